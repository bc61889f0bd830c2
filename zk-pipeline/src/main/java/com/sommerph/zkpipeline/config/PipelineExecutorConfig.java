package com.sommerph.zkpipeline.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class PipelineExecutorConfig {

    private final PipelineProperties properties;

    public PipelineExecutorConfig(PipelineProperties properties) {
        this.properties = properties;
    }

    /**
     * Executor for independent per-subject pipeline runs. Each task blocks on external
     * prover processes, so the pool size bounds how many engine processes run at once.
     */
    @Bean(name = "pipelineExecutor", destroyMethod = "shutdown")
    public ExecutorService pipelineExecutor() {
        int threads = Math.max(1, properties.getParallelism());
        AtomicInteger counter = new AtomicInteger(0);
        return new ThreadPoolExecutor(
                threads,
                threads,
                0L,
                TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                r -> {
                    Thread t = new Thread(r, "proof-pipeline-" + counter.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                });
    }

}
