package com.sommerph.zkpipeline.config;

import com.sommerph.zkpipeline.prover.CommandExecutor;
import com.sommerph.zkpipeline.prover.ProcessCommandExecutor;
import com.sommerph.zkpipeline.store.ArtifactStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;

@Configuration
public class ArtifactStoreConfig {

    private final PipelineProperties properties;

    public ArtifactStoreConfig(PipelineProperties properties) {
        this.properties = properties;
    }

    @Bean
    public ArtifactStore artifactStore() {
        return new ArtifactStore(Paths.get(properties.getSharedRoot()), Paths.get(properties.getSubjectRoot()));
    }

    @Bean
    public CommandExecutor commandExecutor() {
        return new ProcessCommandExecutor();
    }

}
