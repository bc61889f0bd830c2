package com.sommerph.zkpipeline.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    private String sharedRoot = "proof_generation/shared";
    private String subjectRoot = "proof_generation/subjects";
    private String modelVersion = "1.0.0";
    private int parallelism = 2;
    private Prover prover = new Prover();
    private Score score = new Score();
    private Registry registry = new Registry();

    @Data
    public static class Prover {
        private String binary = "ezkl";
        private Duration timeout = Duration.ofMinutes(10);
        private Duration downloadTimeout = Duration.ofMinutes(30);
        private Integer logrows;
        private int stderrExcerptLength = 2000;
    }

    @Data
    public static class Score {
        // fixed-point factor the engine applies to public outputs
        private double scaleDenominator = 67219;
        // metadata scores are on a 0..scoreRange scale
        private double scoreRange = 1000;
        private double tolerance = 0.005;
    }

    @Data
    public static class Registry {
        private boolean enabled = true;
        private String type = "json";
        private String path = "proof_registry";
    }

}
