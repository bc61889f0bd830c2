package com.sommerph.zkpipeline.config;

import com.sommerph.zkpipeline.repository.registry.InMemoryProofRegistry;
import com.sommerph.zkpipeline.repository.registry.JsonFileProofRegistry;
import com.sommerph.zkpipeline.repository.registry.ProofRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;

@Configuration
public class ProofRegistryConfig {

    private final PipelineProperties properties;

    public ProofRegistryConfig(PipelineProperties properties) {
        this.properties = properties;
    }

    @Bean
    public ProofRegistry proofRegistry() throws IOException {
        return switch (properties.getRegistry().getType().toLowerCase()) {
            case "json" -> new JsonFileProofRegistry(properties.getRegistry().getPath());
            case "memory" -> new InMemoryProofRegistry();
            default -> throw new IllegalArgumentException("Unsupported proof registry type: " + properties.getRegistry().getType());
        };
    }

}
