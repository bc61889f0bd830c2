package com.sommerph.zkpipeline.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI zkPipelineOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("zk-SNARK Proof Pipeline API")
                        .version("1.0.0")
                        .description("API for building the common circuit and generating, verifying and registering per-subject score proofs."));
    }

    @Bean
    public GroupedOpenApi commonCircuitGroup() {
        return GroupedOpenApi.builder()
                .group("common-circuit")
                .pathsToMatch("/api/pipeline/common/**")
                .build();
    }

    @Bean
    public GroupedOpenApi subjectProofGroup() {
        return GroupedOpenApi.builder()
                .group("subject-proofs")
                .pathsToMatch("/api/pipeline/subjects/**")
                .build();
    }

}
