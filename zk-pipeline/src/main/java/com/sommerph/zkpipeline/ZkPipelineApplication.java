package com.sommerph.zkpipeline;

import com.sommerph.zkpipeline.config.PipelineProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

import java.util.Arrays;

@SpringBootApplication
@EnableConfigurationProperties(PipelineProperties.class)
public class ZkPipelineApplication {

	public static void main(String[] args) {
		SpringApplication application = new SpringApplication(ZkPipelineApplication.class);
		// a command word selects CLI mode: run one pipeline mode and exit with its status
		if (Arrays.stream(args).anyMatch(arg -> !arg.startsWith("--"))) {
			application.setWebApplicationType(WebApplicationType.NONE);
			System.exit(SpringApplication.exit(application.run(args)));
		}
		application.run(args);
	}

}
