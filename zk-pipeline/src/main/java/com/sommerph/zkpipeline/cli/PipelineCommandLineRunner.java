package com.sommerph.zkpipeline.cli;

import com.sommerph.zkpipeline.exception.PipelineException;
import com.sommerph.zkpipeline.exception.UsageException;
import com.sommerph.zkpipeline.model.pipeline.PipelineStageResult;
import com.sommerph.zkpipeline.model.pipeline.StagedReport;
import com.sommerph.zkpipeline.model.request.PipelineInvocation;
import com.sommerph.zkpipeline.service.PipelineOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Command line surface:
 * <pre>
 *   setup-common --model=&lt;onnx&gt; --srs=&lt;path&gt; [--calibration-input=&lt;json&gt;]
 *   generate --subject-dir=&lt;dir&gt; [--generate-contract]
 *   generate --subject=&lt;id&gt; [--generate-contract]
 * </pre>
 * Without a command the application keeps serving HTTP.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PipelineCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;

    static final String SETUP_COMMON = "setup-common";
    static final String GENERATE = "generate";

    private static final String USAGE = "usage: setup-common --model=<path> --srs=<path> [--calibration-input=<path>]"
            + " | generate (--subject-dir=<dir> | --subject=<id>) [--generate-contract]";

    private final PipelineOrchestrator orchestrator;

    private int exitCode = EXIT_OK;

    @Override
    public void run(ApplicationArguments args) {
        if (args.getNonOptionArgs().isEmpty()) {
            return;
        }
        exitCode = execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int execute(ApplicationArguments args) {
        try {
            PipelineInvocation invocation = toInvocation(args);
            StagedReport report = orchestrator.dispatch(invocation);
            for (PipelineStageResult stage : report.getStages()) {
                log.info("[{}] {}: {}", stage.getStatus(), stage.getStage().getLabel(), stage.getDiagnosticMessage());
            }
            if (report.isSuccess()) {
                log.info("Pipeline completed successfully");
                return EXIT_OK;
            }
            report.firstFailure().ifPresent(failure ->
                    log.error("Pipeline failed at stage '{}': {}", failure.getStage().getLabel(), failure.getDiagnosticMessage()));
            return EXIT_FAILURE;
        } catch (UsageException e) {
            log.error("{}\n{}", e.getMessage(), USAGE);
            return EXIT_USAGE;
        } catch (PipelineException e) {
            log.error("Pipeline failed at stage '{}': {}", e.getStageLabel(), e.getMessage());
            return EXIT_FAILURE;
        } catch (RuntimeException e) {
            log.error("Pipeline aborted", e);
            return EXIT_FAILURE;
        }
    }

    PipelineInvocation toInvocation(ApplicationArguments args) {
        List<String> commands = args.getNonOptionArgs();
        if (commands.size() != 1) {
            throw new UsageException("Expected exactly one command, got " + commands);
        }
        String command = commands.get(0);
        PipelineInvocation.PipelineInvocationBuilder builder = PipelineInvocation.builder()
                .generateContract(args.containsOption("generate-contract"));

        switch (command) {
            case SETUP_COMMON -> {
                String model = option(args, "model");
                String srs = option(args, "srs");
                if (model == null || srs == null) {
                    throw new UsageException("setup-common requires --model and --srs");
                }
                builder.modelPath(model)
                        .referenceStringPath(srs)
                        .calibrationInputPath(option(args, "calibration-input"));
            }
            case GENERATE -> {
                if (args.containsOption("model") || args.containsOption("srs")) {
                    throw new UsageException("generate does not take --model or --srs");
                }
                builder.subjectDirectory(option(args, "subject-dir"))
                        .subjectId(option(args, "subject"));
            }
            default -> throw new UsageException("Unknown command: " + command);
        }
        return builder.build();
    }

    private static String option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        if (values.size() > 1) {
            throw new UsageException("Option --" + name + " given more than once");
        }
        String value = values.get(0);
        return value == null || value.isBlank() ? null : value;
    }

}
