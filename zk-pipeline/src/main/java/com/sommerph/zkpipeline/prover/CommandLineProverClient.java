package com.sommerph.zkpipeline.prover;

import com.sommerph.zkpipeline.config.PipelineProperties;
import com.sommerph.zkpipeline.exception.ExternalToolException;
import com.sommerph.zkpipeline.exception.InconsistentToolOutputException;
import com.sommerph.zkpipeline.model.pipeline.PipelineStage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

@Slf4j
@Component
@RequiredArgsConstructor
public class CommandLineProverClient implements ExternalProverClient {

    private final CommandExecutor executor;
    private final PipelineProperties properties;

    @Override
    public Path generateSettings(Path model, Path settings) {
        List<String> args = new ArrayList<>(List.of("gen-settings", "-M", arg(model), "-O", arg(settings)));
        appendLogrows(args);
        run(PipelineStage.SETTINGS, args, timeout());
        return expect(PipelineStage.SETTINGS, settings).get(0);
    }

    @Override
    public Path calibrateSettings(Path model, Path calibrationInput, Path settings) {
        List<String> args = new ArrayList<>(List.of("calibrate-settings",
                "-M", arg(model), "-D", arg(calibrationInput), "-O", arg(settings)));
        appendLogrows(args);
        CommandResult result = run(PipelineStage.CALIBRATION, args, timeout());
        // calibration prints the chosen scales, worth keeping in the log
        log.info("Calibration output:\n{}", result.getStdout());
        return expect(PipelineStage.CALIBRATION, settings).get(0);
    }

    @Override
    public Path compileCircuit(Path model, Path settings, Path compiledCircuit) {
        run(PipelineStage.COMPILE, List.of("compile-circuit",
                "-M", arg(model), "--compiled-circuit", arg(compiledCircuit), "-S", arg(settings)), timeout());
        return expect(PipelineStage.COMPILE, compiledCircuit).get(0);
    }

    @Override
    public Path downloadReferenceString(Path settings, Path referenceString) {
        if (Files.isRegularFile(referenceString)) {
            log.info("Reference string already cached at {}", referenceString);
            return referenceString;
        }
        log.info("Downloading reference string to {}, this may take a while", referenceString);
        run(PipelineStage.REFERENCE_STRING, List.of("get-srs",
                "--settings-path", arg(settings), "--srs-path", arg(referenceString)),
                properties.getProver().getDownloadTimeout());
        return expect(PipelineStage.REFERENCE_STRING, referenceString).get(0);
    }

    @Override
    public List<Path> runSetup(Path compiledCircuit, Path referenceString, Path provingKey, Path verificationKey) {
        run(PipelineStage.SETUP, List.of("setup",
                "-M", arg(compiledCircuit),
                "--srs-path", arg(referenceString),
                "--vk-path", arg(verificationKey),
                "--pk-path", arg(provingKey)), timeout());
        return expect(PipelineStage.SETUP, provingKey, verificationKey);
    }

    @Override
    public Path generateWitness(Path input, Path compiledCircuit, Path witness) {
        run(PipelineStage.WITNESS, List.of("gen-witness",
                "-D", arg(input), "-M", arg(compiledCircuit), "-O", arg(witness)), timeout());
        return expect(PipelineStage.WITNESS, witness).get(0);
    }

    @Override
    public Path prove(Path witness, Path provingKey, Path compiledCircuit, Path referenceString, Path proof) {
        run(PipelineStage.PROOF, List.of("prove",
                "--witness", arg(witness),
                "--proof-path", arg(proof),
                "--pk-path", arg(provingKey),
                "--compiled-circuit", arg(compiledCircuit),
                "--srs-path", arg(referenceString)), timeout());
        return expect(PipelineStage.PROOF, proof).get(0);
    }

    @Override
    public VerifyResult verify(Path proof, Path verificationKey, Path referenceString, Path settings) {
        CommandResult result = execute(PipelineStage.VERIFICATION, command(List.of("verify",
                "--proof-path", arg(proof),
                "--vk-path", arg(verificationKey),
                "--srs-path", arg(referenceString),
                "--settings-path", arg(settings))), timeout());
        if (result.isTimedOut()) {
            throw new ExternalToolException(PipelineStage.VERIFICATION, result.getExitCode(), excerpt(result));
        }
        if (result.getExitCode() != 0) {
            log.warn("Proof {} did not verify, exit code {}", proof, result.getExitCode());
            return VerifyResult.failed(result.getExitCode(), excerpt(result));
        }
        return VerifyResult.passed();
    }

    @Override
    public Path createEvmVerifier(Path settings, Path verificationKey, Path referenceString, Path contract) {
        run(PipelineStage.VERIFIER_CONTRACT, List.of("create-evm-verifier",
                "--settings-path", arg(settings),
                "--vk-path", arg(verificationKey),
                "--srs-path", arg(referenceString),
                "--sol-code-path", arg(contract)), timeout());
        return expect(PipelineStage.VERIFIER_CONTRACT, contract).get(0);
    }

    @Override
    public Path encodeCalldata(Path proof, Path calldata) {
        run(PipelineStage.CALLDATA, List.of("encode-evm-calldata",
                "--proof-path", arg(proof), "--calldata-path", arg(calldata)), timeout());
        return expect(PipelineStage.CALLDATA, calldata).get(0);
    }

    private CommandResult run(PipelineStage stage, List<String> args, Duration timeout) {
        CommandResult result = execute(stage, command(args), timeout);
        if (!result.isSuccess()) {
            log.error("Stage {} failed with exit code {}", stage.getLabel(), result.getExitCode());
            throw new ExternalToolException(stage, result.getExitCode(), excerpt(result));
        }
        return result;
    }

    private CommandResult execute(PipelineStage stage, List<String> command, Duration timeout) {
        log.info("Run {}: {}", stage.getLabel(), String.join(" ", command));
        try {
            return executor.execute(command, timeout);
        } catch (IOException e) {
            log.error("Failed to launch {} for stage {}", command.get(0), stage.getLabel(), e);
            throw new ExternalToolException(stage, "failed to launch " + command.get(0) + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalToolException(stage, "interrupted while waiting for " + command.get(0), e);
        }
    }

    private List<String> command(List<String> args) {
        List<String> command = new ArrayList<>(args.size() + 1);
        command.add(properties.getProver().getBinary());
        command.addAll(args);
        return command;
    }

    private List<Path> expect(PipelineStage stage, Path... outputs) {
        List<Path> missing = Arrays.stream(outputs)
                .filter(path -> !Files.isRegularFile(path))
                .collect(Collectors.toList());
        if (!missing.isEmpty()) {
            throw new InconsistentToolOutputException(stage, missing);
        }
        return List.of(outputs);
    }

    private void appendLogrows(List<String> args) {
        Integer logrows = properties.getProver().getLogrows();
        if (logrows != null) {
            args.add("--logrows");
            args.add(logrows.toString());
        }
    }

    private Duration timeout() {
        return properties.getProver().getTimeout();
    }

    // tail of stderr, falling back to stdout since the engine reports some errors there
    private String excerpt(CommandResult result) {
        String text = result.getStderr() == null || result.getStderr().isBlank() ? result.getStdout() : result.getStderr();
        if (text == null) {
            return "";
        }
        text = text.strip();
        int limit = Math.max(0, properties.getProver().getStderrExcerptLength());
        return text.length() <= limit ? text : "..." + text.substring(text.length() - limit);
    }

    private static String arg(Path path) {
        return path.toString();
    }

}
