package com.sommerph.zkpipeline.prover;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * {@link CommandExecutor} backed by {@link ProcessBuilder}. Output is redirected to temporary
 * files so a chatty engine can never block on a full pipe.
 */
@Slf4j
public class ProcessCommandExecutor implements CommandExecutor {

    private static final long KILL_GRACE_SECONDS = 5;

    @Override
    public CommandResult execute(List<String> command, Duration timeout) throws IOException, InterruptedException {
        Path stdout = Files.createTempFile("prover-", ".out");
        Path stderr = Files.createTempFile("prover-", ".err");
        try {
            Process process = new ProcessBuilder(command)
                    .redirectOutput(stdout.toFile())
                    .redirectError(stderr.toFile())
                    .start();

            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Command timed out after {}: {}", timeout, command.get(0));
                process.destroyForcibly();
                process.waitFor(KILL_GRACE_SECONDS, TimeUnit.SECONDS);
                return CommandResult.timedOut(read(stdout), read(stderr));
            }

            CommandResult result = new CommandResult(process.exitValue(), read(stdout), read(stderr), false);
            log.debug("Command exited with {}, stdout:\n{}", result.getExitCode(), result.getStdout());
            return result;
        } finally {
            Files.deleteIfExists(stdout);
            Files.deleteIfExists(stderr);
        }
    }

    // malformed bytes are replaced, engine progress output is not always valid UTF-8
    private String read(Path path) throws IOException {
        return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
    }

}
