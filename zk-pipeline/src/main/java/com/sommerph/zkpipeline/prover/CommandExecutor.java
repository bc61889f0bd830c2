package com.sommerph.zkpipeline.prover;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * Runs one external command to completion and captures its output. Blocks the calling
 * thread until the process exits or the timeout elapses.
 */
public interface CommandExecutor {

    CommandResult execute(List<String> command, Duration timeout) throws IOException, InterruptedException;

}
