package com.sommerph.zkpipeline.prover;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class CommandResult {

    private final int exitCode;
    private final String stdout;
    private final String stderr;
    private final boolean timedOut;

    public static CommandResult timedOut(String stdout, String stderr) {
        return new CommandResult(-1, stdout, stderr, true);
    }

    public boolean isSuccess() {
        return !timedOut && exitCode == 0;
    }

}
