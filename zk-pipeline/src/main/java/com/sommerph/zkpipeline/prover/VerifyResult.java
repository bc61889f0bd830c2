package com.sommerph.zkpipeline.prover;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class VerifyResult {

    private final boolean passed;
    private final int exitCode;
    private final String diagnostic;

    public static VerifyResult passed() {
        return new VerifyResult(true, 0, "");
    }

    public static VerifyResult failed(int exitCode, String diagnostic) {
        return new VerifyResult(false, exitCode, diagnostic);
    }

}
