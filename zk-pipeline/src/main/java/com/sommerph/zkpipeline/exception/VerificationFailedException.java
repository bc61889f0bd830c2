package com.sommerph.zkpipeline.exception;

import com.sommerph.zkpipeline.model.pipeline.PipelineStage;

public class VerificationFailedException extends PipelineException {

    public VerificationFailedException(String subjectId, int exitCode, String diagnostic) {
        super(PipelineStage.VERIFICATION, "VerificationFailed: proof for subject " + subjectId
                + " did not verify (exit code " + exitCode + ")"
                + (diagnostic == null || diagnostic.isBlank() ? "" : ": " + diagnostic));
    }

}
