package com.sommerph.zkpipeline.exception;

import com.sommerph.zkpipeline.model.pipeline.PipelineStage;

/**
 * The proving engine terminated with a non-zero status, timed out (exit code -1) or
 * could not be launched at all.
 */
public class ExternalToolException extends PipelineException {

    private final int exitCode;
    private final String stderrExcerpt;

    public ExternalToolException(PipelineStage stage, int exitCode, String stderrExcerpt) {
        super(stage, "Stage '" + stage.getLabel() + "' failed with exit code " + exitCode
                + (stderrExcerpt == null || stderrExcerpt.isBlank() ? "" : ": " + stderrExcerpt));
        this.exitCode = exitCode;
        this.stderrExcerpt = stderrExcerpt;
    }

    public ExternalToolException(PipelineStage stage, String message, Throwable cause) {
        super(stage, "Stage '" + stage.getLabel() + "' could not run: " + message, cause);
        this.exitCode = -1;
        this.stderrExcerpt = message;
    }

    public int getExitCode() {
        return exitCode;
    }

    public String getStderrExcerpt() {
        return stderrExcerpt;
    }

}
