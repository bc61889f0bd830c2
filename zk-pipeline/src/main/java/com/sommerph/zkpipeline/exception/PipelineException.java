package com.sommerph.zkpipeline.exception;

import com.sommerph.zkpipeline.model.pipeline.PipelineStage;

/**
 * Base type for every failure the pipeline surfaces to its caller. The stage is
 * {@code null} for failures detected before any stage ran.
 */
public class PipelineException extends RuntimeException {

    private final PipelineStage stage;

    public PipelineException(PipelineStage stage, String message) {
        super(message);
        this.stage = stage;
    }

    public PipelineException(PipelineStage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public PipelineStage getStage() {
        return stage;
    }

    public String getStageLabel() {
        return stage == null ? "none" : stage.getLabel();
    }

}
