package com.sommerph.zkpipeline.exception;

import com.sommerph.zkpipeline.model.pipeline.PipelineStage;

import java.nio.file.Path;

public class MissingModelException extends PipelineException {

    public MissingModelException(Path modelPath) {
        super(PipelineStage.PRECONDITIONS, "Model file not found: " + modelPath);
    }

}
