package com.sommerph.zkpipeline.exception;

import com.sommerph.zkpipeline.model.pipeline.PipelineStage;

import java.nio.file.Path;

public class MissingSubjectInputException extends PipelineException {

    private final String subjectId;

    public MissingSubjectInputException(String subjectId, Path expected) {
        super(PipelineStage.PRECONDITIONS, "Input file not found for subject " + subjectId + ": " + expected);
        this.subjectId = subjectId;
    }

    public String getSubjectId() {
        return subjectId;
    }

}
