package com.sommerph.zkpipeline.exception;

public class UsageException extends PipelineException {

    public UsageException(String message) {
        super(null, message);
    }

}
