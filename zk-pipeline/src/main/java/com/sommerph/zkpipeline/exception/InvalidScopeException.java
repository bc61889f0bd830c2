package com.sommerph.zkpipeline.exception;

public class InvalidScopeException extends PipelineException {

    public InvalidScopeException(String message) {
        super(null, message);
    }

}
