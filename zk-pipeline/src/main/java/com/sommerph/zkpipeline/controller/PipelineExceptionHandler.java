package com.sommerph.zkpipeline.controller;

import com.sommerph.zkpipeline.exception.ExternalToolException;
import com.sommerph.zkpipeline.exception.InconsistentToolOutputException;
import com.sommerph.zkpipeline.exception.InvalidScopeException;
import com.sommerph.zkpipeline.exception.MissingModelException;
import com.sommerph.zkpipeline.exception.MissingSharedArtifactsException;
import com.sommerph.zkpipeline.exception.MissingSubjectInputException;
import com.sommerph.zkpipeline.exception.PipelineException;
import com.sommerph.zkpipeline.exception.UsageException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class PipelineExceptionHandler {

    @ExceptionHandler({UsageException.class, InvalidScopeException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(PipelineException ex) {
        return body(HttpStatus.BAD_REQUEST, "invalid_request", ex);
    }

    @ExceptionHandler({MissingSubjectInputException.class, MissingModelException.class})
    public ResponseEntity<Map<String, Object>> handleNotFound(PipelineException ex) {
        return body(HttpStatus.NOT_FOUND, "missing_input", ex);
    }

    @ExceptionHandler(MissingSharedArtifactsException.class)
    public ResponseEntity<Map<String, Object>> handleMissingShared(MissingSharedArtifactsException ex) {
        ResponseEntity<Map<String, Object>> response = body(HttpStatus.CONFLICT, "missing_shared_artifacts", ex);
        response.getBody().put("missing", ex.getMissing());
        return response;
    }

    @ExceptionHandler({ExternalToolException.class, InconsistentToolOutputException.class})
    public ResponseEntity<Map<String, Object>> handleToolFailure(PipelineException ex) {
        return body(HttpStatus.BAD_GATEWAY, "prover_failure", ex);
    }

    @ExceptionHandler(PipelineException.class)
    public ResponseEntity<Map<String, Object>> handlePipeline(PipelineException ex) {
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "pipeline_failure", ex);
    }

    private ResponseEntity<Map<String, Object>> body(HttpStatus status, String error, PipelineException ex) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("stage", ex.getStageLabel());
        body.put("message", ex.getMessage());
        return new ResponseEntity<>(body, status);
    }

}
