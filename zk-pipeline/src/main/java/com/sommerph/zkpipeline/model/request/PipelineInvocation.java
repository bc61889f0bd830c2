package com.sommerph.zkpipeline.model.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raw arguments of one pipeline invocation, before the orchestrator validates which mode
 * they select.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PipelineInvocation {

    private String modelPath;
    private String referenceStringPath;
    private String calibrationInputPath;
    private String subjectDirectory;
    private String subjectId;
    private boolean generateContract;

}
