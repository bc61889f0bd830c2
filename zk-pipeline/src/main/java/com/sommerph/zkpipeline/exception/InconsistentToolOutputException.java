package com.sommerph.zkpipeline.exception;

import com.sommerph.zkpipeline.model.pipeline.PipelineStage;

import java.nio.file.Path;
import java.util.List;

/**
 * The engine reported success but did not write the files its contract promises.
 */
public class InconsistentToolOutputException extends PipelineException {

    private final List<Path> missingOutputs;

    public InconsistentToolOutputException(PipelineStage stage, List<Path> missingOutputs) {
        super(stage, "Stage '" + stage.getLabel() + "' reported success but expected output is missing: " + missingOutputs);
        this.missingOutputs = List.copyOf(missingOutputs);
    }

    public List<Path> getMissingOutputs() {
        return missingOutputs;
    }

}
