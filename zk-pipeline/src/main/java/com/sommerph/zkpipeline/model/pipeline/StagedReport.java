package com.sommerph.zkpipeline.model.pipeline;

import java.util.List;
import java.util.Optional;

public interface StagedReport {

    List<PipelineStageResult> getStages();

    boolean isSuccess();

    default Optional<PipelineStageResult> firstFailure() {
        return getStages().stream().filter(result -> !result.isSuccess()).findFirst();
    }

}
