package com.sommerph.zkpipeline.model.pipeline;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CommonSetupReport implements StagedReport {

    private List<PipelineStageResult> stages;
    private CommonCircuitState finalState;

    @Override
    public boolean isSuccess() {
        return finalState == CommonCircuitState.DONE && stages.stream().allMatch(PipelineStageResult::isSuccess);
    }

}
