package com.sommerph.zkpipeline.model.pipeline;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PipelineReport implements StagedReport {

    private String subjectId;
    private List<PipelineStageResult> stages;
    private ReconciliationResult reconciliation;

    /**
     * Report for a run refused before its first stage, e.g. inside a batch where one
     * subject's input is missing.
     */
    public static PipelineReport rejected(String subjectId, String message) {
        return new PipelineReport(subjectId,
                List.of(PipelineStageResult.failed(PipelineStage.PRECONDITIONS, message)), null);
    }

    @Override
    public boolean isSuccess() {
        return !stages.isEmpty() && stages.stream().allMatch(PipelineStageResult::isSuccess);
    }

}
