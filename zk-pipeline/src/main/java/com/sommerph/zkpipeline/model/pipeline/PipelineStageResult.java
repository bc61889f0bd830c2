package com.sommerph.zkpipeline.model.pipeline;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PipelineStageResult {

    private PipelineStage stage;
    private StageStatus status;
    private String diagnosticMessage;
    private List<String> producedArtifacts;

    public static PipelineStageResult success(PipelineStage stage, String message, List<Path> produced) {
        return new PipelineStageResult(stage, StageStatus.SUCCESS, message,
                produced.stream().map(Path::toString).collect(Collectors.toList()));
    }

    public static PipelineStageResult failed(PipelineStage stage, String message) {
        return new PipelineStageResult(stage, StageStatus.FAILED, message, List.of());
    }

    public boolean isSuccess() {
        return status == StageStatus.SUCCESS;
    }

}
