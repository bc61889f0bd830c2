package com.sommerph.zkpipeline.service;

import com.sommerph.zkpipeline.exception.PipelineException;
import com.sommerph.zkpipeline.model.pipeline.PipelineStage;
import com.sommerph.zkpipeline.model.pipeline.PipelineStageResult;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.List;
import java.util.function.Supplier;

/**
 * Runs one stage and turns its outcome into a {@link PipelineStageResult}.
 */
@Slf4j
final class StageRunner {

    private StageRunner() {
    }

    static PipelineStageResult run(PipelineStage stage, String owner, Supplier<List<Path>> action) {
        log.info("Run stage {} for {}", stage.getLabel(), owner);
        try {
            List<Path> produced = action.get();
            return PipelineStageResult.success(stage, "Completed " + stage.getLabel(), produced);
        } catch (PipelineException e) {
            log.error("Stage {} failed for {}: {}", stage.getLabel(), owner, e.getMessage());
            return PipelineStageResult.failed(stage, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Stage {} failed for {}", stage.getLabel(), owner, e);
            return PipelineStageResult.failed(stage, "Stage '" + stage.getLabel() + "' failed: " + e.getMessage());
        }
    }

    static PipelineStageResult skipped(PipelineStage stage, String owner, String reason) {
        log.info("Skip stage {} for {}: {}", stage.getLabel(), owner, reason);
        return PipelineStageResult.success(stage, "Skipped: " + reason, List.of());
    }

}
