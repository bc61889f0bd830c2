package com.sommerph.zkpipeline.service;

import com.sommerph.zkpipeline.config.PipelineProperties;
import com.sommerph.zkpipeline.model.artifact.SubjectMetadata;
import com.sommerph.zkpipeline.model.pipeline.ReconciliationResult;
import com.sommerph.zkpipeline.model.pipeline.ScoreComparison;
import org.springframework.stereotype.Component;

/**
 * Compares the plaintext score with the scaled score carried in the proof metadata, to
 * catch scaling or encoding drift. Reporting only: never decides pipeline success.
 */
@Component
public class ScoreReconciler {

    private final double scaleDenominator;
    private final double scoreRange;
    private final double tolerance;

    public ScoreReconciler(PipelineProperties properties) {
        PipelineProperties.Score score = properties.getScore();
        if (score.getScaleDenominator() <= 0 || score.getScoreRange() <= 0) {
            throw new IllegalArgumentException("Score scale denominator and range must be positive");
        }
        this.scaleDenominator = score.getScaleDenominator();
        this.scoreRange = score.getScoreRange();
        this.tolerance = score.getTolerance();
    }

    public ReconciliationResult reconcile(double plaintextScore, SubjectMetadata metadata) {
        if (metadata == null || metadata.getScaledScore() == null) {
            return ReconciliationResult.skipped("no scaled_score in metadata");
        }
        long scaled = metadata.getScaledScore();
        double normalized = scaled / scaleDenominator / scoreRange;
        boolean discrepancy = Math.abs(normalized - plaintextScore) > tolerance;
        return ReconciliationResult.compared(new ScoreComparison(plaintextScore, scaled, normalized, discrepancy));
    }

}
