package com.sommerph.zkpipeline.model.pipeline;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Either a score comparison or the reason it was skipped. A skip is informational only.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReconciliationResult {

    private ScoreComparison comparison;
    private String skipReason;

    public static ReconciliationResult compared(ScoreComparison comparison) {
        return new ReconciliationResult(comparison, null);
    }

    public static ReconciliationResult skipped(String reason) {
        return new ReconciliationResult(null, reason);
    }

    public boolean isSkipped() {
        return comparison == null;
    }

    public String describe() {
        if (isSkipped()) {
            return "ReconciliationSkipped: " + skipReason;
        }
        return String.format("plaintext=%.4f scaled=%d normalized=%.4f discrepancy=%s",
                comparison.getPlaintextScore(), comparison.getScaledScore(),
                comparison.getNormalizedScore(), comparison.isDiscrepancy());
    }

}
