package com.sommerph.zkpipeline.model.pipeline;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScoreComparison {

    private double plaintextScore;
    private long scaledScore;
    private double normalizedScore;
    private boolean discrepancy;

}
