package com.sommerph.zkpipeline.model.registry;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

@AllArgsConstructor
@NoArgsConstructor
@Data
public class ProofRegistryEntry {

    @AllArgsConstructor
    @NoArgsConstructor
    @Data
    public static class ScalingAnalysis {
        private Long metadataScaledScore;
        private BigInteger proofPublicInput;
        private Double scalingFactor;
    }

    private String address;
    private String proofHash;       // SHA-256 of proof.json, hex
    private BigInteger creditScore; // first public instance of the proof
    private Double originalScore;
    private long timestamp;
    private String modelVersion;
    private ScalingAnalysis scaling;

}
