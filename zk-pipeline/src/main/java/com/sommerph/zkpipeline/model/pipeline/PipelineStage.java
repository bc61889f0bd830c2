package com.sommerph.zkpipeline.model.pipeline;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum PipelineStage {

    // common circuit
    SETTINGS("gen-settings"),
    CALIBRATION("calibrate-settings"),
    COMPILE("compile-circuit"),
    REFERENCE_STRING("get-reference-string"),
    SETUP("setup"),

    // per subject
    PRECONDITIONS("preconditions"),
    WITNESS("gen-witness"),
    PROOF("prove"),
    STAGING("artifact-staging"),
    VERIFICATION("verify"),
    VERIFIER_CONTRACT("create-verifier-contract"),
    CALLDATA("encode-calldata"),
    RECONCILIATION("score-reconciliation"),
    REGISTRATION("proof-registration");

    private final String label;

}
