package com.sommerph.zkpipeline.model.pipeline;

/**
 * Progress of the common circuit phase, derived only from which shared artifacts exist.
 */
public enum CommonCircuitState {
    START,
    CIRCUIT_COMPILED,
    REFERENCE_STRING_READY,
    // keys present but the reference string is no longer in shared scope
    KEYS_GENERATED,
    DONE
}
