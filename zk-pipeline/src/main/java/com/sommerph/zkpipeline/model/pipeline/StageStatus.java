package com.sommerph.zkpipeline.model.pipeline;

public enum StageStatus {
    SUCCESS,
    FAILED
}
