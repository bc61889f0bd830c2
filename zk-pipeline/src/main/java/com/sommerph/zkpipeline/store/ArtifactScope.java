package com.sommerph.zkpipeline.store;

public enum ArtifactScope {
    SHARED,
    SUBJECT
}
