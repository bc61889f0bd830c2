package com.sommerph.zkpipeline.model.artifact;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.nio.file.Path;

@Getter
@AllArgsConstructor
public class SubjectArtifacts {

    private final String subjectId;
    private final Path directory;
    private final Path input;
    private final Path witness;
    private final Path proof;
    private final Path metadata;
    private final Path verificationKeyCopy;
    private final Path settingsCopy;
    private final Path verifierContract;
    private final Path calldata;
    private final Path lookup;

}
