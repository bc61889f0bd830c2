package com.sommerph.zkpipeline.exception;

import com.sommerph.zkpipeline.model.pipeline.PipelineStage;
import com.sommerph.zkpipeline.store.ArtifactName;

import java.util.List;
import java.util.stream.Collectors;

public class MissingSharedArtifactsException extends PipelineException {

    private final List<ArtifactName> missing;

    public MissingSharedArtifactsException(List<ArtifactName> missing) {
        super(PipelineStage.PRECONDITIONS, "Missing shared circuit artifacts: "
                + missing.stream().map(ArtifactName::getFileName).collect(Collectors.joining(", "))
                + ". Run setup-common first.");
        this.missing = List.copyOf(missing);
    }

    public List<ArtifactName> getMissing() {
        return missing;
    }

}
