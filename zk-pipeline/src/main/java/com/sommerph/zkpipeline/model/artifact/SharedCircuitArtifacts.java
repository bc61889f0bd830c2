package com.sommerph.zkpipeline.model.artifact;

import com.sommerph.zkpipeline.store.ArtifactName;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Locations of the artifacts every subject run reads: produced once by the common
 * circuit phase and never written afterwards.
 */
@Getter
@AllArgsConstructor
public class SharedCircuitArtifacts {

    private final Path compiledCircuit;
    private final Path settings;
    private final Path provingKey;
    private final Path verificationKey;
    private final Path referenceString;

    public Map<ArtifactName, Path> asMap() {
        Map<ArtifactName, Path> artifacts = new LinkedHashMap<>();
        artifacts.put(ArtifactName.COMPILED_CIRCUIT, compiledCircuit);
        artifacts.put(ArtifactName.SETTINGS, settings);
        artifacts.put(ArtifactName.PROVING_KEY, provingKey);
        artifacts.put(ArtifactName.VERIFICATION_KEY, verificationKey);
        artifacts.put(ArtifactName.REFERENCE_STRING, referenceString);
        return artifacts;
    }

}
