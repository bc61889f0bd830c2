package com.sommerph.zkpipeline.store;

import lombok.Getter;

import java.util.EnumSet;
import java.util.Set;

import static com.sommerph.zkpipeline.store.ArtifactScope.SHARED;
import static com.sommerph.zkpipeline.store.ArtifactScope.SUBJECT;

@Getter
public enum ArtifactName {

    COMPILED_CIRCUIT("model.compiled", SHARED),
    SETTINGS("settings.json", SHARED, SUBJECT),
    PROVING_KEY("pk.key", SHARED),
    VERIFICATION_KEY("vk.key", SHARED, SUBJECT),
    REFERENCE_STRING("kzg.srs", SHARED),
    INPUT("input.json", SUBJECT),
    WITNESS("witness.json", SUBJECT),
    PROOF("proof.json", SUBJECT),
    METADATA("metadata.json", SUBJECT),
    VERIFIER_CONTRACT("contract/verifier.sol", SUBJECT),
    CALLDATA("contract/calldata.json", SUBJECT),
    LOOKUP("lookup.json", SUBJECT);

    private final String fileName;
    private final Set<ArtifactScope> scopes;

    ArtifactName(String fileName, ArtifactScope first, ArtifactScope... rest) {
        this.fileName = fileName;
        this.scopes = EnumSet.of(first, rest);
    }

    public boolean isAvailableIn(ArtifactScope scope) {
        return scopes.contains(scope);
    }

}
