package com.sommerph.zkpipeline.store;

import com.sommerph.zkpipeline.exception.InvalidScopeException;
import com.sommerph.zkpipeline.model.artifact.SharedCircuitArtifacts;
import com.sommerph.zkpipeline.model.artifact.SubjectArtifacts;
import com.sommerph.zkpipeline.util.ProofUtils;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps logical artifact names to file locations. Shared artifacts live directly under the
 * shared root, subject artifacts under {@code <subjectRoot>/<subjectId>}. Only path
 * bookkeeping and plain file copies happen here.
 */
@Slf4j
public class ArtifactStore {

    private final Path sharedRoot;
    private final Path subjectRoot;

    public ArtifactStore(Path sharedRoot, Path subjectRoot) {
        this.sharedRoot = sharedRoot.toAbsolutePath().normalize();
        this.subjectRoot = subjectRoot.toAbsolutePath().normalize();
    }

    public ArtifactStore withSubjectRoot(Path subjectRoot) {
        return new ArtifactStore(sharedRoot, subjectRoot);
    }

    public Path getSharedRoot() {
        return sharedRoot;
    }

    public Path getSubjectRoot() {
        return subjectRoot;
    }

    public Path resolve(ArtifactScope scope, ArtifactName name) {
        return resolve(scope, name, null);
    }

    public Path resolve(ArtifactScope scope, ArtifactName name, String subjectId) {
        if (!name.isAvailableIn(scope)) {
            throw new InvalidScopeException(name + " is not a " + scope.name().toLowerCase() + " artifact");
        }
        return switch (scope) {
            case SHARED -> sharedRoot.resolve(name.getFileName());
            case SUBJECT -> subjectDirectory(subjectId).resolve(name.getFileName());
        };
    }

    /**
     * Directory of a subject. An id given as an address keeps its {@code 0x} prefix in reports but
     * not on disk, the same naming the proof registry uses.
     */
    public Path subjectDirectory(String subjectId) {
        if (subjectId == null || subjectId.isBlank()) {
            throw new InvalidScopeException("A subject id is required for subject-scoped artifacts");
        }
        Path directory = subjectRoot.resolve(ProofUtils.addressToFilename(subjectId)).normalize();
        if (!subjectRoot.equals(directory.getParent())) {
            throw new InvalidScopeException("Subject id does not name a directory below the subject root: " + subjectId);
        }
        return directory;
    }

    public boolean exists(Path location) {
        return Files.isRegularFile(location);
    }

    public void ensureDirectory(Path location) {
        Path parent = location.toAbsolutePath().getParent();
        if (parent == null) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            log.error("Failed to create directory: {}", parent, e);
            throw new RuntimeException("Failed to create directory: " + parent, e);
        }
    }

    public void copy(Path source, Path target) {
        ensureDirectory(target);
        try {
            Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
            log.info("Copied {} to {}", source, target);
        } catch (IOException e) {
            log.error("Failed to copy {} to {}", source, target, e);
            throw new RuntimeException("Failed to copy " + source + " to " + target, e);
        }
    }

    public SharedCircuitArtifacts sharedArtifacts() {
        return new SharedCircuitArtifacts(
                resolve(ArtifactScope.SHARED, ArtifactName.COMPILED_CIRCUIT),
                resolve(ArtifactScope.SHARED, ArtifactName.SETTINGS),
                resolve(ArtifactScope.SHARED, ArtifactName.PROVING_KEY),
                resolve(ArtifactScope.SHARED, ArtifactName.VERIFICATION_KEY),
                resolve(ArtifactScope.SHARED, ArtifactName.REFERENCE_STRING)
        );
    }

    public List<ArtifactName> missingSharedArtifacts() {
        return sharedArtifacts().asMap().entrySet().stream()
                .filter(entry -> !exists(entry.getValue()))
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    public SubjectArtifacts subjectArtifacts(String subjectId) {
        return new SubjectArtifacts(
                subjectId,
                subjectDirectory(subjectId),
                resolve(ArtifactScope.SUBJECT, ArtifactName.INPUT, subjectId),
                resolve(ArtifactScope.SUBJECT, ArtifactName.WITNESS, subjectId),
                resolve(ArtifactScope.SUBJECT, ArtifactName.PROOF, subjectId),
                resolve(ArtifactScope.SUBJECT, ArtifactName.METADATA, subjectId),
                resolve(ArtifactScope.SUBJECT, ArtifactName.VERIFICATION_KEY, subjectId),
                resolve(ArtifactScope.SUBJECT, ArtifactName.SETTINGS, subjectId),
                resolve(ArtifactScope.SUBJECT, ArtifactName.VERIFIER_CONTRACT, subjectId),
                resolve(ArtifactScope.SUBJECT, ArtifactName.CALLDATA, subjectId),
                resolve(ArtifactScope.SUBJECT, ArtifactName.LOOKUP, subjectId)
        );
    }

}
