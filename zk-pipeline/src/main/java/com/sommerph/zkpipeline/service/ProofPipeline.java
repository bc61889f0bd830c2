package com.sommerph.zkpipeline.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sommerph.zkpipeline.config.PipelineProperties;
import com.sommerph.zkpipeline.exception.MissingSharedArtifactsException;
import com.sommerph.zkpipeline.exception.MissingSubjectInputException;
import com.sommerph.zkpipeline.exception.VerificationFailedException;
import com.sommerph.zkpipeline.model.artifact.SharedCircuitArtifacts;
import com.sommerph.zkpipeline.model.artifact.SubjectArtifacts;
import com.sommerph.zkpipeline.model.artifact.SubjectMetadata;
import com.sommerph.zkpipeline.model.pipeline.PipelineReport;
import com.sommerph.zkpipeline.model.pipeline.PipelineStage;
import com.sommerph.zkpipeline.model.pipeline.PipelineStageResult;
import com.sommerph.zkpipeline.model.pipeline.ReconciliationResult;
import com.sommerph.zkpipeline.prover.ExternalProverClient;
import com.sommerph.zkpipeline.prover.VerifyResult;
import com.sommerph.zkpipeline.store.ArtifactName;
import com.sommerph.zkpipeline.store.ArtifactStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-subject phase: witness, proof, staging of the verification material, local
 * verification, optional verifier contract and calldata, score reconciliation and
 * registration. Stages run strictly in order and the run stops at the first failure;
 * outputs of earlier stages, including a proof that failed verification, are kept.
 */
@Slf4j
@Service
public class ProofPipeline {

    private final ArtifactStore artifactStore;
    private final ExternalProverClient proverClient;
    private final ScoreReconciler scoreReconciler;
    private final ProofRegistrationService registrationService;
    private final PipelineProperties properties;
    private final ObjectMapper mapper = new ObjectMapper();

    public ProofPipeline(ArtifactStore artifactStore,
                         ExternalProverClient proverClient,
                         ScoreReconciler scoreReconciler,
                         ProofRegistrationService registrationService,
                         PipelineProperties properties) {
        this.artifactStore = artifactStore;
        this.proverClient = proverClient;
        this.scoreReconciler = scoreReconciler;
        this.registrationService = registrationService;
        this.properties = properties;
    }

    /**
     * Same pipeline reading and writing subject artifacts through another store, used when a
     * subject directory lives outside the configured subject root.
     */
    public ProofPipeline withArtifactStore(ArtifactStore store) {
        return new ProofPipeline(store, proverClient, scoreReconciler, registrationService, properties);
    }

    public ArtifactStore getArtifactStore() {
        return artifactStore;
    }

    public PipelineReport run(String subjectId, boolean generateContract) {
        log.info("Generate proof for subject: {} (contract: {})", subjectId, generateContract);

        List<ArtifactName> missing = artifactStore.missingSharedArtifacts();
        if (!missing.isEmpty()) {
            throw new MissingSharedArtifactsException(missing);
        }
        SubjectArtifacts subject = artifactStore.subjectArtifacts(subjectId);
        if (!artifactStore.exists(subject.getInput())) {
            throw new MissingSubjectInputException(subjectId, subject.getInput());
        }
        SharedCircuitArtifacts shared = artifactStore.sharedArtifacts();
        List<PipelineStageResult> results = new ArrayList<>();

        if (!record(results, StageRunner.run(PipelineStage.WITNESS, subjectId, () -> List.of(
                proverClient.generateWitness(subject.getInput(), shared.getCompiledCircuit(), subject.getWitness()))))) {
            return report(subjectId, results, null);
        }

        if (!record(results, StageRunner.run(PipelineStage.PROOF, subjectId, () -> List.of(
                proverClient.prove(subject.getWitness(), shared.getProvingKey(), shared.getCompiledCircuit(),
                        shared.getReferenceString(), subject.getProof()))))) {
            return report(subjectId, results, null);
        }

        // verification must not depend on the shared directory
        if (!record(results, StageRunner.run(PipelineStage.STAGING, subjectId, () -> {
            artifactStore.copy(shared.getVerificationKey(), subject.getVerificationKeyCopy());
            artifactStore.copy(shared.getSettings(), subject.getSettingsCopy());
            return List.of(subject.getVerificationKeyCopy(), subject.getSettingsCopy());
        }))) {
            return report(subjectId, results, null);
        }

        if (!record(results, StageRunner.run(PipelineStage.VERIFICATION, subjectId, () -> {
            VerifyResult verification = proverClient.verify(subject.getProof(), subject.getVerificationKeyCopy(),
                    shared.getReferenceString(), subject.getSettingsCopy());
            if (!verification.isPassed()) {
                throw new VerificationFailedException(subjectId, verification.getExitCode(), verification.getDiagnostic());
            }
            return List.of(subject.getProof());
        }))) {
            return report(subjectId, results, null);
        }

        if (generateContract) {
            if (!record(results, StageRunner.run(PipelineStage.VERIFIER_CONTRACT, subjectId, () -> {
                artifactStore.ensureDirectory(subject.getVerifierContract());
                return List.of(proverClient.createEvmVerifier(subject.getSettingsCopy(),
                        subject.getVerificationKeyCopy(), shared.getReferenceString(), subject.getVerifierContract()));
            }))) {
                return report(subjectId, results, null);
            }
            if (!record(results, StageRunner.run(PipelineStage.CALLDATA, subjectId, () -> List.of(
                    proverClient.encodeCalldata(subject.getProof(), subject.getCalldata()))))) {
                return report(subjectId, results, null);
            }
        }

        SubjectMetadata metadata = loadMetadata(subject);
        ReconciliationResult reconciliation = reconcile(subject, metadata);
        results.add(PipelineStageResult.success(PipelineStage.RECONCILIATION, reconciliation.describe(), List.of()));

        if (properties.getRegistry().isEnabled()) {
            record(results, StageRunner.run(PipelineStage.REGISTRATION, subjectId, () -> {
                registrationService.register(subject, metadata);
                return List.of(subject.getLookup());
            }));
        }

        return report(subjectId, results, reconciliation);
    }

    private SubjectMetadata loadMetadata(SubjectArtifacts subject) {
        if (!artifactStore.exists(subject.getMetadata())) {
            return null;
        }
        try {
            return mapper.readValue(subject.getMetadata().toFile(), SubjectMetadata.class);
        } catch (IOException e) {
            log.warn("Unreadable metadata for subject {}: {}", subject.getSubjectId(), e.getMessage());
            return null;
        }
    }

    private ReconciliationResult reconcile(SubjectArtifacts subject, SubjectMetadata metadata) {
        ReconciliationResult result;
        if (metadata == null) {
            result = ReconciliationResult.skipped("no readable metadata at " + subject.getMetadata());
        } else if (metadata.getScore() == null) {
            result = ReconciliationResult.skipped("no plaintext score in metadata");
        } else {
            result = scoreReconciler.reconcile(metadata.getScore(), metadata);
        }

        if (result.isSkipped()) {
            log.info("Score reconciliation for subject {}: {}", subject.getSubjectId(), result.describe());
        } else if (result.getComparison().isDiscrepancy()) {
            log.warn("Score discrepancy for subject {}: {}", subject.getSubjectId(), result.describe());
        } else {
            log.info("Score reconciliation for subject {}: {}", subject.getSubjectId(), result.describe());
        }
        return result;
    }

    private boolean record(List<PipelineStageResult> results, PipelineStageResult result) {
        results.add(result);
        return result.isSuccess();
    }

    private PipelineReport report(String subjectId, List<PipelineStageResult> results, ReconciliationResult reconciliation) {
        PipelineReport report = new PipelineReport(subjectId, results, reconciliation);
        if (report.isSuccess()) {
            log.info("Proof generation complete for subject: {}", subjectId);
        } else {
            report.firstFailure().ifPresent(failure ->
                    log.error("Proof generation for subject {} stopped at stage {}: {}",
                            subjectId, failure.getStage().getLabel(), failure.getDiagnosticMessage()));
        }
        return report;
    }

}
