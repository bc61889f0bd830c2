package com.sommerph.zkpipeline.service;

import com.sommerph.zkpipeline.exception.MissingModelException;
import com.sommerph.zkpipeline.model.artifact.SharedCircuitArtifacts;
import com.sommerph.zkpipeline.model.pipeline.CommonCircuitState;
import com.sommerph.zkpipeline.model.pipeline.CommonSetupReport;
import com.sommerph.zkpipeline.model.pipeline.PipelineStage;
import com.sommerph.zkpipeline.model.pipeline.PipelineStageResult;
import com.sommerph.zkpipeline.model.request.CommonSetupRequest;
import com.sommerph.zkpipeline.prover.ExternalProverClient;
import com.sommerph.zkpipeline.store.ArtifactStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * One-time phase producing the shared circuit artifacts. Progress is read from the files
 * already present in shared scope, so a rerun only performs the steps whose outputs are missing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CommonCircuitBuilder {

    private static final String OWNER = "common circuit";

    private final ArtifactStore artifactStore;
    private final ExternalProverClient proverClient;

    public CommonCircuitState currentState() {
        SharedCircuitArtifacts shared = artifactStore.sharedArtifacts();
        boolean compiled = artifactStore.exists(shared.getCompiledCircuit()) && artifactStore.exists(shared.getSettings());
        boolean referenceString = artifactStore.exists(shared.getReferenceString());
        boolean keys = artifactStore.exists(shared.getProvingKey()) && artifactStore.exists(shared.getVerificationKey());

        if (!compiled) {
            return CommonCircuitState.START;
        }
        if (referenceString && keys) {
            return CommonCircuitState.DONE;
        }
        if (keys) {
            return CommonCircuitState.KEYS_GENERATED;
        }
        return referenceString ? CommonCircuitState.REFERENCE_STRING_READY : CommonCircuitState.CIRCUIT_COMPILED;
    }

    public CommonSetupReport build(CommonSetupRequest request) {
        Path model = Paths.get(request.getModelPath()).toAbsolutePath();
        log.info("Build common circuit from model {}, state {}", model, currentState());

        SharedCircuitArtifacts shared = artifactStore.sharedArtifacts();
        List<PipelineStageResult> results = new ArrayList<>();

        if (!compileIfAbsent(model, request, shared, results)) {
            return report(results);
        }
        if (!record(results, acquireReferenceString(request, shared))) {
            return report(results);
        }
        record(results, setupIfAbsent(shared));
        return report(results);
    }

    private boolean compileIfAbsent(Path model, CommonSetupRequest request, SharedCircuitArtifacts shared,
                                    List<PipelineStageResult> results) {
        if (artifactStore.exists(shared.getCompiledCircuit()) && artifactStore.exists(shared.getSettings())) {
            results.add(StageRunner.skipped(PipelineStage.COMPILE, OWNER, "compiled circuit and settings already present"));
            return true;
        }
        if (!Files.isRegularFile(model)) {
            throw new MissingModelException(model);
        }
        if (!record(results, StageRunner.run(PipelineStage.SETTINGS, OWNER, () -> {
            artifactStore.ensureDirectory(shared.getSettings());
            return List.of(proverClient.generateSettings(model, shared.getSettings()));
        }))) {
            return false;
        }

        if (request.getCalibrationInputPath() != null && !request.getCalibrationInputPath().isBlank()) {
            Path calibrationInput = Paths.get(request.getCalibrationInputPath()).toAbsolutePath();
            if (!record(results, StageRunner.run(PipelineStage.CALIBRATION, OWNER,
                    () -> List.of(proverClient.calibrateSettings(model, calibrationInput, shared.getSettings()))))) {
                return false;
            }
        } else {
            results.add(StageRunner.skipped(PipelineStage.CALIBRATION, OWNER, "no calibration input supplied"));
        }

        return record(results, StageRunner.run(PipelineStage.COMPILE, OWNER,
                () -> List.of(proverClient.compileCircuit(model, shared.getSettings(), shared.getCompiledCircuit()))));
    }

    private PipelineStageResult acquireReferenceString(CommonSetupRequest request, SharedCircuitArtifacts shared) {
        Path sharedLocation = shared.getReferenceString();
        Path requested = request.getReferenceStringPath() == null || request.getReferenceStringPath().isBlank()
                ? sharedLocation
                : Paths.get(request.getReferenceStringPath()).toAbsolutePath().normalize();

        if (artifactStore.exists(sharedLocation)) {
            return StageRunner.skipped(PipelineStage.REFERENCE_STRING, OWNER, "reference string already present at " + sharedLocation);
        }
        return StageRunner.run(PipelineStage.REFERENCE_STRING, OWNER, () -> {
            if (!artifactStore.exists(requested)) {
                artifactStore.ensureDirectory(requested);
                proverClient.downloadReferenceString(shared.getSettings(), requested);
            }
            if (!requested.equals(sharedLocation)) {
                artifactStore.copy(requested, sharedLocation);
            }
            return List.of(sharedLocation);
        });
    }

    private PipelineStageResult setupIfAbsent(SharedCircuitArtifacts shared) {
        if (artifactStore.exists(shared.getProvingKey()) && artifactStore.exists(shared.getVerificationKey())) {
            return StageRunner.skipped(PipelineStage.SETUP, OWNER, "proving and verification keys already present");
        }
        return StageRunner.run(PipelineStage.SETUP, OWNER, () -> proverClient.runSetup(
                shared.getCompiledCircuit(), shared.getReferenceString(),
                shared.getProvingKey(), shared.getVerificationKey()));
    }

    private boolean record(List<PipelineStageResult> results, PipelineStageResult result) {
        results.add(result);
        return result.isSuccess();
    }

    private CommonSetupReport report(List<PipelineStageResult> results) {
        CommonSetupReport report = new CommonSetupReport(results, currentState());
        if (report.isSuccess()) {
            log.info("Common circuit ready in {}", artifactStore.getSharedRoot());
        } else {
            report.firstFailure().ifPresent(failure ->
                    log.error("Common circuit setup stopped at stage {}: {}",
                            failure.getStage().getLabel(), failure.getDiagnosticMessage()));
        }
        return report;
    }

}
