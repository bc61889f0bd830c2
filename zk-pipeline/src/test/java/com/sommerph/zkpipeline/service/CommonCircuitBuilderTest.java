package com.sommerph.zkpipeline.service;

import com.sommerph.zkpipeline.exception.MissingModelException;
import com.sommerph.zkpipeline.model.pipeline.CommonCircuitState;
import com.sommerph.zkpipeline.model.pipeline.CommonSetupReport;
import com.sommerph.zkpipeline.model.pipeline.PipelineStage;
import com.sommerph.zkpipeline.model.pipeline.PipelineStageResult;
import com.sommerph.zkpipeline.model.pipeline.StageStatus;
import com.sommerph.zkpipeline.model.request.CommonSetupRequest;
import com.sommerph.zkpipeline.store.ArtifactStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class CommonCircuitBuilderTest {

    @TempDir
    Path tempDir;

    private ArtifactStore store;
    private FakeProverClient prover;
    private CommonCircuitBuilder builder;
    private Path model;

    @BeforeEach
    void setUp() throws Exception {
        store = new ArtifactStore(tempDir.resolve("shared"), tempDir.resolve("subjects"));
        prover = spy(new FakeProverClient());
        builder = new CommonCircuitBuilder(store, prover);
        model = Files.writeString(tempDir.resolve("network.onnx"), "onnx");
    }

    @Test
    void build_fromScratchReachesDone() {
        assertEquals(CommonCircuitState.START, builder.currentState());

        CommonSetupReport report = builder.build(request(tempDir.resolve("shared/kzg.srs"), null));

        assertTrue(report.isSuccess());
        assertEquals(CommonCircuitState.DONE, report.getFinalState());
        assertEquals(List.of(PipelineStage.SETTINGS, PipelineStage.CALIBRATION, PipelineStage.COMPILE,
                PipelineStage.REFERENCE_STRING, PipelineStage.SETUP), stages(report));
        assertTrue(report.getStages().get(1).getDiagnosticMessage().startsWith("Skipped:"));
        assertTrue(store.missingSharedArtifacts().isEmpty());
        verify(prover, never()).calibrateSettings(any(), any(), any());
    }

    @Test
    void build_rerunInvokesNoEngineCommand() {
        builder.build(request(tempDir.resolve("shared/kzg.srs"), null));
        clearInvocations(prover);

        CommonSetupReport report = builder.build(request(tempDir.resolve("shared/kzg.srs"), null));

        assertTrue(report.isSuccess());
        assertTrue(report.getStages().stream().allMatch(stage -> stage.getDiagnosticMessage().startsWith("Skipped:")));
        verifyNoInteractions(prover);
    }

    @Test
    void build_calibratesWhenInputSupplied() throws Exception {
        Path calibration = Files.writeString(tempDir.resolve("calibration.json"), "{}");

        CommonSetupReport report = builder.build(new CommonSetupRequest(model.toString(),
                tempDir.resolve("shared/kzg.srs").toString(), calibration.toString()));

        assertTrue(report.isSuccess());
        verify(prover).calibrateSettings(model.toAbsolutePath(), calibration.toAbsolutePath(),
                store.sharedArtifacts().getSettings());
    }

    @Test
    void build_downloadsMissingReferenceStringOnceAndCopiesItIntoSharedScope() {
        Path requested = tempDir.resolve("cache/kzg17.srs");

        builder.build(request(requested, null));
        builder.build(request(requested, null));

        verify(prover, times(1)).downloadReferenceString(any(), eq(requested));
        assertTrue(Files.isRegularFile(requested));
        assertTrue(Files.isRegularFile(store.sharedArtifacts().getReferenceString()));
    }

    @Test
    void build_copiesExistingReferenceStringWithoutDownload() throws Exception {
        Path requested = Files.writeString(tempDir.resolve("kzg17.srs"), "cached-srs");

        CommonSetupReport report = builder.build(request(requested, null));

        assertTrue(report.isSuccess());
        verify(prover, never()).downloadReferenceString(any(), any());
        assertEquals("cached-srs", Files.readString(store.sharedArtifacts().getReferenceString()));
    }

    @Test
    void build_keepsSharedReferenceStringWhenAnotherPathIsRequested() {
        builder.build(request(tempDir.resolve("shared/kzg.srs"), null));
        clearInvocations(prover);

        CommonSetupReport report = builder.build(request(tempDir.resolve("elsewhere/kzg20.srs"), null));

        assertTrue(report.isSuccess());
        verifyNoInteractions(prover);
        assertFalse(Files.exists(tempDir.resolve("elsewhere/kzg20.srs")));
    }

    @Test
    void build_unwritableSharedRootFailsTheSettingsStage() throws Exception {
        Files.writeString(tempDir.resolve("shared"), "not a directory");

        CommonSetupReport report = builder.build(request(tempDir.resolve("kzg.srs"), null));

        assertFalse(report.isSuccess());
        assertEquals(PipelineStage.SETTINGS, report.firstFailure().orElseThrow().getStage());
        assertEquals(CommonCircuitState.START, report.getFinalState());
        verifyNoInteractions(prover);
    }

    @Test
    void build_stopsAtFailedSetupWithoutKeys() {
        prover.failOn(PipelineStage.SETUP);

        CommonSetupReport report = builder.build(request(tempDir.resolve("shared/kzg.srs"), null));

        assertFalse(report.isSuccess());
        PipelineStageResult failure = report.firstFailure().orElseThrow();
        assertEquals(PipelineStage.SETUP, failure.getStage());
        assertEquals(StageStatus.FAILED, failure.getStatus());
        assertEquals(CommonCircuitState.REFERENCE_STRING_READY, report.getFinalState());
        assertFalse(Files.exists(store.sharedArtifacts().getProvingKey()));
    }

    @Test
    void build_stopsAfterFailedCompile() {
        prover.failOn(PipelineStage.COMPILE);

        CommonSetupReport report = builder.build(request(tempDir.resolve("shared/kzg.srs"), null));

        assertEquals(PipelineStage.COMPILE, report.getStages().get(report.getStages().size() - 1).getStage());
        assertEquals(CommonCircuitState.START, report.getFinalState());
        verify(prover, never()).downloadReferenceString(any(), any());
        verify(prover, never()).runSetup(any(), any(), any(), any());
    }

    @Test
    void build_missingModelIsRejectedBeforeAnyCommand() {
        CommonSetupRequest request = new CommonSetupRequest(tempDir.resolve("absent.onnx").toString(),
                tempDir.resolve("kzg.srs").toString(), null);

        assertThrows(MissingModelException.class, () -> builder.build(request));
        verifyNoInteractions(prover);
    }

    @Test
    void currentState_keysWithoutReferenceString() throws Exception {
        builder.build(request(tempDir.resolve("shared/kzg.srs"), null));
        Files.delete(store.sharedArtifacts().getReferenceString());

        assertEquals(CommonCircuitState.KEYS_GENERATED, builder.currentState());
    }

    private CommonSetupRequest request(Path referenceString, Path calibration) {
        return new CommonSetupRequest(model.toString(), referenceString.toString(),
                calibration == null ? null : calibration.toString());
    }

    private static List<PipelineStage> stages(CommonSetupReport report) {
        return report.getStages().stream().map(PipelineStageResult::getStage).collect(Collectors.toList());
    }

}
