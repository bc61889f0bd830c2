package com.sommerph.zkpipeline.service;

import com.sommerph.zkpipeline.exception.ExternalToolException;
import com.sommerph.zkpipeline.model.pipeline.PipelineStage;
import com.sommerph.zkpipeline.prover.ExternalProverClient;
import com.sommerph.zkpipeline.prover.VerifyResult;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Stands in for the proving engine by writing placeholder outputs. Wrap it in
 * {@code Mockito.spy} to count invocations.
 */
class FakeProverClient implements ExternalProverClient {

    // little-endian encoding of 42280878
    static final String PUBLIC_INPUT_HEX = "ae27850200000000000000000000000000000000000000000000000000000000";

    private final Set<PipelineStage> failing = EnumSet.noneOf(PipelineStage.class);
    private boolean verifies = true;

    FakeProverClient failOn(PipelineStage stage) {
        failing.add(stage);
        return this;
    }

    FakeProverClient rejectProofs() {
        verifies = false;
        return this;
    }

    @Override
    public Path generateSettings(Path model, Path settings) {
        return write(PipelineStage.SETTINGS, settings, "{\"run_args\":{}}");
    }

    @Override
    public Path calibrateSettings(Path model, Path calibrationInput, Path settings) {
        return write(PipelineStage.CALIBRATION, settings, "{\"run_args\":{\"calibrated\":true}}");
    }

    @Override
    public Path compileCircuit(Path model, Path settings, Path compiledCircuit) {
        return write(PipelineStage.COMPILE, compiledCircuit, "circuit");
    }

    @Override
    public Path downloadReferenceString(Path settings, Path referenceString) {
        return write(PipelineStage.REFERENCE_STRING, referenceString, "srs");
    }

    @Override
    public List<Path> runSetup(Path compiledCircuit, Path referenceString, Path provingKey, Path verificationKey) {
        return List.of(write(PipelineStage.SETUP, provingKey, "pk"), write(PipelineStage.SETUP, verificationKey, "vk"));
    }

    @Override
    public Path generateWitness(Path input, Path compiledCircuit, Path witness) {
        return write(PipelineStage.WITNESS, witness, "{}");
    }

    @Override
    public Path prove(Path witness, Path provingKey, Path compiledCircuit, Path referenceString, Path proof) {
        return write(PipelineStage.PROOF, proof, "{\"instances\":[[\"" + PUBLIC_INPUT_HEX + "\"]],\"proof\":\"0x00\"}");
    }

    @Override
    public VerifyResult verify(Path proof, Path verificationKey, Path referenceString, Path settings) {
        if (failing.contains(PipelineStage.VERIFICATION)) {
            throw new ExternalToolException(PipelineStage.VERIFICATION, 101, "engine crashed");
        }
        return verifies ? VerifyResult.passed() : VerifyResult.failed(1, "pairing check failed");
    }

    @Override
    public Path createEvmVerifier(Path settings, Path verificationKey, Path referenceString, Path contract) {
        return write(PipelineStage.VERIFIER_CONTRACT, contract, "contract Halo2Verifier {}");
    }

    @Override
    public Path encodeCalldata(Path proof, Path calldata) {
        return write(PipelineStage.CALLDATA, calldata, "[0]");
    }

    private Path write(PipelineStage stage, Path target, String content) {
        if (failing.contains(stage)) {
            throw new ExternalToolException(stage, 1, "simulated " + stage.getLabel() + " failure");
        }
        try {
            Files.createDirectories(target.getParent());
            Files.writeString(target, content);
            return target;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

}
