package com.sommerph.zkpipeline.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sommerph.zkpipeline.config.PipelineProperties;
import com.sommerph.zkpipeline.model.artifact.SubjectArtifacts;
import com.sommerph.zkpipeline.model.artifact.SubjectMetadata;
import com.sommerph.zkpipeline.model.registry.ProofRegistryEntry;
import com.sommerph.zkpipeline.repository.registry.InMemoryProofRegistry;
import com.sommerph.zkpipeline.store.ArtifactStore;
import com.sommerph.zkpipeline.util.ProofUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProofRegistrationServiceTest {

    @TempDir
    Path tempDir;

    private SubjectArtifacts subject;
    private InMemoryProofRegistry registry;
    private ProofRegistrationService service;

    @BeforeEach
    void setUp() throws Exception {
        subject = new ArtifactStore(tempDir.resolve("shared"), tempDir.resolve("subjects")).subjectArtifacts("0xab12");
        Files.createDirectories(subject.getDirectory());
        Files.writeString(subject.getProof(),
                "{\"instances\":[[\"" + FakeProverClient.PUBLIC_INPUT_HEX + "\"]],\"proof\":\"0x00\"}");
        registry = new InMemoryProofRegistry();
        service = new ProofRegistrationService(registry, new PipelineProperties());
    }

    @Test
    void register_recordsHashPublicInputAndScaling() throws Exception {
        SubjectMetadata metadata = new SubjectMetadata("0xab12", List.of(0.1), 0.629, 42280878L, 1700000000L, "1.0.0");

        ProofRegistryEntry entry = service.register(subject, metadata);

        assertEquals(ProofUtils.sha256Hex(Files.readAllBytes(subject.getProof())), entry.getProofHash());
        assertEquals(BigInteger.valueOf(42280878L), entry.getCreditScore());
        assertEquals(1.0, entry.getScaling().getScalingFactor(), 1e-9);
        assertSame(entry, registry.load("0xab12"));

        JsonNode lookup = new ObjectMapper().readTree(subject.getLookup().toFile());
        assertEquals("0x28527ae", lookup.path("public_input").asText());
        assertEquals(42280878L, lookup.path("scaling_debug").path("metadata_scaled_score").asLong());
    }

    @Test
    void register_withoutMetadataLeavesScalingEmpty() {
        ProofRegistryEntry entry = service.register(subject, null);

        assertNull(entry.getOriginalScore());
        assertNull(entry.getScaling().getScalingFactor());
        assertEquals(BigInteger.valueOf(42280878L), entry.getCreditScore());
    }

    @Test
    void load_unregisteredSubjectFails() {
        assertThrows(IllegalStateException.class, () -> service.load("0xcd34"));
    }

}
