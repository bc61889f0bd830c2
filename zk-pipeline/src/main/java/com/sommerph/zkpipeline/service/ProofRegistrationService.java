package com.sommerph.zkpipeline.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.sommerph.zkpipeline.config.PipelineProperties;
import com.sommerph.zkpipeline.model.artifact.SubjectArtifacts;
import com.sommerph.zkpipeline.model.artifact.SubjectMetadata;
import com.sommerph.zkpipeline.model.registry.ProofRegistryEntry;
import com.sommerph.zkpipeline.repository.registry.ProofRegistry;
import com.sommerph.zkpipeline.util.ProofUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Records a verified proof: its hash, the score committed as public input and how that
 * value relates to the metadata score.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProofRegistrationService {

    private final ProofRegistry proofRegistry;
    private final PipelineProperties properties;

    public ProofRegistryEntry register(SubjectArtifacts subject, SubjectMetadata metadata) {
        log.info("Register proof for subject: {}", subject.getSubjectId());
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        try {
            byte[] proofBytes = Files.readAllBytes(subject.getProof());
            String proofHash = ProofUtils.sha256Hex(proofBytes);
            JsonNode proof = mapper.readTree(proofBytes);

            BigInteger publicInput = ProofUtils.firstPublicInput(proof).orElse(null);
            if (publicInput == null) {
                log.warn("No public instance found in proof for subject: {}", subject.getSubjectId());
            }

            Long scaledScore = metadata == null ? null : metadata.getScaledScore();
            Double scalingFactor = publicInput != null && scaledScore != null && scaledScore > 0
                    ? publicInput.doubleValue() / scaledScore
                    : null;

            ProofRegistryEntry entry = new ProofRegistryEntry(
                    subject.getSubjectId(),
                    proofHash,
                    publicInput,
                    metadata == null ? null : metadata.getScore(),
                    Instant.now().getEpochSecond(),
                    properties.getModelVersion(),
                    new ProofRegistryEntry.ScalingAnalysis(scaledScore, publicInput, scalingFactor)
            );
            proofRegistry.save(entry);
            writeLookup(mapper, subject.getLookup(), entry);
            return entry;
        } catch (IOException e) {
            throw new RuntimeException("Failed to register proof for subject: " + subject.getSubjectId(), e);
        }
    }

    public ProofRegistryEntry load(String subjectId) {
        if (!proofRegistry.exists(subjectId)) {
            throw new IllegalStateException("No registered proof for subject: " + subjectId);
        }
        return proofRegistry.load(subjectId);
    }

    private void writeLookup(ObjectMapper mapper, Path lookupPath, ProofRegistryEntry entry) throws IOException {
        Map<String, Object> lookup = new LinkedHashMap<>();
        lookup.put("address", entry.getAddress());
        lookup.put("proof_hash", entry.getProofHash());
        lookup.put("credit_score", entry.getCreditScore());
        lookup.put("public_input", entry.getCreditScore() == null ? null : "0x" + entry.getCreditScore().toString(16));
        lookup.put("original_score", entry.getOriginalScore());

        Map<String, Object> scaling = new LinkedHashMap<>();
        scaling.put("proof_public_input", entry.getScaling().getProofPublicInput());
        scaling.put("metadata_scaled_score", entry.getScaling().getMetadataScaledScore());
        scaling.put("scaling_factor", entry.getScaling().getScalingFactor());
        lookup.put("scaling_debug", scaling);

        mapper.writeValue(lookupPath.toFile(), lookup);
    }

}
