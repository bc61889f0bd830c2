package com.sommerph.zkpipeline.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.sommerph.zkpipeline.config.PipelineProperties;
import com.sommerph.zkpipeline.model.artifact.SubjectArtifacts;
import com.sommerph.zkpipeline.model.artifact.SubjectInput;
import com.sommerph.zkpipeline.store.ArtifactStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes a subject's engine input and score metadata from features produced upstream.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SubjectInputService {

    private final ArtifactStore artifactStore;
    private final PipelineProperties properties;

    public List<Path> stage(SubjectInput input) {
        log.info("Stage input for subject: {}", input.getSubjectId());
        SubjectArtifacts subject = artifactStore.subjectArtifacts(input.getSubjectId());
        artifactStore.ensureDirectory(subject.getInput());

        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);

        Map<String, Object> engineInput = new LinkedHashMap<>();
        engineInput.put("input_data", List.of(input.getInputVector()));
        engineInput.put("input_shapes", List.of(List.of(input.getInputVector().size())));
        engineInput.put("output_data", List.of(List.of(input.getPlaintextScore())));

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("address", input.getSubjectId());
        metadata.put("features", input.getInputVector());
        metadata.put("score", input.getPlaintextScore());
        metadata.put("scaled_score", scaledScore(input.getPlaintextScore()));
        metadata.put("timestamp", Instant.now().getEpochSecond());
        metadata.put("model_version", properties.getModelVersion());

        try {
            mapper.writeValue(subject.getInput().toFile(), engineInput);
            mapper.writeValue(subject.getMetadata().toFile(), metadata);
        } catch (IOException e) {
            log.error("Failed to write input for subject: {}", input.getSubjectId(), e);
            throw new RuntimeException("Failed to write input for subject: " + input.getSubjectId(), e);
        }
        return List.of(subject.getInput(), subject.getMetadata());
    }

    long scaledScore(double score) {
        PipelineProperties.Score scale = properties.getScore();
        return Math.round(score * scale.getScoreRange() * scale.getScaleDenominator());
    }

}
