package com.sommerph.zkpipeline.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sommerph.zkpipeline.config.PipelineProperties;
import com.sommerph.zkpipeline.exception.InvalidScopeException;
import com.sommerph.zkpipeline.model.artifact.SubjectArtifacts;
import com.sommerph.zkpipeline.model.artifact.SubjectInput;
import com.sommerph.zkpipeline.store.ArtifactStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SubjectInputServiceTest {

    @TempDir
    Path tempDir;

    private ArtifactStore store;
    private SubjectInputService service;

    @BeforeEach
    void setUp() {
        store = new ArtifactStore(tempDir.resolve("shared"), tempDir.resolve("subjects"));
        service = new SubjectInputService(store, new PipelineProperties());
    }

    @Test
    void stage_writesEngineInputAndMetadata() throws Exception {
        List<Path> written = service.stage(new SubjectInput("0xabc", List.of(0.1, 0.2, 0.3), 0.63));

        SubjectArtifacts subject = store.subjectArtifacts("0xabc");
        assertEquals(List.of(subject.getInput(), subject.getMetadata()), written);

        ObjectMapper mapper = new ObjectMapper();
        JsonNode input = mapper.readTree(subject.getInput().toFile());
        assertEquals(3, input.path("input_data").path(0).size());
        assertEquals(3, input.path("input_shapes").path(0).path(0).asInt());
        assertEquals(0.63, input.path("output_data").path(0).path(0).asDouble(), 1e-9);

        JsonNode metadata = mapper.readTree(subject.getMetadata().toFile());
        assertEquals("0xabc", metadata.path("address").asText());
        assertEquals(42347970L, metadata.path("scaled_score").asLong());
        assertEquals("1.0.0", metadata.path("model_version").asText());
    }

    @Test
    void stage_rejectsSubjectIdOutsideSubjectRoot() {
        assertThrows(InvalidScopeException.class,
                () -> service.stage(new SubjectInput("../shared", List.of(0.1), 0.5)));
    }

}
