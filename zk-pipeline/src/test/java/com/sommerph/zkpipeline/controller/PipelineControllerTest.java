package com.sommerph.zkpipeline.controller;

import com.sommerph.zkpipeline.exception.MissingSharedArtifactsException;
import com.sommerph.zkpipeline.model.pipeline.CommonCircuitState;
import com.sommerph.zkpipeline.model.pipeline.PipelineReport;
import com.sommerph.zkpipeline.model.pipeline.PipelineStage;
import com.sommerph.zkpipeline.model.pipeline.PipelineStageResult;
import com.sommerph.zkpipeline.service.CommonCircuitBuilder;
import com.sommerph.zkpipeline.service.PipelineOrchestrator;
import com.sommerph.zkpipeline.service.ProofRegistrationService;
import com.sommerph.zkpipeline.service.SubjectInputService;
import com.sommerph.zkpipeline.store.ArtifactName;
import com.sommerph.zkpipeline.store.ArtifactStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.file.Path;
import java.util.List;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class PipelineControllerTest {

    @TempDir
    Path tempDir;

    private PipelineOrchestrator orchestrator;
    private CommonCircuitBuilder builder;
    private ProofRegistrationService registrationService;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        orchestrator = mock(PipelineOrchestrator.class);
        builder = mock(CommonCircuitBuilder.class);
        registrationService = mock(ProofRegistrationService.class);
        ArtifactStore store = new ArtifactStore(tempDir.resolve("shared"), tempDir.resolve("subjects"));
        PipelineController controller = new PipelineController(orchestrator, builder,
                mock(SubjectInputService.class), registrationService, store);
        mvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new PipelineExceptionHandler()).build();
    }

    @Test
    void commonStatus_listsMissingArtifacts() throws Exception {
        when(builder.currentState()).thenReturn(CommonCircuitState.START);

        mvc.perform(get("/api/pipeline/common/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("START"))
                .andExpect(jsonPath("$.missing.length()").value(5));
    }

    @Test
    void generateProof_failedStageIsServerError() throws Exception {
        when(orchestrator.generateForSubject("0xab12", false)).thenReturn(new PipelineReport("0xab12",
                List.of(PipelineStageResult.failed(PipelineStage.WITNESS, "Stage 'gen-witness' failed")), null));

        mvc.perform(post("/api/pipeline/subjects/0xab12/proof"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.stages[0].stage").value("WITNESS"));
    }

    @Test
    void generateProof_missingSharedArtifactsIsConflict() throws Exception {
        when(orchestrator.generateForSubject("0xab12", true))
                .thenThrow(new MissingSharedArtifactsException(List.of(ArtifactName.REFERENCE_STRING)));

        mvc.perform(post("/api/pipeline/subjects/0xab12/proof").param("generateContract", "true"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("missing_shared_artifacts"))
                .andExpect(jsonPath("$.stage").value(PipelineStage.PRECONDITIONS.getLabel()));
    }

    @Test
    void stageInput_mismatchedSubjectIsBadRequest() throws Exception {
        mvc.perform(post("/api/pipeline/subjects/0xab12/input")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"subjectId\":\"0xcd34\",\"inputVector\":[0.1],\"plaintextScore\":0.5}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void registry_unregisteredSubjectIsNotFound() throws Exception {
        when(registrationService.load("0xcd34")).thenThrow(new IllegalStateException("No registered proof for subject: 0xcd34"));

        mvc.perform(get("/api/pipeline/subjects/0xcd34/registry"))
                .andExpect(status().isNotFound());
    }

    @Test
    void registry_unreadableEntryIsServerError() throws Exception {
        when(registrationService.load("0xcd34")).thenThrow(new RuntimeException("Failed to read registry entry for address: 0xcd34"));

        mvc.perform(get("/api/pipeline/subjects/0xcd34/registry"))
                .andExpect(status().isInternalServerError());
    }

}
