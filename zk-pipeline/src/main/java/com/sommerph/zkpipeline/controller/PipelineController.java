package com.sommerph.zkpipeline.controller;

import com.sommerph.zkpipeline.exception.PipelineException;
import com.sommerph.zkpipeline.model.artifact.SubjectInput;
import com.sommerph.zkpipeline.model.pipeline.CommonSetupReport;
import com.sommerph.zkpipeline.model.pipeline.PipelineReport;
import com.sommerph.zkpipeline.model.registry.ProofRegistryEntry;
import com.sommerph.zkpipeline.model.request.BatchProofRequest;
import com.sommerph.zkpipeline.model.request.CommonSetupRequest;
import com.sommerph.zkpipeline.service.CommonCircuitBuilder;
import com.sommerph.zkpipeline.service.PipelineOrchestrator;
import com.sommerph.zkpipeline.service.ProofRegistrationService;
import com.sommerph.zkpipeline.service.SubjectInputService;
import com.sommerph.zkpipeline.store.ArtifactStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/pipeline")
@RequiredArgsConstructor
@Tag(name = "Proof Pipeline", description = "Endpoints for common circuit setup and per-subject proof generation")
public class PipelineController {

    private final PipelineOrchestrator orchestrator;
    private final CommonCircuitBuilder commonCircuitBuilder;
    private final SubjectInputService subjectInputService;
    private final ProofRegistrationService registrationService;
    private final ArtifactStore artifactStore;

    @Operation(summary = "Compile the model and derive the shared keys and reference string")
    @PostMapping("/common")
    public ResponseEntity<?> setupCommon(@RequestBody @Valid CommonSetupRequest request) {
        log.info("Set up common circuit from model: {}", request.getModelPath());
        try {
            CommonSetupReport report = orchestrator.setupCommon(request);
            return report.isSuccess() ? ResponseEntity.ok(report) : ResponseEntity.internalServerError().body(report);
        } catch (PipelineException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to set up common circuit", e);
            return ResponseEntity.internalServerError().body("Error setting up common circuit: " + e.getMessage());
        }
    }

    @Operation(summary = "Show which shared circuit artifacts are present")
    @GetMapping("/common/status")
    public ResponseEntity<?> commonStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("state", commonCircuitBuilder.currentState());
        status.put("sharedRoot", artifactStore.getSharedRoot().toString());
        status.put("missing", artifactStore.missingSharedArtifacts());
        return ResponseEntity.ok(status);
    }

    @Operation(summary = "Write the engine input and score metadata for a subject")
    @PostMapping("/subjects/{subjectId}/input")
    public ResponseEntity<?> stageInput(@PathVariable @NotBlank String subjectId,
                                        @RequestBody @Valid SubjectInput input) {
        log.info("Stage input for subject: {}", subjectId);
        if (!subjectId.equals(input.getSubjectId())) {
            return ResponseEntity.badRequest().body("Subject id in path and body differ: " + subjectId + " / " + input.getSubjectId());
        }
        try {
            List<Path> written = subjectInputService.stage(input);
            return ResponseEntity.ok(written.stream().map(Path::toString).toList());
        } catch (PipelineException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to stage input for subject: {}", subjectId, e);
            return ResponseEntity.internalServerError().body("Error staging input: " + e.getMessage());
        }
    }

    @Operation(summary = "Generate, verify and register a proof for one subject")
    @PostMapping("/subjects/{subjectId}/proof")
    public ResponseEntity<?> generateProof(@PathVariable @NotBlank String subjectId,
                                           @RequestParam(defaultValue = "false") boolean generateContract) {
        log.info("Generate proof for subject: {}", subjectId);
        try {
            PipelineReport report = orchestrator.generateForSubject(subjectId, generateContract);
            return report.isSuccess() ? ResponseEntity.ok(report) : ResponseEntity.internalServerError().body(report);
        } catch (PipelineException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to generate proof for subject: {}", subjectId, e);
            return ResponseEntity.internalServerError().body("Error generating proof: " + e.getMessage());
        }
    }

    @Operation(summary = "Generate proofs for several subjects in parallel")
    @PostMapping("/subjects/proofs")
    public ResponseEntity<?> generateProofs(@RequestBody @Valid BatchProofRequest request) {
        log.info("Generate proofs for subjects: {}", request.getSubjectIds());
        try {
            return ResponseEntity.ok(orchestrator.generateForSubjects(request.getSubjectIds(), request.isGenerateContract()));
        } catch (Exception e) {
            log.error("Failed to generate proofs for subjects: {}", request.getSubjectIds(), e);
            return ResponseEntity.internalServerError().body("Error generating proofs: " + e.getMessage());
        }
    }

    @Operation(summary = "Get the registered proof of a subject")
    @GetMapping("/subjects/{subjectId}/registry")
    public ResponseEntity<?> getRegistryEntry(@PathVariable @NotBlank String subjectId) {
        log.info("Load registry entry for subject: {}", subjectId);
        artifactStore.subjectDirectory(subjectId);
        try {
            ProofRegistryEntry entry = registrationService.load(subjectId);
            return ResponseEntity.ok(entry);
        } catch (IllegalStateException e) {
            log.warn("No registered proof for subject: {}", subjectId);
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(e.getMessage());
        } catch (Exception e) {
            log.error("Failed to load registry entry for subject: {}", subjectId, e);
            return ResponseEntity.internalServerError().body("Error loading registry entry: " + e.getMessage());
        }
    }

}
