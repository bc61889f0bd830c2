package com.sommerph.zkpipeline.service;

import com.sommerph.zkpipeline.exception.MissingSubjectInputException;
import com.sommerph.zkpipeline.exception.PipelineException;
import com.sommerph.zkpipeline.exception.UsageException;
import com.sommerph.zkpipeline.model.pipeline.CommonSetupReport;
import com.sommerph.zkpipeline.model.pipeline.PipelineReport;
import com.sommerph.zkpipeline.model.pipeline.StagedReport;
import com.sommerph.zkpipeline.model.request.CommonSetupRequest;
import com.sommerph.zkpipeline.model.request.PipelineInvocation;
import com.sommerph.zkpipeline.store.ArtifactStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Entry point for both phases. An invocation selects exactly one of them: common setup
 * never continues into a subject run.
 */
@Slf4j
@Service
public class PipelineOrchestrator {

    public enum Mode {
        SETUP_COMMON,
        GENERATE_FOR_SUBJECT
    }

    private final CommonCircuitBuilder commonCircuitBuilder;
    private final ProofPipeline proofPipeline;
    private final ExecutorService pipelineExecutor;

    public PipelineOrchestrator(CommonCircuitBuilder commonCircuitBuilder,
                                ProofPipeline proofPipeline,
                                @Qualifier("pipelineExecutor") ExecutorService pipelineExecutor) {
        this.commonCircuitBuilder = commonCircuitBuilder;
        this.proofPipeline = proofPipeline;
        this.pipelineExecutor = pipelineExecutor;
    }

    public StagedReport dispatch(PipelineInvocation invocation) {
        Mode mode = validate(invocation);
        log.info("Dispatch pipeline invocation in mode {}", mode);
        if (mode == Mode.SETUP_COMMON) {
            return setupCommon(new CommonSetupRequest(invocation.getModelPath(),
                    invocation.getReferenceStringPath(), invocation.getCalibrationInputPath()));
        }
        if (present(invocation.getSubjectDirectory())) {
            return generateForSubjectDirectory(Paths.get(invocation.getSubjectDirectory()), invocation.isGenerateContract());
        }
        return generateForSubject(invocation.getSubjectId(), invocation.isGenerateContract());
    }

    /**
     * Checks the argument combination without touching the filesystem or the engine.
     */
    public Mode validate(PipelineInvocation invocation) {
        boolean model = present(invocation.getModelPath());
        boolean referenceString = present(invocation.getReferenceStringPath());
        boolean calibration = present(invocation.getCalibrationInputPath());
        boolean subjectDirectory = present(invocation.getSubjectDirectory());
        boolean subjectId = present(invocation.getSubjectId());

        if (model || referenceString) {
            if (!model || !referenceString) {
                throw new UsageException("setup-common requires both a model path and a reference string path");
            }
            if (subjectDirectory || subjectId) {
                throw new UsageException("setup-common does not take a subject; run subjects in a separate invocation");
            }
            if (invocation.isGenerateContract()) {
                throw new UsageException("--generate-contract only applies to subject proof generation");
            }
            return Mode.SETUP_COMMON;
        }
        if (calibration) {
            throw new UsageException("A calibration input is only valid together with a model path");
        }
        if (subjectDirectory == subjectId) {
            throw new UsageException("Proof generation requires exactly one of a subject directory or a subject id");
        }
        return Mode.GENERATE_FOR_SUBJECT;
    }

    public CommonSetupReport setupCommon(CommonSetupRequest request) {
        return commonCircuitBuilder.build(request);
    }

    public PipelineReport generateForSubject(String subjectId, boolean generateContract) {
        return proofPipeline.run(subjectId, generateContract);
    }

    public PipelineReport generateForSubjectDirectory(Path directory, boolean generateContract) {
        Path subjectDirectory = directory.toAbsolutePath().normalize();
        Path parent = subjectDirectory.getParent();
        if (parent == null || subjectDirectory.getFileName() == null) {
            throw new UsageException("Not a subject directory: " + directory);
        }
        String subjectId = subjectDirectory.getFileName().toString();
        if (!Files.isDirectory(subjectDirectory)) {
            throw new MissingSubjectInputException(subjectId, subjectDirectory);
        }

        ArtifactStore store = proofPipeline.getArtifactStore();
        if (!parent.equals(store.getSubjectRoot())) {
            store = store.withSubjectRoot(parent);
        }
        if (!store.subjectDirectory(subjectId).equals(subjectDirectory)) {
            throw new UsageException("Subject directory names carry no 0x prefix: " + directory);
        }
        ProofPipeline pipeline = store == proofPipeline.getArtifactStore()
                ? proofPipeline
                : proofPipeline.withArtifactStore(store);
        return pipeline.run(subjectId, generateContract);
    }

    /**
     * Runs independent subjects in parallel. Reports come back in request order; a subject
     * refused by its preconditions gets a rejected report instead of failing the batch.
     */
    public List<PipelineReport> generateForSubjects(List<String> subjectIds, boolean generateContract) {
        log.info("Generate proofs for {} subjects", subjectIds.size());
        List<Future<PipelineReport>> futures = new ArrayList<>();
        for (String subjectId : subjectIds) {
            futures.add(pipelineExecutor.submit(() -> {
                try {
                    return proofPipeline.run(subjectId, generateContract);
                } catch (PipelineException e) {
                    log.error("Subject {} rejected: {}", subjectId, e.getMessage());
                    return PipelineReport.rejected(subjectId, e.getMessage());
                }
            }));
        }

        List<PipelineReport> reports = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            try {
                reports.add(futures.get(i).get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while waiting for subject proofs", e);
            } catch (ExecutionException e) {
                log.error("Proof generation crashed for subject {}", subjectIds.get(i), e.getCause());
                reports.add(PipelineReport.rejected(subjectIds.get(i), String.valueOf(e.getCause().getMessage())));
            }
        }
        return reports;
    }

    private static boolean present(String value) {
        return value != null && !value.isBlank();
    }

}
