package org.example.imagegen.service;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.example.imagegen.config.GenerationProperties;
import org.example.imagegen.config.RequestCorrelation;
import org.example.imagegen.entity.ContentRecordEntity;
import org.example.imagegen.entity.GenerationJobEntity;
import org.example.imagegen.entity.GenerationJobStatus;
import org.example.imagegen.entity.ModelType;
import org.example.imagegen.model.ErrorClassification;
import org.example.imagegen.model.LoraSelection;
import org.example.imagegen.model.WorkflowParameters;
import org.example.imagegen.repository.ContentRecordRepository;
import org.example.imagegen.repository.GenerationJobRepository;
import org.example.imagegen.service.engine.EngineConnectionException;
import org.example.imagegen.service.engine.EngineJobState;
import org.example.imagegen.service.engine.EngineOutput;
import org.example.imagegen.service.engine.EnginePollResult;
import org.example.imagegen.service.engine.GenerationEngineClient;
import org.example.imagegen.service.engine.GenerationEngineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Drives one claimed job from queued to a terminal status. Every step re-reads
 * the job row, so a cancel from the API wins over whatever the engine reports
 * afterwards.
 */
@Service
public class GenerationJobProcessor {

    private static final Logger log = LoggerFactory.getLogger(GenerationJobProcessor.class);
    private static final int MAX_TITLE_LENGTH = 80;

    private final GenerationJobRepository jobRepository;
    private final ContentRecordRepository contentRecordRepository;
    private final JobTransitionService transitions;
    private final GenerationEngineClient engineClient;
    private final WorkflowBuilder workflowBuilder;
    private final ModelCatalogService modelCatalog;
    private final ArtifactStorageService artifactStorage;
    private final ErrorClassifier errorClassifier;
    private final JobJsonCodec jsonCodec;

    private final int maxSubmitAttempts;
    private final long initialRetryDelayMillis;
    private final long maxRetryDelayMillis;
    private final Duration pollInterval;
    private final Duration workflowTimeout;

    @Autowired
    public GenerationJobProcessor(
            GenerationJobRepository jobRepository,
            ContentRecordRepository contentRecordRepository,
            JobTransitionService transitions,
            GenerationEngineClient engineClient,
            WorkflowBuilder workflowBuilder,
            ModelCatalogService modelCatalog,
            ArtifactStorageService artifactStorage,
            ErrorClassifier errorClassifier,
            JobJsonCodec jsonCodec,
            GenerationProperties properties) {
        this.jobRepository = jobRepository;
        this.contentRecordRepository = contentRecordRepository;
        this.transitions = transitions;
        this.engineClient = engineClient;
        this.workflowBuilder = workflowBuilder;
        this.modelCatalog = modelCatalog;
        this.artifactStorage = artifactStorage;
        this.errorClassifier = errorClassifier;
        this.jsonCodec = jsonCodec;
        this.maxSubmitAttempts = Math.max(1, properties.getRetry().getMaxAttempts());
        this.initialRetryDelayMillis = properties.getRetry().getInitialDelay().toMillis();
        this.maxRetryDelayMillis = properties.getRetry().getMaxDelay().toMillis();
        this.pollInterval = properties.getWorker().getPollInterval();
        this.workflowTimeout = properties.getWorker().getWorkflowTimeout();
    }

    /**
     * Process one delivery of a job. A queued job is picked up. A redelivered
     * job still running or processing belongs to a worker whose lease ran out:
     * polling resumes when the engine ref is known, otherwise the job fails.
     * Anything else is a duplicate delivery and ignored.
     */
    public void process(String jobId, int deliveryCount) {
        MDC.put(RequestCorrelation.JOB_ID_KEY, jobId);
        try {
            Optional<GenerationJobEntity> current = jobRepository.findById(jobId);
            if (current.isEmpty()) {
                log.warn("Claimed task for missing job {}", jobId);
                return;
            }
            GenerationJobStatus status = current.get().getStatus();
            if (status == GenerationJobStatus.QUEUED) {
                JobTransitionService.TransitionResult running = transitions.transition(jobId, GenerationJobStatus.RUNNING);
                if (!running.applied()) {
                    log.info("Job {} moved to {} before it could start", jobId, running.status().wireName());
                    return;
                }
                run(running.job());
            } else if (deliveryCount > 1 && (status == GenerationJobStatus.RUNNING || status == GenerationJobStatus.PROCESSING)) {
                recoverAbandoned(current.get(), deliveryCount);
            } else {
                log.info("Skipping redelivered job {} in status {}", jobId, status.wireName());
            }
        } catch (JobNotFoundException e) {
            log.warn("Job {} disappeared while processing", jobId);
        } catch (RuntimeException e) {
            log.error("Unexpected failure processing job {}", jobId, e);
            failJob(jobId, e);
        } finally {
            MDC.remove(RequestCorrelation.JOB_ID_KEY);
        }
    }

    private void recoverAbandoned(GenerationJobEntity job, int deliveryCount) {
        String jobId = job.getId();
        String ref = job.getExternalJobRef();
        if (job.getStatus() == GenerationJobStatus.PROCESSING && ref != null && !ref.isBlank()) {
            log.warn("Resuming abandoned job {} on engine prompt {} (delivery {})", jobId, ref, deliveryCount);
            followEngine(job, ref);
            return;
        }
        log.warn("Failing abandoned job {} in status {} (delivery {})", jobId, job.getStatus().wireName(), deliveryCount);
        ErrorClassification classification = ErrorClassification.workerLost();
        JobTransitionService.TransitionResult result = transitions.fail(jobId,
                classification.message(),
                jsonCodec.write(classification.recoverySuggestions()));
        if (!result.applied()) {
            log.info("Job {} already {}; not recording failure", jobId, result.status().wireName());
        }
    }

    private void run(GenerationJobEntity job) {
        String jobId = job.getId();
        ObjectNode workflow = workflowBuilder.build(toWorkflowParameters(job));

        String ref;
        try {
            ref = submitWithRetry(jobId, workflow);
        } catch (GenerationEngineException e) {
            log.warn("Engine submission failed for job {}: {}", jobId, e.getMessage());
            failJob(jobId, e);
            return;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Worker interrupted while submitting job {}", jobId);
            return;
        }
        if (ref == null) {
            log.info("Job {} was cancelled before the engine accepted it", jobId);
            return;
        }

        JobTransitionService.TransitionResult processing = transitions.transition(jobId, GenerationJobStatus.PROCESSING, row -> {
            row.setExternalJobRef(ref);
            row.setStartedAt(transitions.now());
        });
        if (!processing.applied()) {
            log.info("Job {} became {} during submission; cancelling engine prompt {}",
                    jobId, processing.status().wireName(), ref);
            cancelEngineQuietly(jobId, ref);
            return;
        }
        followEngine(processing.job(), ref);
    }

    /**
     * Poll a processing job's engine prompt to the end and record the outcome.
     */
    private void followEngine(GenerationJobEntity job, String ref) {
        String jobId = job.getId();
        EnginePollResult result;
        try {
            result = awaitCompletion(jobId, ref);
        } catch (TimeoutException e) {
            log.warn("Job {} timed out waiting for engine prompt {}", jobId, ref);
            cancelEngineQuietly(jobId, ref);
            failJob(jobId, e);
            return;
        } catch (GenerationEngineException e) {
            failJob(jobId, e);
            return;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Worker interrupted while polling job {}", jobId);
            return;
        }
        if (result == null) {
            log.info("Job {} was cancelled while the engine was working on it", jobId);
            return;
        }

        if (result.state() == EngineJobState.FAILED) {
            if (isCancelled(jobId)) {
                return;
            }
            ErrorClassification classification = errorClassifier.classify(result.errorMessage());
            transitions.fail(jobId,
                    errorClassifier.describe(classification, result.errorMessage()),
                    jsonCodec.write(classification.recoverySuggestions()));
            return;
        }

        complete(job, result.outputs());
    }

    /**
     * @return the engine ref, or null when the job was cancelled between attempts
     */
    String submitWithRetry(String jobId, ObjectNode workflow) throws GenerationEngineException, InterruptedException {
        for (int attempt = 1; ; attempt++) {
            if (isCancelled(jobId)) {
                return null;
            }
            try {
                return engineClient.submit(workflow);
            } catch (EngineConnectionException e) {
                if (attempt >= maxSubmitAttempts) {
                    log.warn("Giving up on job {} after {} submission attempt(s)", jobId, attempt);
                    throw e;
                }
                long delayMillis = computeRetryDelayMillis(attempt);
                log.warn("Engine submission for job {} failed (attempt {}/{}), retrying in {}ms: {}",
                        jobId, attempt, maxSubmitAttempts, delayMillis, e.getMessage());
                Thread.sleep(delayMillis);
            }
        }
    }

    /**
     * @return the finished poll result, or null when the job was cancelled
     * @throws TimeoutException when the engine does not finish within the workflow timeout
     */
    EnginePollResult awaitCompletion(String jobId, String ref)
            throws GenerationEngineException, TimeoutException, InterruptedException {
        long deadline = System.nanoTime() + workflowTimeout.toNanos();
        while (true) {
            if (isCancelled(jobId)) {
                return null;
            }
            try {
                EnginePollResult result = engineClient.poll(ref);
                if (result.isFinished()) {
                    return result;
                }
            } catch (EngineConnectionException e) {
                log.warn("Transient poll failure for job {} (ref={}): {}", jobId, ref, e.getMessage());
            }
            if (System.nanoTime() >= deadline) {
                throw new TimeoutException("Engine did not finish prompt " + ref + " within " + workflowTimeout.toSeconds() + "s");
            }
            Thread.sleep(Math.max(1L, pollInterval.toMillis()));
        }
    }

    private void complete(GenerationJobEntity job, List<EngineOutput> outputs) {
        String jobId = job.getId();
        ArtifactStorageService.StoredArtifacts artifacts;
        try {
            List<ArtifactStorageService.DownloadedImage> images = new ArrayList<>();
            for (EngineOutput output : outputs) {
                images.add(new ArtifactStorageService.DownloadedImage(output.filename(), engineClient.download(output)));
            }
            artifacts = artifactStorage.store(job.getUserId(), jobId, images);
        } catch (GenerationEngineException | ArtifactStorageException e) {
            log.warn("Failed to collect outputs for job {}: {}", jobId, e.getMessage());
            failJob(jobId, e instanceof ArtifactStorageException ? e : new ArtifactStorageException(e.getMessage(), e));
            return;
        }

        JobTransitionService.TransitionResult completed = transitions.transition(jobId, GenerationJobStatus.COMPLETED, row -> {
            ContentRecordEntity record = new ContentRecordEntity(
                    row.getUserId(), jobId, titleFromPrompt(row.getPrompt()), row.getPrompt(), artifacts.primaryOutput());
            record.setThumbnailPath(artifacts.primaryThumbnail());
            record.setWidth(row.getWidth());
            record.setHeight(row.getHeight());
            record = contentRecordRepository.save(record);
            row.setContentId(record.getId());
            row.setOutputPathsJson(jsonCodec.write(artifacts.outputPaths()));
            row.setThumbnailPathsJson(jsonCodec.write(artifacts.thumbnailPaths()));
        });
        if (!completed.applied()) {
            log.info("Job {} is {}; discarding {} finished output(s)",
                    jobId, completed.status().wireName(), artifacts.outputPaths().size());
            artifactStorage.delete(artifacts);
        }
    }

    long computeRetryDelayMillis(int attempt) {
        long baseMillis = Math.max(1L, initialRetryDelayMillis);
        long maxMillis = Math.max(baseMillis, maxRetryDelayMillis);
        long delayMillis = baseMillis;
        for (int i = 1; i < attempt; i++) {
            if (delayMillis >= maxMillis) {
                break;
            }
            delayMillis = Math.min(maxMillis, delayMillis * 2);
        }
        return delayMillis;
    }

    private WorkflowParameters toWorkflowParameters(GenerationJobEntity job) {
        String checkpointFile = modelCatalog.resolve(ModelType.CHECKPOINT, job.getCheckpointModel())
                .map(model -> model.getFilename())
                .orElse(job.getCheckpointModel());
        List<WorkflowParameters.ResolvedLora> loras = new ArrayList<>();
        for (LoraSelection lora : jsonCodec.readLoras(job.getLoraModelsJson())) {
            String filename = modelCatalog.resolve(ModelType.LORA, lora.name())
                    .map(model -> model.getFilename())
                    .orElse(lora.name());
            loras.add(new WorkflowParameters.ResolvedLora(
                    filename, lora.effectiveStrengthModel(), lora.effectiveStrengthClip()));
        }
        return new WorkflowParameters(
                job.getPrompt(),
                job.getNegativePrompt(),
                checkpointFile,
                loras,
                job.getWidth(),
                job.getHeight(),
                job.getBatchSize(),
                jsonCodec.readObjectMap(job.getSamplerParamsJson()),
                WorkflowBuilder.filenamePrefixFor(job.getId()));
    }

    private boolean isCancelled(String jobId) {
        return jobRepository.findById(jobId)
                .map(job -> job.getStatus() == GenerationJobStatus.CANCELLED)
                .orElse(true);
    }

    private void failJob(String jobId, Throwable error) {
        ErrorClassification classification = errorClassifier.classify(error);
        try {
            JobTransitionService.TransitionResult result = transitions.fail(jobId,
                    errorClassifier.describe(classification, error.getMessage()),
                    jsonCodec.write(classification.recoverySuggestions()));
            if (!result.applied()) {
                log.info("Job {} already {}; not recording failure", jobId, result.status().wireName());
            }
        } catch (RuntimeException e) {
            log.error("Failed to record failure for job {}", jobId, e);
        }
    }

    private void cancelEngineQuietly(String jobId, String ref) {
        try {
            engineClient.cancel(ref);
        } catch (GenerationEngineException | RuntimeException e) {
            log.warn("Best-effort engine cancel failed for job {} (ref={}): {}", jobId, ref, e.getMessage());
        }
    }

    static String titleFromPrompt(String prompt) {
        if (prompt == null || prompt.isBlank()) {
            return "Untitled generation";
        }
        String normalized = prompt.trim().replaceAll("\\s+", " ");
        if (normalized.length() <= MAX_TITLE_LENGTH) {
            return normalized;
        }
        String cut = normalized.substring(0, MAX_TITLE_LENGTH);
        int lastSpace = cut.lastIndexOf(' ');
        if (lastSpace > MAX_TITLE_LENGTH / 2) {
            cut = cut.substring(0, lastSpace);
        }
        return cut + "...";
    }
}
