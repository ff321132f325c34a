package org.example.imagegen.service;

import org.example.imagegen.config.GenerationProperties;
import org.example.imagegen.entity.GenerationJobEntity;
import org.example.imagegen.entity.GenerationJobStatus;
import org.example.imagegen.entity.ModelType;
import org.example.imagegen.model.CreateGenerationJobRequest;
import org.example.imagegen.model.GenerationJobPage;
import org.example.imagegen.model.GenerationJobView;
import org.example.imagegen.model.LoraSelection;
import org.example.imagegen.model.StatusEvent;
import org.example.imagegen.repository.GenerationJobRepository;
import org.example.imagegen.service.engine.GenerationEngineClient;
import org.example.imagegen.service.engine.GenerationEngineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Admission, cancellation and lookup of generation jobs. The worker pool
 * drives everything between queued and a terminal status.
 */
@Service
public class GenerationJobService {

    private static final Logger log = LoggerFactory.getLogger(GenerationJobService.class);
    private static final int MAX_PAGE_SIZE = 100;
    private static final Set<String> SAMPLER_KEYS = Set.of("seed", "steps", "cfg", "sampler_name", "scheduler", "denoise");

    private final GenerationJobRepository jobRepository;
    private final GenerationTaskQueue taskQueue;
    private final JobTransitionService transitions;
    private final JobStatusBroadcaster broadcaster;
    private final ModelCatalogService modelCatalog;
    private final GenerationEngineClient engineClient;
    private final JobJsonCodec jsonCodec;
    private final GenerationProperties.Validation limits;

    public GenerationJobService(
            GenerationJobRepository jobRepository,
            GenerationTaskQueue taskQueue,
            JobTransitionService transitions,
            JobStatusBroadcaster broadcaster,
            ModelCatalogService modelCatalog,
            GenerationEngineClient engineClient,
            JobJsonCodec jsonCodec,
            GenerationProperties properties) {
        this.jobRepository = jobRepository;
        this.taskQueue = taskQueue;
        this.transitions = transitions;
        this.broadcaster = broadcaster;
        this.modelCatalog = modelCatalog;
        this.engineClient = engineClient;
        this.jsonCodec = jsonCodec;
        this.limits = properties.getValidation();
    }

    /**
     * Validate, persist as pending, enqueue and move to queued in one
     * transaction. Both status events are published after commit. Identical
     * requests produce distinct jobs.
     *
     * @throws JobValidationException listing every invalid field
     */
    @Transactional
    public GenerationJobEntity createJob(CreateGenerationJobRequest request) {
        validate(request);

        GenerationJobEntity job = new GenerationJobEntity(
                request.userId().trim(),
                request.prompt().trim(),
                request.checkpointModel().trim(),
                request.width(),
                request.height(),
                request.batchSize() == null ? 1 : request.batchSize());
        if (request.negativePrompt() != null && !request.negativePrompt().isBlank()) {
            job.setNegativePrompt(request.negativePrompt().trim());
        }
        job.setLoraModelsJson(jsonCodec.write(request.loraModels()));
        job.setSamplerParamsJson(jsonCodec.write(request.samplerParams()));

        job = jobRepository.saveAndFlush(job);
        broadcaster.publishAfterCommit(StatusEvent.of(job, Instant.now()));

        taskQueue.enqueue(job.getId());
        job.setStatus(GenerationJobStatus.QUEUED);
        job = jobRepository.saveAndFlush(job);
        broadcaster.publishAfterCommit(StatusEvent.of(job, Instant.now()));

        log.info("Created generation job {} for user {} (checkpoint={}, {}x{}, batch={})",
                job.getId(), job.getUserId(), job.getCheckpointModel(), job.getWidth(), job.getHeight(), job.getBatchSize());
        return job;
    }

    /**
     * Cancel a job that has not reached a terminal status. A job owned by a
     * different user is reported as not found.
     *
     * @throws JobNotFoundException when the job does not exist for this user
     * @throws JobConflictException when the job is already terminal
     */
    public GenerationJobEntity cancelJob(String jobId, String userId) {
        GenerationJobEntity job = getJob(jobId);
        if (userId != null && !userId.isBlank() && !userId.trim().equals(job.getUserId())) {
            throw new JobNotFoundException(jobId);
        }
        if (job.getStatus().isTerminal()) {
            throw new JobConflictException(jobId, job.getStatus());
        }

        JobTransitionService.TransitionResult result = transitions.transition(jobId, GenerationJobStatus.CANCELLED);
        if (!result.applied()) {
            // lost the race against the worker reaching a terminal status
            throw new JobConflictException(jobId, result.status());
        }

        String ref = result.job().getExternalJobRef();
        if (ref != null && !ref.isBlank()) {
            try {
                boolean acknowledged = engineClient.cancel(ref);
                log.info("Sent cancel for job {} to {} (ref={}, acknowledged={})",
                        jobId, engineClient.getEngineName(), ref, acknowledged);
            } catch (GenerationEngineException | RuntimeException e) {
                log.warn("Engine cancel failed for job {} (ref={}): {}", jobId, ref, e.getMessage());
            }
        }
        return result.job();
    }

    public GenerationJobEntity getJob(String jobId) {
        return jobRepository.findById(jobId)
                .orElseThrow(() -> new JobNotFoundException(jobId));
    }

    /**
     * A user's jobs, newest first.
     */
    public GenerationJobPage listJobs(String userId, GenerationJobStatus status, int page, int size) {
        if (userId == null || userId.isBlank()) {
            throw new JobValidationException(Map.of("user_id", "must not be blank"));
        }
        PageRequest pageRequest = PageRequest.of(Math.max(0, page), Math.max(1, Math.min(MAX_PAGE_SIZE, size)));
        Page<GenerationJobEntity> result = status == null
                ? jobRepository.findByUserIdOrderByCreatedAtDesc(userId.trim(), pageRequest)
                : jobRepository.findByUserIdAndStatusOrderByCreatedAtDesc(userId.trim(), status, pageRequest);
        return new GenerationJobPage(
                result.getContent().stream().map(this::toView).toList(),
                result.getNumber(),
                result.getSize(),
                result.getTotalElements(),
                result.getTotalPages());
    }

    public GenerationJobView toView(GenerationJobEntity job) {
        return new GenerationJobView(
                job.getId(),
                job.getUserId(),
                job.getStatus().wireName(),
                job.getPrompt(),
                job.getNegativePrompt(),
                job.getCheckpointModel(),
                jsonCodec.readLoras(job.getLoraModelsJson()),
                job.getWidth(),
                job.getHeight(),
                job.getBatchSize(),
                jsonCodec.readObjectMap(job.getSamplerParamsJson()),
                job.getExternalJobRef(),
                job.getContentId(),
                jsonCodec.readStrings(job.getOutputPathsJson()),
                jsonCodec.readStrings(job.getThumbnailPathsJson()),
                job.getErrorMessage(),
                jsonCodec.readStrings(job.getRecoverySuggestionsJson()),
                job.getCreatedAt(),
                job.getStartedAt(),
                job.getCompletedAt(),
                job.getUpdatedAt());
    }

    void validate(CreateGenerationJobRequest request) {
        Map<String, String> errors = new LinkedHashMap<>();

        if (request.userId() == null || request.userId().isBlank()) {
            errors.put("user_id", "must not be blank");
        }
        if (request.prompt() == null || request.prompt().isBlank()) {
            errors.put("prompt", "must not be blank");
        } else if (request.prompt().trim().length() > limits.getMaxPromptLength()) {
            errors.put("prompt", "must be at most " + limits.getMaxPromptLength() + " characters");
        }
        if (request.negativePrompt() != null && request.negativePrompt().trim().length() > limits.getMaxPromptLength()) {
            errors.put("negative_prompt", "must be at most " + limits.getMaxPromptLength() + " characters");
        }
        validateDimension("width", request.width(), errors);
        validateDimension("height", request.height(), errors);

        Integer batchSize = request.batchSize();
        if (batchSize != null && (batchSize < 1 || batchSize > limits.getMaxBatchSize())) {
            errors.put("batch_size", "must be between 1 and " + limits.getMaxBatchSize());
        }

        if (request.checkpointModel() == null || request.checkpointModel().isBlank()) {
            errors.put("checkpoint_model", "must not be blank");
        } else if (modelCatalog.resolve(ModelType.CHECKPOINT, request.checkpointModel()).isEmpty()) {
            errors.put("checkpoint_model", "unknown checkpoint '" + request.checkpointModel().trim() + "'");
        }

        List<LoraSelection> loras = request.loraModels();
        for (int i = 0; i < loras.size(); i++) {
            LoraSelection lora = loras.get(i);
            String field = "lora_models[" + i + "]";
            if (lora == null || lora.name() == null || lora.name().isBlank()) {
                errors.put(field + ".name", "must not be blank");
            } else if (modelCatalog.resolve(ModelType.LORA, lora.name()).isEmpty()) {
                errors.put(field + ".name", "unknown LoRA '" + lora.name().trim() + "'");
            }
        }

        for (String key : request.samplerParams().keySet()) {
            if (!SAMPLER_KEYS.contains(key)) {
                log.debug("Ignoring unrecognized sampler parameter '{}'", key);
            }
        }

        if (!errors.isEmpty()) {
            throw new JobValidationException(errors);
        }
    }

    private void validateDimension(String field, Integer value, Map<String, String> errors) {
        if (value == null) {
            errors.put(field, "is required");
            return;
        }
        if (value < limits.getMinDimension() || value > limits.getMaxDimension()) {
            errors.put(field, "must be between " + limits.getMinDimension() + " and " + limits.getMaxDimension());
        } else if (limits.getDimensionMultiple() > 1 && value % limits.getDimensionMultiple() != 0) {
            errors.put(field, "must be a multiple of " + limits.getDimensionMultiple());
        }
    }
}
