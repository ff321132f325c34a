package org.example.imagegen.service;

import jakarta.persistence.OptimisticLockException;
import org.example.imagegen.entity.GenerationJobEntity;
import org.example.imagegen.entity.GenerationJobStatus;
import org.example.imagegen.model.StatusEvent;
import org.example.imagegen.repository.GenerationJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.function.Consumer;

/**
 * Single entry point for job status changes. Each change is a read, a state
 * machine check and a versioned write in its own transaction; the status event
 * goes out only after commit.
 */
@Service
public class JobTransitionService {

    private static final Logger log = LoggerFactory.getLogger(JobTransitionService.class);
    private static final int MAX_UPDATE_ATTEMPTS = 5;

    private final GenerationJobRepository jobRepository;
    private final JobStatusBroadcaster broadcaster;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    @Autowired
    public JobTransitionService(
            GenerationJobRepository jobRepository,
            JobStatusBroadcaster broadcaster,
            PlatformTransactionManager transactionManager) {
        this(jobRepository, broadcaster, new TransactionTemplate(transactionManager), Clock.systemDefaultZone());
    }

    JobTransitionService(
            GenerationJobRepository jobRepository,
            JobStatusBroadcaster broadcaster,
            TransactionTemplate transactionTemplate,
            Clock clock) {
        this.jobRepository = jobRepository;
        this.broadcaster = broadcaster;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    /**
     * Move a job to {@code target} if the state machine allows it from the
     * current row status.
     *
     * @param mutator extra changes applied in the same transaction, only when
     *                the transition is allowed
     * @return the outcome; not applied when the job already moved elsewhere
     * @throws JobNotFoundException when the job does not exist
     */
    public TransitionResult transition(String jobId, GenerationJobStatus target, Consumer<GenerationJobEntity> mutator) {
        for (int attempt = 1; attempt <= MAX_UPDATE_ATTEMPTS; attempt++) {
            try {
                TransitionResult result = transactionTemplate.execute(status -> applyOnce(jobId, target, mutator));
                if (result != null) {
                    return result;
                }
            } catch (ObjectOptimisticLockingFailureException | OptimisticLockException e) {
                log.debug("Concurrent update on job {} while moving to {} (attempt {}/{})",
                        jobId, target, attempt, MAX_UPDATE_ATTEMPTS);
            }
        }
        GenerationJobEntity current = jobRepository.findById(jobId)
                .orElseThrow(() -> new JobNotFoundException(jobId));
        log.warn("Gave up moving job {} to {} after {} concurrent updates; current status {}",
                jobId, target, MAX_UPDATE_ATTEMPTS, current.getStatus());
        return TransitionResult.rejected(current);
    }

    public TransitionResult transition(String jobId, GenerationJobStatus target) {
        return transition(jobId, target, job -> {
        });
    }

    /**
     * Mark the job failed with the given message and suggestions. No-op once
     * the job is terminal.
     */
    public TransitionResult fail(String jobId, String errorMessage, String recoverySuggestionsJson) {
        return transition(jobId, GenerationJobStatus.FAILED, job -> {
            job.setErrorMessage(truncate(errorMessage, 2000));
            job.setRecoverySuggestionsJson(recoverySuggestionsJson);
        });
    }

    public LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    private TransitionResult applyOnce(String jobId, GenerationJobStatus target, Consumer<GenerationJobEntity> mutator) {
        GenerationJobEntity job = jobRepository.findById(jobId)
                .orElseThrow(() -> new JobNotFoundException(jobId));
        GenerationJobStatus from = job.getStatus();
        if (!from.canTransitionTo(target)) {
            return TransitionResult.rejected(job);
        }
        mutator.accept(job);
        job.setStatus(target);
        if (target.isTerminal() && job.getCompletedAt() == null) {
            job.setCompletedAt(now());
        }
        if (target != GenerationJobStatus.COMPLETED) {
            job.setContentId(null);
            job.setOutputPathsJson(null);
        }
        GenerationJobEntity saved = jobRepository.saveAndFlush(job);
        broadcaster.publishAfterCommit(StatusEvent.of(saved, Instant.now(clock)));
        log.info("Job {} {} -> {}", jobId, from.wireName(), target.wireName());
        return TransitionResult.success(saved);
    }

    private static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }

    public record TransitionResult(boolean applied, GenerationJobEntity job) {

        static TransitionResult success(GenerationJobEntity job) {
            return new TransitionResult(true, job);
        }

        static TransitionResult rejected(GenerationJobEntity job) {
            return new TransitionResult(false, job);
        }

        public GenerationJobStatus status() {
            return job.getStatus();
        }
    }
}
