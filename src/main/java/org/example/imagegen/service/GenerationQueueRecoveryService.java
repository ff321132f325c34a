package org.example.imagegen.service;

import org.example.imagegen.config.GenerationProperties;
import org.example.imagegen.entity.GenerationJobEntity;
import org.example.imagegen.entity.GenerationJobStatus;
import org.example.imagegen.model.ErrorClassification;
import org.example.imagegen.repository.GenerationJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Startup sweep over jobs left behind by a previous run: queued jobs without
 * an open task get one, running/processing jobs that have not been touched for
 * a full lease are failed because their worker is gone.
 */
@Service
public class GenerationQueueRecoveryService {

    private static final Logger log = LoggerFactory.getLogger(GenerationQueueRecoveryService.class);

    private final GenerationJobRepository jobRepository;
    private final GenerationTaskQueue taskQueue;
    private final JobTransitionService transitions;
    private final JobJsonCodec jsonCodec;
    private final Duration staleAfter;
    private final boolean recoveryEnabled;

    public GenerationQueueRecoveryService(
            GenerationJobRepository jobRepository,
            GenerationTaskQueue taskQueue,
            JobTransitionService transitions,
            JobJsonCodec jsonCodec,
            GenerationProperties properties,
            @Value("${generation.queue.recovery.enabled:true}") boolean recoveryEnabled) {
        this.jobRepository = jobRepository;
        this.taskQueue = taskQueue;
        this.transitions = transitions;
        this.jsonCodec = jsonCodec;
        this.staleAfter = properties.getWorker().getLeaseDuration();
        this.recoveryEnabled = recoveryEnabled;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void recoverOnStartup() {
        recoverPendingGenerationWork();
    }

    RecoverySummary recoverPendingGenerationWork() {
        if (!recoveryEnabled) {
            log.info("Generation queue recovery is disabled");
            return new RecoverySummary(0, 0);
        }

        int requeued = 0;
        for (GenerationJobEntity job : jobRepository.findByStatus(GenerationJobStatus.QUEUED)) {
            if (!taskQueue.hasOpenTask(job.getId())) {
                taskQueue.enqueue(job.getId());
                requeued++;
            }
        }

        LocalDateTime staleBefore = transitions.now().minus(staleAfter);
        List<GenerationJobEntity> stale = jobRepository.findStaleInStatuses(
                List.of(GenerationJobStatus.RUNNING, GenerationJobStatus.PROCESSING), staleBefore);
        ErrorClassification classification = ErrorClassification.workerLost();
        int failed = 0;
        for (GenerationJobEntity job : stale) {
            JobTransitionService.TransitionResult result = transitions.fail(
                    job.getId(),
                    classification.message(),
                    jsonCodec.write(classification.recoverySuggestions()));
            if (result.applied()) {
                failed++;
            }
        }

        RecoverySummary summary = new RecoverySummary(requeued, failed);
        log.info("Recovered generation queue: requeued={}, failedStale={}",
                summary.jobsRequeued(), summary.staleJobsFailed());
        return summary;
    }

    record RecoverySummary(int jobsRequeued, int staleJobsFailed) {
    }
}
