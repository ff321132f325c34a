package org.example.imagegen.service;

import org.example.imagegen.config.GenerationProperties;
import org.example.imagegen.entity.GenerationTaskEntity;
import org.example.imagegen.entity.GenerationTaskStatus;
import org.example.imagegen.repository.GenerationTaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Durable at-least-once work queue backed by the generation_tasks table.
 *
 * <p>A task belongs to whichever worker won the conditional lease UPDATE.
 * Tasks whose lease expired without an acknowledgement are claimable again.
 * The in-memory wake-up queue only shortens idle waits; losing a signal costs
 * at most one idle poll interval.
 */
@Service
public class GenerationTaskQueue {

    private static final Logger log = LoggerFactory.getLogger(GenerationTaskQueue.class);
    private static final int CLAIM_CANDIDATES = 5;
    private static final List<GenerationTaskStatus> OPEN_STATUSES =
            List.of(GenerationTaskStatus.AVAILABLE, GenerationTaskStatus.CLAIMED);

    private final GenerationTaskRepository taskRepository;
    private final Duration leaseDuration;
    private final Clock clock;
    private final BlockingQueue<String> wakeups = new LinkedBlockingQueue<>(1024);

    @Autowired
    public GenerationTaskQueue(GenerationTaskRepository taskRepository, GenerationProperties properties) {
        this(taskRepository, properties.getWorker().getLeaseDuration(), Clock.systemDefaultZone());
    }

    GenerationTaskQueue(GenerationTaskRepository taskRepository, Duration leaseDuration, Clock clock) {
        this.taskRepository = taskRepository;
        this.leaseDuration = leaseDuration;
        this.clock = clock;
    }

    /**
     * Add a task for the job. Inside a transaction, workers are woken only
     * after commit so they never look for a row they cannot see yet.
     */
    public GenerationTaskEntity enqueue(String jobId) {
        GenerationTaskEntity task = new GenerationTaskEntity(jobId);
        LocalDateTime now = LocalDateTime.now(clock);
        task.setCreatedAt(now);
        task.setAvailableAt(now);
        GenerationTaskEntity saved = taskRepository.save(task);
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    signal(jobId);
                }
            });
        } else {
            signal(jobId);
        }
        log.debug("Enqueued generation task {} for job {}", saved.getId(), jobId);
        return saved;
    }

    public Optional<ClaimedTask> claimNext(String workerId) {
        LocalDateTime now = LocalDateTime.now(clock);
        List<String> candidates = taskRepository.findClaimCandidates(
                now,
                GenerationTaskStatus.AVAILABLE,
                GenerationTaskStatus.CLAIMED,
                PageRequest.of(0, CLAIM_CANDIDATES));
        for (String taskId : candidates) {
            int claimed = taskRepository.claimLease(
                    taskId,
                    now,
                    now.plus(leaseDuration),
                    workerId,
                    GenerationTaskStatus.AVAILABLE,
                    GenerationTaskStatus.CLAIMED);
            if (claimed == 1) {
                Optional<GenerationTaskEntity> task = taskRepository.findById(taskId);
                if (task.isPresent()) {
                    GenerationTaskEntity entity = task.get();
                    if (entity.getDeliveryCount() > 1) {
                        log.info("Redelivering task {} for job {} (delivery {})",
                                taskId, entity.getJobId(), entity.getDeliveryCount());
                    }
                    return Optional.of(new ClaimedTask(taskId, entity.getJobId(), workerId, entity.getDeliveryCount()));
                }
            }
        }
        return Optional.empty();
    }

    public boolean acknowledge(ClaimedTask task) {
        int updated = taskRepository.acknowledge(
                task.taskId(),
                task.workerId(),
                LocalDateTime.now(clock),
                GenerationTaskStatus.CLAIMED,
                GenerationTaskStatus.DONE);
        if (updated == 0) {
            log.warn("Task {} for job {} was no longer leased by {} at acknowledgement",
                    task.taskId(), task.jobId(), task.workerId());
        }
        return updated == 1;
    }

    /**
     * Block until work may be available or the timeout passes.
     */
    public void awaitWork(Duration timeout) throws InterruptedException {
        String hint = wakeups.poll(Math.max(1L, timeout.toMillis()), TimeUnit.MILLISECONDS);
        if (hint != null) {
            log.trace("Woken for job {}", hint);
        }
    }

    public void signal(String jobId) {
        if (!wakeups.offer(jobId)) {
            log.debug("Wake-up queue full; workers will find job {} on their next poll", jobId);
        }
    }

    public boolean hasOpenTask(String jobId) {
        return taskRepository.existsByJobIdAndStatusIn(jobId, OPEN_STATUSES);
    }

    public long countOpen() {
        return taskRepository.countByStatus(GenerationTaskStatus.AVAILABLE)
                + taskRepository.countByStatus(GenerationTaskStatus.CLAIMED);
    }

    public record ClaimedTask(String taskId, String jobId, String workerId, int deliveryCount) {
    }
}
