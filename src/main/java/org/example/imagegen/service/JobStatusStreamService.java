package org.example.imagegen.service;

import org.example.imagegen.config.GenerationProperties;
import org.example.imagegen.entity.GenerationJobEntity;
import org.example.imagegen.model.StatusEvent;
import org.example.imagegen.repository.GenerationJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Push gateway: one subscription per connected client and job. The current
 * row status is replayed after registering, so a client never misses the
 * transition that happened while it was connecting.
 */
@Service
public class JobStatusStreamService {

    private static final Logger log = LoggerFactory.getLogger(JobStatusStreamService.class);
    static final int MAX_JOBS_PER_STREAM = 50;

    private final GenerationJobRepository jobRepository;
    private final JobStatusBroadcaster broadcaster;
    private final long emitterTimeoutMillis;

    public JobStatusStreamService(
            GenerationJobRepository jobRepository,
            JobStatusBroadcaster broadcaster,
            GenerationProperties properties) {
        this.jobRepository = jobRepository;
        this.broadcaster = broadcaster;
        this.emitterTimeoutMillis = properties.getStream().getEmitterTimeout().toMillis();
    }

    /**
     * @throws JobNotFoundException before any stream is opened
     */
    public SseEmitter open(String jobId) {
        if (!jobRepository.existsById(jobId)) {
            throw new JobNotFoundException(jobId);
        }
        SseEmitter emitter = new SseEmitter(emitterTimeoutMillis);
        attach(jobId, new SseStatusEventSink(emitter));
        return emitter;
    }

    /**
     * One stream for several jobs. Closes after the last of them reaches a
     * terminal status.
     *
     * @throws JobValidationException when the id list is empty, too long or
     * names jobs that do not exist
     */
    public SseEmitter openMany(Collection<String> jobIds) {
        List<String> ids = normalizeJobIds(jobIds);
        List<String> unknown = ids.stream().filter(id -> !jobRepository.existsById(id)).toList();
        if (!unknown.isEmpty()) {
            throw new JobValidationException(Map.of("job_ids", "unknown job ids: " + String.join(", ", unknown)));
        }
        SseEmitter emitter = new SseEmitter(emitterTimeoutMillis);
        attachAll(ids, new SseStatusEventSink(emitter));
        return emitter;
    }

    public List<StatusSubscription> attachAll(List<String> jobIds, StatusEventSink sink) {
        MultiJobStatusSink shared = new MultiJobStatusSink(sink, jobIds);
        List<StatusSubscription> subscriptions = new ArrayList<>();
        try {
            for (String jobId : jobIds) {
                subscriptions.add(attach(jobId, shared.forJob(jobId)));
            }
        } catch (JobNotFoundException e) {
            subscriptions.forEach(StatusSubscription::close);
            throw e;
        }
        log.debug("Status subscriber attached to {} job(s)", jobIds.size());
        return subscriptions;
    }

    static List<String> normalizeJobIds(Collection<String> jobIds) {
        Set<String> ids = new LinkedHashSet<>();
        if (jobIds != null) {
            for (String jobId : jobIds) {
                if (jobId != null && !jobId.isBlank()) {
                    ids.add(jobId.trim());
                }
            }
        }
        if (ids.isEmpty()) {
            throw new JobValidationException(Map.of("job_ids", "must list at least one job id"));
        }
        if (ids.size() > MAX_JOBS_PER_STREAM) {
            throw new JobValidationException(Map.of("job_ids", "must list at most " + MAX_JOBS_PER_STREAM + " job ids"));
        }
        return List.copyOf(ids);
    }

    public StatusSubscription attach(String jobId, StatusEventSink sink) {
        StatusSubscription subscription = new StatusSubscription(jobId, sink);
        sink.onClose(subscription::close);
        subscription.bind(broadcaster.subscribe(jobId, subscription::offer));

        GenerationJobEntity job = jobRepository.findById(jobId).orElse(null);
        if (job == null) {
            subscription.close();
            throw new JobNotFoundException(jobId);
        }
        subscription.offer(snapshot(job));
        log.debug("Status subscriber attached to job {} (current status {})", jobId, job.getStatus().wireName());
        return subscription;
    }

    /**
     * Row state as an event stamped with the row's last update, so any later
     * transition compares as newer.
     */
    static StatusEvent snapshot(GenerationJobEntity job) {
        return StatusEvent.of(job, job.getUpdatedAt().atZone(ZoneId.systemDefault()).toInstant());
    }
}
