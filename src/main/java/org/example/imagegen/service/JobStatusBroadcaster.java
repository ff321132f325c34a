package org.example.imagegen.service;

import org.example.imagegen.model.StatusEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process publish channel, one per job. Subscribers only see events
 * published after they registered.
 */
@Service
public class JobStatusBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(JobStatusBroadcaster.class);

    private final Map<String, List<Consumer<StatusEvent>>> listeners = new ConcurrentHashMap<>();

    /**
     * Register a listener for one job.
     *
     * @return handle that removes the listener again
     */
    public Runnable subscribe(String jobId, Consumer<StatusEvent> listener) {
        listeners.computeIfAbsent(jobId, key -> new CopyOnWriteArrayList<>()).add(listener);
        return () -> unsubscribe(jobId, listener);
    }

    public void publish(StatusEvent event) {
        List<Consumer<StatusEvent>> jobListeners = listeners.get(event.jobId());
        if (jobListeners == null || jobListeners.isEmpty()) {
            log.debug("No subscribers for job {} status {}", event.jobId(), event.status());
            return;
        }
        for (Consumer<StatusEvent> listener : jobListeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                log.warn("Status listener for job {} failed: {}", event.jobId(), e.getMessage());
            }
        }
    }

    /**
     * Publish once the surrounding transaction commits; immediately when no
     * transaction is active. Rolled-back transitions are never announced.
     */
    public void publishAfterCommit(StatusEvent event) {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    publish(event);
                }
            });
            return;
        }
        publish(event);
    }

    public int subscriberCount(String jobId) {
        List<Consumer<StatusEvent>> jobListeners = listeners.get(jobId);
        return jobListeners == null ? 0 : jobListeners.size();
    }

    private void unsubscribe(String jobId, Consumer<StatusEvent> listener) {
        listeners.computeIfPresent(jobId, (key, current) -> {
            current.remove(listener);
            return current.isEmpty() ? null : current;
        });
    }
}
