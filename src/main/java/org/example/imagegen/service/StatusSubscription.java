package org.example.imagegen.service;

import org.example.imagegen.model.StatusEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Per-client filter between the broadcaster and a sink. Once a terminal event
 * went out nothing else does; a non-terminal event that is older than, or
 * repeats, the last delivered one is dropped.
 */
public class StatusSubscription {

    private static final Logger log = LoggerFactory.getLogger(StatusSubscription.class);

    private final String jobId;
    private final StatusEventSink sink;
    private Runnable unsubscribe = () -> {
    };
    private StatusEvent lastDelivered;
    private boolean terminalDelivered;
    private boolean closed;

    StatusSubscription(String jobId, StatusEventSink sink) {
        this.jobId = jobId;
        this.sink = sink;
    }

    synchronized void bind(Runnable unsubscribe) {
        this.unsubscribe = unsubscribe;
        if (closed) {
            unsubscribe.run();
        }
    }

    /**
     * @return true when the event was delivered
     */
    public synchronized boolean offer(StatusEvent event) {
        if (closed || terminalDelivered) {
            return false;
        }
        if (!event.isTerminal() && lastDelivered != null
                && (event.timestamp().isBefore(lastDelivered.timestamp())
                || event.status().equals(lastDelivered.status()))) {
            log.debug("Dropping stale {} event for job {}", event.status(), jobId);
            return false;
        }
        try {
            sink.send(event);
        } catch (IOException | IllegalStateException e) {
            log.debug("Status stream for job {} is gone: {}", jobId, e.getMessage());
            close();
            return false;
        }
        lastDelivered = event;
        if (event.isTerminal()) {
            terminalDelivered = true;
            close();
            sink.complete();
        }
        return true;
    }

    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        unsubscribe.run();
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    public String getJobId() {
        return jobId;
    }
}
