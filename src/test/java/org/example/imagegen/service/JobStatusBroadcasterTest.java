package org.example.imagegen.service;

import org.example.imagegen.model.StatusEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobStatusBroadcasterTest {

    private final JobStatusBroadcaster broadcaster = new JobStatusBroadcaster();

    @AfterEach
    void clearSynchronization() {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.clearSynchronization();
        }
    }

    @Test
    void publish_onlyReachesSubscribersOfThatJob() {
        List<String> jobOne = new ArrayList<>();
        List<String> jobTwo = new ArrayList<>();
        broadcaster.subscribe("job-1", event -> jobOne.add(event.status()));
        broadcaster.subscribe("job-2", event -> jobTwo.add(event.status()));

        broadcaster.publish(event("job-1", "running"));

        assertEquals(List.of("running"), jobOne);
        assertTrue(jobTwo.isEmpty());
    }

    @Test
    void publish_continuesPastFailingListener() {
        List<String> received = new ArrayList<>();
        broadcaster.subscribe("job-1", event -> {
            throw new IllegalStateException("listener broke");
        });
        broadcaster.subscribe("job-1", event -> received.add(event.status()));

        broadcaster.publish(event("job-1", "queued"));

        assertEquals(List.of("queued"), received);
    }

    @Test
    void unsubscribe_removesListenerAndEmptyChannel() {
        List<String> received = new ArrayList<>();
        Runnable unsubscribe = broadcaster.subscribe("job-1", event -> received.add(event.status()));
        assertEquals(1, broadcaster.subscriberCount("job-1"));

        unsubscribe.run();
        broadcaster.publish(event("job-1", "running"));

        assertEquals(0, broadcaster.subscriberCount("job-1"));
        assertTrue(received.isEmpty());
    }

    @Test
    void publishAfterCommit_waitsForCommit() {
        List<String> received = new ArrayList<>();
        broadcaster.subscribe("job-1", event -> received.add(event.status()));
        TransactionSynchronizationManager.initSynchronization();

        broadcaster.publishAfterCommit(event("job-1", "pending"));
        assertTrue(received.isEmpty());

        for (TransactionSynchronization synchronization : TransactionSynchronizationManager.getSynchronizations()) {
            synchronization.afterCommit();
        }
        assertEquals(List.of("pending"), received);
    }

    @Test
    void publishAfterCommit_withoutTransaction_publishesImmediately() {
        List<String> received = new ArrayList<>();
        broadcaster.subscribe("job-1", event -> received.add(event.status()));

        broadcaster.publishAfterCommit(event("job-1", "cancelled"));

        assertEquals(List.of("cancelled"), received);
    }

    private static StatusEvent event(String jobId, String status) {
        return new StatusEvent(jobId, status, null, null, Instant.now());
    }
}
