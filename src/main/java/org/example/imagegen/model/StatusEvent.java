package org.example.imagegen.model;

import org.example.imagegen.entity.GenerationJobEntity;
import org.example.imagegen.entity.GenerationJobStatus;

import java.time.Instant;

/**
 * Ephemeral notification of a committed job transition. Never persisted.
 */
public record StatusEvent(
        String jobId,
        String status,
        String contentId,
        String error,
        Instant timestamp
) {
    public StatusEvent {
        GenerationJobStatus.fromWire(status);
    }

    public static StatusEvent of(GenerationJobEntity job, Instant timestamp) {
        return new StatusEvent(
                job.getId(),
                job.getStatus().wireName(),
                job.getContentId(),
                job.getStatus() == GenerationJobStatus.FAILED ? job.getErrorMessage() : null,
                timestamp
        );
    }

    public boolean isTerminal() {
        return GenerationJobStatus.fromWire(status).isTerminal();
    }
}
