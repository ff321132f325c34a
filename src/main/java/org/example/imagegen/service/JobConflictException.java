package org.example.imagegen.service;

import org.example.imagegen.entity.GenerationJobStatus;

/**
 * The requested change is not allowed from the job's current status.
 */
public class JobConflictException extends RuntimeException {

    private final GenerationJobStatus currentStatus;

    public JobConflictException(String jobId, GenerationJobStatus currentStatus) {
        super("Generation job " + jobId + " is already " + currentStatus.wireName());
        this.currentStatus = currentStatus;
    }

    public GenerationJobStatus getCurrentStatus() {
        return currentStatus;
    }
}
