package org.example.imagegen.service;

public class JobNotFoundException extends RuntimeException {

    public JobNotFoundException(String jobId) {
        super("Generation job not found: " + jobId);
    }
}
