package org.example.imagegen.service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Thrown when a generation request is rejected before a job exists. Carries
 * every violated field, not just the first.
 */
public class JobValidationException extends RuntimeException {

    private final Map<String, String> fieldErrors;

    public JobValidationException(Map<String, String> fieldErrors) {
        super("Invalid generation request: " + String.join(", ", fieldErrors.keySet()));
        this.fieldErrors = Collections.unmodifiableMap(new LinkedHashMap<>(fieldErrors));
    }

    public Map<String, String> getFieldErrors() {
        return fieldErrors;
    }
}
