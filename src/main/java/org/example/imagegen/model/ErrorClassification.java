package org.example.imagegen.model;

import java.util.List;

public record ErrorClassification(ErrorCategory category, String message, List<String> recoverySuggestions) {

    public static final String WORKER_LOST_MESSAGE = "Generation was interrupted because its worker stopped.";

    public ErrorClassification {
        recoverySuggestions = recoverySuggestions == null ? List.of() : List.copyOf(recoverySuggestions);
    }

    /**
     * A job whose worker went away mid-run, found by a later delivery or the
     * startup sweep.
     */
    public static ErrorClassification workerLost() {
        return new ErrorClassification(ErrorCategory.UNKNOWN, WORKER_LOST_MESSAGE, List.of("Submit the generation again"));
    }
}
