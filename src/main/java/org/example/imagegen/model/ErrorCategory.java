package org.example.imagegen.model;

public enum ErrorCategory {
    CONNECTION,
    VALIDATION,
    MODEL_NOT_FOUND,
    RESOURCE_EXHAUSTED,
    TIMEOUT,
    STORAGE,
    UNKNOWN
}
