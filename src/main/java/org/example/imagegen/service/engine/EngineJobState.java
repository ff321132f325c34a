package org.example.imagegen.service.engine;

public enum EngineJobState {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    UNKNOWN
}
