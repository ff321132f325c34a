package org.example.imagegen.entity;

public enum GenerationTaskStatus {
    AVAILABLE,
    CLAIMED,
    DONE
}
