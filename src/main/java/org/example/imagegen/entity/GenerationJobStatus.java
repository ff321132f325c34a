package org.example.imagegen.entity;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

public enum GenerationJobStatus {
    PENDING,
    QUEUED,
    RUNNING,
    PROCESSING,
    COMPLETED,
    FAILED,
    CANCELLED;

    private static final Map<String, GenerationJobStatus> BY_WIRE_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(GenerationJobStatus::wireName, Function.identity()));

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Forward edges of the job state machine. Terminal states have none; every
     * non-terminal state may fail or be cancelled.
     */
    public boolean canTransitionTo(GenerationJobStatus next) {
        if (next == null || isTerminal()) {
            return false;
        }
        if (next == FAILED || next == CANCELLED) {
            return true;
        }
        return switch (this) {
            case PENDING -> next == QUEUED;
            case QUEUED -> next == RUNNING;
            case RUNNING -> next == PROCESSING;
            case PROCESSING -> next == COMPLETED;
            default -> false;
        };
    }

    public static Set<GenerationJobStatus> active() {
        return EnumSet.of(PENDING, QUEUED, RUNNING, PROCESSING);
    }

    public String wireName() {
        return name().toLowerCase();
    }

    /**
     * @throws IllegalArgumentException for anything that is not a wire name
     */
    public static GenerationJobStatus fromWire(String wireName) {
        GenerationJobStatus status = wireName == null ? null : BY_WIRE_NAME.get(wireName);
        if (status == null) {
            throw new IllegalArgumentException("Unknown job status: " + wireName);
        }
        return status;
    }
}
