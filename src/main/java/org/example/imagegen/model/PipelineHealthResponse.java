package org.example.imagegen.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDateTime;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PipelineHealthResponse(
        String status,
        LocalDateTime asOf,
        EngineHealth engine,
        WorkerHealth workers,
        long openTasks,
        GenerationJobCounts jobs
) {
    public record EngineHealth(
            String name,
            boolean available,
            Integer queueRunning,
            Integer queuePending,
            List<String> checkpoints,
            List<String> loras
    ) {
    }

    public record WorkerHealth(String workerId, int threads, boolean running, int busy) {
    }
}
