package org.example.imagegen.service.engine;

import java.util.List;

public record EnginePollResult(EngineJobState state, List<EngineOutput> outputs, String errorMessage) {

    public EnginePollResult {
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
    }

    public static EnginePollResult pending() {
        return new EnginePollResult(EngineJobState.PENDING, List.of(), null);
    }

    public static EnginePollResult running() {
        return new EnginePollResult(EngineJobState.RUNNING, List.of(), null);
    }

    public static EnginePollResult unknown() {
        return new EnginePollResult(EngineJobState.UNKNOWN, List.of(), null);
    }

    public static EnginePollResult completed(List<EngineOutput> outputs) {
        return new EnginePollResult(EngineJobState.COMPLETED, outputs, null);
    }

    public static EnginePollResult failed(String errorMessage) {
        return new EnginePollResult(EngineJobState.FAILED, List.of(), errorMessage);
    }

    public boolean isFinished() {
        return state == EngineJobState.COMPLETED || state == EngineJobState.FAILED;
    }
}
