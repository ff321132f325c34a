package org.example.imagegen.service.engine;

public record EngineQueueInfo(int running, int pending) {

    public static EngineQueueInfo of(int running, int pending) {
        return new EngineQueueInfo(Math.max(0, running), Math.max(0, pending));
    }
}
