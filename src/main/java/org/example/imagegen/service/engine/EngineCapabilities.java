package org.example.imagegen.service.engine;

import java.util.List;

public record EngineCapabilities(List<String> checkpoints, List<String> loras) {

    public EngineCapabilities {
        checkpoints = checkpoints == null ? List.of() : List.copyOf(checkpoints);
        loras = loras == null ? List.of() : List.copyOf(loras);
    }
}
