package org.example.imagegen.model;

import java.util.List;
import java.util.Map;

public record CreateGenerationJobRequest(
        String userId,
        String prompt,
        String negativePrompt,
        String checkpointModel,
        List<LoraSelection> loraModels,
        Integer width,
        Integer height,
        Integer batchSize,
        Map<String, Object> samplerParams
) {
    public CreateGenerationJobRequest {
        loraModels = loraModels == null ? List.of() : loraModels;
        samplerParams = samplerParams == null ? Map.of() : samplerParams;
    }
}
