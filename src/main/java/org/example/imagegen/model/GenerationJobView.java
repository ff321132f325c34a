package org.example.imagegen.model;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

public record GenerationJobView(
        String id,
        String userId,
        String status,
        String prompt,
        String negativePrompt,
        String checkpointModel,
        List<LoraSelection> loraModels,
        int width,
        int height,
        int batchSize,
        Map<String, Object> samplerParams,
        String externalJobRef,
        String contentId,
        List<String> outputPaths,
        List<String> thumbnailPaths,
        String errorMessage,
        List<String> recoverySuggestions,
        LocalDateTime createdAt,
        LocalDateTime startedAt,
        LocalDateTime completedAt,
        LocalDateTime updatedAt
) {
}
