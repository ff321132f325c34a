package org.example.imagegen.model;

import java.util.List;
import java.util.Map;

/**
 * Engine-facing inputs for one job, with model names already resolved to
 * filenames.
 */
public record WorkflowParameters(
        String prompt,
        String negativePrompt,
        String checkpointFilename,
        List<ResolvedLora> loras,
        int width,
        int height,
        int batchSize,
        Map<String, Object> samplerParams,
        String filenamePrefix
) {
    public WorkflowParameters {
        loras = loras == null ? List.of() : List.copyOf(loras);
        samplerParams = samplerParams == null ? Map.of() : samplerParams;
    }

    public record ResolvedLora(String filename, double strengthModel, double strengthClip) {
    }
}
