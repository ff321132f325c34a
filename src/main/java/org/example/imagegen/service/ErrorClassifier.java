package org.example.imagegen.service;

import org.example.imagegen.model.ErrorCategory;
import org.example.imagegen.model.ErrorClassification;
import org.example.imagegen.service.engine.EngineConnectionException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Turns generation failures into a category, a user-facing message and
 * recovery suggestions that are stored on the job row.
 */
@Service
public class ErrorClassifier {

    private static final int MAX_DETAIL_LENGTH = 500;

    public ErrorClassification classify(Throwable error) {
        if (error instanceof TimeoutException) {
            return forCategory(ErrorCategory.TIMEOUT);
        }
        if (error instanceof ArtifactStorageException) {
            return forCategory(ErrorCategory.STORAGE);
        }
        if (error instanceof JobValidationException) {
            return forCategory(ErrorCategory.VALIDATION);
        }
        ErrorCategory byMessage = categorize(error == null ? null : error.getMessage());
        if (byMessage == ErrorCategory.UNKNOWN && error instanceof EngineConnectionException) {
            return forCategory(ErrorCategory.CONNECTION);
        }
        return forCategory(byMessage);
    }

    /**
     * Classify a failure reported by the engine itself (no exception).
     */
    public ErrorClassification classify(String engineMessage) {
        return forCategory(categorize(engineMessage));
    }

    /**
     * Job-row error text: the user-facing message followed by a trimmed
     * technical detail.
     */
    public String describe(ErrorClassification classification, String detail) {
        String safeDetail = safeDetail(detail);
        if (safeDetail == null) {
            return classification.message();
        }
        return classification.message() + " Details: " + safeDetail;
    }

    ErrorCategory categorize(String message) {
        if (message == null || message.isBlank()) {
            return ErrorCategory.UNKNOWN;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        if (lower.contains("out of memory") || lower.contains("outofmemory") || lower.contains("allocation failed")) {
            return ErrorCategory.RESOURCE_EXHAUSTED;
        }
        if ((lower.contains("model") || lower.contains("ckpt_name") || lower.contains("lora_name"))
                && (lower.contains("not found") || lower.contains("not in list") || lower.contains("missing"))) {
            return ErrorCategory.MODEL_NOT_FOUND;
        }
        if (lower.contains("timed out") || lower.contains("timeout")) {
            return ErrorCategory.TIMEOUT;
        }
        if (lower.contains("connection") || lower.contains("connect") || lower.contains("unreachable")) {
            return ErrorCategory.CONNECTION;
        }
        if (lower.contains("disk") && lower.contains("space")) {
            return ErrorCategory.STORAGE;
        }
        if (lower.contains("invalid") || lower.contains("validation") || lower.contains("prompt_outputs_failed")) {
            return ErrorCategory.VALIDATION;
        }
        return ErrorCategory.UNKNOWN;
    }

    private ErrorClassification forCategory(ErrorCategory category) {
        return switch (category) {
            case CONNECTION -> new ErrorClassification(category,
                    "Image generation service is temporarily unavailable.",
                    List.of(
                            "Try again in a few minutes",
                            "Check that the generation engine is running and reachable"));
            case VALIDATION -> new ErrorClassification(category,
                    "Generation settings were rejected by the engine.",
                    List.of(
                            "Check the image dimensions and sampler settings",
                            "Remove unusual characters from the prompt",
                            "Try again with default settings"));
            case MODEL_NOT_FOUND -> new ErrorClassification(category,
                    "Selected model is currently unavailable.",
                    List.of(
                            "Choose a different checkpoint model",
                            "Remove LoRA models that are not installed on the engine",
                            "Refresh the model list and try again"));
            case RESOURCE_EXHAUSTED -> new ErrorClassification(category,
                    "The generation engine ran out of memory.",
                    List.of(
                            "Reduce the image width and height",
                            "Lower the batch size",
                            "Try again when the engine is less busy"));
            case TIMEOUT -> new ErrorClassification(category,
                    "Generation did not finish within the allowed time.",
                    List.of(
                            "Try again later when the service is less busy",
                            "Reduce the number of sampling steps",
                            "Use a smaller image size"));
            case STORAGE -> new ErrorClassification(category,
                    "Unable to save the generated images.",
                    List.of(
                            "Try again in a few minutes",
                            "Contact support if the problem persists"));
            case UNKNOWN -> new ErrorClassification(category,
                    "Image generation failed unexpectedly.",
                    List.of(
                            "Try again",
                            "Simplify the prompt or settings",
                            "Contact support if the problem persists"));
        };
    }

    private static String safeDetail(String detail) {
        if (detail == null || detail.isBlank()) {
            return null;
        }
        String trimmed = detail.trim();
        if (trimmed.length() > MAX_DETAIL_LENGTH) {
            return trimmed.substring(0, MAX_DETAIL_LENGTH) + "...";
        }
        return trimmed;
    }
}
