package org.example.imagegen.service.engine;

/**
 * Base type for failures reported by a generation engine.
 */
public class GenerationEngineException extends Exception {

    public GenerationEngineException(String message) {
        super(message);
    }

    public GenerationEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
