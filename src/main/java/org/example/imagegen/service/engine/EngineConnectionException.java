package org.example.imagegen.service.engine;

/**
 * The engine could not be reached or failed server-side. Submissions that hit
 * this are retried with backoff.
 */
public class EngineConnectionException extends GenerationEngineException {

    public EngineConnectionException(String message) {
        super(message);
    }

    public EngineConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
