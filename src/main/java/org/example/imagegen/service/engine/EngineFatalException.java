package org.example.imagegen.service.engine;

/**
 * The engine rejected the work itself (missing model, malformed workflow,
 * out of memory). Never retried.
 */
public class EngineFatalException extends GenerationEngineException {

    public EngineFatalException(String message) {
        super(message);
    }

    public EngineFatalException(String message, Throwable cause) {
        super(message, cause);
    }
}
