package org.example.imagegen.service;

/**
 * Organizing or thumbnailing a finished generation failed.
 */
public class ArtifactStorageException extends RuntimeException {

    public ArtifactStorageException(String message) {
        super(message);
    }

    public ArtifactStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
