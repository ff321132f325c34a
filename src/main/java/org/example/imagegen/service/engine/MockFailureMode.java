package org.example.imagegen.service.engine;

public enum MockFailureMode {
    NONE,
    CONNECTION,
    MODEL_NOT_FOUND,
    OUT_OF_MEMORY;

    public static MockFailureMode fromConfig(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        return valueOf(value.trim().toUpperCase().replace('-', '_'));
    }
}
