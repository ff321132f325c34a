package org.example.imagegen.service.engine;

public record EngineOutput(String filename, String subfolder, String type) {

    public EngineOutput {
        subfolder = subfolder == null ? "" : subfolder;
        type = type == null || type.isBlank() ? "output" : type;
    }
}
