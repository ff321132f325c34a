package org.example.imagegen.service.engine;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Abstraction over the external image generation engine (ComfyUI, or the
 * in-process mock used by tests and local runs).
 */
public interface GenerationEngineClient {

    /**
     * Submit an API-format workflow graph.
     *
     * @param workflow node id to node definition
     * @return the engine's reference for the submitted prompt
     * @throws EngineConnectionException when the engine cannot be reached or answers 5xx
     * @throws EngineFatalException when the engine rejects the workflow
     */
    String submit(ObjectNode workflow) throws GenerationEngineException;

    /**
     * Single non-blocking status check for a previously submitted prompt.
     */
    EnginePollResult poll(String ref) throws GenerationEngineException;

    /**
     * Best-effort cancellation. Returns true when the engine acknowledged it.
     */
    boolean cancel(String ref) throws GenerationEngineException;

    /**
     * Fetch the bytes of one output reported by {@link #poll(String)}.
     */
    byte[] download(EngineOutput output) throws GenerationEngineException;

    EngineQueueInfo queueInfo() throws GenerationEngineException;

    EngineCapabilities capabilities() throws GenerationEngineException;

    /**
     * Check if the engine is reachable.
     *
     * @return true if the engine can accept work
     */
    boolean isAvailable();

    /**
     * Get the name of this engine for logging and health output.
     *
     * @return engine name (e.g., "comfyui", "mock")
     */
    String getEngineName();
}
