package org.example.imagegen.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.imagegen.service.engine.ComfyUIEngineClient;
import org.example.imagegen.service.engine.GenerationEngineClient;
import org.example.imagegen.service.engine.MockFailureMode;
import org.example.imagegen.service.engine.MockGenerationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.nio.file.Paths;
import java.util.List;

/**
 * Selects the generation engine: the ComfyUI HTTP client or the in-process
 * mock used by tests and local runs.
 */
@Configuration
public class GenerationEngineConfig {

    private static final Logger log = LoggerFactory.getLogger(GenerationEngineConfig.class);

    @Value("${engine.backend:comfyui}")
    private String backend;

    // ComfyUI
    @Value("${comfyui.base-url:http://localhost:8188}")
    private String comfyuiBaseUrl;

    @Value("${comfyui.request-timeout-seconds:10}")
    private int comfyuiRequestTimeoutSeconds;

    @Value("${comfyui.download-timeout-seconds:30}")
    private int comfyuiDownloadTimeoutSeconds;

    // Mock engine
    @Value("${mock-engine.output-dir:./data/mock-engine/output}")
    private String mockOutputDir;

    @Value("${mock-engine.fixture:classpath:mock-engine/fixture.png}")
    private String mockFixture;

    @Value("${mock-engine.pending-polls:2}")
    private int mockPendingPolls;

    @Value("${mock-engine.failure-mode:none}")
    private String mockFailureMode;

    @Value("${mock-engine.checkpoints:test_checkpoint.safetensors,mock_model_v1.ckpt}")
    private List<String> mockCheckpoints;

    @Value("${mock-engine.loras:test_lora.safetensors,mock_lora_v1.safetensors}")
    private List<String> mockLoras;

    @Bean
    public GenerationEngineClient generationEngineClient(ObjectMapper objectMapper, ResourceLoader resourceLoader) {
        log.info("Configuring generation engine: {}", backend);
        return switch (backend.trim().toLowerCase()) {
            case "mock" -> new MockGenerationEngine(
                    Paths.get(mockOutputDir),
                    resourceLoader.getResource(mockFixture),
                    mockPendingPolls,
                    MockFailureMode.fromConfig(mockFailureMode),
                    mockCheckpoints,
                    mockLoras);
            case "comfyui" -> new ComfyUIEngineClient(
                    comfyuiBaseUrl,
                    comfyuiRequestTimeoutSeconds,
                    comfyuiDownloadTimeoutSeconds,
                    objectMapper);
            default -> {
                log.warn("Unknown engine backend '{}', falling back to ComfyUI", backend);
                yield new ComfyUIEngineClient(
                        comfyuiBaseUrl,
                        comfyuiRequestTimeoutSeconds,
                        comfyuiDownloadTimeoutSeconds,
                        objectMapper);
            }
        };
    }
}
