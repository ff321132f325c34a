package org.example.imagegen.config;

import org.example.imagegen.entity.ModelType;
import org.example.imagegen.service.ModelCatalogService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Seeds the model catalog from {@code generation.models.*} on startup.
 */
@Component
@Order(1)
public class ModelCatalogInitializer implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(ModelCatalogInitializer.class);

    private final ModelCatalogService modelCatalogService;
    private final GenerationProperties properties;

    public ModelCatalogInitializer(ModelCatalogService modelCatalogService, GenerationProperties properties) {
        this.modelCatalogService = modelCatalogService;
        this.properties = properties;
    }

    @Override
    public void run(String... args) {
        int checkpoints = modelCatalogService.register(ModelType.CHECKPOINT, properties.getModels().getCheckpoints());
        int loras = modelCatalogService.register(ModelType.LORA, properties.getModels().getLoras());
        log.info("Model catalog seeded: {} checkpoint(s), {} LoRA(s) added or updated", checkpoints, loras);
    }
}
