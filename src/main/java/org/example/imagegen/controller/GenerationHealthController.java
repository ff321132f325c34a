package org.example.imagegen.controller;

import org.example.imagegen.model.ModelCatalogEntry;
import org.example.imagegen.model.PipelineHealthResponse;
import org.example.imagegen.service.ModelCatalogService;
import org.example.imagegen.service.PipelineHealthService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/generation")
public class GenerationHealthController {

    private final PipelineHealthService pipelineHealthService;
    private final ModelCatalogService modelCatalogService;

    public GenerationHealthController(
            PipelineHealthService pipelineHealthService,
            ModelCatalogService modelCatalogService) {
        this.pipelineHealthService = pipelineHealthService;
        this.modelCatalogService = modelCatalogService;
    }

    @GetMapping("/health")
    public PipelineHealthResponse health() {
        return pipelineHealthService.snapshot();
    }

    @GetMapping("/models")
    public List<ModelCatalogEntry> models() {
        return modelCatalogService.listActive();
    }
}
