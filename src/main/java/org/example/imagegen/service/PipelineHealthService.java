package org.example.imagegen.service;

import org.example.imagegen.entity.GenerationJobStatus;
import org.example.imagegen.model.GenerationJobCounts;
import org.example.imagegen.model.PipelineHealthResponse;
import org.example.imagegen.repository.GenerationJobRepository;
import org.example.imagegen.service.engine.EngineCapabilities;
import org.example.imagegen.service.engine.EngineQueueInfo;
import org.example.imagegen.service.engine.GenerationEngineClient;
import org.example.imagegen.service.engine.GenerationEngineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;

@Service
public class PipelineHealthService {

    private static final Logger log = LoggerFactory.getLogger(PipelineHealthService.class);

    private final GenerationEngineClient engineClient;
    private final GenerationWorkerPool workerPool;
    private final GenerationTaskQueue taskQueue;
    private final GenerationJobRepository jobRepository;

    public PipelineHealthService(
            GenerationEngineClient engineClient,
            GenerationWorkerPool workerPool,
            GenerationTaskQueue taskQueue,
            GenerationJobRepository jobRepository) {
        this.engineClient = engineClient;
        this.workerPool = workerPool;
        this.taskQueue = taskQueue;
        this.jobRepository = jobRepository;
    }

    public PipelineHealthResponse snapshot() {
        boolean available = engineClient.isAvailable();
        Integer queueRunning = null;
        Integer queuePending = null;
        EngineCapabilities capabilities = null;
        if (available) {
            try {
                EngineQueueInfo queueInfo = engineClient.queueInfo();
                queueRunning = queueInfo.running();
                queuePending = queueInfo.pending();
                capabilities = engineClient.capabilities();
            } catch (GenerationEngineException e) {
                log.debug("Engine details unavailable for health check: {}", e.getMessage());
            }
        }

        PipelineHealthResponse.EngineHealth engine = new PipelineHealthResponse.EngineHealth(
                engineClient.getEngineName(),
                available,
                queueRunning,
                queuePending,
                capabilities == null ? null : capabilities.checkpoints(),
                capabilities == null ? null : capabilities.loras());
        PipelineHealthResponse.WorkerHealth workers = new PipelineHealthResponse.WorkerHealth(
                workerPool.getWorkerId(),
                workerPool.getThreads(),
                workerPool.isRunning(),
                workerPool.getBusyWorkers());

        GenerationJobCounts counts = GenerationJobCounts.of(
                jobRepository.countByStatus(GenerationJobStatus.PENDING),
                jobRepository.countByStatus(GenerationJobStatus.QUEUED),
                jobRepository.countByStatus(GenerationJobStatus.RUNNING),
                jobRepository.countByStatus(GenerationJobStatus.PROCESSING),
                jobRepository.countByStatus(GenerationJobStatus.COMPLETED),
                jobRepository.countByStatus(GenerationJobStatus.FAILED),
                jobRepository.countByStatus(GenerationJobStatus.CANCELLED));

        String status = available && workers.running() ? "UP" : "DEGRADED";
        return new PipelineHealthResponse(status, LocalDateTime.now(), engine, workers, taskQueue.countOpen(), counts);
    }
}
