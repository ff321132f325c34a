package org.example.imagegen.controller;

import org.example.imagegen.entity.GenerationJobEntity;
import org.example.imagegen.entity.GenerationJobStatus;
import org.example.imagegen.model.CreateGenerationJobRequest;
import org.example.imagegen.model.GenerationJobPage;
import org.example.imagegen.model.GenerationJobView;
import org.example.imagegen.service.GenerationJobService;
import org.example.imagegen.service.JobStatusStreamService;
import org.example.imagegen.service.JobValidationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Map;

/**
 * Generation job API: submit, inspect, list, cancel and stream status.
 */
@RestController
@RequestMapping("/api/generation/jobs")
public class GenerationJobController {

    private final GenerationJobService generationJobService;
    private final JobStatusStreamService jobStatusStreamService;

    public GenerationJobController(
            GenerationJobService generationJobService,
            JobStatusStreamService jobStatusStreamService) {
        this.generationJobService = generationJobService;
        this.jobStatusStreamService = jobStatusStreamService;
    }

    @PostMapping
    public ResponseEntity<GenerationJobView> createJob(@RequestBody CreateGenerationJobRequest request) {
        GenerationJobEntity job = generationJobService.createJob(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(generationJobService.toView(job));
    }

    @GetMapping("/{jobId}")
    public GenerationJobView getJob(@PathVariable String jobId) {
        return generationJobService.toView(generationJobService.getJob(jobId));
    }

    @GetMapping
    public GenerationJobPage listJobs(
            @RequestParam("user_id") String userId,
            @RequestParam(value = "status", required = false) String status,
            @RequestParam(value = "page", defaultValue = "0") int page,
            @RequestParam(value = "size", defaultValue = "20") int size) {
        return generationJobService.listJobs(userId, parseStatus(status), page, size);
    }

    /**
     * Cancel a job that has not finished yet. Returns 409 when it already has.
     */
    @PostMapping("/{jobId}/cancel")
    public GenerationJobView cancelJob(
            @PathVariable String jobId,
            @RequestParam(value = "user_id", required = false) String userId) {
        return generationJobService.toView(generationJobService.cancelJob(jobId, userId));
    }

    @GetMapping(value = "/{jobId}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamEvents(@PathVariable String jobId) {
        return jobStatusStreamService.open(jobId);
    }

    /**
     * One stream for several jobs, e.g. {@code ?job_ids=a,b,c}. Completes after
     * every listed job has reached a terminal status.
     */
    @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamEventsForJobs(@RequestParam("job_ids") List<String> jobIds) {
        return jobStatusStreamService.openMany(jobIds);
    }

    private static GenerationJobStatus parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        try {
            return GenerationJobStatus.valueOf(status.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new JobValidationException(Map.of("status", "unknown status '" + status.trim() + "'"));
        }
    }
}
