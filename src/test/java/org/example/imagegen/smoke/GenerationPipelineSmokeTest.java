package org.example.imagegen.smoke;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.imagegen.entity.GenerationJobEntity;
import org.example.imagegen.entity.GenerationJobStatus;
import org.example.imagegen.entity.GenerationTaskEntity;
import org.example.imagegen.entity.GenerationTaskStatus;
import org.example.imagegen.model.ErrorClassification;
import org.example.imagegen.model.StatusEvent;
import org.example.imagegen.repository.ContentRecordRepository;
import org.example.imagegen.repository.GenerationJobRepository;
import org.example.imagegen.repository.GenerationTaskRepository;
import org.example.imagegen.service.ArtifactStorageService;
import org.example.imagegen.service.JobStatusBroadcaster;
import org.example.imagegen.service.engine.GenerationEngineClient;
import org.example.imagegen.service.engine.MockFailureMode;
import org.example.imagegen.service.engine.MockGenerationEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoSpyBean;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.file.Files;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;

import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class GenerationPipelineSmokeTest {

    private static final long WAIT_MILLIS = 15_000;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private GenerationEngineClient engineClient;

    @Autowired
    private GenerationJobRepository jobRepository;

    @Autowired
    private ContentRecordRepository contentRecordRepository;

    @Autowired
    private GenerationTaskRepository taskRepository;

    @Autowired
    private ArtifactStorageService artifactStorage;

    @MockitoSpyBean
    private JobStatusBroadcaster broadcaster;

    private MockGenerationEngine mockEngine;

    @BeforeEach
    void setUp() {
        mockEngine = (MockGenerationEngine) engineClient;
        mockEngine.reset();
        mockEngine.setPendingPolls(1);
    }

    @Test
    void submittedJob_runsToCompletionThroughEveryStatus() throws Exception {
        String jobId = submit("smoke-user", "A scenic landscape");

        GenerationJobEntity job = awaitJob(jobId, row -> row.getStatus().isTerminal());

        assertEquals(GenerationJobStatus.COMPLETED, job.getStatus());
        assertNotNull(job.getContentId());
        assertNotNull(job.getStartedAt());
        assertNotNull(job.getCompletedAt());
        assertTrue(contentRecordRepository.findByJobId(jobId).isPresent());
        assertEquals(List.of("pending", "queued", "running", "processing", "completed"),
                awaitEventStatuses(jobId, "completed"));

        String body = mockMvc.perform(get("/api/generation/jobs/" + jobId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status", is("completed")))
                .andExpect(jsonPath("$.content_id", is(job.getContentId())))
                .andReturn().getResponse().getContentAsString();
        JsonNode view = objectMapper.readTree(body);
        assertEquals(1, view.path("output_paths").size());
        assertFalse(view.path("thumbnail_paths").isEmpty());
        assertTrue(Files.isRegularFile(artifactStorage.resolve(view.path("output_paths").get(0).asText())));

        mockMvc.perform(get("/api/generation/jobs").param("user_id", "smoke-user").param("status", "completed"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items[0].id", is(jobId)));
    }

    @Test
    void cancelledJob_staysCancelledAndProducesNoContent() throws Exception {
        mockEngine.setPendingPolls(1_000);
        String jobId = submit("cancel-user", "A storm over the harbor");
        GenerationJobEntity processing = awaitJob(jobId,
                row -> row.getStatus() == GenerationJobStatus.PROCESSING || row.getStatus().isTerminal());
        assertEquals(GenerationJobStatus.PROCESSING, processing.getStatus());
        String ref = processing.getExternalJobRef();

        mockMvc.perform(post("/api/generation/jobs/" + jobId + "/cancel").param("user_id", "cancel-user"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status", is("cancelled")));
        mockMvc.perform(post("/api/generation/jobs/" + jobId + "/cancel").param("user_id", "cancel-user"))
                .andExpect(status().isConflict());

        mockEngine.forceComplete(ref);
        Thread.sleep(300);

        GenerationJobEntity job = jobRepository.findById(jobId).orElseThrow();
        assertEquals(GenerationJobStatus.CANCELLED, job.getStatus());
        assertNull(job.getContentId());
        assertTrue(contentRecordRepository.findByJobId(jobId).isEmpty());
        assertTrue(mockEngine.cancelCount(ref) >= 1);
        List<String> statuses = awaitEventStatuses(jobId, "cancelled");
        assertEquals("cancelled", statuses.get(statuses.size() - 1));
        assertFalse(statuses.contains("completed"));
    }

    @Test
    void unreachableEngine_failsJobWithSuggestions() throws Exception {
        mockEngine.setFailureMode(MockFailureMode.CONNECTION);
        String jobId = submit("failing-user", "A lighthouse at dusk");

        GenerationJobEntity job = awaitJob(jobId, row -> row.getStatus().isTerminal());

        assertEquals(GenerationJobStatus.FAILED, job.getStatus());
        assertNotNull(job.getErrorMessage());
        assertNull(job.getContentId());
        assertEquals(3, mockEngine.submitCount());
        mockMvc.perform(get("/api/generation/jobs/" + jobId))
                .andExpect(jsonPath("$.status", is("failed")))
                .andExpect(jsonPath("$.recovery_suggestions[0]").exists());
    }

    @Test
    void runningJobOfDeadWorker_isFailedWhenItsLeaseExpires() throws Exception {
        GenerationJobEntity orphan = new GenerationJobEntity("orphan-user", "A quiet forest", "m1", 512, 512, 1);
        orphan.setStatus(GenerationJobStatus.RUNNING);
        orphan = jobRepository.saveAndFlush(orphan);
        GenerationTaskEntity task = new GenerationTaskEntity(orphan.getId());
        task.setStatus(GenerationTaskStatus.CLAIMED);
        task.setDeliveryCount(1);
        task.setLeaseOwner("dead-worker");
        task.setLeaseExpiresAt(LocalDateTime.now().minusMinutes(1));
        task = taskRepository.saveAndFlush(task);
        String jobId = orphan.getId();

        GenerationJobEntity job = awaitJob(jobId, row -> row.getStatus().isTerminal());

        assertEquals(GenerationJobStatus.FAILED, job.getStatus());
        assertEquals(ErrorClassification.WORKER_LOST_MESSAGE, job.getErrorMessage());
        GenerationTaskEntity redelivered = taskRepository.findById(task.getId()).orElseThrow();
        assertEquals(2, redelivered.getDeliveryCount());
        assertEquals(0, mockEngine.submitCount());
    }

    @Test
    void invalidRequest_isRejectedWithoutCreatingAJob() throws Exception {
        long before = jobRepository.count();

        mockMvc.perform(post("/api/generation/jobs")
                        .contentType("application/json")
                        .content("""
                                {"user_id":"smoke-user","prompt":" ","width":100,"height":512,"checkpoint_model":"missing"}
                                """))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.details.fields.prompt").exists())
                .andExpect(jsonPath("$.details.fields.width").exists())
                .andExpect(jsonPath("$.details.fields.checkpoint_model").exists());

        assertEquals(before, jobRepository.count());
    }

    private String submit(String userId, String prompt) throws Exception {
        String body = mockMvc.perform(post("/api/generation/jobs")
                        .contentType("application/json")
                        .content("""
                                {"user_id":"%s","prompt":"%s","width":512,"height":512,"checkpoint_model":"m1"}
                                """.formatted(userId, prompt)))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(body).path("id").asText();
    }

    private GenerationJobEntity awaitJob(String jobId, Predicate<GenerationJobEntity> condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + WAIT_MILLIS;
        while (System.currentTimeMillis() < deadline) {
            GenerationJobEntity job = jobRepository.findById(jobId).orElse(null);
            if (job != null && condition.test(job)) {
                return job;
            }
            Thread.sleep(25);
        }
        return fail("Timed out waiting on job " + jobId);
    }

    private List<String> awaitEventStatuses(String jobId, String lastStatus) throws InterruptedException {
        long deadline = System.currentTimeMillis() + WAIT_MILLIS;
        List<String> statuses = List.of();
        while (System.currentTimeMillis() < deadline) {
            statuses = publishedEvents(jobId).stream().map(StatusEvent::status).toList();
            if (statuses.contains(lastStatus)) {
                return statuses;
            }
            Thread.sleep(25);
        }
        return fail("Timed out waiting for " + lastStatus + " event on job " + jobId + ", saw " + statuses);
    }

    private List<StatusEvent> publishedEvents(String jobId) {
        return Mockito.mockingDetails(broadcaster).getInvocations().stream()
                .filter(invocation -> invocation.getMethod().getName().equals("publish"))
                .map(invocation -> (StatusEvent) invocation.getArgument(0))
                .filter(event -> event.jobId().equals(jobId))
                .sorted(Comparator.comparing(StatusEvent::timestamp))
                .toList();
    }
}
