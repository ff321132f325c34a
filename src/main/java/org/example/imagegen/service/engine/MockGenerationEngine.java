package org.example.imagegen.service.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

/**
 * Deterministic in-process stand-in for ComfyUI.
 *
 * <p>Every submission copies the fixture image into the output directory as
 * {@code {prefix}_{counter:05d}_.png}, one file per batch item. A job reports
 * pending for the configured number of polls and then completes. Tests can
 * switch failure modes, force completion of a ref, and inspect per-ref call
 * counts.
 */
public class MockGenerationEngine implements GenerationEngineClient {

    private static final Logger log = LoggerFactory.getLogger(MockGenerationEngine.class);

    static final String DEFAULT_PREFIX = "mock_gen";
    static final String INTERRUPTED_MESSAGE = "Interrupted by user";

    private final Path outputDir;
    private final Resource fixture;
    private final List<String> checkpoints;
    private final List<String> loras;

    private final Map<String, MockJob> jobs = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> pollCounts = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> cancelCounts = new ConcurrentHashMap<>();
    private final AtomicInteger submitAttempts = new AtomicInteger();
    private final AtomicLong fileCounter = new AtomicLong();

    private volatile int pendingPolls;
    private volatile MockFailureMode failureMode;
    private volatile byte[] fixtureBytes;

    public MockGenerationEngine(
            Path outputDir,
            Resource fixture,
            int pendingPolls,
            MockFailureMode failureMode,
            List<String> checkpoints,
            List<String> loras) {
        this.outputDir = outputDir;
        this.fixture = fixture;
        this.pendingPolls = Math.max(0, pendingPolls);
        this.failureMode = failureMode == null ? MockFailureMode.NONE : failureMode;
        this.checkpoints = checkpoints == null ? List.of() : List.copyOf(checkpoints);
        this.loras = loras == null ? List.of() : List.copyOf(loras);
        log.info("Mock generation engine writing to {} (pendingPolls={}, failureMode={})",
                outputDir, this.pendingPolls, this.failureMode);
    }

    @Override
    public String submit(ObjectNode workflow) throws GenerationEngineException {
        submitAttempts.incrementAndGet();
        switch (failureMode) {
            case CONNECTION -> throw new EngineConnectionException("Connection refused: mock engine is unreachable");
            case MODEL_NOT_FOUND -> throw new EngineFatalException(
                    "Value not in list: ckpt_name '" + checkpointOf(workflow) + "' not in available checkpoints");
            case OUT_OF_MEMORY -> throw new EngineFatalException(
                    "CUDA out of memory. Tried to allocate 2.00 GiB");
            default -> {
            }
        }

        String prefix = extractFilenamePrefix(workflow);
        int batchSize = extractBatchSize(workflow);
        String ref = UUID.randomUUID().toString();
        List<EngineOutput> outputs = new ArrayList<>();
        try {
            Files.createDirectories(outputDir);
            byte[] image = loadFixture();
            for (int i = 0; i < batchSize; i++) {
                String filename = String.format("%s_%05d_.png", prefix, fileCounter.incrementAndGet());
                Files.write(outputDir.resolve(filename), image);
                outputs.add(new EngineOutput(filename, "", "output"));
            }
        } catch (IOException e) {
            throw new EngineFatalException("Mock engine failed to write output: " + e.getMessage(), e);
        }

        jobs.put(ref, new MockJob(ref, outputs));
        log.debug("Mock engine accepted prompt {} with {} output(s)", ref, outputs.size());
        return ref;
    }

    @Override
    public EnginePollResult poll(String ref) {
        int pollNumber = pollCounts.computeIfAbsent(ref, key -> new AtomicInteger()).incrementAndGet();
        MockJob job = jobs.get(ref);
        if (job == null) {
            return EnginePollResult.failed("Unknown prompt id: " + ref);
        }
        synchronized (job) {
            if (job.forced) {
                return EnginePollResult.completed(job.outputs);
            }
            if (job.cancelled) {
                return EnginePollResult.failed(INTERRUPTED_MESSAGE);
            }
            if (job.completed || pollNumber > pendingPolls) {
                job.completed = true;
                return EnginePollResult.completed(job.outputs);
            }
        }
        return EnginePollResult.pending();
    }

    @Override
    public boolean cancel(String ref) {
        cancelCounts.computeIfAbsent(ref, key -> new AtomicInteger()).incrementAndGet();
        MockJob job = jobs.get(ref);
        if (job == null) {
            return false;
        }
        synchronized (job) {
            if (!job.completed) {
                job.cancelled = true;
            }
        }
        return true;
    }

    @Override
    public byte[] download(EngineOutput output) throws GenerationEngineException {
        Path file = output.subfolder().isBlank()
                ? outputDir.resolve(output.filename())
                : outputDir.resolve(output.subfolder()).resolve(output.filename());
        try {
            return Files.readAllBytes(file);
        } catch (IOException e) {
            throw new EngineFatalException("Mock engine output not found: " + output.filename(), e);
        }
    }

    @Override
    public EngineQueueInfo queueInfo() {
        int running = 0;
        int pending = 0;
        for (MockJob job : jobs.values()) {
            synchronized (job) {
                if (job.completed || job.cancelled || job.forced) {
                    continue;
                }
            }
            if (pollCount(job.ref) > 0) {
                running++;
            } else {
                pending++;
            }
        }
        return EngineQueueInfo.of(running, pending);
    }

    @Override
    public EngineCapabilities capabilities() {
        return new EngineCapabilities(checkpoints, loras);
    }

    @Override
    public boolean isAvailable() {
        return failureMode != MockFailureMode.CONNECTION;
    }

    @Override
    public String getEngineName() {
        return "mock";
    }

    /**
     * Make the ref report completion on the next poll, even if it was cancelled.
     */
    public void forceComplete(String ref) {
        MockJob job = jobs.get(ref);
        if (job == null) {
            throw new IllegalArgumentException("Unknown prompt id: " + ref);
        }
        synchronized (job) {
            job.forced = true;
            job.completed = true;
        }
    }

    /**
     * Forget every prompt, reset counters and delete generated files.
     */
    public void reset() {
        jobs.clear();
        pollCounts.clear();
        cancelCounts.clear();
        submitAttempts.set(0);
        fileCounter.set(0);
        failureMode = MockFailureMode.NONE;
        if (Files.isDirectory(outputDir)) {
            try (Stream<Path> files = Files.list(outputDir)) {
                files.filter(Files::isRegularFile).forEach(this::deleteQuietly);
            } catch (IOException e) {
                log.warn("Failed to clean mock engine output dir {}: {}", outputDir, e.getMessage());
            }
        }
    }

    public void setFailureMode(MockFailureMode failureMode) {
        this.failureMode = failureMode == null ? MockFailureMode.NONE : failureMode;
    }

    public MockFailureMode getFailureMode() {
        return failureMode;
    }

    public void setPendingPolls(int pendingPolls) {
        this.pendingPolls = Math.max(0, pendingPolls);
    }

    public int getPendingPolls() {
        return pendingPolls;
    }

    public int submitCount() {
        return submitAttempts.get();
    }

    public int pollCount(String ref) {
        AtomicInteger count = pollCounts.get(ref);
        return count == null ? 0 : count.get();
    }

    public int cancelCount(String ref) {
        AtomicInteger count = cancelCounts.get(ref);
        return count == null ? 0 : count.get();
    }

    public List<String> knownRefs() {
        return List.copyOf(jobs.keySet());
    }

    public List<EngineOutput> outputsOf(String ref) {
        MockJob job = jobs.get(ref);
        return job == null ? List.of() : job.outputs;
    }

    public Path getOutputDir() {
        return outputDir;
    }

    static String extractFilenamePrefix(JsonNode workflow) {
        Iterator<JsonNode> nodes = workflow.elements();
        while (nodes.hasNext()) {
            JsonNode node = nodes.next();
            if ("SaveImage".equals(node.path("class_type").asText())) {
                String prefix = node.path("inputs").path("filename_prefix").asText("");
                if (!prefix.isBlank()) {
                    return prefix;
                }
            }
        }
        return DEFAULT_PREFIX;
    }

    static int extractBatchSize(JsonNode workflow) {
        Iterator<JsonNode> nodes = workflow.elements();
        while (nodes.hasNext()) {
            JsonNode node = nodes.next();
            if ("EmptyLatentImage".equals(node.path("class_type").asText())) {
                return Math.max(1, node.path("inputs").path("batch_size").asInt(1));
            }
        }
        return 1;
    }

    private static String checkpointOf(JsonNode workflow) {
        Iterator<JsonNode> nodes = workflow.elements();
        while (nodes.hasNext()) {
            JsonNode node = nodes.next();
            if ("CheckpointLoaderSimple".equals(node.path("class_type").asText())) {
                return node.path("inputs").path("ckpt_name").asText("");
            }
        }
        return "";
    }

    private byte[] loadFixture() throws IOException {
        byte[] cached = fixtureBytes;
        if (cached == null) {
            try (InputStream in = fixture.getInputStream()) {
                cached = in.readAllBytes();
            }
            fixtureBytes = cached;
        }
        return cached;
    }

    private void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Failed to delete mock output {}: {}", file, e.getMessage());
        }
    }

    private static final class MockJob {
        private final String ref;
        private final List<EngineOutput> outputs;
        private boolean completed;
        private boolean cancelled;
        private boolean forced;

        private MockJob(String ref, List<EngineOutput> outputs) {
            this.ref = ref;
            this.outputs = List.copyOf(outputs);
        }
    }
}
