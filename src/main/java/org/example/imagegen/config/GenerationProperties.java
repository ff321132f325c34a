package org.example.imagegen.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "generation")
public class GenerationProperties {

    private Validation validation = new Validation();
    private Retry retry = new Retry();
    private Worker worker = new Worker();
    private Storage storage = new Storage();
    private Stream stream = new Stream();
    private Models models = new Models();

    public Validation getValidation() {
        return validation;
    }

    public void setValidation(Validation validation) {
        this.validation = validation == null ? new Validation() : validation;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry == null ? new Retry() : retry;
    }

    public Worker getWorker() {
        return worker;
    }

    public void setWorker(Worker worker) {
        this.worker = worker == null ? new Worker() : worker;
    }

    public Storage getStorage() {
        return storage;
    }

    public void setStorage(Storage storage) {
        this.storage = storage == null ? new Storage() : storage;
    }

    public Stream getStream() {
        return stream;
    }

    public void setStream(Stream stream) {
        this.stream = stream == null ? new Stream() : stream;
    }

    public Models getModels() {
        return models;
    }

    public void setModels(Models models) {
        this.models = models == null ? new Models() : models;
    }

    public static class Validation {
        private int maxPromptLength = 2000;
        private int minDimension = 64;
        private int maxDimension = 2048;
        private int dimensionMultiple = 8;
        private int maxBatchSize = 4;

        public int getMaxPromptLength() {
            return maxPromptLength;
        }

        public void setMaxPromptLength(int maxPromptLength) {
            this.maxPromptLength = maxPromptLength;
        }

        public int getMinDimension() {
            return minDimension;
        }

        public void setMinDimension(int minDimension) {
            this.minDimension = minDimension;
        }

        public int getMaxDimension() {
            return maxDimension;
        }

        public void setMaxDimension(int maxDimension) {
            this.maxDimension = maxDimension;
        }

        public int getDimensionMultiple() {
            return dimensionMultiple;
        }

        public void setDimensionMultiple(int dimensionMultiple) {
            this.dimensionMultiple = dimensionMultiple;
        }

        public int getMaxBatchSize() {
            return maxBatchSize;
        }

        public void setMaxBatchSize(int maxBatchSize) {
            this.maxBatchSize = maxBatchSize;
        }
    }

    /**
     * Backoff for transient engine submission failures. Attempt n waits
     * initialDelay * 2^(n-1), capped at maxDelay.
     */
    public static class Retry {
        private int maxAttempts = 3;
        private Duration initialDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(30);

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getInitialDelay() {
            return initialDelay;
        }

        public void setInitialDelay(Duration initialDelay) {
            this.initialDelay = initialDelay;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }
    }

    public static class Worker {
        private boolean enabled = true;
        private int threads = 2;
        private String id;
        private Duration pollInterval = Duration.ofSeconds(1);
        private Duration workflowTimeout = Duration.ofMinutes(10);
        private Duration leaseDuration = Duration.ofMinutes(15);
        private Duration idlePollInterval = Duration.ofSeconds(2);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getThreads() {
            return threads;
        }

        public void setThreads(int threads) {
            this.threads = threads;
        }

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public Duration getWorkflowTimeout() {
            return workflowTimeout;
        }

        public void setWorkflowTimeout(Duration workflowTimeout) {
            this.workflowTimeout = workflowTimeout;
        }

        public Duration getLeaseDuration() {
            return leaseDuration;
        }

        public void setLeaseDuration(Duration leaseDuration) {
            this.leaseDuration = leaseDuration;
        }

        public Duration getIdlePollInterval() {
            return idlePollInterval;
        }

        public void setIdlePollInterval(Duration idlePollInterval) {
            this.idlePollInterval = idlePollInterval;
        }
    }

    public static class Storage {
        private String root = "./data";
        private List<Integer> thumbnailSizes = new ArrayList<>(List.of(150, 300, 600));
        private int primaryThumbnailSize = 300;

        public String getRoot() {
            return root;
        }

        public void setRoot(String root) {
            this.root = root;
        }

        public List<Integer> getThumbnailSizes() {
            return thumbnailSizes;
        }

        public void setThumbnailSizes(List<Integer> thumbnailSizes) {
            this.thumbnailSizes = thumbnailSizes == null ? new ArrayList<>() : thumbnailSizes;
        }

        public int getPrimaryThumbnailSize() {
            return primaryThumbnailSize;
        }

        public void setPrimaryThumbnailSize(int primaryThumbnailSize) {
            this.primaryThumbnailSize = primaryThumbnailSize;
        }
    }

    public static class Stream {
        private Duration emitterTimeout = Duration.ofMinutes(30);

        public Duration getEmitterTimeout() {
            return emitterTimeout;
        }

        public void setEmitterTimeout(Duration emitterTimeout) {
            this.emitterTimeout = emitterTimeout;
        }
    }

    /**
     * Catalog seed. Entries are "name" or "name=filename".
     */
    public static class Models {
        private List<String> checkpoints = new ArrayList<>();
        private List<String> loras = new ArrayList<>();

        public List<String> getCheckpoints() {
            return checkpoints;
        }

        public void setCheckpoints(List<String> checkpoints) {
            this.checkpoints = checkpoints == null ? new ArrayList<>() : checkpoints;
        }

        public List<String> getLoras() {
            return loras;
        }

        public void setLoras(List<String> loras) {
            this.loras = loras == null ? new ArrayList<>() : loras;
        }
    }
}
