package org.example.imagegen.entity;

import jakarta.persistence.*;

import java.time.LocalDateTime;

@Entity
@Table(name = "generation_jobs", indexes = {
        @Index(name = "idx_generation_jobs_user_created", columnList = "userId, createdAt"),
        @Index(name = "idx_generation_jobs_status", columnList = "status")
})
public class GenerationJobEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false, length = 120)
    private String userId;

    @Column(nullable = false, length = 2000)
    private String prompt;

    @Column(length = 2000)
    private String negativePrompt;

    @Column(nullable = false)
    private String checkpointModel;

    // JSON array of {name, strengthModel, strengthClip}
    @Column(name = "lora_models_json", columnDefinition = "TEXT")
    private String loraModelsJson;

    @Column(nullable = false)
    private int width;

    @Column(nullable = false)
    private int height;

    @Column(nullable = false)
    private int batchSize;

    @Column(name = "sampler_params_json", columnDefinition = "TEXT")
    private String samplerParamsJson;

    @Column(length = 200)
    private String externalJobRef;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private GenerationJobStatus status;

    @Column(length = 64)
    private String contentId;

    @Column(name = "output_paths_json", columnDefinition = "TEXT")
    private String outputPathsJson;

    @Column(name = "thumbnail_paths_json", columnDefinition = "TEXT")
    private String thumbnailPathsJson;

    @Column(length = 2000)
    private String errorMessage;

    @Column(name = "recovery_suggestions_json", columnDefinition = "TEXT")
    private String recoverySuggestionsJson;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    private LocalDateTime startedAt;

    private LocalDateTime completedAt;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    @Version
    @Column(nullable = false)
    private long version;

    public GenerationJobEntity() {}

    public GenerationJobEntity(String userId, String prompt, String checkpointModel, int width, int height, int batchSize) {
        this.userId = userId;
        this.prompt = prompt;
        this.checkpointModel = checkpointModel;
        this.width = width;
        this.height = height;
        this.batchSize = batchSize;
        this.status = GenerationJobStatus.PENDING;
        this.createdAt = LocalDateTime.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void touch() {
        this.updatedAt = LocalDateTime.now();
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public String getPrompt() { return prompt; }
    public void setPrompt(String prompt) { this.prompt = prompt; }

    public String getNegativePrompt() { return negativePrompt; }
    public void setNegativePrompt(String negativePrompt) { this.negativePrompt = negativePrompt; }

    public String getCheckpointModel() { return checkpointModel; }
    public void setCheckpointModel(String checkpointModel) { this.checkpointModel = checkpointModel; }

    public String getLoraModelsJson() { return loraModelsJson; }
    public void setLoraModelsJson(String loraModelsJson) { this.loraModelsJson = loraModelsJson; }

    public int getWidth() { return width; }
    public void setWidth(int width) { this.width = width; }

    public int getHeight() { return height; }
    public void setHeight(int height) { this.height = height; }

    public int getBatchSize() { return batchSize; }
    public void setBatchSize(int batchSize) { this.batchSize = batchSize; }

    public String getSamplerParamsJson() { return samplerParamsJson; }
    public void setSamplerParamsJson(String samplerParamsJson) { this.samplerParamsJson = samplerParamsJson; }

    public String getExternalJobRef() { return externalJobRef; }
    public void setExternalJobRef(String externalJobRef) { this.externalJobRef = externalJobRef; }

    public GenerationJobStatus getStatus() { return status; }
    public void setStatus(GenerationJobStatus status) { this.status = status; }

    public String getContentId() { return contentId; }
    public void setContentId(String contentId) { this.contentId = contentId; }

    public String getOutputPathsJson() { return outputPathsJson; }
    public void setOutputPathsJson(String outputPathsJson) { this.outputPathsJson = outputPathsJson; }

    public String getThumbnailPathsJson() { return thumbnailPathsJson; }
    public void setThumbnailPathsJson(String thumbnailPathsJson) { this.thumbnailPathsJson = thumbnailPathsJson; }

    public String getErrorMessage() { return errorMessage; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }

    public String getRecoverySuggestionsJson() { return recoverySuggestionsJson; }
    public void setRecoverySuggestionsJson(String recoverySuggestionsJson) { this.recoverySuggestionsJson = recoverySuggestionsJson; }

    public LocalDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }

    public LocalDateTime getStartedAt() { return startedAt; }
    public void setStartedAt(LocalDateTime startedAt) { this.startedAt = startedAt; }

    public LocalDateTime getCompletedAt() { return completedAt; }
    public void setCompletedAt(LocalDateTime completedAt) { this.completedAt = completedAt; }

    public LocalDateTime getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(LocalDateTime updatedAt) { this.updatedAt = updatedAt; }

    public long getVersion() { return version; }
    public void setVersion(long version) { this.version = version; }
}
