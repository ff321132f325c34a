package org.example.imagegen.entity;

import jakarta.persistence.*;

import java.time.LocalDateTime;

/**
 * Gallery-facing record of a finished generation. Written once by the worker;
 * the job keeps only the id.
 */
@Entity
@Table(name = "content_records")
public class ContentRecordEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false, length = 120)
    private String userId;

    @Column(nullable = false, unique = true, length = 64)
    private String jobId;

    @Column(nullable = false)
    private String title;

    @Column(nullable = false, length = 2000)
    private String prompt;

    @Column(nullable = false, length = 1000)
    private String primaryPath;

    @Column(length = 1000)
    private String thumbnailPath;

    private int width;

    private int height;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    public ContentRecordEntity() {}

    public ContentRecordEntity(String userId, String jobId, String title, String prompt, String primaryPath) {
        this.userId = userId;
        this.jobId = jobId;
        this.title = title;
        this.prompt = prompt;
        this.primaryPath = primaryPath;
        this.createdAt = LocalDateTime.now();
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public String getJobId() { return jobId; }
    public void setJobId(String jobId) { this.jobId = jobId; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public String getPrompt() { return prompt; }
    public void setPrompt(String prompt) { this.prompt = prompt; }

    public String getPrimaryPath() { return primaryPath; }
    public void setPrimaryPath(String primaryPath) { this.primaryPath = primaryPath; }

    public String getThumbnailPath() { return thumbnailPath; }
    public void setThumbnailPath(String thumbnailPath) { this.thumbnailPath = thumbnailPath; }

    public int getWidth() { return width; }
    public void setWidth(int width) { this.width = width; }

    public int getHeight() { return height; }
    public void setHeight(int height) { this.height = height; }

    public LocalDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }
}
