package org.example.imagegen.entity;

import jakarta.persistence.*;

import java.time.LocalDateTime;

@Entity
@Table(name = "generation_tasks", indexes = {
        @Index(name = "idx_generation_tasks_claimable", columnList = "status, availableAt")
})
public class GenerationTaskEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false, length = 64)
    private String jobId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private GenerationTaskStatus status;

    @Column(nullable = false)
    private int deliveryCount;

    @Column(nullable = false)
    private LocalDateTime availableAt;

    @Column(length = 120)
    private String leaseOwner;

    private LocalDateTime leaseExpiresAt;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    private LocalDateTime finishedAt;

    public GenerationTaskEntity() {}

    public GenerationTaskEntity(String jobId) {
        this.jobId = jobId;
        this.status = GenerationTaskStatus.AVAILABLE;
        this.deliveryCount = 0;
        this.createdAt = LocalDateTime.now();
        this.availableAt = this.createdAt;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getJobId() { return jobId; }
    public void setJobId(String jobId) { this.jobId = jobId; }

    public GenerationTaskStatus getStatus() { return status; }
    public void setStatus(GenerationTaskStatus status) { this.status = status; }

    public int getDeliveryCount() { return deliveryCount; }
    public void setDeliveryCount(int deliveryCount) { this.deliveryCount = deliveryCount; }

    public LocalDateTime getAvailableAt() { return availableAt; }
    public void setAvailableAt(LocalDateTime availableAt) { this.availableAt = availableAt; }

    public String getLeaseOwner() { return leaseOwner; }
    public void setLeaseOwner(String leaseOwner) { this.leaseOwner = leaseOwner; }

    public LocalDateTime getLeaseExpiresAt() { return leaseExpiresAt; }
    public void setLeaseExpiresAt(LocalDateTime leaseExpiresAt) { this.leaseExpiresAt = leaseExpiresAt; }

    public LocalDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }

    public LocalDateTime getFinishedAt() { return finishedAt; }
    public void setFinishedAt(LocalDateTime finishedAt) { this.finishedAt = finishedAt; }
}
