package org.example.imagegen.repository;

import org.example.imagegen.entity.GenerationTaskEntity;
import org.example.imagegen.entity.GenerationTaskStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface GenerationTaskRepository extends JpaRepository<GenerationTaskEntity, String> {

    long countByStatus(GenerationTaskStatus status);

    boolean existsByJobIdAndStatusIn(String jobId, List<GenerationTaskStatus> statuses);

    @Query("""
            SELECT t.id
            FROM GenerationTaskEntity t
            WHERE (t.status = :availableStatus AND t.availableAt <= :now)
               OR (t.status = :claimedStatus AND (t.leaseExpiresAt IS NULL OR t.leaseExpiresAt < :now))
            ORDER BY t.availableAt ASC
            """)
    List<String> findClaimCandidates(
            @Param("now") LocalDateTime now,
            @Param("availableStatus") GenerationTaskStatus availableStatus,
            @Param("claimedStatus") GenerationTaskStatus claimedStatus,
            Pageable pageable);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("""
            UPDATE GenerationTaskEntity t
            SET t.status = :claimedStatus,
                t.leaseOwner = :leaseOwner,
                t.leaseExpiresAt = :leaseExpiresAt,
                t.deliveryCount = t.deliveryCount + 1
            WHERE t.id = :taskId
              AND (
                (t.status = :availableStatus AND t.availableAt <= :now)
                OR (t.status = :claimedStatus AND (t.leaseExpiresAt IS NULL OR t.leaseExpiresAt < :now))
              )
            """)
    int claimLease(
            @Param("taskId") String taskId,
            @Param("now") LocalDateTime now,
            @Param("leaseExpiresAt") LocalDateTime leaseExpiresAt,
            @Param("leaseOwner") String leaseOwner,
            @Param("availableStatus") GenerationTaskStatus availableStatus,
            @Param("claimedStatus") GenerationTaskStatus claimedStatus);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("""
            UPDATE GenerationTaskEntity t
            SET t.status = :doneStatus,
                t.leaseExpiresAt = NULL,
                t.finishedAt = :now
            WHERE t.id = :taskId
              AND t.status = :claimedStatus
              AND t.leaseOwner = :leaseOwner
            """)
    int acknowledge(
            @Param("taskId") String taskId,
            @Param("leaseOwner") String leaseOwner,
            @Param("now") LocalDateTime now,
            @Param("claimedStatus") GenerationTaskStatus claimedStatus,
            @Param("doneStatus") GenerationTaskStatus doneStatus);
}
