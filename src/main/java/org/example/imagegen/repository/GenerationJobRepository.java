package org.example.imagegen.repository;

import org.example.imagegen.entity.GenerationJobEntity;
import org.example.imagegen.entity.GenerationJobStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

@Repository
public interface GenerationJobRepository extends JpaRepository<GenerationJobEntity, String> {

    Page<GenerationJobEntity> findByUserIdOrderByCreatedAtDesc(String userId, Pageable pageable);

    Page<GenerationJobEntity> findByUserIdAndStatusOrderByCreatedAtDesc(
            String userId, GenerationJobStatus status, Pageable pageable);

    List<GenerationJobEntity> findByStatus(GenerationJobStatus status);

    long countByStatus(GenerationJobStatus status);

    @Query("""
            SELECT j
            FROM GenerationJobEntity j
            WHERE j.status IN :statuses
              AND j.updatedAt < :staleBefore
            """)
    List<GenerationJobEntity> findStaleInStatuses(
            @Param("statuses") Collection<GenerationJobStatus> statuses,
            @Param("staleBefore") LocalDateTime staleBefore);
}
