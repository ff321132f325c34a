package org.example.imagegen.repository;

import org.example.imagegen.entity.ContentRecordEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ContentRecordRepository extends JpaRepository<ContentRecordEntity, String> {

    Optional<ContentRecordEntity> findByJobId(String jobId);
}
