package org.example.imagegen.repository;

import org.example.imagegen.entity.AvailableModelEntity;
import org.example.imagegen.entity.ModelType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface AvailableModelRepository extends JpaRepository<AvailableModelEntity, String> {

    Optional<AvailableModelEntity> findByTypeAndName(ModelType type, String name);

    List<AvailableModelEntity> findByActiveTrueOrderByTypeAscNameAsc();

    boolean existsByTypeAndNameAndActiveTrue(ModelType type, String name);
}
