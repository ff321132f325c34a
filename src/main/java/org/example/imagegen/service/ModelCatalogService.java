package org.example.imagegen.service;

import org.example.imagegen.entity.AvailableModelEntity;
import org.example.imagegen.entity.ModelType;
import org.example.imagegen.model.ModelCatalogEntry;
import org.example.imagegen.repository.AvailableModelRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Service
public class ModelCatalogService {

    private static final Logger log = LoggerFactory.getLogger(ModelCatalogService.class);

    private final AvailableModelRepository modelRepository;

    public ModelCatalogService(AvailableModelRepository modelRepository) {
        this.modelRepository = modelRepository;
    }

    public Optional<AvailableModelEntity> resolve(ModelType type, String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return modelRepository.findByTypeAndName(type, name.trim())
                .filter(AvailableModelEntity::isActive);
    }

    public List<ModelCatalogEntry> listActive() {
        return modelRepository.findByActiveTrueOrderByTypeAscNameAsc().stream()
                .map(model -> new ModelCatalogEntry(
                        model.getName(),
                        model.getType().name().toLowerCase(),
                        model.getFilename()))
                .toList();
    }

    /**
     * Insert or reactivate catalog entries. Entries are "name" (filename equals
     * name) or "name=filename".
     *
     * @return number of entries inserted or changed
     */
    @Transactional
    public int register(ModelType type, List<String> entries) {
        int changed = 0;
        for (String entry : entries) {
            if (entry == null || entry.isBlank()) {
                continue;
            }
            String[] parts = entry.split("=", 2);
            String name = parts[0].trim();
            String filename = parts.length > 1 && !parts[1].isBlank() ? parts[1].trim() : name;
            Optional<AvailableModelEntity> existing = modelRepository.findByTypeAndName(type, name);
            if (existing.isEmpty()) {
                modelRepository.save(new AvailableModelEntity(name, type, filename));
                changed++;
                continue;
            }
            AvailableModelEntity model = existing.get();
            if (!model.isActive() || !filename.equals(model.getFilename())) {
                model.setActive(true);
                model.setFilename(filename);
                modelRepository.save(model);
                changed++;
            }
        }
        if (changed > 0) {
            log.info("Registered {} {} model(s) in catalog", changed, type.name().toLowerCase());
        }
        return changed;
    }
}
