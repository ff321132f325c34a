package org.example.imagegen.entity;

import jakarta.persistence.*;

@Entity
@Table(name = "available_models", uniqueConstraints = {
        @UniqueConstraint(name = "uk_available_models_type_name", columnNames = {"type", "name"})
})
public class AvailableModelEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ModelType type;

    @Column(nullable = false)
    private String filename;

    @Column(nullable = false)
    private boolean active = true;

    public AvailableModelEntity() {}

    public AvailableModelEntity(String name, ModelType type, String filename) {
        this.name = name;
        this.type = type;
        this.filename = filename;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public ModelType getType() { return type; }
    public void setType(ModelType type) { this.type = type; }

    public String getFilename() { return filename; }
    public void setFilename(String filename) { this.filename = filename; }

    public boolean isActive() { return active; }
    public void setActive(boolean active) { this.active = active; }
}
