package org.example.imagegen.entity;

public enum ModelType {
    CHECKPOINT,
    LORA
}
