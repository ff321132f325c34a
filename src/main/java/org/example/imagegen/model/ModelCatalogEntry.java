package org.example.imagegen.model;

public record ModelCatalogEntry(String name, String type, String filename) {
}
