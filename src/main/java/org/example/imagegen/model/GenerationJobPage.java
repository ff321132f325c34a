package org.example.imagegen.model;

import java.util.List;

public record GenerationJobPage(
        List<GenerationJobView> items,
        int page,
        int size,
        long totalItems,
        int totalPages
) {
}
