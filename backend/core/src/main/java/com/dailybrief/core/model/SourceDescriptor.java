package com.dailybrief.core.model;

import java.util.List;
import java.util.Objects;

public record SourceDescriptor(
        String name,
        String feedUrl,
        String category,
        List<String> keywords
) {
    public static final String DEFAULT_CATEGORY = "general";

    public SourceDescriptor {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(feedUrl, "feedUrl is required");
        category = category == null || category.isBlank() ? DEFAULT_CATEGORY : category;
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
    }

    public SourceDescriptor withCategory(String newCategory) {
        return new SourceDescriptor(name, feedUrl, newCategory, keywords);
    }
}
