package com.openrangelabs.nycdata.sync.model;

import java.util.List;

public record CatalogSearchFilters(
        String query,
        String category,
        List<String> tags,
        int limit,
        int offset) {

    public CatalogSearchFilters {
        tags = tags != null ? List.copyOf(tags) : List.of();
        offset = Math.max(0, offset);
    }

    public CatalogSearchFilters withLimit(int limit) {
        return new CatalogSearchFilters(query, category, tags, limit, offset);
    }
}
