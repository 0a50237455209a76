package com.openrangelabs.nycdata.sync.model;

import java.time.LocalDateTime;
import java.util.List;

/**
 * A dataset published in the source catalog, registered here or not
 */
public record DiscoveredDataset(
        String id,
        String name,
        String description,
        String category,
        List<String> tags,
        String apiEndpoint,
        String webUrl,
        Long recordCount,
        LocalDateTime lastUpdated,
        List<DatasetColumn> columns,
        String updateFrequency,
        boolean configured) {

    public DiscoveredDataset {
        tags = tags != null ? List.copyOf(tags) : List.of();
        columns = columns != null ? List.copyOf(columns) : List.of();
    }

    public DiscoveredDataset withConfigured(boolean configured) {
        return new DiscoveredDataset(id, name, description, category, tags, apiEndpoint, webUrl,
                recordCount, lastUpdated, columns, updateFrequency, configured);
    }

    public DiscoveredDataset withRecordCount(Long recordCount) {
        return new DiscoveredDataset(id, name, description, category, tags, apiEndpoint, webUrl,
                recordCount, lastUpdated, columns, updateFrequency, configured);
    }
}
