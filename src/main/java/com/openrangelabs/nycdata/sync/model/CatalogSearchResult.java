package com.openrangelabs.nycdata.sync.model;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * One page of catalog datasets with the categories and most used tags seen on it
 */
public record CatalogSearchResult(
        List<DiscoveredDataset> datasets,
        long totalCount,
        List<String> categories,
        List<String> popularTags) {

    public CatalogSearchResult markConfigured(Set<String> configuredIds) {
        List<DiscoveredDataset> marked = datasets.stream()
                .map(dataset -> dataset.withConfigured(configuredIds.contains(dataset.id())))
                .collect(Collectors.toList());
        return new CatalogSearchResult(marked, totalCount, categories, popularTags);
    }
}
