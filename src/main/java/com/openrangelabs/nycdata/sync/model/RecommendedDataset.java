package com.openrangelabs.nycdata.sync.model;

/**
 * A catalog dataset ranked by how much it relates to property and buildings
 */
public record RecommendedDataset(DiscoveredDataset dataset, int relevanceScore) {
}
