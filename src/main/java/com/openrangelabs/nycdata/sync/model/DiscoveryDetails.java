package com.openrangelabs.nycdata.sync.model;

import java.util.List;

/**
 * Catalog metadata of one dataset plus the registration settings detected from its columns
 */
public record DiscoveryDetails(
        DiscoveredDataset dataset,
        List<String> suggestedPrimaryKeyFields,
        String suggestedDateField,
        int suggestedPriority) {
}
