package com.openrangelabs.nycdata.sync.source;

import com.openrangelabs.nycdata.sync.model.CatalogSearchFilters;
import com.openrangelabs.nycdata.sync.model.CatalogSearchResult;
import com.openrangelabs.nycdata.sync.model.DiscoveredDataset;
import reactor.core.publisher.Mono;

/**
 * Search access to the catalog of datasets a source publishes
 */
public interface DatasetCatalogClient {

    Mono<CatalogSearchResult> search(CatalogSearchFilters filters);

    /**
     * Metadata and columns of one dataset, empty if the catalog does not know it
     */
    Mono<DiscoveredDataset> fetchMetadata(String datasetId);
}
