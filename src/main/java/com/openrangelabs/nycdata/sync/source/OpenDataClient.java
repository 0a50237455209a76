package com.openrangelabs.nycdata.sync.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.openrangelabs.nycdata.sync.entity.DatasetConfig;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Read access to an external open data source.
 *
 * <p>Transient failures are signalled as
 * {@link com.openrangelabs.nycdata.sync.exception.SourceUnavailableException};
 * a dataset with nothing new returns an empty page, never an error.
 */
public interface OpenDataClient {

    /**
     * Total number of records the source currently reports for the dataset
     */
    Mono<Long> fetchRecordCount(DatasetConfig dataset);

    /**
     * One page of raw records, ordered by the dataset's date field
     */
    Mono<List<JsonNode>> fetchPage(DatasetConfig dataset, SourcePageRequest page);
}
