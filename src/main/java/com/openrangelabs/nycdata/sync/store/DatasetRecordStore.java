package com.openrangelabs.nycdata.sync.store;

import com.openrangelabs.nycdata.sync.model.BatchWriteResult;
import com.openrangelabs.nycdata.sync.transform.SourceRecord;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Local storage for ingested records, deduplicated by dataset and natural key
 */
public interface DatasetRecordStore {

    /**
     * Upsert a batch atomically. A failed batch writes nothing and signals an error.
     */
    Mono<BatchWriteResult> upsertBatch(String datasetId, List<SourceRecord> records);

    Mono<Long> countByDataset(String datasetId);
}
