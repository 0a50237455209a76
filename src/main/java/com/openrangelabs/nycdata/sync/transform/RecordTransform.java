package com.openrangelabs.nycdata.sync.transform;

import com.fasterxml.jackson.databind.JsonNode;
import com.openrangelabs.nycdata.sync.entity.DatasetConfig;

import java.util.Optional;
import java.util.Set;

/**
 * Maps raw source records of one or more datasets to {@link SourceRecord}s.
 */
public interface RecordTransform {

    /**
     * Dataset ids this transform handles. Empty for the catch-all transform.
     */
    Set<String> supportedDatasets();

    /**
     * Transform one raw record. An empty result means the record is intentionally skipped.
     *
     * @throws com.openrangelabs.nycdata.sync.exception.RecordTransformException if the record is unusable
     */
    Optional<SourceRecord> transform(DatasetConfig dataset, JsonNode raw);
}
