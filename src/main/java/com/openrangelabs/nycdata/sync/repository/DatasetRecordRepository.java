package com.openrangelabs.nycdata.sync.repository;

import com.openrangelabs.nycdata.sync.entity.DatasetRecord;
import org.springframework.data.r2dbc.repository.R2dbcRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

@Repository
public interface DatasetRecordRepository extends R2dbcRepository<DatasetRecord, Long> {

    Mono<DatasetRecord> findByDatasetIdAndNaturalKey(String datasetId, String naturalKey);

    Mono<Long> countByDatasetId(String datasetId);
}
