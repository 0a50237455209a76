package com.openrangelabs.nycdata.sync.repository;

import com.openrangelabs.nycdata.sync.entity.DataFreshness;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.r2dbc.repository.R2dbcRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Repository for per-dataset freshness records
 */
@Repository
public interface DataFreshnessRepository extends R2dbcRepository<DataFreshness, Long> {

    Mono<DataFreshness> findByDatasetId(String datasetId);

    /**
     * Stale datasets, worst first
     */
    @Query("SELECT * FROM data_freshness WHERE is_stale = TRUE ORDER BY freshness_score ASC")
    Flux<DataFreshness> findStale();
}
