package com.openrangelabs.nycdata.sync.repository;

import com.openrangelabs.nycdata.sync.entity.DatasetConfig;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.r2dbc.repository.R2dbcRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Repository for dataset configurations
 */
@Repository
public interface DatasetConfigRepository extends R2dbcRepository<DatasetConfig, Long> {

    Mono<DatasetConfig> findByDatasetId(String datasetId);

    Mono<Boolean> existsByDatasetId(String datasetId);

    /**
     * All datasets, most urgent first
     */
    @Query("SELECT * FROM dataset_config ORDER BY priority DESC, dataset_id ASC")
    Flux<DatasetConfig> findAllOrderByPriority();

    /**
     * Active datasets, most urgent first
     */
    @Query("""
        SELECT * FROM dataset_config
        WHERE is_active = TRUE
        ORDER BY priority DESC, dataset_id ASC
        """)
    Flux<DatasetConfig> findActiveOrderByPriority();

    @Query("SELECT COUNT(*) FROM dataset_config WHERE is_active = TRUE AND sync_enabled = TRUE")
    Mono<Long> countSyncEnabled();
}
