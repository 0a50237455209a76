package com.openrangelabs.nycdata.sync.repository;

import com.openrangelabs.nycdata.sync.entity.SyncLog;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.r2dbc.repository.R2dbcRepository;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

/**
 * Repository for the sync audit log
 */
@Repository
public interface SyncLogRepository extends R2dbcRepository<SyncLog, Long> {

    Flux<SyncLog> findByDatasetIdOrderByStartTimeDesc(String datasetId);

    /**
     * Latest run that advanced the watermark
     */
    @Query("""
        SELECT * FROM sync_log
        WHERE dataset_id = :datasetId
        AND status IN ('success', 'partial')
        ORDER BY end_time DESC
        LIMIT 1
        """)
    Mono<SyncLog> findLatestCompleted(@Param("datasetId") String datasetId);

    /**
     * Count in-progress runs started after the sanity threshold
     */
    @Query("""
        SELECT COUNT(*) FROM sync_log
        WHERE dataset_id = :datasetId
        AND status = 'in_progress'
        AND start_time > :threshold
        """)
    Mono<Long> countActiveRuns(
            @Param("datasetId") String datasetId,
            @Param("threshold") LocalDateTime threshold);

    /**
     * In-progress rows older than the sanity threshold
     */
    @Query("""
        SELECT * FROM sync_log
        WHERE status = 'in_progress'
        AND start_time <= :threshold
        ORDER BY start_time ASC
        """)
    Flux<SyncLog> findStaleInProgress(@Param("threshold") LocalDateTime threshold);

    /**
     * Finalize an in-progress row. Returns 0 if the row was already finalized.
     */
    @Modifying
    @Query("""
        UPDATE sync_log SET
            status = :status,
            end_time = :endTime,
            records_processed = :processed,
            records_added = :added,
            records_updated = :updated,
            records_failed = :failed,
            error_message = :errorMessage,
            last_record_date = :lastRecordDate
        WHERE id = :id AND status = 'in_progress'
        """)
    Mono<Integer> finalizeRun(
            @Param("id") Long id,
            @Param("status") String status,
            @Param("endTime") LocalDateTime endTime,
            @Param("processed") int processed,
            @Param("added") int added,
            @Param("updated") int updated,
            @Param("failed") int failed,
            @Param("errorMessage") String errorMessage,
            @Param("lastRecordDate") LocalDateTime lastRecordDate);
}
