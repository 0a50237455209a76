package com.openrangelabs.nycdata.sync.service;

import com.openrangelabs.nycdata.sync.config.NycDataProperties;
import com.openrangelabs.nycdata.sync.dto.SyncLogPage;
import com.openrangelabs.nycdata.sync.dto.SyncLogQuery;
import com.openrangelabs.nycdata.sync.dto.SyncLogStats;
import com.openrangelabs.nycdata.sync.entity.SyncLog;
import com.openrangelabs.nycdata.sync.model.SyncStatus;
import com.openrangelabs.nycdata.sync.model.SyncType;
import com.openrangelabs.nycdata.sync.repository.SyncLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.data.relational.core.query.Criteria;
import org.springframework.data.relational.core.query.Query;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Append-only access to the sync log. Rows are inserted as {@code in_progress}
 * and finalized exactly once; nothing else ever updates them.
 */
@Service
public class SyncLogService {

    private static final Logger logger = LoggerFactory.getLogger(SyncLogService.class);

    static final int MAX_ERROR_MESSAGE_LENGTH = 2000;

    private final SyncLogRepository repository;
    private final R2dbcEntityTemplate template;
    private final DatabaseClient databaseClient;
    private final NycDataProperties properties;
    private final Clock clock;

    public SyncLogService(SyncLogRepository repository,
                          R2dbcEntityTemplate template,
                          DatabaseClient databaseClient,
                          NycDataProperties properties,
                          Clock clock) {
        this.repository = repository;
        this.template = template;
        this.databaseClient = databaseClient;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Insert the in-progress row that opens a run
     */
    public Mono<SyncLog> startRun(String datasetId, SyncType syncType, String triggeredBy) {
        SyncLog log = new SyncLog(datasetId, syncType, LocalDateTime.now(clock), triggeredBy);
        return repository.save(log)
                .doOnNext(saved -> logger.debug("Opened sync log {} for {} ({})", saved.getId(), datasetId, syncType.value()));
    }

    /**
     * Write the terminal state of a run. Fails if the row was already finalized.
     */
    public Mono<SyncLog> finalizeRun(SyncLog log) {
        SyncStatus status = log.getSyncStatus();
        if (status == null || !status.isTerminal()) {
            return Mono.error(new IllegalArgumentException("Cannot finalize sync log with status " + log.getStatus()));
        }
        if (log.getEndTime() == null) {
            log.setEndTime(LocalDateTime.now(clock));
        }
        log.setErrorMessage(truncate(log.getErrorMessage()));

        return repository.finalizeRun(
                        log.getId(),
                        log.getStatus(),
                        log.getEndTime(),
                        log.getRecordsProcessed(),
                        log.getRecordsAdded(),
                        log.getRecordsUpdated(),
                        log.getRecordsFailed(),
                        log.getErrorMessage(),
                        log.getLastRecordDate())
                .flatMap(updated -> updated == 1
                        ? Mono.just(log)
                        : Mono.error(new IllegalStateException("Sync log " + log.getId() + " is already finalized")));
    }

    /**
     * Record an attempt that was rejected before any record was read
     */
    public Mono<SyncLog> recordRejectedRun(String datasetId, SyncType syncType, String triggeredBy, String reason) {
        return startRun(datasetId, syncType, triggeredBy)
                .flatMap(log -> {
                    log.setStatus(SyncStatus.FAILED.value());
                    log.setErrorMessage(reason);
                    return finalizeRun(log);
                })
                .doOnNext(log -> logger.warn("Rejected ingestion of {}: {}", datasetId, reason));
    }

    /**
     * Latest success or partial run
     */
    public Mono<SyncLog> getLatestCompleted(String datasetId) {
        return repository.findLatestCompleted(datasetId);
    }

    /**
     * Incremental floor for the next run, empty if there is none
     */
    public Mono<Optional<LocalDateTime>> findWatermark(String datasetId) {
        return repository.findLatestCompleted(datasetId)
                .map(log -> Optional.ofNullable(log.getLastRecordDate()))
                .defaultIfEmpty(Optional.empty());
    }

    /**
     * True if a run for the dataset is in progress and younger than the sanity window
     */
    public Mono<Boolean> hasActiveRun(String datasetId) {
        return repository.countActiveRuns(datasetId, staleThreshold())
                .map(count -> count > 0);
    }

    /**
     * In-progress rows older than the sanity window, left behind by crashed runs
     */
    public Flux<SyncLog> findStaleInProgress() {
        return repository.findStaleInProgress(staleThreshold());
    }

    /**
     * Filtered, paginated listing with per dataset/status aggregates
     */
    public Mono<SyncLogPage> searchLogs(SyncLogQuery query) {
        Criteria criteria = toCriteria(query);

        Mono<List<SyncLog>> logs = template.select(SyncLog.class)
                .matching(Query.query(criteria)
                        .sort(Sort.by(Sort.Direction.DESC, "startTime"))
                        .limit(query.limit())
                        .offset(query.offset()))
                .all()
                .collectList();
        Mono<Long> total = template.count(Query.query(criteria), SyncLog.class);
        Mono<List<SyncLogStats>> stats = getStatistics(query).collectList();

        return Mono.zip(logs, total, stats)
                .map(tuple -> new SyncLogPage(tuple.getT1(), tuple.getT2(), query.limit(), query.offset(), tuple.getT3()));
    }

    /**
     * Run counts and record totals grouped by dataset and status
     */
    public Flux<SyncLogStats> getStatistics(SyncLogQuery query) {
        StringBuilder sql = new StringBuilder("""
            SELECT dataset_id, status,
                COUNT(*) AS runs,
                COALESCE(SUM(records_processed), 0) AS records_processed,
                COALESCE(SUM(records_added), 0) AS records_added,
                COALESCE(SUM(records_updated), 0) AS records_updated,
                COALESCE(SUM(records_failed), 0) AS records_failed
            FROM sync_log
            WHERE 1 = 1
            """);
        Map<String, Object> bindings = new LinkedHashMap<>();
        if (query.datasetId() != null) {
            sql.append(" AND dataset_id = :datasetId");
            bindings.put("datasetId", query.datasetId());
        }
        if (query.status() != null) {
            sql.append(" AND status = :status");
            bindings.put("status", query.status());
        }
        if (query.startDate() != null) {
            sql.append(" AND start_time >= :startDate");
            bindings.put("startDate", query.startDate());
        }
        if (query.endDate() != null) {
            sql.append(" AND start_time <= :endDate");
            bindings.put("endDate", query.endDate());
        }
        sql.append(" GROUP BY dataset_id, status ORDER BY dataset_id, status");

        DatabaseClient.GenericExecuteSpec spec = databaseClient.sql(sql.toString());
        for (Map.Entry<String, Object> binding : bindings.entrySet()) {
            spec = spec.bind(binding.getKey(), binding.getValue());
        }
        return spec.map((row, metadata) -> new SyncLogStats(
                        row.get("dataset_id", String.class),
                        row.get("status", String.class),
                        longValue(row.get("runs", Long.class)),
                        longValue(row.get("records_processed", Long.class)),
                        longValue(row.get("records_added", Long.class)),
                        longValue(row.get("records_updated", Long.class)),
                        longValue(row.get("records_failed", Long.class))))
                .all();
    }

    private Criteria toCriteria(SyncLogQuery query) {
        Criteria criteria = Criteria.empty();
        if (query.datasetId() != null) {
            criteria = criteria.and("datasetId").is(query.datasetId());
        }
        if (query.status() != null) {
            criteria = criteria.and("status").is(query.status());
        }
        if (query.startDate() != null) {
            criteria = criteria.and("startTime").greaterThanOrEquals(query.startDate());
        }
        if (query.endDate() != null) {
            criteria = criteria.and("startTime").lessThanOrEquals(query.endDate());
        }
        return criteria;
    }

    private LocalDateTime staleThreshold() {
        return LocalDateTime.now(clock).minusMinutes(properties.getPipeline().getStaleInProgressMinutes());
    }

    private static long longValue(Long value) {
        return value != null ? value : 0L;
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= MAX_ERROR_MESSAGE_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_ERROR_MESSAGE_LENGTH - 3) + "...";
    }
}
