package com.openrangelabs.nycdata.sync.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.openrangelabs.nycdata.sync.config.NycDataProperties;
import com.openrangelabs.nycdata.sync.entity.DatasetConfig;
import com.openrangelabs.nycdata.sync.entity.SyncLog;
import com.openrangelabs.nycdata.sync.exception.RecordTransformException;
import com.openrangelabs.nycdata.sync.model.BatchWriteResult;
import com.openrangelabs.nycdata.sync.model.IngestOptions;
import com.openrangelabs.nycdata.sync.model.SyncStatus;
import com.openrangelabs.nycdata.sync.model.SyncType;
import com.openrangelabs.nycdata.sync.source.OpenDataClient;
import com.openrangelabs.nycdata.sync.source.SourcePageRequest;
import com.openrangelabs.nycdata.sync.store.DatasetRecordStore;
import com.openrangelabs.nycdata.sync.transform.RecordTransform;
import com.openrangelabs.nycdata.sync.transform.RecordTransformRegistry;
import com.openrangelabs.nycdata.sync.transform.SourceRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs one ingestion of one dataset: opens a sync log row, reads the source page by page
 * through the dataset's transform into the record store, and finalizes the row.
 *
 * <p>The returned {@link Mono} never errors for source, transform or storage problems;
 * they end up in the status, counters and error message of the finalized log.
 */
@Service
public class IngestionPipeline {

    private static final Logger logger = LoggerFactory.getLogger(IngestionPipeline.class);

    private static final int MAX_REPORTED_ERRORS = 5;

    private final DatasetRegistryService registryService;
    private final SyncLogService syncLogService;
    private final OpenDataClient openDataClient;
    private final RecordTransformRegistry transformRegistry;
    private final DatasetRecordStore recordStore;
    private final FreshnessScorer scorer;
    private final NycDataProperties.Pipeline properties;
    private final Clock clock;

    public IngestionPipeline(DatasetRegistryService registryService,
                             SyncLogService syncLogService,
                             OpenDataClient openDataClient,
                             RecordTransformRegistry transformRegistry,
                             DatasetRecordStore recordStore,
                             FreshnessScorer scorer,
                             NycDataProperties properties,
                             Clock clock) {
        this.registryService = registryService;
        this.syncLogService = syncLogService;
        this.openDataClient = openDataClient;
        this.transformRegistry = transformRegistry;
        this.recordStore = recordStore;
        this.scorer = scorer;
        this.properties = properties.getPipeline();
        this.clock = clock;
    }

    /**
     * Ingest a dataset and return its finalized sync log
     */
    public Mono<SyncLog> ingest(String datasetId, IngestOptions options) {
        return registryService.findDataset(datasetId)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(found -> {
                    if (found.isEmpty()) {
                        return syncLogService.recordRejectedRun(datasetId, options.requestedType(),
                                options.triggeredBy(), "Unknown dataset: " + datasetId);
                    }
                    DatasetConfig dataset = found.get();
                    if (!Boolean.TRUE.equals(dataset.getActive())) {
                        return syncLogService.recordRejectedRun(datasetId, options.requestedType(),
                                options.triggeredBy(), "Dataset is inactive: " + datasetId);
                    }
                    return resolveWatermark(dataset, options)
                            .flatMap(watermark -> run(dataset, watermark, options));
                });
    }

    Mono<Optional<LocalDateTime>> resolveWatermark(DatasetConfig dataset, IngestOptions options) {
        if (options.fullSync() || !dataset.supportsIncrementalSync()) {
            return Mono.just(Optional.empty());
        }
        if (options.fromDate() != null) {
            return Mono.just(Optional.of(options.fromDate()));
        }
        return syncLogService.findWatermark(dataset.getDatasetId());
    }

    private Mono<SyncLog> run(DatasetConfig dataset, Optional<LocalDateTime> watermark, IngestOptions options) {
        SyncType syncType = watermark.isPresent() ? SyncType.INCREMENTAL : SyncType.FULL;
        int batchSize = syncType == SyncType.FULL ? properties.getFullBatchSize() : properties.getIncrementalBatchSize();

        return syncLogService.startRun(dataset.getDatasetId(), syncType, options.triggeredBy())
                .flatMap(log -> {
                    RunState state = new RunState(options.limit(),
                            clock.instant().plusSeconds(properties.getDatasetTimeBudgetSeconds()));
                    logger.info("Starting {} sync of {} (log {}, watermark {})",
                            syncType.value(), dataset.getDatasetId(), log.getId(), watermark.orElse(null));

                    SourcePageRequest first = new SourcePageRequest(0, state.nextPageSize(batchSize), watermark.orElse(null));
                    Mono<PageOutcome> firstPage = first.limit() > 0 ? readPage(dataset, first, state) : Mono.empty();
                    return firstPage
                            .expand(page -> page.exhausted() || !state.canContinue(clock.instant())
                                    ? Mono.empty()
                                    : readPage(dataset, page.request().next().withLimit(state.nextPageSize(batchSize)), state))
                            .then(Mono.fromSupplier(() -> complete(log, state, watermark.orElse(null))))
                            .onErrorResume(error -> {
                                logger.error("Sync of {} aborted: {}", dataset.getDatasetId(), error.getMessage(), error);
                                state.error("Aborted: " + error.getMessage());
                                state.sourceFailed = true;
                                return Mono.just(complete(log, state, watermark.orElse(null)));
                            });
                })
                .flatMap(syncLogService::finalizeRun)
                .flatMap(finalized -> refreshFreshness(dataset, finalized).thenReturn(finalized))
                .doOnNext(finalized -> logger.info("Finished sync of {}: status={}, processed={}, added={}, updated={}, failed={}",
                        dataset.getDatasetId(), finalized.getStatus(), finalized.getRecordsProcessed(),
                        finalized.getRecordsAdded(), finalized.getRecordsUpdated(), finalized.getRecordsFailed()));
    }

    private Mono<PageOutcome> readPage(DatasetConfig dataset, SourcePageRequest request, RunState state) {
        return openDataClient.fetchPage(dataset, request)
                .onErrorResume(error -> {
                    logger.warn("Fetching {} at offset {} failed: {}", dataset.getDatasetId(), request.offset(), error.getMessage());
                    state.sourceFailed = true;
                    state.error("Source read failed at offset " + request.offset() + ": " + error.getMessage());
                    return Mono.empty();
                })
                .flatMap(rows -> writeBatch(dataset, rows, state)
                        .thenReturn(new PageOutcome(request, rows.size() < request.limit())));
    }

    private Mono<Void> writeBatch(DatasetConfig dataset, List<JsonNode> rows, RunState state) {
        state.fetched += rows.size();
        state.processed += rows.size();

        RecordTransform transform = transformRegistry.resolve(dataset.getDatasetId());
        List<SourceRecord> records = new ArrayList<>(rows.size());
        for (JsonNode row : rows) {
            try {
                transform.transform(dataset, row).ifPresent(records::add);
            } catch (RecordTransformException e) {
                state.failed++;
                state.error(e.getMessage());
            }
        }
        if (records.isEmpty()) {
            return Mono.empty();
        }

        return recordStore.upsertBatch(dataset.getDatasetId(), records)
                .doOnNext(result -> state.written(result, records))
                .onErrorResume(error -> {
                    logger.warn("Writing batch of {} records for {} failed: {}",
                            records.size(), dataset.getDatasetId(), error.getMessage());
                    state.failed += records.size();
                    state.watermarkFrozen = true;
                    state.error("Batch write failed: " + error.getMessage());
                    return Mono.empty();
                })
                .then();
    }

    private SyncLog complete(SyncLog log, RunState state, LocalDateTime watermark) {
        log.setRecordsProcessed(state.processed);
        log.setRecordsAdded(state.added);
        log.setRecordsUpdated(state.updated);
        log.setRecordsFailed(state.failed);
        log.setStatus(state.status().value());
        log.setEndTime(LocalDateTime.now(clock));
        log.setLastRecordDate(latest(state.maxRecordDate, watermark));
        log.setErrorMessage(state.errors.isEmpty() ? null : String.join("; ", state.errors));
        return log;
    }

    private Mono<Void> refreshFreshness(DatasetConfig dataset, SyncLog log) {
        if (!log.isCompleted()) {
            return Mono.empty();
        }
        String datasetId = dataset.getDatasetId();
        return recordStore.countByDataset(datasetId)
                .zipWith(registryService.getFreshness(datasetId))
                .map(tuple -> scorer.afterSync(dataset, tuple.getT2(), tuple.getT1()))
                .flatMap(registryService::saveFreshness)
                .onErrorResume(error -> {
                    logger.warn("Could not refresh freshness of {} after sync: {}", datasetId, error.getMessage());
                    return Mono.empty();
                })
                .then();
    }

    private static LocalDateTime latest(LocalDateTime a, LocalDateTime b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.isAfter(b) ? a : b;
    }

    private record PageOutcome(SourcePageRequest request, boolean exhausted) {
    }

    /**
     * Counters of one run. Pages are read one after another, so a run never touches its state concurrently.
     */
    private static final class RunState {
        private final Integer limit;
        private final Instant deadline;
        private final List<String> errors = new ArrayList<>();
        private int fetched;
        private int processed;
        private int added;
        private int updated;
        private int failed;
        private boolean sourceFailed;
        // set by the first failed write; later batches no longer move the watermark
        private boolean watermarkFrozen;
        private LocalDateTime maxRecordDate;

        RunState(Integer limit, Instant deadline) {
            this.limit = limit;
            this.deadline = deadline;
        }

        int nextPageSize(int batchSize) {
            return limit == null ? batchSize : Math.max(0, Math.min(batchSize, limit - fetched));
        }

        boolean canContinue(Instant now) {
            if (sourceFailed) {
                return false;
            }
            if (limit != null && fetched >= limit) {
                return false;
            }
            return now.isBefore(deadline);
        }

        void written(BatchWriteResult result, List<SourceRecord> records) {
            added += result.inserted();
            updated += result.updated();
            if (watermarkFrozen) {
                return;
            }
            for (SourceRecord record : records) {
                maxRecordDate = latest(maxRecordDate, record.recordDate());
            }
        }

        void error(String message) {
            if (errors.size() < MAX_REPORTED_ERRORS) {
                errors.add(message);
            }
        }

        SyncStatus status() {
            if (failed == 0 && !sourceFailed) {
                return SyncStatus.SUCCESS;
            }
            return processed - failed > 0 ? SyncStatus.PARTIAL : SyncStatus.FAILED;
        }
    }
}
