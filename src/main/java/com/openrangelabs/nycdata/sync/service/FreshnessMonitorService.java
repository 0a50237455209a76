package com.openrangelabs.nycdata.sync.service;

import com.openrangelabs.nycdata.sync.dto.FreshnessCheckSummary;
import com.openrangelabs.nycdata.sync.entity.DataFreshness;
import com.openrangelabs.nycdata.sync.entity.DatasetConfig;
import com.openrangelabs.nycdata.sync.source.OpenDataClient;
import com.openrangelabs.nycdata.sync.store.DatasetRecordStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Asks the source for record counts and feeds them to the {@link FreshnessScorer}
 */
@Slf4j
@Service
public class FreshnessMonitorService {

    private static final int CHECK_CONCURRENCY = 4;

    private final DatasetRegistryService registryService;
    private final DatasetRecordStore recordStore;
    private final OpenDataClient openDataClient;
    private final FreshnessScorer scorer;
    private final Clock clock;

    public FreshnessMonitorService(DatasetRegistryService registryService,
                                   DatasetRecordStore recordStore,
                                   OpenDataClient openDataClient,
                                   FreshnessScorer scorer,
                                   Clock clock) {
        this.registryService = registryService;
        this.recordStore = recordStore;
        this.openDataClient = openDataClient;
        this.scorer = scorer;
        this.clock = clock;
    }

    /**
     * Check one dataset. A failed count check yields an unverified record, not an error.
     */
    public Mono<DataFreshness> checkDataset(String datasetId) {
        return registryService.getDataset(datasetId)
                .flatMap(this::check);
    }

    /**
     * Check every active dataset; failures stay with the dataset they happened on
     */
    public Mono<FreshnessCheckSummary> checkAllDatasets() {
        LocalDateTime startedAt = LocalDateTime.now(clock);
        return registryService.getActiveDatasets()
                .flatMap(dataset -> check(dataset)
                        .map(Optional::of)
                        .onErrorResume(error -> {
                            log.error("Freshness check failed for {}: {}", dataset.getDatasetId(), error.getMessage());
                            return Mono.just(Optional.empty());
                        }), CHECK_CONCURRENCY)
                .collectList()
                .map(results -> summarize(results, startedAt))
                .doOnNext(summary -> log.info("Freshness check finished: {} checked, {} stale, {} unverified, {} failed",
                        summary.checked(), summary.stale(), summary.unverified(), summary.failed()));
    }

    private Mono<DataFreshness> check(DatasetConfig dataset) {
        String datasetId = dataset.getDatasetId();
        Mono<Optional<Long>> remote = openDataClient.fetchRecordCount(dataset)
                .map(Optional::of)
                .onErrorResume(error -> {
                    log.warn("Record count check failed for {}: {}", datasetId, error.getMessage());
                    return Mono.just(Optional.empty());
                });

        return recordStore.countByDataset(datasetId)
                .defaultIfEmpty(0L)
                .zipWith(remote)
                .flatMap(tuple -> scorer.score(datasetId, tuple.getT1(), tuple.getT2().orElse(null)));
    }

    private FreshnessCheckSummary summarize(List<Optional<DataFreshness>> results, LocalDateTime checkedAt) {
        int stale = 0;
        int fresh = 0;
        int unverified = 0;
        int failed = 0;
        for (Optional<DataFreshness> result : results) {
            if (result.isEmpty()) {
                failed++;
                continue;
            }
            DataFreshness record = result.get();
            if (!Boolean.TRUE.equals(record.getVerified())) {
                unverified++;
            } else if (Boolean.TRUE.equals(record.getStale())) {
                stale++;
            } else {
                fresh++;
            }
        }
        return new FreshnessCheckSummary(results.size(), stale, fresh, unverified, failed, checkedAt);
    }

    public Flux<DataFreshness> getAllFreshness() {
        return registryService.getAllFreshness();
    }
}
