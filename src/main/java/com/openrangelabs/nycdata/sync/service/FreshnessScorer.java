package com.openrangelabs.nycdata.sync.service;

import com.openrangelabs.nycdata.sync.config.NycDataProperties;
import com.openrangelabs.nycdata.sync.entity.DataFreshness;
import com.openrangelabs.nycdata.sync.entity.DatasetConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Turns local and remote record counts into a freshness assessment.
 *
 * <p>The score is {@code min(1, ours / remote)}; an empty source scores 1.0. When the
 * remote count is unknown the previous assessment is kept and marked unverified, so a
 * failed count check never makes a dataset look fresh or urgent.
 */
@Component
public class FreshnessScorer {

    private static final Logger logger = LoggerFactory.getLogger(FreshnessScorer.class);

    private final DatasetRegistryService registryService;
    private final NycDataProperties.Freshness properties;
    private final Clock clock;

    public FreshnessScorer(DatasetRegistryService registryService, NycDataProperties properties, Clock clock) {
        this.registryService = registryService;
        this.properties = properties.getFreshness();
        this.clock = clock;
    }

    /**
     * Score a dataset and persist the result. {@code remoteCount} is null when the count check failed.
     */
    public Mono<DataFreshness> score(String datasetId, long ourCount, Long remoteCount) {
        LocalDateTime checkedAt = LocalDateTime.now(clock);
        return registryService.getDataset(datasetId)
                .zipWith(registryService.getFreshness(datasetId))
                .map(tuple -> evaluate(tuple.getT1(), tuple.getT2(), ourCount, remoteCount, checkedAt))
                .flatMap(registryService::saveFreshness)
                .doOnNext(record -> logger.debug("Scored {}: {}", datasetId, record));
    }

    /**
     * Pure scoring step
     */
    public DataFreshness evaluate(DatasetConfig dataset, DataFreshness previous,
                                  long ourCount, Long remoteCount, LocalDateTime checkedAt) {
        DataFreshness record = previous != null ? previous.copy() : new DataFreshness(dataset.getDatasetId());
        record.setLastChecked(latest(record.getLastChecked(), checkedAt));

        if (remoteCount == null || remoteCount < 0) {
            record.setVerified(false);
            return record;
        }

        long ours = Math.max(0L, ourCount);
        record.setOurRecordCount(ours);
        record.setRemoteRecordCount(remoteCount);
        applyScore(dataset, record, ours, remoteCount);
        record.setVerified(true);
        record.setLastVerifiedAt(latest(record.getLastVerifiedAt(), checkedAt));
        return record;
    }

    /**
     * Optimistic update after a run: new local count against the last known remote count.
     * {@code lastChecked} is untouched; the next check supersedes this.
     */
    public DataFreshness afterSync(DatasetConfig dataset, DataFreshness previous, long ourCount) {
        DataFreshness record = previous != null ? previous.copy() : new DataFreshness(dataset.getDatasetId());
        long ours = Math.max(0L, ourCount);
        record.setOurRecordCount(ours);
        if (record.getRemoteRecordCount() != null) {
            applyScore(dataset, record, ours, record.getRemoteRecordCount());
        }
        return record;
    }

    public double computeScore(long ourCount, long remoteCount) {
        if (remoteCount == 0) {
            return 1.0;
        }
        return Math.min(1.0, (double) Math.max(0L, ourCount) / remoteCount);
    }

    public boolean isStale(double score) {
        return score < properties.getStaleThreshold();
    }

    private void applyScore(DatasetConfig dataset, DataFreshness record, long ours, long remote) {
        double score = computeScore(ours, remote);
        boolean stale = isStale(score);
        record.setFreshnessScore(score);
        record.setStale(stale);
        record.setRecommendSync(stale && dataset.isEligibleForSync());
    }

    private static LocalDateTime latest(LocalDateTime a, LocalDateTime b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.isAfter(b) ? a : b;
    }
}
