package com.openrangelabs.nycdata.sync.service;

import com.openrangelabs.nycdata.sync.config.NycDataProperties;
import com.openrangelabs.nycdata.sync.entity.DataFreshness;
import com.openrangelabs.nycdata.sync.entity.DatasetConfig;
import com.openrangelabs.nycdata.sync.entity.SyncLog;
import com.openrangelabs.nycdata.sync.model.DatasetSnapshot;
import com.openrangelabs.nycdata.sync.model.SyncPlan;
import com.openrangelabs.nycdata.sync.model.SyncRecommendation;
import com.openrangelabs.nycdata.sync.model.SyncTier;
import com.openrangelabs.nycdata.sync.model.SyncType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the tiered sync plan from freshness records and sync history.
 *
 * <p>Tier rules, applied in order:
 * <ul>
 *   <li>inactive, sync-disabled or never verified: no action</li>
 *   <li>sync recommended and score below the critical threshold, never synced,
 *       or last sync older than the dataset's max age: immediate</li>
 *   <li>sync recommended, score below the moderate threshold and no sync in the recent window: within the hour</li>
 *   <li>any other recommended sync: today</li>
 *   <li>not recommended but stale or within the approaching margin of the threshold: this week</li>
 *   <li>everything else: no action</li>
 * </ul>
 * Within a tier, higher priority first, then lower score, then dataset id.
 */
@Service
public class RecommendationScheduler {

    private static final Logger logger = LoggerFactory.getLogger(RecommendationScheduler.class);

    static final Comparator<SyncRecommendation> TIER_ORDER = Comparator
            .comparingInt(SyncRecommendation::priority).reversed()
            .thenComparingDouble(rec -> rec.freshnessScore() != null ? rec.freshnessScore() : 1.0)
            .thenComparing(SyncRecommendation::datasetId);

    private static final int FULL_SYNC_AFTER_DAYS = 30;
    private static final long BASE_SYNC_SECONDS = 300;
    private static final long MAX_ESTIMATED_RECORDS = 5000;
    private static final long RECORDS_PER_SECOND = 50;

    private final DatasetRegistryService registryService;
    private final SyncLogService syncLogService;
    private final NycDataProperties.Freshness properties;
    private final Clock clock;

    public RecommendationScheduler(DatasetRegistryService registryService,
                                   SyncLogService syncLogService,
                                   NycDataProperties properties,
                                   Clock clock) {
        this.registryService = registryService;
        this.syncLogService = syncLogService;
        this.properties = properties.getFreshness();
        this.clock = clock;
    }

    /**
     * Plan over every dataset in the registry
     */
    public Mono<SyncPlan> generateSyncRecommendations() {
        return registryService.getAllDatasets()
                .concatMap(dataset -> Mono.zip(
                                registryService.getFreshness(dataset.getDatasetId()),
                                syncLogService.getLatestCompleted(dataset.getDatasetId())
                                        .map(Optional::of)
                                        .defaultIfEmpty(Optional.empty()))
                        .map(tuple -> new DatasetSnapshot(dataset, tuple.getT1(),
                                tuple.getT2().map(SyncLog::getEndTime).orElse(null))))
                .collectList()
                .map(snapshots -> plan(snapshots, LocalDateTime.now(clock)))
                .doOnNext(plan -> logger.info("Generated sync plan: {}", plan.summary()));
    }

    /**
     * Pure planning step
     */
    public SyncPlan plan(List<DatasetSnapshot> snapshots, LocalDateTime now) {
        Map<SyncTier, List<SyncRecommendation>> tiers = new EnumMap<>(SyncTier.class);
        for (SyncTier tier : SyncTier.values()) {
            tiers.put(tier, new ArrayList<>());
        }
        for (DatasetSnapshot snapshot : snapshots) {
            SyncRecommendation recommendation = recommend(snapshot, now);
            tiers.get(recommendation.tier()).add(recommendation);
        }
        tiers.values().forEach(list -> list.sort(TIER_ORDER));

        return new SyncPlan(
                List.copyOf(tiers.get(SyncTier.IMMEDIATE)),
                List.copyOf(tiers.get(SyncTier.WITHIN_HOUR)),
                List.copyOf(tiers.get(SyncTier.TODAY)),
                List.copyOf(tiers.get(SyncTier.THIS_WEEK)),
                List.copyOf(tiers.get(SyncTier.NO_ACTION)),
                now);
    }

    SyncRecommendation recommend(DatasetSnapshot snapshot, LocalDateTime now) {
        DatasetConfig dataset = snapshot.dataset();
        DataFreshness freshness = snapshot.freshness() != null
                ? snapshot.freshness()
                : new DataFreshness(dataset.getDatasetId());
        LocalDateTime lastSync = snapshot.lastSuccessfulSync();

        if (!Boolean.TRUE.equals(dataset.getActive())) {
            return build(snapshot, freshness, now, SyncTier.NO_ACTION, "Dataset is inactive");
        }
        if (!Boolean.TRUE.equals(dataset.getSyncEnabled())) {
            return build(snapshot, freshness, now, SyncTier.NO_ACTION, "Sync is disabled");
        }
        if (!freshness.hasBeenVerified() || freshness.getFreshnessScore() == null) {
            return build(snapshot, freshness, now, SyncTier.NO_ACTION, "Freshness has not been verified yet");
        }

        double score = freshness.getFreshnessScore();
        String unverified = Boolean.TRUE.equals(freshness.getVerified()) ? "" : " (unverified, last check failed)";

        if (Boolean.TRUE.equals(freshness.getRecommendSync())) {
            if (lastSync == null) {
                return build(snapshot, freshness, now, SyncTier.IMMEDIATE, "Never synced" + unverified);
            }
            if (score < properties.getCriticalThreshold()) {
                return build(snapshot, freshness, now, SyncTier.IMMEDIATE,
                        String.format("Critically stale: %.1f%% of source records held%s", score * 100, unverified));
            }
            if (lastSync.isBefore(now.minusHours(maxAgeHours(dataset)))) {
                return build(snapshot, freshness, now, SyncTier.IMMEDIATE,
                        "Last sync older than " + maxAgeHours(dataset) + " hours" + unverified);
            }
            boolean syncedRecently = !lastSync.isBefore(now.minusMinutes(properties.getRecentSyncWindowMinutes()));
            if (score < properties.getModerateThreshold() && !syncedRecently) {
                return build(snapshot, freshness, now, SyncTier.WITHIN_HOUR,
                        String.format("Moderately stale: %.1f%% of source records held%s", score * 100, unverified));
            }
            return build(snapshot, freshness, now, SyncTier.TODAY,
                    (syncedRecently ? "Source grew since the last sync" : "Mildly stale") + unverified);
        }

        if (Boolean.TRUE.equals(freshness.getStale())
                || score < properties.getStaleThreshold() + properties.getApproachingMargin()) {
            return build(snapshot, freshness, now, SyncTier.THIS_WEEK,
                    String.format("Approaching staleness threshold: %.2f%% current", score * 100));
        }
        return build(snapshot, freshness, now, SyncTier.NO_ACTION, "Data is current");
    }

    /**
     * Full when there is no usable watermark, the last sync is old, or the count gap is large
     */
    SyncType chooseSyncType(DatasetConfig dataset, DataFreshness freshness, LocalDateTime lastSync, LocalDateTime now) {
        if (!dataset.supportsIncrementalSync() || lastSync == null) {
            return SyncType.FULL;
        }
        if (lastSync.isBefore(now.minusDays(FULL_SYNC_AFTER_DAYS))) {
            return SyncType.FULL;
        }
        Long remote = freshness.getRemoteRecordCount();
        if (remote != null && remote > 0
                && (double) freshness.getRecordGap() / remote > properties.getFullSyncGapRatio()) {
            return SyncType.FULL;
        }
        return SyncType.INCREMENTAL;
    }

    long estimateDurationSeconds(SyncType syncType, DataFreshness freshness) {
        if (syncType == SyncType.FULL) {
            return BASE_SYNC_SECONDS * 4;
        }
        long records = Math.min(freshness.getRecordGap(), MAX_ESTIMATED_RECORDS);
        return Math.max(60, records / RECORDS_PER_SECOND);
    }

    private SyncRecommendation build(DatasetSnapshot snapshot, DataFreshness freshness, LocalDateTime now,
                                     SyncTier tier, String reason) {
        DatasetConfig dataset = snapshot.dataset();
        SyncType syncType = chooseSyncType(dataset, freshness, snapshot.lastSuccessfulSync(), now);
        return new SyncRecommendation(
                dataset.getDatasetId(),
                dataset.getName(),
                dataset.getPriority() != null ? dataset.getPriority() : 0,
                tier,
                syncType,
                reason,
                freshness.getFreshnessScore(),
                Boolean.TRUE.equals(freshness.getVerified()),
                snapshot.lastSuccessfulSync(),
                estimateDurationSeconds(syncType, freshness));
    }

    private int maxAgeHours(DatasetConfig dataset) {
        return dataset.getMaxAgeHours() != null ? dataset.getMaxAgeHours() : properties.getDefaultMaxAgeHours();
    }
}
