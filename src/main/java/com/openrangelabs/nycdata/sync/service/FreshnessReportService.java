package com.openrangelabs.nycdata.sync.service;

import com.openrangelabs.nycdata.sync.dto.SyncLogQuery;
import com.openrangelabs.nycdata.sync.dto.SyncLogStats;
import com.openrangelabs.nycdata.sync.entity.DataFreshness;
import com.openrangelabs.nycdata.sync.entity.DatasetConfig;
import com.openrangelabs.nycdata.sync.model.FreshnessHealth;
import com.openrangelabs.nycdata.sync.model.StaleDataset;
import com.openrangelabs.nycdata.sync.model.SyncStatus;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read-only views over the stored freshness records of the active datasets
 */
@Service
public class FreshnessReportService {

    static final int SUCCESS_WINDOW_DAYS = 30;
    static final int HIGH_PRIORITY = 80;
    static final double FAILING_SUCCESS_RATE = 50.0;
    static final double LOW_SUCCESS_RATE = 30.0;
    static final int MAX_CONCERNS = 5;

    private final DatasetRegistryService registryService;
    private final SyncLogService syncLogService;
    private final Clock clock;

    public FreshnessReportService(DatasetRegistryService registryService,
                                  SyncLogService syncLogService,
                                  Clock clock) {
        this.registryService = registryService;
        this.syncLogService = syncLogService;
        this.clock = clock;
    }

    /**
     * Stale active datasets, highest priority first and worst score first within a priority
     */
    public Mono<List<StaleDataset>> getStaleDatasets() {
        return Mono.zip(activeDatasets(), freshnessById())
                .map(tuple -> tuple.getT1().stream()
                        .filter(dataset -> {
                            DataFreshness freshness = tuple.getT2().get(dataset.getDatasetId());
                            return freshness != null && Boolean.TRUE.equals(freshness.getStale());
                        })
                        .map(dataset -> toStale(dataset, tuple.getT2().get(dataset.getDatasetId())))
                        .sorted(Comparator.comparingInt(StaleDataset::priority).reversed()
                                .thenComparingDouble(stale -> stale.freshnessScore() != null ? stale.freshnessScore() : 0.0))
                        .collect(Collectors.toList()));
    }

    public Mono<FreshnessHealth> getHealth() {
        LocalDateTime now = LocalDateTime.now(clock);
        SyncLogQuery window = new SyncLogQuery(null, null, now.minusDays(SUCCESS_WINDOW_DAYS), null, 0, 0);
        return Mono.zip(activeDatasets(), freshnessById(), syncLogService.getStatistics(window).collectList())
                .map(tuple -> health(tuple.getT1(), tuple.getT2(), successRates(tuple.getT3()), now));
    }

    FreshnessHealth health(List<DatasetConfig> datasets, Map<String, DataFreshness> freshnessById,
                           Map<String, Double> successRates, LocalDateTime now) {
        int healthy = 0;
        int stale = 0;
        int unverified = 0;
        int failing = 0;
        double freshnessSum = 0;
        int scored = 0;
        double successSum = 0;
        int withRuns = 0;
        long totalRecords = 0;
        List<FreshnessHealth.Concern> concerns = new ArrayList<>();

        for (DatasetConfig dataset : datasets) {
            DataFreshness freshness = freshnessById.getOrDefault(dataset.getDatasetId(), new DataFreshness(dataset.getDatasetId()));
            Double successRate = successRates.get(dataset.getDatasetId());
            boolean isStale = Boolean.TRUE.equals(freshness.getStale());
            boolean isVerified = Boolean.TRUE.equals(freshness.getVerified());

            if (isStale) {
                stale++;
            } else if (isVerified) {
                healthy++;
            }
            if (!isVerified) {
                unverified++;
            }
            if (freshness.getFreshnessScore() != null) {
                freshnessSum += freshness.getFreshnessScore() * 100;
                scored++;
            }
            if (successRate != null) {
                successSum += successRate;
                withRuns++;
                if (successRate < FAILING_SUCCESS_RATE) {
                    failing++;
                }
            }
            if (freshness.getOurRecordCount() != null) {
                totalRecords += freshness.getOurRecordCount();
            }
            concernFor(dataset, freshness, successRate).ifPresent(concerns::add);
        }

        double averageFreshness = scored > 0 ? round(freshnessSum / scored) : 0.0;
        // no finished run in the window means nothing has failed
        double averageSuccess = withRuns > 0 ? round(successSum / withRuns) : 100.0;
        double healthyShare = datasets.isEmpty() ? 0.0 : 100.0 * healthy / datasets.size();
        int overall = datasets.isEmpty() ? 0
                : (int) Math.round(averageFreshness * 0.4 + averageSuccess * 0.3 + healthyShare * 0.3);

        concerns.sort(Comparator.comparing(FreshnessHealth.Concern::severity)
                .thenComparing(Comparator.comparingInt(FreshnessHealth.Concern::priority).reversed()));
        List<FreshnessHealth.Concern> top = concerns.size() > MAX_CONCERNS ? concerns.subList(0, MAX_CONCERNS) : concerns;

        return new FreshnessHealth(overall, datasets.size(), healthy, stale, unverified, failing,
                averageFreshness, averageSuccess, totalRecords, List.copyOf(top), now);
    }

    private Optional<FreshnessHealth.Concern> concernFor(DatasetConfig dataset, DataFreshness freshness,
                                                      Double successRate) {
        int priority = dataset.getPriority() != null ? dataset.getPriority() : 0;
        boolean isStale = Boolean.TRUE.equals(freshness.getStale());
        String score = freshness.getFreshnessScore() != null
                ? String.format(Locale.ROOT, "%.1f%% fresh", freshness.getFreshnessScore() * 100)
                : "not scored";

        FreshnessHealth.Concern concern = null;
        if (isStale && priority > HIGH_PRIORITY) {
            concern = concern(dataset, "High priority dataset is stale (" + score + ")", FreshnessHealth.Severity.HIGH);
        } else if (successRate != null && successRate < LOW_SUCCESS_RATE) {
            concern = concern(dataset, String.format(Locale.ROOT, "Low sync success rate (%.1f%%)", successRate), FreshnessHealth.Severity.HIGH);
        } else if (isStale) {
            concern = concern(dataset, "Dataset is stale (" + score + ")", FreshnessHealth.Severity.MEDIUM);
        } else if (freshness.hasBeenVerified() && !Boolean.TRUE.equals(freshness.getVerified())) {
            concern = concern(dataset, "Latest record count check failed", FreshnessHealth.Severity.MEDIUM);
        }
        return Optional.ofNullable(concern);
    }

    private static FreshnessHealth.Concern concern(DatasetConfig dataset, String issue, FreshnessHealth.Severity severity) {
        return new FreshnessHealth.Concern(dataset.getDatasetId(), dataset.getName(), issue, severity,
                dataset.getPriority() != null ? dataset.getPriority() : 0);
    }

    /**
     * Percentage of finished runs per dataset that completed, partial runs included
     */
    static Map<String, Double> successRates(List<SyncLogStats> stats) {
        Map<String, long[]> counts = new HashMap<>();
        for (SyncLogStats row : stats) {
            SyncStatus status = SyncStatus.fromValue(row.status());
            if (status == null || !status.isTerminal()) {
                continue;
            }
            long[] pair = counts.computeIfAbsent(row.datasetId(), id -> new long[2]);
            if (status.isCompleted()) {
                pair[0] += row.runs();
            }
            pair[1] += row.runs();
        }
        Map<String, Double> rates = new HashMap<>();
        counts.forEach((datasetId, pair) -> {
            if (pair[1] > 0) {
                rates.put(datasetId, 100.0 * pair[0] / pair[1]);
            }
        });
        return rates;
    }

    private StaleDataset toStale(DatasetConfig dataset, DataFreshness freshness) {
        return new StaleDataset(dataset.getDatasetId(), dataset.getName(),
                dataset.getPriority() != null ? dataset.getPriority() : 0,
                freshness.getFreshnessScore(),
                freshness.getRecordGap(),
                Boolean.TRUE.equals(freshness.getVerified()),
                freshness.getLastChecked());
    }

    private Mono<List<DatasetConfig>> activeDatasets() {
        return registryService.getActiveDatasets().collectList();
    }

    private Mono<Map<String, DataFreshness>> freshnessById() {
        return registryService.getAllFreshness()
                .collectMap(DataFreshness::getDatasetId, Function.identity());
    }

    private static double round(double value) {
        return Math.round(value * 10) / 10.0;
    }
}
