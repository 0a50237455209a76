package com.openrangelabs.nycdata.sync.service;

import com.openrangelabs.nycdata.sync.config.NycDataProperties;
import com.openrangelabs.nycdata.sync.entity.SyncLog;
import com.openrangelabs.nycdata.sync.model.ExecutionProgress;
import com.openrangelabs.nycdata.sync.model.ExecutionSummary;
import com.openrangelabs.nycdata.sync.model.IngestOptions;
import com.openrangelabs.nycdata.sync.model.SyncItemResult;
import com.openrangelabs.nycdata.sync.model.SyncRecommendation;
import com.openrangelabs.nycdata.sync.model.SyncType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.function.Tuple2;
import reactor.util.function.Tuples;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Runs queued sync recommendations with at most {@code maxConcurrent} ingestions in flight
 * and no new start after the wall-clock deadline. Items not started in time are skipped;
 * in-flight ingestions are left to finish under their own time budget.
 */
@Service
public class BoundedSyncExecutor {

    private static final Logger logger = LoggerFactory.getLogger(BoundedSyncExecutor.class);

    private final RecommendationScheduler recommendationScheduler;
    private final IngestionPipeline pipeline;
    private final SyncLogService syncLogService;
    private final NycDataProperties.Executor properties;
    private final Clock clock;

    private final AtomicReference<ExecutionTracker> current = new AtomicReference<>();

    public BoundedSyncExecutor(RecommendationScheduler recommendationScheduler,
                               IngestionPipeline pipeline,
                               SyncLogService syncLogService,
                               NycDataProperties properties,
                               Clock clock) {
        this.recommendationScheduler = recommendationScheduler;
        this.pipeline = pipeline;
        this.syncLogService = syncLogService;
        this.properties = properties.getExecutor();
        this.clock = clock;
    }

    /**
     * Generate a fresh plan and run its immediate, within-hour and today tiers
     */
    public Mono<ExecutionSummary> executeRecommendedSyncs(Integer maxConcurrent, Long maxDurationSeconds, String triggeredBy) {
        int concurrency = maxConcurrent != null ? maxConcurrent : properties.getDefaultMaxConcurrent();
        long duration = maxDurationSeconds != null ? maxDurationSeconds : properties.getDefaultMaxDurationSeconds();
        return recommendationScheduler.generateSyncRecommendations()
                .flatMap(plan -> execute(plan.executionQueue(), concurrency, duration, triggeredBy));
    }

    /**
     * Run {@code queue} in place of the current execution. Only one execution runs at a time;
     * a call made while another is in flight skips every item and leaves the running one untouched.
     * Slots are handed out as ingestions finish, results are reported in queue order.
     */
    public Mono<ExecutionSummary> execute(List<SyncRecommendation> queue, int maxConcurrent,
                                          long maxDurationSeconds, String triggeredBy) {
        return Mono.defer(() -> {
            int concurrency = Math.max(1, Math.min(maxConcurrent, properties.getMaxConcurrentLimit()));
            Instant startedAt = clock.instant();
            ExecutionTracker tracker = new ExecutionTracker(queue.size(), startedAt,
                    startedAt.plusSeconds(Math.max(0, maxDurationSeconds)));

            ExecutionTracker previous = current.get();
            if ((previous != null && previous.running) || !current.compareAndSet(previous, tracker)) {
                logger.warn("Rejecting execution of {} syncs requested by {}: another execution is in progress",
                        queue.size(), triggeredBy);
                return Mono.just(rejected(queue, tracker));
            }

            logger.info("Executing {} recommended syncs (maxConcurrent={}, maxDuration={}s)",
                    queue.size(), concurrency, maxDurationSeconds);

            return Flux.fromIterable(queue)
                    .index()
                    .flatMap(indexed -> runItem(indexed.getT2(), tracker, triggeredBy)
                            .map(result -> Tuples.of(indexed.getT1(), result)), concurrency)
                    .collectSortedList((a, b) -> Long.compare(a.getT1(), b.getT1()))
                    .map(indexed -> indexed.stream().map(Tuple2::getT2).collect(Collectors.toList()))
                    .map(results -> summarize(results, tracker))
                    .doFinally(signal -> tracker.finish())
                    .doOnNext(summary -> logger.info("Execution finished: executed={}, failed={}, skipped={}, successRate={}%",
                            summary.executed(), summary.failed(), summary.skipped(), summary.successRate()));
        });
    }

    private ExecutionSummary rejected(List<SyncRecommendation> queue, ExecutionTracker tracker) {
        tracker.finish();
        List<SyncItemResult> results = queue.stream()
                .map(item -> SyncItemResult.skipped(item.datasetId(), "Another sync execution is in progress"))
                .collect(Collectors.toList());
        tracker.skipped.addAndGet(results.size());
        return summarize(results, tracker);
    }

    /**
     * Counters of the current execution, or of the last one once it finished
     */
    public ExecutionProgress currentProgress() {
        ExecutionTracker tracker = current.get();
        return tracker == null ? ExecutionProgress.idle() : tracker.snapshot();
    }

    private Mono<SyncItemResult> runItem(SyncRecommendation item, ExecutionTracker tracker, String triggeredBy) {
        return Mono.defer(() -> {
            Instant now = clock.instant();
            if (!now.isBefore(tracker.deadline)) {
                tracker.skipped.incrementAndGet();
                return Mono.just(SyncItemResult.skipped(item.datasetId(), "Execution deadline reached"));
            }
            return syncLogService.hasActiveRun(item.datasetId())
                    .onErrorReturn(false)
                    .defaultIfEmpty(false)
                    .flatMap(active -> {
                        if (active) {
                            tracker.skipped.incrementAndGet();
                            return Mono.just(SyncItemResult.skipped(item.datasetId(), "A sync is already in progress"));
                        }
                        return ingest(item, tracker, triggeredBy);
                    });
        });
    }

    private Mono<SyncItemResult> ingest(SyncRecommendation item, ExecutionTracker tracker, String triggeredBy) {
        tracker.inFlight.incrementAndGet();
        tracker.markStarted(clock.instant());
        long started = clock.millis();
        IngestOptions options = new IngestOptions(item.syncType() == SyncType.FULL, null, null, triggeredBy);

        return pipeline.ingest(item.datasetId(), options)
                .map(log -> toResult(item.datasetId(), log, clock.millis() - started))
                .onErrorResume(error -> {
                    logger.error("Sync of {} failed outside its run: {}", item.datasetId(), error.getMessage(), error);
                    return Mono.just(new SyncItemResult(item.datasetId(), SyncItemResult.Outcome.FAILED, null,
                            0, 0, clock.millis() - started, error.getMessage()));
                })
                .switchIfEmpty(Mono.fromSupplier(() -> new SyncItemResult(item.datasetId(), SyncItemResult.Outcome.FAILED,
                        null, 0, 0, clock.millis() - started, "Ingestion produced no result")))
                .doOnNext(result -> {
                    if (result.outcome() == SyncItemResult.Outcome.EXECUTED) {
                        tracker.executed.incrementAndGet();
                    } else {
                        tracker.failed.incrementAndGet();
                    }
                    tracker.markFinished(clock.instant());
                })
                .doFinally(signal -> tracker.inFlight.decrementAndGet());
    }

    private SyncItemResult toResult(String datasetId, SyncLog log, long durationMillis) {
        SyncItemResult.Outcome outcome = log.isCompleted()
                ? SyncItemResult.Outcome.EXECUTED
                : SyncItemResult.Outcome.FAILED;
        return new SyncItemResult(datasetId, outcome, log.getId(),
                log.getRecordsProcessed() != null ? log.getRecordsProcessed() : 0,
                log.getRecordsAdded() != null ? log.getRecordsAdded() : 0,
                durationMillis,
                log.getErrorMessage());
    }

    private ExecutionSummary summarize(List<SyncItemResult> results, ExecutionTracker tracker) {
        int executed = 0;
        int failed = 0;
        int skipped = 0;
        for (SyncItemResult result : results) {
            switch (result.outcome()) {
                case EXECUTED -> executed++;
                case FAILED -> failed++;
                case SKIPPED -> skipped++;
            }
        }
        return new ExecutionSummary(executed, failed, skipped,
                tracker.totalDurationMillis(),
                ExecutionSummary.successRate(executed, failed),
                results,
                LocalDateTime.ofInstant(tracker.startedAt, clock.getZone()),
                LocalDateTime.now(clock));
    }

    /**
     * Shared counters of one execution; workers only touch the atomics
     */
    private final class ExecutionTracker {
        private final int queued;
        private final Instant startedAt;
        private final Instant deadline;
        private final AtomicInteger inFlight = new AtomicInteger();
        private final AtomicInteger executed = new AtomicInteger();
        private final AtomicInteger failed = new AtomicInteger();
        private final AtomicInteger skipped = new AtomicInteger();
        private final AtomicReference<Instant> firstStart = new AtomicReference<>();
        private final AtomicReference<Instant> lastFinish = new AtomicReference<>();
        private volatile boolean running = true;

        ExecutionTracker(int queued, Instant startedAt, Instant deadline) {
            this.queued = queued;
            this.startedAt = startedAt;
            this.deadline = deadline;
        }

        void markStarted(Instant at) {
            firstStart.compareAndSet(null, at);
        }

        void markFinished(Instant at) {
            lastFinish.accumulateAndGet(at, (prev, next) -> prev == null || next.isAfter(prev) ? next : prev);
        }

        long totalDurationMillis() {
            Instant first = firstStart.get();
            Instant last = lastFinish.get();
            if (first == null || last == null) {
                return 0;
            }
            return Math.max(0, last.toEpochMilli() - first.toEpochMilli());
        }

        void finish() {
            running = false;
        }

        ExecutionProgress snapshot() {
            return new ExecutionProgress(running, queued, inFlight.get(), executed.get(), failed.get(), skipped.get(),
                    LocalDateTime.ofInstant(startedAt, clock.getZone()),
                    LocalDateTime.ofInstant(deadline, clock.getZone()));
        }
    }
}
