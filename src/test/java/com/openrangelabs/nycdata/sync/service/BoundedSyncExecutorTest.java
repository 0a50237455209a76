package com.openrangelabs.nycdata.sync.service;

import com.openrangelabs.nycdata.sync.config.NycDataProperties;
import com.openrangelabs.nycdata.sync.entity.SyncLog;
import com.openrangelabs.nycdata.sync.model.ExecutionProgress;
import com.openrangelabs.nycdata.sync.model.ExecutionSummary;
import com.openrangelabs.nycdata.sync.model.IngestOptions;
import com.openrangelabs.nycdata.sync.model.SyncItemResult;
import com.openrangelabs.nycdata.sync.model.SyncPlan;
import com.openrangelabs.nycdata.sync.model.SyncRecommendation;
import com.openrangelabs.nycdata.sync.model.SyncStatus;
import com.openrangelabs.nycdata.sync.model.SyncTier;
import com.openrangelabs.nycdata.sync.model.SyncType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BoundedSyncExecutorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-01T12:00:00Z"), ZoneOffset.UTC);
    private static final LocalDateTime NOW = LocalDateTime.now(CLOCK);

    @Mock
    private RecommendationScheduler recommendationScheduler;

    @Mock
    private IngestionPipeline pipeline;

    @Mock
    private SyncLogService syncLogService;

    private BoundedSyncExecutor executor;

    @BeforeEach
    void setUp() {
        executor = new BoundedSyncExecutor(recommendationScheduler, pipeline, syncLogService,
            new NycDataProperties(), CLOCK);
    }

    @Test
    void execute_ZeroDuration_SkipsEverything() {
        List<SyncRecommendation> queue = List.of(item("aaaa-0001"), item("bbbb-0001"), item("cccc-0001"));

        StepVerifier.create(executor.execute(queue, 2, 0, "tester"))
            .expectNextMatches(summary -> {
                assertThat(summary.executed()).isZero();
                assertThat(summary.failed()).isZero();
                assertThat(summary.skipped()).isEqualTo(3);
                assertThat(summary.successRate()).isZero();
                assertThat(summary.totalDurationMillis()).isZero();
                return true;
            })
            .verifyComplete();

        verifyNoInteractions(pipeline);
    }

    @Test
    void execute_OneDatasetFails_SiblingsStillSucceed() {
        when(syncLogService.hasActiveRun(anyString())).thenReturn(Mono.just(false));
        when(pipeline.ingest(eq("aaaa-0001"), any(IngestOptions.class)))
            .thenReturn(Mono.just(log("aaaa-0001", SyncStatus.SUCCESS, 10)));
        when(pipeline.ingest(eq("bbbb-0001"), any(IngestOptions.class)))
            .thenReturn(Mono.just(log("bbbb-0001", SyncStatus.FAILED, 0)));
        when(pipeline.ingest(eq("cccc-0001"), any(IngestOptions.class)))
            .thenReturn(Mono.just(log("cccc-0001", SyncStatus.PARTIAL, 5)));

        List<SyncRecommendation> queue = List.of(item("aaaa-0001"), item("bbbb-0001"), item("cccc-0001"));

        StepVerifier.create(executor.execute(queue, 2, 60, "tester"))
            .expectNextMatches(summary -> {
                assertThat(summary.executed()).isEqualTo(2);
                assertThat(summary.failed()).isEqualTo(1);
                assertThat(summary.skipped()).isZero();
                assertThat(summary.successRate()).isEqualTo(67);
                assertThat(summary.results()).extracting(SyncItemResult::datasetId)
                    .containsExactly("aaaa-0001", "bbbb-0001", "cccc-0001");
                assertThat(summary.results().get(1).outcome()).isEqualTo(SyncItemResult.Outcome.FAILED);
                return true;
            })
            .verifyComplete();
    }

    @Test
    void execute_PipelineErrors_CountedAsFailedNotPropagated() {
        when(syncLogService.hasActiveRun(anyString())).thenReturn(Mono.just(false));
        when(pipeline.ingest(eq("aaaa-0001"), any(IngestOptions.class)))
            .thenReturn(Mono.error(new IllegalStateException("database down")));
        when(pipeline.ingest(eq("bbbb-0001"), any(IngestOptions.class)))
            .thenReturn(Mono.just(log("bbbb-0001", SyncStatus.SUCCESS, 3)));

        StepVerifier.create(executor.execute(List.of(item("aaaa-0001"), item("bbbb-0001")), 1, 60, "tester"))
            .expectNextMatches(summary -> {
                assertThat(summary.executed()).isEqualTo(1);
                assertThat(summary.failed()).isEqualTo(1);
                assertThat(summary.results().get(0).message()).isEqualTo("database down");
                return true;
            })
            .verifyComplete();
    }

    @Test
    void execute_ActiveRun_SkipsDataset() {
        when(syncLogService.hasActiveRun("aaaa-0001")).thenReturn(Mono.just(true));
        when(syncLogService.hasActiveRun("bbbb-0001")).thenReturn(Mono.just(false));
        when(pipeline.ingest(eq("bbbb-0001"), any(IngestOptions.class)))
            .thenReturn(Mono.just(log("bbbb-0001", SyncStatus.SUCCESS, 3)));

        StepVerifier.create(executor.execute(List.of(item("aaaa-0001"), item("bbbb-0001")), 2, 60, "tester"))
            .expectNextMatches(summary -> {
                assertThat(summary.executed()).isEqualTo(1);
                assertThat(summary.skipped()).isEqualTo(1);
                assertThat(summary.results().get(0).outcome()).isEqualTo(SyncItemResult.Outcome.SKIPPED);
                return true;
            })
            .verifyComplete();

        verify(pipeline, never()).ingest(eq("aaaa-0001"), any(IngestOptions.class));
    }

    @Test
    void execute_NeverExceedsMaxConcurrent() {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxObserved = new AtomicInteger();
        when(syncLogService.hasActiveRun(anyString())).thenReturn(Mono.just(false));
        when(pipeline.ingest(anyString(), any(IngestOptions.class))).thenAnswer(invocation -> {
            String datasetId = invocation.getArgument(0);
            return Mono.delay(Duration.ofMillis(30))
                .map(tick -> log(datasetId, SyncStatus.SUCCESS, 1))
                .doOnSubscribe(subscription -> maxObserved.accumulateAndGet(inFlight.incrementAndGet(), Math::max))
                .doFinally(signal -> inFlight.decrementAndGet());
        });

        List<SyncRecommendation> queue = IntStream.range(0, 8)
            .mapToObj(i -> item(String.format("ds%02d-0001", i)))
            .collect(Collectors.toList());

        StepVerifier.create(executor.execute(queue, 3, 60, "tester"))
            .expectNextMatches(summary -> summary.executed() == 8)
            .verifyComplete();

        assertThat(maxObserved.get()).isLessThanOrEqualTo(3);
        assertThat(maxObserved.get()).isGreaterThan(1);
    }

    @Test
    void execute_SlowFirstItem_DoesNotHoldBackLaterItems() {
        Sinks.One<SyncLog> slowRun = Sinks.one();
        when(syncLogService.hasActiveRun(anyString())).thenReturn(Mono.just(false));
        when(pipeline.ingest(eq("slow-0001"), any(IngestOptions.class))).thenReturn(slowRun.asMono());
        when(pipeline.ingest(startsWith("fast"), any(IngestOptions.class))).thenAnswer(invocation ->
            Mono.just(log(invocation.getArgument(0), SyncStatus.SUCCESS, 1)));

        List<SyncRecommendation> queue = List.of(item("slow-0001"), item("fast-0001"), item("fast-0002"),
            item("fast-0003"), item("fast-0004"));
        AtomicReference<ExecutionSummary> finished = new AtomicReference<>();

        executor.execute(queue, 2, 60, "tester").subscribe(finished::set);

        // every fast item ran through the second slot while the first one is still in flight
        verify(pipeline, times(4)).ingest(startsWith("fast"), any(IngestOptions.class));
        assertThat(finished.get()).isNull();
        assertThat(executor.currentProgress().inFlight()).isEqualTo(1);
        assertThat(executor.currentProgress().executed()).isEqualTo(4);

        slowRun.tryEmitValue(log("slow-0001", SyncStatus.SUCCESS, 5));

        assertThat(finished.get()).isNotNull();
        assertThat(finished.get().executed()).isEqualTo(5);
        assertThat(finished.get().results()).extracting(SyncItemResult::datasetId)
            .containsExactly("slow-0001", "fast-0001", "fast-0002", "fast-0003", "fast-0004");
    }

    @Test
    void execute_WhileAnotherExecutionRuns_RejectedWithoutTouchingIt() {
        Sinks.One<SyncLog> firstRun = Sinks.one();
        when(syncLogService.hasActiveRun(anyString())).thenReturn(Mono.just(false));
        when(pipeline.ingest(eq("aaaa-0001"), any(IngestOptions.class))).thenReturn(firstRun.asMono());

        AtomicReference<ExecutionSummary> first = new AtomicReference<>();
        executor.execute(List.of(item("aaaa-0001")), 1, 60, "scheduler").subscribe(first::set);

        StepVerifier.create(executor.execute(List.of(item("aaaa-0001"), item("bbbb-0001")), 2, 60, "alice"))
            .expectNextMatches(summary -> {
                assertThat(summary.skipped()).isEqualTo(2);
                assertThat(summary.executed()).isZero();
                assertThat(summary.results()).allSatisfy(result -> {
                    assertThat(result.outcome()).isEqualTo(SyncItemResult.Outcome.SKIPPED);
                    assertThat(result.message()).isEqualTo("Another sync execution is in progress");
                });
                return true;
            })
            .verifyComplete();

        // the running execution still owns the progress counters
        assertThat(executor.currentProgress().running()).isTrue();
        assertThat(executor.currentProgress().queued()).isEqualTo(1);
        verify(pipeline, times(1)).ingest(anyString(), any(IngestOptions.class));

        firstRun.tryEmitValue(log("aaaa-0001", SyncStatus.SUCCESS, 1));

        assertThat(first.get().executed()).isEqualTo(1);
        assertThat(executor.currentProgress().running()).isFalse();
    }

    @Test
    void execute_PassesSyncTypeAndActorToPipeline() {
        when(syncLogService.hasActiveRun(anyString())).thenReturn(Mono.just(false));
        when(pipeline.ingest(anyString(), any(IngestOptions.class)))
            .thenReturn(Mono.just(log("aaaa-0001", SyncStatus.SUCCESS, 1)));

        SyncRecommendation incremental = new SyncRecommendation("aaaa-0001", "A", 50, SyncTier.TODAY,
            SyncType.INCREMENTAL, "test", 0.95, true, NOW.minusHours(1), 60);

        StepVerifier.create(executor.execute(List.of(incremental), 1, 60, "alice"))
            .expectNextCount(1)
            .verifyComplete();

        verify(pipeline).ingest("aaaa-0001", new IngestOptions(false, null, null, "alice"));
    }

    @Test
    void executeRecommendedSyncs_RunsOnlyActionableTiers() {
        SyncPlan plan = new SyncPlan(
            List.of(item("aaaa-0001")),
            List.of(),
            List.of(),
            List.of(item("week-0001")),
            List.of(item("none-0001")),
            NOW);
        when(recommendationScheduler.generateSyncRecommendations()).thenReturn(Mono.just(plan));
        when(syncLogService.hasActiveRun(anyString())).thenReturn(Mono.just(false));
        when(pipeline.ingest(eq("aaaa-0001"), any(IngestOptions.class)))
            .thenReturn(Mono.just(log("aaaa-0001", SyncStatus.SUCCESS, 1)));

        StepVerifier.create(executor.executeRecommendedSyncs(null, null, "system"))
            .expectNextMatches(summary -> summary.executed() == 1 && summary.results().size() == 1)
            .verifyComplete();

        verify(pipeline, times(1)).ingest(anyString(), any(IngestOptions.class));
    }

    @Test
    void currentProgress_ReflectsLastExecution() {
        assertThat(executor.currentProgress().running()).isFalse();
        assertThat(executor.currentProgress().queued()).isZero();

        executor.execute(List.of(item("aaaa-0001"), item("bbbb-0001")), 2, 0, "tester").block();

        ExecutionProgress progress = executor.currentProgress();
        assertThat(progress.running()).isFalse();
        assertThat(progress.queued()).isEqualTo(2);
        assertThat(progress.skipped()).isEqualTo(2);
        assertThat(progress.remaining()).isZero();
        assertThat(progress.deadline()).isEqualTo(NOW);
    }

    private static SyncRecommendation item(String datasetId) {
        return new SyncRecommendation(datasetId, "Dataset " + datasetId, 50, SyncTier.IMMEDIATE,
            SyncType.FULL, "test", 0.3, true, null, 1200);
    }

    private static SyncLog log(String datasetId, SyncStatus status, int processed) {
        SyncLog log = new SyncLog(datasetId, SyncType.FULL, NOW, "tester");
        log.setId((long) Math.abs(datasetId.hashCode()));
        log.setStatus(status.value());
        log.setRecordsProcessed(processed);
        log.setRecordsAdded(processed);
        log.setEndTime(NOW);
        return log;
    }
}
