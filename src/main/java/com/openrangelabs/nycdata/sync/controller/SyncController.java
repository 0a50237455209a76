package com.openrangelabs.nycdata.sync.controller;

import com.openrangelabs.nycdata.sync.dto.ExecuteRecommendedRequest;
import com.openrangelabs.nycdata.sync.dto.IngestRequest;
import com.openrangelabs.nycdata.sync.dto.RecommendationsResponse;
import com.openrangelabs.nycdata.sync.dto.SyncLogPage;
import com.openrangelabs.nycdata.sync.dto.SyncLogQuery;
import com.openrangelabs.nycdata.sync.entity.SyncLog;
import com.openrangelabs.nycdata.sync.model.ExecutionProgress;
import com.openrangelabs.nycdata.sync.model.ExecutionSummary;
import com.openrangelabs.nycdata.sync.service.BoundedSyncExecutor;
import com.openrangelabs.nycdata.sync.service.FreshnessMonitorService;
import com.openrangelabs.nycdata.sync.service.FreshnessReportService;
import com.openrangelabs.nycdata.sync.service.IngestionPipeline;
import com.openrangelabs.nycdata.sync.service.RecommendationScheduler;
import com.openrangelabs.nycdata.sync.service.SyncLogService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.security.Principal;
import java.time.LocalDateTime;
import java.util.Locale;

/**
 * REST controller for freshness, sync planning and ingestion
 */
@RestController
@RequestMapping("/api/nyc-data")
@CrossOrigin(origins = "${nycdata.security.cors.allowed-origins:http://localhost:3000}")
@Tag(name = "Sync", description = "Freshness checks, sync recommendations and ingestion runs")
public class SyncController {

    private final RecommendationScheduler recommendationScheduler;
    private final BoundedSyncExecutor syncExecutor;
    private final IngestionPipeline ingestionPipeline;
    private final SyncLogService syncLogService;
    private final FreshnessMonitorService freshnessMonitorService;
    private final FreshnessReportService freshnessReportService;

    public SyncController(RecommendationScheduler recommendationScheduler,
                          BoundedSyncExecutor syncExecutor,
                          IngestionPipeline ingestionPipeline,
                          SyncLogService syncLogService,
                          FreshnessMonitorService freshnessMonitorService,
                          FreshnessReportService freshnessReportService) {
        this.recommendationScheduler = recommendationScheduler;
        this.syncExecutor = syncExecutor;
        this.ingestionPipeline = ingestionPipeline;
        this.syncLogService = syncLogService;
        this.freshnessMonitorService = freshnessMonitorService;
        this.freshnessReportService = freshnessReportService;
    }

    /**
     * Tiered sync plan over every registered dataset
     */
    @GetMapping("/recommendations")
    @PreAuthorize("hasRole('ADMIN') or hasRole('USER')")
    @Operation(summary = "Get the tiered sync plan")
    public Mono<RecommendationsResponse> getRecommendations() {
        return recommendationScheduler.generateSyncRecommendations()
                .map(RecommendationsResponse::from);
    }

    /**
     * Run the immediate, within-hour and today tiers under a concurrency and time bound.
     * Items that could not start before the deadline come back as skipped.
     */
    @PostMapping("/sync/execute-recommended")
    @PreAuthorize("hasRole('ADMIN')")
    @Operation(summary = "Execute recommended syncs")
    public Mono<ExecutionSummary> executeRecommended(
            @Valid @RequestBody(required = false) ExecuteRecommendedRequest request,
            Principal principal) {
        ExecuteRecommendedRequest limits = request != null ? request : new ExecuteRecommendedRequest();
        return syncExecutor.executeRecommendedSyncs(limits.getMaxConcurrent(), limits.getMaxDuration(), actor(principal));
    }

    @GetMapping("/sync/progress")
    @PreAuthorize("hasRole('ADMIN') or hasRole('USER')")
    public Mono<ExecutionProgress> getProgress() {
        return Mono.fromSupplier(syncExecutor::currentProgress);
    }

    /**
     * Ingest one dataset. The response is the finalized sync log, including failed runs.
     */
    @PostMapping("/ingest")
    @PreAuthorize("hasRole('ADMIN')")
    @Operation(summary = "Ingest a single dataset")
    public Mono<ResponseEntity<SyncLog>> ingest(@Valid @RequestBody IngestRequest request, Principal principal) {
        return ingestionPipeline.ingest(request.getDatasetId(), request.toOptions(actor(principal)))
                .map(ResponseEntity::ok);
    }

    @GetMapping("/logs")
    @PreAuthorize("hasRole('ADMIN') or hasRole('USER')")
    @Operation(summary = "Search sync logs")
    public Mono<SyncLogPage> getLogs(
            @RequestParam(required = false) String datasetId,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime endDate,
            @RequestParam(defaultValue = "50") int limit,
            @RequestParam(defaultValue = "0") int offset) {
        return syncLogService.searchLogs(new SyncLogQuery(datasetId, status, startDate, endDate, limit, offset));
    }

    /**
     * Stored freshness records. {@code view=stale} lists the stale active datasets by priority,
     * {@code view=health} summarizes freshness and sync success over the active datasets.
     */
    @GetMapping("/freshness")
    @PreAuthorize("hasRole('ADMIN') or hasRole('USER')")
    @Operation(summary = "Get freshness records, stale datasets or a health summary")
    public Mono<ResponseEntity<Object>> getFreshness(@RequestParam(defaultValue = "status") String view) {
        switch (view.toLowerCase(Locale.ROOT)) {
            case "status":
                return freshnessMonitorService.getAllFreshness()
                        .collectList()
                        .map(records -> ResponseEntity.<Object>ok(records));
            case "stale":
                return freshnessReportService.getStaleDatasets()
                        .map(stale -> ResponseEntity.<Object>ok(stale));
            case "health":
                return freshnessReportService.getHealth()
                        .map(health -> ResponseEntity.<Object>ok(health));
            default:
                return Mono.error(new ServerWebInputException("Unknown freshness view: " + view));
        }
    }

    /**
     * Check the source now, for one dataset or for every active one
     */
    @PostMapping("/freshness/check")
    @PreAuthorize("hasRole('ADMIN')")
    public Mono<ResponseEntity<Object>> checkFreshness(@RequestParam(required = false) String datasetId) {
        if (datasetId != null && !datasetId.isBlank()) {
            return freshnessMonitorService.checkDataset(datasetId)
                    .map(record -> ResponseEntity.<Object>ok(record));
        }
        return freshnessMonitorService.checkAllDatasets()
                .map(summary -> ResponseEntity.<Object>ok(summary));
    }

    static String actor(Principal principal) {
        return principal != null ? principal.getName() : "anonymous";
    }
}
