package com.openrangelabs.nycdata.sync.scheduler;

import com.openrangelabs.nycdata.sync.service.BoundedSyncExecutor;
import com.openrangelabs.nycdata.sync.service.FreshnessMonitorService;
import com.openrangelabs.nycdata.sync.service.SyncLogService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic freshness checks, optional automatic syncs and the stale run sweep
 */
@Component
public class SyncScheduler {

    private static final Logger logger = LoggerFactory.getLogger(SyncScheduler.class);

    static final String SYSTEM_ACTOR = "system";

    private final FreshnessMonitorService freshnessMonitorService;
    private final BoundedSyncExecutor syncExecutor;
    private final SyncLogService syncLogService;

    @Value("${nycdata.scheduling.enabled:true}")
    private boolean schedulingEnabled;

    @Value("${nycdata.scheduling.auto-sync.enabled:false}")
    private boolean autoSyncEnabled;

    public SyncScheduler(FreshnessMonitorService freshnessMonitorService,
                         BoundedSyncExecutor syncExecutor,
                         SyncLogService syncLogService) {
        this.freshnessMonitorService = freshnessMonitorService;
        this.syncExecutor = syncExecutor;
        this.syncLogService = syncLogService;
    }

    /**
     * Check every active dataset. Every 6 hours by default.
     */
    @Scheduled(fixedDelayString = "${nycdata.scheduling.freshness-check-interval-ms:21600000}", initialDelay = 60000)
    public void scheduledFreshnessCheck() {
        if (!schedulingEnabled) {
            logger.debug("Scheduled freshness check is disabled");
            return;
        }
        runFreshnessCheck();
    }

    @Scheduled(fixedDelayString = "${nycdata.scheduling.auto-sync.interval-ms:3600000}", initialDelay = 300000)
    public void scheduledAutoSync() {
        if (!schedulingEnabled || !autoSyncEnabled) {
            logger.debug("Automatic sync is disabled");
            return;
        }
        runAutoSync();
    }

    /**
     * Report runs stuck in progress. Hourly; the rows are left untouched.
     */
    @Scheduled(cron = "0 0 * * * ?")
    public void sweepStaleRuns() {
        if (!schedulingEnabled) {
            return;
        }
        runStaleRunSweep();
    }

    public void runFreshnessCheck() {
        logger.info("Starting scheduled freshness check");
        freshnessMonitorService.checkAllDatasets()
                .subscribe(
                        summary -> logger.info("Scheduled freshness check: {} checked, {} stale, {} unverified",
                                summary.checked(), summary.stale(), summary.unverified()),
                        error -> logger.error("Error during scheduled freshness check: {}", error.getMessage()));
    }

    public void runAutoSync() {
        logger.info("Starting automatic execution of recommended syncs");
        syncExecutor.executeRecommendedSyncs(null, null, SYSTEM_ACTOR)
                .subscribe(
                        summary -> logger.info("Automatic sync: executed={}, failed={}, skipped={}",
                                summary.executed(), summary.failed(), summary.skipped()),
                        error -> logger.error("Error during automatic sync: {}", error.getMessage()));
    }

    public void runStaleRunSweep() {
        syncLogService.findStaleInProgress()
                .doOnNext(log -> logger.warn("Sync log {} for {} is still in progress since {}",
                        log.getId(), log.getDatasetId(), log.getStartTime()))
                .count()
                .subscribe(
                        count -> {
                            if (count > 0) {
                                logger.warn("Found {} stale in-progress sync runs", count);
                            }
                        },
                        error -> logger.error("Error during stale run sweep: {}", error.getMessage()));
    }
}
