package com.openrangelabs.nycdata.sync.model;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Datasets partitioned into urgency tiers. Every dataset of the registry is in exactly one list.
 */
public record SyncPlan(
        List<SyncRecommendation> immediate,
        List<SyncRecommendation> withinHour,
        List<SyncRecommendation> today,
        List<SyncRecommendation> thisWeek,
        List<SyncRecommendation> noAction,
        LocalDateTime generatedAt) {

    public List<SyncRecommendation> tier(SyncTier tier) {
        return switch (tier) {
            case IMMEDIATE -> immediate;
            case WITHIN_HOUR -> withinHour;
            case TODAY -> today;
            case THIS_WEEK -> thisWeek;
            case NO_ACTION -> noAction;
        };
    }

    /**
     * Work the executor runs: immediate, then within the hour, then today
     */
    public List<SyncRecommendation> executionQueue() {
        List<SyncRecommendation> queue = new ArrayList<>(immediate.size() + withinHour.size() + today.size());
        queue.addAll(immediate);
        queue.addAll(withinHour);
        queue.addAll(today);
        return queue;
    }

    public PlanSummary summary() {
        return new PlanSummary(immediate.size(), withinHour.size(), today.size(), thisWeek.size(), noAction.size());
    }

    public record PlanSummary(int immediate, int withinHour, int today, int thisWeek, int noAction) {

        public int getTotalRecommendations() {
            return immediate + withinHour + today + thisWeek;
        }
    }
}
