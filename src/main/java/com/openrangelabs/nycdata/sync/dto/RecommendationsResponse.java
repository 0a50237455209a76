package com.openrangelabs.nycdata.sync.dto;

import com.openrangelabs.nycdata.sync.model.SyncPlan;
import com.openrangelabs.nycdata.sync.model.SyncRecommendation;

import java.time.LocalDateTime;
import java.util.List;

public record RecommendationsResponse(
        List<SyncRecommendation> immediate,
        List<SyncRecommendation> withinHour,
        List<SyncRecommendation> today,
        List<SyncRecommendation> thisWeek,
        List<SyncRecommendation> noAction,
        Summary summary,
        LocalDateTime generatedAt) {

    public static RecommendationsResponse from(SyncPlan plan) {
        SyncPlan.PlanSummary counts = plan.summary();
        return new RecommendationsResponse(plan.immediate(), plan.withinHour(), plan.today(),
                plan.thisWeek(), plan.noAction(),
                new Summary(counts.immediate(), counts.withinHour(), counts.today(), counts.thisWeek(),
                        counts.noAction(), counts.getTotalRecommendations()),
                plan.generatedAt());
    }

    public record Summary(int immediate, int withinHour, int today, int thisWeek, int noAction,
                          int totalRecommendations) {
    }
}
