package com.good4it.lendingservice.dto;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record ScoreAnalyticsResponse(
        int currentScore,
        String period,
        int totalChanges,
        int positiveChanges,
        int negativeChanges,
        long totalScoreChange,
        Map<String, ChangeTypeStats> changeTypes,
        List<MonthlyTrend> monthlyTrend,
        List<ScoreEvent> topPositiveEvents,
        List<ScoreEvent> topNegativeEvents
) {
    public record ChangeTypeStats(int count, long totalChange, double averageChange) {
    }

    public record MonthlyTrend(String month, long scoreChange, int changes) {
    }

    public record ScoreEvent(String changeType, int scoreChange, String description, UUID transactionId,
                             Instant date) {
    }
}
