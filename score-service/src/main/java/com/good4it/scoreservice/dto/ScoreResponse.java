package com.good4it.scoreservice.dto;

import com.good4it.scoreservice.model.ScoreChangeType;

import java.util.Map;
import java.util.UUID;

public record ScoreResponse(
        UUID userId,
        int score,
        long totalChanges,
        Map<ScoreChangeType, ChangeTypeSummary> breakdown
) {
    public record ChangeTypeSummary(long occurrences, long totalChange) {
    }
}
