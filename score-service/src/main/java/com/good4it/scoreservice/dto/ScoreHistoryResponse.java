package com.good4it.scoreservice.dto;

import com.good4it.scoreservice.model.ScoreChangeType;
import com.good4it.scoreservice.model.ScoreHistory;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record ScoreHistoryResponse(
        UUID id,
        UUID transactionId,
        ScoreChangeType changeType,
        int scoreChange,
        int previousScore,
        int newScore,
        String description,
        Map<String, Object> metadata,
        Instant createdAt
) {
    public static ScoreHistoryResponse from(ScoreHistory history) {
        return new ScoreHistoryResponse(
                history.getId(),
                history.getTransactionId(),
                history.getChangeType(),
                history.getScoreChange(),
                history.getPreviousScore(),
                history.getNewScore(),
                history.getDescription(),
                history.getMetadata(),
                history.getCreatedAt()
        );
    }
}
