package com.good4it.lendingservice.dto.client;

import java.time.Instant;
import java.util.UUID;

public record ScoreHistoryEntry(
        UUID id,
        UUID transactionId,
        String changeType,
        int scoreChange,
        int previousScore,
        int newScore,
        String description,
        Instant createdAt
) {
}
