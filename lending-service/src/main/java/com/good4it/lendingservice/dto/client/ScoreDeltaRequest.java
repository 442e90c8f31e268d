package com.good4it.lendingservice.dto.client;

import java.util.Map;
import java.util.UUID;

public record ScoreDeltaRequest(
        String changeType,
        int scoreChange,
        String description,
        Map<String, Object> metadata,
        UUID transactionId
) {
}
