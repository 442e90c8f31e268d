package com.good4it.lendingservice.dto.client;

import java.util.UUID;

public record ScoreSnapshot(UUID userId, int score, long totalChanges) {
}
