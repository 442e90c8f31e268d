package com.good4it.lendingservice.service.reputation;

import com.good4it.lendingservice.dto.client.ScoreDeltaRequest;
import com.good4it.lendingservice.dto.client.ScoreDeltaResult;
import com.good4it.lendingservice.dto.client.ScoreHistoryEntry;
import com.good4it.lendingservice.dto.client.ScoreSnapshot;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface ReputationLedger {

    int MAX_HISTORY = 100;

    ScoreDeltaResult applyScoreDelta(UUID userId, ScoreDeltaRequest request);

    ScoreSnapshot currentScore(UUID userId);

    // Newest first, at most MAX_HISTORY entries
    List<ScoreHistoryEntry> history(UUID userId, Instant since);
}
