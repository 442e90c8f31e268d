package com.good4it.scoreservice.service;

import com.good4it.scoreservice.dto.ScoreDeltaRequest;
import com.good4it.scoreservice.dto.ScoreDeltaResult;
import com.good4it.scoreservice.dto.ScoreResponse;
import com.good4it.scoreservice.model.ScoreHistory;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface ScoreLedgerService {

    ScoreDeltaResult applyScoreDelta(UUID userId, ScoreDeltaRequest request);

    ScoreResponse getScore(UUID userId);

    List<ScoreHistory> getHistory(UUID userId, Integer limit, Instant since);
}
