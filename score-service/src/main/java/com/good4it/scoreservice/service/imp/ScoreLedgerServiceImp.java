package com.good4it.scoreservice.service.imp;

import com.good4it.scoreservice.core.exceptions.InvalidHistoryLimitException;
import com.good4it.scoreservice.core.exceptions.UnknownChangeTypeException;
import com.good4it.scoreservice.core.util.ScoreUtil;
import com.good4it.scoreservice.dto.ScoreDeltaRequest;
import com.good4it.scoreservice.dto.ScoreDeltaResult;
import com.good4it.scoreservice.dto.ScoreResponse;
import com.good4it.scoreservice.model.ScoreChangeType;
import com.good4it.scoreservice.model.ScoreHistory;
import com.good4it.scoreservice.model.UserScore;
import com.good4it.scoreservice.repository.ScoreHistoryRepository;
import com.good4it.scoreservice.repository.UserScoreRepository;
import com.good4it.scoreservice.service.ScoreLedgerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.PageRequest;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Service
@Slf4j
@RequiredArgsConstructor
public class ScoreLedgerServiceImp implements ScoreLedgerService {

    private final UserScoreRepository userScoreRepository;
    private final ScoreHistoryRepository historyRepository;

    @Override
    @Transactional(isolation = Isolation.READ_COMMITTED)
    @Retryable(
            retryFor = {OptimisticLockingFailureException.class, DataIntegrityViolationException.class},
            maxAttempts = 4,
            backoff = @Backoff(delay = 50, multiplier = 2))
    public ScoreDeltaResult applyScoreDelta(UUID userId, ScoreDeltaRequest request) {
        ScoreChangeType changeType = parseChangeType(request.changeType());

        // Concurrent first touches collide on the primary key and are retried
        UserScore userScore = userScoreRepository.findById(userId)
                .orElseGet(() -> UserScore.builder()
                        .userId(userId)
                        .score(ScoreUtil.DEFAULT_SCORE)
                        .build());

        int previous = userScore.getScore();
        int updated = ScoreUtil.clamp((long) previous + request.scoreChange());
        int applied = updated - previous;

        userScore.setScore(updated);
        userScoreRepository.saveAndFlush(userScore);

        historyRepository.save(ScoreHistory.builder()
                .userId(userId)
                .transactionId(request.transactionId())
                .changeType(changeType)
                .scoreChange(applied)
                .previousScore(previous)
                .newScore(updated)
                .description(request.description())
                .metadata(request.metadata() == null ? Map.of() : request.metadata())
                .build());

        if (applied != request.scoreChange()) {
            log.info("Score change {} for user {} clamped to {} ({} -> {})",
                    request.scoreChange(), userId, applied, previous, updated);
        } else {
            log.info("Score of user {} changed by {} for {} ({} -> {})", userId, applied, changeType, previous, updated);
        }

        return new ScoreDeltaResult(previous, updated, applied);
    }

    @Override
    @Transactional(readOnly = true)
    public ScoreResponse getScore(UUID userId) {
        int score = userScoreRepository.findById(userId)
                .map(UserScore::getScore)
                .orElse(ScoreUtil.DEFAULT_SCORE);

        Map<ScoreChangeType, ScoreResponse.ChangeTypeSummary> breakdown = new EnumMap<>(ScoreChangeType.class);
        long total = 0;
        for (ScoreHistoryRepository.ChangeTypeTotal row : historyRepository.totalsByChangeType(userId)) {
            breakdown.put(row.getChangeType(),
                    new ScoreResponse.ChangeTypeSummary(row.getOccurrences(), row.getTotalChange()));
            total += row.getOccurrences();
        }

        return new ScoreResponse(userId, score, total, breakdown);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ScoreHistory> getHistory(UUID userId, Integer limit, Instant since) {
        int size = limit == null ? ScoreUtil.DEFAULT_HISTORY_LIMIT : limit;
        if (size < 1 || size > ScoreUtil.MAX_HISTORY_LIMIT) {
            throw new InvalidHistoryLimitException(size, ScoreUtil.MAX_HISTORY_LIMIT);
        }
        if (since != null) {
            return historyRepository.findByUserIdAndCreatedAtGreaterThanEqualOrderByCreatedAtDesc(userId, since,
                    PageRequest.of(0, size));
        }
        return historyRepository.findByUserIdOrderByCreatedAtDesc(userId, PageRequest.of(0, size));
    }

    private static ScoreChangeType parseChangeType(String changeType) {
        try {
            return ScoreChangeType.valueOf(changeType.trim().toUpperCase());
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new UnknownChangeTypeException(changeType);
        }
    }
}
