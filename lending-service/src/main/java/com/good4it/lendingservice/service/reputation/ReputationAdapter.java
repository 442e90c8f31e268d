package com.good4it.lendingservice.service.reputation;

import com.good4it.lendingservice.dto.client.ScoreDeltaRequest;
import com.good4it.lendingservice.dto.client.ScoreDeltaResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

@Component
@Slf4j
@RequiredArgsConstructor
public class ReputationAdapter {

    private final ReputationLedger ledger;

    public void record(UUID userId, ScoreChangeType type, BigDecimal amount, UUID transactionId, String description) {
        record(userId, type, amount, false, transactionId, description, Map.of());
    }

    public void record(UUID userId, ScoreChangeType type, BigDecimal amount, boolean late, UUID transactionId,
                       String description, Map<String, Object> extra) {
        int delta = ScoreDeltaCalculator.calculate(type, amount, late);

        Map<String, Object> metadata = new HashMap<>(extra);
        if (amount != null) {
            metadata.put("amount", amount);
        }
        if (transactionId != null) {
            metadata.put("transactionId", transactionId);
        }

        try {
            ScoreDeltaResult result = ledger.applyScoreDelta(userId,
                    new ScoreDeltaRequest(type.name(), delta, description, metadata, transactionId));
            log.info("Score of user {} moved {} -> {} ({})", userId,
                    result.previousScore(), result.newScore(), type);
        } catch (Exception e) {
            log.error("Failed to apply {} score delta of {} to user {}: {}", type, delta, userId, e.getMessage());
        }
    }
}
