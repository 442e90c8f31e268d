package com.good4it.lendingservice.client;

import com.good4it.lendingservice.core.exception.ExternalServiceException;
import com.good4it.lendingservice.dto.client.ScoreDeltaRequest;
import com.good4it.lendingservice.dto.client.ScoreDeltaResult;
import com.good4it.lendingservice.dto.client.ScoreHistoryEntry;
import com.good4it.lendingservice.dto.client.ScoreSnapshot;
import com.good4it.lendingservice.service.reputation.ReputationLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Component
@Slf4j
@RequiredArgsConstructor
public class ScoreLedgerClient implements ReputationLedger {

    private final RestClient restClient;

    @Value("${app.score-service.url}")
    private String scoreServiceUrl;

    @Override
    public ScoreDeltaResult applyScoreDelta(UUID userId, ScoreDeltaRequest request) {
        return restClient.post()
                .uri(scoreServiceUrl + "/scores/{userId}/deltas", userId)
                .body(request)
                .retrieve()
                .body(ScoreDeltaResult.class);
    }

    @Override
    public ScoreSnapshot currentScore(UUID userId) {
        try {
            return restClient.get()
                    .uri(scoreServiceUrl + "/scores/{userId}", userId)
                    .retrieve()
                    .body(ScoreSnapshot.class);
        } catch (Exception e) {
            log.error("Score service unreachable while reading the score of {}", userId, e);
            throw new ExternalServiceException("Score service", e);
        }
    }

    @Override
    public List<ScoreHistoryEntry> history(UUID userId, Instant since) {
        UriComponentsBuilder uri = UriComponentsBuilder.fromUriString(scoreServiceUrl)
                .path("/scores/{userId}/history")
                .queryParam("limit", MAX_HISTORY);
        if (since != null) {
            uri.queryParam("since", since.toString());
        }
        URI target = uri.buildAndExpand(userId).encode().toUri();

        try {
            List<ScoreHistoryEntry> entries = restClient.get()
                    .uri(target)
                    .retrieve()
                    .body(new ParameterizedTypeReference<List<ScoreHistoryEntry>>() {});
            return entries == null ? List.of() : entries;
        } catch (Exception e) {
            log.error("Score service unreachable while reading the history of {}", userId, e);
            throw new ExternalServiceException("Score service", e);
        }
    }
}
