package com.good4it.scoreservice;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.good4it.scoreservice.dto.ScoreDeltaRequest;
import com.good4it.scoreservice.repository.ScoreHistoryRepository;
import com.good4it.scoreservice.repository.UserScoreRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.Map;
import java.util.UUID;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
@AutoConfigureMockMvc
@ActiveProfiles("test")
class ScoreControllerE2ETest {

    @Container
    @ServiceConnection
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine");

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private UserScoreRepository userScoreRepository;

    @Autowired
    private ScoreHistoryRepository historyRepository;

    private UUID userId;

    @BeforeEach
    void setup() {
        historyRepository.deleteAll();
        userScoreRepository.deleteAll();
        userId = UUID.randomUUID();
    }

    @Test
    @DisplayName("POST /scores/{userId}/deltas - applies the delta and records history")
    void testApplyDelta() throws Exception {
        postDelta(new ScoreDeltaRequest("REPAYMENT_COMPLETED", 5, "Repaid 120.00", Map.of("amount", "120.00"), UUID.randomUUID()))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.previousScore").value(50))
                .andExpect(jsonPath("$.newScore").value(55))
                .andExpect(jsonPath("$.scoreChange").value(5));

        postDelta(new ScoreDeltaRequest("LATE_REPAYMENT", -3, null, null, null))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.newScore").value(52));

        mockMvc.perform(get("/scores/{userId}", userId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.score").value(52))
                .andExpect(jsonPath("$.totalChanges").value(2))
                .andExpect(jsonPath("$.breakdown.LATE_REPAYMENT.totalChange").value(-3));

        mockMvc.perform(get("/scores/{userId}/history", userId).param("limit", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1));
    }

    @Test
    @DisplayName("GET /scores/{userId}/history - since filters out older changes")
    void testHistorySince() throws Exception {
        postDelta(new ScoreDeltaRequest("TRANSACTION_COMPLETED", 2, null, null, null))
                .andExpect(status().isCreated());

        mockMvc.perform(get("/scores/{userId}/history", userId).param("since", "2000-01-01T00:00:00Z"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1));

        mockMvc.perform(get("/scores/{userId}/history", userId).param("since", "2999-01-01T00:00:00Z"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));
    }

    @Test
    @DisplayName("POST /scores/{userId}/deltas - unknown change type returns 400")
    void testUnknownChangeType() throws Exception {
        postDelta(new ScoreDeltaRequest("GOOD_VIBES", 5, null, null, null))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("UNKNOWN_CHANGE_TYPE"));
    }

    @Test
    @DisplayName("POST /scores/{userId}/deltas - missing score change returns 400")
    void testValidation() throws Exception {
        postDelta(new ScoreDeltaRequest("FALSE_DISPUTE", null, null, null, null))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_FAILED"));
    }

    @Test
    @DisplayName("GET /scores/{userId}/history - limit above 100 returns 400")
    void testHistoryLimit() throws Exception {
        mockMvc.perform(get("/scores/{userId}/history", userId).param("limit", "101"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_LIMIT"));
    }

    private ResultActions postDelta(ScoreDeltaRequest request) throws Exception {
        return mockMvc.perform(post("/scores/{userId}/deltas", userId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)));
    }
}
