package com.good4it.lendingservice.controller;

import com.good4it.lendingservice.dto.FriendBalanceResponse;
import com.good4it.lendingservice.dto.LendingSummaryResponse;
import com.good4it.lendingservice.dto.ScoreAnalyticsResponse;
import com.good4it.lendingservice.service.LendingInsightService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/insights")
@RequiredArgsConstructor
public class InsightController {

    private final LendingInsightService insightService;

    @GetMapping("/summary")
    public ResponseEntity<LendingSummaryResponse> summary(@RequestHeader("X-User-ID") UUID userId) {
        return ResponseEntity.ok(insightService.summary(userId));
    }

    @GetMapping("/friends/{friendId}")
    public ResponseEntity<FriendBalanceResponse> friendBalance(
            @RequestHeader("X-User-ID") UUID userId,
            @PathVariable UUID friendId
    ) {
        return ResponseEntity.ok(insightService.friendBalance(userId, friendId));
    }

    @GetMapping("/score")
    public ResponseEntity<ScoreAnalyticsResponse> scoreAnalytics(
            @RequestHeader("X-User-ID") UUID userId,
            @RequestParam(defaultValue = "30d") String period
    ) {
        return ResponseEntity.ok(insightService.scoreAnalytics(userId, period));
    }
}
