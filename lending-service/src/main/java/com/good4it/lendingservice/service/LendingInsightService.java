package com.good4it.lendingservice.service;

import com.good4it.lendingservice.dto.FriendBalanceResponse;
import com.good4it.lendingservice.dto.LendingSummaryResponse;
import com.good4it.lendingservice.dto.ScoreAnalyticsResponse;

import java.util.UUID;

public interface LendingInsightService {

    LendingSummaryResponse summary(UUID userId);

    FriendBalanceResponse friendBalance(UUID userId, UUID friendId);

    ScoreAnalyticsResponse scoreAnalytics(UUID userId, String period);
}
