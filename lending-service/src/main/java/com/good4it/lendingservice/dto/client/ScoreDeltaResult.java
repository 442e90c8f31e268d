package com.good4it.lendingservice.dto.client;

public record ScoreDeltaResult(int previousScore, int newScore, int scoreChange) {
}
