package com.good4it.scoreservice.dto;

public record ScoreDeltaResult(int previousScore, int newScore, int scoreChange) {
}
