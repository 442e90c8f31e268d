package com.good4it.scoreservice.core.util;

public class ScoreUtil {

    private ScoreUtil(){}

    public static final int MIN_SCORE = 0;
    public static final int MAX_SCORE = 100;
    public static final int DEFAULT_SCORE = 50;

    public static final int MAX_HISTORY_LIMIT = 100;
    public static final int DEFAULT_HISTORY_LIMIT = 20;

    public static int clamp(long score) {
        return (int) Math.max(MIN_SCORE, Math.min(MAX_SCORE, score));
    }
}
