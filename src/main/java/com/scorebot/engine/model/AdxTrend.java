package com.scorebot.engine.model;

public enum AdxTrend {
    STRONG_UPTREND,
    STRONG_DOWNTREND,
    TRENDLESS
}
