package com.scorebot.engine.model;

public enum TrendDirection {
    UPWARD,
    DOWNWARD,
    FLAT
}
