package com.scorebot.engine.model;

public enum DmiCross {
    GOLDEN_CROSS,
    DEAD_CROSS
}
