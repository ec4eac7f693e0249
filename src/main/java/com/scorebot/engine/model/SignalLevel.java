package com.scorebot.engine.model;

public enum SignalLevel {
    BUY,
    BUY_READY,
    NEUTRAL,
    SELL_READY,
    SELL
}
