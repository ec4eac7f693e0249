package com.scorebot.engine.model;

public enum RunState {
    STARTED,
    PARAMETERS_RESOLVED,
    SCORED,
    GATED,
    PERSISTED,
    DONE,
    FAILED
}
