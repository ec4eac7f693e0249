package com.scorebot.engine.model;

public enum SkipReason {
    NONE("none"),
    HISTORY_SHORT("history_short"),
    NOT_FOUND("not_found"),
    RATE_LIMIT("rate_limit"),
    TIMEOUT("timeout"),
    OTHER("other");

    private final String label;

    SkipReason(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
