package com.scorebot.core.error;

public final class InsufficientHistoryException extends EngineException {
    private final int required;
    private final int actual;

    public InsufficientHistoryException(String indicator, int required, int actual) {
        super("insufficient history for " + indicator + ": required=" + required + " actual=" + actual);
        this.required = required;
        this.actual = actual;
    }

    public int required() {
        return required;
    }

    public int actual() {
        return actual;
    }
}
