package com.scorebot.core.error;

public final class RateLimitException extends EngineException {

    public RateLimitException(String message) {
        super(message);
    }

    @Override
    public boolean retryable() {
        return true;
    }
}
