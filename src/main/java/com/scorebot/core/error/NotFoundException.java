package com.scorebot.core.error;

public final class NotFoundException extends EngineException {

    public NotFoundException(String message) {
        super(message);
    }

    @Override
    public boolean retryable() {
        return true;
    }
}
