package com.scorebot.core.error;

public final class CallTimeoutException extends EngineException {

    public CallTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean retryable() {
        return true;
    }
}
