package com.scorebot.core.error;

public final class AiServiceException extends EngineException {

    public AiServiceException(String message) {
        super(message);
    }

    public AiServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
