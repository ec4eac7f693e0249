package com.scorebot.core.error;

/**
 * Base type for engine failures. Per-item failures are recoverable; only
 * {@link ConfigurationException} aborts a whole run.
 */
public abstract class EngineException extends RuntimeException {

    protected EngineException(String message) {
        super(message);
    }

    protected EngineException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Whether a collaborator call that failed with this exception may be attempted again after backoff.
     */
    public boolean retryable() {
        return false;
    }
}
