package com.scorebot.engine.output;

public interface Notifier {

    /**
     * Best-effort notification. Returns false on failure; implementations log instead of throwing.
     */
    boolean sendNotification(String ticker, String rationale);
}
