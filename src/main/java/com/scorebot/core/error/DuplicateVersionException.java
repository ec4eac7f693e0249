package com.scorebot.core.error;

import java.time.LocalDate;

/**
 * A tuning parameter version already exists for (effective date, name). The existing row stays authoritative.
 */
public final class DuplicateVersionException extends EngineException {
    private final LocalDate effectiveDate;
    private final String name;

    public DuplicateVersionException(LocalDate effectiveDate, String name) {
        super("tuning parameter version exists: date=" + effectiveDate + " name=" + name);
        this.effectiveDate = effectiveDate;
        this.name = name;
    }

    public LocalDate effectiveDate() {
        return effectiveDate;
    }

    public String name() {
        return name;
    }
}
