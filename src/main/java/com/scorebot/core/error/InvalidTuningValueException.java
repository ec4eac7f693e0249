package com.scorebot.core.error;

public final class InvalidTuningValueException extends EngineException {
    private final String name;
    private final double value;

    public InvalidTuningValueException(String name, double value, String reason) {
        super("invalid tuning value name=" + name + " value=" + value + " reason=" + reason);
        this.name = name;
        this.value = value;
    }

    public String name() {
        return name;
    }

    public double value() {
        return value;
    }
}
