package com.scorebot.engine.model;

public final class TuningSuggestion {
    public final String name;
    public final double value;

    public TuningSuggestion(String name, double value) {
        this.name = name == null ? "" : name.trim();
        this.value = value;
    }

    @Override
    public String toString() {
        return name + "=" + value;
    }
}
