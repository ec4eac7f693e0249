package com.scorebot.engine.model;

import java.util.Locale;

public enum RiskLevel {
    NONE("none"),
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String label;

    RiskLevel(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * @return the matching level, or null when the label is blank or unknown
     */
    public static RiskLevel fromLabel(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return null;
        }
        String target = raw.trim().toLowerCase(Locale.ROOT);
        for (RiskLevel level : values()) {
            if (level.label.equals(target)) {
                return level;
            }
        }
        return null;
    }
}
