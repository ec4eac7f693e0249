package com.scorebot.engine.model;

public final class RationaleResult {
    public final String rationale;
    public final RiskLevel risk;

    public RationaleResult(String rationale, RiskLevel risk) {
        this.rationale = rationale == null ? "" : rationale;
        this.risk = risk;
    }
}
