package com.scorebot.engine.model;

import java.util.List;
import java.util.Map;

public final class DecisionOutcome {
    public enum Status {
        EVALUATED,
        ALREADY_EVALUATED,
        FAILED
    }

    public final long runId;
    public final String ticker;
    public final Status status;
    public final double realizedPct;
    public final Map<String, Double> applied;
    public final List<String> rejected;
    public final List<String> discarded;
    public final String detail;

    private DecisionOutcome(
            long runId,
            String ticker,
            Status status,
            double realizedPct,
            Map<String, Double> applied,
            List<String> rejected,
            List<String> discarded,
            String detail
    ) {
        this.runId = runId;
        this.ticker = ticker;
        this.status = status;
        this.realizedPct = realizedPct;
        this.applied = applied == null ? Map.of() : Map.copyOf(applied);
        this.rejected = rejected == null ? List.of() : List.copyOf(rejected);
        this.discarded = discarded == null ? List.of() : List.copyOf(discarded);
        this.detail = detail == null ? "" : detail;
    }

    public static DecisionOutcome evaluated(
            DecisionRecord decision,
            double realizedPct,
            Map<String, Double> applied,
            List<String> rejected,
            List<String> discarded
    ) {
        return new DecisionOutcome(decision.runId, decision.ticker(), Status.EVALUATED, realizedPct, applied, rejected, discarded, "");
    }

    public static DecisionOutcome alreadyEvaluated(DecisionRecord decision) {
        return new DecisionOutcome(decision.runId, decision.ticker(), Status.ALREADY_EVALUATED, Double.NaN, null, null, null, "");
    }

    public static DecisionOutcome failed(DecisionRecord decision, double realizedPct, String detail) {
        return new DecisionOutcome(decision.runId, decision.ticker(), Status.FAILED, realizedPct, null, null, null, detail);
    }
}
