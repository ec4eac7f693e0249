package com.scorebot.engine.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Marker of a processed decision: once present, the feedback loop never evaluates it again.
 */
public final class DecisionEvaluation {
    public final long runId;
    public final String ticker;
    public final Instant evaluatedAt;
    public final double realizedPct;
    public final Map<String, Double> applied;

    public DecisionEvaluation(long runId, String ticker, Instant evaluatedAt, double realizedPct, Map<String, Double> applied) {
        this.runId = runId;
        this.ticker = ticker;
        this.evaluatedAt = evaluatedAt;
        this.realizedPct = realizedPct;
        this.applied = applied == null ? Map.of() : Map.copyOf(new LinkedHashMap<>(applied));
    }
}
