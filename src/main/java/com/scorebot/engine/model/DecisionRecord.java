package com.scorebot.engine.model;

import java.time.Instant;

/**
 * A persisted result together with the context of the run that produced it.
 */
public final class DecisionRecord {
    public final long runId;
    public final Instant analyzedAt;
    public final TuningParameters parametersUsed;
    public final AnalysisResult result;

    public DecisionRecord(long runId, Instant analyzedAt, TuningParameters parametersUsed, AnalysisResult result) {
        this.runId = runId;
        this.analyzedAt = analyzedAt;
        this.parametersUsed = parametersUsed == null ? new TuningParameters(null) : parametersUsed;
        this.result = result;
    }

    public String ticker() {
        return result.ticker;
    }
}
