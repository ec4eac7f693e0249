package com.scorebot.engine.model;

import java.time.Instant;
import java.util.List;

public final class RunReport {
    public final long runId;
    public final Instant analyzedAt;
    public final RunState state;
    public final List<TickerOutcome> outcomes;
    public final String error;

    public RunReport(long runId, Instant analyzedAt, RunState state, List<TickerOutcome> outcomes, String error) {
        this.runId = runId;
        this.analyzedAt = analyzedAt;
        this.state = state;
        this.outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
        this.error = error == null ? "" : error;
    }

    public int scoredCount() {
        return (int) outcomes.stream().filter(TickerOutcome::isScored).count();
    }

    public int skippedCount() {
        return outcomes.size() - scoredCount();
    }

    public int gatedCount() {
        return (int) outcomes.stream().filter(o -> o.gated).count();
    }

    public int notifiedCount() {
        return (int) outcomes.stream().filter(o -> o.notified).count();
    }

    public TickerOutcome outcomeFor(String ticker) {
        for (TickerOutcome outcome : outcomes) {
            if (outcome.ticker.equals(ticker)) {
                return outcome;
            }
        }
        return null;
    }
}
