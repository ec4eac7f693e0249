package com.scorebot.engine.model;

import java.time.LocalDate;
import java.util.List;

public final class FeedbackReport {
    public final LocalDate tuningDate;
    public final List<DecisionOutcome> outcomes;

    public FeedbackReport(LocalDate tuningDate, List<DecisionOutcome> outcomes) {
        this.tuningDate = tuningDate;
        this.outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
    }

    public long count(DecisionOutcome.Status status) {
        return outcomes.stream().filter(o -> o.status == status).count();
    }

    public int appliedCount() {
        return outcomes.stream().mapToInt(o -> o.applied.size()).sum();
    }
}
