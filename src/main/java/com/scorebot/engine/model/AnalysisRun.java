package com.scorebot.engine.model;

import java.time.Instant;

public final class AnalysisRun {
    public final long id;
    public final Instant analyzedAt;
    public final TuningParameters parametersUsed;

    public AnalysisRun(long id, Instant analyzedAt, TuningParameters parametersUsed) {
        this.id = id;
        this.analyzedAt = analyzedAt;
        this.parametersUsed = parametersUsed == null ? new TuningParameters(null) : parametersUsed;
    }
}
