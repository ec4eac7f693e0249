package com.scorebot.engine.query;

import com.scorebot.engine.model.AnalysisResult;
import com.scorebot.engine.model.AnalysisRun;

import java.util.List;

public final class TopSummary {
    public final AnalysisRun run;
    public final List<AnalysisResult> topBuy;
    public final List<AnalysisResult> topShort;

    public TopSummary(AnalysisRun run, List<AnalysisResult> topBuy, List<AnalysisResult> topShort) {
        this.run = run;
        this.topBuy = topBuy == null ? List.of() : List.copyOf(topBuy);
        this.topShort = topShort == null ? List.of() : List.copyOf(topShort);
    }

    public boolean isEmpty() {
        return run == null;
    }
}
