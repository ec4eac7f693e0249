package com.scorebot.engine.model;

/**
 * Explicit per-ticker result of one run: either a scored row or a skip with its reason.
 */
public final class TickerOutcome {
    public final String ticker;
    public final AnalysisResult result;
    public final SkipReason skipReason;
    public final String detail;
    public final boolean gated;
    public final boolean notified;

    private TickerOutcome(String ticker, AnalysisResult result, SkipReason skipReason, String detail, boolean gated, boolean notified) {
        this.ticker = ticker;
        this.result = result;
        this.skipReason = skipReason == null ? SkipReason.NONE : skipReason;
        this.detail = detail == null ? "" : detail;
        this.gated = gated;
        this.notified = notified;
    }

    public static TickerOutcome scored(AnalysisResult result, boolean gated, boolean notified) {
        return new TickerOutcome(result.ticker, result, SkipReason.NONE, "", gated, notified);
    }

    public static TickerOutcome skipped(String ticker, SkipReason reason, String detail) {
        return new TickerOutcome(ticker, null, reason, detail, false, false);
    }

    public boolean isScored() {
        return result != null;
    }
}
