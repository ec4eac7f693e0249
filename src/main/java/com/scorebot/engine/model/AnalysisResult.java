package com.scorebot.engine.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Scored row of one ticker in one run. Rationale and risk flag are null when gating was not
 * triggered or the AI call failed.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class AnalysisResult {
    public final long runId;
    public final String ticker;
    public final double price;
    public final double rsi;
    public final double deviationRate;
    public final TrendDirection trend;
    public final double macdLine;
    public final double macdSignal;
    public final double dmiPlus;
    public final double dmiMinus;
    public final double adx;
    public final double volume;
    public final SignalFlags signals;
    public final int buyScore;
    public final int shortScore;
    public final String rationale;
    public final RiskLevel riskFlag;

    public static AnalysisResult of(long runId, IndicatorSnapshot snapshot, ScoreResult score) {
        return AnalysisResult.builder()
                .runId(runId)
                .ticker(snapshot.ticker)
                .price(snapshot.price)
                .rsi(snapshot.rsi)
                .deviationRate(snapshot.deviationRate)
                .trend(score.signals == null ? TrendDirection.FLAT : score.signals.trend)
                .macdLine(snapshot.macdLine)
                .macdSignal(snapshot.macdSignal)
                .dmiPlus(snapshot.dmiPlus)
                .dmiMinus(snapshot.dmiMinus)
                .adx(snapshot.adx)
                .volume(snapshot.volume)
                .signals(score.signals)
                .buyScore(score.buyScore)
                .shortScore(score.shortScore)
                .build();
    }

    public boolean hasRationale() {
        return rationale != null && !rationale.isEmpty();
    }
}
