package com.scorebot.engine.strategy;

import com.scorebot.engine.Fixtures;
import com.scorebot.engine.model.AdxTrend;
import com.scorebot.engine.model.DmiCross;
import com.scorebot.engine.model.IndicatorSnapshot;
import com.scorebot.engine.model.ScoreResult;
import com.scorebot.engine.model.SignalLevel;
import com.scorebot.engine.model.TrendDirection;
import com.scorebot.engine.model.TuningParameters;
import com.scorebot.engine.tuning.ParameterCatalog;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScoringEngineTest {
    private final ScoringEngine engine = new ScoringEngine();
    private final TuningParameters seeds = Fixtures.params(Map.of());

    @Test
    void score_shouldAccumulateEveryBullishSignal() {
        ScoreResult result = engine.score(snapshot(20, -6, 101, 100, 1.0, 0.5, 30, 10, 30), seeds);

        assertEquals(10, result.buyScore);
        assertEquals(0, result.shortScore);
        assertEquals(SignalLevel.BUY, result.signals.rsi);
        assertEquals(SignalLevel.BUY, result.signals.deviation);
        assertEquals(TrendDirection.UPWARD, result.signals.trend);
        assertEquals(SignalLevel.BUY, result.signals.macd);
        assertEquals(DmiCross.GOLDEN_CROSS, result.signals.dmi);
        assertEquals(AdxTrend.STRONG_UPTREND, result.signals.adx);
        assertTrue(result.signals.rsiOversold);
        assertTrue(result.signals.trendConfirmed);
        assertFalse(result.signals.gated);
    }

    @Test
    void score_shouldAccumulateEveryBearishSignal() {
        ScoreResult result = engine.score(snapshot(80, 6, 99, 100, -1.0, 0.5, 10, 30, 30), seeds);

        assertEquals(0, result.buyScore);
        assertEquals(10, result.shortScore);
        assertEquals(SignalLevel.SELL, result.signals.rsi);
        assertEquals(TrendDirection.DOWNWARD, result.signals.trend);
        assertEquals(DmiCross.DEAD_CROSS, result.signals.dmi);
        assertEquals(AdxTrend.STRONG_DOWNTREND, result.signals.adx);
        assertTrue(result.signals.rsiOverbought);
        assertEquals(10, result.maxScore());
    }

    @Test
    void score_shouldTreatTiesAsBearishCrossesWithoutTrendConfirmation() {
        ScoreResult result = engine.score(snapshot(50, 0, 100, 100, 0.5, 0.5, 20, 20, 10), seeds);

        assertEquals(0, result.buyScore);
        assertEquals(4, result.shortScore);
        assertEquals(SignalLevel.NEUTRAL, result.signals.rsi);
        assertEquals(SignalLevel.NEUTRAL, result.signals.deviation);
        assertEquals(TrendDirection.FLAT, result.signals.trend);
        assertEquals(AdxTrend.TRENDLESS, result.signals.adx);
        assertFalse(result.signals.trendConfirmed);
    }

    @Test
    void score_shouldUseWeightsFromParameters() {
        TuningParameters heavy = Fixtures.params(Map.of(ParameterCatalog.RSI_BUY_WEIGHT, 9.0, ParameterCatalog.DEVIATION_WEIGHT, 0.0));

        ScoreResult result = engine.score(snapshot(20, -6, 101, 100, 1.0, 0.5, 30, 10, 30), heavy);

        assertEquals(15, result.buyScore);
    }

    @Test
    void score_shouldBeDeterministic() {
        IndicatorSnapshot snapshot = snapshot(33, -2, 100, 101, 0.1, 0.2, 12, 15, 18);

        assertEquals(engine.score(snapshot, seeds), engine.score(snapshot, seeds));
    }

    @Test
    void rsiSignal_shouldRespectThresholdBoundaries() {
        assertEquals(SignalLevel.BUY, ScoringEngine.rsiSignal(24.9, seeds));
        assertEquals(SignalLevel.BUY_READY, ScoringEngine.rsiSignal(25.0, seeds));
        assertEquals(SignalLevel.NEUTRAL, ScoringEngine.rsiSignal(40.0, seeds));
        assertEquals(SignalLevel.SELL_READY, ScoringEngine.rsiSignal(60.0, seeds));
        assertEquals(SignalLevel.SELL_READY, ScoringEngine.rsiSignal(75.0, seeds));
        assertEquals(SignalLevel.SELL, ScoringEngine.rsiSignal(75.1, seeds));
    }

    private static IndicatorSnapshot snapshot(
            double rsi,
            double deviation,
            double trendSma,
            double trendSmaPrev,
            double macdLine,
            double macdSignal,
            double dmiPlus,
            double dmiMinus,
            double adx
    ) {
        return new IndicatorSnapshot("TEST", LocalDate.of(2024, 3, 1), 100.0, 1_000.0,
                rsi, deviation, trendSma, trendSmaPrev, macdLine, macdSignal, dmiPlus, dmiMinus, adx);
    }
}
