package com.scorebot.engine.strategy;

import com.scorebot.engine.model.AdxTrend;
import com.scorebot.engine.model.DmiCross;
import com.scorebot.engine.model.IndicatorSnapshot;
import com.scorebot.engine.model.ScoreResult;
import com.scorebot.engine.model.SignalFlags;
import com.scorebot.engine.model.SignalLevel;
import com.scorebot.engine.model.TrendDirection;
import com.scorebot.engine.model.TuningParameters;

import static com.scorebot.engine.tuning.ParameterCatalog.ADX_TREND_THRESHOLD;
import static com.scorebot.engine.tuning.ParameterCatalog.ADX_WEIGHT;
import static com.scorebot.engine.tuning.ParameterCatalog.DEVIATION_BUY_THRESHOLD;
import static com.scorebot.engine.tuning.ParameterCatalog.DEVIATION_SELL_THRESHOLD;
import static com.scorebot.engine.tuning.ParameterCatalog.DEVIATION_WEIGHT;
import static com.scorebot.engine.tuning.ParameterCatalog.DMI_WEIGHT;
import static com.scorebot.engine.tuning.ParameterCatalog.MACD_WEIGHT;
import static com.scorebot.engine.tuning.ParameterCatalog.RSI_BUY_READY_THRESHOLD;
import static com.scorebot.engine.tuning.ParameterCatalog.RSI_BUY_READY_WEIGHT;
import static com.scorebot.engine.tuning.ParameterCatalog.RSI_BUY_WEIGHT;
import static com.scorebot.engine.tuning.ParameterCatalog.RSI_OVERBOUGHT_THRESHOLD;
import static com.scorebot.engine.tuning.ParameterCatalog.RSI_OVERSOLD_THRESHOLD;
import static com.scorebot.engine.tuning.ParameterCatalog.RSI_SELL_READY_THRESHOLD;
import static com.scorebot.engine.tuning.ParameterCatalog.RSI_SHORT_READY_WEIGHT;
import static com.scorebot.engine.tuning.ParameterCatalog.RSI_SHORT_WEIGHT;
import static com.scorebot.engine.tuning.ParameterCatalog.TREND_WEIGHT;

/**
 * Integer buy/short accumulation over discrete signals. Pure: the same snapshot and parameters
 * always give the same result.
 */
public final class ScoringEngine {

    public ScoreResult score(IndicatorSnapshot snapshot, TuningParameters params) {
        int buy = 0;
        int shortScore = 0;

        SignalLevel rsiSignal = rsiSignal(snapshot.rsi, params);
        switch (rsiSignal) {
            case BUY:
                buy += params.intValue(RSI_BUY_WEIGHT);
                break;
            case BUY_READY:
                buy += params.intValue(RSI_BUY_READY_WEIGHT);
                break;
            case SELL:
                shortScore += params.intValue(RSI_SHORT_WEIGHT);
                break;
            case SELL_READY:
                shortScore += params.intValue(RSI_SHORT_READY_WEIGHT);
                break;
            default:
                break;
        }

        SignalLevel deviationSignal = SignalLevel.NEUTRAL;
        if (snapshot.deviationRate <= params.value(DEVIATION_BUY_THRESHOLD)) {
            deviationSignal = SignalLevel.BUY;
            buy += params.intValue(DEVIATION_WEIGHT);
        } else if (snapshot.deviationRate >= params.value(DEVIATION_SELL_THRESHOLD)) {
            deviationSignal = SignalLevel.SELL;
            shortScore += params.intValue(DEVIATION_WEIGHT);
        }

        TrendDirection trend = TrendDirection.FLAT;
        if (snapshot.trendSma > snapshot.trendSmaPrevious) {
            trend = TrendDirection.UPWARD;
            buy += params.intValue(TREND_WEIGHT);
        } else if (snapshot.trendSma < snapshot.trendSmaPrevious) {
            trend = TrendDirection.DOWNWARD;
            shortScore += params.intValue(TREND_WEIGHT);
        }

        SignalLevel macdSignal;
        if (snapshot.macdLine > snapshot.macdSignal) {
            macdSignal = SignalLevel.BUY;
            buy += params.intValue(MACD_WEIGHT);
        } else {
            macdSignal = SignalLevel.SELL;
            shortScore += params.intValue(MACD_WEIGHT);
        }

        DmiCross dmi;
        if (snapshot.dmiPlus > snapshot.dmiMinus) {
            dmi = DmiCross.GOLDEN_CROSS;
            buy += params.intValue(DMI_WEIGHT);
        } else {
            dmi = DmiCross.DEAD_CROSS;
            shortScore += params.intValue(DMI_WEIGHT);
        }

        AdxTrend adx = AdxTrend.TRENDLESS;
        boolean strong = snapshot.adx > params.value(ADX_TREND_THRESHOLD);
        if (strong && snapshot.dmiPlus > snapshot.dmiMinus) {
            adx = AdxTrend.STRONG_UPTREND;
            buy += params.intValue(ADX_WEIGHT);
        } else if (strong && snapshot.dmiPlus < snapshot.dmiMinus) {
            adx = AdxTrend.STRONG_DOWNTREND;
            shortScore += params.intValue(ADX_WEIGHT);
        }

        SignalFlags signals = SignalFlags.builder()
                .rsi(rsiSignal)
                .deviation(deviationSignal)
                .trend(trend)
                .macd(macdSignal)
                .dmi(dmi)
                .adx(adx)
                .rsiOversold(rsiSignal == SignalLevel.BUY)
                .rsiOverbought(rsiSignal == SignalLevel.SELL)
                .trendConfirmed(adx != AdxTrend.TRENDLESS)
                .gated(false)
                .build();
        return new ScoreResult(buy, shortScore, signals);
    }

    static SignalLevel rsiSignal(double rsi, TuningParameters params) {
        if (rsi < params.value(RSI_OVERSOLD_THRESHOLD)) {
            return SignalLevel.BUY;
        }
        if (rsi < params.value(RSI_BUY_READY_THRESHOLD)) {
            return SignalLevel.BUY_READY;
        }
        if (rsi > params.value(RSI_OVERBOUGHT_THRESHOLD)) {
            return SignalLevel.SELL;
        }
        if (rsi >= params.value(RSI_SELL_READY_THRESHOLD)) {
            return SignalLevel.SELL_READY;
        }
        return SignalLevel.NEUTRAL;
    }
}
