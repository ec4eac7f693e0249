package com.scorebot.engine.indicator;

import com.scorebot.core.error.InsufficientHistoryException;
import com.scorebot.engine.model.BarDaily;
import com.scorebot.engine.model.IndicatorSnapshot;
import com.scorebot.engine.model.TuningParameters;
import com.scorebot.engine.tuning.ParameterCatalog;

import java.util.Arrays;
import java.util.List;

/**
 * Pure indicator arithmetic over an ascending daily bar series. Every period comes from the
 * resolved tuning parameters.
 */
public final class IndicatorEngine {

    /**
     * Smallest number of bars for which every indicator can be computed with the given periods.
     */
    public static int requiredBars(TuningParameters params) {
        int rsiPeriod = params.intValue(ParameterCatalog.RSI_PERIOD);
        int deviationPeriod = params.intValue(ParameterCatalog.DEVIATION_PERIOD);
        int trendPeriod = params.intValue(ParameterCatalog.TREND_SMA_PERIOD);
        int macdSlow = params.intValue(ParameterCatalog.MACD_SLOW_PERIOD);
        int macdSignal = params.intValue(ParameterCatalog.MACD_SIGNAL_PERIOD);
        int dmiPeriod = params.intValue(ParameterCatalog.DMI_PERIOD);
        int required = rsiPeriod + 1;
        required = Math.max(required, deviationPeriod);
        required = Math.max(required, trendPeriod + 1);
        required = Math.max(required, macdSlow + macdSignal - 1);
        required = Math.max(required, 2 * dmiPeriod + 1);
        return required;
    }

    public IndicatorSnapshot compute(String ticker, List<BarDaily> bars, TuningParameters params) {
        int size = bars == null ? 0 : bars.size();
        int required = requiredBars(params);
        if (size < required) {
            throw new InsufficientHistoryException("indicator set", required, size);
        }

        double[] closes = new double[size];
        double[] highs = new double[size];
        double[] lows = new double[size];
        for (int i = 0; i < size; i++) {
            BarDaily bar = bars.get(i);
            closes[i] = bar.close;
            highs[i] = bar.high;
            lows[i] = bar.low;
        }
        BarDaily last = bars.get(size - 1);

        double rsi = rsi(closes, params.intValue(ParameterCatalog.RSI_PERIOD));
        double deviation = deviationRate(closes, params.intValue(ParameterCatalog.DEVIATION_PERIOD));
        int trendPeriod = params.intValue(ParameterCatalog.TREND_SMA_PERIOD);
        double trendSma = smaAtOffset(closes, trendPeriod, 0);
        double trendSmaPrev = smaAtOffset(closes, trendPeriod, 1);
        Macd macd = macd(
                closes,
                params.intValue(ParameterCatalog.MACD_FAST_PERIOD),
                params.intValue(ParameterCatalog.MACD_SLOW_PERIOD),
                params.intValue(ParameterCatalog.MACD_SIGNAL_PERIOD)
        );
        Dmi dmi = dmi(highs, lows, closes, params.intValue(ParameterCatalog.DMI_PERIOD));

        return new IndicatorSnapshot(
                ticker,
                last.tradeDate,
                last.close,
                last.volume,
                rsi,
                deviation,
                trendSma,
                trendSmaPrev,
                macd.line,
                macd.signal,
                dmi.plus,
                dmi.minus,
                dmi.adx
        );
    }

    /**
     * Wilder RSI. Needs at least {@code period + 1} closes.
     */
    public static double rsi(double[] closes, int period) {
        if (closes.length <= period) {
            throw new InsufficientHistoryException("rsi", period + 1, closes.length);
        }
        double gain = 0.0;
        double loss = 0.0;
        for (int i = 1; i <= period; i++) {
            double diff = closes[i] - closes[i - 1];
            if (diff >= 0) {
                gain += diff;
            } else {
                loss -= diff;
            }
        }
        double avgGain = gain / period;
        double avgLoss = loss / period;

        for (int i = period + 1; i < closes.length; i++) {
            double diff = closes[i] - closes[i - 1];
            double currentGain = diff > 0 ? diff : 0.0;
            double currentLoss = diff < 0 ? -diff : 0.0;
            avgGain = (avgGain * (period - 1) + currentGain) / period;
            avgLoss = (avgLoss * (period - 1) + currentLoss) / period;
        }
        if (avgLoss == 0.0) {
            return avgGain == 0.0 ? 50.0 : 100.0;
        }
        double rs = avgGain / avgLoss;
        return 100.0 - (100.0 / (1.0 + rs));
    }

    /**
     * (close - SMA) / SMA * 100 on the latest close.
     */
    public static double deviationRate(double[] closes, int period) {
        if (closes.length < period) {
            throw new InsufficientHistoryException("deviation", period, closes.length);
        }
        double sma = smaAtOffset(closes, period, 0);
        if (sma == 0.0) {
            return 0.0;
        }
        return (closes[closes.length - 1] - sma) / sma * 100.0;
    }

    static double smaAtOffset(double[] values, int period, int offset) {
        int endExclusive = values.length - offset;
        int startInclusive = endExclusive - period;
        if (period <= 0 || startInclusive < 0) {
            throw new InsufficientHistoryException("sma" + period, period + offset, values.length);
        }
        double sum = 0.0;
        for (int i = startInclusive; i < endExclusive; i++) {
            sum += values[i];
        }
        return sum / period;
    }

    /**
     * EMA series seeded with the SMA of the first {@code period} values. Entries before the seed are NaN.
     */
    static double[] ema(double[] values, int from, int period) {
        double[] out = new double[values.length];
        Arrays.fill(out, Double.NaN);
        int seedEnd = from + period;
        if (period <= 0 || seedEnd > values.length) {
            return out;
        }
        double sum = 0.0;
        for (int i = from; i < seedEnd; i++) {
            sum += values[i];
        }
        double k = 2.0 / (period + 1.0);
        double ema = sum / period;
        out[seedEnd - 1] = ema;
        for (int i = seedEnd; i < values.length; i++) {
            ema = values[i] * k + ema * (1.0 - k);
            out[i] = ema;
        }
        return out;
    }

    static Macd macd(double[] closes, int fast, int slow, int signalPeriod) {
        int required = slow + signalPeriod - 1;
        if (closes.length < required) {
            throw new InsufficientHistoryException("macd", required, closes.length);
        }
        double[] fastEma = ema(closes, 0, fast);
        double[] slowEma = ema(closes, 0, slow);
        double[] line = new double[closes.length];
        for (int i = 0; i < closes.length; i++) {
            line[i] = fastEma[i] - slowEma[i];
        }
        double[] signal = ema(line, slow - 1, signalPeriod);
        int last = closes.length - 1;
        return new Macd(line[last], signal[last]);
    }

    /**
     * Wilder +DI/-DI and ADX; ADX is seeded with the mean of the first {@code period} DX values.
     */
    static Dmi dmi(double[] highs, double[] lows, double[] closes, int period) {
        int required = 2 * period + 1;
        if (closes.length < required) {
            throw new InsufficientHistoryException("dmi", required, closes.length);
        }
        int n = closes.length - 1;
        double[] tr = new double[n];
        double[] dmPlus = new double[n];
        double[] dmMinus = new double[n];
        for (int i = 1; i < closes.length; i++) {
            double highDiff = highs[i] - highs[i - 1];
            double lowDiff = lows[i - 1] - lows[i];
            tr[i - 1] = Math.max(highs[i] - lows[i],
                    Math.max(Math.abs(highs[i] - closes[i - 1]), Math.abs(lows[i] - closes[i - 1])));
            dmPlus[i - 1] = (highDiff > lowDiff && highDiff > 0) ? highDiff : 0.0;
            dmMinus[i - 1] = (lowDiff > highDiff && lowDiff > 0) ? lowDiff : 0.0;
        }

        double smoothTr = 0.0;
        double smoothPlus = 0.0;
        double smoothMinus = 0.0;
        for (int i = 0; i < period; i++) {
            smoothTr += tr[i];
            smoothPlus += dmPlus[i];
            smoothMinus += dmMinus[i];
        }

        double plusDi = 0.0;
        double minusDi = 0.0;
        double adx = 0.0;
        double dxSum = 0.0;
        int dxCount = 0;
        for (int i = period - 1; i < n; i++) {
            if (i > period - 1) {
                smoothTr = smoothTr - (smoothTr / period) + tr[i];
                smoothPlus = smoothPlus - (smoothPlus / period) + dmPlus[i];
                smoothMinus = smoothMinus - (smoothMinus / period) + dmMinus[i];
            }
            plusDi = smoothTr == 0.0 ? 0.0 : 100.0 * smoothPlus / smoothTr;
            minusDi = smoothTr == 0.0 ? 0.0 : 100.0 * smoothMinus / smoothTr;
            double diSum = plusDi + minusDi;
            double dx = diSum == 0.0 ? 0.0 : Math.abs(plusDi - minusDi) / diSum * 100.0;

            dxCount++;
            if (dxCount < period) {
                dxSum += dx;
            } else if (dxCount == period) {
                adx = (dxSum + dx) / period;
            } else {
                adx = (adx * (period - 1) + dx) / period;
            }
        }
        return new Dmi(plusDi, minusDi, adx);
    }

    static final class Macd {
        final double line;
        final double signal;

        Macd(double line, double signal) {
            this.line = line;
            this.signal = signal;
        }
    }

    static final class Dmi {
        final double plus;
        final double minus;
        final double adx;

        Dmi(double plus, double minus, double adx) {
            this.plus = plus;
            this.minus = minus;
            this.adx = adx;
        }
    }
}
