package com.scorebot.engine.tuning;

import com.scorebot.core.error.ConfigurationException;
import com.scorebot.core.error.InvalidTuningValueException;
import com.scorebot.core.error.MissingParameterException;
import com.scorebot.engine.model.TuningParameters;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Every tuning parameter the indicator and scoring code reads, with its seed value and sane range.
 * All of them are required.
 */
public final class ParameterCatalog {
    public static final String RSI_PERIOD = "rsi_period";
    public static final String DEVIATION_PERIOD = "deviation_period";
    public static final String TREND_SMA_PERIOD = "trend_sma_period";
    public static final String MACD_FAST_PERIOD = "macd_fast_period";
    public static final String MACD_SLOW_PERIOD = "macd_slow_period";
    public static final String MACD_SIGNAL_PERIOD = "macd_signal_period";
    public static final String DMI_PERIOD = "dmi_period";

    public static final String RSI_OVERSOLD_THRESHOLD = "rsi_oversold_threshold";
    public static final String RSI_BUY_READY_THRESHOLD = "rsi_buy_ready_threshold";
    public static final String RSI_SELL_READY_THRESHOLD = "rsi_sell_ready_threshold";
    public static final String RSI_OVERBOUGHT_THRESHOLD = "rsi_overbought_threshold";
    public static final String DEVIATION_BUY_THRESHOLD = "deviation_buy_threshold";
    public static final String DEVIATION_SELL_THRESHOLD = "deviation_sell_threshold";
    public static final String ADX_TREND_THRESHOLD = "adx_trend_threshold";

    public static final String RSI_BUY_WEIGHT = "rsi_buy_weight";
    public static final String RSI_BUY_READY_WEIGHT = "rsi_buy_ready_weight";
    public static final String RSI_SHORT_WEIGHT = "rsi_short_weight";
    public static final String RSI_SHORT_READY_WEIGHT = "rsi_short_ready_weight";
    public static final String DEVIATION_WEIGHT = "deviation_weight";
    public static final String TREND_WEIGHT = "trend_weight";
    public static final String MACD_WEIGHT = "macd_weight";
    public static final String DMI_WEIGHT = "dmi_weight";
    public static final String ADX_WEIGHT = "adx_weight";

    public static final String SCORE_THRESHOLD = "score_threshold";

    private static final Map<String, ParameterSpec> SPECS = buildSpecs();
    private static final List<String[]> ORDERED_PAIRS = List.of(
            new String[]{MACD_FAST_PERIOD, MACD_SLOW_PERIOD},
            new String[]{RSI_OVERSOLD_THRESHOLD, RSI_BUY_READY_THRESHOLD},
            new String[]{RSI_SELL_READY_THRESHOLD, RSI_OVERBOUGHT_THRESHOLD});

    private ParameterCatalog() {
    }

    public static Collection<ParameterSpec> all() {
        return SPECS.values();
    }

    public static List<String> names() {
        return List.copyOf(SPECS.keySet());
    }

    public static ParameterSpec spec(String name) {
        return SPECS.get(name);
    }

    public static boolean isKnown(String name) {
        return name != null && SPECS.containsKey(name);
    }

    /**
     * Fails with {@link MissingParameterException} when any catalog name is absent from the resolved values.
     */
    public static void requireAll(LocalDate asOfDate, Map<String, Double> resolved) {
        List<String> missing = new ArrayList<>();
        for (String name : SPECS.keySet()) {
            if (resolved == null || !resolved.containsKey(name)) {
                missing.add(name);
            }
        }
        if (!missing.isEmpty()) {
            throw new MissingParameterException(asOfDate, missing);
        }
    }

    public static void validate(String name, double value) {
        ParameterSpec spec = SPECS.get(name);
        if (spec == null) {
            throw new InvalidTuningValueException(name, value, "unknown parameter");
        }
        String reason = spec.check(value);
        if (reason != null) {
            throw new InvalidTuningValueException(name, value, reason);
        }
    }

    /**
     * Cross-parameter constraints the indicator and scoring code depend on: each pair's first member must stay
     * strictly below its second, or the MACD lines coincide and the RSI ready bands become unreachable.
     */
    public static void validateConsistency(TuningParameters params) {
        for (String[] pair : ORDERED_PAIRS) {
            double lower = params.value(pair[0]);
            double upper = params.value(pair[1]);
            if (lower >= upper) {
                throw new ConfigurationException(pair[1] + " must exceed " + pair[0] + ": "
                        + pair[1] + "=" + upper + " " + pair[0] + "=" + lower);
            }
        }
    }

    /**
     * Checks a single proposed value against the current values of its ordered partners.
     */
    public static void validateOrdering(String name, double value, Map<String, Double> current) {
        for (String[] pair : ORDERED_PAIRS) {
            if (pair[0].equals(name)) {
                Double upper = current.get(pair[1]);
                if (upper != null && value >= upper) {
                    throw new InvalidTuningValueException(name, value, "must stay below " + pair[1] + "=" + upper);
                }
            } else if (pair[1].equals(name)) {
                Double lower = current.get(pair[0]);
                if (lower != null && value <= lower) {
                    throw new InvalidTuningValueException(name, value, "must stay above " + pair[0] + "=" + lower);
                }
            }
        }
    }

    private static Map<String, ParameterSpec> buildSpecs() {
        Map<String, ParameterSpec> specs = new LinkedHashMap<>();
        add(specs, RSI_PERIOD, 14, 2, 100, true, "Wilder RSI period");
        add(specs, DEVIATION_PERIOD, 25, 2, 200, true, "SMA period for the deviation rate");
        add(specs, TREND_SMA_PERIOD, 75, 2, 300, true, "SMA period for trend direction");
        add(specs, MACD_FAST_PERIOD, 12, 2, 100, true, "MACD fast EMA");
        add(specs, MACD_SLOW_PERIOD, 26, 3, 200, true, "MACD slow EMA");
        add(specs, MACD_SIGNAL_PERIOD, 9, 2, 100, true, "MACD signal EMA");
        add(specs, DMI_PERIOD, 14, 2, 100, true, "Wilder DMI/ADX period");

        add(specs, RSI_OVERSOLD_THRESHOLD, 25, 0, 100, false, "RSI below -> BUY");
        add(specs, RSI_BUY_READY_THRESHOLD, 40, 0, 100, false, "RSI below -> BUY_READY");
        add(specs, RSI_SELL_READY_THRESHOLD, 60, 0, 100, false, "RSI at/above -> SELL_READY");
        add(specs, RSI_OVERBOUGHT_THRESHOLD, 75, 0, 100, false, "RSI above -> SELL");
        add(specs, DEVIATION_BUY_THRESHOLD, -5, -100, 0, false, "deviation at/below -> BUY");
        add(specs, DEVIATION_SELL_THRESHOLD, 5, 0, 100, false, "deviation at/above -> SELL");
        add(specs, ADX_TREND_THRESHOLD, 25, 0, 100, false, "ADX above -> trend confirmed");

        add(specs, RSI_BUY_WEIGHT, 2, 0, 20, true, "buy points for RSI BUY");
        add(specs, RSI_BUY_READY_WEIGHT, 1, 0, 20, true, "buy points for RSI BUY_READY");
        add(specs, RSI_SHORT_WEIGHT, 2, 0, 20, true, "short points for RSI SELL");
        add(specs, RSI_SHORT_READY_WEIGHT, 1, 0, 20, true, "short points for RSI SELL_READY");
        add(specs, DEVIATION_WEIGHT, 2, 0, 20, true, "points for the deviation side");
        add(specs, TREND_WEIGHT, 1, 0, 20, true, "points for the trend side");
        add(specs, MACD_WEIGHT, 2, 0, 20, true, "points for MACD line vs signal");
        add(specs, DMI_WEIGHT, 2, 0, 20, true, "points for +DI vs -DI");
        add(specs, ADX_WEIGHT, 1, 0, 20, true, "trend confirmation points");

        add(specs, SCORE_THRESHOLD, 5, 0, 100, true, "gating threshold on max(buy, short)");
        return Collections.unmodifiableMap(specs);
    }

    private static void add(Map<String, ParameterSpec> specs, String name, double seed, double min, double max, boolean integral, String description) {
        specs.put(name, new ParameterSpec(name, seed, min, max, integral, description));
    }
}
