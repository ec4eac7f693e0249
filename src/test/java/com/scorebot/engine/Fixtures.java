package com.scorebot.engine;

import com.scorebot.engine.model.BarDaily;
import com.scorebot.engine.model.TuningParameters;
import com.scorebot.engine.tuning.InMemoryParameterStore;
import com.scorebot.engine.tuning.ParameterCatalog;
import com.scorebot.engine.tuning.ParameterSpec;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared builders for parameter sets and bar series.
 */
public final class Fixtures {
    public static final LocalDate SEED_DATE = LocalDate.of(2024, 1, 1);

    private Fixtures() {
    }

    public static Map<String, Double> seedValues() {
        Map<String, Double> values = new HashMap<>();
        for (ParameterSpec spec : ParameterCatalog.all()) {
            values.put(spec.name, spec.seed);
        }
        return values;
    }

    public static TuningParameters params(Map<String, Double> overrides) {
        Map<String, Double> values = seedValues();
        values.putAll(overrides);
        return new TuningParameters(values);
    }

    /**
     * Short periods (8 bars needed) with every weight zero except the RSI buy weight of 6.
     */
    public static Map<String, Double> rsiOnlyOverrides() {
        Map<String, Double> o = new HashMap<>();
        o.put(ParameterCatalog.RSI_PERIOD, 5.0);
        o.put(ParameterCatalog.DEVIATION_PERIOD, 5.0);
        o.put(ParameterCatalog.TREND_SMA_PERIOD, 5.0);
        o.put(ParameterCatalog.MACD_FAST_PERIOD, 3.0);
        o.put(ParameterCatalog.MACD_SLOW_PERIOD, 6.0);
        o.put(ParameterCatalog.MACD_SIGNAL_PERIOD, 3.0);
        o.put(ParameterCatalog.DMI_PERIOD, 3.0);
        o.put(ParameterCatalog.RSI_OVERSOLD_THRESHOLD, 30.0);
        o.put(ParameterCatalog.RSI_BUY_WEIGHT, 6.0);
        o.put(ParameterCatalog.RSI_BUY_READY_WEIGHT, 0.0);
        o.put(ParameterCatalog.RSI_SHORT_WEIGHT, 0.0);
        o.put(ParameterCatalog.RSI_SHORT_READY_WEIGHT, 0.0);
        o.put(ParameterCatalog.DEVIATION_WEIGHT, 0.0);
        o.put(ParameterCatalog.TREND_WEIGHT, 0.0);
        o.put(ParameterCatalog.MACD_WEIGHT, 0.0);
        o.put(ParameterCatalog.DMI_WEIGHT, 0.0);
        o.put(ParameterCatalog.ADX_WEIGHT, 0.0);
        o.put(ParameterCatalog.SCORE_THRESHOLD, 5.0);
        return o;
    }

    public static InMemoryParameterStore seededStore(LocalDate date, Map<String, Double> overrides) {
        InMemoryParameterStore store = new InMemoryParameterStore();
        Map<String, Double> values = seedValues();
        values.putAll(overrides);
        for (Map.Entry<String, Double> e : values.entrySet()) {
            store.writeNewVersion(date, e.getKey(), e.getValue(), "seed");
        }
        return store;
    }

    /**
     * Bars with high/low one unit around each close, one trading day apart.
     */
    public static List<BarDaily> bars(String ticker, double... closes) {
        List<BarDaily> out = new ArrayList<>(closes.length);
        LocalDate day = LocalDate.of(2024, 1, 2);
        for (double close : closes) {
            out.add(new BarDaily(ticker, day, close, close + 1.0, close - 1.0, close, 1_000_000.0));
            day = day.plusDays(1);
        }
        return out;
    }

    public static double[] linear(int n, double start, double step) {
        double[] closes = new double[n];
        for (int i = 0; i < n; i++) {
            closes[i] = start + step * i;
        }
        return closes;
    }
}
