package com.scorebot.engine.db;

import com.scorebot.engine.model.AdxTrend;
import com.scorebot.engine.model.DmiCross;
import com.scorebot.engine.model.SignalFlags;
import com.scorebot.engine.model.SignalLevel;
import com.scorebot.engine.model.TrendDirection;
import com.scorebot.engine.model.TuningParameters;
import org.json.JSONObject;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Text encodings of the frozen parameter snapshot and the signal set.
 */
public final class JsonCodec {

    private JsonCodec() {
    }

    public static String encodeParameters(TuningParameters params) {
        return new JSONObject(params.asMap()).toString();
    }

    public static TuningParameters decodeParameters(String json) {
        Map<String, Double> values = new LinkedHashMap<>();
        if (json != null && !json.isBlank()) {
            JSONObject obj = new JSONObject(json);
            for (String key : obj.keySet()) {
                values.put(key, obj.getDouble(key));
            }
        }
        return new TuningParameters(values);
    }

    public static String encodeValues(Map<String, Double> values) {
        return new JSONObject(values == null ? Map.of() : values).toString();
    }

    public static String encodeSignals(SignalFlags signals) {
        if (signals == null) {
            return "{}";
        }
        return new JSONObject(signals.toMap()).toString();
    }

    public static SignalFlags decodeSignals(String json) {
        JSONObject obj = json == null || json.isBlank() ? new JSONObject() : new JSONObject(json);
        return SignalFlags.builder()
                .rsi(obj.optEnum(SignalLevel.class, "rsi"))
                .deviation(obj.optEnum(SignalLevel.class, "deviation"))
                .trend(obj.optEnum(TrendDirection.class, "trend"))
                .macd(obj.optEnum(SignalLevel.class, "macd"))
                .dmi(obj.optEnum(DmiCross.class, "dmi"))
                .adx(obj.optEnum(AdxTrend.class, "adx"))
                .rsiOversold(obj.optBoolean("rsi_oversold"))
                .rsiOverbought(obj.optBoolean("rsi_overbought"))
                .trendConfirmed(obj.optBoolean("trend_confirmed"))
                .gated(obj.optBoolean("gated"))
                .build();
    }
}
