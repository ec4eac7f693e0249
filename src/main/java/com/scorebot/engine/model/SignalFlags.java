package com.scorebot.engine.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class SignalFlags {
    public final SignalLevel rsi;
    public final SignalLevel deviation;
    public final TrendDirection trend;
    public final SignalLevel macd;
    public final DmiCross dmi;
    public final AdxTrend adx;
    public final boolean rsiOversold;
    public final boolean rsiOverbought;
    public final boolean trendConfirmed;
    public final boolean gated;

    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("rsi", rsi == null ? null : rsi.name());
        out.put("deviation", deviation == null ? null : deviation.name());
        out.put("trend", trend == null ? null : trend.name());
        out.put("macd", macd == null ? null : macd.name());
        out.put("dmi", dmi == null ? null : dmi.name());
        out.put("adx", adx == null ? null : adx.name());
        out.put("rsi_oversold", rsiOversold);
        out.put("rsi_overbought", rsiOverbought);
        out.put("trend_confirmed", trendConfirmed);
        out.put("gated", gated);
        return out;
    }
}
