package com.scorebot.engine.model;

import java.time.LocalDate;

/**
 * Raw indicator values of one ticker on its latest bar.
 */
public final class IndicatorSnapshot {
    public final String ticker;
    public final LocalDate tradeDate;
    public final double price;
    public final double volume;
    public final double rsi;
    public final double deviationRate;
    public final double trendSma;
    public final double trendSmaPrevious;
    public final double macdLine;
    public final double macdSignal;
    public final double dmiPlus;
    public final double dmiMinus;
    public final double adx;

    public IndicatorSnapshot(
            String ticker,
            LocalDate tradeDate,
            double price,
            double volume,
            double rsi,
            double deviationRate,
            double trendSma,
            double trendSmaPrevious,
            double macdLine,
            double macdSignal,
            double dmiPlus,
            double dmiMinus,
            double adx
    ) {
        this.ticker = ticker;
        this.tradeDate = tradeDate;
        this.price = price;
        this.volume = volume;
        this.rsi = rsi;
        this.deviationRate = deviationRate;
        this.trendSma = trendSma;
        this.trendSmaPrevious = trendSmaPrevious;
        this.macdLine = macdLine;
        this.macdSignal = macdSignal;
        this.dmiPlus = dmiPlus;
        this.dmiMinus = dmiMinus;
        this.adx = adx;
    }
}
