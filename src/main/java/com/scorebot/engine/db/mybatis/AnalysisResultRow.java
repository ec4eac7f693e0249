package com.scorebot.engine.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisResultRow {
    private Long runId;
    private String ticker;
    private Double price;
    private Double rsi;
    private Double deviationRate;
    private String trend;
    private Double macdLine;
    private Double macdSignal;
    private Double dmiPlus;
    private Double dmiMinus;
    private Double adx;
    private Double volume;
    private String signalsJson;
    private Integer buyScore;
    private Integer shortScore;
    private String rationale;
    private String riskFlag;
}
