package com.scorebot.engine.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DecisionEvaluationRow {
    private Long runId;
    private String ticker;
    private OffsetDateTime evaluatedAt;
    private Double realizedPct;
    private String appliedJson;
}
