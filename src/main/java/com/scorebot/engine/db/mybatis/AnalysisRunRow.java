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
public class AnalysisRunRow {
    private Long id;
    private OffsetDateTime analyzedAt;
    private String parametersUsed;
}
