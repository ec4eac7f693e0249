package com.scorebot.engine.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TuningParameterRow {
    private LocalDate effectiveDate;
    private String name;
    private Double value;
    private String description;
    private OffsetDateTime createdAt;
}
