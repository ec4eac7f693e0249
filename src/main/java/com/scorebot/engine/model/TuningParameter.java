package com.scorebot.engine.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * One immutable version of a named tuning parameter.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class TuningParameter {
    public final LocalDate effectiveDate;
    public final String name;
    public final double value;
    public final String description;
}
