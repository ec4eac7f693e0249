package com.scorebot.engine.model;

import com.scorebot.core.error.ConfigurationException;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Frozen name to value mapping resolved for one as-of date.
 */
public final class TuningParameters {
    private final Map<String, Double> values;

    public TuningParameters(Map<String, Double> values) {
        this.values = values == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(values));
    }

    public double value(String name) {
        Double v = values.get(name);
        if (v == null) {
            throw new ConfigurationException("tuning parameter not resolved: " + name);
        }
        return v;
    }

    public int intValue(String name) {
        return (int) Math.round(value(name));
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public Map<String, Double> asMap() {
        return values;
    }

    public int size() {
        return values.size();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TuningParameters && values.equals(((TuningParameters) o).values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
