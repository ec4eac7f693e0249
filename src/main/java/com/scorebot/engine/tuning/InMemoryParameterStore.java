package com.scorebot.engine.tuning;

import com.scorebot.core.error.DuplicateVersionException;
import com.scorebot.engine.model.TuningParameter;
import com.scorebot.engine.model.TuningParameters;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Ordered index keyed by (name, date). Safe for concurrent readers; writers serialize on the map.
 */
public final class InMemoryParameterStore implements ParameterStore {
    private final Map<String, NavigableMap<LocalDate, TuningParameter>> versions = new HashMap<>();

    @Override
    public synchronized TuningParameters getCurrent(LocalDate asOfDate) {
        Map<String, Double> resolved = new HashMap<>();
        for (Map.Entry<String, NavigableMap<LocalDate, TuningParameter>> e : versions.entrySet()) {
            Map.Entry<LocalDate, TuningParameter> floor = e.getValue().floorEntry(asOfDate);
            if (floor != null) {
                resolved.put(e.getKey(), floor.getValue().value);
            }
        }
        ParameterCatalog.requireAll(asOfDate, resolved);
        return new TuningParameters(resolved);
    }

    @Override
    public synchronized void writeNewVersion(LocalDate date, String name, double value, String description) {
        NavigableMap<LocalDate, TuningParameter> byDate = versions.computeIfAbsent(name, k -> new TreeMap<>());
        if (byDate.containsKey(date)) {
            throw new DuplicateVersionException(date, name);
        }
        byDate.put(date, new TuningParameter(date, name, value, description));
    }

    @Override
    public synchronized List<TuningParameter> history(String name) {
        NavigableMap<LocalDate, TuningParameter> byDate = versions.get(name);
        return byDate == null ? List.of() : new ArrayList<>(byDate.values());
    }

    @Override
    public synchronized boolean isEmpty() {
        return versions.isEmpty();
    }
}
