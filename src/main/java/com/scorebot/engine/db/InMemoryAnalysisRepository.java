package com.scorebot.engine.db;

import com.scorebot.engine.model.AnalysisResult;
import com.scorebot.engine.model.AnalysisRun;
import com.scorebot.engine.model.DecisionEvaluation;
import com.scorebot.engine.model.DecisionRecord;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

public final class InMemoryAnalysisRepository implements AnalysisRepository {
    private final AtomicLong sequence = new AtomicLong(0L);
    private final Map<Long, AnalysisRun> runs = new LinkedHashMap<>();
    private final Map<Long, List<AnalysisResult>> results = new HashMap<>();
    private final Map<String, DecisionEvaluation> evaluations = new HashMap<>();

    @Override
    public long allocateRunId() {
        return sequence.incrementAndGet();
    }

    @Override
    public synchronized void saveRun(AnalysisRun run, List<AnalysisResult> rows) {
        if (runs.containsKey(run.id)) {
            throw new IllegalStateException("run already saved: " + run.id);
        }
        List<AnalysisResult> copy = new ArrayList<>(rows);
        copy.sort(Comparator.comparing(r -> r.ticker));
        runs.put(run.id, run);
        results.put(run.id, copy);
    }

    @Override
    public synchronized Optional<AnalysisRun> findLatestRun() {
        return runs.values().stream()
                .max(Comparator.comparing((AnalysisRun r) -> r.analyzedAt).thenComparingLong(r -> r.id));
    }

    @Override
    public synchronized Optional<AnalysisRun> findRun(long runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    @Override
    public synchronized List<AnalysisResult> listResults(long runId) {
        return List.copyOf(results.getOrDefault(runId, List.of()));
    }

    @Override
    public synchronized List<DecisionRecord> findMatureUnevaluated(Instant cutoff, int limit) {
        List<DecisionRecord> out = new ArrayList<>();
        List<AnalysisRun> ordered = new ArrayList<>(runs.values());
        ordered.sort(Comparator.comparing((AnalysisRun r) -> r.analyzedAt).thenComparingLong(r -> r.id));
        for (AnalysisRun run : ordered) {
            if (run.analyzedAt.isAfter(cutoff)) {
                continue;
            }
            for (AnalysisResult result : results.getOrDefault(run.id, List.of())) {
                if (out.size() >= limit) {
                    return out;
                }
                if (!evaluations.containsKey(key(run.id, result.ticker))) {
                    out.add(new DecisionRecord(run.id, run.analyzedAt, run.parametersUsed, result));
                }
            }
        }
        return out;
    }

    @Override
    public synchronized boolean isEvaluated(long runId, String ticker) {
        return evaluations.containsKey(key(runId, ticker));
    }

    @Override
    public synchronized boolean markEvaluated(DecisionEvaluation evaluation) {
        return evaluations.putIfAbsent(key(evaluation.runId, evaluation.ticker), evaluation) == null;
    }

    @Override
    public synchronized void recordApplied(long runId, String ticker, Map<String, Double> applied) {
        DecisionEvaluation marker = evaluations.get(key(runId, ticker));
        if (marker == null) {
            throw new IllegalStateException("decision not marked: " + key(runId, ticker));
        }
        evaluations.put(key(runId, ticker),
                new DecisionEvaluation(runId, ticker, marker.evaluatedAt, marker.realizedPct, applied));
    }

    public synchronized DecisionEvaluation evaluation(long runId, String ticker) {
        return evaluations.get(key(runId, ticker));
    }

    private static String key(long runId, String ticker) {
        return runId + ":" + ticker;
    }
}
