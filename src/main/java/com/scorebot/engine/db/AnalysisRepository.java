package com.scorebot.engine.db;

import com.scorebot.engine.model.AnalysisResult;
import com.scorebot.engine.model.AnalysisRun;
import com.scorebot.engine.model.DecisionEvaluation;
import com.scorebot.engine.model.DecisionRecord;

import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Run and result storage. A run and its result rows become visible together or not at all.
 */
public interface AnalysisRepository {

    long allocateRunId() throws SQLException;

    /**
     * Writes the run row and every result row in one transaction.
     */
    void saveRun(AnalysisRun run, List<AnalysisResult> results) throws SQLException;

    Optional<AnalysisRun> findLatestRun() throws SQLException;

    Optional<AnalysisRun> findRun(long runId) throws SQLException;

    List<AnalysisResult> listResults(long runId) throws SQLException;

    /**
     * Results of runs analyzed at or before {@code cutoff} that carry no evaluation marker, oldest first.
     */
    List<DecisionRecord> findMatureUnevaluated(Instant cutoff, int limit) throws SQLException;

    boolean isEvaluated(long runId, String ticker) throws SQLException;

    /**
     * Claims a decision for evaluation. Tuning writes for the decision happen only after a successful claim.
     *
     * @return false when the decision already carried a marker
     */
    boolean markEvaluated(DecisionEvaluation evaluation) throws SQLException;

    /**
     * Stores the tuning values applied for an already marked decision.
     */
    void recordApplied(long runId, String ticker, Map<String, Double> applied) throws SQLException;
}
