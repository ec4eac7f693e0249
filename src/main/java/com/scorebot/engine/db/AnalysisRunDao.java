package com.scorebot.engine.db;

import com.scorebot.engine.db.mybatis.AnalysisResultRow;
import com.scorebot.engine.db.mybatis.AnalysisRunMapper;
import com.scorebot.engine.db.mybatis.AnalysisRunRow;
import com.scorebot.engine.db.mybatis.DecisionEvaluationRow;
import com.scorebot.engine.db.mybatis.MyBatisSupport;
import com.scorebot.engine.model.AnalysisResult;
import com.scorebot.engine.model.AnalysisRun;
import com.scorebot.engine.model.DecisionEvaluation;
import com.scorebot.engine.model.DecisionRecord;
import com.scorebot.engine.model.RiskLevel;
import com.scorebot.engine.model.TrendDirection;
import org.apache.ibatis.session.SqlSession;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class AnalysisRunDao implements AnalysisRepository {
    private final Database database;

    public AnalysisRunDao(Database database) {
        this.database = database;
    }

    @Override
    public long allocateRunId() throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            return session.getMapper(AnalysisRunMapper.class).nextRunId();
        }
    }

    @Override
    public void saveRun(AnalysisRun run, List<AnalysisResult> results) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            try {
                AnalysisRunMapper mapper = session.getMapper(AnalysisRunMapper.class);
                mapper.insertRun(AnalysisRunRow.builder()
                        .id(run.id)
                        .analyzedAt(OffsetDateTime.ofInstant(run.analyzedAt, ZoneOffset.UTC))
                        .parametersUsed(JsonCodec.encodeParameters(run.parametersUsed))
                        .build());
                for (AnalysisResult result : results) {
                    mapper.insertResult(toRow(result));
                }
                conn.commit();
            } catch (RuntimeException e) {
                conn.rollback();
                throw new SQLException("saving run " + run.id + " failed: " + e.getMessage(), e);
            }
        }
    }

    @Override
    public Optional<AnalysisRun> findLatestRun() throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            return Optional.ofNullable(session.getMapper(AnalysisRunMapper.class).findLatestRun()).map(AnalysisRunDao::toRun);
        }
    }

    @Override
    public Optional<AnalysisRun> findRun(long runId) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            return Optional.ofNullable(session.getMapper(AnalysisRunMapper.class).findRun(runId)).map(AnalysisRunDao::toRun);
        }
    }

    @Override
    public List<AnalysisResult> listResults(long runId) throws SQLException {
        List<AnalysisResult> out = new ArrayList<>();
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            for (AnalysisResultRow row : session.getMapper(AnalysisRunMapper.class).listResults(runId)) {
                out.add(toResult(row));
            }
        }
        return out;
    }

    @Override
    public List<DecisionRecord> findMatureUnevaluated(Instant cutoff, int limit) throws SQLException {
        List<DecisionRecord> out = new ArrayList<>();
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            AnalysisRunMapper mapper = session.getMapper(AnalysisRunMapper.class);
            Map<Long, AnalysisRun> runs = new HashMap<>();
            for (AnalysisResultRow row : mapper.findMatureUnevaluated(OffsetDateTime.ofInstant(cutoff, ZoneOffset.UTC), limit)) {
                AnalysisRun run = runs.computeIfAbsent(row.getRunId(), id -> toRun(mapper.findRun(id)));
                out.add(new DecisionRecord(run.id, run.analyzedAt, run.parametersUsed, toResult(row)));
            }
        }
        return out;
    }

    @Override
    public boolean isEvaluated(long runId, String ticker) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            return session.getMapper(AnalysisRunMapper.class).countEvaluations(runId, ticker) > 0;
        }
    }

    @Override
    public boolean markEvaluated(DecisionEvaluation evaluation) throws SQLException {
        DecisionEvaluationRow row = DecisionEvaluationRow.builder()
                .runId(evaluation.runId)
                .ticker(evaluation.ticker)
                .evaluatedAt(OffsetDateTime.ofInstant(evaluation.evaluatedAt, ZoneOffset.UTC))
                .realizedPct(evaluation.realizedPct)
                .appliedJson(JsonCodec.encodeValues(evaluation.applied))
                .build();
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            int inserted = session.getMapper(AnalysisRunMapper.class).insertEvaluation(row);
            conn.commit();
            return inserted > 0;
        }
    }

    @Override
    public void recordApplied(long runId, String ticker, Map<String, Double> applied) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            int updated = session.getMapper(AnalysisRunMapper.class).updateApplied(runId, ticker, JsonCodec.encodeValues(applied));
            conn.commit();
            if (updated == 0) {
                throw new SQLException("no evaluation marker for run_id=" + runId + " ticker=" + ticker);
            }
        }
    }

    private static AnalysisResultRow toRow(AnalysisResult r) {
        return AnalysisResultRow.builder()
                .runId(r.runId)
                .ticker(r.ticker)
                .price(r.price)
                .rsi(r.rsi)
                .deviationRate(r.deviationRate)
                .trend(r.trend == null ? null : r.trend.name())
                .macdLine(r.macdLine)
                .macdSignal(r.macdSignal)
                .dmiPlus(r.dmiPlus)
                .dmiMinus(r.dmiMinus)
                .adx(r.adx)
                .volume(r.volume)
                .signalsJson(JsonCodec.encodeSignals(r.signals))
                .buyScore(r.buyScore)
                .shortScore(r.shortScore)
                .rationale(r.rationale)
                .riskFlag(r.riskFlag == null ? null : r.riskFlag.label())
                .build();
    }

    private static AnalysisRun toRun(AnalysisRunRow row) {
        return new AnalysisRun(row.getId(), row.getAnalyzedAt().toInstant(), JsonCodec.decodeParameters(row.getParametersUsed()));
    }

    private static AnalysisResult toResult(AnalysisResultRow row) {
        return AnalysisResult.builder()
                .runId(row.getRunId())
                .ticker(row.getTicker())
                .price(nz(row.getPrice()))
                .rsi(nz(row.getRsi()))
                .deviationRate(nz(row.getDeviationRate()))
                .trend(row.getTrend() == null ? TrendDirection.FLAT : TrendDirection.valueOf(row.getTrend()))
                .macdLine(nz(row.getMacdLine()))
                .macdSignal(nz(row.getMacdSignal()))
                .dmiPlus(nz(row.getDmiPlus()))
                .dmiMinus(nz(row.getDmiMinus()))
                .adx(nz(row.getAdx()))
                .volume(nz(row.getVolume()))
                .signals(JsonCodec.decodeSignals(row.getSignalsJson()))
                .buyScore(row.getBuyScore() == null ? 0 : row.getBuyScore())
                .shortScore(row.getShortScore() == null ? 0 : row.getShortScore())
                .rationale(row.getRationale())
                .riskFlag(RiskLevel.fromLabel(row.getRiskFlag()))
                .build();
    }

    private static double nz(Double v) {
        return v == null ? 0.0 : v;
    }
}
