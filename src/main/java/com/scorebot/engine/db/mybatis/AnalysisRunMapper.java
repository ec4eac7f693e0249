package com.scorebot.engine.db.mybatis;

import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.time.OffsetDateTime;
import java.util.List;

public interface AnalysisRunMapper {
    String RESULT_COLUMNS = "run_id, ticker, price, rsi, deviation_rate, trend, macd_line, macd_signal, " +
            "dmi_plus, dmi_minus, adx, volume, signals_json, buy_score, short_score, rationale, risk_flag";

    @Select("SELECT nextval('analysis_runs_id_seq')")
    long nextRunId();

    @Insert("INSERT INTO analysis_runs(id, analyzed_at, parameters_used) VALUES(#{id}, #{analyzedAt}, #{parametersUsed})")
    int insertRun(AnalysisRunRow row);

    @Insert("INSERT INTO analysis_results(" + RESULT_COLUMNS + ") VALUES(" +
            "#{runId}, #{ticker}, #{price}, #{rsi}, #{deviationRate}, #{trend}, #{macdLine}, #{macdSignal}, " +
            "#{dmiPlus}, #{dmiMinus}, #{adx}, #{volume}, #{signalsJson}, #{buyScore}, #{shortScore}, #{rationale}, #{riskFlag})")
    int insertResult(AnalysisResultRow row);

    @Select("SELECT id, analyzed_at, parameters_used FROM analysis_runs ORDER BY analyzed_at DESC, id DESC LIMIT 1")
    AnalysisRunRow findLatestRun();

    @Select("SELECT id, analyzed_at, parameters_used FROM analysis_runs WHERE id = #{runId}")
    AnalysisRunRow findRun(@Param("runId") long runId);

    @Select("SELECT " + RESULT_COLUMNS + " FROM analysis_results WHERE run_id = #{runId} ORDER BY ticker ASC")
    List<AnalysisResultRow> listResults(@Param("runId") long runId);

    @Select("SELECT a.run_id, a.ticker, a.price, a.rsi, a.deviation_rate, a.trend, a.macd_line, a.macd_signal, " +
            "a.dmi_plus, a.dmi_minus, a.adx, a.volume, a.signals_json, a.buy_score, a.short_score, a.rationale, a.risk_flag " +
            "FROM analysis_results a " +
            "JOIN analysis_runs r ON r.id = a.run_id " +
            "LEFT JOIN decision_evaluations e ON e.run_id = a.run_id AND e.ticker = a.ticker " +
            "WHERE e.run_id IS NULL AND r.analyzed_at <= #{cutoff} " +
            "ORDER BY r.analyzed_at ASC, a.run_id ASC, a.ticker ASC LIMIT #{limit}")
    List<AnalysisResultRow> findMatureUnevaluated(@Param("cutoff") OffsetDateTime cutoff, @Param("limit") int limit);

    @Select("SELECT COUNT(*) FROM decision_evaluations WHERE run_id = #{runId} AND ticker = #{ticker}")
    int countEvaluations(@Param("runId") long runId, @Param("ticker") String ticker);

    @Insert("INSERT INTO decision_evaluations(run_id, ticker, evaluated_at, realized_pct, applied_json) " +
            "VALUES(#{runId}, #{ticker}, #{evaluatedAt}, #{realizedPct}, #{appliedJson}) " +
            "ON CONFLICT (run_id, ticker) DO NOTHING")
    int insertEvaluation(DecisionEvaluationRow row);

    @Update("UPDATE decision_evaluations SET applied_json = #{appliedJson} WHERE run_id = #{runId} AND ticker = #{ticker}")
    int updateApplied(@Param("runId") long runId, @Param("ticker") String ticker, @Param("appliedJson") String appliedJson);
}
