package com.scorebot.engine.runner;

import com.scorebot.core.RetryPolicy;
import com.scorebot.core.error.CallTimeoutException;
import com.scorebot.core.error.ConfigurationException;
import com.scorebot.core.error.InsufficientHistoryException;
import com.scorebot.core.error.NotFoundException;
import com.scorebot.core.error.RateLimitException;
import com.scorebot.engine.ai.AiAdvisor;
import com.scorebot.engine.data.PriceHistoryProvider;
import com.scorebot.engine.db.AnalysisRepository;
import com.scorebot.engine.indicator.IndicatorEngine;
import com.scorebot.engine.model.AnalysisResult;
import com.scorebot.engine.model.AnalysisRun;
import com.scorebot.engine.model.BarDaily;
import com.scorebot.engine.model.IndicatorSnapshot;
import com.scorebot.engine.model.NewsItem;
import com.scorebot.engine.model.RationaleResult;
import com.scorebot.engine.model.RiskLevel;
import com.scorebot.engine.model.RunReport;
import com.scorebot.engine.model.RunState;
import com.scorebot.engine.model.ScoreResult;
import com.scorebot.engine.model.SkipReason;
import com.scorebot.engine.model.TickerOutcome;
import com.scorebot.engine.model.TuningParameters;
import com.scorebot.engine.news.NewsProvider;
import com.scorebot.engine.output.Notifier;
import com.scorebot.engine.strategy.ScoringEngine;
import com.scorebot.engine.tuning.ParameterCatalog;
import com.scorebot.engine.tuning.ParameterStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * One scheduled analysis run:
 * STARTED, PARAMETERS_RESOLVED, SCORED, GATED, PERSISTED, DONE.
 * <p>
 * Per-ticker failures become {@link TickerOutcome} skips; only parameter resolution aborts the run.
 * The run row and its result rows are committed together.
 */
public final class DecisionPipeline {
    private static final Logger LOG = LogManager.getLogger(DecisionPipeline.class);

    public static final class Settings {
        public int threads = 4;
        public int historyBufferDays = 20;
        public RetryPolicy pricePolicy = RetryPolicy.once();
        public RetryPolicy newsPolicy = RetryPolicy.once();
        public RetryPolicy aiPolicy = RetryPolicy.once();
    }

    private final ParameterStore parameterStore;
    private final AnalysisRepository repository;
    private final PriceHistoryProvider priceProvider;
    private final NewsProvider newsProvider;
    private final AiAdvisor aiAdvisor;
    private final Notifier notifier;
    private final IndicatorEngine indicatorEngine;
    private final ScoringEngine scoringEngine;
    private final Clock clock;
    private final ZoneId zone;
    private final Settings settings;

    public DecisionPipeline(
            ParameterStore parameterStore,
            AnalysisRepository repository,
            PriceHistoryProvider priceProvider,
            NewsProvider newsProvider,
            AiAdvisor aiAdvisor,
            Notifier notifier,
            Clock clock,
            ZoneId zone,
            Settings settings
    ) {
        this.parameterStore = parameterStore;
        this.repository = repository;
        this.priceProvider = priceProvider;
        this.newsProvider = newsProvider;
        this.aiAdvisor = aiAdvisor;
        this.notifier = notifier;
        this.indicatorEngine = new IndicatorEngine();
        this.scoringEngine = new ScoringEngine();
        this.clock = clock;
        this.zone = zone;
        this.settings = settings == null ? new Settings() : settings;
    }

    /**
     * @throws ConfigurationException when the tuning parameters for today cannot be resolved
     */
    public RunReport run(List<String> universe) {
        Instant analyzedAt = clock.instant();
        long runId;
        try {
            runId = repository.allocateRunId();
        } catch (SQLException e) {
            LOG.error("Run id allocation failed err={}", e.getMessage());
            return new RunReport(-1L, analyzedAt, RunState.FAILED, List.of(), "run id allocation failed: " + e.getMessage());
        }
        transition(runId, RunState.STARTED, "universe=" + universe.size());

        TuningParameters params = resolveParameters(runId, analyzedAt);
        AnalysisRun run = new AnalysisRun(runId, analyzedAt, params);
        transition(runId, RunState.PARAMETERS_RESOLVED, "parameters=" + params.size());

        Map<String, TickerOutcome> outcomes;
        try {
            outcomes = scoreAll(runId, universe, params);
            transition(runId, RunState.SCORED, "scored=" + countScored(outcomes) + " skipped=" + (outcomes.size() - countScored(outcomes)));
            gateAll(runId, outcomes, params.intValue(ParameterCatalog.SCORE_THRESHOLD));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.error("Run interrupted run_id={}", runId);
            return new RunReport(runId, analyzedAt, RunState.FAILED, List.of(), "interrupted");
        }
        List<TickerOutcome> ordered = new ArrayList<>(outcomes.values());
        transition(runId, RunState.GATED, "gated=" + ordered.stream().filter(o -> o.gated).count());

        List<AnalysisResult> rows = new ArrayList<>();
        for (TickerOutcome outcome : ordered) {
            if (outcome.isScored()) {
                rows.add(outcome.result);
            }
        }
        try {
            repository.saveRun(run, rows);
        } catch (SQLException e) {
            LOG.error("Run persistence failed run_id={} rows={} err={}", runId, rows.size(), e.getMessage());
            return new RunReport(runId, analyzedAt, RunState.FAILED, ordered, "persistence failed: " + e.getMessage());
        }
        transition(runId, RunState.PERSISTED, "rows=" + rows.size());
        transition(runId, RunState.DONE, "");
        return new RunReport(runId, analyzedAt, RunState.DONE, ordered, "");
    }

    private TuningParameters resolveParameters(long runId, Instant analyzedAt) {
        LocalDate asOf = LocalDate.ofInstant(analyzedAt, zone);
        TuningParameters params;
        try {
            params = parameterStore.getCurrent(asOf);
        } catch (SQLException e) {
            LOG.error("Parameter resolution failed run_id={} as_of={} err={}", runId, asOf, e.getMessage());
            throw new ConfigurationException("cannot read tuning parameters as_of=" + asOf, e);
        } catch (ConfigurationException e) {
            LOG.error("Parameter resolution failed run_id={} as_of={} err={}", runId, asOf, e.getMessage());
            throw e;
        }
        ParameterCatalog.validateConsistency(params);
        return params;
    }

    private Map<String, TickerOutcome> scoreAll(long runId, List<String> universe, TuningParameters params) throws InterruptedException {
        int lookback = IndicatorEngine.requiredBars(params) + Math.max(0, settings.historyBufferDays);
        Map<String, Callable<TickerOutcome>> tasks = new LinkedHashMap<>();
        for (String ticker : universe) {
            tasks.put(ticker, () -> scoreTicker(runId, ticker, lookback, params));
        }
        return runParallel(tasks);
    }

    TickerOutcome scoreTicker(long runId, String ticker, int lookback, TuningParameters params) {
        try {
            List<BarDaily> bars = settings.pricePolicy.call("history " + ticker, () -> priceProvider.getHistory(ticker, lookback));
            IndicatorSnapshot snapshot = indicatorEngine.compute(ticker, bars, params);
            ScoreResult score = scoringEngine.score(snapshot, params);
            LOG.debug("Scored run_id={} ticker={} buy={} short={}", runId, ticker, score.buyScore, score.shortScore);
            return TickerOutcome.scored(AnalysisResult.of(runId, snapshot, score), false, false);
        } catch (RuntimeException e) {
            SkipReason reason = skipReasonOf(e);
            LOG.warn("Ticker skipped run_id={} ticker={} reason={} err={}", runId, ticker, reason.label(), e.getMessage());
            return TickerOutcome.skipped(ticker, reason, e.getMessage());
        }
    }

    private void gateAll(long runId, Map<String, TickerOutcome> outcomes, int threshold) throws InterruptedException {
        Map<String, Callable<TickerOutcome>> tasks = new LinkedHashMap<>();
        for (TickerOutcome outcome : outcomes.values()) {
            if (outcome.isScored() && Math.max(outcome.result.buyScore, outcome.result.shortScore) >= threshold) {
                tasks.put(outcome.ticker, () -> gateTicker(runId, outcome.result));
            }
        }
        if (tasks.isEmpty()) {
            return;
        }
        Map<String, TickerOutcome> gated = runParallel(tasks);
        for (Map.Entry<String, TickerOutcome> e : gated.entrySet()) {
            if (e.getValue().isScored()) {
                outcomes.put(e.getKey(), e.getValue());
            }
        }
    }

    /**
     * News and AI failures leave the row without rationale; the score is never discarded.
     */
    TickerOutcome gateTicker(long runId, AnalysisResult scored) {
        String ticker = scored.ticker;
        AnalysisResult result = scored.toBuilder()
                .signals(scored.signals.toBuilder().gated(true).build())
                .build();

        List<NewsItem> news;
        try {
            news = settings.newsPolicy.call("news " + ticker, () -> newsProvider.getRecentNews(ticker));
        } catch (RuntimeException e) {
            LOG.warn("News fetch failed run_id={} ticker={} err={}", runId, ticker, e.getMessage());
            return TickerOutcome.scored(result, true, false);
        }

        RationaleResult rationale;
        try {
            AnalysisResult context = result;
            rationale = settings.aiPolicy.call("rationale " + ticker, () -> aiAdvisor.generateRationaleAndRisk(context, news));
        } catch (RuntimeException e) {
            LOG.warn("AI rationale failed run_id={} ticker={} err={}", runId, ticker, e.getMessage());
            return TickerOutcome.scored(result, true, false);
        }
        result = result.toBuilder()
                .rationale(rationale.rationale)
                .riskFlag(rationale.risk)
                .build();

        boolean notified = false;
        if (rationale.risk == RiskLevel.NONE) {
            try {
                notified = notifier.sendNotification(ticker, rationale.rationale);
            } catch (RuntimeException e) {
                LOG.warn("Notification failed run_id={} ticker={} err={}", runId, ticker, e.getMessage());
            }
        }
        LOG.info("Gated run_id={} ticker={} risk={} notified={}", runId, ticker, rationale.risk.label(), notified);
        return TickerOutcome.scored(result, true, notified);
    }

    private Map<String, TickerOutcome> runParallel(Map<String, Callable<TickerOutcome>> tasks) throws InterruptedException {
        Map<String, TickerOutcome> results = new LinkedHashMap<>();
        if (tasks.isEmpty()) {
            return results;
        }
        for (String ticker : tasks.keySet()) {
            results.put(ticker, null);
        }
        int threads = Math.max(1, Math.min(settings.threads, tasks.size()));
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CompletionService<TickerOutcome> completion = new ExecutorCompletionService<>(pool);
        Map<Future<TickerOutcome>, String> submitted = new HashMap<>();
        try {
            for (Map.Entry<String, Callable<TickerOutcome>> task : tasks.entrySet()) {
                submitted.put(completion.submit(task.getValue()), task.getKey());
            }
            for (int i = 0; i < tasks.size(); i++) {
                Future<TickerOutcome> future = completion.take();
                String ticker = submitted.get(future);
                try {
                    results.put(ticker, future.get());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() == null ? e : e.getCause();
                    LOG.warn("Ticker task failed ticker={} err={}", ticker, cause.toString());
                    results.put(ticker, TickerOutcome.skipped(ticker, SkipReason.OTHER, cause.toString()));
                }
            }
        } finally {
            pool.shutdownNow();
        }
        return results;
    }

    static SkipReason skipReasonOf(RuntimeException e) {
        if (e instanceof InsufficientHistoryException) {
            return SkipReason.HISTORY_SHORT;
        }
        if (e instanceof NotFoundException) {
            return SkipReason.NOT_FOUND;
        }
        if (e instanceof RateLimitException) {
            return SkipReason.RATE_LIMIT;
        }
        if (e instanceof CallTimeoutException) {
            return SkipReason.TIMEOUT;
        }
        return SkipReason.OTHER;
    }

    private static int countScored(Map<String, TickerOutcome> outcomes) {
        int n = 0;
        for (TickerOutcome o : outcomes.values()) {
            if (o.isScored()) {
                n++;
            }
        }
        return n;
    }

    private static void transition(long runId, RunState state, String detail) {
        LOG.info("Run state run_id={} state={} {}", runId, state, detail);
    }
}
