package com.scorebot.engine.runner;

import com.scorebot.core.error.ConfigurationException;
import com.scorebot.engine.ai.AiAdvisor;
import com.scorebot.engine.data.PriceHistoryProvider;
import com.scorebot.engine.db.AnalysisRepository;
import com.scorebot.engine.model.FeedbackReport;
import com.scorebot.engine.model.RunReport;
import com.scorebot.engine.news.NewsProvider;
import com.scorebot.engine.output.Notifier;
import com.scorebot.engine.tuning.ParameterSeeder;
import com.scorebot.engine.tuning.ParameterStore;
import com.scorebot.engine.tuning.TuningFeedbackLoop;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;

/**
 * Entry point of the two scheduled jobs. Everything the jobs need is fixed at construction,
 * so both triggers take no arguments.
 */
public final class ScoreBotEngine {
    private static final Logger LOG = LogManager.getLogger(ScoreBotEngine.class);

    private final List<String> universe;
    private final ParameterStore parameterStore;
    private final LocalDate seedDate;
    private final DecisionPipeline pipeline;
    private final TuningFeedbackLoop feedbackLoop;
    private volatile boolean seeded = false;

    public ScoreBotEngine(
            List<String> universe,
            LocalDate seedDate,
            ParameterStore parameterStore,
            AnalysisRepository repository,
            PriceHistoryProvider priceProvider,
            NewsProvider newsProvider,
            AiAdvisor aiAdvisor,
            Notifier notifier,
            Clock clock,
            ZoneId zone,
            DecisionPipeline.Settings pipelineSettings,
            TuningFeedbackLoop.Settings feedbackSettings
    ) {
        this.universe = universe == null ? List.of() : List.copyOf(universe);
        this.seedDate = seedDate;
        this.parameterStore = parameterStore;
        this.pipeline = new DecisionPipeline(
                parameterStore, repository, priceProvider, newsProvider, aiAdvisor, notifier, clock, zone, pipelineSettings);
        this.feedbackLoop = new TuningFeedbackLoop(
                parameterStore, repository, priceProvider, aiAdvisor, clock, zone, feedbackSettings);
    }

    public List<String> universe() {
        return universe;
    }

    /**
     * Scores the configured universe once.
     *
     * @throws ConfigurationException when the universe is empty or the tuning parameters cannot be resolved
     */
    public RunReport runScheduledAnalysis() {
        if (universe.isEmpty()) {
            throw new ConfigurationException("ticker universe is empty; set analysis.universe or analysis.universe_file");
        }
        ensureSeeded();
        return pipeline.run(universe);
    }

    /**
     * Re-evaluates matured decisions and applies accepted tuning suggestions.
     */
    public FeedbackReport triggerReEvaluation() {
        ensureSeeded();
        return feedbackLoop.run();
    }

    private void ensureSeeded() {
        if (seeded || seedDate == null) {
            return;
        }
        synchronized (this) {
            if (seeded) {
                return;
            }
            try {
                int written = new ParameterSeeder(parameterStore).seedIfEmpty(seedDate);
                if (written > 0) {
                    LOG.info("Parameter store was empty, seeded {} parameters", written);
                }
                seeded = true;
            } catch (SQLException e) {
                throw new ConfigurationException("cannot seed tuning parameters: " + e.getMessage(), e);
            }
        }
    }
}
