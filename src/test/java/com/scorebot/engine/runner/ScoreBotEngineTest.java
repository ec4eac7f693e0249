package com.scorebot.engine.runner;

import com.scorebot.core.error.ConfigurationException;
import com.scorebot.engine.FakeAiAdvisor;
import com.scorebot.engine.FakeNewsProvider;
import com.scorebot.engine.FakePriceHistoryProvider;
import com.scorebot.engine.Fixtures;
import com.scorebot.engine.RecordingNotifier;
import com.scorebot.engine.db.InMemoryAnalysisRepository;
import com.scorebot.engine.model.DecisionOutcome;
import com.scorebot.engine.model.FeedbackReport;
import com.scorebot.engine.model.RunReport;
import com.scorebot.engine.model.RunState;
import com.scorebot.engine.tuning.InMemoryParameterStore;
import com.scorebot.engine.tuning.ParameterCatalog;
import com.scorebot.engine.tuning.TuningFeedbackLoop;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScoreBotEngineTest {
    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private final InMemoryParameterStore store = new InMemoryParameterStore();
    private final InMemoryAnalysisRepository repository = new InMemoryAnalysisRepository();
    private final FakePriceHistoryProvider prices = new FakePriceHistoryProvider();

    @Test
    void runScheduledAnalysis_shouldSeedEmptyStoreThenRun() throws Exception {
        prices.history("AAPL", Fixtures.linear(120, 200, -1));

        RunReport report = engine(List.of("AAPL"), NOW).runScheduledAnalysis();

        assertEquals(RunState.DONE, report.state);
        assertFalse(store.isEmpty());
        assertEquals(ParameterCatalog.all().size(), store.getCurrent(Fixtures.SEED_DATE).size());
        assertEquals(1, repository.listResults(report.runId).size());
    }

    @Test
    void runScheduledAnalysis_shouldRejectEmptyUniverse() {
        ScoreBotEngine engine = engine(List.of(), NOW);

        assertThrows(ConfigurationException.class, engine::runScheduledAnalysis);
        assertTrue(store.isEmpty());
    }

    @Test
    void triggerReEvaluation_shouldEvaluateMaturedRun() throws Exception {
        prices.history("AAPL", Fixtures.linear(120, 200, -1));
        RunReport report = engine(List.of("AAPL"), NOW).runScheduledAnalysis();
        prices.currentPrice("AAPL", 90.0);

        FeedbackReport feedback = engine(List.of("AAPL"), NOW.plus(Duration.ofDays(11))).triggerReEvaluation();

        assertEquals(1, feedback.count(DecisionOutcome.Status.EVALUATED));
        assertTrue(repository.isEvaluated(report.runId, "AAPL"));
    }

    @Test
    void triggerReEvaluation_shouldFindNothingBeforeMaturity() {
        prices.history("AAPL", Fixtures.linear(120, 200, -1));
        engine(List.of("AAPL"), NOW).runScheduledAnalysis();

        FeedbackReport feedback = engine(List.of("AAPL"), NOW.plus(Duration.ofDays(2))).triggerReEvaluation();

        assertTrue(feedback.outcomes.isEmpty());
    }

    private ScoreBotEngine engine(List<String> universe, Instant now) {
        return new ScoreBotEngine(
                universe,
                Fixtures.SEED_DATE,
                store,
                repository,
                prices,
                new FakeNewsProvider(),
                new FakeAiAdvisor(),
                new RecordingNotifier(),
                Clock.fixed(now, ZoneOffset.UTC),
                ZoneOffset.UTC,
                new DecisionPipeline.Settings(),
                new TuningFeedbackLoop.Settings()
        );
    }
}
