package com.scorebot.engine.tuning;

import com.scorebot.core.RetryPolicy;
import com.scorebot.core.error.ConfigurationException;
import com.scorebot.core.error.DuplicateVersionException;
import com.scorebot.core.error.InvalidTuningValueException;
import com.scorebot.engine.ai.AiAdvisor;
import com.scorebot.engine.data.PriceHistoryProvider;
import com.scorebot.engine.db.AnalysisRepository;
import com.scorebot.engine.model.DecisionEvaluation;
import com.scorebot.engine.model.DecisionOutcome;
import com.scorebot.engine.model.DecisionRecord;
import com.scorebot.engine.model.FeedbackReport;
import com.scorebot.engine.model.TuningSuggestion;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Re-evaluates matured decisions and appends tuning versions dated today.
 * <p>
 * Within one execution the first write per name wins; later suggestions for that name are discarded.
 * A decision is marked before any tuning write for it, so repeating the loop never tunes twice for it; when the
 * marker cannot be written nothing is applied. Decisions whose price fetch or AI call failed stay unmarked and are
 * retried by a later execution.
 */
public final class TuningFeedbackLoop {
    private static final Logger LOG = LogManager.getLogger(TuningFeedbackLoop.class);

    public static final class Settings {
        public int maturityDays = 10;
        public int batchLimit = 200;
        public RetryPolicy pricePolicy = RetryPolicy.once();
        public RetryPolicy aiPolicy = RetryPolicy.once();
    }

    private final ParameterStore parameterStore;
    private final AnalysisRepository repository;
    private final PriceHistoryProvider priceProvider;
    private final AiAdvisor aiAdvisor;
    private final Clock clock;
    private final ZoneId zone;
    private final Settings settings;

    public TuningFeedbackLoop(
            ParameterStore parameterStore,
            AnalysisRepository repository,
            PriceHistoryProvider priceProvider,
            AiAdvisor aiAdvisor,
            Clock clock,
            ZoneId zone,
            Settings settings
    ) {
        this.parameterStore = parameterStore;
        this.repository = repository;
        this.priceProvider = priceProvider;
        this.aiAdvisor = aiAdvisor;
        this.clock = clock;
        this.zone = zone;
        this.settings = settings == null ? new Settings() : settings;
    }

    public FeedbackReport run() {
        Instant now = clock.instant();
        LocalDate today = LocalDate.ofInstant(now, zone);
        Instant cutoff = now.minus(Duration.ofDays(Math.max(0, settings.maturityDays)));

        List<DecisionRecord> decisions;
        Map<String, Double> effective;
        try {
            decisions = repository.findMatureUnevaluated(cutoff, Math.max(1, settings.batchLimit));
            effective = new HashMap<>(parameterStore.getCurrent(today).asMap());
        } catch (SQLException | ConfigurationException e) {
            LOG.error("Feedback loop aborted before processing date={} err={}", today, e.getMessage());
            return new FeedbackReport(today, List.of());
        }
        LOG.info("Feedback loop start date={} cutoff={} decisions={}", today, cutoff, decisions.size());

        Set<String> writtenToday = new HashSet<>();
        List<DecisionOutcome> outcomes = new ArrayList<>(decisions.size());
        for (DecisionRecord decision : decisions) {
            outcomes.add(evaluate(decision, now, today, writtenToday, effective));
        }
        FeedbackReport report = new FeedbackReport(today, outcomes);
        LOG.info("Feedback loop done date={} evaluated={} failed={} already={} applied={}",
                today,
                report.count(DecisionOutcome.Status.EVALUATED),
                report.count(DecisionOutcome.Status.FAILED),
                report.count(DecisionOutcome.Status.ALREADY_EVALUATED),
                report.appliedCount());
        return report;
    }

    DecisionOutcome evaluate(
            DecisionRecord decision,
            Instant now,
            LocalDate today,
            Set<String> writtenToday,
            Map<String, Double> effective
    ) {
        String ticker = decision.ticker();
        try {
            if (repository.isEvaluated(decision.runId, ticker)) {
                return DecisionOutcome.alreadyEvaluated(decision);
            }
        } catch (SQLException e) {
            LOG.warn("Marker lookup failed run_id={} ticker={} err={}", decision.runId, ticker, e.getMessage());
            return DecisionOutcome.failed(decision, Double.NaN, "marker lookup failed: " + e.getMessage());
        }

        double recorded = decision.result.price;
        if (!(recorded > 0.0)) {
            return DecisionOutcome.failed(decision, Double.NaN, "no recorded price");
        }
        double current;
        try {
            current = settings.pricePolicy.call("price " + ticker, () -> priceProvider.getCurrentPrice(ticker));
        } catch (RuntimeException e) {
            LOG.warn("Current price failed run_id={} ticker={} err={}", decision.runId, ticker, e.getMessage());
            return DecisionOutcome.failed(decision, Double.NaN, "price fetch failed: " + e.getMessage());
        }
        double realizedPct = realizedPct(recorded, current);

        List<TuningSuggestion> suggestions;
        try {
            suggestions = settings.aiPolicy.call("tuning " + ticker, () -> aiAdvisor.suggestTuning(decision, realizedPct));
        } catch (RuntimeException e) {
            LOG.warn("Tuning suggestion failed run_id={} ticker={} err={}", decision.runId, ticker, e.getMessage());
            return DecisionOutcome.failed(decision, realizedPct, "ai suggestion failed: " + e.getMessage());
        }

        try {
            if (!repository.markEvaluated(new DecisionEvaluation(decision.runId, ticker, now, realizedPct, Map.of()))) {
                LOG.info("Decision claimed elsewhere run_id={} ticker={}", decision.runId, ticker);
                return DecisionOutcome.alreadyEvaluated(decision);
            }
        } catch (SQLException e) {
            LOG.warn("Marker write failed run_id={} ticker={} err={}", decision.runId, ticker, e.getMessage());
            return DecisionOutcome.failed(decision, realizedPct, "marker write failed: " + e.getMessage());
        }

        Map<String, Double> applied = new LinkedHashMap<>();
        List<String> rejected = new ArrayList<>();
        List<String> discarded = new ArrayList<>();
        for (TuningSuggestion suggestion : suggestions) {
            String name = suggestion.name;
            try {
                ParameterCatalog.validate(name, suggestion.value);
                ParameterCatalog.validateOrdering(name, suggestion.value, effective);
            } catch (InvalidTuningValueException e) {
                LOG.warn("Suggestion rejected run_id={} ticker={} {}", decision.runId, ticker, e.getMessage());
                rejected.add(suggestion.toString());
                continue;
            }
            if (writtenToday.contains(name)) {
                discarded.add(suggestion.toString());
                continue;
            }
            String description = String.format(Locale.US, "feedback run_id=%d ticker=%s outcome=%.2f%%", decision.runId, ticker, realizedPct);
            try {
                parameterStore.writeNewVersion(today, name, suggestion.value, description);
                writtenToday.add(name);
                effective.put(name, suggestion.value);
                applied.put(name, suggestion.value);
                LOG.info("Tuning applied date={} {} run_id={} ticker={}", today, suggestion, decision.runId, ticker);
            } catch (DuplicateVersionException e) {
                // a version dated today already exists; it stays authoritative
                writtenToday.add(name);
                discarded.add(suggestion.toString());
            } catch (SQLException e) {
                LOG.warn("Tuning write failed run_id={} ticker={} {} err={}", decision.runId, ticker, suggestion, e.getMessage());
                discarded.add(suggestion.toString());
            }
        }

        if (!applied.isEmpty()) {
            try {
                repository.recordApplied(decision.runId, ticker, applied);
            } catch (SQLException e) {
                // the marker already exists; only its applied values are lost
                LOG.warn("Applied values not recorded run_id={} ticker={} err={}", decision.runId, ticker, e.getMessage());
            }
        }
        return DecisionOutcome.evaluated(decision, realizedPct, applied, rejected, discarded);
    }

    static double realizedPct(double recorded, double current) {
        return (current - recorded) / recorded * 100.0;
    }
}
