package com.scorebot.engine;

import com.scorebot.core.error.AiServiceException;
import com.scorebot.engine.ai.AiAdvisor;
import com.scorebot.engine.model.AnalysisResult;
import com.scorebot.engine.model.DecisionRecord;
import com.scorebot.engine.model.NewsItem;
import com.scorebot.engine.model.RationaleResult;
import com.scorebot.engine.model.RiskLevel;
import com.scorebot.engine.model.TuningSuggestion;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class FakeAiAdvisor implements AiAdvisor {
    private final Map<String, RiskLevel> risks = new HashMap<>();
    private final Map<String, List<TuningSuggestion>> suggestions = new HashMap<>();
    private final Set<String> failing = new HashSet<>();
    public final List<String> rationaleCalls = Collections.synchronizedList(new ArrayList<>());
    public final List<DecisionRecord> tuningCalls = Collections.synchronizedList(new ArrayList<>());
    public final List<Double> realizedSeen = Collections.synchronizedList(new ArrayList<>());

    public FakeAiAdvisor risk(String ticker, RiskLevel risk) {
        risks.put(ticker, risk);
        return this;
    }

    public FakeAiAdvisor suggest(String ticker, TuningSuggestion... items) {
        suggestions.put(ticker, List.of(items));
        return this;
    }

    public FakeAiAdvisor failFor(String ticker) {
        failing.add(ticker);
        return this;
    }

    public FakeAiAdvisor recover(String ticker) {
        failing.remove(ticker);
        return this;
    }

    @Override
    public RationaleResult generateRationaleAndRisk(AnalysisResult score, List<NewsItem> news) {
        rationaleCalls.add(score.ticker);
        if (failing.contains(score.ticker)) {
            throw new AiServiceException("model unavailable");
        }
        return new RationaleResult("Oversold with supportive news for " + score.ticker, risks.getOrDefault(score.ticker, RiskLevel.NONE));
    }

    @Override
    public List<TuningSuggestion> suggestTuning(DecisionRecord decision, double realizedPct) {
        tuningCalls.add(decision);
        realizedSeen.add(realizedPct);
        if (failing.contains(decision.ticker())) {
            throw new AiServiceException("model unavailable");
        }
        return suggestions.getOrDefault(decision.ticker(), List.of());
    }
}
