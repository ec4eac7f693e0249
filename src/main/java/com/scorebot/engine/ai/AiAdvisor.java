package com.scorebot.engine.ai;

import com.scorebot.engine.model.AnalysisResult;
import com.scorebot.engine.model.DecisionRecord;
import com.scorebot.engine.model.NewsItem;
import com.scorebot.engine.model.RationaleResult;
import com.scorebot.engine.model.TuningSuggestion;

import java.util.List;

/**
 * Generative-AI collaborator. Malformed replies surface as
 * {@link com.scorebot.core.error.AiServiceException}.
 */
public interface AiAdvisor {

    RationaleResult generateRationaleAndRisk(AnalysisResult score, List<NewsItem> news);

    List<TuningSuggestion> suggestTuning(DecisionRecord decision, double realizedPct);
}
