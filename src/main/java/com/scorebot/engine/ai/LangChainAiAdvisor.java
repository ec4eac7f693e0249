package com.scorebot.engine.ai;

import com.scorebot.core.error.AiServiceException;
import com.scorebot.engine.config.Config;
import com.scorebot.engine.model.AnalysisResult;
import com.scorebot.engine.model.DecisionRecord;
import com.scorebot.engine.model.NewsItem;
import com.scorebot.engine.model.RationaleResult;
import com.scorebot.engine.model.RiskLevel;
import com.scorebot.engine.model.TuningSuggestion;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link AiAdvisor} over a LangChain4j chat model, Ollama by default. Replies must be one JSON object.
 */
public final class LangChainAiAdvisor implements AiAdvisor {
    private static final Logger LOG = LogManager.getLogger(LangChainAiAdvisor.class);

    private final ChatLanguageModel chatModel;

    public LangChainAiAdvisor(Config config) {
        this(OllamaChatModel.builder()
                .baseUrl(config.getString("ai.base_url", "http://127.0.0.1:11434"))
                .modelName(config.getString("ai.model", "llama3.1:latest"))
                .temperature(config.getDouble("ai.temperature", 0.2))
                .numPredict(Math.max(64, config.getInt("ai.max_tokens", 600)))
                .format("json")
                .timeout(Duration.ofSeconds(Math.max(10, config.getInt("ai.timeout_sec", 180))))
                .build());
    }

    public LangChainAiAdvisor(ChatLanguageModel chatModel) {
        this.chatModel = chatModel;
    }

    @Override
    public RationaleResult generateRationaleAndRisk(AnalysisResult score, List<NewsItem> news) {
        JSONObject json = ask(Prompts.rationalePrompt(score, news == null ? List.of() : news), "rationale ticker=" + score.ticker);
        String rationale = json.optString("rationale", "").trim();
        if (rationale.isEmpty()) {
            throw new AiServiceException("AI reply has no rationale ticker=" + score.ticker);
        }
        RiskLevel risk = RiskLevel.fromLabel(json.optString("risk", ""));
        if (risk == null) {
            throw new AiServiceException("AI reply has unknown risk '" + json.optString("risk", "") + "' ticker=" + score.ticker);
        }
        return new RationaleResult(rationale, risk);
    }

    @Override
    public List<TuningSuggestion> suggestTuning(DecisionRecord decision, double realizedPct) {
        JSONObject json = ask(Prompts.tuningPrompt(decision, realizedPct), "tuning ticker=" + decision.ticker());
        JSONArray array = json.optJSONArray("suggestions");
        if (array == null) {
            throw new AiServiceException("AI reply has no suggestions array ticker=" + decision.ticker());
        }
        List<TuningSuggestion> out = new ArrayList<>();
        for (int i = 0; i < array.length(); i++) {
            JSONObject item = array.optJSONObject(i);
            if (item == null || !item.has("name") || !item.has("value")) {
                throw new AiServiceException("AI suggestion #" + i + " malformed ticker=" + decision.ticker());
            }
            double value;
            try {
                value = item.getDouble("value");
            } catch (JSONException e) {
                throw new AiServiceException("AI suggestion #" + i + " value is not numeric ticker=" + decision.ticker(), e);
            }
            out.add(new TuningSuggestion(item.optString("name", ""), value));
        }
        return out;
    }

    private JSONObject ask(String prompt, String label) {
        String reply;
        try {
            reply = chatModel.generate(prompt);
        } catch (RuntimeException e) {
            throw new AiServiceException("AI call failed " + label + ": " + e.getMessage(), e);
        }
        JSONObject json = parseJsonObject(reply);
        if (json == null) {
            LOG.warn("AI reply not JSON {} reply={}", label, abbreviate(reply));
            throw new AiServiceException("AI reply is not a JSON object " + label);
        }
        return json;
    }

    static JSONObject parseJsonObject(String reply) {
        if (reply == null) {
            return null;
        }
        String text = reply.replace("```json", "").replace("```", "").trim();
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return null;
        }
        try {
            return new JSONObject(text.substring(start, end + 1));
        } catch (JSONException e) {
            return null;
        }
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "";
        }
        String flat = text.replace('\n', ' ');
        return flat.length() > 200 ? flat.substring(0, 200) + "..." : flat;
    }
}
