package com.scorebot.engine.ai;

import com.scorebot.engine.model.AnalysisResult;
import com.scorebot.engine.model.DecisionRecord;
import com.scorebot.engine.model.NewsItem;
import com.scorebot.engine.tuning.ParameterCatalog;
import com.scorebot.engine.tuning.ParameterSpec;

import java.util.List;
import java.util.Locale;
import java.util.Map;

final class Prompts {
    private static final int MAX_NEWS = 8;

    private Prompts() {
    }

    static String rationalePrompt(AnalysisResult score, List<NewsItem> news) {
        StringBuilder sb = new StringBuilder(2048);
        sb.append("You are a financial analyst.\n");
        sb.append("Assess the technical signals and recent news for the ticker below.\n");
        sb.append("Ticker: ").append(safe(score.ticker)).append("\n");
        sb.append(String.format(Locale.US, "Price: %.4f%n", score.price));
        sb.append(String.format(Locale.US, "RSI: %.2f  Deviation(%%): %.2f  ADX: %.2f%n", score.rsi, score.deviationRate, score.adx));
        sb.append(String.format(Locale.US, "MACD: %.4f / signal %.4f  +DI: %.2f  -DI: %.2f%n",
                score.macdLine, score.macdSignal, score.dmiPlus, score.dmiMinus));
        sb.append("Buy score: ").append(score.buyScore).append("  Short score: ").append(score.shortScore).append("\n");
        if (score.signals != null) {
            sb.append("Signals: ").append(score.signals.toMap()).append("\n");
        }
        sb.append("News:\n");
        int n = 0;
        for (NewsItem item : news) {
            if (item == null || n >= MAX_NEWS) {
                continue;
            }
            String line = safe(item.summary());
            if (!line.isEmpty()) {
                sb.append("- ").append(line).append("\n");
                n++;
            }
        }
        if (n == 0) {
            sb.append("- (no recent news)\n");
        }
        sb.append("\nReply with a single JSON object and nothing else:\n");
        sb.append("{\"rationale\": \"<two or three sentences>\", \"risk\": \"none|low|medium|high\"}\n");
        sb.append("Only use facts from the given input.\n");
        return sb.toString();
    }

    static String tuningPrompt(DecisionRecord decision, double realizedPct) {
        AnalysisResult r = decision.result;
        StringBuilder sb = new StringBuilder(4096);
        sb.append("You tune the thresholds and weights of a technical scoring model.\n");
        sb.append("A past decision and its realized outcome follow.\n");
        sb.append("Ticker: ").append(safe(r.ticker)).append("\n");
        sb.append("Analyzed at: ").append(decision.analyzedAt).append("\n");
        sb.append(String.format(Locale.US, "Recorded price: %.4f%n", r.price));
        sb.append(String.format(Locale.US, "Realized change (%%): %.2f%n", realizedPct));
        sb.append("Buy score: ").append(r.buyScore).append("  Short score: ").append(r.shortScore).append("\n");
        if (r.signals != null) {
            sb.append("Signals: ").append(r.signals.toMap()).append("\n");
        }
        sb.append("Parameters used:\n");
        for (Map.Entry<String, Double> e : decision.parametersUsed.asMap().entrySet()) {
            ParameterSpec spec = ParameterCatalog.spec(e.getKey());
            sb.append("- ").append(e.getKey()).append(" = ").append(e.getValue());
            if (spec != null) {
                sb.append(String.format(Locale.US, " (range %s..%s%s)", num(spec.min), num(spec.max), spec.integral ? ", integer" : ""));
            }
            sb.append("\n");
        }
        sb.append("\nPropose only the parameter changes that would have improved this decision; propose none if it was right.\n");
        sb.append("Reply with a single JSON object and nothing else:\n");
        sb.append("{\"suggestions\": [{\"name\": \"<parameter name>\", \"value\": <number>}]}\n");
        return sb.toString();
    }

    private static String num(double v) {
        return v == Math.rint(v) ? String.valueOf((long) v) : String.valueOf(v);
    }

    private static String safe(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("\r", " ")
                .replace("\n", " ")
                .trim();
    }
}
