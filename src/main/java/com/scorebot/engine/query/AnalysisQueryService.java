package com.scorebot.engine.query;

import com.scorebot.engine.db.AnalysisRepository;
import com.scorebot.engine.model.AnalysisResult;
import com.scorebot.engine.model.AnalysisRun;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Read side over the latest run. No run yet means empty results.
 */
public final class AnalysisQueryService {
    private final AnalysisRepository repository;

    public AnalysisQueryService(AnalysisRepository repository) {
        this.repository = repository;
    }

    public TopSummary topSummary(int n) throws SQLException {
        Optional<AnalysisRun> latest = repository.findLatestRun();
        if (latest.isEmpty()) {
            return new TopSummary(null, List.of(), List.of());
        }
        AnalysisRun run = latest.get();
        List<AnalysisResult> results = repository.listResults(run.id);
        int limit = Math.max(0, n);
        List<AnalysisResult> topBuy = results.stream()
                .sorted(Comparator.comparingInt((AnalysisResult r) -> r.buyScore).reversed().thenComparing(r -> r.ticker))
                .limit(limit)
                .collect(Collectors.toList());
        List<AnalysisResult> topShort = results.stream()
                .sorted(Comparator.comparingInt((AnalysisResult r) -> r.shortScore).reversed().thenComparing(r -> r.ticker))
                .limit(limit)
                .collect(Collectors.toList());
        return new TopSummary(run, topBuy, topShort);
    }

    public List<AnalysisResult> search(SearchCriteria criteria) throws SQLException {
        Optional<AnalysisRun> latest = repository.findLatestRun();
        if (latest.isEmpty()) {
            return List.of();
        }
        List<AnalysisResult> out = new ArrayList<>();
        for (AnalysisResult r : repository.listResults(latest.get().id)) {
            if (criteria.minBuyScore != null && r.buyScore < criteria.minBuyScore) {
                continue;
            }
            if (criteria.minShortScore != null && r.shortScore < criteria.minShortScore) {
                continue;
            }
            out.add(r);
        }
        Comparator<AnalysisResult> order = criteria.sortBy == SearchCriteria.SortBy.SHORT_SCORE
                ? Comparator.comparingInt(r -> r.shortScore)
                : Comparator.comparingInt(r -> r.buyScore);
        if (criteria.descending) {
            order = order.reversed();
        }
        out.sort(order.thenComparing(r -> r.ticker));
        return out.size() > criteria.limit ? new ArrayList<>(out.subList(0, Math.max(0, criteria.limit))) : out;
    }
}
