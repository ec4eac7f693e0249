package com.scorebot.engine.query;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.Locale;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class SearchCriteria {
    public enum SortBy {
        BUY_SCORE,
        SHORT_SCORE;

        public static SortBy parse(String raw) {
            String v = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
            if ("short".equals(v) || "short_score".equals(v)) {
                return SHORT_SCORE;
            }
            if (v.isEmpty() || "buy".equals(v) || "buy_score".equals(v)) {
                return BUY_SCORE;
            }
            throw new IllegalArgumentException("unknown sort field: " + raw);
        }
    }

    public final Integer minBuyScore;
    public final Integer minShortScore;
    @Builder.Default
    public final SortBy sortBy = SortBy.BUY_SCORE;
    @Builder.Default
    public final boolean descending = true;
    @Builder.Default
    public final int limit = 20;
}
