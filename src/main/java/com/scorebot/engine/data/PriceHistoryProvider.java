package com.scorebot.engine.data;

import com.scorebot.engine.model.BarDaily;

import java.util.List;

/**
 * Daily OHLCV source. Implementations throw {@link com.scorebot.core.error.NotFoundException} or
 * {@link com.scorebot.core.error.RateLimitException}; retries belong to the caller.
 */
public interface PriceHistoryProvider {

    /**
     * @return at most {@code lookback} bars, oldest first
     */
    List<BarDaily> getHistory(String ticker, int lookback);

    double getCurrentPrice(String ticker);
}
