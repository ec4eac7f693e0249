package com.scorebot.engine.data;

import com.scorebot.core.error.CallTimeoutException;
import com.scorebot.core.error.NotFoundException;
import com.scorebot.core.error.RateLimitException;
import com.scorebot.engine.config.Config;
import com.scorebot.engine.model.BarDaily;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Daily bars from the stooq CSV endpoint. One HTTP attempt per call.
 */
public final class StooqClient implements PriceHistoryProvider {
    private static final Logger LOG = LogManager.getLogger(StooqClient.class);

    private final String baseUrl;
    private final String suffix;
    private final int timeoutSec;
    private final long requestPauseMs;
    private final HttpClientEx http;
    private final AtomicLong lastRequestAtNanos = new AtomicLong(0L);

    public StooqClient(Config config) {
        this(config, new HttpClientEx());
    }

    public StooqClient(Config config, HttpClientEx http) {
        this.baseUrl = config.getString("stooq.base_url", "https://stooq.com/q/d/l/");
        this.suffix = config.getString("stooq.suffix", "");
        this.timeoutSec = Math.max(3, config.getInt("stooq.timeout_sec", 20));
        this.requestPauseMs = Math.max(0L, config.getLong("stooq.request_pause_ms", 0L));
        this.http = http;
    }

    @Override
    public List<BarDaily> getHistory(String ticker, int lookback) {
        List<BarDaily> all = fetchDaily(ticker);
        if (lookback <= 0 || all.size() <= lookback) {
            return all;
        }
        return new ArrayList<>(all.subList(all.size() - lookback, all.size()));
    }

    @Override
    public double getCurrentPrice(String ticker) {
        List<BarDaily> bars = fetchDaily(ticker);
        return bars.get(bars.size() - 1).close;
    }

    List<BarDaily> fetchDaily(String ticker) {
        String symbol = symbolFor(ticker);
        String url = baseUrl + "?s=" + symbol + "&i=d";
        HttpClientEx.TextResponse response;
        try {
            throttleRequest();
            response = http.get(url, timeoutSec);
        } catch (HttpTimeoutException e) {
            throw new CallTimeoutException("stooq timeout ticker=" + ticker, e);
        } catch (IOException e) {
            throw new CallTimeoutException("stooq io failure ticker=" + ticker + " err=" + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CallTimeoutException("stooq fetch interrupted ticker=" + ticker, e);
        }
        if (response.status == 429) {
            throw new RateLimitException("stooq http status=429 ticker=" + ticker);
        }
        if (response.status == 404) {
            throw new NotFoundException("stooq http status=404 ticker=" + ticker);
        }
        if (!response.ok()) {
            throw new NotFoundException("stooq http status=" + response.status + " ticker=" + ticker);
        }
        List<BarDaily> bars = parseCsv(ticker, response.body);
        LOG.debug("stooq fetched ticker={} bars={}", ticker, bars.size());
        return bars;
    }

    String symbolFor(String ticker) {
        String normalized = ticker == null ? "" : ticker.trim().toLowerCase(Locale.ROOT);
        if (normalized.contains(".") || suffix.isEmpty()) {
            return normalized;
        }
        return normalized + suffix.toLowerCase(Locale.ROOT);
    }

    static List<BarDaily> parseCsv(String ticker, String body) {
        String text = body == null ? "" : body.trim();
        if (text.isEmpty() || text.equalsIgnoreCase("No data")) {
            throw new NotFoundException("stooq no data ticker=" + ticker);
        }
        if (text.toLowerCase(Locale.ROOT).contains("exceeded the daily hits limit")) {
            throw new RateLimitException("stooq daily hits limit ticker=" + ticker);
        }

        String[] lines = text.split("\\r?\\n");
        String header = lines[0].trim().toLowerCase(Locale.ROOT);
        if (!header.startsWith("date,open,high,low,close,volume")) {
            String sample = text.length() > 120 ? text.substring(0, 120) : text;
            throw new NotFoundException("unexpected stooq payload ticker=" + ticker + " sample=" + sample);
        }

        List<BarDaily> all = new ArrayList<>(Math.max(64, lines.length));
        for (int i = 1; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.isEmpty()) {
                continue;
            }
            String[] cols = line.split(",");
            if (cols.length < 6) {
                continue;
            }
            try {
                LocalDate date = LocalDate.parse(cols[0].trim());
                double close = parseDouble(cols[4]);
                if (close <= 0) {
                    continue;
                }
                all.add(new BarDaily(ticker, date, parseDouble(cols[1]), parseDouble(cols[2]), parseDouble(cols[3]), close, parseDouble(cols[5])));
            } catch (RuntimeException e) {
                LOG.debug("stooq malformed line skipped ticker={} line={}", ticker, line);
            }
        }
        if (all.isEmpty()) {
            throw new NotFoundException("stooq no rows ticker=" + ticker);
        }
        all.sort(Comparator.comparing(a -> a.tradeDate));
        return all;
    }

    private static double parseDouble(String input) {
        String v = input == null ? "" : input.trim();
        if (v.isEmpty() || v.equalsIgnoreCase("null")) {
            return 0.0;
        }
        return Double.parseDouble(v);
    }

    private void throttleRequest() throws InterruptedException {
        if (requestPauseMs <= 0L) {
            return;
        }
        long pauseNanos = requestPauseMs * 1_000_000L;
        while (true) {
            long prev = lastRequestAtNanos.get();
            long now = System.nanoTime();
            long nextAllowed = prev + pauseNanos;
            if (now < nextAllowed) {
                TimeUnit.NANOSECONDS.sleep(nextAllowed - now);
                continue;
            }
            if (lastRequestAtNanos.compareAndSet(prev, now)) {
                return;
            }
        }
    }
}
