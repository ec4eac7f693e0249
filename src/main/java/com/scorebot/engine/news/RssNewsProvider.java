package com.scorebot.engine.news;

import com.scorebot.core.error.CallTimeoutException;
import com.scorebot.core.error.NotFoundException;
import com.scorebot.core.error.RateLimitException;
import com.scorebot.engine.config.Config;
import com.scorebot.engine.data.HttpClientEx;
import com.scorebot.engine.model.NewsItem;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Google News RSS search by ticker symbol.
 */
public final class RssNewsProvider implements NewsProvider {
    private static final Logger LOG = LogManager.getLogger(RssNewsProvider.class);

    private final HttpClientEx http;
    private final String baseUrl;
    private final String lang;
    private final String region;
    private final int maxItems;
    private final int timeoutSec;

    public RssNewsProvider(Config config, HttpClientEx http) {
        this.http = http;
        this.baseUrl = config.getString("news.base_url", "https://news.google.com/rss/search");
        this.lang = config.getString("news.lang", "en");
        this.region = config.getString("news.region", "US");
        this.maxItems = Math.max(1, config.getInt("news.max_items", 8));
        this.timeoutSec = Math.max(3, config.getInt("news.timeout_sec", 15));
    }

    @Override
    public List<NewsItem> getRecentNews(String ticker) {
        String q = URLEncoder.encode(ticker + " stock", StandardCharsets.UTF_8);
        String url = baseUrl + "?q=" + q + "&hl=" + lang + "&gl=" + region + "&ceid=" + region + ":" + lang;
        HttpClientEx.TextResponse response;
        try {
            response = http.get(url, timeoutSec);
        } catch (IOException e) {
            throw new CallTimeoutException("news fetch failed ticker=" + ticker + " err=" + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CallTimeoutException("news fetch interrupted ticker=" + ticker, e);
        }
        if (response.status == 429) {
            throw new RateLimitException("news http status=429 ticker=" + ticker);
        }
        if (!response.ok()) {
            throw new NotFoundException("news http status=" + response.status + " ticker=" + ticker);
        }
        List<NewsItem> items = RssParser.parse(response.body, maxItems);
        LOG.debug("news fetched ticker={} items={}", ticker, items.size());
        return items;
    }
}
