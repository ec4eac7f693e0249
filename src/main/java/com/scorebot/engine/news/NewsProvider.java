package com.scorebot.engine.news;

import com.scorebot.engine.model.NewsItem;

import java.util.List;

public interface NewsProvider {

    /**
     * @return recent articles, possibly empty; failures are thrown, never returned as an empty list
     */
    List<NewsItem> getRecentNews(String ticker);
}
