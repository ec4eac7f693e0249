package com.scorebot.engine.model;

import java.time.ZonedDateTime;

public final class NewsItem {
    public final String title;
    public final String description;
    public final String link;
    public final String source;
    public final ZonedDateTime publishedAt;

    public NewsItem(String title, String description, String link, String source, ZonedDateTime publishedAt) {
        this.title = title == null ? "" : title;
        this.description = description == null ? "" : description;
        this.link = link == null ? "" : link;
        this.source = source == null ? "" : source;
        this.publishedAt = publishedAt;
    }

    /**
     * One-line summary handed to the AI collaborator.
     */
    public String summary() {
        StringBuilder sb = new StringBuilder(title);
        if (!source.isEmpty()) {
            sb.append(" (").append(source).append(')');
        }
        if (!description.isEmpty() && !description.equals(title)) {
            sb.append(": ").append(description);
        }
        return sb.toString();
    }
}
