package com.scorebot.engine.news;

import com.scorebot.engine.model.NewsItem;
import org.jsoup.Jsoup;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import java.io.ByteArrayInputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

public final class RssParser {

    private RssParser() {
    }

    /**
     * @throws IllegalArgumentException when the payload is not well-formed RSS
     */
    public static List<NewsItem> parse(String xml, int maxItems) {
        Document doc;
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            doc = factory.newDocumentBuilder()
                    .parse(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
        } catch (Exception e) {
            throw new IllegalArgumentException("malformed rss payload: " + e.getMessage(), e);
        }

        List<NewsItem> out = new ArrayList<>();
        NodeList items = doc.getElementsByTagName("item");
        for (int i = 0; i < items.getLength() && out.size() < maxItems; i++) {
            Element item = (Element) items.item(i);
            String title = clean(text(item, "title"));
            String link = clean(text(item, "link"));
            String description = stripHtml(text(item, "description"));
            out.add(new NewsItem(title, description, link, sourceText(item, title, link), publishedAt(text(item, "pubDate"))));
        }
        return out;
    }

    static String stripHtml(String raw) {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        return Jsoup.parse(raw).text().trim();
    }

    private static ZonedDateTime publishedAt(String pubDate) {
        if (pubDate == null || pubDate.isBlank()) {
            return null;
        }
        try {
            return ZonedDateTime.parse(pubDate.trim(), DateTimeFormatter.RFC_1123_DATE_TIME);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static String clean(String raw) {
        return raw == null ? "" : raw.trim();
    }

    private static String text(Element parent, String tag) {
        NodeList nl = parent.getElementsByTagName(tag);
        if (nl.getLength() == 0) {
            return null;
        }
        Node n = nl.item(0);
        return n == null ? null : n.getTextContent();
    }

    private static String sourceText(Element item, String title, String link) {
        String source = text(item, "source");
        if (source != null && !source.trim().isEmpty()) {
            return source.trim();
        }
        // aggregators append the outlet as "title - source"
        if (title.contains(" - ")) {
            String guessed = title.substring(title.lastIndexOf(" - ") + 3).trim();
            if (!guessed.isEmpty()) {
                return guessed;
            }
        }
        if (!link.isEmpty()) {
            try {
                String host = URI.create(link).getHost();
                return host == null ? "" : host;
            } catch (IllegalArgumentException e) {
                return "";
            }
        }
        return "";
    }
}
