package com.scorebot.engine.data;

import com.scorebot.core.error.ConfigurationException;
import com.scorebot.engine.config.Config;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Ticker universe from {@code analysis.universe} and the one-column CSV named by
 * {@code analysis.universe_file}. Order is preserved, duplicates dropped.
 */
public final class UniverseLoader {
    private static final Logger LOG = LogManager.getLogger(UniverseLoader.class);

    private final Config config;

    public UniverseLoader(Config config) {
        this.config = config;
    }

    public List<String> load() {
        Set<String> tickers = new LinkedHashSet<>();
        for (String raw : config.getList("analysis.universe")) {
            addTicker(tickers, raw);
        }
        String file = config.getString("analysis.universe_file");
        if (!file.isEmpty()) {
            Path path = config.getPath("analysis.universe_file");
            try {
                for (String line : Files.readAllLines(path, StandardCharsets.UTF_8)) {
                    String trimmed = line.trim();
                    if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                        continue;
                    }
                    int comma = trimmed.indexOf(',');
                    addTicker(tickers, comma >= 0 ? trimmed.substring(0, comma) : trimmed);
                }
            } catch (IOException e) {
                throw new ConfigurationException("cannot read universe file " + path, e);
            }
        }
        LOG.info("Universe loaded: size={}", tickers.size());
        return new ArrayList<>(tickers);
    }

    private static void addTicker(Set<String> tickers, String raw) {
        String t = raw == null ? "" : raw.trim().replace("\"", "").toUpperCase(Locale.ROOT);
        if (!t.isEmpty()) {
            tickers.add(t);
        }
    }
}
