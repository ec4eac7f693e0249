package com.scorebot.engine.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigTest {

    @Test
    void of_shouldLayerEntriesOverDefaults() {
        Config config = Config.of(Map.of("analysis.threads", "8", "feedback.maturity_days", "oops"));

        assertEquals(8, config.getInt("analysis.threads"));
        assertEquals(5, config.getInt("feedback.maturity_days", 5));
        assertEquals("https://stooq.com/q/d/l/", config.getString("stooq.base_url"));
        assertEquals("fallback", config.getString("no.such.key", "fallback"));
    }

    @Test
    void getBoolean_shouldUseFallbackOnlyForUnknownKeys() {
        Config config = Config.of(Map.of("mail.dry_run", "yes"));

        assertTrue(config.getBoolean("mail.dry_run", false));
        assertFalse(config.getBoolean("email.enabled.missing", false));
        assertTrue(config.getBoolean("app.dry_run", true));
        assertTrue(config.getBoolean("email.enabled", false));
    }

    @Test
    void getList_shouldSplitOnCommaAndSemicolon() {
        Config config = Config.of(Map.of("analysis.universe", " AAPL, MSFT;;NVDA "));

        assertEquals(List.of("AAPL", "MSFT", "NVDA"), config.getList("analysis.universe"));
        assertTrue(config.getList("analysis.universe_file").isEmpty());
    }

    @Test
    void fromConfigurationProperties_shouldFlattenNestedMapsAndLists() {
        Map<String, Object> retry = new LinkedHashMap<>();
        retry.put("max", 5);
        Map<String, Object> price = new LinkedHashMap<>();
        price.put("retry", retry);
        price.put("timeout_ms", 1500L);
        Map<String, Object> analysis = new LinkedHashMap<>();
        analysis.put("price", price);
        analysis.put("universe", List.of("AAPL", "MSFT"));
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("analysis", analysis);

        Config config = Config.fromConfigurationProperties(Path.of("/tmp/scorebot"), raw);

        assertEquals(5, config.getInt("analysis.price.retry.max"));
        assertEquals(1500L, config.getLong("analysis.price.timeout_ms", 0L));
        assertEquals(List.of("AAPL", "MSFT"), config.getList("analysis.universe"));
        assertEquals("override", config.sourceOf("analysis.universe"));
        assertEquals("default", config.sourceOf("stooq.base_url"));
        assertEquals(Path.of("/tmp/scorebot/outputs/mail_dry_run"), config.getPath("mail.dry_run_dir"));
    }

    @Test
    void asProperties_shouldCopyOnlyExplicitEntries() {
        Config config = Config.of(Map.of("schedule.zone", "Asia/Tokyo"));

        Properties props = config.asProperties();
        props.setProperty("schedule.zone", "UTC");

        assertEquals("Asia/Tokyo", config.getString("schedule.zone"));
        assertFalse(props.containsKey("stooq.base_url"));
    }
}
