package com.scorebot.engine.config;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.Array;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Flattened operating configuration: classpath {@code config.properties}, a working-directory
 * override file, or Spring-bound properties. Tuning parameters never live here.
 */
public final class Config {
    private static final Logger LOG = LogManager.getLogger(Config.class);
    private static final Map<String, String> DEFAULTS = buildDefaults();

    private final Properties props = new Properties();
    private final Properties resourceProps = new Properties();
    private final Properties overrideProps = new Properties();
    private final Path workingDir;

    private Config(Path workingDir) {
        this.workingDir = workingDir;
    }

    public static Config load(Path workingDir) {
        Config config = new Config(workingDir);

        try (InputStream in = Config.class.getClassLoader().getResourceAsStream("config.properties")) {
            if (in != null) {
                config.resourceProps.load(in);
                config.props.putAll(config.resourceProps);
            }
        } catch (IOException e) {
            LOG.warn("classpath config.properties unreadable, using defaults: {}", e.getMessage());
        }

        Path local = workingDir.resolve("config.properties");
        if (Files.exists(local)) {
            try (InputStream in = Files.newInputStream(local)) {
                config.overrideProps.load(in);
                config.props.putAll(config.overrideProps);
            } catch (IOException e) {
                LOG.warn("failed to read {}: {}", local, e.getMessage());
            }
        }

        return config;
    }

    /**
     * Build Config from Spring-bound configuration properties.
     */
    public static Config fromConfigurationProperties(Path workingDir, Map<String, ?> rawProperties) {
        Config config = new Config(workingDir);
        flattenInto(config, "", rawProperties);
        return config;
    }

    /**
     * Config backed only by the given entries on top of defaults. Used by tests and the dry-run wiring.
     */
    public static Config of(Map<String, String> entries) {
        Config config = new Config(Path.of(".").toAbsolutePath().normalize());
        if (entries != null) {
            for (Map.Entry<String, String> e : entries.entrySet()) {
                putBoundValue(config, e.getKey(), e.getValue());
            }
        }
        return config;
    }

    public Path workingDir() {
        return workingDir;
    }

    public String getString(String key) {
        String raw = props.getProperty(key);
        if (raw != null) {
            String trimmed = raw.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return DEFAULTS.getOrDefault(key, "");
    }

    public String getString(String key, String fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return value;
    }

    public boolean getBoolean(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return false;
        }
        return "true".equalsIgnoreCase(value)
                || "1".equals(value)
                || "yes".equalsIgnoreCase(value)
                || "y".equalsIgnoreCase(value);
    }

    public boolean getBoolean(String key, boolean fallback) {
        String raw = props.getProperty(key);
        if ((raw == null || raw.trim().isEmpty()) && !DEFAULTS.containsKey(key)) {
            return fallback;
        }
        return getBoolean(key);
    }

    public int getInt(String key) {
        return getInt(key, parseInt(DEFAULTS.get(key), 0));
    }

    public int getInt(String key, int fallback) {
        return parseInt(getString(key), fallback);
    }

    public long getLong(String key, long fallback) {
        String value = getString(key);
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    public double getDouble(String key, double fallback) {
        return parseDouble(getString(key), fallback);
    }

    public Path getPath(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return workingDir;
        }
        return workingDir.resolve(value).normalize();
    }

    public List<String> getList(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String token : value.split("[,;]")) {
            String trimmed = token.trim();
            if (!trimmed.isEmpty()) {
                out.add(trimmed);
            }
        }
        return out;
    }

    /**
     * Copy of every explicitly set entry, without defaults.
     */
    public Properties asProperties() {
        Properties copy = new Properties();
        copy.putAll(props);
        return copy;
    }

    public String sourceOf(String key) {
        if (key == null || key.trim().isEmpty()) {
            return "default";
        }
        if (!nonBlank(overrideProps.getProperty(key)).isEmpty()) {
            return "override";
        }
        if (!nonBlank(resourceProps.getProperty(key)).isEmpty()) {
            return "resource";
        }
        return "default";
    }

    private static String nonBlank(String raw) {
        return raw == null ? "" : raw.trim();
    }

    private static void flattenInto(Config config, String prefix, Object value) {
        if (config == null || value == null) {
            return;
        }
        if (value instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String key = entry.getKey() == null ? "" : entry.getKey().toString().trim();
                if (key.isEmpty()) {
                    continue;
                }
                String fullKey = prefix.isEmpty() ? key : prefix + "." + key;
                flattenInto(config, fullKey, entry.getValue());
            }
            return;
        }
        if (value instanceof List<?> list) {
            List<String> parts = new ArrayList<>();
            for (Object item : list) {
                parts.add(stringify(item));
            }
            putBoundValue(config, prefix, String.join(",", parts));
            return;
        }
        if (value.getClass().isArray()) {
            int len = Array.getLength(value);
            List<String> parts = new ArrayList<>(len);
            for (int i = 0; i < len; i++) {
                parts.add(stringify(Array.get(value, i)));
            }
            putBoundValue(config, prefix, String.join(",", parts));
            return;
        }
        putBoundValue(config, prefix, stringify(value));
    }

    private static void putBoundValue(Config config, String key, String value) {
        if (config == null || key == null || key.trim().isEmpty()) {
            return;
        }
        String normalizedKey = key.trim();
        String normalizedValue = value == null ? "" : value;
        config.overrideProps.setProperty(normalizedKey, normalizedValue);
        config.props.setProperty(normalizedKey, normalizedValue);
    }

    private static String stringify(Object value) {
        return value == null ? "" : String.valueOf(value);
    }

    private static int parseInt(String value, int fallback) {
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static double parseDouble(String value, double fallback) {
        if (value == null) {
            return fallback;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static Map<String, String> buildDefaults() {
        Map<String, String> defaults = new HashMap<>();

        defaults.put("outputs.dir", "outputs");
        defaults.put("db.url", "jdbc:postgresql://localhost:5432/scorebot");
        defaults.put("db.user", "scorebot");
        defaults.put("db.pass", "scorebot");
        defaults.put("db.schema", "scorebot");
        defaults.put("db.sql_log.enabled", "true");

        defaults.put("analysis.universe", "");
        defaults.put("analysis.universe_file", "");
        defaults.put("analysis.threads", "4");
        defaults.put("analysis.history_buffer_days", "20");
        defaults.put("analysis.price.retry.max", "3");
        defaults.put("analysis.price.retry.backoff_ms", "400");
        defaults.put("analysis.price.timeout_ms", "20000");
        defaults.put("analysis.news.retry.max", "2");
        defaults.put("analysis.news.retry.backoff_ms", "300");
        defaults.put("analysis.news.timeout_ms", "15000");
        defaults.put("analysis.ai.retry.max", "1");
        defaults.put("analysis.ai.retry.backoff_ms", "0");
        defaults.put("analysis.ai.timeout_ms", "180000");

        defaults.put("feedback.maturity_days", "10");
        defaults.put("feedback.batch_limit", "200");
        defaults.put("tuning.seed_date", "2000-01-01");

        defaults.put("stooq.base_url", "https://stooq.com/q/d/l/");
        defaults.put("stooq.suffix", ".us");
        defaults.put("stooq.timeout_sec", "20");

        defaults.put("news.base_url", "https://news.google.com/rss/search");
        defaults.put("news.lang", "en");
        defaults.put("news.region", "US");
        defaults.put("news.max_items", "8");
        defaults.put("news.timeout_sec", "15");

        defaults.put("ai.base_url", "http://127.0.0.1:11434");
        defaults.put("ai.model", "llama3.1:latest");
        defaults.put("ai.timeout_sec", "180");
        defaults.put("ai.temperature", "0.2");
        defaults.put("ai.max_tokens", "600");

        defaults.put("email.enabled", "true");
        defaults.put("email.smtp_host", "smtp.gmail.com");
        defaults.put("email.smtp_port", "587");
        defaults.put("email.smtp_user", "");
        defaults.put("email.smtp_pass", "");
        defaults.put("email.from", "");
        defaults.put("email.to", "");
        defaults.put("email.subject_prefix", "[ScoreBot]");
        defaults.put("mail.dry_run", "false");
        defaults.put("mail.dry_run_dir", "outputs/mail_dry_run");

        defaults.put("schedule.zone", "UTC");
        defaults.put("schedule.analysis_times", "06:00");
        defaults.put("schedule.feedback_times", "07:00");

        return Collections.unmodifiableMap(defaults);
    }
}
