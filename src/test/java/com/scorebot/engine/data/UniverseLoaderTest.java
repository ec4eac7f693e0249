package com.scorebot.engine.data;

import com.scorebot.core.error.ConfigurationException;
import com.scorebot.engine.config.Config;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UniverseLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_shouldMergeListAndFileInOrderWithoutDuplicates() throws Exception {
        Path file = tempDir.resolve("universe.csv");
        Files.write(file, List.of("# watch list", "nvda,NVIDIA", "", "\"amzn\"", "aapl"), StandardCharsets.UTF_8);
        Config config = Config.of(Map.of(
                "analysis.universe", "aapl; msft",
                "analysis.universe_file", file.toString()
        ));

        assertEquals(List.of("AAPL", "MSFT", "NVDA", "AMZN"), new UniverseLoader(config).load());
    }

    @Test
    void load_shouldReturnEmptyWhenNothingConfigured() {
        assertTrue(new UniverseLoader(Config.of(Map.of())).load().isEmpty());
    }

    @Test
    void load_shouldFailOnUnreadableFile() {
        Config config = Config.of(Map.of("analysis.universe_file", tempDir.resolve("missing.csv").toString()));

        assertThrows(ConfigurationException.class, () -> new UniverseLoader(config).load());
    }
}
