package com.scorebot.engine.data;

import com.scorebot.core.error.CallTimeoutException;
import com.scorebot.core.error.NotFoundException;
import com.scorebot.core.error.RateLimitException;
import com.scorebot.engine.StubHttpClient;
import com.scorebot.engine.config.Config;
import com.scorebot.engine.model.BarDaily;
import org.junit.jupiter.api.Test;

import java.net.http.HttpTimeoutException;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StooqClientTest {
    private static final String CSV = "Date,Open,High,Low,Close,Volume\n"
            + "2024-03-05,170.0,173.0,169.0,172.0,1000\n"
            + "2024-03-04,168.0,171.0,167.5,170.5,900\n"
            + "2024-03-06,172.0,175.0,171.0,174.0,1100\n"
            + "broken,line\n"
            + "2024-03-07,174.0,176.0,173.0,0,500\n";

    @Test
    void parseCsv_shouldSortBarsAndSkipBadRows() {
        List<BarDaily> bars = StooqClient.parseCsv("AAPL", CSV);

        assertEquals(3, bars.size());
        assertEquals(LocalDate.of(2024, 3, 4), bars.get(0).tradeDate);
        assertEquals(174.0, bars.get(2).close);
        assertEquals(1100.0, bars.get(2).volume);
    }

    @Test
    void parseCsv_shouldMapEmptyAndLimitPayloads() {
        assertThrows(NotFoundException.class, () -> StooqClient.parseCsv("ZZZZ", "No data"));
        assertThrows(NotFoundException.class, () -> StooqClient.parseCsv("ZZZZ", "<html>oops</html>"));
        assertThrows(NotFoundException.class, () -> StooqClient.parseCsv("ZZZZ", "Date,Open,High,Low,Close,Volume\n"));
        assertThrows(RateLimitException.class, () -> StooqClient.parseCsv("AAPL", "Exceeded the daily hits limit"));
    }

    @Test
    void getHistory_shouldKeepMostRecentBars() {
        StubHttpClient http = new StubHttpClient(200, CSV);
        StooqClient client = new StooqClient(Config.of(Map.of()), http);

        List<BarDaily> bars = client.getHistory("AAPL", 2);

        assertEquals(2, bars.size());
        assertEquals(LocalDate.of(2024, 3, 5), bars.get(0).tradeDate);
        assertTrue(http.urls.get(0).contains("s=aapl.us"));
        assertEquals(174.0, client.getCurrentPrice("AAPL"));
    }

    @Test
    void getHistory_shouldMapHttpFailures() {
        Config config = Config.of(Map.of());

        assertThrows(RateLimitException.class, () -> new StooqClient(config, new StubHttpClient(429, "")).getHistory("AAPL", 10));
        assertThrows(NotFoundException.class, () -> new StooqClient(config, new StubHttpClient(404, "")).getHistory("AAPL", 10));
        assertThrows(CallTimeoutException.class,
                () -> new StooqClient(config, StubHttpClient.failing(new HttpTimeoutException("slow"))).getHistory("AAPL", 10));
    }

    @Test
    void symbolFor_shouldAppendSuffixOnlyToBareTickers() {
        StooqClient client = new StooqClient(Config.of(Map.of("stooq.suffix", ".us")), new StubHttpClient(200, CSV));

        assertEquals("msft.us", client.symbolFor(" MSFT "));
        assertEquals("7203.jp", client.symbolFor("7203.JP"));
    }
}
