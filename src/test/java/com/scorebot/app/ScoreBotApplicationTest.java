package com.scorebot.app;

import com.scorebot.engine.query.SearchCriteria;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.junit.jupiter.api.Test;

import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScoreBotApplicationTest {

    @Test
    void run_shouldReturnUsageExitCodes() {
        ScoreBotApplication app = new ScoreBotApplication();

        assertEquals(0, app.run(new String[]{"--help"}));
        assertEquals(2, app.run(new String[]{}));
        assertEquals(2, app.run(new String[]{"--analyze", "--re-evaluate"}));
        assertEquals(2, app.run(new String[]{"--no-such-flag"}));
    }

    @Test
    void buildCriteria_shouldReadSearchModifiers() throws Exception {
        SearchCriteria criteria = ScoreBotApplication.buildCriteria(parse(
                "--search", "--min-buy", "4", "--sort-by", "short_score", "--order", "asc", "--limit", "5"));

        assertEquals(4, criteria.minBuyScore);
        assertNull(criteria.minShortScore);
        assertEquals(SearchCriteria.SortBy.SHORT_SCORE, criteria.sortBy);
        assertFalse(criteria.descending);
        assertEquals(5, criteria.limit);
    }

    @Test
    void buildCriteria_shouldDefaultToBuyScoreDescending() throws Exception {
        SearchCriteria criteria = ScoreBotApplication.buildCriteria(parse("--search"));

        assertEquals(SearchCriteria.SortBy.BUY_SCORE, criteria.sortBy);
        assertTrue(criteria.descending);
        assertEquals(20, criteria.limit);
    }

    @Test
    void buildCriteria_shouldRejectBadValues() throws Exception {
        CommandLine badOrder = parse("--search", "--order", "sideways");
        CommandLine badLimit = parse("--search", "--limit", "0");
        CommandLine badScore = parse("--search", "--min-short", "high");

        assertThrows(IllegalArgumentException.class, () -> ScoreBotApplication.buildCriteria(badOrder));
        assertThrows(IllegalArgumentException.class, () -> ScoreBotApplication.buildCriteria(badLimit));
        assertThrows(IllegalArgumentException.class, () -> ScoreBotApplication.buildCriteria(badScore));
    }

    @Test
    void parseInt_shouldRejectMissingValueWithFlagName() {
        IllegalArgumentException missing = assertThrows(IllegalArgumentException.class,
                () -> ScoreBotApplication.parseInt(null, "--min-buy"));
        assertTrue(missing.getMessage().contains("--min-buy"));
        assertEquals(7, ScoreBotApplication.parseInt(" 7 ", "--min-buy"));
    }

    @Test
    void parseTimes_shouldSortDeduplicateAndSkipInvalid() {
        assertEquals(List.of(LocalTime.of(6, 0), LocalTime.of(18, 30)),
                ScoreBotApplication.parseTimes("18:30, 6:00,06:00,25:99"));
        assertTrue(ScoreBotApplication.parseTimes(" ").isEmpty());
    }

    @Test
    void buildSlots_shouldRunAnalysisBeforeFeedbackInSharedSlot() {
        Map<LocalTime, List<ScoreBotApplication.Job>> slots = ScoreBotApplication.buildSlots(
                List.of(LocalTime.of(6, 0)),
                List.of(LocalTime.of(6, 0), LocalTime.of(7, 0)));

        assertEquals(List.of(LocalTime.of(6, 0), LocalTime.of(7, 0)), List.copyOf(slots.keySet()));
        assertEquals(List.of(ScoreBotApplication.Job.ANALYSIS, ScoreBotApplication.Job.FEEDBACK), slots.get(LocalTime.of(6, 0)));
    }

    @Test
    void nextRunTime_shouldRollOverToNextDay() {
        ZoneId zone = ZoneId.of("Asia/Tokyo");
        List<LocalTime> times = List.of(LocalTime.of(6, 0), LocalTime.of(18, 0));

        ZonedDateTime morning = ZonedDateTime.of(2024, 3, 1, 7, 0, 0, 0, zone);
        ZonedDateTime evening = ZonedDateTime.of(2024, 3, 1, 18, 0, 0, 0, zone);

        assertEquals(ZonedDateTime.of(2024, 3, 1, 18, 0, 0, 0, zone), ScoreBotApplication.nextRunTime(morning, times));
        assertEquals(ZonedDateTime.of(2024, 3, 2, 6, 0, 0, 0, zone), ScoreBotApplication.nextRunTime(evening, times));
    }

    private static CommandLine parse(String... args) throws Exception {
        return new DefaultParser().parse(ScoreBotApplication.buildOptions(), args);
    }
}
