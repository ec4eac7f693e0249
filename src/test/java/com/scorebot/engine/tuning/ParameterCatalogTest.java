package com.scorebot.engine.tuning;

import com.scorebot.core.error.ConfigurationException;
import com.scorebot.core.error.InvalidTuningValueException;
import com.scorebot.engine.Fixtures;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ParameterCatalogTest {

    @Test
    void seeds_shouldPassTheirOwnRangeChecks() {
        for (ParameterSpec spec : ParameterCatalog.all()) {
            assertNull(spec.check(spec.seed), spec.name);
        }
        assertDoesNotThrow(() -> ParameterCatalog.validateConsistency(Fixtures.params(Map.of())));
    }

    @Test
    void validate_shouldRejectUnknownOutOfRangeAndFractionalValues() {
        InvalidTuningValueException unknown = assertThrows(InvalidTuningValueException.class,
                () -> ParameterCatalog.validate("lucky_number", 7.0));
        assertTrue(unknown.getMessage().contains("unknown parameter"));

        assertThrows(InvalidTuningValueException.class,
                () -> ParameterCatalog.validate(ParameterCatalog.RSI_OVERSOLD_THRESHOLD, 120.0));
        assertThrows(InvalidTuningValueException.class,
                () -> ParameterCatalog.validate(ParameterCatalog.RSI_PERIOD, 13.5));
        assertThrows(InvalidTuningValueException.class,
                () -> ParameterCatalog.validate(ParameterCatalog.DEVIATION_BUY_THRESHOLD, Double.NaN));

        assertDoesNotThrow(() -> ParameterCatalog.validate(ParameterCatalog.RSI_OVERSOLD_THRESHOLD, 27.5));
        assertDoesNotThrow(() -> ParameterCatalog.validate(ParameterCatalog.RSI_PERIOD, 10.0));
    }

    @Test
    void validateConsistency_shouldRequireSlowMacdAboveFast() {
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> ParameterCatalog.validateConsistency(
                Fixtures.params(Map.of(ParameterCatalog.MACD_FAST_PERIOD, 26.0, ParameterCatalog.MACD_SLOW_PERIOD, 26.0))));
        assertTrue(e.getMessage().contains("macd_slow_period"));
    }

    @Test
    void validateConsistency_shouldKeepRsiReadyBandsReachable() {
        ConfigurationException buy = assertThrows(ConfigurationException.class, () -> ParameterCatalog.validateConsistency(
                Fixtures.params(Map.of(ParameterCatalog.RSI_OVERSOLD_THRESHOLD, 40.0))));
        assertTrue(buy.getMessage().contains("rsi_buy_ready_threshold"));

        ConfigurationException sell = assertThrows(ConfigurationException.class, () -> ParameterCatalog.validateConsistency(
                Fixtures.params(Map.of(ParameterCatalog.RSI_SELL_READY_THRESHOLD, 80.0))));
        assertTrue(sell.getMessage().contains("rsi_overbought_threshold"));
    }

    @Test
    void validateOrdering_shouldCompareAgainstCurrentPartner() {
        Map<String, Double> current = Map.of(
                ParameterCatalog.RSI_OVERSOLD_THRESHOLD, 25.0,
                ParameterCatalog.RSI_BUY_READY_THRESHOLD, 40.0,
                ParameterCatalog.RSI_SELL_READY_THRESHOLD, 60.0,
                ParameterCatalog.RSI_OVERBOUGHT_THRESHOLD, 75.0);

        assertThrows(InvalidTuningValueException.class,
                () -> ParameterCatalog.validateOrdering(ParameterCatalog.RSI_OVERSOLD_THRESHOLD, 40.0, current));
        assertThrows(InvalidTuningValueException.class,
                () -> ParameterCatalog.validateOrdering(ParameterCatalog.RSI_BUY_READY_THRESHOLD, 20.0, current));
        assertThrows(InvalidTuningValueException.class,
                () -> ParameterCatalog.validateOrdering(ParameterCatalog.RSI_SELL_READY_THRESHOLD, 75.0, current));
        assertThrows(InvalidTuningValueException.class,
                () -> ParameterCatalog.validateOrdering(ParameterCatalog.RSI_OVERBOUGHT_THRESHOLD, 58.0, current));
        assertDoesNotThrow(() -> ParameterCatalog.validateOrdering(ParameterCatalog.RSI_OVERSOLD_THRESHOLD, 35.0, current));
        assertDoesNotThrow(() -> ParameterCatalog.validateOrdering(ParameterCatalog.SCORE_THRESHOLD, 99.0, current));
    }

    @Test
    void isKnown_shouldMatchCatalogNamesOnly() {
        assertTrue(ParameterCatalog.isKnown(ParameterCatalog.SCORE_THRESHOLD));
        assertFalse(ParameterCatalog.isKnown("score"));
        assertFalse(ParameterCatalog.isKnown(null));
        assertEquals(24, ParameterCatalog.names().size());
    }
}
