package com.scorebot.engine.tuning;

import com.scorebot.core.error.DuplicateVersionException;
import com.scorebot.core.error.MissingParameterException;
import com.scorebot.engine.Fixtures;
import com.scorebot.engine.model.TuningParameter;
import com.scorebot.engine.model.TuningParameters;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryParameterStoreTest {
    private static final LocalDate D1 = LocalDate.of(2024, 1, 1);
    private static final LocalDate D2 = LocalDate.of(2024, 2, 1);

    @Test
    void getCurrent_shouldReturnLatestVersionOnOrBeforeDate() {
        InMemoryParameterStore store = Fixtures.seededStore(D1, Map.of());
        store.writeNewVersion(D2, ParameterCatalog.RSI_OVERSOLD_THRESHOLD, 28.0, "feedback");

        assertEquals(25.0, store.getCurrent(D1).value(ParameterCatalog.RSI_OVERSOLD_THRESHOLD));
        assertEquals(25.0, store.getCurrent(D2.minusDays(1)).value(ParameterCatalog.RSI_OVERSOLD_THRESHOLD));
        assertEquals(28.0, store.getCurrent(D2).value(ParameterCatalog.RSI_OVERSOLD_THRESHOLD));
        assertEquals(28.0, store.getCurrent(D2.plusYears(1)).value(ParameterCatalog.RSI_OVERSOLD_THRESHOLD));
    }

    @Test
    void getCurrent_shouldResolveEveryCatalogName() {
        TuningParameters params = Fixtures.seededStore(D1, Map.of()).getCurrent(D1);

        assertEquals(ParameterCatalog.names().size(), params.size());
        for (String name : ParameterCatalog.names()) {
            assertTrue(params.contains(name), name);
        }
    }

    @Test
    void getCurrent_shouldFailBeforeFirstVersion() {
        InMemoryParameterStore store = Fixtures.seededStore(D1, Map.of());

        MissingParameterException e = assertThrows(MissingParameterException.class, () -> store.getCurrent(D1.minusDays(1)));
        assertEquals(ParameterCatalog.names().size(), e.missingNames().size());
        assertEquals(D1.minusDays(1), e.asOfDate());
    }

    @Test
    void getCurrent_shouldNameOnlyTheMissingParameters() {
        InMemoryParameterStore store = new InMemoryParameterStore();
        for (String name : ParameterCatalog.names()) {
            if (!name.equals(ParameterCatalog.SCORE_THRESHOLD)) {
                store.writeNewVersion(D1, name, ParameterCatalog.spec(name).seed, "seed");
            }
        }

        MissingParameterException e = assertThrows(MissingParameterException.class, () -> store.getCurrent(D1));
        assertEquals(List.of(ParameterCatalog.SCORE_THRESHOLD), e.missingNames());
    }

    @Test
    void writeNewVersion_shouldRejectSecondVersionForSameDateAndName() {
        InMemoryParameterStore store = Fixtures.seededStore(D1, Map.of());
        store.writeNewVersion(D2, ParameterCatalog.RSI_PERIOD, 10.0, "first");

        DuplicateVersionException e = assertThrows(DuplicateVersionException.class,
                () -> store.writeNewVersion(D2, ParameterCatalog.RSI_PERIOD, 12.0, "second"));
        assertEquals(D2, e.effectiveDate());
        assertEquals(ParameterCatalog.RSI_PERIOD, e.name());
        assertEquals(10.0, store.getCurrent(D2).value(ParameterCatalog.RSI_PERIOD));
    }

    @Test
    void history_shouldKeepEveryVersionInDateOrder() {
        InMemoryParameterStore store = Fixtures.seededStore(D1, Map.of());
        store.writeNewVersion(D2, ParameterCatalog.RSI_PERIOD, 10.0, "feedback");

        List<TuningParameter> history = store.history(ParameterCatalog.RSI_PERIOD);

        assertEquals(2, history.size());
        assertEquals(D1, history.get(0).effectiveDate);
        assertEquals(14.0, history.get(0).value);
        assertEquals(D2, history.get(1).effectiveDate);
        assertEquals("feedback", history.get(1).description);
        assertTrue(store.history("unknown").isEmpty());
    }

    @Test
    void seeder_shouldSeedOnlyAnEmptyStore() throws Exception {
        InMemoryParameterStore store = new InMemoryParameterStore();
        ParameterSeeder seeder = new ParameterSeeder(store);

        assertTrue(store.isEmpty());
        assertEquals(ParameterCatalog.names().size(), seeder.seedIfEmpty(D1));
        assertFalse(store.isEmpty());
        assertEquals(0, seeder.seedIfEmpty(D2));
        assertEquals(1, store.history(ParameterCatalog.RSI_PERIOD).size());
        assertEquals(14.0, store.getCurrent(D2).value(ParameterCatalog.RSI_PERIOD));
    }
}
