package com.scorebot.engine.tuning;

import com.scorebot.core.error.DuplicateVersionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.time.LocalDate;

/**
 * Writes the catalog seeds into an empty store. Never overwrites existing versions.
 */
public final class ParameterSeeder {
    private static final Logger LOG = LogManager.getLogger(ParameterSeeder.class);

    private final ParameterStore store;

    public ParameterSeeder(ParameterStore store) {
        this.store = store;
    }

    public int seedIfEmpty(LocalDate seedDate) throws SQLException {
        if (!store.isEmpty()) {
            return 0;
        }
        int written = 0;
        for (ParameterSpec spec : ParameterCatalog.all()) {
            try {
                store.writeNewVersion(seedDate, spec.name, spec.seed, "seed");
                written++;
            } catch (DuplicateVersionException e) {
                LOG.debug("seed already present name={} date={}", spec.name, seedDate);
            }
        }
        LOG.info("Tuning parameters seeded: count={} date={}", written, seedDate);
        return written;
    }
}
