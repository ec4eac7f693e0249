package com.scorebot.engine.tuning;

import com.scorebot.engine.model.TuningParameter;
import com.scorebot.engine.model.TuningParameters;

import java.sql.SQLException;
import java.time.LocalDate;
import java.util.List;

/**
 * Append-only, date-versioned store of named tuning parameters. There is no delete and no update.
 */
public interface ParameterStore {

    /**
     * Resolves, for every catalog name, the value of the latest version dated on or before {@code asOfDate}.
     *
     * @throws com.scorebot.core.error.MissingParameterException when a catalog name has no such version
     */
    TuningParameters getCurrent(LocalDate asOfDate) throws SQLException;

    /**
     * Inserts one version.
     *
     * @throws com.scorebot.core.error.DuplicateVersionException when (date, name) already exists
     */
    void writeNewVersion(LocalDate date, String name, double value, String description) throws SQLException;

    /**
     * All versions of a name, oldest first.
     */
    List<TuningParameter> history(String name) throws SQLException;

    boolean isEmpty() throws SQLException;
}
