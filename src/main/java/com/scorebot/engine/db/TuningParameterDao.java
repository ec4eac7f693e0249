package com.scorebot.engine.db;

import com.scorebot.core.error.DuplicateVersionException;
import com.scorebot.engine.db.mybatis.MyBatisSupport;
import com.scorebot.engine.db.mybatis.TuningParameterMapper;
import com.scorebot.engine.db.mybatis.TuningParameterRow;
import com.scorebot.engine.model.TuningParameter;
import com.scorebot.engine.model.TuningParameters;
import com.scorebot.engine.tuning.ParameterCatalog;
import com.scorebot.engine.tuning.ParameterStore;
import org.apache.ibatis.session.SqlSession;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * PostgreSQL-backed {@link ParameterStore}. The UNIQUE(effective_date, name) constraint is the only
 * serialization point between writers.
 */
public final class TuningParameterDao implements ParameterStore {
    static final String UNIQUE_VIOLATION = "23505";

    private final Database database;

    public TuningParameterDao(Database database) {
        this.database = database;
    }

    @Override
    public TuningParameters getCurrent(LocalDate asOfDate) throws SQLException {
        Map<String, Double> resolved = new HashMap<>();
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            for (TuningParameterRow row : session.getMapper(TuningParameterMapper.class).selectCurrent(asOfDate)) {
                resolved.put(row.getName(), row.getValue());
            }
        }
        ParameterCatalog.requireAll(asOfDate, resolved);
        return new TuningParameters(resolved);
    }

    @Override
    public void writeNewVersion(LocalDate date, String name, double value, String description) throws SQLException {
        TuningParameterRow row = TuningParameterRow.builder()
                .effectiveDate(date)
                .name(name)
                .value(value)
                .description(description)
                .createdAt(OffsetDateTime.now(ZoneOffset.UTC))
                .build();
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            try {
                session.getMapper(TuningParameterMapper.class).insert(row);
                conn.commit();
            } catch (RuntimeException e) {
                conn.rollback();
                if (isUniqueViolation(e)) {
                    throw new DuplicateVersionException(date, name);
                }
                throw e;
            }
        }
    }

    @Override
    public List<TuningParameter> history(String name) throws SQLException {
        List<TuningParameter> out = new ArrayList<>();
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            for (TuningParameterRow row : session.getMapper(TuningParameterMapper.class).selectHistory(name)) {
                out.add(new TuningParameter(row.getEffectiveDate(), row.getName(), row.getValue(), row.getDescription()));
            }
        }
        return out;
    }

    @Override
    public boolean isEmpty() throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            return session.getMapper(TuningParameterMapper.class).countAll() == 0L;
        }
    }

    /**
     * MyBatis wraps the driver exception; walk the cause chain for the SQLState.
     */
    static boolean isUniqueViolation(Throwable error) {
        Throwable cursor = error;
        while (cursor != null) {
            if (cursor instanceof SQLException && UNIQUE_VIOLATION.equals(((SQLException) cursor).getSQLState())) {
                return true;
            }
            if (cursor.getCause() == cursor) {
                break;
            }
            cursor = cursor.getCause();
        }
        return false;
    }
}
