package com.scorebot.engine.db;

import org.apache.ibatis.exceptions.PersistenceException;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TuningParameterDaoTest {

    @Test
    void isUniqueViolation_shouldFindWrappedSqlState() {
        SQLException unique = new SQLException("duplicate key value violates unique constraint", "23505");

        assertTrue(TuningParameterDao.isUniqueViolation(unique));
        assertTrue(TuningParameterDao.isUniqueViolation(new PersistenceException("insert failed", unique)));
    }

    @Test
    void isUniqueViolation_shouldIgnoreOtherFailures() {
        assertFalse(TuningParameterDao.isUniqueViolation(new SQLException("connection reset", "08006")));
        assertFalse(TuningParameterDao.isUniqueViolation(new IllegalStateException("boom")));
        assertFalse(TuningParameterDao.isUniqueViolation(null));
    }
}
