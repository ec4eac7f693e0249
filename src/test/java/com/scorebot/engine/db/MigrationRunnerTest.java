package com.scorebot.engine.db;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertTrue;

class MigrationRunnerTest {

    @Test
    void buildStatements_shouldBeIdempotentAndKeyVersions() {
        List<String> statements = MigrationRunner.buildStatements();

        for (String sql : statements) {
            assertTrue(sql.contains("IF NOT EXISTS"), sql);
        }
        assertTrue(statements.stream().anyMatch(s -> s.contains("tuning_parameters") && s.contains("UNIQUE (effective_date, name)")));
        assertTrue(statements.stream().anyMatch(s -> s.contains("decision_evaluations") && s.contains("PRIMARY KEY (run_id, ticker)")));
    }
}
