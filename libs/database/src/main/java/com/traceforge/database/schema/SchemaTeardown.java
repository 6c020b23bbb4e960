package com.traceforge.database.schema;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Drops every known table so the following build starts from an empty schema.
 * <p>
 * Statements run one at a time in auto-commit mode. The first failure aborts the teardown.
 */
public class SchemaTeardown {

    private static final Logger log = LoggerFactory.getLogger(SchemaTeardown.class);

    private final JdbcTemplate jdbcTemplate;

    public SchemaTeardown(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Drops all tables listed by {@link SchemaCatalog#teardownTables()}.
     *
     * @return number of drop statements executed
     * @throws SchemaStatementException on the first statement that fails
     */
    public int dropAll() {
        log.info("Dropping existing tables...");
        int executed = 0;
        for (String table : SchemaCatalog.teardownTables()) {
            String sql = SchemaCatalog.dropStatement(table);
            try {
                jdbcTemplate.execute(sql);
            } catch (DataAccessException e) {
                log.error("Failed to execute SQL: {}", e.getMostSpecificCause().getMessage());
                log.error("SQL: {}", sql);
                throw new SchemaStatementException(sql, e);
            }
            executed++;
            log.info("Dropped table {}", table);
        }
        log.info("Dropped {} tables", executed);
        return executed;
    }
}
