package com.traceforge.database.repository;

import com.traceforge.database.json.JsonColumns;
import com.traceforge.database.model.Plan;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

/** Read access to subscription plans. */
public class PlanRepository {

    private static final String COLUMNS =
            "plan_id, name, description, price, duration, limits, is_active";

    private static final RowMapper<Plan> ROW_MAPPER = (rs, rowNum) -> new Plan(
            rs.getInt("plan_id"),
            rs.getString("name"),
            rs.getString("description"),
            rs.getString("price"),
            rs.getString("duration"),
            JsonColumns.readLimits(rs.getString("limits")),
            rs.getBoolean("is_active"));

    private final JdbcTemplate jdbcTemplate;

    public PlanRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<Plan> findByName(String name) {
        return jdbcTemplate
                .query("SELECT " + COLUMNS + " FROM plans WHERE name = ?", ROW_MAPPER, name)
                .stream()
                .findFirst();
    }

    public List<Plan> findAll() {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM plans ORDER BY plan_id", ROW_MAPPER);
    }
}
