package com.traceforge.database.repository;

import com.traceforge.database.model.Plan;
import com.traceforge.database.model.PlanLimits;
import com.traceforge.database.model.SubscriptionStatus;
import com.traceforge.database.model.UsageMetric;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Tenant subscriptions and their metered usage counters.
 * <p>
 * A tenant holds at most one subscription. Subscribing copies the plan's limits into one
 * {@code usage} row per metric; consumption is checked against that copy, not the live plan.
 */
public class SubscriptionRepository {

    /** Length of one usage period. */
    static final Duration USAGE_PERIOD = Duration.ofDays(30);

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public SubscriptionRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate =
                new TransactionTemplate(new DataSourceTransactionManager(jdbcTemplate.getDataSource()));
    }

    /**
     * Subscribes a tenant to a plan and opens a usage counter for every metric the plan limits.
     *
     * @return the subscription id
     * @throws org.springframework.dao.DataIntegrityViolationException if the tenant already holds
     *     a subscription
     */
    public int subscribe(UUID tenantId, Plan plan, Instant startDate) {
        return transactionTemplate.execute(tx -> {
            Integer subscriptionId = jdbcTemplate.queryForObject(
                    "INSERT INTO subscriptions (tenant_id, plan_id, status, start_date)"
                            + " VALUES (?, ?, ?, ?) RETURNING subscription_id",
                    Integer.class,
                    tenantId, plan.planId(), SubscriptionStatus.ACTIVE.value(), Timestamp.from(startDate));
            Timestamp resetDate = Timestamp.from(startDate.plus(USAGE_PERIOD));
            for (Map.Entry<UsageMetric, Integer> limit : plan.limits().limits().entrySet()) {
                jdbcTemplate.update(
                        "INSERT INTO usage (subscription_id, metric, used, \"limit\", reset_date)"
                                + " VALUES (?, ?, 0, ?, ?)",
                        subscriptionId, limit.getKey().value(), limit.getValue(), resetDate);
            }
            return subscriptionId;
        });
    }

    public Optional<SubscriptionStatus> findStatus(int subscriptionId) {
        return jdbcTemplate
                .queryForList("SELECT status FROM subscriptions WHERE subscription_id = ?",
                        String.class, subscriptionId)
                .stream()
                .findFirst()
                .flatMap(SubscriptionStatus::fromString);
    }

    public boolean changeStatus(int subscriptionId, SubscriptionStatus status) {
        return jdbcTemplate.update(
                        "UPDATE subscriptions SET status = ? WHERE subscription_id = ?",
                        status.value(), subscriptionId)
                > 0;
    }

    /** Units of {@code metric} consumed in the current period, or empty if not metered. */
    public Optional<Integer> used(int subscriptionId, UsageMetric metric) {
        return jdbcTemplate
                .queryForList("SELECT used FROM usage WHERE subscription_id = ? AND metric = ?",
                        Integer.class, subscriptionId, metric.value())
                .stream()
                .findFirst();
    }

    /**
     * Consumes one unit of {@code metric}. Only {@link SubscriptionStatus#ACTIVE} subscriptions
     * with remaining allowance may consume; the usage row is locked for the check.
     *
     * @return true if the unit was consumed
     */
    public boolean consume(int subscriptionId, UsageMetric metric) {
        Boolean consumed = transactionTemplate.execute(tx -> {
            List<Map<String, Object>> rows = jdbcTemplate.queryForList(
                    "SELECT s.status, u.used, u.\"limit\" FROM usage u"
                            + " JOIN subscriptions s ON s.subscription_id = u.subscription_id"
                            + " WHERE u.subscription_id = ? AND u.metric = ? FOR UPDATE OF u",
                    subscriptionId, metric.value());
            if (rows.isEmpty()) {
                return false;
            }
            Map<String, Object> row = rows.get(0);
            boolean active = SubscriptionStatus.fromString((String) row.get("status"))
                    .map(SubscriptionStatus.ACTIVE::equals)
                    .orElse(false);
            PlanLimits limits = new PlanLimits(Map.of(metric, ((Number) row.get("limit")).intValue()));
            if (!active || !limits.allows(metric, ((Number) row.get("used")).intValue())) {
                return false;
            }
            jdbcTemplate.update(
                    "UPDATE usage SET used = used + 1 WHERE subscription_id = ? AND metric = ?",
                    subscriptionId, metric.value());
            return true;
        });
        return Boolean.TRUE.equals(consumed);
    }
}
