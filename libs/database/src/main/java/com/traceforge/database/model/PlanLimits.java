package com.traceforge.database.model;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Numeric limits of a plan, keyed by metric. A limit of {@value #UNLIMITED} means unlimited.
 * <p>
 * Metrics missing from the map are treated as not allowed (limit 0).
 *
 * @param limits limit per metric
 */
public record PlanLimits(Map<UsageMetric, Integer> limits) {

    /** Sentinel limit for an unmetered quantity. */
    public static final int UNLIMITED = -1;

    public PlanLimits {
        limits = limits.isEmpty() ? Map.of() : Map.copyOf(new EnumMap<>(limits));
    }

    public static PlanLimits of(int uploads, int testcases, int apiCalls) {
        return new PlanLimits(Map.of(
                UsageMetric.UPLOADS, uploads,
                UsageMetric.TESTCASES, testcases,
                UsageMetric.API_CALLS, apiCalls));
    }

    /** The configured limit, or empty when the plan does not mention the metric. */
    public Optional<Integer> limitFor(UsageMetric metric) {
        return Optional.ofNullable(limits.get(metric));
    }

    public boolean isUnlimited(UsageMetric metric) {
        return limitFor(metric).map(limit -> limit == UNLIMITED).orElse(false);
    }

    /**
     * Whether one more unit of {@code metric} may be consumed given the current usage.
     *
     * @param metric the metered quantity
     * @param used units already consumed in the current period
     * @return true if unlimited or {@code used} is below the limit
     */
    public boolean allows(UsageMetric metric, int used) {
        if (isUnlimited(metric)) {
            return true;
        }
        return used < limitFor(metric).orElse(0);
    }
}
