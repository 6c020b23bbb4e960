package com.traceforge.database.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link PlanLimits}.
 *
 * <p>WHY: Usage checks rely on the {@code -1} sentinel and on missing metrics meaning "not allowed".
 * Getting either wrong silently lifts or blocks a quota.
 */
@DisplayName("PlanLimits")
class PlanLimitsTest {

    @Test
    @DisplayName("usage below the limit is allowed, at the limit it is not")
    void boundedLimit() {
        PlanLimits free = PlanLimits.of(5, 50, 1000);

        assertThat(free.allows(UsageMetric.UPLOADS, 4)).isTrue();
        assertThat(free.allows(UsageMetric.UPLOADS, 5)).isFalse();
        assertThat(free.isUnlimited(UsageMetric.UPLOADS)).isFalse();
    }

    @Test
    @DisplayName("-1 means unlimited")
    void unlimited() {
        PlanLimits unlimited = PlanLimits.of(-1, -1, -1);

        assertThat(unlimited.isUnlimited(UsageMetric.API_CALLS)).isTrue();
        assertThat(unlimited.allows(UsageMetric.API_CALLS, Integer.MAX_VALUE)).isTrue();
    }

    @Test
    @DisplayName("metrics the plan does not mention are not allowed")
    void missingMetric() {
        PlanLimits limits = new PlanLimits(Map.of(UsageMetric.UPLOADS, 10));

        assertThat(limits.limitFor(UsageMetric.TESTCASES)).isEmpty();
        assertThat(limits.allows(UsageMetric.TESTCASES, 0)).isFalse();
    }

    @Test
    @DisplayName("equality ignores the map implementation")
    void equality() {
        assertThat(new PlanLimits(Map.of(UsageMetric.UPLOADS, 5, UsageMetric.TESTCASES, 50, UsageMetric.API_CALLS, 1000)))
                .isEqualTo(PlanLimits.of(5, 50, 1000));
    }
}
