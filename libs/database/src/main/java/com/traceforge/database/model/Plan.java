package com.traceforge.database.model;

/**
 * A subscription plan row.
 *
 * @param planId surrogate key
 * @param name unique plan name (e.g., "Free")
 * @param description human readable description
 * @param price price as stored (text, e.g. "99.00")
 * @param duration billing period (e.g. "monthly", "lifetime")
 * @param limits per-metric limits
 * @param active whether the plan can be subscribed to
 */
public record Plan(
        int planId,
        String name,
        String description,
        String price,
        String duration,
        PlanLimits limits,
        boolean active) {}
