package com.traceforge.database.model;

import java.util.List;
import java.util.UUID;

/**
 * Identifiers of the rows every initialized database contains.
 * <p>
 * The rows themselves are inserted by the repeatable seed migrations under
 * {@code db/seed/reference} with insert-if-absent semantics.
 */
public final class DefaultFixtures {

    /** The well-known default tenant (nil UUID). */
    public static final UUID DEFAULT_TENANT_ID = new UUID(0L, 0L);

    public static final String DEFAULT_TENANT_NAME = "Default Tenant";

    public static final String DEFAULT_TENANT_DOMAIN = "default.testcase-platform.com";

    public static final TenantType DEFAULT_TENANT_TYPE = TenantType.ORGANIZATION;

    public static final AccountState DEFAULT_TENANT_STATE = AccountState.ACTIVE;

    public static final String FREE_PLAN = "Free";

    public static final String PRO_PLAN = "Pro";

    public static final String UNLIMITED_PLAN = "Unlimited";

    /** Seeded plan names in seed order. */
    public static final List<String> PLAN_NAMES = List.of(FREE_PLAN, PRO_PLAN, UNLIMITED_PLAN);

    private DefaultFixtures() {
        // constants
    }
}
