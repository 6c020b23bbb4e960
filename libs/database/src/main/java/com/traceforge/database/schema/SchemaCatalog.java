package com.traceforge.database.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Names of the objects the traceability schema consists of.
 * <p>
 * The DDL itself lives in the Flyway migrations under {@code db/migration/traceforge}; this class
 * lists what teardown must drop and what the build is expected to produce.
 */
public final class SchemaCatalog {

    /** Flyway migration location of the schema build. */
    public static final String MIGRATION_LOCATION = "classpath:db/migration/traceforge";

    /** Flyway location of the repeatable seed fixtures. */
    public static final String SEED_LOCATION = "classpath:db/seed/reference";

    /** Flyway's bookkeeping table; dropped with the rest so every run rebuilds from scratch. */
    public static final String SCHEMA_HISTORY_TABLE = "flyway_schema_history";

    /** Every table of the schema in creation (dependency) order, leaves first. */
    public static final List<String> TABLES = List.of(
            "tenants",
            "requirement_labels",
            "users",
            "tcm_integrations",
            "requirements",
            "tcm_credentials",
            "testcases",
            "sections",
            "tcm_testcase_mappings",
            "testrail_projects",
            "testrail_suites",
            "zephyr_projects",
            "xray_projects",
            "testcase_section_map",
            "requirement_testcase_map",
            "traceability_matrix",
            "plans",
            "subscriptions",
            "usage");

    /** Tables whose {@code updated_at} is stamped by {@code update_updated_at_column()}. */
    public static final List<String> AUDITED_TABLES = List.of(
            "requirement_labels",
            "requirements",
            "testcases",
            "tenants",
            "users",
            "tcm_integrations",
            "tcm_credentials",
            "traceability_matrix",
            "plans",
            "subscriptions",
            "usage");

    public static final String REQUIREMENT_SECTIONS_VIEW = "requirement_sections_v";

    public static final String TCM_MAPPING_DELETE_TRIGGER = "trg_cascade_tcm_mapping_delete";

    private SchemaCatalog() {
        // constants
    }

    /** Name of the {@code updated_at} trigger installed on an audited table. */
    public static String auditTriggerName(String table) {
        return "update_" + table + "_updated_at";
    }

    /**
     * Tables teardown drops: all schema tables in reverse creation order, then the schema history
     * table. Cascade semantics make the order irrelevant for correctness.
     */
    public static List<String> teardownTables() {
        List<String> tables = new ArrayList<>(TABLES);
        Collections.reverse(tables);
        tables.add(SCHEMA_HISTORY_TABLE);
        return List.copyOf(tables);
    }

    /** Drop statement for one table; tolerates a missing table and cascades to dependents. */
    public static String dropStatement(String table) {
        return "DROP TABLE IF EXISTS " + table + " CASCADE";
    }
}
