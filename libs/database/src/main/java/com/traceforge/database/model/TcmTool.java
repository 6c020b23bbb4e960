package com.traceforge.database.model;

import java.util.Optional;

/**
 * External test case management tools an integration, mapping or section can refer to.
 * <p>
 * Values are lower case in every column that stores them ({@code tcm_integrations.integrator_type},
 * {@code tcm_testcase_mappings.tcm_tool}, {@code sections.source}).
 */
public enum TcmTool {

    TESTRAIL("testrail"),
    ZEPHYR("zephyr"),
    XRAY("xray");

    private final String value;

    TcmTool(String value) {
        this.value = value;
    }

    /** The value stored in the database column. */
    public String value() {
        return value;
    }

    /** The section origin tag that sections imported from this tool carry. */
    public SectionSource sectionSource() {
        return switch (this) {
            case TESTRAIL -> SectionSource.TESTRAIL;
            case ZEPHYR -> SectionSource.ZEPHYR;
            case XRAY -> SectionSource.XRAY;
        };
    }

    public static Optional<TcmTool> fromString(String value) {
        for (TcmTool tool : values()) {
            if (tool.value.equals(value)) {
                return Optional.of(tool);
            }
        }
        return Optional.empty();
    }
}
