package com.traceforge.database.model;

import java.util.Optional;

/**
 * Origin tag of a section. {@link #INTERNAL} sections are created inside the platform; the others
 * mirror a folder or suite of an external TCM tool.
 */
public enum SectionSource {

    INTERNAL("internal"),
    TESTRAIL("testrail"),
    ZEPHYR("zephyr"),
    XRAY("xray");

    private final String value;

    SectionSource(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Whether deleting a TCM mapping for {@code tool} removes links into sections of this origin.
     * Mirrors the {@code cascade_delete_section_links_for_tcm} trigger.
     */
    public boolean isOwnedBy(TcmTool tool) {
        return this != INTERNAL && value.equals(tool.value());
    }

    public static Optional<SectionSource> fromString(String value) {
        for (SectionSource source : values()) {
            if (source.value.equals(value)) {
                return Optional.of(source);
            }
        }
        return Optional.empty();
    }
}
