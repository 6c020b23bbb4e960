package com.traceforge.database.model;

import java.util.UUID;

/**
 * Named grouping of testcases, unique per (tenant, name).
 *
 * @param sectionId section key
 * @param tenantId owning tenant
 * @param name section name
 * @param source where the section originates
 * @param externalSectionId id of the mirrored folder in the external tool, if any
 * @param externalSuiteId id of the mirrored suite in the external tool, if any
 */
public record Section(
        UUID sectionId,
        UUID tenantId,
        String name,
        SectionSource source,
        String externalSectionId,
        String externalSuiteId) {}
