package com.traceforge.database.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Traceability link between one requirement version and one testcase version.
 *
 * @param id surrogate key
 * @param requirementId logical requirement id
 * @param requirementVersion linked requirement version
 * @param testcaseId logical testcase id
 * @param testcaseVersion linked testcase version
 * @param linkedAtVersion requirement version that was current when the link was recorded
 * @param createdAt when the link was recorded
 */
public record RequirementTestcaseLink(
        int id,
        UUID requirementId,
        int requirementVersion,
        UUID testcaseId,
        int testcaseVersion,
        int linkedAtVersion,
        Instant createdAt) {}
