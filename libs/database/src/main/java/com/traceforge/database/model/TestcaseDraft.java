package com.traceforge.database.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;
import java.util.UUID;

/**
 * Content of a testcase version to be appended.
 *
 * @param requirementId requirement the testcase verifies
 * @param title title, required
 * @param steps ordered steps as JSON, required
 * @param expectedResult expected outcome, required
 * @param status free-form workflow status, required
 * @param priority priority; defaults to {@value #DEFAULT_PRIORITY} when null
 * @param metaInfo free-form metadata, may be null
 */
public record TestcaseDraft(
        UUID requirementId,
        String title,
        JsonNode steps,
        String expectedResult,
        String status,
        String priority,
        JsonNode metaInfo) {

    public static final String DEFAULT_PRIORITY = "MEDIUM";

    public TestcaseDraft {
        Objects.requireNonNull(requirementId, "requirementId");
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(steps, "steps");
        Objects.requireNonNull(expectedResult, "expectedResult");
        Objects.requireNonNull(status, "status");
        if (priority == null || priority.isBlank()) {
            priority = DEFAULT_PRIORITY;
        }
    }
}
