package com.traceforge.database.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * One immutable version of a testcase. {@code (testcaseId, version)} is unique.
 * <p>
 * {@code derivedFromRowId} points at the row this version was generated from. It is a lookup key
 * only; deleting a row never cascades along it.
 */
public record Testcase(
        long rowId,
        UUID testcaseId,
        int version,
        UUID requirementId,
        String title,
        JsonNode steps,
        String expectedResult,
        String status,
        SyncStatus syncStatus,
        String priority,
        Long derivedFromRowId,
        JsonNode metaInfo,
        Instant createdAt,
        Instant updatedAt) {

    public Optional<Long> parentRowId() {
        return Optional.ofNullable(derivedFromRowId);
    }
}
