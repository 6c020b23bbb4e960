package com.traceforge.database.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.UUID;

/**
 * One immutable version of a requirement. {@code (requirementId, version)} is unique.
 */
public record Requirement(
        long rowId,
        UUID requirementId,
        int version,
        UUID tenantId,
        int labelId,
        String title,
        String rawText,
        JsonNode detail,
        GenerationStatus generationStatus,
        JsonNode metaInfo,
        Instant createdAt,
        Instant updatedAt) {}
