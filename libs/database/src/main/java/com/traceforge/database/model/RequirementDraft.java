package com.traceforge.database.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;
import java.util.UUID;

/**
 * Content of a requirement version to be appended. Identity and version number are assigned on
 * insert.
 *
 * @param tenantId owning tenant
 * @param labelId requirement label
 * @param title title, required
 * @param rawText original free text, may be null
 * @param detail structured requirement detail, required
 * @param metaInfo free-form metadata, may be null
 */
public record RequirementDraft(
        UUID tenantId,
        int labelId,
        String title,
        String rawText,
        JsonNode detail,
        JsonNode metaInfo) {

    public RequirementDraft {
        Objects.requireNonNull(tenantId, "tenantId");
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(detail, "detail");
    }
}
