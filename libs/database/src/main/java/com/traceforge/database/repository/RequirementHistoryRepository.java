package com.traceforge.database.repository;

import com.traceforge.database.json.JsonColumns;
import com.traceforge.database.model.GenerationStatus;
import com.traceforge.database.model.Requirement;
import com.traceforge.database.model.RequirementDraft;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

/**
 * Append-only access to requirement history.
 * <p>
 * Editing a requirement appends a new version row; content of existing versions is never
 * rewritten. The only mutable column is the generation status of the latest version, which tracks
 * downstream work rather than requirement content.
 */
public class RequirementHistoryRepository {

    private static final Logger log = LoggerFactory.getLogger(RequirementHistoryRepository.class);

    private static final String COLUMNS =
            "row_id, requirement_id, version, tenant_id, label_id, title, raw_text,"
                    + " requirement_detail, testcase_generation_status, meta_info, created_at,"
                    + " updated_at";

    private static final String APPEND_SQL = """
            INSERT INTO requirements
                (requirement_id, version, tenant_id, label_id, title, raw_text,
                 requirement_detail, meta_info)
            VALUES (?, (SELECT COALESCE(MAX(version), 0) + 1 FROM requirements WHERE requirement_id = ?),
                    ?, ?, ?, ?, ?::json, ?::json)
            RETURNING\s""" + COLUMNS;

    private static final RowMapper<Requirement> ROW_MAPPER = (rs, rowNum) -> new Requirement(
            rs.getLong("row_id"),
            ResultSets.uuid(rs, "requirement_id"),
            rs.getInt("version"),
            ResultSets.uuid(rs, "tenant_id"),
            rs.getInt("label_id"),
            rs.getString("title"),
            rs.getString("raw_text"),
            JsonColumns.read(rs.getString("requirement_detail")),
            GenerationStatus.fromString(rs.getString("testcase_generation_status"))
                    .orElse(GenerationStatus.NOT_STARTED),
            JsonColumns.read(rs.getString("meta_info")),
            ResultSets.instant(rs, "created_at"),
            ResultSets.instant(rs, "updated_at"));

    private final JdbcTemplate jdbcTemplate;

    public RequirementHistoryRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /** Creates a new requirement with a fresh id at version 1. */
    public Requirement create(RequirementDraft draft) {
        return appendVersion(UUID.randomUUID(), draft);
    }

    /**
     * Appends the next version of a requirement: one more than the highest existing version, or 1
     * if the id is new.
     *
     * @throws VersionConflictException if a concurrent append claimed the same version
     */
    public Requirement appendVersion(UUID requirementId, RequirementDraft draft) {
        try {
            Requirement appended = jdbcTemplate.queryForObject(
                    APPEND_SQL,
                    ROW_MAPPER,
                    requirementId,
                    requirementId,
                    draft.tenantId(),
                    draft.labelId(),
                    draft.title(),
                    draft.rawText(),
                    JsonColumns.write(draft.detail()),
                    JsonColumns.write(draft.metaInfo()));
            log.debug("Appended requirement {} version {}", requirementId, appended.version());
            return appended;
        } catch (DuplicateKeyException e) {
            throw new VersionConflictException(
                    requirementId, "Concurrent append to requirement " + requirementId, e);
        }
    }

    public Optional<Requirement> findVersion(UUID requirementId, int version) {
        return jdbcTemplate
                .query("SELECT " + COLUMNS + " FROM requirements WHERE requirement_id = ? AND version = ?",
                        ROW_MAPPER, requirementId, version)
                .stream()
                .findFirst();
    }

    public Optional<Requirement> findLatest(UUID requirementId) {
        return jdbcTemplate
                .query("SELECT " + COLUMNS + " FROM requirements WHERE requirement_id = ?"
                                + " ORDER BY version DESC LIMIT 1",
                        ROW_MAPPER, requirementId)
                .stream()
                .findFirst();
    }

    /** All versions, oldest first. */
    public List<Requirement> findHistory(UUID requirementId) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM requirements WHERE requirement_id = ? ORDER BY version",
                ROW_MAPPER, requirementId);
    }

    /**
     * Moves the generation status of the latest version along its lifecycle.
     *
     * @throws IllegalArgumentException if the requirement does not exist
     * @throws IllegalStateException if the transition is not allowed
     * @throws VersionConflictException if the latest version changed concurrently
     */
    public Requirement markGenerationStatus(UUID requirementId, GenerationStatus next) {
        Requirement latest = findLatest(requirementId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown requirement: " + requirementId));
        latest.generationStatus().transitionTo(next);

        int updated = jdbcTemplate.update(
                "UPDATE requirements SET testcase_generation_status = ?"
                        + " WHERE row_id = ? AND testcase_generation_status = ?"
                        + " AND version = (SELECT MAX(version) FROM requirements WHERE requirement_id = ?)",
                next.value(), latest.rowId(), latest.generationStatus().value(), requirementId);
        if (updated == 0) {
            throw new VersionConflictException(
                    requirementId,
                    "Requirement %s changed while updating generation status".formatted(requirementId),
                    null);
        }
        return findVersion(requirementId, latest.version()).orElseThrow();
    }
}
