package com.traceforge.database.repository;

import com.traceforge.database.json.JsonColumns;
import com.traceforge.database.model.SyncStatus;
import com.traceforge.database.model.Testcase;
import com.traceforge.database.model.TestcaseDraft;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

/**
 * Append-only access to testcase history and its provenance chain.
 * <p>
 * New content is always a new version row. {@code derived_from_row_id} links a row to the row it
 * was generated from; following it only ever reads, never cascades.
 */
public class TestcaseHistoryRepository {

    private static final String COLUMNS =
            "row_id, testcase_id, version, requirement_id, title, steps, expected_result, status,"
                    + " sync_status, priority, derived_from_row_id, meta_info, created_at, updated_at";

    private static final String APPEND_SQL = """
            INSERT INTO testcases
                (testcase_id, version, requirement_id, title, steps, expected_result, status,
                 sync_status, priority, derived_from_row_id, meta_info)
            VALUES (?, (SELECT COALESCE(MAX(version), 0) + 1 FROM testcases WHERE testcase_id = ?),
                    ?, ?, ?::json, ?, ?, ?, ?, ?, ?::json)
            RETURNING\s""" + COLUMNS;

    private static final RowMapper<Testcase> ROW_MAPPER = (rs, rowNum) -> new Testcase(
            rs.getLong("row_id"),
            ResultSets.uuid(rs, "testcase_id"),
            rs.getInt("version"),
            ResultSets.uuid(rs, "requirement_id"),
            rs.getString("title"),
            JsonColumns.read(rs.getString("steps")),
            rs.getString("expected_result"),
            rs.getString("status"),
            SyncStatus.fromString(rs.getString("sync_status")).orElse(SyncStatus.NEW),
            rs.getString("priority"),
            ResultSets.nullableLong(rs, "derived_from_row_id"),
            JsonColumns.read(rs.getString("meta_info")),
            ResultSets.instant(rs, "created_at"),
            ResultSets.instant(rs, "updated_at"));

    private final JdbcTemplate jdbcTemplate;

    public TestcaseHistoryRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /** Creates a new testcase with a fresh id at version 1, not yet known to any TCM tool. */
    public Testcase create(TestcaseDraft draft) {
        return insert(UUID.randomUUID(), draft, null, SyncStatus.NEW);
    }

    /**
     * Appends the next version of an existing testcase. The new row is derived from the previous
     * latest row; once a testcase has been pushed to a TCM tool, new versions start as
     * {@link SyncStatus#UPDATED}.
     *
     * @throws IllegalArgumentException if the testcase does not exist
     * @throws VersionConflictException if a concurrent append claimed the same version
     */
    public Testcase appendVersion(UUID testcaseId, TestcaseDraft draft) {
        Testcase latest = findLatest(testcaseId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown testcase: " + testcaseId));
        SyncStatus syncStatus = latest.syncStatus() == SyncStatus.NEW ? SyncStatus.NEW : SyncStatus.UPDATED;
        return insert(testcaseId, draft, latest.rowId(), syncStatus);
    }

    /** Creates a new testcase (fresh id, version 1) generated from an existing row. */
    public Testcase derive(long parentRowId, TestcaseDraft draft) {
        if (findByRowId(parentRowId).isEmpty()) {
            throw new IllegalArgumentException("Unknown testcase row: " + parentRowId);
        }
        return insert(UUID.randomUUID(), draft, parentRowId, SyncStatus.NEW);
    }

    public Optional<Testcase> findByRowId(long rowId) {
        return jdbcTemplate
                .query("SELECT " + COLUMNS + " FROM testcases WHERE row_id = ?", ROW_MAPPER, rowId)
                .stream()
                .findFirst();
    }

    public Optional<Testcase> findVersion(UUID testcaseId, int version) {
        return jdbcTemplate
                .query("SELECT " + COLUMNS + " FROM testcases WHERE testcase_id = ? AND version = ?",
                        ROW_MAPPER, testcaseId, version)
                .stream()
                .findFirst();
    }

    public Optional<Testcase> findLatest(UUID testcaseId) {
        return jdbcTemplate
                .query("SELECT " + COLUMNS + " FROM testcases WHERE testcase_id = ?"
                                + " ORDER BY version DESC LIMIT 1",
                        ROW_MAPPER, testcaseId)
                .stream()
                .findFirst();
    }

    public List<Testcase> findHistory(UUID testcaseId) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM testcases WHERE testcase_id = ? ORDER BY version",
                ROW_MAPPER, testcaseId);
    }

    /** Latest version of every testcase generated for a requirement. */
    public List<Testcase> findLatestForRequirement(UUID requirementId) {
        return jdbcTemplate.query(
                "SELECT DISTINCT ON (testcase_id) " + COLUMNS + " FROM testcases"
                        + " WHERE requirement_id = ? ORDER BY testcase_id, version DESC",
                ROW_MAPPER, requirementId);
    }

    /** The row a testcase was derived from, one step up the provenance chain. */
    public Optional<Testcase> findParent(Testcase testcase) {
        return testcase.parentRowId().flatMap(this::findByRowId);
    }

    /** The provenance chain from {@code testcase} up to its root, starting with itself. */
    public List<Testcase> lineage(Testcase testcase) {
        List<Testcase> chain = new ArrayList<>();
        Set<Long> seen = new HashSet<>();
        Optional<Testcase> current = Optional.of(testcase);
        while (current.isPresent() && seen.add(current.get().rowId())) {
            chain.add(current.get());
            current = findParent(current.get());
        }
        return chain;
    }

    /**
     * Marks the latest version as synchronized with the external tools.
     *
     * @return true if a row was updated
     */
    public boolean markSynched(UUID testcaseId) {
        return jdbcTemplate.update(
                        "UPDATE testcases SET sync_status = ? WHERE testcase_id = ?"
                                + " AND version = (SELECT MAX(version) FROM testcases WHERE testcase_id = ?)",
                        SyncStatus.SYNCHED.value(), testcaseId, testcaseId)
                > 0;
    }

    private Testcase insert(UUID testcaseId, TestcaseDraft draft, Long derivedFrom, SyncStatus syncStatus) {
        try {
            return jdbcTemplate.queryForObject(
                    APPEND_SQL,
                    ROW_MAPPER,
                    testcaseId,
                    testcaseId,
                    draft.requirementId(),
                    draft.title(),
                    JsonColumns.write(draft.steps()),
                    draft.expectedResult(),
                    draft.status(),
                    syncStatus.value(),
                    draft.priority(),
                    derivedFrom,
                    JsonColumns.write(draft.metaInfo()));
        } catch (DuplicateKeyException e) {
            throw new VersionConflictException(testcaseId, "Concurrent append to testcase " + testcaseId, e);
        }
    }
}
