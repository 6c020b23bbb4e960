package com.traceforge.database.repository;

import com.traceforge.database.model.SyncDirection;
import com.traceforge.database.model.TcmTestcaseMapping;
import com.traceforge.database.model.TcmTool;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

/**
 * Mappings from internal testcases to their ids in external TCM tools.
 * <p>
 * Deleting a mapping fires {@code trg_cascade_tcm_mapping_delete}, which removes the testcase's
 * links into sections imported from the same tool.
 */
public class TcmMappingRepository {

    private static final String COLUMNS =
            "mapping_id, testcase_id, tcm_tool, external_testcase_id, sync_direction, last_synced_at";

    private static final RowMapper<TcmTestcaseMapping> ROW_MAPPER =
            (rs, rowNum) -> new TcmTestcaseMapping(
                    rs.getInt("mapping_id"),
                    ResultSets.uuid(rs, "testcase_id"),
                    TcmTool.fromString(rs.getString("tcm_tool")).orElseThrow(),
                    rs.getString("external_testcase_id"),
                    SyncDirection.fromString(rs.getString("sync_direction"))
                            .orElse(SyncDirection.BIDIRECTIONAL),
                    ResultSets.instant(rs, "last_synced_at"));

    private final JdbcTemplate jdbcTemplate;

    public TcmMappingRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /** Maps a testcase to its external id; one mapping per (testcase, tool). */
    public TcmTestcaseMapping map(
            UUID testcaseId, TcmTool tool, String externalTestcaseId, SyncDirection direction) {
        return jdbcTemplate.queryForObject(
                "INSERT INTO tcm_testcase_mappings (testcase_id, tcm_tool, external_testcase_id,"
                        + " sync_direction) VALUES (?, ?, ?, ?) RETURNING " + COLUMNS,
                ROW_MAPPER,
                testcaseId, tool.value(), externalTestcaseId, direction.value());
    }

    public Optional<TcmTestcaseMapping> find(UUID testcaseId, TcmTool tool) {
        return jdbcTemplate
                .query("SELECT " + COLUMNS + " FROM tcm_testcase_mappings WHERE testcase_id = ? AND tcm_tool = ?",
                        ROW_MAPPER, testcaseId, tool.value())
                .stream()
                .findFirst();
    }

    public List<TcmTestcaseMapping> findByTestcase(UUID testcaseId) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM tcm_testcase_mappings WHERE testcase_id = ? ORDER BY tcm_tool",
                ROW_MAPPER, testcaseId);
    }

    /** Stamps {@code last_synced_at} with the current time. */
    public boolean markSynced(int mappingId) {
        return jdbcTemplate.update(
                        "UPDATE tcm_testcase_mappings SET last_synced_at = CURRENT_TIMESTAMP WHERE mapping_id = ?",
                        mappingId)
                > 0;
    }

    /**
     * Removes the mapping for (testcase, tool) together with the testcase's links into that tool's
     * sections.
     *
     * @return true if a mapping existed
     */
    public boolean unmap(UUID testcaseId, TcmTool tool) {
        return jdbcTemplate.update(
                        "DELETE FROM tcm_testcase_mappings WHERE testcase_id = ? AND tcm_tool = ?",
                        testcaseId, tool.value())
                > 0;
    }
}
