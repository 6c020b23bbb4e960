package com.traceforge.database.repository;

import com.traceforge.database.model.MatrixStatus;
import com.traceforge.database.model.RequirementTestcaseLink;
import com.traceforge.database.model.Section;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

/**
 * Traceability links between requirement versions and testcase versions.
 * <p>
 * Each link is stamped with the requirement version that was current when it was recorded, so the
 * link table doubles as versioned evidence of traceability.
 */
public class TraceabilityLinkRepository {

    private static final String COLUMNS =
            "id, requirement_id, requirement_version, testcase_id, testcase_version,"
                    + " linked_at_version, created_at";

    private static final RowMapper<RequirementTestcaseLink> ROW_MAPPER =
            (rs, rowNum) -> new RequirementTestcaseLink(
                    rs.getInt("id"),
                    ResultSets.uuid(rs, "requirement_id"),
                    rs.getInt("requirement_version"),
                    ResultSets.uuid(rs, "testcase_id"),
                    rs.getInt("testcase_version"),
                    rs.getInt("linked_at_version"),
                    ResultSets.instant(rs, "created_at"));

    private final JdbcTemplate jdbcTemplate;

    public TraceabilityLinkRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Records that a testcase version verifies a requirement version.
     *
     * @throws IllegalArgumentException if the requirement has no versions
     * @throws org.springframework.dao.DataIntegrityViolationException if either version does not
     *     exist or the link is already recorded
     */
    public RequirementTestcaseLink link(
            UUID requirementId, int requirementVersion, UUID testcaseId, int testcaseVersion) {
        Integer current = jdbcTemplate.queryForObject(
                "SELECT MAX(version) FROM requirements WHERE requirement_id = ?",
                Integer.class, requirementId);
        if (current == null) {
            throw new IllegalArgumentException("Unknown requirement: " + requirementId);
        }
        return jdbcTemplate.queryForObject(
                "INSERT INTO requirement_testcase_map (requirement_id, requirement_version,"
                        + " testcase_id, testcase_version, linked_at_version)"
                        + " VALUES (?, ?, ?, ?, ?) RETURNING " + COLUMNS,
                ROW_MAPPER,
                requirementId, requirementVersion, testcaseId, testcaseVersion, current);
    }

    public List<RequirementTestcaseLink> findByRequirement(UUID requirementId) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM requirement_testcase_map WHERE requirement_id = ?"
                        + " ORDER BY requirement_version, testcase_id, testcase_version",
                ROW_MAPPER, requirementId);
    }

    public List<RequirementTestcaseLink> findByTestcase(UUID testcaseId) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM requirement_testcase_map WHERE testcase_id = ?"
                        + " ORDER BY testcase_version",
                ROW_MAPPER, testcaseId);
    }

    /** Sections touched by the testcases linked to a requirement, via {@code requirement_sections_v}. */
    public List<Section> findSectionsForRequirement(UUID requirementId) {
        return jdbcTemplate.query(
                "SELECT s.section_id, s.tenant_id, s.section_name, s.source,"
                        + " s.external_section_id, s.external_suite_id"
                        + " FROM requirement_sections_v v JOIN sections s ON s.section_id = v.section_id"
                        + " WHERE v.requirement_id = ? ORDER BY s.section_name",
                SectionRepository.ROW_MAPPER, requirementId);
    }

    /** Version of the requirement that was current when the given link was recorded. */
    public int linkedAtVersion(int linkId) {
        try {
            Integer version = jdbcTemplate.queryForObject(
                    "SELECT linked_at_version FROM requirement_testcase_map WHERE id = ?",
                    Integer.class, linkId);
            return version;
        } catch (EmptyResultDataAccessException e) {
            throw new IllegalArgumentException("Unknown link: " + linkId, e);
        }
    }

    /** Records the matrix status of one requirement version, replacing any earlier status. */
    public void recordMatrixStatus(UUID requirementId, int version, MatrixStatus status) {
        jdbcTemplate.update(
                "INSERT INTO traceability_matrix (requirement_id, version, status) VALUES (?, ?, ?)"
                        + " ON CONFLICT (requirement_id, version) DO UPDATE SET status = EXCLUDED.status",
                requirementId, version, status.value());
    }

    public Optional<MatrixStatus> findMatrixStatus(UUID requirementId, int version) {
        return jdbcTemplate
                .queryForList(
                        "SELECT status FROM traceability_matrix WHERE requirement_id = ? AND version = ?",
                        String.class, requirementId, version)
                .stream()
                .findFirst()
                .flatMap(MatrixStatus::fromString);
    }
}
