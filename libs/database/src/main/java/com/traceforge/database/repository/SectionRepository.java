package com.traceforge.database.repository;

import com.traceforge.database.model.Section;
import com.traceforge.database.model.SectionSource;
import com.traceforge.database.model.TcmTool;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

/** Sections and the version-stamped links from testcases into them. */
public class SectionRepository {

    private static final String COLUMNS =
            "s.section_id, s.tenant_id, s.section_name, s.source, s.external_section_id,"
                    + " s.external_suite_id";

    static final RowMapper<Section> ROW_MAPPER = (rs, rowNum) -> new Section(
            ResultSets.uuid(rs, "section_id"),
            ResultSets.uuid(rs, "tenant_id"),
            rs.getString("section_name"),
            SectionSource.fromString(rs.getString("source")).orElse(SectionSource.INTERNAL),
            rs.getString("external_section_id"),
            rs.getString("external_suite_id"));

    private final JdbcTemplate jdbcTemplate;

    public SectionRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Section create(UUID tenantId, String name, SectionSource source) {
        return create(tenantId, name, source, null, null);
    }

    /** Creates a section; names are unique per tenant. */
    public Section create(
            UUID tenantId,
            String name,
            SectionSource source,
            String externalSectionId,
            String externalSuiteId) {
        return jdbcTemplate.queryForObject(
                "INSERT INTO sections AS s (tenant_id, section_name, source, external_section_id,"
                        + " external_suite_id) VALUES (?, ?, ?, ?, ?) RETURNING " + COLUMNS,
                ROW_MAPPER,
                tenantId, name, source.value(), externalSectionId, externalSuiteId);
    }

    /** Creates a section mirroring a folder or suite of an external tool. */
    public Section importSection(
            UUID tenantId, String name, TcmTool tool, String externalSectionId, String externalSuiteId) {
        return create(tenantId, name, tool.sectionSource(), externalSectionId, externalSuiteId);
    }

    public Optional<Section> findByName(UUID tenantId, String name) {
        return jdbcTemplate
                .query("SELECT " + COLUMNS + " FROM sections s WHERE s.tenant_id = ? AND s.section_name = ?",
                        ROW_MAPPER, tenantId, name)
                .stream()
                .findFirst();
    }

    /**
     * Links a testcase version into a section. The (testcase id, version) pair must exist.
     *
     * @return the generated link id
     */
    public int linkTestcase(UUID sectionId, UUID testcaseId, int testcaseVersion) {
        Integer mapId = jdbcTemplate.queryForObject(
                "INSERT INTO testcase_section_map (testcase_id, section_id, linked_at_version)"
                        + " VALUES (?, ?, ?) RETURNING map_id",
                Integer.class,
                testcaseId, sectionId, testcaseVersion);
        return mapId;
    }

    public boolean unlinkTestcase(UUID sectionId, UUID testcaseId) {
        return jdbcTemplate.update(
                        "DELETE FROM testcase_section_map WHERE section_id = ? AND testcase_id = ?",
                        sectionId, testcaseId)
                > 0;
    }

    /** Sections a testcase is linked into, by name. */
    public List<Section> findSectionsOfTestcase(UUID testcaseId) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM sections s"
                        + " JOIN testcase_section_map m ON m.section_id = s.section_id"
                        + " WHERE m.testcase_id = ? ORDER BY s.section_name",
                ROW_MAPPER, testcaseId);
    }

    /**
     * Sections of a testcase whose links are removed when its mapping to {@code tool} is deleted.
     */
    public List<Section> findSectionsOwnedBy(UUID testcaseId, TcmTool tool) {
        return findSectionsOfTestcase(testcaseId).stream()
                .filter(section -> section.source().isOwnedBy(tool))
                .toList();
    }
}
