package com.pathfinder.prereq.repository;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

/** Last raw prerequisite text seen for a course and the JSON of what it parsed to. */
@Repository
public class PrereqSourceJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public PrereqSourceJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void save(String courseId, String source, String rawText, String logicJson) {
        jdbcTemplate.update(
                "MERGE INTO course_prereq_text(course_id, source, raw_text, logic_json, parsed_at) KEY(course_id) VALUES (?,?,?,?,?)",
                courseId, source, rawText, logicJson, java.sql.Timestamp.from(Instant.now()));
    }

    public Optional<PrereqSourceRow> find(String courseId) {
        return jdbcTemplate.query(
                        "SELECT course_id, source, COALESCE(raw_text, ''), COALESCE(logic_json, '{}') FROM course_prereq_text WHERE course_id = ?",
                        (rs, n) -> new PrereqSourceRow(rs.getString(1), rs.getString(2), rs.getString(3), rs.getString(4)),
                        courseId)
                .stream().findFirst();
    }

    public record PrereqSourceRow(String courseId, String source, String rawText, String logicJson) {}
}
