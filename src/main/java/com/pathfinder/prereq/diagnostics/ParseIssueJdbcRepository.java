package com.pathfinder.prereq.diagnostics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

@Repository
public class ParseIssueJdbcRepository implements ParseDiagnosticsSink {
    private static final Logger log = LoggerFactory.getLogger(ParseIssueJdbcRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public ParseIssueJdbcRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public void record(ParseDiagnostic d) {
        log.info("course={} issue={} confidence={}", d.courseId(), d.issue().code(), d.confidence());
        try {
            jdbcTemplate.update(
                    "INSERT INTO prereq_parse_issue(course_id, department, issue, confidence, raw_excerpt, current_groups, new_groups, constraint_notes, error, created_at) VALUES (?,?,?,?,?,?,?,?,?,?)",
                    d.courseId(), d.department(), d.issue().code(), d.confidence(),
                    ParseDiagnostic.excerpt(d.rawExcerpt()),
                    json(d.currentGroups()), json(d.newGroups()), json(d.constraints()),
                    d.error(), Timestamp.from(Instant.now()));
        } catch (DataAccessException | JsonProcessingException e) {
            log.warn("Could not record parse issue for {}: {}", d.courseId(), e.getMessage());
        }
    }

    public List<IssueRow> findByCourse(String courseId) {
        return jdbcTemplate.query(
                "SELECT course_id, issue, confidence, raw_excerpt, new_groups FROM prereq_parse_issue WHERE course_id = ? ORDER BY id",
                (rs, n) -> new IssueRow(rs.getString(1), rs.getString(2), rs.getObject(3, Double.class), rs.getString(4), rs.getString(5)),
                courseId);
    }

    private String json(Object value) throws JsonProcessingException {
        return value == null ? null : objectMapper.writeValueAsString(value);
    }

    public record IssueRow(String courseId, String issue, Double confidence, String rawExcerpt, String newGroupsJson) {}
}
