package com.pathfinder.prereq.repository;

import com.pathfinder.prereq.domain.DomainModels.Course;
import com.pathfinder.prereq.domain.DomainModels.StoredRelationship;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.*;

@Repository
public class PrerequisiteJdbcRepository implements PrerequisiteStore {
    private static final String ROW_COLUMNS = "SELECT course_id, prereq_course_id, prerequisite_group, min_grade FROM course_prereq";
    private static final RowMapper<StoredRelationship> ROW_MAPPER = (rs, n) -> new StoredRelationship(
            rs.getString(1), rs.getString(2), rs.getInt(3), rs.getObject(4, Integer.class));

    private final JdbcTemplate jdbcTemplate;

    public PrerequisiteJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<StoredRelationship> findByCourse(String course) {
        return jdbcTemplate.query(ROW_COLUMNS + " WHERE course_id = ? ORDER BY prerequisite_group, prereq_course_id",
                ROW_MAPPER, course);
    }

    @Override
    public List<StoredRelationship> findByCourses(Collection<String> courses) {
        if (courses.isEmpty()) return List.of();
        return jdbcTemplate.query(ROW_COLUMNS + " WHERE course_id IN (" + placeholders(courses.size()) + ")"
                        + " ORDER BY course_id, prerequisite_group, prereq_course_id",
                ROW_MAPPER, courses.toArray());
    }

    @Override
    public List<String> findDependents(String prereq) {
        return jdbcTemplate.queryForList(
                "SELECT DISTINCT course_id FROM course_prereq WHERE prereq_course_id = ? ORDER BY course_id",
                String.class, prereq);
    }

    @Override
    public boolean exists(String code) {
        Integer courses = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM course WHERE course_id = ?", Integer.class, code);
        if (courses != null && courses > 0) return true;
        Integer rows = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM course_prereq WHERE course_id = ? OR prereq_course_id = ?", Integer.class, code, code);
        return rows != null && rows > 0;
    }

    @Override
    public Optional<Course> findCourse(String code) {
        List<Course> rows = jdbcTemplate.query(
                "SELECT course_id, COALESCE(course_name, ''), COALESCE(department, ''), course_level, COALESCE(description, '') FROM course WHERE course_id = ?",
                (rs, n) -> new Course(rs.getString(1), rs.getString(2), rs.getString(3),
                        rs.getObject(4, Integer.class), rs.getString(5)),
                code);
        return rows.stream().findFirst();
    }

    public void saveCourse(Course course) {
        jdbcTemplate.update(
                "MERGE INTO course(course_id, course_name, department, course_level, description) KEY(course_id) VALUES (?,?,?,?,?)",
                course.id(), course.name(), course.department(), course.level(), course.description());
    }

    @Override
    public Set<String> knownCodes() {
        return new TreeSet<>(jdbcTemplate.queryForList("SELECT course_id FROM course", String.class));
    }

    @Override
    public Set<String> existingCodes(Collection<String> codes) {
        if (codes.isEmpty()) return Set.of();
        return new HashSet<>(jdbcTemplate.queryForList(
                "SELECT course_id FROM course WHERE course_id IN (" + placeholders(codes.size()) + ")",
                String.class, codes.toArray()));
    }

    @Override
    public void createPlaceholders(Collection<String> codes) {
        codes.forEach(code -> jdbcTemplate.update("MERGE INTO course(course_id) KEY(course_id) VALUES (?)", code));
    }

    @Override
    public void delete(String course, String prereq, int groupIndex) {
        jdbcTemplate.update("DELETE FROM course_prereq WHERE course_id = ? AND prereq_course_id = ? AND prerequisite_group = ?",
                course, prereq, groupIndex);
    }

    @Override
    public void upsert(StoredRelationship row) {
        jdbcTemplate.update(
                "MERGE INTO course_prereq(course_id, prereq_course_id, prerequisite_group, min_grade) KEY(course_id, prereq_course_id, prerequisite_group) VALUES (?,?,?,?)",
                row.course(), row.prereq(), row.groupIndex(), row.minGrade());
    }

    private static String placeholders(int count) {
        return String.join(",", Collections.nCopies(count, "?"));
    }
}
