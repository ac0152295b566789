package com.pathfinder.prereq.service;

import com.pathfinder.prereq.diagnostics.ParseIssueJdbcRepository;
import com.pathfinder.prereq.domain.DomainModels.StoredRelationship;
import com.pathfinder.prereq.repository.PrerequisiteJdbcRepository;
import com.pathfinder.prereq.service.SyncModels.*;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {
        "spring.datasource.url=jdbc:h2:mem:prereq-locking;DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=200",
        "prereq.reconcile.max-attempts=2",
        "prereq.reconcile.backoff=10ms"
})
class PrereqSyncLockingTest {
    @Autowired
    private PrereqSyncService service;
    @Autowired
    private PrerequisiteJdbcRepository repository;
    @Autowired
    private ParseIssueJdbcRepository issueRepository;
    @Autowired
    private JdbcTemplate jdbcTemplate;
    @Autowired
    private DataSource dataSource;

    private Connection lockHolder;

    @BeforeEach
    void seedAndLock() throws SQLException {
        jdbcTemplate.update("DELETE FROM prereq_parse_issue");
        jdbcTemplate.update("DELETE FROM course_prereq_text");
        jdbcTemplate.update("DELETE FROM course_prereq");
        jdbcTemplate.update("DELETE FROM course");
        repository.createPlaceholders(List.of("CS246", "CS136"));
        repository.upsert(new StoredRelationship("CS246", "CS136", 1, null));

        lockHolder = dataSource.getConnection();
        lockHolder.setAutoCommit(false);
        try (Statement statement = lockHolder.createStatement()) {
            statement.executeUpdate("UPDATE course_prereq SET min_grade = 50 WHERE course_id = 'CS246' AND prereq_course_id = 'CS136'");
        }
    }

    @AfterEach
    void release() throws SQLException {
        lockHolder.rollback();
        lockHolder.close();
    }

    @Test
    void lockedRowIsReportedAsSkipped() {
        CourseSyncResult result = service.syncCourse("CS246", "CS 136 with at least 60%", SyncOptions.applying());

        assertEquals(CourseAction.SKIPPED_LOCKED, result.action());
        assertNotNull(result.error());
        assertEquals("CS136", result.applied().skipped().get(0).prereq());
        assertEquals(List.of("skipped_locked"),
                issueRepository.findByCourse("CS246").stream().map(ParseIssueJdbcRepository.IssueRow::issue).toList());
        assertEquals(List.of(new StoredRelationship("CS246", "CS136", 1, null)), repository.findByCourse("CS246"));
    }

    @Test
    void lockedCourseDoesNotStopTheRestOfTheBatch() {
        Map<String, String> texts = new LinkedHashMap<>();
        texts.put("CS246", "CS 136 with at least 60%");
        texts.put("CS241", "MATH 135; CS 138");
        texts.put("CS240", "CS 136 or CS 146");

        SyncReport report = service.syncDepartment("CS", texts, SyncOptions.applying());

        assertEquals(List.of(CourseAction.SKIPPED_LOCKED, CourseAction.UPDATED, CourseAction.UPDATED),
                report.courses().stream().map(CourseSyncResult::action).toList());
        assertEquals(3, report.stats().checked());
        assertEquals(2, report.stats().updated());
        assertEquals(1, report.stats().skippedLocked());
        assertEquals(0, report.stats().failed());
        assertEquals(2, repository.findByCourse("CS241").size());
        assertEquals(2, repository.findByCourse("CS240").size());
    }
}
