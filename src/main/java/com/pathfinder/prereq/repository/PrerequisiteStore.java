package com.pathfinder.prereq.repository;

import com.pathfinder.prereq.domain.DomainModels.Course;
import com.pathfinder.prereq.domain.DomainModels.StoredRelationship;

import java.util.*;

/**
 * Durable prerequisite relationships. Rows are keyed by (course, prereq, group index); writes are
 * individually atomic, and conflicting writes surface as Spring's transient data access exceptions.
 */
public interface PrerequisiteStore {
    List<StoredRelationship> findByCourse(String course);

    List<StoredRelationship> findByCourses(Collection<String> courses);

    /** Courses listing {@code prereq} in any clause, sorted by code. */
    List<String> findDependents(String prereq);

    /** True when the code is a known course or appears in any relationship. */
    boolean exists(String code);

    Optional<Course> findCourse(String code);

    Set<String> knownCodes();

    Set<String> existingCodes(Collection<String> codes);

    void createPlaceholders(Collection<String> codes);

    void delete(String course, String prereq, int groupIndex);

    void upsert(StoredRelationship row);
}
