package com.pathfinder.prereq.diagnostics;

import com.pathfinder.prereq.domain.DomainModels.PrereqExpression;

import java.util.List;

/**
 * One parse decision for one course, kept for offline audit.
 *
 * @param currentGroups stored structure before the decision, null when not looked up
 * @param newGroups     structure the parse produced, null when nothing was parsed
 * @param error         failure detail for skipped writes
 */
public record ParseDiagnostic(String courseId,
                              String department,
                              IssueKind issue,
                              Double confidence,
                              String rawExcerpt,
                              PrereqExpression currentGroups,
                              PrereqExpression newGroups,
                              List<String> constraints,
                              String error) {
    public static final int EXCERPT_LENGTH = 500;

    public static String excerpt(String raw) {
        if (raw == null) return "";
        return raw.length() > EXCERPT_LENGTH ? raw.substring(0, EXCERPT_LENGTH) : raw;
    }
}
