package com.pathfinder.prereq.service;

import com.pathfinder.prereq.domain.DomainModels.ParseResult;
import com.pathfinder.prereq.reconcile.ReconciliationModels.ApplyOutcome;

import java.util.List;

public class SyncModels {
    public enum CourseAction {
        MISSING_TEXT, EMPTY_GROUPS, NO_CHANGE, LOW_CONFIDENCE, UPDATED, WOULD_UPDATE, SKIPPED_LOCKED, FAILED
    }

    /**
     * @param apply        write changes; otherwise only report what would change
     * @param onlyCourse   restrict a batch to one course, null for all
     * @param threshold    minimum confidence for replacing a differing stored structure, null for the configured one
     * @param useStructuring consult the text-generation service, null for the configured default
     */
    public record SyncOptions(boolean apply, String onlyCourse, Double threshold, Boolean useStructuring) {
        public static SyncOptions dryRun() {
            return new SyncOptions(false, null, null, null);
        }

        public static SyncOptions applying() {
            return new SyncOptions(true, null, null, null);
        }
    }

    public record CourseSyncResult(String courseId, CourseAction action, ParseResult parse, ApplyOutcome applied, String error) {}

    public record SyncStats(int checked, int updated, int skippedLowConf, int noChange,
                            int missingPrereqText, int skippedLocked, int failed) {
        public static SyncStats of(List<CourseSyncResult> results) {
            int updated = 0, lowConf = 0, noChange = 0, missing = 0, locked = 0, failed = 0;
            for (CourseSyncResult r : results) {
                switch (r.action()) {
                    case UPDATED, WOULD_UPDATE -> updated++;
                    case LOW_CONFIDENCE, EMPTY_GROUPS -> lowConf++;
                    case NO_CHANGE -> noChange++;
                    case MISSING_TEXT -> missing++;
                    case SKIPPED_LOCKED -> locked++;
                    case FAILED -> failed++;
                }
            }
            return new SyncStats(results.size(), updated, lowConf, noChange, missing, locked, failed);
        }
    }

    public record SyncReport(String department, SyncStats stats, List<CourseSyncResult> courses) {}
}
