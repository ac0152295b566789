package com.pathfinder.prereq.reconcile;

import com.pathfinder.prereq.domain.DomainModels.StoredRelationship;

import java.util.Comparator;
import java.util.List;

public class ReconciliationModels {
    public record RowKey(String prereq, int groupIndex) implements Comparable<RowKey> {
        private static final Comparator<RowKey> ORDER =
                Comparator.comparing(RowKey::prereq).thenComparingInt(RowKey::groupIndex);

        @Override
        public int compareTo(RowKey other) {
            return ORDER.compare(this, other);
        }
    }

    /** Minimal mutations turning the stored rows of {@code course} into the desired ones. */
    public record ReconcilePlan(String course, List<RowKey> deletes, List<StoredRelationship> upserts) {
        public boolean hasChanges() {
            return !deletes.isEmpty() || !upserts.isEmpty();
        }
    }

    public enum Operation { DELETE, UPSERT }

    public record SkippedRow(Operation operation, String course, String prereq, int groupIndex, String error) {}

    public record ApplyOutcome(String course,
                               List<RowKey> deleted,
                               List<StoredRelationship> upserted,
                               List<SkippedRow> skipped) {
        public boolean complete() {
            return skipped.isEmpty();
        }
    }
}
