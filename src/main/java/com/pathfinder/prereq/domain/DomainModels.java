package com.pathfinder.prereq.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.*;

public class DomainModels {
    public record PrereqItem(String code, Integer minGrade) {
        public PrereqItem {
            if (code == null || code.isBlank()) throw new IllegalArgumentException("Prerequisite code is required");
            if (minGrade != null && (minGrade < 0 || minGrade > 100)) {
                throw new IllegalArgumentException("Grade constraint out of range: " + minGrade);
            }
        }

        /** Builds an item, dropping a grade that is not a percentage. */
        public static PrereqItem of(String code, Integer minGrade) {
            return new PrereqItem(code, minGrade == null || minGrade < 0 || minGrade > 100 ? null : minGrade);
        }
    }

    /**
     * One OR-group of alternatives. Duplicate codes collapse into a single item carrying the
     * stricter grade, keeping the position of the first occurrence.
     */
    public record PrereqClause(List<PrereqItem> items) {
        public PrereqClause {
            if (items == null || items.isEmpty()) throw new IllegalArgumentException("Clause must contain at least one item");
            Map<String, Integer> merged = new LinkedHashMap<>();
            for (PrereqItem item : items) {
                if (merged.containsKey(item.code())) {
                    merged.put(item.code(), stricterGrade(merged.get(item.code()), item.minGrade()));
                } else {
                    merged.put(item.code(), item.minGrade());
                }
            }
            items = merged.entrySet().stream().map(e -> new PrereqItem(e.getKey(), e.getValue())).toList();
        }

        public static PrereqClause of(PrereqItem... items) {
            return new PrereqClause(List.of(items));
        }

        @JsonProperty("type")
        public ClauseType type() {
            return ClauseType.forSize(items.size());
        }

        public List<String> codes() {
            return items.stream().map(PrereqItem::code).toList();
        }
    }

    /** AND across clauses. */
    public record PrereqExpression(List<PrereqClause> clauses) {
        public PrereqExpression {
            clauses = clauses == null ? List.of() : List.copyOf(clauses);
        }

        public static PrereqExpression empty() {
            return new PrereqExpression(List.of());
        }

        public boolean hasClauses() {
            return !clauses.isEmpty();
        }
    }

    public record ParseResult(PrereqExpression expression, List<String> constraints, double confidence) {
        public ParseResult {
            expression = expression == null ? PrereqExpression.empty() : expression;
            constraints = constraints == null ? List.of() : List.copyOf(constraints);
            confidence = Math.max(0.0, Math.min(1.0, confidence));
        }

        public static ParseResult empty(double confidence, String... constraints) {
            return new ParseResult(PrereqExpression.empty(), List.of(constraints), confidence);
        }
    }

    public record StoredRelationship(String course, String prereq, int groupIndex, Integer minGrade) {}

    public record Course(String id, String name, String department, Integer level, String description) {
        public static Course placeholder(String id) {
            return new Course(id, "", "", null, "");
        }
    }

    /** Derived from clause cardinality only; never stored. */
    public enum ClauseType {
        AND, OR;

        public static ClauseType forSize(int size) {
            return size > 1 ? OR : AND;
        }
    }

    public static Integer stricterGrade(Integer a, Integer b) {
        if (a == null) return b;
        if (b == null) return a;
        return Math.max(a, b);
    }

    /** Regroups stored rows of one course into clauses ordered by group index, items by code. */
    public static PrereqExpression toExpression(Collection<StoredRelationship> rows) {
        Map<Integer, List<PrereqItem>> groups = new TreeMap<>();
        rows.stream()
                .sorted(Comparator.comparingInt(StoredRelationship::groupIndex).thenComparing(StoredRelationship::prereq))
                .forEach(r -> groups.computeIfAbsent(r.groupIndex(), k -> new ArrayList<>()).add(PrereqItem.of(r.prereq(), r.minGrade())));
        return new PrereqExpression(groups.values().stream().map(PrereqClause::new).toList());
    }
}
