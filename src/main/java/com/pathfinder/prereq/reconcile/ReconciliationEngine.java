package com.pathfinder.prereq.reconcile;

import com.pathfinder.prereq.config.PrereqProperties;
import com.pathfinder.prereq.domain.DomainModels;
import com.pathfinder.prereq.domain.DomainModels.PrereqClause;
import com.pathfinder.prereq.domain.DomainModels.PrereqExpression;
import com.pathfinder.prereq.domain.DomainModels.PrereqItem;
import com.pathfinder.prereq.domain.DomainModels.StoredRelationship;
import com.pathfinder.prereq.lexicon.CodeLexicon;
import com.pathfinder.prereq.reconcile.ReconciliationModels.*;
import com.pathfinder.prereq.repository.PrerequisiteStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Diffs a desired prerequisite expression against the stored rows of a course and applies the
 * difference row by row. Each write is retried on transient lock errors; a row that still fails
 * is reported as skipped and does not stop the remaining rows.
 */
@Service
public class ReconciliationEngine {
    private static final Logger log = LoggerFactory.getLogger(ReconciliationEngine.class);

    private static final Comparator<PrereqItem> ITEM_ORDER = Comparator
            .comparing(PrereqItem::code)
            .thenComparing(PrereqItem::minGrade, Comparator.nullsFirst(Comparator.naturalOrder()));
    private static final Comparator<List<PrereqItem>> CLAUSE_ORDER = (a, b) -> {
        for (int i = 0; i < Math.min(a.size(), b.size()); i++) {
            int c = ITEM_ORDER.compare(a.get(i), b.get(i));
            if (c != 0) return c;
        }
        return Integer.compare(a.size(), b.size());
    };

    private final PrerequisiteStore store;
    private final PrereqProperties.Reconcile settings;

    public ReconciliationEngine(PrerequisiteStore store, PrereqProperties properties) {
        this.store = store;
        this.settings = properties.reconcile();
    }

    public ReconcilePlan reconcile(String course, PrereqExpression expression, List<StoredRelationship> storedRows) {
        Map<RowKey, Integer> desired = desiredRows(course, expression);

        Map<RowKey, Integer> current = new HashMap<>();
        for (StoredRelationship row : storedRows) {
            if (!course.equals(row.course())) continue;
            current.put(new RowKey(canonical(row.prereq()), row.groupIndex()), row.minGrade());
        }

        List<RowKey> deletes = current.keySet().stream().filter(k -> !desired.containsKey(k)).sorted().toList();
        List<StoredRelationship> upserts = desired.entrySet().stream()
                .filter(e -> !current.containsKey(e.getKey()) || !Objects.equals(current.get(e.getKey()), e.getValue()))
                .map(e -> new StoredRelationship(course, e.getKey().prereq(), e.getKey().groupIndex(), e.getValue()))
                .toList();
        return new ReconcilePlan(course, deletes, upserts);
    }

    /** Loads the stored rows, diffs and applies. */
    public ApplyOutcome synchronize(String course, PrereqExpression expression) {
        return apply(reconcile(course, expression, store.findByCourse(course)));
    }

    public ApplyOutcome apply(ReconcilePlan plan) {
        String course = plan.course();
        List<RowKey> deleted = new ArrayList<>();
        List<StoredRelationship> upserted = new ArrayList<>();
        List<SkippedRow> skipped = new ArrayList<>();

        for (RowKey key : plan.deletes()) {
            String error = withRetry(() -> store.delete(course, key.prereq(), key.groupIndex()));
            if (error == null) deleted.add(key);
            else skipped.add(new SkippedRow(Operation.DELETE, course, key.prereq(), key.groupIndex(), error));
        }

        String placeholderError = plan.upserts().isEmpty() ? null : withRetry(() -> ensureCoursesExist(plan));
        for (StoredRelationship row : plan.upserts()) {
            String error = placeholderError != null ? placeholderError : withRetry(() -> store.upsert(row));
            if (error == null) upserted.add(row);
            else skipped.add(new SkippedRow(Operation.UPSERT, course, row.prereq(), row.groupIndex(), error));
        }

        skipped.forEach(s -> log.warn("Skipped {} {} -> {} (group {}): {}", s.operation(), s.course(), s.prereq(), s.groupIndex(), s.error()));
        return new ApplyOutcome(course, deleted, upserted, skipped);
    }

    /**
     * Equal when both hold the same clauses with the same items and grades, regardless of clause
     * order or item order within a clause.
     */
    public static boolean groupsEqual(PrereqExpression a, PrereqExpression b) {
        return normalized(a).equals(normalized(b));
    }

    private static List<List<PrereqItem>> normalized(PrereqExpression expression) {
        List<List<PrereqItem>> clauses = new ArrayList<>();
        for (PrereqClause clause : expression.clauses()) {
            clauses.add(clause.items().stream().sorted(ITEM_ORDER).toList());
        }
        clauses.sort(CLAUSE_ORDER);
        return clauses;
    }

    /** One row per (prereq, clause index), strictest grade wins; the course never requires itself. */
    private static Map<RowKey, Integer> desiredRows(String course, PrereqExpression expression) {
        Map<RowKey, Integer> desired = new TreeMap<>();
        String self = canonical(course);
        int groupIndex = 0;
        for (PrereqClause clause : expression.clauses()) {
            groupIndex++;
            for (PrereqItem item : clause.items()) {
                String code = canonical(item.code());
                if (code.isEmpty() || code.equals(self)) continue;
                RowKey key = new RowKey(code, groupIndex);
                desired.put(key, desired.containsKey(key) ? DomainModels.stricterGrade(desired.get(key), item.minGrade()) : item.minGrade());
            }
        }
        return desired;
    }

    private void ensureCoursesExist(ReconcilePlan plan) {
        Set<String> codes = new TreeSet<>();
        codes.add(plan.course());
        plan.upserts().forEach(r -> codes.add(r.prereq()));
        Set<String> existing = store.existingCodes(codes);
        List<String> missing = codes.stream().filter(c -> !existing.contains(c)).toList();
        if (!missing.isEmpty()) {
            log.debug("Creating placeholder courses {}", missing);
            store.createPlaceholders(missing);
        }
    }

    /**
     * Runs the write, retrying transient conflicts (lock waits, deadlocks, lock-timeout query
     * timeouts); returns null on success or the last error message.
     */
    private String withRetry(Runnable write) {
        for (int attempt = 1; ; attempt++) {
            try {
                write.run();
                return null;
            } catch (TransientDataAccessException e) {
                if (attempt >= settings.maxAttempts()) {
                    return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                }
                pause(settings.backoff().toMillis() * attempt);
            }
        }
    }

    private static String canonical(String code) {
        return CodeLexicon.canonicalize(code).orElse("");
    }

    private static void pause(long millis) {
        if (millis <= 0) return;
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while retrying a prerequisite write", e);
        }
    }
}
