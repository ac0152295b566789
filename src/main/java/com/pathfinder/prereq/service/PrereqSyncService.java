package com.pathfinder.prereq.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pathfinder.prereq.arbiter.ParseArbiter;
import com.pathfinder.prereq.config.PrereqProperties;
import com.pathfinder.prereq.diagnostics.IssueKind;
import com.pathfinder.prereq.diagnostics.ParseDiagnostic;
import com.pathfinder.prereq.diagnostics.ParseDiagnosticsSink;
import com.pathfinder.prereq.domain.DomainModels;
import com.pathfinder.prereq.domain.DomainModels.ParseResult;
import com.pathfinder.prereq.domain.DomainModels.PrereqExpression;
import com.pathfinder.prereq.lexicon.CodeLexicon;
import com.pathfinder.prereq.parser.PrereqTextExtractor;
import com.pathfinder.prereq.reconcile.ReconciliationEngine;
import com.pathfinder.prereq.reconcile.ReconciliationModels.ApplyOutcome;
import com.pathfinder.prereq.repository.PrereqSourceJdbcRepository;
import com.pathfinder.prereq.repository.PrerequisiteStore;
import com.pathfinder.prereq.service.SyncModels.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parse, compare and (optionally) write prerequisites for one course or a whole department.
 * <p>
 * Per course: missing text and empty parses are logged and skipped; a parse equal to the stored
 * structure is a no-op; a differing parse below the confidence threshold is logged as a low-confidence
 * mismatch; anything else is reconciled. Model calls finish before any write starts, and a failure in
 * one course never stops the others.
 */
@Service
public class PrereqSyncService {
    private static final Logger log = LoggerFactory.getLogger(PrereqSyncService.class);
    private static final Pattern DEPARTMENT = Pattern.compile("^([A-Z]+)");
    static final String SOURCE = "calendar";

    private final PrereqTextExtractor extractor;
    private final ParseArbiter arbiter;
    private final ReconciliationEngine engine;
    private final PrerequisiteStore store;
    private final PrereqSourceJdbcRepository sourceRepository;
    private final ParseDiagnosticsSink diagnostics;
    private final ObjectMapper objectMapper;
    private final PrereqProperties properties;

    public PrereqSyncService(PrereqTextExtractor extractor,
                             ParseArbiter arbiter,
                             ReconciliationEngine engine,
                             PrerequisiteStore store,
                             PrereqSourceJdbcRepository sourceRepository,
                             ParseDiagnosticsSink diagnostics,
                             ObjectMapper objectMapper,
                             PrereqProperties properties) {
        this.extractor = extractor;
        this.arbiter = arbiter;
        this.engine = engine;
        this.store = store;
        this.sourceRepository = sourceRepository;
        this.diagnostics = diagnostics;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public CourseSyncResult syncCourse(String courseId, String rawText, SyncOptions options) {
        return syncCourse(courseId, rawText, options, store.knownCodes());
    }

    /**
     * Runs every course of {@code prereqTexts} (course code to raw text) on a pool bounded by
     * {@code prereq.sync.concurrency}. Course order in the report follows the input order.
     */
    public SyncReport syncDepartment(String department, Map<String, String> prereqTexts, SyncOptions options) {
        Set<String> knownCodes = store.knownCodes();
        String only = options.onlyCourse() == null ? null : CodeLexicon.canonicalize(options.onlyCourse()).orElse(null);

        Map<String, String> selected = new LinkedHashMap<>();
        prereqTexts.forEach((code, raw) -> {
            String canonical = CodeLexicon.canonicalize(code).orElse(code);
            if (only == null || only.equals(canonical)) selected.put(canonical, raw);
        });
        if (selected.isEmpty()) {
            return new SyncReport(department, SyncStats.of(List.of()), List.of());
        }

        ExecutorService pool = Executors.newFixedThreadPool(Math.min(properties.sync().concurrency(), selected.size()));
        try {
            Map<String, Future<CourseSyncResult>> pending = new LinkedHashMap<>();
            selected.forEach((code, raw) -> pending.put(code, pool.submit(() -> syncCourse(code, raw, options, knownCodes))));

            List<CourseSyncResult> results = new ArrayList<>();
            for (var entry : pending.entrySet()) {
                results.add(await(entry.getKey(), entry.getValue()));
            }
            SyncStats stats = SyncStats.of(results);
            log.info("Prerequisite sync {} (apply={}): {}", department, options.apply(), stats);
            return new SyncReport(department, stats, results);
        } finally {
            pool.shutdownNow();
        }
    }

    /**
     * Calendar variant: each course comes as the text cells of its calendar entry, and the
     * prerequisite sentence is picked out of them first.
     */
    public SyncReport syncCalendar(String department, Map<String, List<String>> coursePageCells, SyncOptions options) {
        Map<String, String> texts = new LinkedHashMap<>();
        coursePageCells.forEach((code, cells) -> texts.put(code, extractor.extract(cells == null ? List.of() : cells)));
        return syncDepartment(department, texts, options);
    }

    CourseSyncResult syncCourse(String courseId, String rawText, SyncOptions options, Set<String> knownCodes) {
        String code = CodeLexicon.canonicalize(courseId).orElse(courseId);
        try {
            return process(code, rawText, options, knownCodes);
        } catch (RuntimeException e) {
            log.error("Prerequisite sync failed for {}", code, e);
            return new CourseSyncResult(code, CourseAction.FAILED, null, null, e.getMessage());
        }
    }

    private CourseSyncResult process(String code, String rawText, SyncOptions options, Set<String> knownCodes) {
        String department = department(code);
        rawText = extractor.trimToPrerequisites(rawText);
        if (rawText.isBlank()) {
            diagnostics.record(new ParseDiagnostic(code, department, IssueKind.NO_PREREQ_TEXT, null, "", null, null, List.of(), null));
            return new CourseSyncResult(code, CourseAction.MISSING_TEXT, null, null, null);
        }

        boolean useStructuring = options.useStructuring() != null ? options.useStructuring() : properties.structuring().enabled();
        ParseResult parsed = arbiter.arbitrate(rawText, knownCodes, useStructuring);
        PrereqExpression proposed = parsed.expression();

        if (!proposed.hasClauses()) {
            diagnostics.record(diagnostic(code, department, IssueKind.EMPTY_GROUPS, parsed, rawText, null, null));
            return new CourseSyncResult(code, CourseAction.EMPTY_GROUPS, parsed, null, null);
        }

        PrereqExpression current = DomainModels.toExpression(store.findByCourse(code));
        if (ReconciliationEngine.groupsEqual(proposed, current)) {
            saveSource(code, rawText, parsed);
            return new CourseSyncResult(code, CourseAction.NO_CHANGE, parsed, null, null);
        }

        double threshold = options.threshold() != null ? options.threshold() : properties.confidenceThreshold();
        if (parsed.confidence() < threshold) {
            diagnostics.record(diagnostic(code, department, IssueKind.MISMATCH_LOW_CONF, parsed, rawText, current, null));
            return new CourseSyncResult(code, CourseAction.LOW_CONFIDENCE, parsed, null, null);
        }

        if (!options.apply()) {
            diagnostics.record(diagnostic(code, department, IssueKind.WOULD_UPDATE, parsed, rawText, current, null));
            return new CourseSyncResult(code, CourseAction.WOULD_UPDATE, parsed, null, null);
        }

        ApplyOutcome outcome = engine.synchronize(code, proposed);
        if (!outcome.complete()) {
            String error = outcome.skipped().get(0).error();
            diagnostics.record(diagnostic(code, department, IssueKind.SKIPPED_LOCKED, parsed, rawText,
                    DomainModels.toExpression(store.findByCourse(code)), error));
            return new CourseSyncResult(code, CourseAction.SKIPPED_LOCKED, parsed, outcome, error);
        }
        saveSource(code, rawText, parsed);
        diagnostics.record(diagnostic(code, department, IssueKind.UPDATED, parsed, rawText, current, null));
        return new CourseSyncResult(code, CourseAction.UPDATED, parsed, outcome, null);
    }

    private ParseDiagnostic diagnostic(String code, String department, IssueKind issue, ParseResult parsed,
                                       String rawText, PrereqExpression current, String error) {
        return new ParseDiagnostic(code, department, issue, parsed.confidence(), ParseDiagnostic.excerpt(rawText),
                current, parsed.expression(), parsed.constraints(), error);
    }

    private void saveSource(String code, String rawText, ParseResult parsed) {
        Map<String, Object> logic = new LinkedHashMap<>();
        logic.put("groups", parsed.expression().clauses());
        logic.put("constraints", parsed.constraints());
        logic.put("confidence", parsed.confidence());
        try {
            sourceRepository.save(code, SOURCE, rawText, objectMapper.writeValueAsString(logic));
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize parse result for {}: {}", code, e.getMessage());
        }
    }

    private CourseSyncResult await(String code, Future<CourseSyncResult> future) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            log.error("Prerequisite sync task failed for {}", code, e.getCause());
            return new CourseSyncResult(code, CourseAction.FAILED, null, null, String.valueOf(e.getCause()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new CourseSyncResult(code, CourseAction.FAILED, null, null, "interrupted");
        }
    }

    private static String department(String code) {
        Matcher m = DEPARTMENT.matcher(code);
        return m.find() ? m.group(1) : "";
    }
}
