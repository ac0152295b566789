package com.pathfinder.prereq.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pathfinder.prereq.config.PrereqProperties;
import com.pathfinder.prereq.diagnostics.ParseIssueJdbcRepository;
import com.pathfinder.prereq.graph.GraphModels;
import com.pathfinder.prereq.graph.PrerequisiteGraphService;
import com.pathfinder.prereq.lexicon.CodeLexicon;
import com.pathfinder.prereq.repository.PrereqSourceJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

@RestController
@RequestMapping("/api/course")
public class CourseGraphController {
    private static final Logger log = LoggerFactory.getLogger(CourseGraphController.class);

    private final PrerequisiteGraphService graphService;
    private final PrereqSourceJdbcRepository sourceRepository;
    private final ParseIssueJdbcRepository issueRepository;
    private final ObjectMapper objectMapper;
    private final PrereqProperties.Graph limits;

    public CourseGraphController(PrerequisiteGraphService graphService,
                                 PrereqSourceJdbcRepository sourceRepository,
                                 ParseIssueJdbcRepository issueRepository,
                                 ObjectMapper objectMapper,
                                 PrereqProperties properties) {
        this.graphService = graphService;
        this.sourceRepository = sourceRepository;
        this.issueRepository = issueRepository;
        this.objectMapper = objectMapper;
        this.limits = properties.graph();
    }

    @GetMapping("/{courseId}/prereqs")
    public ResponseEntity<PrereqGroupsResponse> prereqs(@PathVariable String courseId) {
        return ResponseEntity.ok(new PrereqGroupsResponse(code(courseId), graphService.prereqGroups(code(courseId))));
    }

    @GetMapping("/{courseId}/future")
    public ResponseEntity<GraphModels.TreeNode> future(@PathVariable String courseId,
                                                       @RequestParam(required = false) Integer depth) {
        int d = depth == null ? limits.defaultFutureDepth() : depth;
        requireRange("depth", d, 0, limits.maxFutureDepth());
        return ResponseEntity.ok(graphService.forwardTree(code(courseId), d));
    }

    @GetMapping("/{courseId}/tree")
    public ResponseEntity<GraphModels.CourseTree> tree(@PathVariable String courseId,
                                                       @RequestParam(required = false) Integer prereqDepth,
                                                       @RequestParam(required = false) Integer futureDepth) {
        int p = prereqDepth == null ? limits.defaultPrereqDepth() : prereqDepth;
        int f = futureDepth == null ? limits.defaultFutureDepth() : futureDepth;
        requireRange("futureDepth", f, 0, limits.maxFutureDepth());
        requireRange("prereqDepth", p, 1, limits.maxPrereqDepth());
        return graphService.courseTree(code(courseId), p, f)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Course '" + courseId + "' not found"));
    }

    @GetMapping("/{courseId}/prereq-source")
    public ResponseEntity<PrereqSourceResponse> prereqSource(@PathVariable String courseId) {
        String code = code(courseId);
        return ResponseEntity.ok(sourceRepository.find(code)
                .map(row -> new PrereqSourceResponse(code, row.source(), row.rawText(), logic(row.logicJson())))
                .orElse(new PrereqSourceResponse(code, null, "", objectMapper.createObjectNode())));
    }

    @GetMapping("/{courseId}/parse-issues")
    public ResponseEntity<List<ParseIssueJdbcRepository.IssueRow>> parseIssues(@PathVariable String courseId) {
        return ResponseEntity.ok(issueRepository.findByCourse(code(courseId)));
    }

    /** Stored parse JSON as an object; unreadable text degrades to an empty object. */
    private JsonNode logic(String logicJson) {
        try {
            JsonNode node = objectMapper.readTree(logicJson);
            return node != null && node.isObject() ? node : objectMapper.createObjectNode();
        } catch (JsonProcessingException e) {
            log.warn("Unreadable stored parse JSON: {}", e.getOriginalMessage());
            return objectMapper.createObjectNode();
        }
    }

    private static String code(String courseId) {
        return CodeLexicon.canonicalize(courseId).orElse(courseId);
    }

    private static void requireRange(String name, int value, int min, int max) {
        if (value < min || value > max) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, name + " must be between " + min + " and " + max);
        }
    }

    public record PrereqSourceResponse(String courseId, String source, String rawText, JsonNode logic) {}

    public record PrereqGroupsResponse(String courseId, List<GraphModels.GroupView> groups) {}
}
