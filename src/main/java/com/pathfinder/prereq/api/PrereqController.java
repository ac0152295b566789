package com.pathfinder.prereq.api;

import com.pathfinder.prereq.arbiter.ParseArbiter;
import com.pathfinder.prereq.config.PrereqProperties;
import com.pathfinder.prereq.repository.PrerequisiteStore;
import com.pathfinder.prereq.service.PrereqSyncService;
import com.pathfinder.prereq.service.SyncModels;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/prereqs")
public class PrereqController {
    private final ParseArbiter arbiter;
    private final PrereqSyncService syncService;
    private final PrerequisiteStore store;
    private final PrereqProperties properties;

    public PrereqController(ParseArbiter arbiter, PrereqSyncService syncService, PrerequisiteStore store, PrereqProperties properties) {
        this.arbiter = arbiter;
        this.syncService = syncService;
        this.store = store;
        this.properties = properties;
    }

    @PostMapping("/resolve")
    public ResponseEntity<ParseArbiter.Resolution> resolve(@RequestBody ResolveRequest request) {
        double threshold = request.threshold() == null ? properties.confidenceThreshold() : request.threshold();
        return ResponseEntity.ok(arbiter.resolve(request.text(), store.knownCodes(), threshold));
    }

    @PostMapping("/sync")
    public ResponseEntity<SyncModels.SyncReport> sync(@RequestBody SyncRequest request) {
        var options = new SyncModels.SyncOptions(request.apply(), request.onlyCourse(), request.threshold(), request.useStructuring());
        return ResponseEntity.ok(syncService.syncDepartment(request.department(), request.prereqTexts(), options));
    }

    @PostMapping("/sync/calendar")
    public ResponseEntity<SyncModels.SyncReport> syncCalendar(@RequestBody CalendarSyncRequest request) {
        var options = new SyncModels.SyncOptions(request.apply(), request.onlyCourse(), request.threshold(), request.useStructuring());
        return ResponseEntity.ok(syncService.syncCalendar(request.department(), request.courseCells(), options));
    }

    public record ResolveRequest(String text, Double threshold) {}

    public record SyncRequest(String department, Map<String, String> prereqTexts, boolean apply,
                              String onlyCourse, Double threshold, Boolean useStructuring) {}

    public record CalendarSyncRequest(String department, Map<String, List<String>> courseCells, boolean apply,
                                      String onlyCourse, Double threshold, Boolean useStructuring) {}
}
