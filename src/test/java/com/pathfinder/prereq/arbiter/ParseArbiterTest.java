package com.pathfinder.prereq.arbiter;

import com.pathfinder.prereq.config.PrereqProperties;
import com.pathfinder.prereq.domain.DomainModels.ParseResult;
import com.pathfinder.prereq.parser.HeuristicPrereqParser;
import com.pathfinder.prereq.structuring.CompletionGateway;
import com.pathfinder.prereq.structuring.CompletionUnavailableException;
import com.pathfinder.prereq.structuring.StructuringClient;
import com.pathfinder.prereq.structuring.StructuringOutcome;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ParseArbiterTest {
    private static final Set<String> CODES = Set.of("CS135", "CS136", "MATH135");

    private static ParseArbiter arbiter(boolean structuringEnabled, CompletionGateway gateway) {
        var structuring = new PrereqProperties.Structuring(structuringEnabled, Duration.ofSeconds(1), 2, Duration.ZERO, 4000);
        var properties = new PrereqProperties(0.75, structuring, null, null, null);
        return new ParseArbiter(new HeuristicPrereqParser(), new StructuringClient(gateway, properties), properties);
    }

    @Test
    void heuristicOnlyGetsConfidenceFloor() {
        ParseArbiter arbiter = arbiter(false, turns -> fail("service must not be called"));

        ParseResult result = arbiter.arbitrate("CS 135; MATH 135", CODES, false);

        assertEquals(2, result.expression().clauses().size());
        assertEquals(ParseArbiter.HEURISTIC_CONFIDENCE_FLOOR, result.confidence());
        assertTrue(result.constraints().isEmpty());
    }

    @Test
    void structuredResultWinsWhenUsable() {
        ParseArbiter arbiter = arbiter(true, turns -> "{\"groups\":[[{\"code\":\"CS136\"}]],\"constraints\":[\"Level at least 2A\"],\"confidence\":0.9}");

        ParseResult result = arbiter.arbitrate("CS 135; MATH 135", CODES, true);

        assertEquals(List.of("CS136"), result.expression().clauses().get(0).codes());
        assertEquals(0.9, result.confidence());
        assertEquals(List.of("Level at least 2A"), result.constraints());
    }

    @Test
    void barelyConfidentModelFallsBackToHeuristic() {
        ParseArbiter arbiter = arbiter(true, turns -> "{\"groups\":[[{\"code\":\"CS136\"}]],\"constraints\":[\"x\"],\"confidence\":0.05}");

        ParseResult result = arbiter.arbitrate("CS 135; MATH 135", CODES, true);

        assertEquals(List.of("CS135"), result.expression().clauses().get(0).codes());
        assertEquals(0.82, result.confidence());
        assertEquals(List.of("x"), result.constraints());
    }

    @Test
    void unavailableServiceFallsBackToHeuristic() {
        ParseArbiter arbiter = arbiter(true, turns -> {
            throw new CompletionUnavailableException("connection refused");
        });

        ParseResult result = arbiter.arbitrate("CS 135 or CS 136", CODES, true);

        assertEquals(List.of("CS135", "CS136"), result.expression().clauses().get(0).codes());
        assertEquals(0.82, result.confidence());
        assertEquals(List.of(StructuringOutcome.SERVICE_UNAVAILABLE), result.constraints());
    }

    @Test
    void bothEmptyKeepsModelConstraintsAndConfidence() {
        ParseArbiter arbiter = arbiter(true, turns -> "{\"groups\":[],\"constraints\":[\"Honours students only\"],\"confidence\":0.4}");

        ParseResult result = arbiter.arbitrate("Honours students only", CODES, true);

        assertFalse(result.expression().hasClauses());
        assertEquals(0.4, result.confidence());
        assertEquals(List.of("Honours students only"), result.constraints());
    }

    @Test
    void resolutionAppliesCallerThreshold() {
        ParseArbiter arbiter = arbiter(false, turns -> fail("service must not be called"));

        assertTrue(arbiter.resolve("CS 135", CODES, 0.75).accepted());
        assertFalse(arbiter.resolve("CS 135", CODES, 0.9).accepted());
        assertFalse(arbiter.resolve("Consent of instructor", CODES, 0.0).accepted());
    }
}
