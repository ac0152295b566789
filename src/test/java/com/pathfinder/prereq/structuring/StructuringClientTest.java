package com.pathfinder.prereq.structuring;

import com.pathfinder.prereq.config.PrereqProperties;
import com.pathfinder.prereq.domain.DomainModels.ParseResult;
import com.pathfinder.prereq.domain.DomainModels.PrereqItem;
import com.pathfinder.prereq.structuring.StructuringModels.ChatTurn;
import com.pathfinder.prereq.structuring.StructuringModels.Role;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class StructuringClientTest {
    private static final Set<String> CODES = Set.of("CS135", "CS136", "MATH135");

    private static StructuringClient client(CompletionGateway gateway) {
        var structuring = new PrereqProperties.Structuring(true, Duration.ofSeconds(1), 3, Duration.ZERO, 4000);
        return new StructuringClient(gateway, new PrereqProperties(0.75, structuring, null, null, null));
    }

    @Test
    void sanitizesFencedResponseAgainstWhitelist() {
        StructuringClient client = client(turns -> """
                Here you go:
                ```json
                {"groups": [[{"code": "cs135"}, {"code": "XYZ999"}], [[{"code": "MATH135", "min_grade": "60"}]], [{"code": "ECON101"}]],
                 "constraints": ["Honours Mathematics students only"]}
                ```""");

        StructuringOutcome outcome = client.structure("CS 135; MATH 135 with at least 60%", CODES);

        assertInstanceOf(StructuringOutcome.Parsed.class, outcome);
        ParseResult result = outcome.result();
        assertEquals(2, result.expression().clauses().size());
        assertEquals(List.of("CS135"), result.expression().clauses().get(0).codes());
        assertEquals(List.of(new PrereqItem("MATH135", 60)), result.expression().clauses().get(1).items());
        assertEquals(List.of("Honours Mathematics students only"), result.constraints());
        assertEquals(0.5, result.confidence());
    }

    @Test
    void retriesTransientFailures() {
        AtomicInteger calls = new AtomicInteger();
        StructuringClient client = client(turns -> {
            if (calls.incrementAndGet() < 3) throw new CompletionUnavailableException("rate limited");
            return "{\"groups\":[[{\"code\":\"CS136\"}]],\"confidence\":0.9}";
        });

        StructuringOutcome outcome = client.structure("CS 136", CODES);

        assertEquals(3, calls.get());
        assertInstanceOf(StructuringOutcome.Parsed.class, outcome);
        assertEquals(0.9, outcome.result().confidence());
    }

    @Test
    void exhaustedRetriesBecomeServiceError() {
        AtomicInteger calls = new AtomicInteger();
        StructuringClient client = client(turns -> {
            calls.incrementAndGet();
            throw new CompletionUnavailableException("timed out");
        });

        StructuringOutcome outcome = client.structure("CS 136", CODES);

        assertEquals(3, calls.get());
        assertInstanceOf(StructuringOutcome.ServiceError.class, outcome);
        assertFalse(outcome.result().expression().hasClauses());
        assertEquals(0.0, outcome.result().confidence());
        assertEquals(List.of(StructuringOutcome.SERVICE_UNAVAILABLE), outcome.result().constraints());
    }

    @Test
    void undecodableResponseGetsOneStrictRetry() {
        List<List<ChatTurn>> requests = new ArrayList<>();
        StructuringClient client = client(turns -> {
            requests.add(turns);
            return requests.size() == 1 ? "Sure! The prerequisites are CS 136." : "{\"groups\":[[{\"code\":\"CS136\"}]],\"confidence\":0.7}";
        });

        StructuringOutcome outcome = client.structure("CS 136", CODES);

        assertInstanceOf(StructuringOutcome.Parsed.class, outcome);
        assertEquals(2, requests.size());
        ChatTurn last = requests.get(1).get(requests.get(1).size() - 1);
        assertEquals(Role.USER, last.role());
        assertTrue(last.content().contains("Return VALID JSON only"));
        assertTrue(requests.get(1).size() < requests.get(0).size());
    }

    @Test
    void twiceUndecodableIsDecodeError() {
        AtomicInteger calls = new AtomicInteger();
        StructuringClient client = client(turns -> {
            calls.incrementAndGet();
            return "[1, 2, 3]";
        });

        StructuringOutcome outcome = client.structure("CS 136", CODES);

        assertEquals(2, calls.get());
        assertInstanceOf(StructuringOutcome.DecodeError.class, outcome);
        assertEquals(List.of(StructuringOutcome.INVALID_JSON), client.structureWithModel("CS 136", CODES).constraints());
    }

    @Test
    void requestCarriesSortedCodesAndWorkedExamples() {
        List<List<ChatTurn>> requests = new ArrayList<>();
        StructuringClient client = client(turns -> {
            requests.add(turns);
            return "{\"groups\":[],\"confidence\":0.3}";
        });

        client.structure("Consent of instructor", CODES);

        List<ChatTurn> turns = requests.get(0);
        assertEquals(Role.SYSTEM, turns.get(0).role());
        assertEquals(2 + 2 * StructuringPrompts.EXAMPLES.size(), turns.size());
        assertTrue(turns.get(turns.size() - 1).content().contains("CS135, CS136, MATH135"));
    }

    @Test
    void retryDelayDoublesPerAttempt() {
        Duration base = Duration.ofMillis(1500);
        assertEquals(1500, StructuringClient.retryDelay(base, 1));
        assertEquals(3000, StructuringClient.retryDelay(base, 2));
        assertEquals(6000, StructuringClient.retryDelay(base, 3));
        assertEquals(0, StructuringClient.retryDelay(Duration.ZERO, 3));
    }

    @Test
    void codesHintIsTruncated() {
        assertEquals("A, B", StructuringPrompts.codesHint(Set.of("C", "B", "A"), 4));
    }
}
