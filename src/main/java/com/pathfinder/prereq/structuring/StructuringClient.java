package com.pathfinder.prereq.structuring;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.pathfinder.prereq.config.PrereqProperties;
import com.pathfinder.prereq.domain.DomainModels.ParseResult;
import com.pathfinder.prereq.domain.DomainModels.PrereqClause;
import com.pathfinder.prereq.domain.DomainModels.PrereqExpression;
import com.pathfinder.prereq.domain.DomainModels.PrereqItem;
import com.pathfinder.prereq.structuring.StructuringModels.ChatTurn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.*;

/**
 * Asks the text-generation service to structure prerequisite prose and cleans up what comes back.
 * <p>
 * Transient request failures are retried with a doubling delay, bounded by the attempt limit. A response that is not
 * JSON gets one more request with a stricter instruction; if that also fails to decode the outcome
 * is a {@link StructuringOutcome.DecodeError}. Nothing thrown by the gateway escapes this class.
 * <p>
 * Decoded output is sanitized against the caller's code whitelist: nested clause arrays are
 * flattened, unknown codes dropped, empty clauses removed and a missing confidence becomes 0.5.
 */
@Service
public class StructuringClient {
    private static final Logger log = LoggerFactory.getLogger(StructuringClient.class);
    private static final double DEFAULT_CONFIDENCE = 0.5;

    /** Tolerates trailing commas, comments and single quotes. */
    private static final ObjectMapper LENIENT_MAPPER = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
            .build()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final CompletionGateway gateway;
    private final PrereqProperties.Structuring settings;

    public StructuringClient(CompletionGateway gateway, PrereqProperties properties) {
        this.gateway = gateway;
        this.settings = properties.structuring();
    }

    public StructuringOutcome structure(String rawText, Collection<String> knownCodes) {
        Set<String> whitelist = whitelist(knownCodes);
        String userMessage = StructuringPrompts.userMessage(rawText, StructuringPrompts.codesHint(whitelist, settings.knownCodesLimit()));
        try {
            JsonNode body = decode(callWithRetry(StructuringPrompts.conversation(userMessage)));
            if (body == null) {
                log.info("Structuring response was not JSON, retrying with strict instruction");
                body = decode(callWithRetry(StructuringPrompts.strictConversation(userMessage)));
            }
            if (body == null) {
                return new StructuringOutcome.DecodeError("Response is not a JSON object");
            }
            return new StructuringOutcome.Parsed(sanitize(body, whitelist));
        } catch (CompletionUnavailableException e) {
            log.warn("Structuring service unavailable: {}", e.getMessage());
            return new StructuringOutcome.ServiceError(e.getMessage());
        }
    }

    /** Same as {@link #structure} but collapses every failure into its zero-confidence result. */
    public ParseResult structureWithModel(String rawText, Collection<String> knownCodes) {
        return structure(rawText, knownCodes).result();
    }

    private String callWithRetry(List<ChatTurn> conversation) {
        CompletionUnavailableException last = null;
        for (int attempt = 1; attempt <= settings.maxAttempts(); attempt++) {
            try {
                return gateway.complete(conversation);
            } catch (CompletionUnavailableException e) {
                last = e;
                if (attempt < settings.maxAttempts()) {
                    long delay = retryDelay(settings.backoff(), attempt);
                    log.warn("Structuring attempt {}/{} failed ({}), retrying in {}ms",
                            attempt, settings.maxAttempts(), e.getMessage(), delay);
                    pause(delay);
                }
            }
        }
        throw new CompletionUnavailableException("Gave up after " + settings.maxAttempts() + " attempts: " + last.getMessage(), last);
    }

    /** {@code base * 2^(attempt - 1)}: the wait after the given failed attempt. */
    static long retryDelay(Duration base, int attempt) {
        return base.toMillis() << Math.min(attempt - 1, 16);
    }

    private JsonNode decode(String content) {
        if (content == null || content.isBlank()) return null;
        try {
            JsonNode node = LENIENT_MAPPER.readTree(extractJson(content));
            return node != null && node.isObject() ? node : null;
        } catch (JsonProcessingException e) {
            log.debug("Undecodable structuring response: {}", e.getOriginalMessage());
            return null;
        }
    }

    ParseResult sanitize(JsonNode body, Set<String> whitelist) {
        List<PrereqClause> clauses = new ArrayList<>();
        JsonNode groups = body.path("groups");
        for (JsonNode clause : groups.isArray() ? groups : LENIENT_MAPPER.createArrayNode()) {
            List<PrereqItem> items = new ArrayList<>();
            for (JsonNode item : flatten(clause)) {
                if (!item.isObject()) continue;
                String code = item.path("code").asText("").strip().toUpperCase(Locale.ROOT);
                if (!whitelist.contains(code)) continue;
                items.add(PrereqItem.of(code, grade(item.get("min_grade"))));
            }
            if (!items.isEmpty()) clauses.add(new PrereqClause(items));
        }

        List<String> constraints = new ArrayList<>();
        body.path("constraints").forEach(c -> constraints.add(c.isTextual() ? c.asText() : c.toString()));

        JsonNode confidence = body.get("confidence");
        double value = confidence != null && confidence.isNumber() ? confidence.asDouble() : DEFAULT_CONFIDENCE;
        return new ParseResult(new PrereqExpression(clauses), constraints, value);
    }

    /** Nested arrays inside a clause are unwrapped in document order; a bare object is a one-item clause. */
    static List<JsonNode> flatten(JsonNode clause) {
        List<JsonNode> flat = new ArrayList<>();
        Deque<JsonNode> pending = new ArrayDeque<>();
        pending.add(clause);
        while (!pending.isEmpty()) {
            JsonNode node = pending.pollFirst();
            if (node.isArray()) {
                List<JsonNode> children = new ArrayList<>();
                node.forEach(children::add);
                for (int i = children.size() - 1; i >= 0; i--) pending.addFirst(children.get(i));
            } else {
                flat.add(node);
            }
        }
        return flat;
    }

    private static Integer grade(JsonNode node) {
        if (node == null || node.isNull()) return null;
        if (node.isNumber()) return node.asInt();
        if (node.isTextual()) {
            try {
                return Integer.parseInt(node.asText().strip().replace("%", ""));
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    /** Strips markdown fences or surrounding prose around the JSON object. */
    static String extractJson(String response) {
        int fenced = response.indexOf("```");
        if (fenced >= 0) {
            int newline = response.indexOf('\n', fenced + 3);
            int start = newline >= 0 ? newline + 1 : fenced + 3;
            int end = response.indexOf("```", start);
            if (end > start) return response.substring(start, end).trim();
        }
        int braceStart = response.indexOf('{');
        int braceEnd = response.lastIndexOf('}');
        if (braceStart >= 0 && braceEnd > braceStart) {
            return response.substring(braceStart, braceEnd + 1);
        }
        return response.trim();
    }

    private static Set<String> whitelist(Collection<String> knownCodes) {
        Set<String> codes = new HashSet<>();
        if (knownCodes != null) {
            knownCodes.stream().filter(Objects::nonNull).map(c -> c.strip().toUpperCase(Locale.ROOT)).forEach(codes::add);
        }
        return codes;
    }

    private static void pause(long millis) {
        if (millis <= 0) return;
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CompletionUnavailableException("Interrupted while waiting to retry", e);
        }
    }
}
