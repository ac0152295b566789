package com.pathfinder.prereq.arbiter;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pathfinder.prereq.config.PrereqProperties;
import com.pathfinder.prereq.domain.DomainModels.ParseResult;
import com.pathfinder.prereq.domain.DomainModels.PrereqExpression;
import com.pathfinder.prereq.parser.HeuristicPrereqParser;
import com.pathfinder.prereq.structuring.StructuringClient;
import com.pathfinder.prereq.structuring.StructuringOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;

@Service
public class ParseArbiter {
    private static final Logger log = LoggerFactory.getLogger(ParseArbiter.class);

    static final double MIN_MODEL_CONFIDENCE = 0.1;
    static final double HEURISTIC_CONFIDENCE_FLOOR = 0.82;

    private final HeuristicPrereqParser heuristicParser;
    private final StructuringClient structuringClient;
    private final boolean structuringEnabled;

    public ParseArbiter(HeuristicPrereqParser heuristicParser, StructuringClient structuringClient, PrereqProperties properties) {
        this.heuristicParser = heuristicParser;
        this.structuringClient = structuringClient;
        this.structuringEnabled = properties.structuring().enabled();
    }

    public ParseResult resolve(String rawText, Collection<String> knownCodes) {
        return arbitrate(rawText, knownCodes, structuringEnabled);
    }

    /** Resolves and marks whether the result clears {@code threshold} for an automatic write. */
    public Resolution resolve(String rawText, Collection<String> knownCodes, double threshold) {
        return new Resolution(resolve(rawText, knownCodes), threshold);
    }

    /**
     * The heuristic always runs first. A model result wins when it has clauses and at least minimal
     * confidence; otherwise the heuristic clauses are used with their confidence floored at 0.82.
     * Whether the final confidence is high enough to write is the caller's decision.
     */
    public ParseResult arbitrate(String rawText, Collection<String> knownCodes, boolean useStructuring) {
        PrereqExpression heuristic = heuristicParser.parse(rawText);
        ParseResult candidate = useStructuring ? structured(rawText, knownCodes) : ParseResult.empty(0.0);

        if (candidate.expression().hasClauses() && candidate.confidence() >= MIN_MODEL_CONFIDENCE) {
            return candidate;
        }
        if (!heuristic.hasClauses()) {
            return new ParseResult(PrereqExpression.empty(), candidate.constraints(), candidate.confidence());
        }
        return new ParseResult(heuristic, candidate.constraints(), Math.max(candidate.confidence(), HEURISTIC_CONFIDENCE_FLOOR));
    }

    private ParseResult structured(String rawText, Collection<String> knownCodes) {
        StructuringOutcome outcome = structuringClient.structure(rawText, knownCodes);
        if (outcome instanceof StructuringOutcome.Parsed parsed) {
            return parsed.result();
        }
        if (outcome instanceof StructuringOutcome.ServiceError error) {
            log.debug("Falling back to heuristic parse, service unavailable: {}", error.reason());
        } else if (outcome instanceof StructuringOutcome.DecodeError error) {
            log.debug("Falling back to heuristic parse, undecodable response: {}", error.reason());
        }
        return outcome.result();
    }

    public record Resolution(ParseResult result, double threshold) {
        @JsonProperty("accepted")
        public boolean accepted() {
            return result.expression().hasClauses() && result.confidence() >= threshold;
        }
    }
}
