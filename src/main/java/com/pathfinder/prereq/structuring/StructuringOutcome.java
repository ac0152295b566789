package com.pathfinder.prereq.structuring;

import com.pathfinder.prereq.domain.DomainModels.ParseResult;

/**
 * Result of one structuring attempt. Only {@link Parsed} carries a usable expression; the other
 * variants expose an empty zero-confidence result with a marker constraint.
 */
public sealed interface StructuringOutcome {
    String SERVICE_UNAVAILABLE = "service_unavailable";
    String INVALID_JSON = "invalid_json";

    ParseResult result();

    record Parsed(ParseResult result) implements StructuringOutcome {}

    record ServiceError(String reason) implements StructuringOutcome {
        @Override
        public ParseResult result() {
            return ParseResult.empty(0.0, SERVICE_UNAVAILABLE);
        }
    }

    record DecodeError(String reason) implements StructuringOutcome {
        @Override
        public ParseResult result() {
            return ParseResult.empty(0.0, INVALID_JSON);
        }
    }
}
