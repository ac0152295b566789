package com.pathfinder.prereq.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings for prerequisite parsing, reconciliation and graph reads.
 * Any section left unset falls back to its defaults.
 *
 * @param confidenceThreshold minimum confidence before a differing structure is written; 0 writes every parse
 */
@ConfigurationProperties(prefix = "prereq")
public record PrereqProperties(
        Double confidenceThreshold,
        Structuring structuring,
        Reconcile reconcile,
        Sync sync,
        Graph graph
) {
    public PrereqProperties {
        if (confidenceThreshold == null) confidenceThreshold = 0.75;
        if (confidenceThreshold < 0.0 || confidenceThreshold > 1.0) {
            throw new IllegalArgumentException("prereq.confidence-threshold must be within [0, 1]: " + confidenceThreshold);
        }
        if (structuring == null) structuring = new Structuring(false, null, 0, null, 0);
        if (reconcile == null) reconcile = new Reconcile(0, null);
        if (sync == null) sync = new Sync(0);
        if (graph == null) graph = new Graph(0, 0, 0, 0);
    }

    public static PrereqProperties defaults() {
        return new PrereqProperties(null, null, null, null, null);
    }

    /**
     * Text-generation service access.
     *
     * @param enabled         whether the arbiter consults the service at all
     * @param timeout         per-request limit; the request is abandoned when it elapses
     * @param maxAttempts     attempts for transient request failures
     * @param backoff         base delay, doubled after each failed attempt
     * @param knownCodesLimit characters of the code whitelist sent with each request
     */
    public record Structuring(boolean enabled, Duration timeout, int maxAttempts, Duration backoff, int knownCodesLimit) {
        public Structuring {
            if (timeout == null) timeout = Duration.ofSeconds(45);
            if (maxAttempts < 1) maxAttempts = 3;
            if (backoff == null) backoff = Duration.ofMillis(1500);
            if (knownCodesLimit < 1) knownCodesLimit = 4000;
        }
    }

    /**
     * @param maxAttempts attempts per row on lock or deadlock errors
     * @param backoff     base delay, multiplied by the attempt number
     */
    public record Reconcile(int maxAttempts, Duration backoff) {
        public Reconcile {
            if (maxAttempts < 1) maxAttempts = 5;
            if (backoff == null) backoff = Duration.ofMillis(250);
        }
    }

    /** @param concurrency courses reconciled in parallel; keep at or below the connection pool size */
    public record Sync(int concurrency) {
        public Sync {
            if (concurrency < 1) concurrency = 8;
        }
    }

    public record Graph(int defaultPrereqDepth, int maxPrereqDepth, int defaultFutureDepth, int maxFutureDepth) {
        public Graph {
            if (defaultPrereqDepth < 1) defaultPrereqDepth = 99;
            if (maxPrereqDepth < 1) maxPrereqDepth = 100;
            if (defaultFutureDepth < 1) defaultFutureDepth = 2;
            if (maxFutureDepth < 1) maxFutureDepth = 6;
        }
    }
}
