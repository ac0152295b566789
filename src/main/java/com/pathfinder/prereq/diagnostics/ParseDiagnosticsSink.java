package com.pathfinder.prereq.diagnostics;

/**
 * Append-only record of parse decisions. Implementations must not throw: a failed write is
 * never a reason to stop processing courses.
 */
public interface ParseDiagnosticsSink {
    void record(ParseDiagnostic diagnostic);
}
