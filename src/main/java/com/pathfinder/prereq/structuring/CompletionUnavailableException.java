package com.pathfinder.prereq.structuring;

public class CompletionUnavailableException extends RuntimeException {
    public CompletionUnavailableException(String message) {
        super(message);
    }

    public CompletionUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
