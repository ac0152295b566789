package com.pathfinder.prereq.structuring;

import com.pathfinder.prereq.structuring.StructuringModels.ChatTurn;

import java.util.List;

/**
 * Black-box text-generation service: an ordered conversation in, raw completion text out.
 */
@FunctionalInterface
public interface CompletionGateway {
    /**
     * @throws CompletionUnavailableException on transport, authentication or timeout failures
     */
    String complete(List<ChatTurn> conversation);
}
