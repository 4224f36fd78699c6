package com.temporal.wcc.service.engine;

/**
 * The forest or a precedence chain is in a state that must never occur:
 * a cycle, a node with two outgoing forest edges, or a branching chain.
 *
 * Fatal. Never retried and never repaired in place; the forest needs a rebuild.
 */
public class StructuralViolationException extends ForestException {

    public StructuralViolationException(String message, String eventId) {
        super(message, eventId, "STRUCTURAL_VIOLATION");
    }
}
