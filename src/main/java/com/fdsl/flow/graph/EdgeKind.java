package com.fdsl.flow.graph;

/**
 * Classification of a graph edge. Source-to-entity kinds come from the
 * source's declared direction, never from the entity.
 */
public enum EdgeKind {
    /** Read or subscribe source to the entity it produces. */
    PROVIDES,
    /** Write source to the entity its response populates. */
    MUTATION_RESPONSE,
    /** Entity to the write or publish source it is sent to. */
    CONSUMES,
    /** Parent entity to composite child. */
    PARENT_OF,
    /** Entity to a source whose parameter expression reads it. */
    PARAMETER
}
