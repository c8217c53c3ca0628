package com.fdsl.flow.plan;

public enum StepKind {
    /** Pure schema entity, supplied by the caller in the seed context. */
    INPUT,
    /** Entity pushed by a subscribe source, supplied in the seed context. */
    RECEIVE,
    /** Call the fetch collaborator for a read or write source. */
    FETCH,
    /** Compute a composite entity from its parents. */
    EVALUATE
}
