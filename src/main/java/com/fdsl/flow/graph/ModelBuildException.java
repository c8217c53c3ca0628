package com.fdsl.flow.graph;

import java.util.List;

/**
 * Structural error found while building the dependency graph or an execution
 * plan. Always fatal to model loading; carries the offending entity and source
 * names.
 */
public class ModelBuildException extends RuntimeException {

    public enum Reason {
        CYCLE_DETECTED,
        AMBIGUOUS_EDGE_KIND,
        AMBIGUOUS_PARENT_KEY,
        UNRESOLVED_SOURCE_BINDING,
        UNRESOLVED_TERMINAL_ENTITY,
        UNKNOWN_ENTITY,
        DUPLICATE_NAME,
        INVALID_ENTITY_SHAPE,
        INVALID_WRAPPER,
        INVALID_EXPRESSION
    }

    private final Reason reason;
    private final List<String> subjects;

    public ModelBuildException(Reason reason, List<String> subjects, String message) {
        this(reason, subjects, message, null);
    }

    public ModelBuildException(Reason reason, List<String> subjects, String message, Throwable cause) {
        super(reason + " " + subjects + ": " + message, cause);
        this.reason = reason;
        this.subjects = List.copyOf(subjects);
    }

    public ModelBuildException(Reason reason, String subject, String message) {
        this(reason, List.of(subject), message, null);
    }

    public ModelBuildException(Reason reason, String subject, String message, Throwable cause) {
        this(reason, List.of(subject), message, cause);
    }

    public Reason reason() {
        return reason;
    }

    /** Names of the entities, sources or attributes involved. */
    public List<String> subjects() {
        return subjects;
    }
}
