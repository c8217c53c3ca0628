package com.fdsl.flow.io;

import java.util.Locale;

/**
 * Data-flow direction of a source. The graph builder derives edge kinds from
 * this tag alone.
 */
public enum Direction {
    READ, WRITE, SUBSCRIBE, PUBLISH;

    public static Direction fromString(String s) {
        try {
            return Direction.valueOf(s.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown source direction: " + s, e);
        }
    }

    /**
     * Derives the direction of a REST source from its HTTP method, or returns
     * null when the method does not determine one.
     */
    public static Direction fromHttpMethod(String method) {
        if (method == null)
            return null;
        return switch (method.trim().toUpperCase(Locale.ROOT)) {
            case "GET", "HEAD" -> READ;
            case "POST", "PUT", "PATCH", "DELETE" -> WRITE;
            default -> null;
        };
    }

    /** True for directions whose source produces entity values. */
    public boolean produces() {
        return this == READ || this == SUBSCRIBE || this == WRITE;
    }

    /** True for directions whose source accepts an entity payload. */
    public boolean consumes() {
        return this == WRITE || this == PUBLISH;
    }
}
