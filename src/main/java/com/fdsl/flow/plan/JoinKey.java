package com.fdsl.flow.plan;

/**
 * Lookup key for fetching a secondary parent: the value of
 * {@code fromEntity.field} is passed to the fetch as parameter {@code field}.
 */
public record JoinKey(String fromEntity, String field) {
    @Override
    public String toString() {
        return fromEntity + "." + field;
    }
}
