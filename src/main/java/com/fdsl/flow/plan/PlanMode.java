package com.fdsl.flow.plan;

/**
 * Which source edges a plan may follow. READ plans never touch write sources;
 * MUTATION plans populate entities from a write source's response when one is
 * bound.
 */
public enum PlanMode {
    READ, MUTATION
}
