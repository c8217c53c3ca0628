package com.fdsl.flow.plan;

import java.util.List;

/**
 * Immutable, topologically ordered list of steps that materializes one target
 * entity. Every step appears after all the steps it depends on. Shared
 * read-only across requests.
 */
public record ExecutionPlan(String target, PlanMode mode, List<PlanStep> steps) {

    public ExecutionPlan {
        steps = List.copyOf(steps);
    }

    public int size() {
        return steps.size();
    }

    public PlanStep step(int index) {
        return steps.get(index);
    }

    /** The step that materializes {@code entity}, or null if it is not part of the plan. */
    public PlanStep stepFor(String entity) {
        for (PlanStep s : steps)
            if (s.entity().equals(entity))
                return s;
        return null;
    }

    public List<String> entities() {
        return steps.stream().map(PlanStep::entity).toList();
    }

    @Override
    public String toString() {
        return steps.toString();
    }
}
