package com.fdsl.flow.plan;

import java.util.List;
import java.util.Locale;

/**
 * One step of an {@link ExecutionPlan}.
 *
 * @param index         position in the plan
 * @param kind          what the step does
 * @param entity        entity the step materializes
 * @param source        source called by a FETCH or RECEIVE step, otherwise null
 * @param dependsOn     indices of earlier steps this one reads
 * @param fanOut        list handling of an EVALUATE step
 * @param fanOutParent  the list parent iterated or bound, null when
 *                      {@code fanOut} is NONE
 * @param joinKeys      lookup keys passed to a FETCH step
 * @param payloadEntity entity sent as the request body of a write FETCH step
 */
public record PlanStep(int index, StepKind kind, String entity, String source, List<Integer> dependsOn,
        FanOut fanOut, String fanOutParent, List<JoinKey> joinKeys, String payloadEntity) {

    public PlanStep {
        dependsOn = List.copyOf(dependsOn);
        joinKeys = List.copyOf(joinKeys);
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase(Locale.ROOT) + " " + entity;
    }
}
