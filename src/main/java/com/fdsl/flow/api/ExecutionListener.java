package com.fdsl.flow.api;

import com.fdsl.flow.plan.ExecutionPlan;
import com.fdsl.flow.plan.PlanStep;

/**
 * Observability hook for plan execution.
 *
 * Callbacks run on the requesting thread, inside the plan loop, and must be
 * cheap. A listener shared between requests sees interleaved callbacks from
 * concurrent executions and has to be thread-safe.
 */
public interface ExecutionListener {

    void onPlanStart(ExecutionPlan plan);

    /**
     * @param durationNanos wall time of the step, including any fetch
     */
    void onStepCompleted(ExecutionPlan plan, PlanStep step, long durationNanos);

    void onStepError(ExecutionPlan plan, PlanStep step, Throwable error);

    /**
     * @param success false when a step failed and nothing was committed
     */
    void onPlanEnd(ExecutionPlan plan, boolean success);
}
