package com.fdsl.flow.util;

import com.fdsl.flow.api.ExecutionListener;
import com.fdsl.flow.plan.ExecutionPlan;
import com.fdsl.flow.plan.PlanStep;

import java.util.Arrays;

/**
 * Fans {@link ExecutionListener} callbacks out to several listeners.
 * Registration is copy-on-write; iteration allocates nothing.
 */
public class CompositeExecutionListener implements ExecutionListener {
    private volatile ExecutionListener[] listeners = new ExecutionListener[0];

    public synchronized CompositeExecutionListener add(ExecutionListener listener) {
        ExecutionListener[] old = listeners;
        ExecutionListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
        return this;
    }

    @Override
    public void onPlanStart(ExecutionPlan plan) {
        for (ExecutionListener l : listeners)
            l.onPlanStart(plan);
    }

    @Override
    public void onStepCompleted(ExecutionPlan plan, PlanStep step, long durationNanos) {
        for (ExecutionListener l : listeners)
            l.onStepCompleted(plan, step, durationNanos);
    }

    @Override
    public void onStepError(ExecutionPlan plan, PlanStep step, Throwable error) {
        for (ExecutionListener l : listeners)
            l.onStepError(plan, step, error);
    }

    @Override
    public void onPlanEnd(ExecutionPlan plan, boolean success) {
        for (ExecutionListener l : listeners)
            l.onPlanEnd(plan, success);
    }
}
