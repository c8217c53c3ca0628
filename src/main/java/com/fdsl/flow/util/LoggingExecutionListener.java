package com.fdsl.flow.util;

import com.fdsl.flow.api.ExecutionListener;
import com.fdsl.flow.plan.ExecutionPlan;
import com.fdsl.flow.plan.PlanStep;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAccumulator;
import java.util.concurrent.atomic.LongAdder;

import lombok.extern.log4j.Log4j2;

/**
 * Tracks plan and step counts and step latency, and logs failures through a
 * throttled {@link ErrorRateLimiter}. Step timings are logged at trace level.
 * Thread-safe.
 */
@Log4j2
public final class LoggingExecutionListener implements ExecutionListener {
    private final ErrorRateLimiter errLimiter;
    private final LongAdder plans = new LongAdder();
    private final LongAdder failures = new LongAdder();
    private final LongAdder steps = new LongAdder();
    private final LongAdder totalStepNanos = new LongAdder();
    private final LongAccumulator maxStepNanos = new LongAccumulator(Long::max, 0);
    private final AtomicLong lastFailureStep = new AtomicLong(-1);

    public LoggingExecutionListener(long errorThrottleMillis) {
        this.errLimiter = new ErrorRateLimiter(log, errorThrottleMillis);
    }

    public LoggingExecutionListener() {
        this(1000);
    }

    @Override
    public void onPlanStart(ExecutionPlan plan) {
        plans.increment();
    }

    @Override
    public void onStepCompleted(ExecutionPlan plan, PlanStep step, long durationNanos) {
        steps.increment();
        totalStepNanos.add(durationNanos);
        maxStepNanos.accumulate(durationNanos);
        if (log.isTraceEnabled())
            log.trace("{} step {} ({}) took {} us", plan.target(), step.index(), step, durationNanos / 1000.0);
    }

    @Override
    public void onStepError(ExecutionPlan plan, PlanStep step, Throwable error) {
        failures.increment();
        lastFailureStep.set(step.index());
        errLimiter.log(String.format("Plan '%s' failed at step %d (%s): %s", plan.target(), step.index(), step,
                error.getMessage()), null);
    }

    @Override
    public void onPlanEnd(ExecutionPlan plan, boolean success) {
    }

    public long totalPlans() {
        return plans.sum();
    }

    public long totalFailures() {
        return failures.sum();
    }

    public long totalSteps() {
        return steps.sum();
    }

    public double avgStepMicros() {
        long n = steps.sum();
        return n > 0 ? totalStepNanos.sum() / 1000.0 / n : 0;
    }

    public double maxStepMicros() {
        return maxStepNanos.get() / 1000.0;
    }

    /** Index of the step that failed most recently, or -1. */
    public long lastFailureStep() {
        return lastFailureStep.get();
    }

    public String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-12s | %10s | %10s | %10s | %10s%n", "Metric", "Plans", "Failures", "Avg (us)",
                "Max (us)"));
        sb.append("----------------------------------------------------------------\n");
        sb.append(String.format("%-12s | %10d | %10d | %10.2f | %10.2f%n", "Steps", totalPlans(), totalFailures(),
                avgStepMicros(), maxStepMicros()));
        return sb.toString();
    }
}
