package com.fdsl.flow.engine;

/**
 * A plan aborted. The cause is a {@link FetchFailureException} or an
 * {@link com.fdsl.flow.api.EvaluationException}; no partial result was
 * committed.
 */
public class PlanExecutionException extends RuntimeException {
    private final String entity;
    private final int stepIndex;

    public PlanExecutionException(String entity, int stepIndex, Throwable cause) {
        super("Plan failed at step " + stepIndex + " (" + entity + "): " + cause.getMessage(), cause);
        this.entity = entity;
        this.stepIndex = stepIndex;
    }

    public String entity() {
        return entity;
    }

    public int stepIndex() {
        return stepIndex;
    }
}
