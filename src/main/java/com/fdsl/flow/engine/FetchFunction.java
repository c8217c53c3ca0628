package com.fdsl.flow.engine;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * The network-facing collaborator injected into {@link PlanExecutor}. May block;
 * retries and timeouts are its own concern.
 */
@FunctionalInterface
public interface FetchFunction {

    /**
     * @return the raw response payload; a Java null is treated as JSON null
     * @throws Exception any failure, surfaced as {@link FetchFailureException}
     */
    JsonNode fetch(FetchRequest request) throws Exception;
}
