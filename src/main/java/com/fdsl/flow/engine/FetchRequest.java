package com.fdsl.flow.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fdsl.flow.api.Value;
import com.fdsl.flow.graph.SourceNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything the fetch collaborator needs for one source call.
 *
 * @param source  the source being called
 * @param entity  entity the response populates
 * @param params  endpoint parameters, join-key values and evaluated source
 *                parameters, in that order of precedence (later wins)
 * @param payload request body for a write source, egress-unwrapped; null for
 *                reads
 */
public record FetchRequest(SourceNode source, String entity, Map<String, Value> params, JsonNode payload) {

    public FetchRequest {
        params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public Value param(String name) {
        return params.get(name);
    }
}
