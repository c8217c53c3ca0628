package com.fdsl.flow.graph;

import com.fdsl.flow.expr.CompiledExpression;
import com.fdsl.flow.io.Direction;
import com.fdsl.flow.io.Transport;

import java.util.List;

/**
 * External endpoint descriptor. Owns no data; fetched and sent values live in
 * the per-request context.
 *
 * @param entity  entity exchanged with the source (may be null)
 * @param request payload entity of a write source (may be null)
 */
public record SourceNode(String name, Transport transport, Direction direction, String url, String method,
        String entity, String request, List<Param> params, String valueType) implements GraphNode {

    /** Parameter computed from an expression before each call. */
    public record Param(String name, CompiledExpression expression) {
    }

    public SourceNode {
        params = List.copyOf(params);
    }
}
