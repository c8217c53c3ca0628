package com.fdsl.flow.chain;

import com.fdsl.flow.graph.DependencyGraph;
import com.fdsl.flow.graph.EndpointBinding;
import com.fdsl.flow.plan.ExecutionPlan;
import com.fdsl.flow.plan.ExecutionPlanner;

/**
 * Both directions of one WebSocket endpoint, resolved and planned once at
 * startup. A side the endpoint does not declare is null.
 */
public record DuplexChannel(EndpointBinding endpoint, Chain inbound, ExecutionPlan inboundPlan, Chain outbound,
        ExecutionPlan outboundPlan) {

    public static DuplexChannel of(DependencyGraph graph, ExecutionPlanner planner, EndpointBinding endpoint) {
        if (!endpoint.isDuplex())
            throw new IllegalArgumentException(endpoint.name() + " is not a WebSocket endpoint");
        Chain in = null, out = null;
        ExecutionPlan inPlan = null, outPlan = null;
        if (endpoint.clientPublish() != null) {
            in = ChainResolver.resolveInbound(graph, endpoint.clientPublish());
            inPlan = planner.plan(in.terminal());
        }
        if (endpoint.clientSubscribe() != null) {
            out = ChainResolver.resolveOutbound(graph, endpoint.clientSubscribe());
            outPlan = planner.plan(out.terminal());
        }
        return new DuplexChannel(endpoint, in, inPlan, out, outPlan);
    }

    public String name() {
        return endpoint.name();
    }

    public boolean hasInbound() {
        return inbound != null;
    }

    public boolean hasOutbound() {
        return outbound != null;
    }
}
