package com.fdsl.flow.chain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fdsl.flow.api.Context;
import com.fdsl.flow.api.Value;
import com.fdsl.flow.engine.FetchFunction;
import com.fdsl.flow.engine.PlanExecutor;
import com.fdsl.flow.graph.DependencyGraph;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import lombok.extern.log4j.Log4j2;

/**
 * Drives messages through a {@link DuplexChannel}.
 *
 * <p>
 * A client message is bound to the inbound chain's client entity (wrapped if
 * it is a wrapper), the inbound plan runs, and the terminal's egress value is
 * returned once per publish sink. An external message is remembered on the
 * session under the root entity its source feeds; when every sync source has
 * delivered at least once, the outbound plan runs over the latest values and
 * its result is returned for the client.
 *
 * <p>
 * Failures propagate as {@link com.fdsl.flow.engine.PlanExecutionException}
 * and affect only the current message.
 */
@Log4j2
public final class ChannelRunner {
    private final DependencyGraph graph;
    private final DuplexChannel channel;
    private final PlanExecutor executor;
    private final FetchFunction fetchFn;

    /** Payload bound for an external publish source. */
    public record SinkMessage(String source, Value payload) {
        public JsonNode payloadJson() {
            return payload.toJson();
        }
    }

    public ChannelRunner(DependencyGraph graph, DuplexChannel channel, PlanExecutor executor, FetchFunction fetchFn) {
        this.graph = graph;
        this.channel = channel;
        this.executor = executor;
        this.fetchFn = fetchFn;
    }

    public DuplexChannel channel() {
        return channel;
    }

    public List<SinkMessage> onClientMessage(ChannelSession session, Value raw) {
        return onClientMessage(session.newContext(graph.builtins()), raw);
    }

    /**
     * Runs the inbound plan in the given context, which afterwards holds every
     * entity of the plan.
     */
    public List<SinkMessage> onClientMessage(Context context, Value raw) {
        Chain in = channel.inbound();
        if (in == null)
            throw new IllegalStateException("Channel " + channel.name() + " accepts no client messages");
        context.put(in.channelEntity(), raw);
        Value payload = executor.execute(channel.inboundPlan(), context, fetchFn);
        List<SinkMessage> out = new ArrayList<>(in.sources().size());
        for (String sink : in.sources())
            out.add(new SinkMessage(sink, payload));
        log.debug("Channel {}: client message -> {}", channel.name(), in.sources());
        return out;
    }

    /**
     * @return the value to push to the client, or empty while other sync
     *         sources have not delivered yet
     */
    public Optional<Value> onExternalMessage(ChannelSession session, String source, Value raw) {
        Chain out = channel.outbound();
        if (out == null)
            throw new IllegalStateException("Channel " + channel.name() + " has no outbound chain");
        boolean matched = false;
        for (String root : out.roots()) {
            if (graph.provider(root).filter(s -> s.name().equals(source)).isPresent()) {
                session.receive(root, raw);
                matched = true;
            }
        }
        if (!matched)
            throw new IllegalArgumentException("Source " + source + " does not feed channel " + channel.name());
        if (!session.hasAll(out.roots())) {
            log.debug("Channel {}: waiting for sync sources {}", channel.name(), out.syncSources());
            return Optional.empty();
        }
        Context context = session.newContext(graph.builtins());
        return Optional.of(executor.execute(channel.outboundPlan(), context, fetchFn));
    }
}
