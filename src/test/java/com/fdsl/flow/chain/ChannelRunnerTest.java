package com.fdsl.flow.chain;

import com.fdsl.flow.TestModels;
import com.fdsl.flow.api.Context;
import com.fdsl.flow.api.Value;
import com.fdsl.flow.engine.PlanExecutionException;
import com.fdsl.flow.engine.PlanExecutor;
import com.fdsl.flow.graph.DependencyGraph;
import com.fdsl.flow.graph.GraphBuilder;
import com.fdsl.flow.plan.ExecutionPlanner;
import org.junit.Before;
import org.junit.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.fdsl.flow.expr.ExprAst.*;
import static org.junit.Assert.*;

public class ChannelRunnerTest {
    private DependencyGraph graph;
    private ChannelRunner runner;

    @Before
    public void setUp() {
        graph = new GraphBuilder().build(TestModels.echo());
        DuplexChannel channel = DuplexChannel.of(graph, new ExecutionPlanner(graph),
                graph.endpoint("echo").get());
        runner = new ChannelRunner(graph, channel, new PlanExecutor(graph), req -> {
            throw new IllegalStateException("no source calls expected");
        });
    }

    @Test
    public void testDuplexChannelResolution() {
        DuplexChannel ch = runner.channel();

        assertEquals("echo", ch.name());
        assertTrue(ch.hasInbound());
        assertTrue(ch.hasOutbound());
        assertEquals("Processed", ch.inbound().terminal());
        assertEquals("[input ClientMsg, evaluate Processed]", ch.inboundPlan().toString());
        assertEquals("[receive Tick, evaluate TickView]", ch.outboundPlan().toString());
    }

    @Test
    public void testInboundClientMessage() {
        Context ctx = new Context(graph.builtins());
        List<ChannelRunner.SinkMessage> out = runner.onClientMessage(ctx, Value.of("hi"));

        assertEquals(Value.of(Map.of("value", "hi")), ctx.get("ClientMsg"));
        assertEquals(1, out.size());
        assertEquals("EchoOut", out.get(0).source());
        assertEquals(Value.of(Map.of("text", "HI")), out.get(0).payload());
        assertEquals("{\"text\":\"HI\"}", out.get(0).payloadJson().toString());
    }

    @Test
    public void testOutboundExternalMessage() {
        ChannelSession session = new ChannelSession();
        Optional<Value> pushed = runner.onExternalMessage(session, "EchoIn", Value.of(Map.of("text", "abc")));

        assertTrue(pushed.isPresent());
        assertEquals(Value.of("abc"), pushed.get().get("text", Value.NULL));
        assertEquals(Value.of(3), pushed.get().get("length", Value.NULL));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownExternalSource() {
        runner.onExternalMessage(new ChannelSession(), "Elsewhere", Value.NULL);
    }

    @Test
    public void testBadClientMessageAffectsOnlyThatMessage() {
        try {
            runner.onClientMessage(new ChannelSession(), Value.of(5));
            fail("Expected PlanExecutionException");
        } catch (PlanExecutionException expected) {
            assertEquals("ClientMsg", expected.entity());
        }
        List<ChannelRunner.SinkMessage> out = runner.onClientMessage(new ChannelSession(), Value.of("ok"));
        assertEquals(Value.of("OK"), out.get(0).payload().get("text", Value.NULL));
    }

    @Test
    public void testSyncSourcesWaitForAll() {
        DependencyGraph g = new GraphBuilder().build(TestModels.model("quotes")
                .entity("Price").source("PxFeed").attr("px", "number")
                .entity("Fx").source("FxFeed").attr("rate", "number")
                .entity("View").parent("Price").parent("Fx")
                .attr("local", "number", binary("*", ref("Price.px"), ref("Fx.rate")))
                .done()
                .ws("PxFeed", "subscribe", null)
                .ws("FxFeed", "subscribe", null)
                .wsEndpoint("quotes", null, "View")
                .build());
        DuplexChannel ch = DuplexChannel.of(g, new ExecutionPlanner(g), g.endpoint("quotes").get());
        ChannelRunner quotes = new ChannelRunner(g, ch, new PlanExecutor(g), req -> null);
        ChannelSession session = new ChannelSession();

        assertFalse(ch.hasInbound());
        assertEquals(Optional.empty(), quotes.onExternalMessage(session, "PxFeed", Value.of(Map.of("px", 10))));

        Optional<Value> first = quotes.onExternalMessage(session, "FxFeed", Value.of(Map.of("rate", 2)));
        assertEquals(Value.of(20.0), first.get().get("local", Value.NULL));

        // later updates recompute from the latest of each source
        Optional<Value> second = quotes.onExternalMessage(session, "PxFeed", Value.of(Map.of("px", 11)));
        assertEquals(Value.of(22.0), second.get().get("local", Value.NULL));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRestEndpointIsNotAChannel() {
        DependencyGraph g = new GraphBuilder().build(TestModels.doubled());
        DuplexChannel.of(g, new ExecutionPlanner(g), g.endpoint("getDoubled").get());
    }
}
