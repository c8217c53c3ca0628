package com.fdsl.flow.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fdsl.flow.TestModels;
import com.fdsl.flow.api.Context;
import com.fdsl.flow.api.EvaluationException;
import com.fdsl.flow.api.ExecutionListener;
import com.fdsl.flow.api.Value;
import com.fdsl.flow.graph.DependencyGraph;
import com.fdsl.flow.graph.GraphBuilder;
import com.fdsl.flow.io.ModelDefinition;
import com.fdsl.flow.io.ModelJson;
import com.fdsl.flow.plan.ExecutionPlan;
import com.fdsl.flow.plan.ExecutionPlanner;
import com.fdsl.flow.plan.PlanMode;
import com.fdsl.flow.plan.PlanStep;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static com.fdsl.flow.expr.ExprAst.*;
import static org.junit.Assert.*;

public class PlanExecutorTest {
    private static final ObjectMapper JSON = ModelJson.mapper();

    private DependencyGraph doubled;
    private DependencyGraph orders;

    @Before
    public void setUp() {
        doubled = new GraphBuilder().build(TestModels.doubled());
        orders = new GraphBuilder().build(TestModels.orders());
    }

    private static JsonNode json(String text) {
        try {
            return JSON.readTree(text);
        } catch (IOException e) {
            throw new IllegalArgumentException(e);
        }
    }

    @Test
    public void testMutationCallsOneWriteSource() {
        DependencyGraph g = new GraphBuilder().build(TestModels.productOrders());
        ExecutionPlan plan = new ExecutionPlanner(g).plan("OrderView", PlanMode.MUTATION);
        Context ctx = new Context(g.builtins());
        ctx.put("NewOrder", Value.of(Map.of("productId", 7, "qty", 3)));
        List<String> called = new ArrayList<>();

        Value view = new PlanExecutor(g).execute(plan, ctx, req -> {
            called.add(req.source().name());
            return req.source().name().equals("CreateOrder")
                    ? json("{\"id\": 1, \"productId\": 7, \"qty\": 3}")
                    : json("{\"id\": 7, \"price\": 2.5}");
        });

        assertEquals(List.of("CreateOrder", "GetProduct"), called);
        assertEquals(Value.of(7.5), view.get("amount", Value.NULL));
    }

    @Test
    public void testSimpleDerivation() {
        ExecutionPlan plan = ExecutionPlanner.plan(doubled, "Doubled");
        Context ctx = new Context(doubled.builtins());

        Value result = new PlanExecutor(doubled).execute(plan, ctx, req -> json("{\"x\": 21}"));

        assertEquals(Value.of(42), result.get("y", Value.NULL));
        assertEquals(Value.of(21), ctx.get("Raw").get("x", Value.NULL));
        assertEquals(result, ctx.get("Doubled"));
    }

    @Test
    public void testIdempotentExecution() {
        ExecutionPlan plan = ExecutionPlanner.plan(doubled, "Doubled");
        PlanExecutor executor = new PlanExecutor(doubled);
        AtomicInteger calls = new AtomicInteger();
        FetchFunction fetch = req -> {
            calls.incrementAndGet();
            return json("{\"x\": 5}");
        };

        Value first = executor.execute(plan, Context.create(), fetch);
        Value second = executor.execute(plan, Context.create(), fetch);

        assertEquals(first, second);
        assertEquals(2, calls.get());
    }

    @Test
    public void testJoinAndSourceParams() {
        ExecutionPlan plan = ExecutionPlanner.plan(orders, "OrderView");
        Context ctx = Context.create().putParam("orderId", Value.of(7));
        List<String> calls = new ArrayList<>();

        Value view = new PlanExecutor(orders).execute(plan, ctx, req -> {
            calls.add(req.source().name());
            if (req.source().name().equals("GetOrder")) {
                assertEquals(Value.of(7), req.param("orderId"));
                return json("{\"id\": 7, \"userId\": 3, \"total\": 12.5}");
            }
            assertEquals("User", req.entity());
            assertEquals(Value.of(3), req.param("userId"));
            assertNull(req.payload());
            return json("{\"id\": 3, \"name\": \"ann\"}");
        });

        assertEquals(List.of("GetOrder", "GetUser"), calls);
        assertEquals(Value.of(7), view.get("orderId", Value.NULL));
        assertEquals(Value.of("ann"), view.get("customer", Value.NULL));
        assertEquals(Value.of(12.5), view.get("total", Value.NULL));
    }

    @Test
    public void testMutationSendsPayload() {
        ExecutionPlan plan = new ExecutionPlanner(orders).plan("Order", PlanMode.MUTATION);
        Context ctx = Context.create()
                .put("NewOrder", Value.fromJson(json("{\"userId\": 3, \"total\": 5}")));

        Value created = new PlanExecutor(orders).execute(plan, ctx, req -> {
            assertEquals("CreateOrder", req.source().name());
            assertEquals(3, req.payload().get("userId").asInt());
            return json("{\"id\": 99, \"userId\": 3, \"total\": 5}");
        });

        assertEquals(Value.of(99), created.get("id", Value.NULL));
    }

    @Test
    public void testPerItemFanOut() {
        ExecutionPlan plan = ExecutionPlanner.plan(orders, "LineTotal");
        Value totals = new PlanExecutor(orders).execute(plan, Context.create(), req -> json(
                "[{\"sku\": \"a\", \"qty\": 2, \"price\": 1.5}, {\"sku\": \"b\", \"qty\": 1, \"price\": 4}]"));

        assertEquals(Value.Kind.LIST, totals.kind());
        assertEquals(2, totals.asList().size());
        assertEquals(Value.of("a"), totals.asList().get(0).get("sku", Value.NULL));
        assertEquals(Value.of(3.0), totals.asList().get(0).get("amount", Value.NULL));
        assertEquals(Value.of(4.0), totals.asList().get(1).get("amount", Value.NULL));
    }

    @Test
    public void testWholeListAggregation() {
        ExecutionPlan plan = ExecutionPlanner.plan(orders, "OrderSummary");
        Value summary = new PlanExecutor(orders).execute(plan, Context.create(), req -> json(
                "[{\"sku\": \"a\", \"qty\": 2, \"price\": 1.5}, {\"sku\": \"b\", \"qty\": 1, \"price\": 4}]"));

        assertEquals(Value.of(2), summary.get("count", Value.NULL));
        assertEquals(Value.of(7.0), summary.get("total", Value.NULL));
    }

    @Test
    public void testEmptyListAggregation() {
        ExecutionPlan plan = ExecutionPlanner.plan(orders, "OrderSummary");
        Value summary = new PlanExecutor(orders).execute(plan, Context.create(), req -> json("[]"));

        assertEquals(Value.of(0), summary.get("count", Value.NULL));
        assertEquals(Value.of(0), summary.get("total", Value.NULL));
    }

    @Test
    public void testFetchFailureCommitsNothing() {
        ExecutionPlan plan = ExecutionPlanner.plan(doubled, "Doubled");
        Context ctx = Context.create();

        try {
            new PlanExecutor(doubled).execute(plan, ctx, req -> {
                throw new IOException("connection refused");
            });
            fail("Expected PlanExecutionException");
        } catch (PlanExecutionException e) {
            assertEquals("Raw", e.entity());
            assertEquals(0, e.stepIndex());
            assertTrue(e.getCause() instanceof FetchFailureException);
            assertEquals("RawApi", ((FetchFailureException) e.getCause()).source());
        }
        assertFalse(ctx.contains("Raw"));
        assertFalse(ctx.contains("Doubled"));
    }

    @Test
    public void testMissingFieldInResponse() {
        ExecutionPlan plan = ExecutionPlanner.plan(doubled, "Doubled");
        try {
            new PlanExecutor(doubled).execute(plan, Context.create(), req -> json("{}"));
            fail("Expected PlanExecutionException");
        } catch (PlanExecutionException e) {
            EvaluationException cause = (EvaluationException) e.getCause();
            assertEquals(EvaluationException.Kind.MISSING_FIELD, cause.getKind());
            assertEquals("Raw.x", cause.getPath());
        }
    }

    @Test
    public void testDivisionByZero() {
        ModelDefinition def = TestModels.model("ratio")
                .entity("Pair").attr("a", "integer").attr("b", "integer")
                .entity("Ratio").parent("Pair").attr("r", "number", binary("/", ref("Pair.a"), ref("Pair.b")))
                .build();
        DependencyGraph g = new GraphBuilder().build(def);
        Context ctx = Context.create().put("Pair", Value.fromJson(json("{\"a\": 1, \"b\": 0}")));

        try {
            new PlanExecutor(g).execute(ExecutionPlanner.plan(g, "Ratio"), ctx, req -> null);
            fail("Expected PlanExecutionException");
        } catch (PlanExecutionException e) {
            assertEquals(1, e.stepIndex());
            EvaluationException cause = (EvaluationException) e.getCause();
            assertEquals(EvaluationException.Kind.DIVISION_BY_ZERO, cause.getKind());
            assertEquals("Ratio.r", cause.getPath());
        }
        assertFalse(ctx.contains("Ratio"));
    }

    @Test
    public void testMissingInput() {
        DependencyGraph g = new GraphBuilder().build(TestModels.echo());
        try {
            new PlanExecutor(g).execute(ExecutionPlanner.plan(g, "Processed"), Context.create(), req -> null);
            fail("Expected PlanExecutionException");
        } catch (PlanExecutionException e) {
            EvaluationException cause = (EvaluationException) e.getCause();
            assertEquals(EvaluationException.Kind.UNRESOLVED_REFERENCE, cause.getKind());
            assertEquals("ClientMsg", cause.getPath());
        }
    }

    @Test
    public void testListenerCallbacks() {
        List<String> events = new ArrayList<>();
        PlanExecutor executor = new PlanExecutor(doubled);
        executor.setListener(new ExecutionListener() {
            @Override
            public void onPlanStart(ExecutionPlan plan) {
                events.add("start " + plan.target());
            }

            @Override
            public void onStepCompleted(ExecutionPlan plan, PlanStep step, long durationNanos) {
                events.add("done " + step);
            }

            @Override
            public void onStepError(ExecutionPlan plan, PlanStep step, Throwable error) {
                events.add("error " + step);
            }

            @Override
            public void onPlanEnd(ExecutionPlan plan, boolean success) {
                events.add("end " + success);
            }
        });

        ExecutionPlan plan = ExecutionPlanner.plan(doubled, "Doubled");
        executor.execute(plan, Context.create(), req -> json("{\"x\": 1}"));
        assertEquals(List.of("start Doubled", "done fetch Raw", "done evaluate Doubled", "end true"), events);

        events.clear();
        try {
            executor.execute(plan, Context.create(), req -> json("\"oops\""));
            fail("Expected PlanExecutionException");
        } catch (PlanExecutionException expected) {
            assertEquals(List.of("start Doubled", "error fetch Raw", "end false"), events);
        }
    }
}
