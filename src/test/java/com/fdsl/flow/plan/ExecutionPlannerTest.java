package com.fdsl.flow.plan;

import com.fdsl.flow.TestModels;
import com.fdsl.flow.graph.DependencyGraph;
import com.fdsl.flow.graph.GraphBuilder;
import com.fdsl.flow.graph.ModelBuildException;
import com.fdsl.flow.io.ModelDefinition;
import org.junit.Before;
import org.junit.Test;

import java.util.List;

import static com.fdsl.flow.expr.ExprAst.*;
import static org.junit.Assert.*;

public class ExecutionPlannerTest {
    private DependencyGraph orders;

    @Before
    public void setUp() {
        orders = new GraphBuilder().build(TestModels.orders());
    }

    @Test
    public void testSimpleDerivation() {
        DependencyGraph g = new GraphBuilder().build(TestModels.doubled());
        ExecutionPlan plan = ExecutionPlanner.plan(g, "Doubled");

        assertEquals("[fetch Raw, evaluate Doubled]", plan.toString());
        PlanStep fetch = plan.step(0);
        assertEquals(StepKind.FETCH, fetch.kind());
        assertEquals("RawApi", fetch.source());
        assertTrue(fetch.dependsOn().isEmpty());
        assertEquals(List.of(0), plan.step(1).dependsOn());
        assertEquals(FanOut.NONE, plan.step(1).fanOut());
    }

    @Test
    public void testReadPlanNeverCallsWriteSource() {
        ExecutionPlan plan = new ExecutionPlanner(orders).plan("OrderView");

        assertEquals("[fetch Order, fetch User, evaluate OrderView]", plan.toString());
        assertEquals("GetOrder", plan.stepFor("Order").source());
        for (PlanStep s : plan.steps())
            assertNotEquals("CreateOrder", s.source());
        assertFalse(plan.entities().contains("NewOrder"));
    }

    @Test
    public void testMutationPlanUsesWriteResponse() {
        ExecutionPlan plan = new ExecutionPlanner(orders).plan("Order", PlanMode.MUTATION);

        assertEquals("[input NewOrder, fetch Order]", plan.toString());
        PlanStep write = plan.stepFor("Order");
        assertEquals("CreateOrder", write.source());
        assertEquals("NewOrder", write.payloadEntity());
        assertEquals(List.of(0), write.dependsOn());
    }

    @Test
    public void testMutationReadsOtherParents() {
        // Order is write-only, Product is both read and written
        DependencyGraph g = new GraphBuilder().build(TestModels.productOrders());
        ExecutionPlan plan = new ExecutionPlanner(g).plan("OrderView", PlanMode.MUTATION);

        assertEquals("[input NewOrder, fetch Order, fetch Product, evaluate OrderView]", plan.toString());
        assertEquals("CreateOrder", plan.stepFor("Order").source());
        assertEquals("GetProduct", plan.stepFor("Product").source());
        assertEquals(List.of(new JoinKey("Order", "productId")), plan.stepFor("Product").joinKeys());
    }

    @Test
    public void testMutationTargetWritesEvenWhenReadable() {
        DependencyGraph g = new GraphBuilder().build(TestModels.productOrders());

        assertEquals("UpdateProduct", new ExecutionPlanner(g).plan("Product", PlanMode.MUTATION)
                .stepFor("Product").source());
        assertEquals("GetProduct", new ExecutionPlanner(g).plan("Product").stepFor("Product").source());
    }

    @Test
    public void testMutationWithTwoWriteOnlyParentsFails() {
        ModelDefinition def = TestModels.model("twoWrites")
                .entity("Order").pk("id", "integer")
                .entity("Receipt").attr("orderId", "integer")
                .entity("Confirmation").parent("Order").parent("Receipt")
                .attr("orderId", "integer", ref("Order.id"))
                .done()
                .rest("CreateOrder", "POST", "Order")
                .rest("SubmitReceipt", "POST", "Receipt")
                .build();
        DependencyGraph g = new GraphBuilder().build(def);

        try {
            new ExecutionPlanner(g).plan("Confirmation", PlanMode.MUTATION);
            fail("Expected UNRESOLVED_SOURCE_BINDING");
        } catch (ModelBuildException e) {
            assertEquals(ModelBuildException.Reason.UNRESOLVED_SOURCE_BINDING, e.reason());
            assertEquals(List.of("Receipt", "SubmitReceipt"), e.subjects());
        }
    }

    @Test
    public void testReadOfWriteOnlyEntityFails() {
        ModelDefinition def = TestModels.model("writeOnly")
                .entity("Receipt").attr("id", "integer")
                .done()
                .rest("Submit", "POST", "Receipt")
                .build();
        DependencyGraph g = new GraphBuilder().build(def);

        try {
            ExecutionPlanner.plan(g, "Receipt");
            fail("Expected UNRESOLVED_SOURCE_BINDING");
        } catch (ModelBuildException e) {
            assertEquals(ModelBuildException.Reason.UNRESOLVED_SOURCE_BINDING, e.reason());
        }
        assertEquals("[fetch Receipt]", new ExecutionPlanner(g).plan("Receipt", PlanMode.MUTATION).toString());
    }

    @Test
    public void testInferredJoinKey() {
        ExecutionPlan plan = new ExecutionPlanner(orders).plan("OrderView");

        PlanStep user = plan.stepFor("User");
        assertEquals(List.of(new JoinKey("Order", "userId")), user.joinKeys());
        assertEquals(List.of(plan.stepFor("Order").index()), user.dependsOn());
    }

    @Test
    public void testExplicitJoinKeyWins() {
        ModelDefinition def = TestModels.model("explicit")
                .entity("Trade").attr("bookId", "integer").attr("ownerId", "integer")
                .entity("Owner").pk("id", "integer").attr("name", "string")
                .entity("TradeView").parent("Trade").parent("Owner", "ownerId")
                .attr("owner", "string", ref("Owner.name"))
                .done()
                .rest("GetTrade", "GET", "Trade")
                .rest("GetOwner", "GET", "Owner")
                .build();
        DependencyGraph g = new GraphBuilder().build(def);

        PlanStep owner = ExecutionPlanner.plan(g, "TradeView").stepFor("Owner");
        assertEquals(List.of(new JoinKey("Trade", "ownerId")), owner.joinKeys());
    }

    @Test
    public void testMissingJoinKey() {
        ModelDefinition def = TestModels.model("nokey")
                .entity("Trade").attr("qty", "integer")
                .entity("Desk").attr("name", "string")
                .entity("TradeView").parent("Trade").parent("Desk")
                .attr("desk", "string", ref("Desk.name"))
                .done()
                .rest("GetTrade", "GET", "Trade")
                .rest("GetDesk", "GET", "Desk")
                .build();
        DependencyGraph g = new GraphBuilder().build(def);

        try {
            ExecutionPlanner.plan(g, "TradeView");
            fail("Expected AMBIGUOUS_PARENT_KEY");
        } catch (ModelBuildException e) {
            assertEquals(ModelBuildException.Reason.AMBIGUOUS_PARENT_KEY, e.reason());
            assertEquals(List.of("TradeView", "Desk"), e.subjects());
        }
    }

    @Test
    public void testParameterizedSourceSkipsInference() {
        ModelDefinition def = TestModels.model("param")
                .entity("Trade").attr("qty", "integer").attr("deskCode", "string")
                .entity("Desk").attr("name", "string")
                .entity("TradeView").parent("Trade").parent("Desk")
                .attr("desk", "string", ref("Desk.name"))
                .done()
                .rest("GetTrade", "GET", "Trade")
                .rest("GetDesk", "GET", "Desk")
                .sourceParam("code", "string", ref("Trade.deskCode"))
                .build();
        DependencyGraph g = new GraphBuilder().build(def);

        ExecutionPlan plan = ExecutionPlanner.plan(g, "TradeView");
        assertEquals("[fetch Trade, fetch Desk, evaluate TradeView]", plan.toString());
        assertTrue(plan.stepFor("Desk").joinKeys().isEmpty());
        // the parameter expression orders Trade first
        assertEquals(List.of(0), plan.stepFor("Desk").dependsOn());
    }

    @Test
    public void testFanOutModes() {
        ExecutionPlanner planner = new ExecutionPlanner(orders);

        PlanStep perItem = planner.plan("LineTotal").stepFor("LineTotal");
        assertEquals(FanOut.PER_ITEM, perItem.fanOut());
        assertEquals("LineItem", perItem.fanOutParent());

        PlanStep whole = planner.plan("OrderSummary").stepFor("OrderSummary");
        assertEquals(FanOut.WHOLE_LIST, whole.fanOut());
        assertEquals("LineItem", whole.fanOutParent());
    }

    @Test
    public void testInputForUnsourcedEntity() {
        DependencyGraph g = new GraphBuilder().build(TestModels.echo());
        ExecutionPlan plan = ExecutionPlanner.plan(g, "Processed");

        assertEquals("[input ClientMsg, evaluate Processed]", plan.toString());
        assertEquals("[receive Tick, evaluate TickView]", ExecutionPlanner.plan(g, "TickView").toString());
    }

    @Test
    public void testDeclarationOrderBreaksTies() {
        // B and A are independent parents of C; B is declared first
        ModelDefinition def = TestModels.model("ties")
                .entity("B").attr("b", "integer")
                .entity("A").attr("a", "integer")
                .entity("C").parent("A").parent("B")
                .attr("sum", "integer", binary("+", ref("A.a"), ref("B.b")))
                .build();
        DependencyGraph g = new GraphBuilder().build(def);

        assertEquals("[input B, input A, evaluate C]", ExecutionPlanner.plan(g, "C").toString());
    }

    @Test
    public void testDeterminism() {
        String first = ExecutionPlanner.plan(orders, "OrderView").toString();
        for (int i = 0; i < 20; i++) {
            DependencyGraph rebuilt = new GraphBuilder().build(TestModels.orders());
            assertEquals(first, ExecutionPlanner.plan(rebuilt, "OrderView").toString());
        }
    }

    @Test
    public void testPlanCache() {
        ExecutionPlanner planner = new ExecutionPlanner(orders);
        ExecutionPlan a = planner.plan("OrderView");
        ExecutionPlan b = planner.plan("OrderView");

        assertSame(a, b);
        assertNotSame(a, planner.plan("Order", PlanMode.MUTATION));
        assertEquals(2, planner.cachedPlans());

        ExecutionPlanner uncached = new ExecutionPlanner(orders, false);
        uncached.plan("OrderView");
        assertEquals(0, uncached.cachedPlans());
    }

    @Test
    public void testUnknownTarget() {
        try {
            ExecutionPlanner.plan(orders, "Nope");
            fail("Expected UNKNOWN_ENTITY");
        } catch (ModelBuildException e) {
            assertEquals(ModelBuildException.Reason.UNKNOWN_ENTITY, e.reason());
        }
    }

    @Test
    public void testPlanContainsOnlyClosure() {
        ExecutionPlan plan = ExecutionPlanner.plan(orders, "OrderSummary");
        assertEquals(List.of("LineItem", "OrderSummary"), plan.entities());
    }
}
