package com.fdsl.flow.util;

import com.fdsl.flow.TestModels;
import com.fdsl.flow.graph.DependencyGraph;
import com.fdsl.flow.graph.GraphBuilder;
import com.fdsl.flow.plan.ExecutionPlanner;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class GraphExplainTest {
    private DependencyGraph graph;

    @Before
    public void setUp() {
        graph = new GraphBuilder().build(TestModels.orders());
    }

    @Test
    public void testMermaid() {
        String mermaid = new GraphExplain(graph).toMermaid();

        assertTrue(mermaid.startsWith("graph TD;\n"));
        assertTrue(mermaid.contains("LineItem[\"LineItem[]\"];"));
        assertTrue(mermaid.contains("GetOrder -- \"provides\" --> Order;"));
        assertTrue(mermaid.contains("CreateOrder -- \"mutation_response\" --> Order;"));
        assertTrue(mermaid.contains("Order -- \"parent_of\" --> OrderView;"));
    }

    @Test
    public void testExplainEntity() {
        String text = new GraphExplain(graph).explainEntity("OrderView");

        assertTrue(text.startsWith("Entity: OrderView\n"));
        assertTrue(text.contains("Shape: composite"));
        assertTrue(text.contains("customer: string = <expr>"));
    }

    @Test
    public void testDumpTopology() {
        String dump = new GraphExplain(graph).dumpTopology();
        assertTrue(dump.startsWith("Graph orders ("));
        assertTrue(dump.contains("CreateOrder (WRITE)"));
    }

    @Test
    public void testExplainPlan() {
        String text = GraphExplain.explainPlan(ExecutionPlanner.plan(graph, "OrderView"));

        assertTrue(text.startsWith("Plan OrderView (READ, 3 steps):"));
        assertTrue(text.contains("[1] fetch User <- GetUser after [0] by [Order.userId]"));

        String mermaid = GraphExplain.planToMermaid(ExecutionPlanner.plan(graph, "OrderView"));
        assertTrue(mermaid.contains("s0 --> s2;"));
    }
}
