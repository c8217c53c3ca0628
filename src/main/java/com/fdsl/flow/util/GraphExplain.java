package com.fdsl.flow.util;

import com.fdsl.flow.graph.DependencyGraph;
import com.fdsl.flow.graph.Edge;
import com.fdsl.flow.graph.EntityNode;
import com.fdsl.flow.graph.SourceNode;
import com.fdsl.flow.plan.ExecutionPlan;
import com.fdsl.flow.plan.FanOut;
import com.fdsl.flow.plan.PlanStep;

import java.util.List;
import java.util.Locale;

/**
 * Diagnostic utility for inspecting a dependency graph and its plans.
 *
 * <p>
 * Generates human-readable text dumps and Mermaid flowcharts.
 *
 * <p>
 * <b>Usage:</b> Intended for debugging sessions, startup logging and
 * documentation. Do <b>not</b> use per request (allocates strings, iterates
 * collections).
 */
public final class GraphExplain {
    private final DependencyGraph graph;

    public GraphExplain(DependencyGraph graph) {
        this.graph = graph;
    }

    /**
     * Dumps a single entity: flags, attributes and its edges.
     */
    public String explainEntity(String name) {
        EntityNode e = graph.entity(name);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Entity: ").append(name).append('\n')
                .append("  Topo index: ").append(graph.topology().topoIndex(name)).append('\n')
                .append("  Shape: ").append(e.isComposite() ? "composite" : "schema")
                .append(e.many() ? ", many" : "").append(e.wrapper() ? ", wrapper" : "").append('\n');
        for (EntityNode.Attribute a : e.attributes()) {
            sb.append("  ").append(a.name()).append(": ").append(a.type());
            if (a.primaryKey())
                sb.append(" (pk)");
            if (a.isComputed())
                sb.append(" = <expr>");
            sb.append('\n');
        }
        appendEdges(sb, "  In: ", graph.incoming(name));
        appendEdges(sb, "  Out: ", graph.outgoing(name));
        return sb.toString();
    }

    /**
     * Dumps every node in topological order with its outgoing edges.
     */
    public String dumpTopology() {
        List<String> order = graph.topology().order();
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Graph ").append(graph.name()).append(" (").append(order.size()).append(" nodes):\n");
        for (int i = 0; i < order.size(); i++) {
            String n = order.get(i);
            sb.append("  [").append(i).append("] ").append(n);
            if (graph.node(n) instanceof SourceNode s)
                sb.append(" (").append(s.direction()).append(')');
            List<Edge> out = graph.outgoing(n);
            if (!out.isEmpty()) {
                sb.append(" -> ");
                for (int j = 0; j < out.size(); j++) {
                    sb.append(out.get(j).to()).append(' ').append(label(out.get(j)));
                    if (j < out.size() - 1)
                        sb.append(", ");
                }
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Generates a Mermaid flowchart of the whole graph; edges carry their kind.
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph TD;\n");

        // 1. Declare nodes in declaration order
        for (EntityNode e : graph.entities()) {
            sb.append("  ").append(sanitize(e.name())).append("[\"").append(e.name());
            if (e.wrapper())
                sb.append(" (wrapper)");
            else if (e.many())
                sb.append("[]");
            sb.append("\"];\n");
        }
        for (SourceNode s : graph.sources())
            sb.append("  ").append(sanitize(s.name())).append("([\"").append(s.name()).append(' ')
                    .append(s.direction().name().toLowerCase(Locale.ROOT)).append("\"]);\n");

        // 2. Declare all edges afterwards
        for (Edge edge : graph.edges())
            sb.append("  ").append(sanitize(edge.from())).append(" -- \"").append(label(edge)).append("\" --> ")
                    .append(sanitize(edge.to())).append(";\n");
        return sb.toString();
    }

    /**
     * One line per step, with its dependencies and fan-out.
     */
    public static String explainPlan(ExecutionPlan plan) {
        StringBuilder sb = new StringBuilder(512);
        sb.append("Plan ").append(plan.target()).append(" (").append(plan.mode()).append(", ")
                .append(plan.size()).append(" steps):\n");
        for (PlanStep s : plan.steps()) {
            sb.append("  [").append(s.index()).append("] ").append(s);
            if (s.source() != null)
                sb.append(" <- ").append(s.source());
            if (!s.dependsOn().isEmpty())
                sb.append(" after ").append(s.dependsOn());
            if (s.fanOut() != FanOut.NONE)
                sb.append(' ').append(s.fanOut()).append('(').append(s.fanOutParent()).append(')');
            if (!s.joinKeys().isEmpty())
                sb.append(" by ").append(s.joinKeys());
            if (s.payloadEntity() != null)
                sb.append(" sending ").append(s.payloadEntity());
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Mermaid flowchart of a plan: one node per step, edges for dependencies.
     */
    public static String planToMermaid(ExecutionPlan plan) {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("graph LR;\n");
        for (PlanStep s : plan.steps())
            sb.append("  s").append(s.index()).append("[\"").append(s.index()).append(": ").append(s)
                    .append("\"];\n");
        for (PlanStep s : plan.steps())
            for (int dep : s.dependsOn())
                sb.append("  s").append(dep).append(" --> s").append(s.index()).append(";\n");
        return sb.toString();
    }

    private static void appendEdges(StringBuilder sb, String prefix, List<Edge> edges) {
        if (edges.isEmpty())
            return;
        sb.append(prefix);
        for (int i = 0; i < edges.size(); i++) {
            sb.append(edges.get(i));
            if (i < edges.size() - 1)
                sb.append(", ");
        }
        sb.append('\n');
    }

    private static String label(Edge edge) {
        return edge.kind().name().toLowerCase(Locale.ROOT);
    }

    private static String sanitize(String name) {
        return name.replaceAll("[^a-zA-Z0-9_]", "_");
    }
}
