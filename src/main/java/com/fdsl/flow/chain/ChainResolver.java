package com.fdsl.flow.chain;

import com.fdsl.flow.graph.DependencyGraph;
import com.fdsl.flow.graph.Edge;
import com.fdsl.flow.graph.EdgeKind;
import com.fdsl.flow.graph.ModelBuildException;
import com.fdsl.flow.graph.SourceNode;
import com.fdsl.flow.io.Direction;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import lombok.extern.log4j.Log4j2;

/**
 * Resolves the inbound and outbound chains of a WebSocket duplex channel.
 *
 * <p>
 * The two directions are independent traversals. Inbound first finds the
 * terminal by walking PARENT_OF edges forward to the nearest publish-bound
 * descendant, then keeps only the entities lying on a path from the client
 * entity to that terminal. Transformation entities declared downstream of the
 * client entity are therefore always part of the chain. Outbound walks
 * PARENT_OF edges backward to the subscribe-bound roots.
 */
@Log4j2
public final class ChainResolver {

    private ChainResolver() {
    }

    /**
     * Chain from the client-published entity to the entity sent to an external
     * publish sink.
     *
     * @throws ModelBuildException UNRESOLVED_TERMINAL_ENTITY when no
     *                             publish-bound descendant exists
     */
    public static Chain resolveInbound(DependencyGraph graph, String clientEntity) {
        graph.entity(clientEntity);
        String terminal = findDescendantTerminal(graph, clientEntity)
                .orElseThrow(() -> new ModelBuildException(ModelBuildException.Reason.UNRESOLVED_TERMINAL_ENTITY,
                        clientEntity, "no descendant of " + clientEntity + " is bound to a publish source"));

        Set<String> path = descendants(graph, clientEntity);
        path.retainAll(ancestors(graph, terminal));
        List<String> entities = topological(graph, path);

        List<String> sinks = new ArrayList<>();
        for (SourceNode s : graph.consumers(terminal))
            if (s.direction() == Direction.PUBLISH)
                sinks.add(s.name());

        Chain chain = new Chain(clientEntity, ChainDirection.INBOUND, entities, List.of(clientEntity), terminal,
                sinks, wrappers(graph, entities));
        log.debug("Resolved {}", chain);
        return chain;
    }

    /**
     * Chain from the subscribe-bound root entities to the entity exposed to the
     * client.
     *
     * @throws ModelBuildException UNRESOLVED_TERMINAL_ENTITY when no ancestor
     *                             is fed by a subscribe source
     */
    public static Chain resolveOutbound(DependencyGraph graph, String clientEntity) {
        graph.entity(clientEntity);
        List<String> roots = findAncestorRoot(graph, clientEntity);
        if (roots.isEmpty())
            throw new ModelBuildException(ModelBuildException.Reason.UNRESOLVED_TERMINAL_ENTITY, clientEntity,
                    "no ancestor of " + clientEntity + " is fed by a subscribe source");

        Set<String> path = ancestors(graph, clientEntity);
        Set<String> downstream = new LinkedHashSet<>();
        for (String root : roots)
            downstream.addAll(descendants(graph, root));
        path.retainAll(downstream);
        List<String> entities = topological(graph, path);

        List<String> sources = new ArrayList<>();
        for (String root : roots)
            graph.provider(root).map(SourceNode::name).filter(n -> !sources.contains(n)).ifPresent(sources::add);

        Chain chain = new Chain(clientEntity, ChainDirection.OUTBOUND, entities, roots, clientEntity, sources,
                wrappers(graph, entities));
        log.debug("Resolved {}", chain);
        return chain;
    }

    /**
     * Breadth-first search forward over PARENT_OF edges, starting with
     * {@code start} itself, for the nearest entity that CONSUMES into a publish
     * source. Among entities at the same distance the one declared first wins.
     */
    public static Optional<String> findDescendantTerminal(DependencyGraph graph, String start) {
        Deque<String> queue = new ArrayDeque<>();
        Set<String> seen = new LinkedHashSet<>();
        queue.add(start);
        seen.add(start);
        while (!queue.isEmpty()) {
            String e = queue.poll();
            if (isPublishBound(graph, e))
                return Optional.of(e);
            for (String child : graph.children(e))
                if (seen.add(child))
                    queue.add(child);
        }
        return Optional.empty();
    }

    /**
     * Every ancestor of {@code end} (itself included) that is populated by a
     * subscribe source, in declaration order.
     */
    public static List<String> findAncestorRoot(DependencyGraph graph, String end) {
        List<String> roots = new ArrayList<>();
        for (String e : ancestors(graph, end))
            if (graph.provider(e).filter(s -> s.direction() == Direction.SUBSCRIBE).isPresent())
                roots.add(e);
        roots.sort(Comparator.comparingInt(graph::declarationIndex));
        return roots;
    }

    private static boolean isPublishBound(DependencyGraph graph, String entity) {
        for (SourceNode s : graph.consumers(entity))
            if (s.direction() == Direction.PUBLISH)
                return true;
        return false;
    }

    private static Set<String> descendants(DependencyGraph graph, String start) {
        Set<String> out = new LinkedHashSet<>();
        Deque<String> stack = new ArrayDeque<>();
        stack.push(start);
        while (!stack.isEmpty()) {
            String e = stack.pop();
            if (out.add(e))
                graph.children(e).forEach(stack::push);
        }
        return out;
    }

    private static Set<String> ancestors(DependencyGraph graph, String end) {
        Set<String> out = new LinkedHashSet<>();
        Deque<String> stack = new ArrayDeque<>();
        stack.push(end);
        while (!stack.isEmpty()) {
            String e = stack.pop();
            if (out.add(e))
                for (Edge edge : graph.incoming(e, EdgeKind.PARENT_OF))
                    stack.push(edge.from());
        }
        return out;
    }

    private static List<String> topological(DependencyGraph graph, Set<String> entities) {
        List<String> ordered = new ArrayList<>(entities);
        ordered.sort(Comparator.comparingInt(graph.topology()::topoIndex));
        return ordered;
    }

    private static Set<String> wrappers(DependencyGraph graph, List<String> entities) {
        Set<String> out = new LinkedHashSet<>();
        for (String e : entities)
            if (graph.entity(e).wrapper())
                out.add(e);
        return out;
    }
}
