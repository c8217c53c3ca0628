package com.fdsl.flow.graph;

import com.fdsl.flow.engine.TopologicalOrder;
import com.fdsl.flow.fn.BuiltinRegistry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, typed dependency graph of entities and sources.
 *
 * <p>
 * Built once by {@link GraphBuilder} and shared read-only by the planner, the
 * chain resolver and every request. Adjacency lists are kept in both
 * directions, keyed by node name; all listings follow metamodel declaration
 * order.
 */
public final class DependencyGraph {
    private final String name;
    private final Map<String, EntityNode> entities;
    private final Map<String, SourceNode> sources;
    private final Map<String, EndpointBinding> endpoints;
    private final List<Edge> edges;
    private final Map<String, List<Edge>> outgoing;
    private final Map<String, List<Edge>> incoming;
    private final Map<String, Integer> declarationIndex;
    private final TopologicalOrder topology;
    private final BuiltinRegistry builtins;

    DependencyGraph(String name, List<EntityNode> entities, List<SourceNode> sources,
            List<EndpointBinding> endpoints, List<Edge> edges, TopologicalOrder topology,
            BuiltinRegistry builtins) {
        this.name = name;
        this.builtins = builtins;
        this.topology = topology;

        Map<String, EntityNode> em = new LinkedHashMap<>();
        Map<String, Integer> decl = new LinkedHashMap<>();
        for (EntityNode e : entities) {
            em.put(e.name(), e);
            decl.put(e.name(), decl.size());
        }
        Map<String, SourceNode> sm = new LinkedHashMap<>();
        for (SourceNode s : sources) {
            sm.put(s.name(), s);
            decl.put(s.name(), decl.size());
        }
        Map<String, EndpointBinding> epm = new LinkedHashMap<>();
        for (EndpointBinding ep : endpoints)
            epm.put(ep.name(), ep);

        Map<String, List<Edge>> out = new LinkedHashMap<>();
        Map<String, List<Edge>> in = new LinkedHashMap<>();
        for (String n : decl.keySet()) {
            out.put(n, new ArrayList<>());
            in.put(n, new ArrayList<>());
        }
        List<Edge> sorted = new ArrayList<>(edges);
        sorted.sort((a, b) -> {
            int c = Integer.compare(decl.get(a.from()), decl.get(b.from()));
            return c != 0 ? c : Integer.compare(decl.get(a.to()), decl.get(b.to()));
        });
        for (Edge e : sorted) {
            out.get(e.from()).add(e);
            in.get(e.to()).add(e);
        }
        out.replaceAll((k, v) -> Collections.unmodifiableList(v));
        in.replaceAll((k, v) -> Collections.unmodifiableList(v));

        this.entities = Collections.unmodifiableMap(em);
        this.sources = Collections.unmodifiableMap(sm);
        this.endpoints = Collections.unmodifiableMap(epm);
        this.edges = List.copyOf(sorted);
        this.outgoing = Collections.unmodifiableMap(out);
        this.incoming = Collections.unmodifiableMap(in);
        this.declarationIndex = Collections.unmodifiableMap(decl);
    }

    public String name() {
        return name;
    }

    public BuiltinRegistry builtins() {
        return builtins;
    }

    /** Topological order over every node of the graph. */
    public TopologicalOrder topology() {
        return topology;
    }

    public List<EntityNode> entities() {
        return List.copyOf(entities.values());
    }

    public List<SourceNode> sources() {
        return List.copyOf(sources.values());
    }

    public List<EndpointBinding> endpoints() {
        return List.copyOf(endpoints.values());
    }

    public List<Edge> edges() {
        return edges;
    }

    public boolean hasEntity(String entity) {
        return entities.containsKey(entity);
    }

    /** @throws ModelBuildException UNKNOWN_ENTITY */
    public EntityNode entity(String entity) {
        EntityNode e = entities.get(entity);
        if (e == null)
            throw new ModelBuildException(ModelBuildException.Reason.UNKNOWN_ENTITY, entity,
                    "no entity named " + entity);
        return e;
    }

    public SourceNode source(String source) {
        SourceNode s = sources.get(source);
        if (s == null)
            throw new ModelBuildException(ModelBuildException.Reason.UNRESOLVED_SOURCE_BINDING, source,
                    "no source named " + source);
        return s;
    }

    public Optional<EndpointBinding> endpoint(String endpoint) {
        return Optional.ofNullable(endpoints.get(endpoint));
    }

    public GraphNode node(String node) {
        GraphNode n = entities.get(node);
        return n != null ? n : sources.get(node);
    }

    /** Position of the node in the metamodel; entities first, then sources. */
    public int declarationIndex(String node) {
        Integer i = declarationIndex.get(node);
        if (i == null)
            throw new IllegalArgumentException("Unknown node: " + node);
        return i;
    }

    public List<Edge> outgoing(String node) {
        return outgoing.getOrDefault(node, List.of());
    }

    public List<Edge> incoming(String node) {
        return incoming.getOrDefault(node, List.of());
    }

    public List<Edge> outgoing(String node, EdgeKind kind) {
        return outgoing(node).stream().filter(e -> e.kind() == kind).toList();
    }

    public List<Edge> incoming(String node, EdgeKind kind) {
        return incoming(node).stream().filter(e -> e.kind() == kind).toList();
    }

    /** The kind tag of the edge between a source and an entity, in either direction. */
    public Optional<EdgeKind> edgeKind(String source, String entity) {
        for (Edge e : outgoing(source))
            if (e.to().equals(entity))
                return Optional.of(e.kind());
        for (Edge e : incoming(source))
            if (e.from().equals(entity))
                return Optional.of(e.kind());
        return Optional.empty();
    }

    /** Composite children of an entity, in declaration order. */
    public List<String> children(String entity) {
        return outgoing(entity, EdgeKind.PARENT_OF).stream().map(Edge::to).toList();
    }

    /** The single source that provides (read or subscribe) the entity, if any. */
    public Optional<SourceNode> provider(String entity) {
        return incoming(entity, EdgeKind.PROVIDES).stream().findFirst().map(e -> sources.get(e.from()));
    }

    /** The single write source whose response populates the entity, if any. */
    public Optional<SourceNode> mutationProvider(String entity) {
        return incoming(entity, EdgeKind.MUTATION_RESPONSE).stream().findFirst().map(e -> sources.get(e.from()));
    }

    /** Sources the entity is sent to. */
    public List<SourceNode> consumers(String entity) {
        return outgoing(entity, EdgeKind.CONSUMES).stream().map(e -> sources.get(e.to())).toList();
    }

    @Override
    public String toString() {
        return "DependencyGraph[" + name + ": " + entities.size() + " entities, " + sources.size() + " sources, "
                + edges.size() + " edges]";
    }
}
