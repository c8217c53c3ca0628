package com.fdsl.flow.graph;

import com.fdsl.flow.engine.TopologicalOrder;
import com.fdsl.flow.expr.CompileScope;
import com.fdsl.flow.expr.CompiledExpression;
import com.fdsl.flow.expr.ExpressionCompileException;
import com.fdsl.flow.expr.ExpressionCompiler;
import com.fdsl.flow.expr.References;
import com.fdsl.flow.fn.BuiltinRegistry;
import com.fdsl.flow.io.AttributeType;
import com.fdsl.flow.io.Direction;
import com.fdsl.flow.io.ModelDefinition;
import com.fdsl.flow.io.Transport;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import lombok.extern.log4j.Log4j2;

/**
 * Compiles a validated {@link ModelDefinition} into an immutable
 * {@link DependencyGraph}.
 *
 * <p>
 * Every source/entity binding is tagged from the source's declared direction:
 * read and subscribe sources PROVIDE, write sources produce a
 * MUTATION_RESPONSE, and entities sent to write or publish sources CONSUME.
 * A pair tagged two different ways, or an entity with two providers of the
 * same kind, is rejected rather than guessed. All attribute expressions are
 * compiled here, so a graph that builds never fails at runtime on a structural
 * issue.
 */
@Log4j2
public final class GraphBuilder {
    private final ExpressionCompiler compiler;

    public GraphBuilder(BuiltinRegistry builtins) {
        this.compiler = new ExpressionCompiler(builtins);
    }

    public GraphBuilder() {
        this(BuiltinRegistry.standard());
    }

    /**
     * Builds the graph.
     *
     * @throws ModelBuildException on any structural error; the graph is never
     *                             partially built
     */
    public DependencyGraph build(ModelDefinition def) {
        List<ModelDefinition.EntityDef> entityDefs = nonNull(def.getEntities());
        List<ModelDefinition.SourceDef> sourceDefs = nonNull(def.getSources());
        List<ModelDefinition.EndpointDef> endpointDefs = nonNull(def.getEndpoints());

        Map<String, ModelDefinition.EntityDef> entityByName = new LinkedHashMap<>();
        Map<String, ModelDefinition.SourceDef> sourceByName = new LinkedHashMap<>();
        checkNames(entityDefs, sourceDefs, entityByName, sourceByName);

        // 1. Directions
        Map<String, Direction> directions = new LinkedHashMap<>();
        for (ModelDefinition.SourceDef s : sourceDefs)
            directions.put(s.getName(), directionOf(s));

        // 2. Endpoints and the parameter names they expose
        Set<String> endpointParams = new LinkedHashSet<>();
        List<EndpointBinding> endpoints = new ArrayList<>();
        Set<String> wrappers = new LinkedHashSet<>();
        for (ModelDefinition.EndpointDef ep : endpointDefs) {
            EndpointBinding b = toBinding(ep, entityByName);
            endpoints.add(b);
            endpointParams.addAll(b.params());
            if (isPrimitiveValueType(ep.getValueType(), ep.getName())) {
                addIfPresent(wrappers, b.request());
                addIfPresent(wrappers, b.response());
                addIfPresent(wrappers, b.clientPublish());
                addIfPresent(wrappers, b.clientSubscribe());
            }
        }

        // 3. Directional bindings between sources and entities
        Bindings bindings = new Bindings();
        for (ModelDefinition.SourceDef s : sourceDefs) {
            Direction dir = directions.get(s.getName());
            if (s.getEntity() != null) {
                requireEntity(entityByName, s.getEntity(), s.getName());
                switch (dir) {
                    case READ, SUBSCRIBE -> bindings.add(s.getName(), s.getEntity(), EdgeKind.PROVIDES);
                    case WRITE -> bindings.add(s.getName(), s.getEntity(), EdgeKind.MUTATION_RESPONSE);
                    case PUBLISH -> bindings.add(s.getName(), s.getEntity(), EdgeKind.CONSUMES);
                }
                if (isPrimitiveValueType(s.getValueType(), s.getName()))
                    wrappers.add(s.getEntity());
            }
            if (s.getRequest() != null) {
                requireEntity(entityByName, s.getRequest(), s.getName());
                if (!dir.consumes())
                    throw new ModelBuildException(ModelBuildException.Reason.UNRESOLVED_SOURCE_BINDING,
                            List.of(s.getName(), s.getRequest()),
                            dir + " source cannot take a request payload");
                bindings.add(s.getName(), s.getRequest(), EdgeKind.CONSUMES);
            }
        }
        for (ModelDefinition.EntityDef e : entityDefs) {
            if (e.getSource() != null) {
                Direction dir = requireSource(directions, e.getSource(), e.getName());
                switch (dir) {
                    case READ, SUBSCRIBE -> bindings.add(e.getSource(), e.getName(), EdgeKind.PROVIDES);
                    case WRITE -> bindings.add(e.getSource(), e.getName(), EdgeKind.MUTATION_RESPONSE);
                    case PUBLISH -> throw new ModelBuildException(
                            ModelBuildException.Reason.UNRESOLVED_SOURCE_BINDING,
                            List.of(e.getName(), e.getSource()), "publish source cannot populate an entity");
                }
            }
            if (e.getTarget() != null) {
                Direction dir = requireSource(directions, e.getTarget(), e.getName());
                if (!dir.consumes())
                    throw new ModelBuildException(ModelBuildException.Reason.UNRESOLVED_SOURCE_BINDING,
                            List.of(e.getName(), e.getTarget()), dir + " source cannot be a target");
                bindings.add(e.getTarget(), e.getName(), EdgeKind.CONSUMES);
            }
            if (e.isWrapper())
                wrappers.add(e.getName());
        }
        bindings.checkSingleProviders();

        // 4. Entities
        List<EntityNode> entities = new ArrayList<>();
        List<Edge> edges = new ArrayList<>(bindings.edges());
        for (ModelDefinition.EntityDef e : entityDefs) {
            EntityNode node = compileEntity(e, entityByName, endpointParams, bindings.isProduced(e.getName()),
                    wrappers.contains(e.getName()));
            entities.add(node);
            for (EntityNode.Parent p : node.parents())
                edges.add(new Edge(p.entity(), node.name(), EdgeKind.PARENT_OF));
        }

        // 5. Sources, with parameter dependencies
        List<SourceNode> sources = new ArrayList<>();
        CompileScope paramScope = CompileScope.of(entityByName.keySet(), endpointParams);
        for (ModelDefinition.SourceDef s : sourceDefs) {
            List<SourceNode.Param> params = new ArrayList<>();
            Set<String> readers = new LinkedHashSet<>();
            for (ModelDefinition.ParamDef p : nonNull(s.getParams())) {
                if (p.getExpr() == null)
                    continue;
                String path = s.getName() + "." + p.getName();
                AttributeType type;
                try {
                    type = AttributeType.parse(p.getType(), true);
                } catch (IllegalArgumentException ex) {
                    throw new ModelBuildException(ModelBuildException.Reason.INVALID_EXPRESSION, path,
                            ex.getMessage());
                }
                params.add(new SourceNode.Param(p.getName(), compile(p.getExpr(), paramScope, type, path)));
                for (String ref : References.freeNames(p.getExpr()))
                    if (entityByName.containsKey(ref))
                        readers.add(ref);
            }
            for (String reader : readers)
                edges.add(new Edge(reader, s.getName(), EdgeKind.PARAMETER));
            sources.add(new SourceNode(s.getName(), Transport.fromString(s.getTransport()),
                    directions.get(s.getName()), s.getUrl(), s.getMethod(), s.getEntity(), s.getRequest(),
                    params, s.getValueType()));
        }

        // 6. Whole-graph cycle check
        TopologicalOrder.Builder topo = TopologicalOrder.builder();
        entityByName.keySet().forEach(topo::addNode);
        sourceByName.keySet().forEach(topo::addNode);
        for (Edge edge : edges)
            topo.addEdge(edge.from(), edge.to());
        TopologicalOrder topology = topo.build();

        DependencyGraph graph = new DependencyGraph(def.getName(), entities, sources, endpoints, edges, topology,
                compiler.builtins());
        log.info("Built {}", graph);
        if (log.isDebugEnabled())
            graph.edges().forEach(edge -> log.debug("  {}", edge));
        return graph;
    }

    private EntityNode compileEntity(ModelDefinition.EntityDef e, Map<String, ModelDefinition.EntityDef> entityByName,
            Set<String> endpointParams, boolean produced, boolean wrapper) {
        String name = e.getName();
        List<EntityNode.Parent> parents = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (ModelDefinition.ParentDef p : nonNull(e.getParents())) {
            if (p.getEntity() == null)
                throw new ModelBuildException(ModelBuildException.Reason.INVALID_ENTITY_SHAPE, name,
                        "parent reference without an entity");
            if (p.getEntity().equals(name))
                throw new ModelBuildException(ModelBuildException.Reason.CYCLE_DETECTED, name,
                        name + " declares itself as parent");
            requireEntity(entityByName, p.getEntity(), name);
            if (!seen.add(p.getEntity()))
                throw new ModelBuildException(ModelBuildException.Reason.INVALID_ENTITY_SHAPE,
                        List.of(name, p.getEntity()), "parent declared twice");
            boolean many = entityByName.get(p.getEntity()).isMany();
            if (p.isMany() && !many)
                throw new ModelBuildException(ModelBuildException.Reason.INVALID_ENTITY_SHAPE,
                        List.of(name, p.getEntity()), "parent " + p.getEntity() + " is used as a list but is not many");
            parents.add(new EntityNode.Parent(p.getEntity(), many, p.getKey()));
        }
        boolean composite = !parents.isEmpty();
        if (composite && produced)
            throw new ModelBuildException(ModelBuildException.Reason.UNRESOLVED_SOURCE_BINDING, name,
                    "entity is populated by a source and also declares parents");

        List<EntityNode.Attribute> attributes = new ArrayList<>();
        List<String> earlier = new ArrayList<>();
        List<String> parentNames = parents.stream().map(EntityNode.Parent::entity).toList();
        for (ModelDefinition.AttributeDef a : nonNull(e.getAttributes())) {
            String path = name + "." + a.getName();
            AttributeType type;
            try {
                type = AttributeType.parse(a.getType(), a.isNullable());
            } catch (IllegalArgumentException ex) {
                throw new ModelBuildException(ModelBuildException.Reason.INVALID_ENTITY_SHAPE, path, ex.getMessage());
            }
            if (earlier.contains(a.getName()))
                throw new ModelBuildException(ModelBuildException.Reason.DUPLICATE_NAME, path,
                        "attribute declared twice");
            CompiledExpression expr = null;
            if (composite) {
                if (a.getExpr() == null)
                    throw new ModelBuildException(ModelBuildException.Reason.INVALID_ENTITY_SHAPE, path,
                            "composite entity attribute has no expression");
                CompileScope scope = CompileScope.forAttribute(name, earlier, parentNames, endpointParams);
                expr = compile(a.getExpr(), scope, type, path);
            } else if (a.getExpr() != null) {
                throw new ModelBuildException(ModelBuildException.Reason.INVALID_ENTITY_SHAPE, path,
                        "entity without parents cannot compute attributes");
            }
            attributes.add(new EntityNode.Attribute(a.getName(), type, a.isPrimaryKey(), expr));
            earlier.add(a.getName());
        }

        if (wrapper) {
            if (attributes.size() != 1)
                throw new ModelBuildException(ModelBuildException.Reason.INVALID_WRAPPER, name,
                        "wrapper entity must have exactly one attribute, found " + attributes.size());
            EntityNode.Attribute only = attributes.get(0);
            if (only.isComputed() || !only.type().isPrimitiveOrArray())
                throw new ModelBuildException(ModelBuildException.Reason.INVALID_WRAPPER, name,
                        "wrapper attribute must be a plain primitive or array field");
        }
        return new EntityNode(name, attributes, parents, e.getSource(), e.getTarget(), e.isMany(), wrapper,
                e.getAccess());
    }

    private CompiledExpression compile(com.fdsl.flow.expr.ExprAst ast, CompileScope scope, AttributeType type,
            String path) {
        try {
            return compiler.compile(ast, scope, type, path);
        } catch (ExpressionCompileException | IllegalArgumentException ex) {
            throw new ModelBuildException(ModelBuildException.Reason.INVALID_EXPRESSION, path, ex.getMessage(), ex);
        }
    }

    private static void checkNames(List<ModelDefinition.EntityDef> entityDefs,
            List<ModelDefinition.SourceDef> sourceDefs, Map<String, ModelDefinition.EntityDef> entityByName,
            Map<String, ModelDefinition.SourceDef> sourceByName) {
        Set<String> all = new HashSet<>();
        for (ModelDefinition.EntityDef e : entityDefs) {
            if (e.getName() == null || e.getName().isBlank())
                throw new ModelBuildException(ModelBuildException.Reason.INVALID_ENTITY_SHAPE, "<unnamed>",
                        "entity without a name");
            if (!all.add(e.getName()))
                throw new ModelBuildException(ModelBuildException.Reason.DUPLICATE_NAME, e.getName(),
                        "name declared twice");
            entityByName.put(e.getName(), e);
        }
        for (ModelDefinition.SourceDef s : sourceDefs) {
            if (s.getName() == null || s.getName().isBlank())
                throw new ModelBuildException(ModelBuildException.Reason.UNRESOLVED_SOURCE_BINDING, "<unnamed>",
                        "source without a name");
            if (!all.add(s.getName()))
                throw new ModelBuildException(ModelBuildException.Reason.DUPLICATE_NAME, s.getName(),
                        "name declared twice");
            sourceByName.put(s.getName(), s);
        }
    }

    private static Direction directionOf(ModelDefinition.SourceDef s) {
        if (s.getDirection() != null) {
            try {
                return Direction.fromString(s.getDirection());
            } catch (IllegalArgumentException e) {
                throw new ModelBuildException(ModelBuildException.Reason.AMBIGUOUS_EDGE_KIND, s.getName(),
                        e.getMessage());
            }
        }
        Direction d = Transport.fromString(s.getTransport()) == Transport.REST
                ? Direction.fromHttpMethod(s.getMethod())
                : null;
        if (d == null)
            throw new ModelBuildException(ModelBuildException.Reason.AMBIGUOUS_EDGE_KIND, s.getName(),
                    "source direction is not declared and cannot be derived");
        return d;
    }

    private static EndpointBinding toBinding(ModelDefinition.EndpointDef ep,
            Map<String, ModelDefinition.EntityDef> entityByName) {
        for (String ref : new String[] { ep.getRequest(), ep.getResponse(), ep.getClientPublish(),
                ep.getClientSubscribe() })
            if (ref != null)
                requireEntity(entityByName, ref, ep.getName());
        List<String> params = nonNull(ep.getParams()).stream().map(ModelDefinition.ParamDef::getName).toList();
        return new EndpointBinding(ep.getName(), Transport.fromString(ep.getTransport()), ep.getMethod(),
                ep.getPath(), params, ep.getRequest(), ep.getResponse(), ep.getClientPublish(),
                ep.getClientSubscribe(), ep.getValueType());
    }

    private static boolean isPrimitiveValueType(String valueType, String owner) {
        if (valueType == null)
            return false;
        try {
            AttributeType t = AttributeType.parse(valueType, false);
            return t.base() != AttributeType.Base.ANY && t.isPrimitiveOrArray();
        } catch (IllegalArgumentException e) {
            throw new ModelBuildException(ModelBuildException.Reason.INVALID_WRAPPER, owner, e.getMessage());
        }
    }

    private static void requireEntity(Map<String, ModelDefinition.EntityDef> entityByName, String entity,
            String referrer) {
        if (!entityByName.containsKey(entity))
            throw new ModelBuildException(ModelBuildException.Reason.UNKNOWN_ENTITY, List.of(referrer, entity),
                    referrer + " refers to unknown entity " + entity);
    }

    private static Direction requireSource(Map<String, Direction> directions, String source, String referrer) {
        Direction d = directions.get(source);
        if (d == null)
            throw new ModelBuildException(ModelBuildException.Reason.UNRESOLVED_SOURCE_BINDING,
                    List.of(referrer, source), referrer + " refers to unknown source " + source);
        return d;
    }

    private static void addIfPresent(Set<String> set, String value) {
        if (value != null)
            set.add(value);
    }

    private static <T> List<T> nonNull(List<T> list) {
        return list == null ? List.of() : list;
    }

    /** Source/entity pairs with exactly one kind tag each. */
    private static final class Bindings {
        private final Map<List<String>, EdgeKind> kinds = new LinkedHashMap<>();

        void add(String source, String entity, EdgeKind kind) {
            List<String> key = List.of(source, entity);
            EdgeKind existing = kinds.putIfAbsent(key, kind);
            if (existing != null && existing != kind)
                throw new ModelBuildException(ModelBuildException.Reason.AMBIGUOUS_EDGE_KIND, key,
                        "bound both as " + existing + " and " + kind);
        }

        boolean isProduced(String entity) {
            for (var e : kinds.entrySet())
                if (e.getKey().get(1).equals(entity)
                        && (e.getValue() == EdgeKind.PROVIDES || e.getValue() == EdgeKind.MUTATION_RESPONSE))
                    return true;
            return false;
        }

        // at most one PROVIDES and one MUTATION_RESPONSE into any entity
        void checkSingleProviders() {
            Map<List<String>, List<String>> producers = new LinkedHashMap<>();
            for (var e : kinds.entrySet()) {
                if (e.getValue() == EdgeKind.CONSUMES)
                    continue;
                producers.computeIfAbsent(List.of(e.getKey().get(1), e.getValue().name()), k -> new ArrayList<>())
                        .add(e.getKey().get(0));
            }
            for (var e : producers.entrySet()) {
                if (e.getValue().size() > 1) {
                    List<String> subjects = new ArrayList<>();
                    subjects.add(e.getKey().get(0));
                    subjects.addAll(e.getValue());
                    throw new ModelBuildException(ModelBuildException.Reason.AMBIGUOUS_EDGE_KIND, subjects,
                            "entity has " + e.getValue().size() + " " + e.getKey().get(1) + " sources");
                }
            }
        }

        List<Edge> edges() {
            List<Edge> out = new ArrayList<>();
            for (var e : kinds.entrySet()) {
                String source = e.getKey().get(0), entity = e.getKey().get(1);
                if (e.getValue() == EdgeKind.CONSUMES)
                    out.add(new Edge(entity, source, EdgeKind.CONSUMES));
                else
                    out.add(new Edge(source, entity, e.getValue()));
            }
            return out;
        }
    }
}
