package com.fdsl.flow.plan;

import com.fdsl.flow.engine.TopologicalOrder;
import com.fdsl.flow.expr.ExprAst;
import com.fdsl.flow.graph.DependencyGraph;
import com.fdsl.flow.graph.Edge;
import com.fdsl.flow.graph.EdgeKind;
import com.fdsl.flow.graph.EntityNode;
import com.fdsl.flow.graph.ModelBuildException;
import com.fdsl.flow.graph.SourceNode;
import com.fdsl.flow.io.Direction;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import lombok.extern.log4j.Log4j2;

/**
 * Turns a target entity into an {@link ExecutionPlan}.
 *
 * <p>
 * Algorithm:
 * 1. Walk backwards from the target along PARENT_OF edges and the single
 * providing edge of each source-bound entity, collecting the minimal
 * dependency closure. READ plans follow PROVIDES only. A MUTATION plan calls
 * at most one write source: the target's MUTATION_RESPONSE when it has one,
 * else that of the first entity in the closure that cannot be read. Every other
 * entity is read. The write step depends on its source's payload entity.
 * 2. Resolve join keys for secondary parents and the fan-out mode of every
 * composite step.
 * 3. Sort the closure with Kahn's algorithm; ties go to the entity declared
 * first in the metamodel.
 *
 * <p>
 * Plans are deterministic and memoized per (target, mode). All structural
 * errors are raised here, never during execution.
 */
@Log4j2
public final class ExecutionPlanner {
    private final DependencyGraph graph;
    private final boolean caching;
    private final Map<PlanKey, ExecutionPlan> cache = new ConcurrentHashMap<>();

    private record PlanKey(String target, PlanMode mode) {
    }

    public ExecutionPlanner(DependencyGraph graph) {
        this(graph, true);
    }

    public ExecutionPlanner(DependencyGraph graph, boolean caching) {
        this.graph = graph;
        this.caching = caching;
    }

    /** Plans a read of {@code target} without keeping the result. */
    public static ExecutionPlan plan(DependencyGraph graph, String target) {
        return new ExecutionPlanner(graph, false).plan(target);
    }

    public ExecutionPlan plan(String target) {
        return plan(target, PlanMode.READ);
    }

    /**
     * @throws ModelBuildException UNKNOWN_ENTITY, CYCLE_DETECTED,
     *                             AMBIGUOUS_PARENT_KEY or
     *                             UNRESOLVED_SOURCE_BINDING
     */
    public ExecutionPlan plan(String target, PlanMode mode) {
        graph.entity(target);
        if (!caching)
            return build(target, mode);
        return cache.computeIfAbsent(new PlanKey(target, mode), k -> build(k.target(), k.mode()));
    }

    public int cachedPlans() {
        return cache.size();
    }

    public DependencyGraph graph() {
        return graph;
    }

    private ExecutionPlan build(String target, PlanMode mode) {
        Walk walk = new Walk(mode, target);
        walk.visit(target);

        // Topological sort, declaration order breaks ties
        List<String> closure = new ArrayList<>(walk.drafts.keySet());
        closure.sort(Comparator.comparingInt(graph::declarationIndex));
        TopologicalOrder.Builder topo = TopologicalOrder.builder();
        closure.forEach(topo::addNode);
        for (Draft d : walk.drafts.values())
            for (String dep : d.deps)
                topo.addEdge(dep, d.entity);
        TopologicalOrder order = topo.build();

        List<PlanStep> steps = new ArrayList<>(order.nodeCount());
        for (int ti = 0; ti < order.nodeCount(); ti++) {
            Draft d = walk.drafts.get(order.node(ti));
            List<Integer> deps = d.deps.stream().map(order::topoIndex).sorted().toList();
            steps.add(new PlanStep(ti, d.kind, d.entity, d.source, deps, d.fanOut, d.fanOutParent, d.joinKeys,
                    d.payload));
        }
        ExecutionPlan plan = new ExecutionPlan(target, mode, steps);
        log.debug("Planned {} ({}): {}", target, mode, plan);
        return plan;
    }

    private static final class Draft {
        final String entity;
        StepKind kind;
        String source;
        final Set<String> deps = new LinkedHashSet<>();
        FanOut fanOut = FanOut.NONE;
        String fanOutParent;
        final List<JoinKey> joinKeys = new ArrayList<>();
        String payload;

        Draft(String entity) {
            this.entity = entity;
        }
    }

    private final class Walk {
        final PlanMode mode;
        final Map<String, Draft> drafts = new LinkedHashMap<>();
        final Set<String> visiting = new HashSet<>();
        final List<String> path = new ArrayList<>();
        final String target;
        // owner of the single write step of a MUTATION plan
        String writer;

        Walk(PlanMode mode, String target) {
            this.mode = mode;
            this.target = target;
        }

        void visit(String entity) {
            if (drafts.containsKey(entity))
                return;
            if (visiting.contains(entity)) {
                List<String> cycle = new ArrayList<>(path.subList(path.indexOf(entity), path.size()));
                cycle.add(entity);
                throw new ModelBuildException(ModelBuildException.Reason.CYCLE_DETECTED, cycle,
                        "dependency cycle " + String.join(" -> ", cycle));
            }
            visiting.add(entity);
            path.add(entity);

            EntityNode node = graph.entity(entity);
            Draft d = node.isComposite() ? composite(node) : sourced(node);

            path.remove(path.size() - 1);
            visiting.remove(entity);
            drafts.put(entity, d);
        }

        private Draft composite(EntityNode node) {
            Draft d = new Draft(node.name());
            d.kind = StepKind.EVALUATE;
            for (EntityNode.Parent p : node.parents()) {
                visit(p.entity());
                d.deps.add(p.entity());
            }
            for (EntityNode.Parent p : node.parents()) {
                if (p.many()) {
                    d.fanOut = node.many() ? FanOut.PER_ITEM : FanOut.WHOLE_LIST;
                    d.fanOutParent = p.entity();
                    break;
                }
            }
            String first = node.parents().get(0).entity();
            for (EntityNode.Parent p : node.parents().subList(1, node.parents().size()))
                joinKey(node, first, p);
            return d;
        }

        private void joinKey(EntityNode child, String first, EntityNode.Parent parent) {
            Draft pd = drafts.get(parent.entity());
            if (pd.kind != StepKind.FETCH)
                return;
            if (parent.key() == null && !graph.source(pd.source).params().isEmpty())
                return;
            String field = parent.key();
            if (field == null) {
                List<ExprAst> exprs = new ArrayList<>();
                for (EntityNode.Attribute a : child.attributes())
                    if (a.isComputed())
                        exprs.add(a.expression().source());
                field = JoinKeyInference.inferJoinKey(parent.entity(), graph.entity(first).attributes(), exprs)
                        .orElseThrow(() -> new ModelBuildException(ModelBuildException.Reason.AMBIGUOUS_PARENT_KEY,
                                List.of(child.name(), parent.entity()),
                                "no join key links " + parent.entity() + " to " + first));
                log.debug("Inferred join key {}.{} for {} in {}", first, field, parent.entity(), child.name());
            }
            JoinKey key = new JoinKey(first, field);
            if (!pd.joinKeys.contains(key))
                pd.joinKeys.add(key);
            pd.deps.add(first);
        }

        private Draft sourced(EntityNode node) {
            Draft d = new Draft(node.name());
            SourceNode src = chooseSource(node);
            if (src == null) {
                d.kind = StepKind.INPUT;
                return d;
            }
            d.source = src.name();
            if (src.direction() == Direction.SUBSCRIBE) {
                d.kind = StepKind.RECEIVE;
                return d;
            }
            d.kind = StepKind.FETCH;
            for (Edge e : graph.incoming(src.name(), EdgeKind.PARAMETER)) {
                visit(e.from());
                d.deps.add(e.from());
            }
            if (src.direction() == Direction.WRITE) {
                String payload = payloadOf(src);
                if (payload != null && !payload.equals(node.name())) {
                    visit(payload);
                    d.deps.add(payload);
                    d.payload = payload;
                }
            }
            return d;
        }

        private SourceNode chooseSource(EntityNode node) {
            Optional<SourceNode> provider = graph.provider(node.name());
            Optional<SourceNode> mutation = graph.mutationProvider(node.name());
            if (mode == PlanMode.MUTATION && mutation.isPresent()
                    && (node.name().equals(target) || provider.isEmpty() && writer == null)) {
                writer = node.name();
                return mutation.get();
            }
            if (provider.isPresent())
                return provider.get();
            if (mutation.isPresent()) {
                String why = writer == null ? " and cannot be read"
                        : " and the plan already writes through " + writer;
                throw new ModelBuildException(ModelBuildException.Reason.UNRESOLVED_SOURCE_BINDING,
                        List.of(node.name(), mutation.get().name()),
                        node.name() + " is only produced by write source " + mutation.get().name() + why);
            }
            return null;
        }

        private String payloadOf(SourceNode src) {
            if (src.request() != null)
                return src.request();
            List<Edge> consumed = graph.incoming(src.name(), EdgeKind.CONSUMES);
            return consumed.isEmpty() ? null : consumed.get(0).from();
        }
    }
}
