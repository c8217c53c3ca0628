package com.fdsl.flow.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fdsl.flow.api.Context;
import com.fdsl.flow.api.EvaluationException;
import com.fdsl.flow.api.ExecutionListener;
import com.fdsl.flow.api.Value;
import com.fdsl.flow.graph.DependencyGraph;
import com.fdsl.flow.graph.EntityNode;
import com.fdsl.flow.graph.SourceNode;
import com.fdsl.flow.plan.ExecutionPlan;
import com.fdsl.flow.plan.FanOut;
import com.fdsl.flow.plan.JoinKey;
import com.fdsl.flow.plan.PlanStep;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.extern.log4j.Log4j2;

/**
 * Runs an {@link ExecutionPlan} against a request-scoped {@link Context}.
 *
 * <p>
 * Steps run strictly in plan order on a working copy of the seed context. The
 * first failing step aborts the rest of the plan and surfaces as a
 * {@link PlanExecutionException}; the seed is only updated once every step has
 * succeeded, so no partial entity is ever visible to the caller.
 *
 * <p>
 * Stateless apart from the listener; one executor serves all requests
 * concurrently.
 */
@Log4j2
public final class PlanExecutor {
    private final DependencyGraph graph;
    private ExecutionListener listener;

    public PlanExecutor(DependencyGraph graph) {
        this.graph = graph;
    }

    public void setListener(ExecutionListener listener) {
        this.listener = listener;
    }

    /**
     * Executes the plan and returns the target's egress value (unwrapped when
     * the target is a wrapper entity).
     *
     * @param seed    caller context holding endpoint params and client-supplied
     *                entity values; receives every materialized entity on
     *                success
     * @param fetchFn source-call collaborator
     * @throws PlanExecutionException on the first failing step
     */
    public Value execute(ExecutionPlan plan, Context seed, FetchFunction fetchFn) {
        final ExecutionListener l = this.listener;
        if (l != null)
            l.onPlanStart(plan);

        Context work = seed.copy();
        for (PlanStep step : plan.steps()) {
            long start = System.nanoTime();
            try {
                runStep(step, work, fetchFn);
            } catch (RuntimeException e) {
                if (l != null) {
                    l.onStepError(plan, step, e);
                    l.onPlanEnd(plan, false);
                }
                throw new PlanExecutionException(step.entity(), step.index(), e);
            }
            if (l != null)
                l.onStepCompleted(plan, step, System.nanoTime() - start);
        }

        seed.commit(work);
        if (l != null)
            l.onPlanEnd(plan, true);
        return Wrappers.egress(graph.entity(plan.target()), work.get(plan.target()));
    }

    private void runStep(PlanStep step, Context work, FetchFunction fetchFn) {
        EntityNode node = graph.entity(step.entity());
        switch (step.kind()) {
            case INPUT, RECEIVE -> {
                Value raw = work.get(node.name());
                if (raw == null)
                    throw new EvaluationException(EvaluationException.Kind.UNRESOLVED_REFERENCE, node.name(),
                            "no value supplied for " + node.name(), 0, null);
                work.put(node.name(), Wrappers.ingress(node, raw));
            }
            case FETCH -> work.put(node.name(), Wrappers.ingress(node, fetch(step, work, fetchFn)));
            case EVALUATE -> work.put(node.name(), evaluate(step, node, work));
        }
    }

    private Value fetch(PlanStep step, Context work, FetchFunction fetchFn) {
        SourceNode source = graph.source(step.source());
        Map<String, Value> params = new LinkedHashMap<>(work.params());
        for (JoinKey key : step.joinKeys())
            params.put(key.field(), joinValue(work.get(key.fromEntity()), key));
        for (SourceNode.Param p : source.params())
            params.put(p.name(), p.expression().evaluate(work));

        JsonNode payload = null;
        if (step.payloadEntity() != null) {
            EntityNode payloadNode = graph.entity(step.payloadEntity());
            payload = Wrappers.egress(payloadNode, work.get(step.payloadEntity())).toJson();
        }

        FetchRequest request = new FetchRequest(source, step.entity(), params, payload);
        JsonNode response;
        try {
            response = fetchFn.fetch(request);
        } catch (Exception e) {
            throw new FetchFailureException(source.name(), e);
        }
        if (log.isDebugEnabled())
            log.debug("Fetched {} from {} with {}", step.entity(), source.name(), params.keySet());
        return Value.fromJson(response == null ? NullNode.getInstance() : response);
    }

    // A list parent yields the list of its items' key values
    private static Value joinValue(Value from, JoinKey key) {
        if (from.kind() == Value.Kind.LIST) {
            List<Value> keys = new ArrayList<>(from.asList().size());
            for (Value item : from.asList())
                keys.add(item.get(key.field(), Value.NULL));
            return Value.list(keys);
        }
        if (!from.has(key.field()))
            throw EvaluationException.missingField("join key " + key.field() + " is missing")
                    .withPath(key.toString());
        return from.get(key.field(), Value.NULL);
    }

    private static Value evaluate(PlanStep step, EntityNode node, Context work) {
        if (step.fanOut() != FanOut.PER_ITEM)
            return record(node, work);
        List<Value> items = work.get(step.fanOutParent()).asList();
        List<Value> out = new ArrayList<>(items.size());
        for (Value item : items)
            out.add(record(node, work.overlay(step.fanOutParent(), item)));
        return Value.list(out);
    }

    private static Value record(EntityNode node, Context ctx) {
        Map<String, Value> fields = new LinkedHashMap<>();
        for (EntityNode.Attribute a : node.attributes())
            fields.put(a.name(), a.expression().evaluate(ctx, fields));
        return Value.record(fields);
    }
}
