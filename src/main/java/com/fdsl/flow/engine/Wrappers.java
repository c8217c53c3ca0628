package com.fdsl.flow.engine;

import com.fdsl.flow.api.EvaluationException;
import com.fdsl.flow.api.Value;
import com.fdsl.flow.graph.EntityNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ingress and egress of entity values crossing the engine boundary.
 *
 * <p>
 * Wrapper entities are driven by the static marker on {@link EntityNode}: a raw
 * value is always wrapped as {@code {attr: value}} on the way in and the
 * single field is always extracted on the way out. Values are never inspected
 * to decide whether to wrap. Other entities are validated against their
 * declared plain attributes.
 */
public final class Wrappers {

    private Wrappers() {
    }

    /** Raw value to {@code {attr: value}}, type-checked against the wrapper attribute. */
    public static Value wrap(EntityNode node, Value raw) {
        EntityNode.Attribute attr = node.wrapperAttribute();
        Value coerced;
        try {
            coerced = attr.type().coerce(raw);
        } catch (EvaluationException e) {
            throw e.withPath(node.name() + "." + attr.name());
        }
        Map<String, Value> fields = new LinkedHashMap<>();
        fields.put(attr.name(), coerced);
        return Value.record(fields);
    }

    /** Single-field record back to its raw value. */
    public static Value unwrap(EntityNode node, Value wrapped) {
        EntityNode.Attribute attr = node.wrapperAttribute();
        if (wrapped.kind() != Value.Kind.RECORD)
            throw EvaluationException.typeMismatch("wrapper value is " + wrapped.describe())
                    .withPath(node.name());
        return wrapped.get(attr.name(), Value.NULL);
    }

    /** Value entering the context from a client, seed or source. */
    public static Value ingress(EntityNode node, Value raw) {
        if (node.wrapper())
            return wrap(node, raw);
        if (node.many()) {
            if (raw.kind() != Value.Kind.LIST)
                throw EvaluationException.typeMismatch("expected a list of " + node.name() + " but got "
                        + raw.describe()).withPath(node.name());
            List<Value> items = new ArrayList<>(raw.asList().size());
            for (Value item : raw.asList())
                items.add(validate(node, item));
            return Value.list(items);
        }
        return validate(node, raw);
    }

    /** Value leaving the context toward a client or sink. */
    public static Value egress(EntityNode node, Value value) {
        return node.wrapper() ? unwrap(node, value) : value;
    }

    private static Value validate(EntityNode node, Value v) {
        if (v.kind() != Value.Kind.RECORD)
            throw EvaluationException.typeMismatch("expected a record but got " + v.describe())
                    .withPath(node.name());
        Map<String, Value> fields = new LinkedHashMap<>(v.asRecord());
        for (EntityNode.Attribute a : node.attributes()) {
            if (a.isComputed())
                continue;
            String path = node.name() + "." + a.name();
            Value f = fields.get(a.name());
            if (f == null) {
                if (a.type().nullable())
                    continue;
                throw EvaluationException.missingField("no value for " + a.name()).withPath(path);
            }
            try {
                fields.put(a.name(), a.type().coerce(f));
            } catch (EvaluationException e) {
                throw e.withPath(path);
            }
        }
        return Value.record(fields);
    }
}
