package com.fdsl.flow.graph;

import com.fdsl.flow.expr.CompiledExpression;
import com.fdsl.flow.io.AttributeType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entity node with its compiled attributes.
 *
 * @param wrapper static marker: the entity carries a single primitive or array
 *                value, wrapped on ingress and unwrapped on egress
 * @param access  access-control metadata, carried through untouched
 */
public record EntityNode(String name, List<Attribute> attributes, List<Parent> parents, String source,
        String target, boolean many, boolean wrapper, Map<String, Object> access) implements GraphNode {

    /** A declared attribute; {@code expression} is null for plain schema fields. */
    public record Attribute(String name, AttributeType type, boolean primaryKey, CompiledExpression expression) {
        public boolean isComputed() {
            return expression != null;
        }
    }

    /** Parent reference, in declaration order. {@code key} is an explicit join key. */
    public record Parent(String entity, boolean many, String key) {
    }

    public EntityNode {
        attributes = List.copyOf(attributes);
        parents = List.copyOf(parents);
        access = access == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(access));
    }

    public boolean isComposite() {
        return !parents.isEmpty();
    }

    public Attribute attribute(String attr) {
        for (Attribute a : attributes)
            if (a.name().equals(attr))
                return a;
        return null;
    }

    public List<String> attributeNames() {
        return attributes.stream().map(Attribute::name).toList();
    }

    public List<String> parentNames() {
        return parents.stream().map(Parent::entity).toList();
    }

    public Parent parent(String entity) {
        for (Parent p : parents)
            if (p.entity().equals(entity))
                return p;
        return null;
    }

    /** The single attribute of a wrapper entity. */
    public Attribute wrapperAttribute() {
        if (!wrapper)
            throw new IllegalStateException(name + " is not a wrapper entity");
        return attributes.get(0);
    }
}
