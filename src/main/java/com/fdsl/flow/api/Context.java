package com.fdsl.flow.api;

import com.fdsl.flow.fn.BuiltinRegistry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Per-request (or per-message) value store: entity name to computed value,
 * endpoint parameters, and the builtin registry used to evaluate calls.
 *
 * <p>
 * A Context is created at the start of a request and discarded at the end. It
 * is not thread-safe and must never be shared between requests.
 * {@link #overlay(String, Value)} creates a cheap child view used for per-item
 * evaluation of fan-out steps; writes to an overlay never reach its base.
 */
public final class Context {
    private final BuiltinRegistry builtins;
    private final Map<String, Value> values = new LinkedHashMap<>();
    private final Map<String, Value> params;
    private final Context base;

    public Context(BuiltinRegistry builtins) {
        this(builtins, new LinkedHashMap<>(), null);
    }

    private Context(BuiltinRegistry builtins, Map<String, Value> params, Context base) {
        this.builtins = Objects.requireNonNull(builtins, "builtins");
        this.params = params;
        this.base = base;
    }

    public static Context create() {
        return new Context(BuiltinRegistry.standard());
    }

    public BuiltinRegistry builtins() {
        return builtins;
    }

    /** Returns the value stored for an entity, or null when none is present. */
    public Value get(String entity) {
        Value v = values.get(entity);
        if (v == null && base != null)
            return base.get(entity);
        return v;
    }

    public boolean contains(String entity) {
        return get(entity) != null;
    }

    public Context put(String entity, Value value) {
        values.put(entity, Objects.requireNonNull(value, "value"));
        return this;
    }

    /** Returns the named endpoint parameter, or null when it was not supplied. */
    public Value param(String name) {
        return params.get(name);
    }

    public boolean hasParam(String name) {
        return params.containsKey(name);
    }

    public Context putParam(String name, Value value) {
        params.put(name, Objects.requireNonNull(value, "value"));
        return this;
    }

    public Map<String, Value> params() {
        return Collections.unmodifiableMap(params);
    }

    /** Child view in which {@code entity} is bound to {@code value}. */
    public Context overlay(String entity, Value value) {
        Context child = new Context(builtins, params, this);
        child.values.put(entity, value);
        return child;
    }

    /** Flattened, independent copy sharing only the (immutable) registry. */
    public Context copy() {
        Context c = new Context(builtins, new LinkedHashMap<>(params), null);
        c.values.putAll(values());
        return c;
    }

    /** Stores every entity value of {@code other} into this context. */
    public void commit(Context other) {
        values.putAll(other.values());
    }

    /** All entity values visible from this context, base values first. */
    public Map<String, Value> values() {
        if (base == null)
            return Collections.unmodifiableMap(values);
        Map<String, Value> merged = new LinkedHashMap<>(base.values());
        merged.putAll(values);
        return Collections.unmodifiableMap(merged);
    }

    @Override
    public String toString() {
        return "Context" + values();
    }
}
