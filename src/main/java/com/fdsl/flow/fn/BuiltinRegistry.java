package com.fdsl.flow.fn;

import com.fdsl.flow.api.EvaluationException;
import com.fdsl.flow.api.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable registry of the builtin functions callable from expressions.
 *
 * <p>
 * Built once at startup and shared by reference between the expression
 * compiler (which checks call arity) and every {@link com.fdsl.flow.api.Context}
 * (which dispatches calls). Nothing can be added after {@link Builder#build()}.
 */
public final class BuiltinRegistry {

    /** Accepted argument count; {@code max == UNBOUNDED} means variadic. */
    public record Signature(int min, int max) {
        public static final int UNBOUNDED = -1;

        public boolean accepts(int argc) {
            return argc >= min && (max == UNBOUNDED || argc <= max);
        }

        @Override
        public String toString() {
            if (min == max)
                return String.valueOf(min);
            return min + ".." + (max == UNBOUNDED ? "*" : String.valueOf(max));
        }
    }

    /** Metadata describing a builtin's arity and its implementation. */
    public record Builtin(String name, Signature signature, FnN fn) {
    }

    private static volatile BuiltinRegistry standard;

    private final Map<String, Builtin> builtins;

    private BuiltinRegistry(Map<String, Builtin> builtins) {
        this.builtins = Collections.unmodifiableMap(new LinkedHashMap<>(builtins));
    }

    /** The process-wide registry with every standard builtin group. */
    public static BuiltinRegistry standard() {
        BuiltinRegistry r = standard;
        if (r == null) {
            synchronized (BuiltinRegistry.class) {
                r = standard;
                if (r == null) {
                    r = builder().registerStandard().build();
                    standard = r;
                }
            }
        }
        return r;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean contains(String name) {
        return builtins.containsKey(name);
    }

    /** Returns the builtin, or null when no function of that name exists. */
    public Builtin lookup(String name) {
        return builtins.get(name);
    }

    public Set<String> names() {
        return builtins.keySet();
    }

    public int size() {
        return builtins.size();
    }

    /**
     * Invokes a builtin with already evaluated arguments.
     *
     * @throws EvaluationException UNRESOLVED_REFERENCE for an unknown name,
     *                             BUILTIN_ARITY for a bad argument count, and
     *                             BUILTIN_TYPE for argument type errors.
     */
    public Value invoke(String name, List<Value> args) {
        Builtin b = builtins.get(name);
        if (b == null)
            throw new EvaluationException(EvaluationException.Kind.UNRESOLVED_REFERENCE, "unknown function " + name);
        if (!b.signature().accepts(args.size()))
            throw new EvaluationException(EvaluationException.Kind.BUILTIN_ARITY,
                    name + "() takes " + b.signature() + " arguments, got " + args.size());
        return b.fn().apply(args);
    }

    /**
     * Builder collecting builtins before the registry is frozen.
     */
    public static final class Builder {
        private final Map<String, Builtin> builtins = new LinkedHashMap<>();

        public Builder register(String name, int min, int max, FnN fn) {
            if (builtins.containsKey(name))
                throw new IllegalArgumentException("Duplicate builtin: " + name);
            builtins.put(name, new Builtin(name, new Signature(min, max), fn));
            return this;
        }

        public Builder registerFn0(String name, java.util.function.Supplier<Value> fn) {
            return register(name, 0, 0, args -> fn.get());
        }

        public Builder registerFn1(String name, Fn1 fn) {
            return register(name, 1, 1, args -> fn.apply(args.get(0)));
        }

        public Builder registerFn2(String name, Fn2 fn) {
            return register(name, 2, 2, args -> fn.apply(args.get(0), args.get(1)));
        }

        /** Registers the core, collection, math, string, time, JSON and validation groups. */
        public Builder registerStandard() {
            CollectionFns.register(this);
            MathFns.register(this);
            StringFns.register(this);
            TimeFns.register(this);
            JsonFns.register(this);
            ValidationFns.register(this);
            return this;
        }

        public BuiltinRegistry build() {
            return new BuiltinRegistry(builtins);
        }
    }
}
