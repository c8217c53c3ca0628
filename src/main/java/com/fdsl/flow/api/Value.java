package com.fdsl.flow.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Tagged, immutable value flowing through entity evaluation.
 *
 * <p>
 * Every attribute, fetched payload and intermediate expression result is a
 * {@code Value}. Records and lists are stored as unmodifiable collections so a
 * value can be shared between contexts without copying.
 *
 * <p>
 * Numbers keep their integral/floating distinction ({@link Kind#INT} vs
 * {@link Kind#FLOAT}); equality compares them numerically so {@code 1 == 1.0}.
 */
public final class Value {

    public enum Kind {
        NULL, BOOL, INT, FLOAT, STRING, LIST, RECORD, FUNCTION
    }

    /** A callable value produced by a lambda literal. */
    @FunctionalInterface
    public interface Function {
        Value call(List<Value> args);
    }

    public static final Value NULL = new Value(Kind.NULL, null);
    public static final Value TRUE = new Value(Kind.BOOL, Boolean.TRUE);
    public static final Value FALSE = new Value(Kind.BOOL, Boolean.FALSE);
    public static final Value EMPTY_LIST = new Value(Kind.LIST, Collections.emptyList());
    public static final Value EMPTY_RECORD = new Value(Kind.RECORD, Collections.emptyMap());

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final Kind kind;
    private final Object raw;

    private Value(Kind kind, Object raw) {
        this.kind = kind;
        this.raw = raw;
    }

    // ── Factories ──────────────────────────────────────────────────

    public static Value of(boolean b) {
        return b ? TRUE : FALSE;
    }

    public static Value of(long l) {
        return new Value(Kind.INT, l);
    }

    public static Value of(double d) {
        return new Value(Kind.FLOAT, d);
    }

    public static Value of(String s) {
        return s == null ? NULL : new Value(Kind.STRING, s);
    }

    public static Value list(List<Value> items) {
        if (items.isEmpty())
            return EMPTY_LIST;
        return new Value(Kind.LIST, Collections.unmodifiableList(new ArrayList<>(items)));
    }

    public static Value list(Value... items) {
        return list(List.of(items));
    }

    public static Value record(Map<String, Value> fields) {
        if (fields.isEmpty())
            return EMPTY_RECORD;
        return new Value(Kind.RECORD, Collections.unmodifiableMap(new LinkedHashMap<>(fields)));
    }

    public static Value function(Function fn) {
        return new Value(Kind.FUNCTION, Objects.requireNonNull(fn));
    }

    /**
     * Converts a plain Java object (as produced by Jackson or a literal in an
     * expression tree) into a Value. Integers outside the 64-bit range become
     * floats.
     */
    public static Value of(Object o) {
        if (o == null)
            return NULL;
        if (o instanceof Value v)
            return v;
        if (o instanceof Boolean b)
            return of(b.booleanValue());
        if (o instanceof Integer || o instanceof Long || o instanceof Short || o instanceof Byte)
            return of(((Number) o).longValue());
        if (o instanceof java.math.BigInteger bi)
            return bi.bitLength() < 64 ? of(bi.longValue()) : of(bi.doubleValue());
        if (o instanceof Number n)
            return of(n.doubleValue());
        if (o instanceof CharSequence cs)
            return of(cs.toString());
        if (o instanceof JsonNode node)
            return fromJson(node);
        if (o instanceof Map<?, ?> m) {
            Map<String, Value> fields = new LinkedHashMap<>();
            for (var e : m.entrySet())
                fields.put(String.valueOf(e.getKey()), of(e.getValue()));
            return record(fields);
        }
        if (o instanceof Iterable<?> it) {
            List<Value> items = new ArrayList<>();
            for (Object x : it)
                items.add(of(x));
            return list(items);
        }
        throw new IllegalArgumentException("Unsupported value type: " + o.getClass().getName());
    }

    public static Value fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode())
            return NULL;
        if (node.isBoolean())
            return of(node.booleanValue());
        if (node.isIntegralNumber())
            return node.canConvertToLong() ? of(node.longValue()) : of(node.doubleValue());
        if (node.isNumber())
            return of(node.doubleValue());
        if (node.isTextual())
            return of(node.textValue());
        if (node.isArray()) {
            List<Value> items = new ArrayList<>(node.size());
            for (JsonNode item : node)
                items.add(fromJson(item));
            return list(items);
        }
        if (node.isObject()) {
            Map<String, Value> fields = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                var e = it.next();
                fields.put(e.getKey(), fromJson(e.getValue()));
            }
            return record(fields);
        }
        return of(node.asText());
    }

    public JsonNode toJson() {
        switch (kind) {
            case NULL:
                return NODES.nullNode();
            case BOOL:
                return NODES.booleanNode((Boolean) raw);
            case INT:
                return NODES.numberNode((Long) raw);
            case FLOAT:
                return NODES.numberNode((Double) raw);
            case STRING:
                return NODES.textNode((String) raw);
            case LIST: {
                ArrayNode arr = NODES.arrayNode();
                for (Value v : asList())
                    arr.add(v.toJson());
                return arr;
            }
            case RECORD: {
                ObjectNode obj = NODES.objectNode();
                for (var e : asRecord().entrySet())
                    obj.set(e.getKey(), e.getValue().toJson());
                return obj;
            }
            default:
                throw EvaluationException.typeMismatch("function values cannot be serialized");
        }
    }

    // ── Accessors ──────────────────────────────────────────────────

    public Kind kind() {
        return kind;
    }

    public boolean isNull() {
        return kind == Kind.NULL;
    }

    public boolean isNumber() {
        return kind == Kind.INT || kind == Kind.FLOAT;
    }

    public boolean asBoolean() {
        expect(Kind.BOOL);
        return (Boolean) raw;
    }

    public long asLong() {
        if (kind == Kind.INT)
            return (Long) raw;
        if (kind == Kind.FLOAT) {
            double d = (Double) raw;
            if (d == Math.rint(d) && !Double.isInfinite(d))
                return (long) d;
        }
        throw EvaluationException.typeMismatch("expected integer but got " + describe());
    }

    public double asDouble() {
        if (kind == Kind.INT)
            return (Long) raw;
        if (kind == Kind.FLOAT)
            return (Double) raw;
        throw EvaluationException.typeMismatch("expected number but got " + describe());
    }

    public String asString() {
        expect(Kind.STRING);
        return (String) raw;
    }

    @SuppressWarnings("unchecked")
    public List<Value> asList() {
        expect(Kind.LIST);
        return (List<Value>) raw;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Value> asRecord() {
        expect(Kind.RECORD);
        return (Map<String, Value>) raw;
    }

    public Function asFunction() {
        expect(Kind.FUNCTION);
        return (Function) raw;
    }

    /**
     * Safe field lookup: returns {@code def} when this is not a record or the
     * key is absent.
     */
    public Value get(String key, Value def) {
        if (kind != Kind.RECORD)
            return def;
        Value v = asRecord().get(key);
        return v == null ? def : v;
    }

    public boolean has(String key) {
        return kind == Kind.RECORD && asRecord().containsKey(key);
    }

    /** Python-style truthiness, used by {@code and}, {@code or}, {@code not} and conditionals. */
    public boolean truthy() {
        switch (kind) {
            case NULL:
                return false;
            case BOOL:
                return (Boolean) raw;
            case INT:
                return (Long) raw != 0L;
            case FLOAT:
                return (Double) raw != 0.0;
            case STRING:
                return !((String) raw).isEmpty();
            case LIST:
                return !asList().isEmpty();
            case RECORD:
                return !asRecord().isEmpty();
            default:
                return true;
        }
    }

    private void expect(Kind k) {
        if (kind != k)
            throw EvaluationException.typeMismatch("expected " + k.name().toLowerCase() + " but got " + describe());
    }

    /** Short human-readable description for error messages. */
    public String describe() {
        return switch (kind) {
            case NULL -> "null";
            case LIST -> "list[" + asList().size() + "]";
            case RECORD -> "record" + asRecord().keySet();
            case FUNCTION -> "function";
            default -> kind.name().toLowerCase() + " " + toString();
        };
    }

    /** String form used by {@code str()} and string concatenation builtins. */
    public String toDisplayString() {
        return switch (kind) {
            case STRING -> (String) raw;
            case NULL -> "null";
            case FUNCTION -> "<function>";
            default -> toString();
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Value other))
            return false;
        if (isNumber() && other.isNumber()) {
            if (kind == Kind.INT && other.kind == Kind.INT)
                return raw.equals(other.raw);
            return asDouble() == other.asDouble();
        }
        return kind == other.kind && Objects.equals(raw, other.raw);
    }

    @Override
    public int hashCode() {
        if (isNumber()) {
            double d = asDouble();
            if (d == Math.rint(d) && !Double.isInfinite(d))
                return Long.hashCode((long) d);
            return Double.hashCode(d);
        }
        return Objects.hash(kind, raw);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case NULL -> "null";
            case FUNCTION -> "<function>";
            default -> toJson().toString();
        };
    }
}
