package com.fdsl.flow.io;

import com.fdsl.flow.api.EvaluationException;
import com.fdsl.flow.api.Value;

import java.util.Locale;

/**
 * Declared attribute type, with nullability.
 *
 * <p>
 * {@link #coerce(Value)} applies the numeric rules: an integral float assigned
 * to an integer attribute becomes an integer, any number assigned to a number
 * attribute becomes a float. Anything else that does not match is a type
 * mismatch.
 */
public record AttributeType(Base base, boolean nullable) {

    public enum Base {
        STRING, INTEGER, NUMBER, BOOLEAN, LIST, OBJECT, ANY
    }

    public static final AttributeType ANY = new AttributeType(Base.ANY, true);

    /**
     * Parses a declared type such as {@code integer}, {@code string?} or
     * {@code array}. Null or blank means {@code any}.
     */
    public static AttributeType parse(String declared, boolean nullable) {
        if (declared == null || declared.isBlank())
            return ANY;
        String t = declared.trim().toLowerCase(Locale.ROOT);
        if (t.endsWith("?")) {
            nullable = true;
            t = t.substring(0, t.length() - 1);
        }
        Base base = switch (t) {
            case "string", "str", "text" -> Base.STRING;
            case "integer", "int", "long" -> Base.INTEGER;
            case "number", "float", "double", "decimal" -> Base.NUMBER;
            case "boolean", "bool" -> Base.BOOLEAN;
            case "list", "array" -> Base.LIST;
            case "object", "record", "dict" -> Base.OBJECT;
            case "any" -> Base.ANY;
            default -> throw new IllegalArgumentException("Unknown attribute type: " + declared);
        };
        return new AttributeType(base, nullable || base == Base.ANY);
    }

    /** True for types a wrapper entity may carry. */
    public boolean isPrimitiveOrArray() {
        return base != Base.OBJECT;
    }

    public Value coerce(Value v) {
        if (v.isNull()) {
            if (nullable)
                return v;
            throw EvaluationException.typeMismatch("null is not allowed for " + this);
        }
        switch (base) {
            case ANY:
                if (v.kind() == Value.Kind.FUNCTION)
                    throw EvaluationException.typeMismatch("function is not a storable value");
                return v;
            case STRING:
                return require(v, Value.Kind.STRING);
            case BOOLEAN:
                return require(v, Value.Kind.BOOL);
            case LIST:
                return require(v, Value.Kind.LIST);
            case OBJECT:
                return require(v, Value.Kind.RECORD);
            case INTEGER:
                if (v.kind() == Value.Kind.INT)
                    return v;
                if (v.kind() == Value.Kind.FLOAT) {
                    double d = v.asDouble();
                    // 2^63 itself is out of range
                    if (d == Math.rint(d) && d >= -0x1p63 && d < 0x1p63)
                        return Value.of((long) d);
                }
                throw EvaluationException.typeMismatch("expected integer but got " + v.describe());
            case NUMBER:
                if (v.isNumber())
                    return Value.of(v.asDouble());
                throw EvaluationException.typeMismatch("expected number but got " + v.describe());
            default:
                throw new IllegalStateException("Unhandled type " + base);
        }
    }

    private Value require(Value v, Value.Kind kind) {
        if (v.kind() != kind)
            throw EvaluationException.typeMismatch("expected " + this + " but got " + v.describe());
        return v;
    }

    @Override
    public String toString() {
        return base.name().toLowerCase(Locale.ROOT) + (nullable && base != Base.ANY ? "?" : "");
    }
}
