package com.fdsl.flow.expr;

import com.fdsl.flow.api.EvaluationException;
import com.fdsl.flow.api.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Arithmetic, comparison and membership operators.
 *
 * <p>
 * Integer operands stay integers under {@code + - * // % **}; {@code /}
 * always produces a float. {@code //} and {@code %} floor toward negative
 * infinity. A zero divisor is DIVISION_BY_ZERO for every division operator.
 * An integer result outside the 64-bit range is promoted to a float.
 */
final class Operators {
    private Operators() {
    }

    static Value apply(String op, Value a, Value b) {
        return switch (op) {
            case "+" -> add(a, b);
            case "-" -> arith(op, a, b);
            case "*" -> arith(op, a, b);
            case "/" -> divide(a, b);
            case "//" -> floorDivide(a, b);
            case "%" -> modulo(a, b);
            case "**" -> power(a, b);
            case "==" -> Value.of(a.equals(b));
            case "!=" -> Value.of(!a.equals(b));
            case "<" -> Value.of(compare(op, a, b) < 0);
            case "<=" -> Value.of(compare(op, a, b) <= 0);
            case ">" -> Value.of(compare(op, a, b) > 0);
            case ">=" -> Value.of(compare(op, a, b) >= 0);
            case "in" -> Value.of(contains(b, a));
            case "not in" -> Value.of(!contains(b, a));
            default -> throw new IllegalArgumentException("Unknown operator: " + op);
        };
    }

    static boolean isKnown(String op) {
        return switch (op) {
            case "+", "-", "*", "/", "//", "%", "**", "==", "!=", "<", "<=", ">", ">=", "in", "not in" -> true;
            default -> false;
        };
    }

    static Value negate(Value v) {
        if (v.kind() == Value.Kind.INT)
            return v.asLong() == Long.MIN_VALUE ? Value.of(-(double) v.asLong()) : Value.of(-v.asLong());
        if (v.kind() == Value.Kind.FLOAT)
            return Value.of(-v.asDouble());
        throw mismatch("-", v, null);
    }

    private static Value add(Value a, Value b) {
        if (a.kind() == Value.Kind.STRING && b.kind() == Value.Kind.STRING)
            return Value.of(a.asString() + b.asString());
        if (a.kind() == Value.Kind.LIST && b.kind() == Value.Kind.LIST) {
            List<Value> out = new ArrayList<>(a.asList());
            out.addAll(b.asList());
            return Value.list(out);
        }
        return arith("+", a, b);
    }

    private static Value arith(String op, Value a, Value b) {
        numbers(op, a, b);
        if (a.kind() == Value.Kind.INT && b.kind() == Value.Kind.INT) {
            long x = a.asLong(), y = b.asLong();
            try {
                return Value.of(switch (op) {
                    case "+" -> Math.addExact(x, y);
                    case "-" -> Math.subtractExact(x, y);
                    default -> Math.multiplyExact(x, y);
                });
            } catch (ArithmeticException overflow) {
                // fall through to floating point
            }
        }
        double x = a.asDouble(), y = b.asDouble();
        return Value.of(switch (op) {
            case "+" -> x + y;
            case "-" -> x - y;
            default -> x * y;
        });
    }

    private static Value divide(Value a, Value b) {
        numbers("/", a, b);
        if (b.asDouble() == 0.0)
            throw new EvaluationException(EvaluationException.Kind.DIVISION_BY_ZERO, a + " / " + b);
        return Value.of(a.asDouble() / b.asDouble());
    }

    private static Value floorDivide(Value a, Value b) {
        numbers("//", a, b);
        if (b.asDouble() == 0.0)
            throw new EvaluationException(EvaluationException.Kind.DIVISION_BY_ZERO, a + " // " + b);
        if (a.kind() == Value.Kind.INT && b.kind() == Value.Kind.INT
                && !(a.asLong() == Long.MIN_VALUE && b.asLong() == -1))
            return Value.of(Math.floorDiv(a.asLong(), b.asLong()));
        return Value.of(Math.floor(a.asDouble() / b.asDouble()));
    }

    private static Value modulo(Value a, Value b) {
        numbers("%", a, b);
        if (b.asDouble() == 0.0)
            throw new EvaluationException(EvaluationException.Kind.DIVISION_BY_ZERO, a + " % " + b);
        if (a.kind() == Value.Kind.INT && b.kind() == Value.Kind.INT)
            return Value.of(Math.floorMod(a.asLong(), b.asLong()));
        double x = a.asDouble(), y = b.asDouble();
        return Value.of(x - y * Math.floor(x / y));
    }

    private static Value power(Value a, Value b) {
        numbers("**", a, b);
        if (a.kind() == Value.Kind.INT && b.kind() == Value.Kind.INT && b.asLong() >= 0) {
            try {
                return Value.of(exactPower(a.asLong(), b.asLong()));
            } catch (ArithmeticException overflow) {
                return Value.of(Math.pow(a.asDouble(), b.asDouble()));
            }
        }
        if (a.asDouble() == 0.0 && b.asDouble() < 0)
            throw new EvaluationException(EvaluationException.Kind.DIVISION_BY_ZERO, a + " ** " + b);
        return Value.of(Math.pow(a.asDouble(), b.asDouble()));
    }

    /** Exponentiation by squaring; throws ArithmeticException on overflow. */
    static long exactPower(long base, long exp) {
        long result = 1;
        while (exp > 0) {
            if ((exp & 1) == 1)
                result = Math.multiplyExact(result, base);
            exp >>= 1;
            if (exp > 0)
                base = Math.multiplyExact(base, base);
        }
        return result;
    }

    static int compare(String op, Value a, Value b) {
        if (a.isNumber() && b.isNumber())
            return Double.compare(a.asDouble(), b.asDouble());
        if (a.kind() == Value.Kind.STRING && b.kind() == Value.Kind.STRING)
            return a.asString().compareTo(b.asString());
        if (a.kind() == Value.Kind.BOOL && b.kind() == Value.Kind.BOOL)
            return Boolean.compare(a.asBoolean(), b.asBoolean());
        throw mismatch(op, a, b);
    }

    private static boolean contains(Value container, Value item) {
        return switch (container.kind()) {
            case LIST -> container.asList().contains(item);
            case RECORD -> item.kind() == Value.Kind.STRING && container.asRecord().containsKey(item.asString());
            case STRING -> item.kind() == Value.Kind.STRING && container.asString().contains(item.asString());
            default -> throw mismatch("in", item, container);
        };
    }

    private static void numbers(String op, Value a, Value b) {
        if (!a.isNumber() || !b.isNumber())
            throw mismatch(op, a, b);
    }

    private static EvaluationException mismatch(String op, Value a, Value b) {
        String operands = b == null ? a.describe() : a.describe() + " and " + b.describe();
        return EvaluationException.typeMismatch("unsupported operand(s) for " + op + ": " + operands);
    }
}
