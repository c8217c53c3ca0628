package com.fdsl.flow.fn;

import com.fdsl.flow.api.EvaluationException;
import com.fdsl.flow.api.Value;

import java.util.List;

/**
 * Argument checks shared by the builtin groups. Every failure is reported as
 * BUILTIN_TYPE with the function name.
 */
final class Args {
    private Args() {
    }

    static List<Value> list(String fn, Value v) {
        if (v.kind() != Value.Kind.LIST)
            throw EvaluationException.builtinType(fn, "expected list but got " + v.describe());
        return v.asList();
    }

    static String str(String fn, Value v) {
        if (v.kind() != Value.Kind.STRING)
            throw EvaluationException.builtinType(fn, "expected string but got " + v.describe());
        return v.asString();
    }

    static double num(String fn, Value v) {
        if (!v.isNumber())
            throw EvaluationException.builtinType(fn, "expected number but got " + v.describe());
        return v.asDouble();
    }

    static long integer(String fn, Value v) {
        if (v.kind() == Value.Kind.INT)
            return v.asLong();
        if (v.kind() == Value.Kind.FLOAT && v.asDouble() == Math.rint(v.asDouble()))
            return (long) v.asDouble();
        throw EvaluationException.builtinType(fn, "expected integer but got " + v.describe());
    }

    static Value.Function fn(String fn, Value v) {
        if (v.kind() != Value.Kind.FUNCTION)
            throw EvaluationException.builtinType(fn, "expected lambda but got " + v.describe());
        return v.asFunction();
    }

    static java.util.Map<String, Value> record(String fn, Value v) {
        if (v.kind() != Value.Kind.RECORD)
            throw EvaluationException.builtinType(fn, "expected record but got " + v.describe());
        return v.asRecord();
    }

    static Value call(Value.Function f, Value arg) {
        return f.call(List.of(arg));
    }

    /** Sum of numbers; stays integral while every operand is an integer. */
    static Value sum(String fn, List<Value> xs) {
        long l = 0;
        double d = 0;
        boolean floating = false;
        for (Value x : xs) {
            if (x.kind() == Value.Kind.INT) {
                if (floating)
                    d += x.asLong();
                else
                    l += x.asLong();
            } else if (x.kind() == Value.Kind.FLOAT) {
                if (!floating) {
                    floating = true;
                    d = l;
                }
                d += x.asDouble();
            } else {
                throw EvaluationException.builtinType(fn, "cannot sum " + x.describe());
            }
        }
        return floating ? Value.of(d) : Value.of(l);
    }

    /** Natural ordering for numbers and strings, used by sort/min/max. */
    static int compare(String fn, Value a, Value b) {
        if (a.isNumber() && b.isNumber())
            return Double.compare(a.asDouble(), b.asDouble());
        if (a.kind() == Value.Kind.STRING && b.kind() == Value.Kind.STRING)
            return a.asString().compareTo(b.asString());
        throw EvaluationException.builtinType(fn, "cannot compare " + a.describe() + " with " + b.describe());
    }
}
