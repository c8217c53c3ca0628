package com.fdsl.flow.fn;

import com.fdsl.flow.api.EvaluationException;
import com.fdsl.flow.api.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/** Numeric builtins. */
final class MathFns {
    private MathFns() {
    }

    static void register(BuiltinRegistry.Builder b) {
        b.registerFn1("avg", xs -> {
            List<Value> l = Args.list("avg", xs);
            if (l.isEmpty())
                throw EvaluationException.builtinType("avg", "empty sequence");
            return Value.of(Args.sum("avg", l).asDouble() / l.size());
        });
        b.register("min", 1, BuiltinRegistry.Signature.UNBOUNDED, args -> extreme("min", args, -1));
        b.register("max", 1, BuiltinRegistry.Signature.UNBOUNDED, args -> extreme("max", args, 1));
        b.registerFn1("abs", x -> {
            Args.num("abs", x);
            return x.kind() == Value.Kind.INT ? Value.of(Math.abs(x.asLong())) : Value.of(Math.abs(x.asDouble()));
        });
        b.register("round", 1, 2, args -> {
            double d = Args.num("round", args.get(0));
            if (args.size() == 1)
                return Value.of(new BigDecimal(d).setScale(0, RoundingMode.HALF_EVEN).longValue());
            int digits = (int) Args.integer("round", args.get(1));
            return Value.of(BigDecimal.valueOf(d).setScale(digits, RoundingMode.HALF_EVEN).doubleValue());
        });
        b.registerFn1("floor", x -> Value.of((long) Math.floor(Args.num("floor", x))));
        b.registerFn1("ceil", x -> Value.of((long) Math.ceil(Args.num("ceil", x))));
        b.registerFn1("float", x -> {
            if (x.isNumber())
                return Value.of(x.asDouble());
            if (x.kind() == Value.Kind.STRING) {
                try {
                    return Value.of(Double.parseDouble(x.asString().trim()));
                } catch (NumberFormatException e) {
                    throw EvaluationException.builtinType("float", "not a number: '" + x.asString() + "'");
                }
            }
            throw EvaluationException.builtinType("float", "cannot convert " + x.describe());
        });
        b.registerFn1("int", x -> {
            if (x.kind() == Value.Kind.INT)
                return x;
            if (x.kind() == Value.Kind.FLOAT)
                return Value.of((long) x.asDouble());
            if (x.kind() == Value.Kind.BOOL)
                return Value.of(x.asBoolean() ? 1L : 0L);
            if (x.kind() == Value.Kind.STRING) {
                try {
                    return Value.of(Long.parseLong(x.asString().trim()));
                } catch (NumberFormatException e) {
                    throw EvaluationException.builtinType("int", "not an integer: '" + x.asString() + "'");
                }
            }
            throw EvaluationException.builtinType("int", "cannot convert " + x.describe());
        });
    }

    // min/max accept either a single list or several arguments
    private static Value extreme(String fn, List<Value> args, int sign) {
        List<Value> xs = args.size() == 1 ? Args.list(fn, args.get(0)) : args;
        if (xs.isEmpty())
            throw EvaluationException.builtinType(fn, "empty sequence");
        Value best = xs.get(0);
        for (int i = 1; i < xs.size(); i++)
            if (Args.compare(fn, xs.get(i), best) * sign > 0)
                best = xs.get(i);
        return best;
    }
}
