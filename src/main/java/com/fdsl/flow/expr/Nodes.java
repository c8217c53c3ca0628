package com.fdsl.flow.expr;

import com.fdsl.flow.api.EvaluationException;
import com.fdsl.flow.api.Value;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compiled node implementations produced by {@link ExpressionCompiler}.
 */
final class Nodes {
    private Nodes() {
    }

    record Const(Value value) implements Program {
        @Override
        public Value eval(Env env) {
            return value;
        }
    }

    record ListNode(Program[] items) implements Program {
        @Override
        public Value eval(Env env) {
            List<Value> out = new ArrayList<>(items.length);
            for (Program p : items)
                out.add(p.eval(env));
            return Value.list(out);
        }
    }

    record DictNode(String[] keys, Program[] values) implements Program {
        @Override
        public Value eval(Env env) {
            Map<String, Value> out = new LinkedHashMap<>();
            for (int i = 0; i < keys.length; i++)
                out.put(keys[i], values[i].eval(env));
            return Value.record(out);
        }
    }

    /** Lambda parameter, {@code depth} frames up from the innermost. */
    record SlotRef(int depth, int index) implements Program {
        @Override
        public Value eval(Env env) {
            return env.slot(depth, index);
        }
    }

    record SiblingRef(String name) implements Program {
        @Override
        public Value eval(Env env) {
            Value v = env.siblings.get(name);
            if (v == null)
                throw new EvaluationException(EvaluationException.Kind.UNRESOLVED_REFERENCE,
                        "attribute '" + name + "' has not been computed");
            return v;
        }
    }

    /** The entity under computation, seen as the record of its attributes so far. */
    record SelfRef(String entity) implements Program {
        @Override
        public Value eval(Env env) {
            return Value.record(env.siblings);
        }
    }

    record EntityRef(String entity) implements Program {
        @Override
        public Value eval(Env env) {
            Value v = env.context.get(entity);
            if (v == null)
                throw new EvaluationException(EvaluationException.Kind.UNRESOLVED_REFERENCE,
                        "entity '" + entity + "' is not in the context");
            return v;
        }
    }

    record ParamRef(String name) implements Program {
        @Override
        public Value eval(Env env) {
            Value v = env.context.param(name);
            if (v == null)
                throw new EvaluationException(EvaluationException.Kind.UNRESOLVED_REFERENCE,
                        "parameter '" + name + "' was not supplied");
            return v;
        }
    }

    record MemberNode(Program target, String name) implements Program {
        @Override
        public Value eval(Env env) {
            return field(target.eval(env), name);
        }
    }

    record IndexNode(Program target, Program index) implements Program {
        @Override
        public Value eval(Env env) {
            Value t = target.eval(env);
            Value i = index.eval(env);
            switch (t.kind()) {
                case RECORD:
                case NULL:
                    return field(t, i.toDisplayString());
                case LIST: {
                    List<Value> l = t.asList();
                    int at = position(i, l.size());
                    return l.get(at);
                }
                case STRING: {
                    String s = t.asString();
                    int at = position(i, s.length());
                    return Value.of(String.valueOf(s.charAt(at)));
                }
                default:
                    throw EvaluationException.typeMismatch("cannot index " + t.describe());
            }
        }

        private static int position(Value i, int size) {
            if (i.kind() != Value.Kind.INT)
                throw EvaluationException.typeMismatch("index must be an integer, got " + i.describe());
            long at = i.asLong();
            if (at < 0)
                at += size;
            if (at < 0 || at >= size)
                throw EvaluationException.missingField("index " + i.asLong() + " out of range for size " + size);
            return (int) at;
        }
    }

    record CallNode(String function, Program[] args) implements Program {
        @Override
        public Value eval(Env env) {
            Value[] values = new Value[args.length];
            for (int i = 0; i < args.length; i++)
                values[i] = args[i].eval(env);
            return env.context.builtins().invoke(function, Arrays.asList(values));
        }
    }

    record NotNode(Program operand) implements Program {
        @Override
        public Value eval(Env env) {
            return Value.of(!operand.eval(env).truthy());
        }
    }

    record NegNode(Program operand) implements Program {
        @Override
        public Value eval(Env env) {
            return Operators.negate(operand.eval(env));
        }
    }

    /** Short-circuit {@code and}: returns the first falsy operand, else the last. */
    record AndNode(Program left, Program right) implements Program {
        @Override
        public Value eval(Env env) {
            Value l = left.eval(env);
            return l.truthy() ? right.eval(env) : l;
        }
    }

    /** Short-circuit {@code or}: returns the first truthy operand, else the last. */
    record OrNode(Program left, Program right) implements Program {
        @Override
        public Value eval(Env env) {
            Value l = left.eval(env);
            return l.truthy() ? l : right.eval(env);
        }
    }

    record BinaryNode(String op, Program left, Program right) implements Program {
        @Override
        public Value eval(Env env) {
            return Operators.apply(op, left.eval(env), right.eval(env));
        }
    }

    record CondNode(Program condition, Program then, Program otherwise) implements Program {
        @Override
        public Value eval(Env env) {
            return condition.eval(env).truthy() ? then.eval(env) : otherwise.eval(env);
        }
    }

    /**
     * Lambda literal. Evaluates to a function value closing over the current
     * environment. A single list argument is destructured when the lambda
     * declares several parameters, so {@code (k, v) -> ...} works over the
     * pairs produced by {@code zip} and {@code enumerate}.
     */
    record LambdaNode(int arity, Program body) implements Program {
        @Override
        public Value eval(Env env) {
            return Value.function(args -> {
                List<Value> actual = args;
                if (arity > 1 && args.size() == 1 && args.get(0).kind() == Value.Kind.LIST
                        && args.get(0).asList().size() == arity)
                    actual = args.get(0).asList();
                if (actual.size() != arity)
                    throw EvaluationException.typeMismatch(
                            "lambda takes " + arity + " argument(s), got " + actual.size());
                return body.eval(env.push(actual.toArray(new Value[0])));
            });
        }
    }

    static Value field(Value target, String name) {
        if (target.kind() == Value.Kind.RECORD) {
            Value v = target.asRecord().get(name);
            if (v == null)
                throw EvaluationException.missingField("no field '" + name + "' in " + target.describe());
            return v;
        }
        if (target.isNull())
            throw EvaluationException.missingField("no field '" + name + "' on null");
        throw EvaluationException.typeMismatch("cannot read field '" + name + "' of " + target.describe());
    }
}
