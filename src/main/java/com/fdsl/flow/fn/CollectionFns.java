package com.fdsl.flow.fn;

import com.fdsl.flow.api.EvaluationException;
import com.fdsl.flow.api.Value;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Collection builtins: lambda-driven {@code map/filter/find/all/any}, folds
 * ({@code sum}, {@code len}), reshaping ({@code zip}, {@code enumerate},
 * {@code flatten}, {@code sort}) and safe access ({@code get}).
 *
 * <p>
 * A null collection is a BUILTIN_TYPE error, never silently treated as empty.
 */
final class CollectionFns {
    private CollectionFns() {
    }

    static void register(BuiltinRegistry.Builder b) {
        b.registerFn2("map", (xs, f) -> {
            Value.Function fn = Args.fn("map", f);
            List<Value> out = new ArrayList<>();
            for (Value x : Args.list("map", xs))
                out.add(Args.call(fn, x));
            return Value.list(out);
        });
        b.registerFn2("filter", (xs, f) -> {
            Value.Function fn = Args.fn("filter", f);
            List<Value> out = new ArrayList<>();
            for (Value x : Args.list("filter", xs))
                if (Args.call(fn, x).truthy())
                    out.add(x);
            return Value.list(out);
        });
        b.registerFn2("find", (xs, f) -> {
            Value.Function fn = Args.fn("find", f);
            for (Value x : Args.list("find", xs))
                if (Args.call(fn, x).truthy())
                    return x;
            return Value.NULL;
        });
        b.registerFn2("all", (xs, f) -> {
            Value.Function fn = Args.fn("all", f);
            for (Value x : Args.list("all", xs))
                if (!Args.call(fn, x).truthy())
                    return Value.FALSE;
            return Value.TRUE;
        });
        b.registerFn2("any", (xs, f) -> {
            Value.Function fn = Args.fn("any", f);
            for (Value x : Args.list("any", xs))
                if (Args.call(fn, x).truthy())
                    return Value.TRUE;
            return Value.FALSE;
        });
        b.register("sum", 1, 2, args -> {
            List<Value> xs = Args.list("sum", args.get(0));
            if (args.size() == 2) {
                Value.Function fn = Args.fn("sum", args.get(1));
                List<Value> mapped = new ArrayList<>(xs.size());
                for (Value x : xs)
                    mapped.add(Args.call(fn, x));
                xs = mapped;
            }
            return Args.sum("sum", xs);
        });
        b.registerFn1("len", x -> switch (x.kind()) {
            case STRING -> Value.of(x.asString().length());
            case LIST -> Value.of(x.asList().size());
            case RECORD -> Value.of(x.asRecord().size());
            default -> throw EvaluationException.builtinType("len", "no length for " + x.describe());
        });
        b.register("zip", 1, BuiltinRegistry.Signature.UNBOUNDED, args -> {
            List<List<Value>> lists = new ArrayList<>(args.size());
            int n = Integer.MAX_VALUE;
            for (Value a : args) {
                List<Value> l = Args.list("zip", a);
                lists.add(l);
                n = Math.min(n, l.size());
            }
            List<Value> out = new ArrayList<>(n);
            for (int i = 0; i < n; i++) {
                List<Value> tuple = new ArrayList<>(lists.size());
                for (List<Value> l : lists)
                    tuple.add(l.get(i));
                out.add(Value.list(tuple));
            }
            return Value.list(out);
        });
        b.register("enumerate", 1, 2, args -> {
            List<Value> xs = Args.list("enumerate", args.get(0));
            long start = args.size() == 2 ? Args.integer("enumerate", args.get(1)) : 0;
            List<Value> out = new ArrayList<>(xs.size());
            for (int i = 0; i < xs.size(); i++)
                out.add(Value.list(Value.of(start + i), xs.get(i)));
            return Value.list(out);
        });
        b.registerFn1("flatten", xs -> {
            List<Value> out = new ArrayList<>();
            for (Value x : Args.list("flatten", xs)) {
                if (x.kind() == Value.Kind.LIST)
                    out.addAll(x.asList());
                else
                    out.add(x);
            }
            return Value.list(out);
        });
        b.register("sort", 1, 2, args -> {
            List<Value> xs = new ArrayList<>(Args.list("sort", args.get(0)));
            if (args.size() == 2) {
                Value.Function key = Args.fn("sort", args.get(1));
                xs.sort((x, y) -> Args.compare("sort", Args.call(key, x), Args.call(key, y)));
            } else {
                xs.sort((x, y) -> Args.compare("sort", x, y));
            }
            return Value.list(xs);
        });
        b.registerFn1("reverse", xs -> {
            List<Value> out = new ArrayList<>(Args.list("reverse", xs));
            java.util.Collections.reverse(out);
            return Value.list(out);
        });
        b.registerFn1("first", xs -> {
            List<Value> l = Args.list("first", xs);
            return l.isEmpty() ? Value.NULL : l.get(0);
        });
        b.registerFn1("last", xs -> {
            List<Value> l = Args.list("last", xs);
            return l.isEmpty() ? Value.NULL : l.get(l.size() - 1);
        });
        b.registerFn1("unique", xs -> Value.list(new ArrayList<>(new LinkedHashSet<>(Args.list("unique", xs)))));
        b.registerFn1("keys", r -> {
            List<Value> out = new ArrayList<>();
            for (String k : Args.record("keys", r).keySet())
                out.add(Value.of(k));
            return Value.list(out);
        });
        b.registerFn1("values", r -> Value.list(new ArrayList<>(Args.record("values", r).values())));
        b.register("get", 2, 3, args -> {
            Value target = args.get(0);
            Value key = args.get(1);
            Value def = args.size() == 3 ? args.get(2) : Value.NULL;
            if (target.kind() == Value.Kind.RECORD)
                return target.get(key.toDisplayString(), def);
            if (target.kind() == Value.Kind.LIST && key.kind() == Value.Kind.INT) {
                List<Value> l = target.asList();
                long i = key.asLong();
                if (i < 0)
                    i += l.size();
                return i >= 0 && i < l.size() ? l.get((int) i) : def;
            }
            return def;
        });
    }
}
