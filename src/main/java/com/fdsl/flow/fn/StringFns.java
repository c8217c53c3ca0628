package com.fdsl.flow.fn;

import com.fdsl.flow.api.EvaluationException;
import com.fdsl.flow.api.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * String builtins. {@code lower}, {@code upper} and the predicates accept any
 * value and work on its display string; the rest require strings.
 */
final class StringFns {
    private StringFns() {
    }

    static void register(BuiltinRegistry.Builder b) {
        b.registerFn1("lower", x -> Value.of(x.toDisplayString().toLowerCase(Locale.ROOT)));
        b.registerFn1("upper", x -> Value.of(x.toDisplayString().toUpperCase(Locale.ROOT)));
        b.registerFn1("trim", x -> Value.of(Args.str("trim", x).trim()));
        b.registerFn1("str", x -> Value.of(x.toDisplayString()));
        b.register("concat", 1, BuiltinRegistry.Signature.UNBOUNDED, args -> {
            StringBuilder sb = new StringBuilder();
            for (Value a : args)
                sb.append(a.toDisplayString());
            return Value.of(sb.toString());
        });

        b.registerFn2("contains", (s, sub) -> Value.of(s.toDisplayString().contains(sub.toDisplayString())));
        b.registerFn2("icontains", (s, sub) -> Value.of(s.toDisplayString().toLowerCase(Locale.ROOT)
                .contains(sub.toDisplayString().toLowerCase(Locale.ROOT))));
        b.registerFn2("startswith", (s, p) -> Value.of(s.toDisplayString().startsWith(p.toDisplayString())));
        b.registerFn2("endswith", (s, p) -> Value.of(s.toDisplayString().endsWith(p.toDisplayString())));

        b.register("split", 1, 2, args -> {
            String s = Args.str("split", args.get(0));
            List<Value> out = new ArrayList<>();
            if (args.size() == 1) {
                for (String part : s.trim().split("\\s+"))
                    if (!part.isEmpty())
                        out.add(Value.of(part));
            } else {
                String sep = Args.str("split", args.get(1));
                if (sep.isEmpty())
                    throw EvaluationException.builtinType("split", "empty separator");
                for (String part : s.split(Pattern.quote(sep), -1))
                    out.add(Value.of(part));
            }
            return Value.list(out);
        });
        b.register("join", 1, 2, args -> {
            String sep = args.size() == 2 ? Args.str("join", args.get(1)) : "";
            List<String> parts = new ArrayList<>();
            for (Value v : Args.list("join", args.get(0)))
                parts.add(v.toDisplayString());
            return Value.of(String.join(sep, parts));
        });
        b.register("replace", 3, 3, args -> Value.of(Args.str("replace", args.get(0))
                .replace(Args.str("replace", args.get(1)), Args.str("replace", args.get(2)))));
        b.register("substring", 2, 3, args -> {
            String s = Args.str("substring", args.get(0));
            int start = clamp(Args.integer("substring", args.get(1)), s.length());
            int end = args.size() == 3 ? clamp(Args.integer("substring", args.get(2)), s.length()) : s.length();
            return Value.of(start >= end ? "" : s.substring(start, end));
        });
    }

    // Python slice semantics: negative counts from the end, out of range clamps
    private static int clamp(long i, int len) {
        if (i < 0)
            i += len;
        return (int) Math.max(0, Math.min(len, i));
    }
}
