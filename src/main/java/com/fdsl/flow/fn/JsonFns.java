package com.fdsl.flow.fn;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fdsl.flow.api.EvaluationException;
import com.fdsl.flow.api.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON and record-shaping builtins, backed by Jackson.
 */
final class JsonFns {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonFns() {
    }

    static void register(BuiltinRegistry.Builder b) {
        b.registerFn1("jsonParse", JsonFns::parse);
        b.registerFn1("fromJson", JsonFns::parse);
        b.registerFn1("toJson", JsonFns::stringify);
        b.register("jsonStringify", 1, 2, args -> {
            if (args.size() == 1)
                return stringify(args.get(0));
            try {
                return Value.of(MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(args.get(0).toJson()));
            } catch (JsonProcessingException e) {
                throw EvaluationException.builtinType("jsonStringify", e.getOriginalMessage());
            }
        });
        b.registerFn2("pick", (r, ks) -> {
            Map<String, Value> src = Args.record("pick", r);
            Map<String, Value> out = new LinkedHashMap<>();
            for (Value k : Args.list("pick", ks)) {
                Value v = src.get(k.toDisplayString());
                if (v != null)
                    out.put(k.toDisplayString(), v);
            }
            return Value.record(out);
        });
        b.registerFn2("omit", (r, ks) -> {
            Map<String, Value> out = new LinkedHashMap<>(Args.record("omit", r));
            for (Value k : Args.list("omit", ks))
                out.remove(k.toDisplayString());
            return Value.record(out);
        });
        b.register("merge", 1, BuiltinRegistry.Signature.UNBOUNDED, args -> {
            Map<String, Value> out = new LinkedHashMap<>();
            for (Value r : args)
                out.putAll(Args.record("merge", r));
            return Value.record(out);
        });
        b.registerFn2("hasKey", (r, k) -> Value.of(r.has(k.toDisplayString())));
        b.register("getPath", 2, 3, args -> {
            Value def = args.size() == 3 ? args.get(2) : Value.NULL;
            Value cur = args.get(0);
            for (String part : Args.str("getPath", args.get(1)).split("\\.")) {
                if (cur.kind() == Value.Kind.LIST && part.matches("-?\\d+")) {
                    List<Value> l = cur.asList();
                    int i = Integer.parseInt(part);
                    if (i < 0)
                        i += l.size();
                    if (i < 0 || i >= l.size())
                        return def;
                    cur = l.get(i);
                } else {
                    cur = cur.get(part, null);
                    if (cur == null)
                        return def;
                }
            }
            return cur;
        });
    }

    private static Value parse(Value s) {
        try {
            return Value.fromJson(MAPPER.readTree(Args.str("jsonParse", s)));
        } catch (JsonProcessingException e) {
            throw EvaluationException.builtinType("jsonParse", e.getOriginalMessage());
        }
    }

    private static Value stringify(Value v) {
        try {
            return Value.of(MAPPER.writeValueAsString(v.toJson()));
        } catch (JsonProcessingException e) {
            throw EvaluationException.builtinType("jsonStringify", e.getOriginalMessage());
        }
    }
}
