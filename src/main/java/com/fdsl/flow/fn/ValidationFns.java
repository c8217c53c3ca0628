package com.fdsl.flow.fn;

import com.fdsl.flow.api.EvaluationException;
import com.fdsl.flow.api.Value;

import java.util.regex.Pattern;

/**
 * Validation builtins. {@code require} and {@code error} abort evaluation with
 * a RAISED error carrying an HTTP-style status for the transport layer.
 */
final class ValidationFns {
    static final int DEFAULT_STATUS = 400;

    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    private ValidationFns() {
    }

    static void register(BuiltinRegistry.Builder b) {
        b.register("require", 1, 3, args -> {
            if (args.get(0).truthy())
                return Value.TRUE;
            String msg = args.size() >= 2 ? args.get(1).toDisplayString() : "Validation failed";
            int status = args.size() == 3 ? (int) Args.integer("require", args.get(2)) : DEFAULT_STATUS;
            throw EvaluationException.raised(status, msg);
        });
        b.registerFn2("error", (status, msg) -> {
            throw EvaluationException.raised((int) Args.integer("error", status), msg.toDisplayString());
        });
        b.registerFn1("validate_email", x -> Value.of(!x.isNull() && EMAIL.matcher(x.toDisplayString()).matches()));
        b.register("in_range", 3, 3, args -> {
            Value v = args.get(0);
            if (!v.isNumber())
                return Value.FALSE;
            double d = v.asDouble();
            return Value.of(d >= Args.num("in_range", args.get(1)) && d <= Args.num("in_range", args.get(2)));
        });
    }
}
