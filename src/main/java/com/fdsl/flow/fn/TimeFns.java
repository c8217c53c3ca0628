package com.fdsl.flow.fn;

import com.fdsl.flow.api.EvaluationException;
import com.fdsl.flow.api.Value;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;

/**
 * Date builtins. Timestamps are epoch milliseconds; formatting and parsing use
 * UTC.
 */
final class TimeFns {
    private TimeFns() {
    }

    static void register(BuiltinRegistry.Builder b) {
        b.registerFn0("now", () -> Value.of(System.currentTimeMillis()));
        b.register("format_date", 1, 2, args -> {
            long ms = Args.integer("format_date", args.get(0));
            DateTimeFormatter f = args.size() == 1 ? DateTimeFormatter.ISO_INSTANT
                    : formatter("format_date", Args.str("format_date", args.get(1)));
            try {
                return Value.of(f.format(Instant.ofEpochMilli(ms).atZone(ZoneOffset.UTC)));
            } catch (DateTimeException e) {
                throw EvaluationException.builtinType("format_date", "cannot format " + ms + ": " + e.getMessage());
            }
        });
        b.register("parse_date", 1, 2, args -> {
            String s = Args.str("parse_date", args.get(0));
            try {
                if (args.size() == 1)
                    return Value.of(Instant.parse(s).toEpochMilli());
                DateTimeFormatter f = formatter("parse_date", Args.str("parse_date", args.get(1)));
                TemporalAccessor t = f.parseBest(s, LocalDateTime::from, LocalDate::from);
                LocalDateTime dt = t instanceof LocalDate d ? d.atStartOfDay() : (LocalDateTime) t;
                return Value.of(dt.toInstant(ZoneOffset.UTC).toEpochMilli());
            } catch (DateTimeException e) {
                throw EvaluationException.builtinType("parse_date", "cannot parse '" + s + "'");
            }
        });
    }

    private static DateTimeFormatter formatter(String fn, String pattern) {
        try {
            return DateTimeFormatter.ofPattern(pattern);
        } catch (IllegalArgumentException e) {
            throw EvaluationException.builtinType(fn, "bad pattern '" + pattern + "'");
        }
    }
}
