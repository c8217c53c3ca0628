package com.fdsl.flow.fn;

import com.fdsl.flow.api.Value;

import java.util.List;

/**
 * Builtin with a variable argument count. The registry checks the count
 * against the declared {@link BuiltinRegistry.Signature} before calling.
 *
 * Implementations must not keep a reference to {@code args}.
 */
@FunctionalInterface
public interface FnN {
    /**
     * Computes a result from the evaluated arguments.
     *
     * @param args The argument values (read-only).
     * @return The result.
     */
    Value apply(List<Value> args);
}
