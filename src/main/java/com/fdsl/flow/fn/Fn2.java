package com.fdsl.flow.fn;

import com.fdsl.flow.api.Value;

/**
 * Builtin taking exactly two arguments.
 *
 * <p>
 * Collection builtins receive the collection first and the lambda second:
 * {@code (xs, fn) -> ...}.
 */
@FunctionalInterface
public interface Fn2 {
    /**
     * Applies the function.
     *
     * @param a First argument.
     * @param b Second argument.
     * @return The result.
     */
    Value apply(Value a, Value b);
}
