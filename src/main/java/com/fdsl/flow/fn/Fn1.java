package com.fdsl.flow.fn;

import com.fdsl.flow.api.Value;

/**
 * Builtin taking exactly one argument.
 *
 * <p>
 * Registered through
 * {@link BuiltinRegistry.Builder#registerFn1(String, Fn1)}.
 *
 * <p>
 * Examples:
 * <ul>
 * <li>{@code a -> Value.of(a.asString().toUpperCase())}</li>
 * <li>{@code a -> Value.of(Math.abs(a.asDouble()))}</li>
 * </ul>
 */
@FunctionalInterface
public interface Fn1 {
    /**
     * Applies the function.
     *
     * @param a The argument.
     * @return The result.
     */
    Value apply(Value a);
}
