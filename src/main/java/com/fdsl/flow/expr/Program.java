package com.fdsl.flow.expr;

import com.fdsl.flow.api.Value;

/**
 * A compiled expression node. Implementations are immutable; all per-call
 * state lives in the {@link Env}.
 */
@FunctionalInterface
interface Program {
    Value eval(Env env);
}
