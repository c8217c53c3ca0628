package com.fdsl.flow.expr;

import com.fdsl.flow.api.Context;
import com.fdsl.flow.api.Value;

import java.util.Map;

/**
 * Evaluation environment: the request context, the attributes of the entity
 * computed so far, and the chain of lambda frames. Lambda parameters are
 * addressed by (depth, slot), resolved at compile time.
 */
final class Env {
    final Context context;
    final Map<String, Value> siblings;
    private final Value[] slots;
    private final Env outer;

    Env(Context context, Map<String, Value> siblings) {
        this(context, siblings, null, null);
    }

    private Env(Context context, Map<String, Value> siblings, Value[] slots, Env outer) {
        this.context = context;
        this.siblings = siblings;
        this.slots = slots;
        this.outer = outer;
    }

    Env push(Value[] frame) {
        return new Env(context, siblings, frame, this);
    }

    Value slot(int depth, int index) {
        Env e = this;
        for (int i = 0; i < depth; i++)
            e = e.outer;
        return e.slots[index];
    }
}
