package com.fdsl.flow.expr;

import com.fdsl.flow.api.Context;
import com.fdsl.flow.api.EvaluationException;
import com.fdsl.flow.api.Value;
import com.fdsl.flow.io.AttributeType;

import java.util.Map;

/**
 * An expression compiled for one attribute, ready to evaluate.
 *
 * <p>
 * Immutable and stateless: the same instance is evaluated concurrently by
 * every request; only the {@link Context} differs. Evaluating twice against an
 * unchanged context yields equal values (unless a builtin such as
 * {@code now()} reads the clock).
 */
public final class CompiledExpression {
    private final Program root;
    private final ExprAst source;
    private final AttributeType type;
    private final String path;

    CompiledExpression(Program root, ExprAst source, AttributeType type, String path) {
        this.root = root;
        this.source = source;
        this.type = type;
        this.path = path;
    }

    /** Evaluates without sibling attributes in scope. */
    public Value evaluate(Context context) {
        return evaluate(context, Map.of());
    }

    /**
     * Evaluates with the attributes already computed for the current entity.
     *
     * @throws EvaluationException with {@link #path()} attached
     */
    public Value evaluate(Context context, Map<String, Value> siblings) {
        Value v;
        try {
            v = root.eval(new Env(context, siblings));
        } catch (EvaluationException e) {
            if (e.getKind() == EvaluationException.Kind.MISSING_FIELD && type.nullable())
                return Value.NULL;
            throw e.withPath(path);
        }
        try {
            return type.coerce(v);
        } catch (EvaluationException e) {
            throw e.withPath(path);
        }
    }

    /** The tree this expression was compiled from, for static analysis. */
    public ExprAst source() {
        return source;
    }

    public AttributeType type() {
        return type;
    }

    public String path() {
        return path;
    }

    @Override
    public String toString() {
        return "CompiledExpression[" + path + ": " + type + "]";
    }
}
