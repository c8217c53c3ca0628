package com.fdsl.flow.expr;

import com.fdsl.flow.api.EvaluationException;

import lombok.Getter;

/**
 * Static error found while compiling an expression tree: an identifier that
 * resolves to nothing, a call to an unknown builtin, or a builtin called with
 * the wrong number of arguments.
 */
@Getter
public class ExpressionCompileException extends RuntimeException {
    private final EvaluationException.Kind kind;
    private final String subject;

    public ExpressionCompileException(EvaluationException.Kind kind, String subject, String message) {
        super(kind + ": " + message);
        this.kind = kind;
        this.subject = subject;
    }
}
