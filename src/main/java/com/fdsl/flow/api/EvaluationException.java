package com.fdsl.flow.api;

import lombok.Getter;

/**
 * Typed failure raised while evaluating a compiled expression or validating a
 * value against its declared attribute type.
 *
 * <p>
 * The {@code path} names the attribute being computed ({@code Entity.attr}). It
 * is empty while the error travels up through the expression tree and is
 * attached once, by the compiled expression at the top.
 */
@Getter
public class EvaluationException extends RuntimeException {

    public enum Kind {
        UNRESOLVED_REFERENCE,
        TYPE_MISMATCH,
        DIVISION_BY_ZERO,
        BUILTIN_ARITY,
        BUILTIN_TYPE,
        MISSING_FIELD,
        /** Raised explicitly by {@code error()} or a failed {@code require()}. */
        RAISED
    }

    private final Kind kind;
    private final String path;
    private final int status;
    private final String detail;

    public EvaluationException(Kind kind, String detail) {
        this(kind, null, detail, 0, null);
    }

    public EvaluationException(Kind kind, String path, String detail, int status, Throwable cause) {
        super(format(kind, path, detail), cause);
        this.kind = kind;
        this.path = path;
        this.detail = detail;
        this.status = status;
    }

    /** Returns a copy carrying the given attribute path, keeping an existing path if already set. */
    public EvaluationException withPath(String newPath) {
        if (path != null)
            return this;
        EvaluationException e = new EvaluationException(kind, newPath, detail, status, getCause());
        e.setStackTrace(getStackTrace());
        return e;
    }

    public static EvaluationException typeMismatch(String detail) {
        return new EvaluationException(Kind.TYPE_MISMATCH, detail);
    }

    public static EvaluationException missingField(String detail) {
        return new EvaluationException(Kind.MISSING_FIELD, detail);
    }

    public static EvaluationException builtinType(String function, String detail) {
        return new EvaluationException(Kind.BUILTIN_TYPE, function + "(): " + detail);
    }

    public static EvaluationException raised(int status, String message) {
        return new EvaluationException(Kind.RAISED, null, message, status, null);
    }

    private static String format(Kind kind, String path, String detail) {
        return path == null ? kind + ": " + detail : kind + " at " + path + ": " + detail;
    }
}
