package com.fdsl.flow.expr;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Parsed expression tree, as handed over by the FDSL parser.
 *
 * <p>
 * Nodes are bound polymorphically from JSON on the {@code "node"} property. The
 * static factories below build the same trees in code.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "node")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ExprAst.Literal.class, name = "literal"),
        @JsonSubTypes.Type(value = ExprAst.ListExpr.class, name = "list"),
        @JsonSubTypes.Type(value = ExprAst.DictExpr.class, name = "dict"),
        @JsonSubTypes.Type(value = ExprAst.Name.class, name = "name"),
        @JsonSubTypes.Type(value = ExprAst.Member.class, name = "member"),
        @JsonSubTypes.Type(value = ExprAst.Index.class, name = "index"),
        @JsonSubTypes.Type(value = ExprAst.Call.class, name = "call"),
        @JsonSubTypes.Type(value = ExprAst.Unary.class, name = "unary"),
        @JsonSubTypes.Type(value = ExprAst.Binary.class, name = "binary"),
        @JsonSubTypes.Type(value = ExprAst.Conditional.class, name = "conditional"),
        @JsonSubTypes.Type(value = ExprAst.Lambda.class, name = "lambda")
})
public interface ExprAst {

    record Literal(Object value) implements ExprAst {
    }

    record ListExpr(List<ExprAst> items) implements ExprAst {
    }

    record DictEntry(String key, ExprAst value) {
    }

    record DictExpr(List<DictEntry> entries) implements ExprAst {
    }

    record Name(String id) implements ExprAst {
    }

    record Member(ExprAst target, String name) implements ExprAst {
    }

    record Index(ExprAst target, ExprAst index) implements ExprAst {
    }

    record Call(String function, List<ExprAst> args) implements ExprAst {
    }

    record Unary(String op, ExprAst operand) implements ExprAst {
    }

    record Binary(String op, ExprAst left, ExprAst right) implements ExprAst {
    }

    record Conditional(ExprAst condition, ExprAst then, ExprAst otherwise) implements ExprAst {
    }

    record Lambda(List<String> params, ExprAst body) implements ExprAst {
    }

    // ── Builders ───────────────────────────────────────────────────

    static ExprAst lit(Object value) {
        return new Literal(value);
    }

    static ExprAst name(String id) {
        return new Name(id);
    }

    /** {@code Entity.attr} or a longer dotted path such as {@code a.b.c}. */
    static ExprAst ref(String dotted) {
        String[] parts = dotted.split("\\.");
        ExprAst e = new Name(parts[0]);
        for (int i = 1; i < parts.length; i++)
            e = new Member(e, parts[i]);
        return e;
    }

    static ExprAst member(ExprAst target, String name) {
        return new Member(target, name);
    }

    static ExprAst index(ExprAst target, ExprAst index) {
        return new Index(target, index);
    }

    static ExprAst call(String function, ExprAst... args) {
        return new Call(function, Arrays.asList(args));
    }

    static ExprAst unary(String op, ExprAst operand) {
        return new Unary(op, operand);
    }

    static ExprAst binary(String op, ExprAst left, ExprAst right) {
        return new Binary(op, left, right);
    }

    static ExprAst cond(ExprAst condition, ExprAst then, ExprAst otherwise) {
        return new Conditional(condition, then, otherwise);
    }

    static ExprAst lambda(String param, ExprAst body) {
        return new Lambda(List.of(param), body);
    }

    static ExprAst lambda(List<String> params, ExprAst body) {
        return new Lambda(params, body);
    }

    static ExprAst list(ExprAst... items) {
        return new ListExpr(Arrays.asList(items));
    }

    /** Alternating key/value pairs: {@code dict("a", lit(1), "b", lit(2))}. */
    static ExprAst dict(Object... keysAndValues) {
        if (keysAndValues.length % 2 != 0)
            throw new IllegalArgumentException("dict() expects key/value pairs");
        List<DictEntry> entries = new ArrayList<>();
        for (int i = 0; i < keysAndValues.length; i += 2)
            entries.add(new DictEntry((String) keysAndValues[i], (ExprAst) keysAndValues[i + 1]));
        return new DictExpr(entries);
    }
}
