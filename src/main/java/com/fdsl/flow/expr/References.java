package com.fdsl.flow.expr;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Static reference analysis over expression trees, used by the graph builder
 * (parameter dependencies) and by join-key inference.
 */
public final class References {

    /**
     * {@code entity.field} appearing in an expression.
     *
     * @param local true when {@code entity} is a lambda parameter rather than a
     *              free name
     */
    public record FieldRef(String entity, String field, boolean local) {
        public FieldRef(String entity, String field) {
            this(entity, field, false);
        }
    }

    /** Both operands of an {@code ==} comparison between two field references. */
    public record Equality(FieldRef left, FieldRef right) {
        /** The operand on the side of {@code entity}, or null if neither side reads it. */
        public FieldRef sideOf(String entity) {
            if (left.entity().equals(entity))
                return left;
            if (right.entity().equals(entity))
                return right;
            return null;
        }

        public FieldRef otherSide(String entity) {
            if (left.entity().equals(entity))
                return right;
            if (right.entity().equals(entity))
                return left;
            return null;
        }
    }

    private References() {
    }

    /**
     * Identifiers the expression reads that are not bound by one of its own
     * lambdas. Builtin function names are not identifiers.
     */
    public static Set<String> freeNames(ExprAst ast) {
        Set<String> out = new LinkedHashSet<>();
        walk(ast, new ArrayDeque<>(), out, null, null);
        return out;
    }

    /** Every {@code Name.field} access on a free name. */
    public static List<FieldRef> fieldRefs(ExprAst ast) {
        List<FieldRef> out = new ArrayList<>();
        walk(ast, new ArrayDeque<>(), new LinkedHashSet<>(), out, null);
        return out;
    }

    /**
     * Every {@code A.x == B.y} comparison between two field references on
     * different names. At most one side may be a lambda parameter, as in
     * {@code find(B, b -> b.id == A.bId)}.
     */
    public static List<Equality> equalities(ExprAst ast) {
        List<Equality> out = new ArrayList<>();
        walk(ast, new ArrayDeque<>(), new LinkedHashSet<>(), null, out);
        return out;
    }

    private static void walk(ExprAst ast, Deque<List<String>> bound, Set<String> names,
            List<FieldRef> fields, List<Equality> equalities) {
        if (ast == null)
            return;
        if (ast instanceof ExprAst.Name n) {
            if (!isBound(n.id(), bound))
                names.add(n.id());
        } else if (ast instanceof ExprAst.Member m) {
            FieldRef ref = fieldRef(m, bound);
            if (ref != null && fields != null)
                fields.add(ref);
            walk(m.target(), bound, names, fields, equalities);
        } else if (ast instanceof ExprAst.Index i) {
            if (i.index() instanceof ExprAst.Literal lit && lit.value() instanceof String key
                    && i.target() instanceof ExprAst.Name n && !isBound(n.id(), bound) && fields != null)
                fields.add(new FieldRef(n.id(), key));
            walk(i.target(), bound, names, fields, equalities);
            walk(i.index(), bound, names, fields, equalities);
        } else if (ast instanceof ExprAst.ListExpr l) {
            if (l.items() != null)
                for (ExprAst item : l.items())
                    walk(item, bound, names, fields, equalities);
        } else if (ast instanceof ExprAst.DictExpr d) {
            if (d.entries() != null)
                for (ExprAst.DictEntry e : d.entries())
                    walk(e.value(), bound, names, fields, equalities);
        } else if (ast instanceof ExprAst.Call c) {
            if (c.args() != null)
                for (ExprAst a : c.args())
                    walk(a, bound, names, fields, equalities);
        } else if (ast instanceof ExprAst.Unary u) {
            walk(u.operand(), bound, names, fields, equalities);
        } else if (ast instanceof ExprAst.Binary b) {
            if (equalities != null && b.op().equals("==")) {
                FieldRef l = asFieldRef(b.left(), bound);
                FieldRef r = asFieldRef(b.right(), bound);
                if (l != null && r != null && !l.entity().equals(r.entity()) && !(l.local() && r.local()))
                    equalities.add(new Equality(l, r));
            }
            walk(b.left(), bound, names, fields, equalities);
            walk(b.right(), bound, names, fields, equalities);
        } else if (ast instanceof ExprAst.Conditional c) {
            walk(c.condition(), bound, names, fields, equalities);
            walk(c.then(), bound, names, fields, equalities);
            walk(c.otherwise(), bound, names, fields, equalities);
        } else if (ast instanceof ExprAst.Lambda l) {
            bound.push(l.params() == null ? List.of() : l.params());
            try {
                walk(l.body(), bound, names, fields, equalities);
            } finally {
                bound.pop();
            }
        }
    }

    private static FieldRef asFieldRef(ExprAst ast, Deque<List<String>> bound) {
        if (ast instanceof ExprAst.Member m && m.target() instanceof ExprAst.Name n)
            return new FieldRef(n.id(), m.name(), isBound(n.id(), bound));
        if (ast instanceof ExprAst.Index i && i.index() instanceof ExprAst.Literal lit
                && lit.value() instanceof String key && i.target() instanceof ExprAst.Name n)
            return new FieldRef(n.id(), key, isBound(n.id(), bound));
        return null;
    }

    private static FieldRef fieldRef(ExprAst.Member m, Deque<List<String>> bound) {
        if (m.target() instanceof ExprAst.Name n && !isBound(n.id(), bound))
            return new FieldRef(n.id(), m.name());
        return null;
    }

    private static boolean isBound(String id, Deque<List<String>> bound) {
        for (List<String> frame : bound)
            if (frame.contains(id))
                return true;
        return false;
    }
}
