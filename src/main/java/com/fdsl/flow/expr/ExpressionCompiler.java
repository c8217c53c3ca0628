package com.fdsl.flow.expr;

import com.fdsl.flow.api.EvaluationException;
import com.fdsl.flow.api.Value;
import com.fdsl.flow.fn.BuiltinRegistry;
import com.fdsl.flow.io.AttributeType;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Compiles parsed expression trees into immutable {@link CompiledExpression}s.
 *
 * <p>
 * Every identifier is resolved once, here, to one of: lambda parameter
 * (innermost first), sibling attribute, the entity itself, a visible entity,
 * or an endpoint parameter. Builtin calls are checked against the registry's
 * arity. Nothing is left to string lookup at evaluation time except record
 * field names.
 */
public final class ExpressionCompiler {
    private static final Set<String> TRUE_NAMES = Set.of("true", "True");
    private static final Set<String> FALSE_NAMES = Set.of("false", "False");
    private static final Set<String> NULL_NAMES = Set.of("null", "None");

    private final BuiltinRegistry builtins;

    public ExpressionCompiler(BuiltinRegistry builtins) {
        this.builtins = builtins;
    }

    public ExpressionCompiler() {
        this(BuiltinRegistry.standard());
    }

    public BuiltinRegistry builtins() {
        return builtins;
    }

    /** Compiles a self-contained expression: literals, builtins and lambdas only. */
    public CompiledExpression compile(ExprAst ast) {
        return compile(ast, CompileScope.EMPTY, AttributeType.ANY, "<expr>");
    }

    public CompiledExpression compile(ExprAst ast, CompileScope scope) {
        return compile(ast, scope, AttributeType.ANY, "<expr>");
    }

    /**
     * Compiles the expression of one attribute.
     *
     * @param path reported in evaluation errors, {@code Entity.attr}
     * @throws ExpressionCompileException on unresolved names or bad arity
     */
    public CompiledExpression compile(ExprAst ast, CompileScope scope, AttributeType type, String path) {
        if (ast == null)
            throw new IllegalArgumentException("No expression to compile for " + path);
        Program root = new Resolver(scope).compile(ast);
        return new CompiledExpression(root, ast, type, path);
    }

    private final class Resolver {
        private final CompileScope scope;
        private final Deque<List<String>> frames = new ArrayDeque<>();

        Resolver(CompileScope scope) {
            this.scope = scope;
        }

        Program compile(ExprAst ast) {
            if (ast instanceof ExprAst.Literal l)
                return new Nodes.Const(Value.of(l.value()));
            if (ast instanceof ExprAst.ListExpr l)
                return new Nodes.ListNode(compileAll(l.items()));
            if (ast instanceof ExprAst.DictExpr d) {
                String[] keys = new String[d.entries().size()];
                Program[] values = new Program[keys.length];
                for (int i = 0; i < keys.length; i++) {
                    keys[i] = d.entries().get(i).key();
                    values[i] = compile(d.entries().get(i).value());
                }
                return new Nodes.DictNode(keys, values);
            }
            if (ast instanceof ExprAst.Name n)
                return resolveName(n.id());
            if (ast instanceof ExprAst.Member m)
                return new Nodes.MemberNode(compile(m.target()), m.name());
            if (ast instanceof ExprAst.Index i)
                return new Nodes.IndexNode(compile(i.target()), compile(i.index()));
            if (ast instanceof ExprAst.Call c)
                return compileCall(c);
            if (ast instanceof ExprAst.Unary u)
                return compileUnary(u);
            if (ast instanceof ExprAst.Binary b)
                return compileBinary(b);
            if (ast instanceof ExprAst.Conditional c)
                return new Nodes.CondNode(compile(c.condition()), compile(c.then()), compile(c.otherwise()));
            if (ast instanceof ExprAst.Lambda l)
                return compileLambda(l);
            throw new IllegalArgumentException("Unsupported expression node: " + ast);
        }

        private Program[] compileAll(List<ExprAst> asts) {
            if (asts == null)
                return new Program[0];
            Program[] out = new Program[asts.size()];
            for (int i = 0; i < out.length; i++)
                out[i] = compile(asts.get(i));
            return out;
        }

        private Program resolveName(String id) {
            int depth = 0;
            for (List<String> frame : frames) {
                int slot = frame.indexOf(id);
                if (slot >= 0)
                    return new Nodes.SlotRef(depth, slot);
                depth++;
            }
            if (TRUE_NAMES.contains(id))
                return new Nodes.Const(Value.TRUE);
            if (FALSE_NAMES.contains(id))
                return new Nodes.Const(Value.FALSE);
            if (NULL_NAMES.contains(id))
                return new Nodes.Const(Value.NULL);
            if (scope.siblings().contains(id))
                return new Nodes.SiblingRef(id);
            if (id.equals(scope.self()))
                return new Nodes.SelfRef(id);
            if (scope.entities().contains(id))
                return new Nodes.EntityRef(id);
            if (scope.params().contains(id))
                return new Nodes.ParamRef(id);
            String hint = builtins.contains(id) ? " (builtin '" + id + "' must be called)" : "";
            throw new ExpressionCompileException(EvaluationException.Kind.UNRESOLVED_REFERENCE, id,
                    "unresolved reference '" + id + "'" + hint);
        }

        private Program compileCall(ExprAst.Call c) {
            BuiltinRegistry.Builtin b = builtins.lookup(c.function());
            if (b == null)
                throw new ExpressionCompileException(EvaluationException.Kind.UNRESOLVED_REFERENCE, c.function(),
                        "unknown function '" + c.function() + "'");
            int argc = c.args() == null ? 0 : c.args().size();
            if (!b.signature().accepts(argc))
                throw new ExpressionCompileException(EvaluationException.Kind.BUILTIN_ARITY, c.function(),
                        c.function() + "() takes " + b.signature() + " arguments, got " + argc);
            return new Nodes.CallNode(c.function(), compileAll(c.args()));
        }

        private Program compileUnary(ExprAst.Unary u) {
            Program operand = compile(u.operand());
            return switch (u.op()) {
                case "not", "!" -> new Nodes.NotNode(operand);
                case "-" -> new Nodes.NegNode(operand);
                case "+" -> operand;
                default -> throw new IllegalArgumentException("Unknown unary operator: " + u.op());
            };
        }

        private Program compileBinary(ExprAst.Binary b) {
            Program left = compile(b.left());
            Program right = compile(b.right());
            switch (b.op()) {
                case "and":
                case "&&":
                    return new Nodes.AndNode(left, right);
                case "or":
                case "||":
                    return new Nodes.OrNode(left, right);
                default:
                    if (!Operators.isKnown(b.op()))
                        throw new IllegalArgumentException("Unknown binary operator: " + b.op());
                    return new Nodes.BinaryNode(b.op(), left, right);
            }
        }

        private Program compileLambda(ExprAst.Lambda l) {
            List<String> params = l.params() == null ? List.of() : List.copyOf(l.params());
            if (new HashSet<>(params).size() != params.size())
                throw new IllegalArgumentException("Duplicate lambda parameter in " + params);
            frames.push(params);
            try {
                return new Nodes.LambdaNode(params.size(), compile(l.body()));
            } finally {
                frames.pop();
            }
        }
    }
}
