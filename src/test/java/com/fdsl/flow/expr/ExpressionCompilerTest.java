package com.fdsl.flow.expr;

import com.fdsl.flow.api.Context;
import com.fdsl.flow.api.EvaluationException;
import com.fdsl.flow.api.Value;
import com.fdsl.flow.io.AttributeType;
import com.fdsl.flow.io.ModelJson;
import org.junit.Before;
import org.junit.Test;

import java.util.List;
import java.util.Map;

import static com.fdsl.flow.expr.ExprAst.*;
import static org.junit.Assert.*;

public class ExpressionCompilerTest {
    private ExpressionCompiler compiler;
    private Context ctx;
    private CompileScope scope;

    @Before
    public void setUp() {
        compiler = new ExpressionCompiler();
        ctx = Context.create()
                .put("Order", Value.of(Map.of("id", 7, "total", 12.5, "tags", List.of("a", "b"))))
                .put("Items", Value.of(List.of(Map.of("qty", 2), Map.of("qty", 3))))
                .putParam("limit", Value.of(10));
        scope = CompileScope.of(List.of("Order", "Items"), List.of("limit"));
    }

    private Value eval(ExprAst ast) {
        return compiler.compile(ast, scope).evaluate(ctx);
    }

    @Test
    public void testArithmetic() {
        assertEquals(Value.of(7), eval(binary("+", lit(3), lit(4))));
        assertEquals(Value.of(2.5), eval(binary("/", lit(5), lit(2))));
        assertEquals(Value.of(-4), eval(binary("//", lit(-7), lit(2))));
        assertEquals(Value.of(1), eval(binary("%", lit(-7), lit(2))));
        assertEquals(Value.of(1024), eval(binary("**", lit(2), lit(10))));
        assertEquals(Value.of(-3), eval(unary("-", lit(3))));
        assertEquals(Value.of("ab"), eval(binary("+", lit("a"), lit("b"))));
    }

    @Test
    public void testIntegerOverflowBecomesFloat() {
        Value sum = eval(binary("+", lit(Long.MAX_VALUE), lit(1)));
        assertEquals(Value.Kind.FLOAT, sum.kind());
        assertEquals(9.223372036854775807E18, sum.asDouble(), 0.0);

        Value product = eval(binary("*", lit(Long.MAX_VALUE), lit(2)));
        assertEquals(Value.Kind.FLOAT, product.kind());

        Value big = eval(binary("**", lit(2), lit(64)));
        assertEquals(Value.Kind.FLOAT, big.kind());
        assertEquals(Math.pow(2, 64), big.asDouble(), 0.0);

        // exact while it fits
        assertEquals(Value.of(1L << 62), eval(binary("**", lit(2), lit(62))));
        assertEquals(Value.Kind.INT, eval(binary("**", lit(-1), lit(Long.MAX_VALUE))).kind());
        assertEquals(Value.of(-1), eval(binary("**", lit(-1), lit(Long.MAX_VALUE))));
        assertEquals(Value.Kind.FLOAT, eval(binary("-", lit(Long.MIN_VALUE), lit(1))).kind());
        assertEquals(Value.Kind.FLOAT, eval(unary("-", lit(Long.MIN_VALUE))).kind());
        assertEquals(Value.Kind.FLOAT, eval(binary("//", lit(Long.MIN_VALUE), lit(-1))).kind());
    }

    @Test
    public void testOverflowIntoIntegerAttribute() {
        CompiledExpression expr = compiler.compile(binary("**", lit(2), lit(64)), scope,
                AttributeType.parse("integer", false), "Big.n");
        try {
            expr.evaluate(ctx);
            fail("Expected TYPE_MISMATCH");
        } catch (EvaluationException e) {
            assertEquals(EvaluationException.Kind.TYPE_MISMATCH, e.getKind());
            assertEquals("Big.n", e.getPath());
        }
    }

    @Test
    public void testExactPower() {
        assertEquals(1, Operators.exactPower(5, 0));
        assertEquals(3486784401L, Operators.exactPower(3, 20));
        try {
            Operators.exactPower(10, 19);
            fail("Expected overflow");
        } catch (ArithmeticException expected) {
            // 10^19 exceeds Long.MAX_VALUE
        }
    }

    @Test
    public void testDivisionByZero() {
        CompiledExpression expr = compiler.compile(binary("/", ref("Order.id"), lit(0)), scope,
                AttributeType.parse("number", false), "Ratio.r");
        try {
            expr.evaluate(ctx);
            fail("Expected DIVISION_BY_ZERO");
        } catch (EvaluationException e) {
            assertEquals(EvaluationException.Kind.DIVISION_BY_ZERO, e.getKind());
            assertEquals("Ratio.r", e.getPath());
        }
    }

    @Test
    public void testEntityParamAndMemberAccess() {
        assertEquals(Value.of(7), eval(ref("Order.id")));
        assertEquals(Value.of(10), eval(name("limit")));
        assertEquals(Value.of("b"), eval(index(ref("Order.tags"), lit(1))));
        assertEquals(Value.of("b"), eval(index(ref("Order.tags"), lit(-1))));
    }

    @Test
    public void testComparisonAndLogic() {
        assertEquals(Value.TRUE, eval(binary(">", ref("Order.total"), name("limit"))));
        assertEquals(Value.TRUE, eval(binary("==", ref("Order.id"), lit(7.0))));
        assertEquals(Value.TRUE, eval(binary("in", lit("a"), ref("Order.tags"))));
        assertEquals(Value.of(0), eval(binary("and", lit(0), call("error", lit(500), lit("never")))));
        assertEquals(Value.of("x"), eval(binary("or", lit(""), lit("x"))));
        assertEquals(Value.TRUE, eval(unary("not", name("None"))));
        assertEquals(Value.of("big"), eval(cond(binary(">", ref("Order.total"), lit(10)), lit("big"), lit("small"))));
    }

    @Test
    public void testLiteralNames() {
        assertEquals(Value.TRUE, eval(name("True")));
        assertEquals(Value.FALSE, eval(name("false")));
        assertEquals(Value.NULL, eval(name("null")));
    }

    @Test
    public void testLambdas() {
        Value qtys = eval(call("map", name("Items"), lambda("i", ref("i.qty"))));
        assertEquals(Value.list(Value.of(2), Value.of(3)), qtys);

        Value big = eval(call("filter", name("Items"), lambda("i", binary(">", ref("i.qty"), lit(2)))));
        assertEquals(1, big.asList().size());

        // inner lambda sees the outer parameter
        Value nested = eval(call("map", name("Items"), lambda("i",
                call("sum", call("map", list(lit(1), lit(2)), lambda("n", binary("*", name("n"), ref("i.qty"))))))));
        assertEquals(Value.list(Value.of(6), Value.of(9)), nested);
    }

    @Test
    public void testFilterThenSumOfEmpty() {
        Value total = eval(call("sum", call("filter", name("Items"),
                lambda("i", binary(">", ref("i.qty"), lit(100))))));
        assertEquals(Value.of(0), total);
    }

    @Test
    public void testDictAndList() {
        Value v = eval(dict("id", ref("Order.id"), "n", call("len", list(lit(1), lit(2), lit(3)))));
        assertEquals(Value.of(Map.of("id", 7, "n", 3)), v);
    }

    @Test
    public void testSiblingsAndSelf() {
        CompileScope attr = CompileScope.forAttribute("View", List.of("base"), List.of("Order"), List.of());
        CompiledExpression expr = compiler.compile(binary("*", name("base"), lit(2)), attr);

        assertEquals(Value.of(14), expr.evaluate(ctx, Map.of("base", Value.of(7))));
    }

    @Test
    public void testUnresolvedName() {
        try {
            compiler.compile(ref("Missing.x"), scope);
            fail("Expected ExpressionCompileException");
        } catch (ExpressionCompileException e) {
            assertEquals(EvaluationException.Kind.UNRESOLVED_REFERENCE, e.getKind());
            assertEquals("Missing", e.getSubject());
        }
    }

    @Test
    public void testUnknownFunction() {
        try {
            compiler.compile(call("explode", lit(1)));
            fail("Expected ExpressionCompileException");
        } catch (ExpressionCompileException e) {
            assertEquals(EvaluationException.Kind.UNRESOLVED_REFERENCE, e.getKind());
        }
    }

    @Test
    public void testBuiltinArity() {
        try {
            compiler.compile(call("len"));
            fail("Expected ExpressionCompileException");
        } catch (ExpressionCompileException e) {
            assertEquals(EvaluationException.Kind.BUILTIN_ARITY, e.getKind());
            assertEquals("len", e.getSubject());
        }
    }

    @Test
    public void testMissingFieldOnNullableYieldsNull() {
        CompiledExpression nullable = compiler.compile(ref("Order.nope"), scope,
                AttributeType.parse("string", true), "V.nope");
        assertEquals(Value.NULL, nullable.evaluate(ctx));

        CompiledExpression strict = compiler.compile(ref("Order.nope"), scope,
                AttributeType.parse("string", false), "V.nope");
        try {
            strict.evaluate(ctx);
            fail("Expected MISSING_FIELD");
        } catch (EvaluationException e) {
            assertEquals(EvaluationException.Kind.MISSING_FIELD, e.getKind());
            assertEquals("V.nope", e.getPath());
        }
    }

    @Test
    public void testResultCoercedToDeclaredType() {
        CompiledExpression expr = compiler.compile(lit("seven"), scope, AttributeType.parse("integer", false),
                "V.n");
        try {
            expr.evaluate(ctx);
            fail("Expected TYPE_MISMATCH");
        } catch (EvaluationException e) {
            assertEquals(EvaluationException.Kind.TYPE_MISMATCH, e.getKind());
            assertEquals("V.n", e.getPath());
        }
    }

    @Test
    public void testAstFromJson() throws Exception {
        String json = """
                {"node": "call", "function": "upper",
                 "args": [{"node": "member", "target": {"node": "name", "id": "Order"}, "name": "tags"}]}
                """;
        ExprAst ast = ModelJson.mapper().readValue(json, ExprAst.class);

        assertEquals(call("upper", ref("Order.tags")), ast);
        assertEquals(Value.of("[\"A\",\"B\"]"), eval(ast));
    }
}
