package com.fdsl.flow.graph;

import com.fdsl.flow.TestModels;
import com.fdsl.flow.api.EvaluationException;
import com.fdsl.flow.expr.ExprAst;
import com.fdsl.flow.expr.ExpressionCompileException;
import com.fdsl.flow.io.Direction;
import com.fdsl.flow.io.ModelDefinition;
import org.junit.Before;
import org.junit.Test;

import java.util.List;

import static com.fdsl.flow.expr.ExprAst.*;
import static org.junit.Assert.*;

public class GraphBuilderTest {
    private GraphBuilder builder;

    @Before
    public void setUp() {
        builder = new GraphBuilder();
    }

    private ModelBuildException.Reason failure(ModelDefinition def) {
        try {
            builder.build(def);
        } catch (ModelBuildException e) {
            return e.reason();
        }
        fail("Expected the model to be rejected");
        return null;
    }

    @Test
    public void testDoubledGraph() {
        DependencyGraph g = builder.build(TestModels.doubled());

        assertEquals(2, g.entities().size());
        assertEquals(1, g.sources().size());
        assertTrue(g.edges().contains(new Edge("RawApi", "Raw", EdgeKind.PROVIDES)));
        assertTrue(g.edges().contains(new Edge("Raw", "Doubled", EdgeKind.PARENT_OF)));
        assertEquals(List.of("Doubled"), g.children("Raw"));
        assertEquals("RawApi", g.provider("Raw").get().name());
        assertTrue(g.entity("Doubled").isComposite());
        assertFalse(g.entity("Raw").isComposite());

        // RawApi -> Raw -> Doubled
        assertTrue(g.topology().topoIndex("RawApi") < g.topology().topoIndex("Raw"));
        assertTrue(g.topology().topoIndex("Raw") < g.topology().topoIndex("Doubled"));
    }

    @Test
    public void testReadAndWriteSourcesAreTaggedSeparately() {
        DependencyGraph g = builder.build(TestModels.orders());

        assertEquals(EdgeKind.PROVIDES, g.edgeKind("GetOrder", "Order").get());
        assertEquals(EdgeKind.MUTATION_RESPONSE, g.edgeKind("CreateOrder", "Order").get());
        assertEquals(EdgeKind.CONSUMES, g.edgeKind("CreateOrder", "NewOrder").get());
        assertEquals(Direction.WRITE, g.source("CreateOrder").direction());
        assertEquals("GetOrder", g.provider("Order").get().name());
        assertEquals("CreateOrder", g.mutationProvider("Order").get().name());
        assertTrue(g.entity("LineTotal").parent("LineItem").many());
    }

    @Test
    public void testWsDirectionsAndWrapper() {
        DependencyGraph g = builder.build(TestModels.echo());

        assertEquals(Direction.PUBLISH, g.source("EchoOut").direction());
        assertEquals(Direction.SUBSCRIBE, g.source("EchoIn").direction());
        assertEquals(EdgeKind.CONSUMES, g.edgeKind("EchoOut", "Processed").get());
        assertTrue(g.entity("ClientMsg").wrapper());
        assertEquals("value", g.entity("ClientMsg").wrapperAttribute().name());
        assertTrue(g.endpoint("echo").get().isDuplex());
    }

    @Test
    public void testPrimitiveEndpointValueTypeMarksWrapper() {
        ModelDefinition def = TestModels.model("prim")
                .entity("Text").attr("value", "string")
                .done()
                .wsEndpoint("t", "Text", null)
                .build();
        def.getEndpoints().get(0).setValueType("string");

        DependencyGraph g = builder.build(def);
        assertTrue(g.entity("Text").wrapper());
    }

    @Test
    public void testCycleDetection() {
        // A -> B -> A
        ModelDefinition def = TestModels.model("cycle")
                .entity("A").parent("B").attr("a", "integer", ref("B.b"))
                .entity("B").parent("A").attr("b", "integer", ref("A.a"))
                .build();

        try {
            builder.build(def);
            fail("Expected a cycle");
        } catch (ModelBuildException e) {
            assertEquals(ModelBuildException.Reason.CYCLE_DETECTED, e.reason());
            assertTrue(e.subjects().containsAll(List.of("A", "B")));
        }
    }

    @Test
    public void testSelfParentIsCycle() {
        ModelDefinition def = TestModels.model("self")
                .entity("A").parent("A").attr("a", "integer", lit(1))
                .build();
        assertEquals(ModelBuildException.Reason.CYCLE_DETECTED, failure(def));
    }

    @Test
    public void testDuplicateNames() {
        ModelDefinition def = TestModels.model("dup")
                .entity("A").attr("x", "integer")
                .entity("A").attr("y", "integer")
                .build();
        assertEquals(ModelBuildException.Reason.DUPLICATE_NAME, failure(def));

        ModelDefinition clash = TestModels.model("clash")
                .entity("Users").attr("x", "integer")
                .done()
                .rest("Users", "GET", null)
                .build();
        assertEquals(ModelBuildException.Reason.DUPLICATE_NAME, failure(clash));
    }

    @Test
    public void testDuplicateAttribute() {
        ModelDefinition def = TestModels.model("dupAttr")
                .entity("A").attr("x", "integer").attr("x", "string")
                .build();
        assertEquals(ModelBuildException.Reason.DUPLICATE_NAME, failure(def));
    }

    @Test
    public void testUnknownParent() {
        ModelDefinition def = TestModels.model("unknown")
                .entity("B").parent("Missing").attr("b", "integer", lit(1))
                .build();
        assertEquals(ModelBuildException.Reason.UNKNOWN_ENTITY, failure(def));
    }

    @Test
    public void testListParentMustBeMany() {
        ModelDefinition def = TestModels.model("listParent")
                .entity("A").attr("x", "integer")
                .entity("B").listParent("A").attr("n", "integer", call("len", name("A")))
                .build();
        try {
            builder.build(def);
            fail("Expected INVALID_ENTITY_SHAPE");
        } catch (ModelBuildException e) {
            assertEquals(ModelBuildException.Reason.INVALID_ENTITY_SHAPE, e.reason());
            assertEquals(List.of("B", "A"), e.subjects());
        }

        ModelDefinition ok = TestModels.model("listParentOk")
                .entity("A").many().attr("x", "integer")
                .entity("B").listParent("A").attr("n", "integer", call("len", name("A")))
                .build();
        assertTrue(builder.build(ok).entity("B").parents().get(0).many());
    }

    @Test
    public void testCompositeAttributeWithoutExpression() {
        ModelDefinition def = TestModels.model("shape")
                .entity("A").attr("x", "integer")
                .entity("B").parent("A").attr("y", "integer")
                .build();
        assertEquals(ModelBuildException.Reason.INVALID_ENTITY_SHAPE, failure(def));
    }

    @Test
    public void testSchemaAttributeWithExpression() {
        ModelDefinition def = TestModels.model("shape")
                .entity("A").attr("x", "integer", lit(1))
                .build();
        assertEquals(ModelBuildException.Reason.INVALID_ENTITY_SHAPE, failure(def));
    }

    @Test
    public void testUnknownAttributeType() {
        ModelDefinition def = TestModels.model("type")
                .entity("A").attr("x", "quaternion")
                .build();
        assertEquals(ModelBuildException.Reason.INVALID_ENTITY_SHAPE, failure(def));
    }

    @Test
    public void testUnresolvedNameInExpression() {
        ModelDefinition def = TestModels.model("expr")
                .entity("A").attr("x", "integer")
                .entity("B").parent("A").attr("y", "integer", ref("C.x"))
                .build();
        try {
            builder.build(def);
            fail("Expected INVALID_EXPRESSION");
        } catch (ModelBuildException e) {
            assertEquals(ModelBuildException.Reason.INVALID_EXPRESSION, e.reason());
            assertEquals(List.of("B.y"), e.subjects());
        }
    }

    @Test
    public void testBuiltinArityCheckedAtBuild() {
        ModelDefinition def = TestModels.model("arity")
                .entity("A").attr("s", "string")
                .entity("B").parent("A").attr("t", "string", call("upper", ref("A.s"), ref("A.s")))
                .build();
        try {
            builder.build(def);
            fail("Expected INVALID_EXPRESSION");
        } catch (ModelBuildException e) {
            assertEquals(ModelBuildException.Reason.INVALID_EXPRESSION, e.reason());
            assertTrue(e.getCause() instanceof ExpressionCompileException);
            assertEquals(EvaluationException.Kind.BUILTIN_ARITY,
                    ((ExpressionCompileException) e.getCause()).getKind());
            assertEquals(List.of("B.t"), e.subjects());
        }
    }

    @Test
    public void testTwoReadSourcesForOneEntity() {
        ModelDefinition def = TestModels.model("twoReads")
                .entity("A").attr("x", "integer")
                .done()
                .rest("R1", "GET", "A")
                .rest("R2", "GET", "A")
                .build();
        assertEquals(ModelBuildException.Reason.AMBIGUOUS_EDGE_KIND, failure(def));
    }

    @Test
    public void testWsSourceWithoutDirection() {
        ModelDefinition def = TestModels.model("noDir")
                .entity("A").attr("x", "integer")
                .done()
                .ws("Feed", null, "A")
                .build();
        assertEquals(ModelBuildException.Reason.AMBIGUOUS_EDGE_KIND, failure(def));
    }

    @Test
    public void testWrapperWithTwoAttributes() {
        ModelDefinition def = TestModels.model("wrap")
                .entity("W").wrapper().attr("a", "string").attr("b", "string")
                .build();
        assertEquals(ModelBuildException.Reason.INVALID_WRAPPER, failure(def));
    }

    @Test
    public void testWrapperOfRecordType() {
        ModelDefinition def = TestModels.model("wrap")
                .entity("W").wrapper().attr("a", "object")
                .build();
        assertEquals(ModelBuildException.Reason.INVALID_WRAPPER, failure(def));
    }

    @Test
    public void testEntityPopulatedByPublishSource() {
        ModelDefinition def = TestModels.model("pub")
                .entity("A").source("Out").attr("x", "integer")
                .done()
                .ws("Out", "publish", null)
                .build();
        assertEquals(ModelBuildException.Reason.UNRESOLVED_SOURCE_BINDING, failure(def));
    }

    @Test
    public void testCompositeCannotAlsoBeSourced() {
        ModelDefinition def = TestModels.model("both")
                .entity("A").attr("x", "integer")
                .entity("B").parent("A").source("Api").attr("y", "integer", ref("A.x"))
                .done()
                .rest("Api", "GET", null)
                .build();
        assertEquals(ModelBuildException.Reason.UNRESOLVED_SOURCE_BINDING, failure(def));
    }

    @Test
    public void testUnknownSourceReference() {
        ModelDefinition def = TestModels.model("missingSource")
                .entity("A").source("Nowhere").attr("x", "integer")
                .build();
        assertEquals(ModelBuildException.Reason.UNRESOLVED_SOURCE_BINDING, failure(def));
    }

    @Test
    public void testSourceParamAddsParameterEdge() {
        ModelDefinition def = TestModels.model("params")
                .entity("Session").attr("token", "string")
                .entity("Profile").attr("name", "string")
                .done()
                .rest("GetProfile", "GET", "Profile")
                .sourceParam("token", "string", ref("Session.token"))
                .build();

        DependencyGraph g = builder.build(def);
        assertTrue(g.edges().contains(new Edge("Session", "GetProfile", EdgeKind.PARAMETER)));
        assertEquals(1, g.source("GetProfile").params().size());
    }

    @Test
    public void testDeclarationIndex() {
        DependencyGraph g = builder.build(TestModels.orders());
        assertEquals(0, g.declarationIndex("Order"));
        assertEquals(3, g.declarationIndex("OrderView"));
        // sources follow entities
        assertEquals(g.entities().size(), g.declarationIndex("GetOrder"));
    }
}
