package com.reasoning.kgml;

import com.reasoning.kgml.api.GraphListener;
import com.reasoning.kgml.dsl.ValidationResult;
import com.reasoning.kgml.engine.ExecutionResult;
import com.reasoning.kgml.engine.KgmlConfig;
import com.reasoning.kgml.error.CommandFailedException;
import com.reasoning.kgml.error.ErrorKind;
import com.reasoning.kgml.error.KgmlSyntaxException;
import com.reasoning.kgml.error.LexicalException;
import com.reasoning.kgml.fn.KgCallable;
import com.reasoning.kgml.graph.GraphVersion;
import com.reasoning.kgml.node.GraphNode;
import com.reasoning.kgml.node.OutcomeNode;
import com.reasoning.kgml.util.ExecutionLog;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;

public class KgmlGraphTest {

    @Test
    public void testParseErrorsLeaveGraphUntouched() {
        try (KgmlGraph kg = new KgmlGraph()) {
            try {
                kg.execute("KG► C► A : type=\"DataNode\" KGNODE► X type=\"Y\" ◄");
                fail("Expected KgmlSyntaxException");
            } catch (KgmlSyntaxException e) {
                assertEquals(ErrorKind.SYNTAX, e.kind());
            }
            try {
                kg.execute("KG► C► A : type=\"DataNode\", note=\"unterminated ◄");
                fail("Expected LexicalException");
            } catch (LexicalException e) {
                assertEquals(ErrorKind.LEXICAL, e.kind());
            }
            assertEquals(0, kg.graph().nodeCount());
        }
    }

    @Test
    public void testValidate() {
        try (KgmlGraph kg = new KgmlGraph()) {
            ValidationResult result = kg.validate("KG► KGNODE► X type=\"Y\" ◄");
            assertFalse(result.valid());
            assertTrue(result.message().contains("':'"));
            assertTrue(kg.validate("KG► ◄").valid());
        }
    }

    @Test
    public void testProgrammaticNodesAndListeners() {
        try (KgmlGraph kg = new KgmlGraph()) {
            List<String> updated = new ArrayList<>();
            kg.addGraphListener(new GraphListener() {
                @Override
                public void nodeUpdated(GraphNode node) {
                    updated.add(node.uid());
                }
            });
            ExecutionLog audit = new ExecutionLog();
            kg.addListener(audit);

            OutcomeNode check = kg.addNode(new OutcomeNode("Check"));
            check.setTargetEvalState(42L);
            check.attach(KgCallable.of("answer", args -> 42L));

            ExecutionResult result = kg.execute("KG► E► Check ◄");
            assertEquals(42L, result.evaluation("Check"));
            assertEquals(1.0, check.weight(), 0.0);
            assertEquals(List.of("Check"), updated);
            assertEquals(1, audit.entries().size());
        }
    }

    @Test
    public void testNamedCallablesResolveFromRegistry() {
        try (KgmlGraph kg = new KgmlGraph()) {
            kg.functions().register("answer", args -> 42);
            kg.execute("KG► C► Q : type=\"OutcomeNode\", callable=\"answer\", target_eval_state=42 E► Q ◄");
            assertEquals(1.0, ((OutcomeNode) kg.graph().getNode("Q")).weight(), 0.0);
        }
    }

    @Test
    public void testSourceCompilationIsOptIn() {
        String program = "KG►\n"
                + "C► Sq : type=\"FunctionNode\", code=\"function func(x) { return x * x; }\"\n"
                + "E► Sq : 6\n"
                + "◄";
        try (KgmlGraph kg = new KgmlGraph()) {
            try {
                kg.execute(program);
                fail("Expected CommandFailedException");
            } catch (CommandFailedException e) {
                assertEquals(ErrorKind.SEMANTIC, e.kind());
                assertEquals(1, e.commandIndex());
            }
        }
        try (KgmlGraph kg = new KgmlGraph(KgmlConfig.builder().sourceCompilation(true).build())) {
            ExecutionResult result = kg.execute(program);
            assertEquals(36L, result.evaluation("Sq"));
        }
    }

    @Test
    public void testExecuteAsync() throws Exception {
        try (KgmlGraph kg = new KgmlGraph()) {
            ExecutionResult result = kg.executeAsync("KG► C► A : type=\"DataNode\" E► A : \"hi\" ◄")
                    .get(5, TimeUnit.SECONDS);
            assertEquals("hi", result.evaluation("A"));

            try {
                kg.executeAsync("KG► C► ◄").get(5, TimeUnit.SECONDS);
                fail("Expected ExecutionException");
            } catch (ExecutionException e) {
                assertTrue(e.getCause() instanceof KgmlSyntaxException);
            }
        }
    }

    @Test
    public void testDispatcherSharesGraph() throws Exception {
        try (KgmlGraph kg = new KgmlGraph(KgmlConfig.builder().ringBufferSize(16).build())) {
            kg.dispatcher().submit("KG► C► A : type=\"DataNode\" ◄").get(5, TimeUnit.SECONDS);
            assertSame(kg.dispatcher(), kg.dispatcher());
            assertTrue(kg.graph().containsNode("A"));
        }
    }

    @Test
    public void testVersionsAndExports() {
        try (KgmlGraph kg = new KgmlGraph()) {
            kg.execute("KG► C► A : type=\"DataNode\", content=1 ◄");
            int v = kg.snapshot("one node");
            kg.execute("KG► C► B : type=\"DataNode\" ◄");
            kg.rollback(v);

            List<GraphVersion> versions = kg.versions();
            assertEquals(1, versions.size());
            assertEquals(1, kg.graph().nodeCount());
            assertTrue(kg.serialize().contains("C► A : type=\"DataNode\", content=1"));
            assertTrue(kg.toJson().contains("\"id\" : \"A\""));
            assertTrue(kg.explain().dump().contains("A : DataNode"));
        }
    }
}
