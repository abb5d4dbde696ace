package com.reasoning.kgml.engine;

import com.reasoning.kgml.dsl.Kgml;
import com.reasoning.kgml.dsl.Program;
import com.reasoning.kgml.error.CommandFailedException;
import com.reasoning.kgml.error.ErrorKind;
import com.reasoning.kgml.fn.CallableResolver;
import com.reasoning.kgml.fn.FunctionRegistry;
import com.reasoning.kgml.fn.NativeCallableProvider;
import com.reasoning.kgml.graph.KnowledgeGraph;
import com.reasoning.kgml.node.DataNode;
import com.reasoning.kgml.node.OutcomeNode;
import com.reasoning.kgml.util.ExecutionLog;
import org.junit.After;
import org.junit.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;

public class KgmlExecutorAsyncTest {
    private final KnowledgeGraph graph = new KnowledgeGraph();
    private final FunctionRegistry functions = new FunctionRegistry();
    private final ExecutorService workers = Executors.newFixedThreadPool(2);
    private final ExecutionLog audit = new ExecutionLog();
    private final KgmlExecutor executor = new KgmlExecutor(graph,
            new NodeRegistry(new CallableResolver(List.of(new NativeCallableProvider(functions))),
                    Duration.ofSeconds(5)),
            workers, audit);

    @After
    public void tearDown() {
        workers.shutdownNow();
    }

    private static Program parse(String kgml) {
        return Kgml.parse(kgml);
    }

    @Test
    public void testSyncCallablesRunOnWorkers() throws Exception {
        String caller = Thread.currentThread().getName();
        functions.register("thread", args -> Thread.currentThread().getName());
        ExecutionResult result = executor.executeAsync(parse("KG►\n"
                + "C► F : type=\"FunctionNode\", callable=\"thread\"\n"
                + "E► F\n"
                + "◄")).get(5, TimeUnit.SECONDS);

        assertEquals(2, result.size());
        assertNotEquals(caller, result.evaluation("F"));
    }

    @Test
    public void testCascadesAndOutcomes() throws Exception {
        functions.register("double", args -> ((Number) args.arg(0)).longValue() * 2);
        functions.registerAsync("answer", args -> CompletableFuture.supplyAsync(() -> 84L));
        executor.executeAsync(parse("KG►\n"
                + "C► Reading : type=\"DataNode\"\n"
                + "C► Doubled : type=\"FunctionNode\", callable=\"double\"\n"
                + "C► Check : type=\"OutcomeNode\", callable=\"answer\", target_eval_state=84\n"
                + "KGLINK► P : relation=\"parameter\", source=\"Reading\", target=\"Doubled\"\n"
                + "KGLINK► S : relation=\"eval_sequence\", source=\"Doubled\", target=\"Check\"\n"
                + "E► Reading : 42\n"
                + "◄")).get(5, TimeUnit.SECONDS);

        assertEquals(84L, ((DataNode) graph.getNode("Doubled")).content());
        assertEquals(1.0, ((OutcomeNode) graph.getNode("Check")).weight(), 0.0);
    }

    @Test
    public void testFailureCompletesExceptionally() throws Exception {
        CompletableFuture<ExecutionResult> f = executor.executeAsync(parse("KG►\n"
                + "C► A : type=\"DataNode\"\n"
                + "C► B : type=\"DataNode\"\n"
                + "KGLINK► AB : relation=\"parameter\", source=\"A\", target=\"B\"\n"
                + "KGLINK► BA : relation=\"parameter\", source=\"B\", target=\"A\"\n"
                + "E► A : 1\n"
                + "C► Never : type=\"DataNode\"\n"
                + "◄"));
        try {
            f.get(5, TimeUnit.SECONDS);
            fail("Expected ExecutionException");
        } catch (ExecutionException e) {
            assertTrue(e.getCause() instanceof CommandFailedException);
            CommandFailedException cfe = (CommandFailedException) e.getCause();
            assertEquals(ErrorKind.EXECUTION, cfe.kind());
            assertEquals(4, cfe.commandIndex());
        }
        assertTrue(graph.containsNode("A"));
        assertFalse(graph.containsNode("Never"));
        assertEquals(1, audit.failureCount());
    }

    @Test
    public void testCancelStopsProgramAndDiscardsLateResult() throws Exception {
        CompletableFuture<Object> pending = new CompletableFuture<>();
        functions.registerAsync("wait", args -> pending);
        executor.execute(parse("KG► C► W : type=\"FunctionNode\", callable=\"wait\" ◄"));

        CompletableFuture<ExecutionResult> f = executor.executeAsync(parse("KG►\n"
                + "E► W\n"
                + "C► After : type=\"DataNode\"\n"
                + "◄"));
        assertTrue(f.cancel(true));
        pending.complete("late");

        assertNull(((DataNode) graph.getNode("W")).content());
        assertFalse(graph.containsNode("After"));

        // The executor accepts further programs once the cancelled one has stopped
        ExecutionResult next = executor.executeAsync(parse("KG► C► Next : type=\"DataNode\" ◄"))
                .get(5, TimeUnit.SECONDS);
        assertEquals(CommandStatus.CREATED, next.get(0).status());
        assertFalse(graph.containsNode("After"));
    }

    @Test
    public void testProgramsNeverInterleave() throws Exception {
        List<String> order = Collections.synchronizedList(new ArrayList<>());
        CompletableFuture<Object> gate = new CompletableFuture<>();
        functions.registerAsync("gate", args -> gate.thenApply(v -> {
            order.add("first done");
            return v;
        }));
        functions.register("mark", args -> {
            order.add("second ran");
            return null;
        });
        executor.execute(parse("KG►\n"
                + "C► G : type=\"FunctionNode\", callable=\"gate\"\n"
                + "C► M : type=\"FunctionNode\", callable=\"mark\"\n"
                + "◄"));

        CompletableFuture<ExecutionResult> first = executor.executeAsync(parse("KG► E► G ◄"));
        CompletableFuture<ExecutionResult> second = executor.executeAsync(parse("KG► E► M ◄"));
        Thread.sleep(50);
        assertTrue(order.isEmpty());
        assertFalse(second.isDone());

        gate.complete("open");
        first.get(5, TimeUnit.SECONDS);
        second.get(5, TimeUnit.SECONDS);
        assertEquals(List.of("first done", "second ran"), order);
    }

    @Test
    public void testControlBlocksRunCooperatively() throws Exception {
        List<String> order = Collections.synchronizedList(new ArrayList<>());
        int[] left = {2};
        functions.register("more", args -> left[0] > 0);
        functions.register("step", args -> {
            order.add("step" + left[0]);
            return --left[0];
        });
        functions.registerAsync("done", args -> CompletableFuture.supplyAsync(() -> left[0] == 0));
        ExecutionResult result = executor.executeAsync(parse("KG►\n"
                + "C► More : type=\"FunctionNode\", callable=\"more\"\n"
                + "C► Step : type=\"FunctionNode\", callable=\"step\"\n"
                + "C► Done : type=\"FunctionNode\", callable=\"done\"\n"
                + "LOOP► E► More E► Step ◄\n"
                + "IF► E► Done C► Finished : type=\"DataNode\" ELSE► C► Unfinished : type=\"DataNode\" ◄\n"
                + "◄")).get(5, TimeUnit.SECONDS);

        assertEquals(List.of("step2", "step1"), order);
        assertTrue(graph.containsNode("Finished"));
        assertFalse(graph.containsNode("Unfinished"));
        assertEquals(Boolean.TRUE, result.variable("eval_Done"));
    }

    @Test
    public void testLoopLimitFailsAsyncProgram() throws Exception {
        KgmlExecutor bounded = new KgmlExecutor(graph,
                new NodeRegistry(new CallableResolver(List.of(new NativeCallableProvider(functions))),
                        Duration.ofSeconds(5)),
                workers, audit, 3);
        functions.register("always", args -> 1);
        CompletableFuture<ExecutionResult> future = bounded.executeAsync(parse("KG►\n"
                + "C► Always : type=\"FunctionNode\", callable=\"always\"\n"
                + "LOOP► E► Always C► Tmp : type=\"DataNode\" D► Tmp ◄\n"
                + "◄"));
        try {
            future.get(5, TimeUnit.SECONDS);
            fail("Expected ExecutionException");
        } catch (ExecutionException e) {
            assertTrue(e.getCause() instanceof CommandFailedException);
            CommandFailedException failed = (CommandFailedException) e.getCause();
            assertEquals(ErrorKind.EXECUTION, failed.kind());
            assertEquals(1, failed.commandIndex());
        }
        assertFalse(graph.containsNode("Tmp"));
    }
}
