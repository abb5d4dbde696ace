package com.reasoning.kgml.node;

import com.reasoning.kgml.api.ArgumentBundle;
import com.reasoning.kgml.api.Instructions;
import com.reasoning.kgml.api.RawText;
import com.reasoning.kgml.error.KgmlExecutionException;
import com.reasoning.kgml.error.SemanticException;
import com.reasoning.kgml.fn.CallableResolver;
import com.reasoning.kgml.fn.FunctionRegistry;
import com.reasoning.kgml.fn.KgCallable;
import com.reasoning.kgml.fn.NativeCallableProvider;
import org.junit.After;
import org.junit.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;

public class FunctionNodeTest {
    private final ExecutorService workers = Executors.newSingleThreadExecutor();

    @After
    public void tearDown() {
        workers.shutdownNow();
    }

    @Test
    public void testSyncCallableReceivesArguments() {
        FunctionNode node = new FunctionNode("Sum");
        node.attach(KgCallable.of("sum", args -> (Long) args.arg(0) + (Long) args.arg(1)));

        assertEquals(5L, node.evaluate(ArgumentBundle.of(2L, 3L)));
        assertEquals(5L, node.content());
    }

    @Test
    public void testRawTextSplitOnWhitespace() {
        FunctionNode node = new FunctionNode("Echo");
        node.attach(KgCallable.of("echo", ArgumentBundle::positional));

        Object result = node.evaluate(new RawText("  turn   on the light "));
        assertEquals(Arrays.asList("turn", "on", "the", "light"), result);
    }

    @Test
    public void testAsyncCallableInBlockingMode() {
        FunctionNode node = new FunctionNode("Async");
        node.attach(KgCallable.ofAsync("later", args -> CompletableFuture.supplyAsync(() -> "done")));

        assertEquals("done", node.evaluate(Instructions.none()));
        assertEquals("done", node.content());
    }

    @Test
    public void testBlockingCallTimesOut() {
        FunctionNode node = new FunctionNode("Slow");
        node.bind(null, Duration.ofMillis(50));
        CompletableFuture<Object> call = new CompletableFuture<>();
        node.attach(KgCallable.ofAsync("never", args -> call));
        try {
            node.evaluate(Instructions.none());
            fail("Expected KgmlExecutionException");
        } catch (KgmlExecutionException e) {
            assertTrue(e.getMessage().contains("timed out"));
        }
        assertNull(node.content());
        assertTrue(call.isCancelled());
    }

    @Test
    public void testFailureWrappedAsExecutionError() {
        FunctionNode node = new FunctionNode("Bad");
        node.attach(KgCallable.of("bad", args -> {
            throw new IOException("disk gone");
        }));
        try {
            node.evaluate(Instructions.none());
            fail("Expected KgmlExecutionException");
        } catch (KgmlExecutionException e) {
            assertTrue(e.getCause() instanceof IOException);
            assertTrue(e.getMessage().contains("bad"));
        }
    }

    @Test
    public void testEvaluateAsyncRunsSyncCallableOnWorkers() throws Exception {
        FunctionNode node = new FunctionNode("Where");
        node.attach(KgCallable.of("thread", args -> Thread.currentThread().getName()));

        String caller = Thread.currentThread().getName();
        Object result = node.evaluateAsync(Instructions.none(), workers).get(5, TimeUnit.SECONDS);
        assertNotEquals(caller, result);
        assertEquals(result, node.content());
    }

    @Test
    public void testEvaluateAsyncFailure() throws Exception {
        FunctionNode node = new FunctionNode("Bad");
        node.attach(KgCallable.ofAsync("bad",
                args -> CompletableFuture.failedFuture(new IllegalArgumentException("nope"))));
        try {
            node.evaluateAsync(Instructions.none(), workers).get(5, TimeUnit.SECONDS);
            fail("Expected ExecutionException");
        } catch (ExecutionException e) {
            assertTrue(e.getCause() instanceof KgmlExecutionException);
            assertTrue(e.getCause().getCause() instanceof IllegalArgumentException);
        }
    }

    @Test
    public void testCancelledCallDoesNotWrite() throws Exception {
        CompletableFuture<Object> pending = new CompletableFuture<>();
        FunctionNode node = new FunctionNode("Pending");
        node.setContent("before");
        node.attach(KgCallable.ofAsync("pending", args -> pending));

        CompletableFuture<Object> handle = node.evaluateAsync(Instructions.none(), workers);
        assertTrue(handle.cancel(false));
        pending.complete("after");

        assertEquals("before", node.content());
    }

    @Test
    public void testResolvedThroughRegistryAndInvalidatedOnChange() {
        FunctionRegistry registry = new FunctionRegistry()
                .register("one", args -> 1)
                .register("two", args -> 2);
        CallableResolver resolver = new CallableResolver(List.of(new NativeCallableProvider(registry)));

        FunctionNode node = new FunctionNode("F").bind(resolver, Duration.ofSeconds(1));
        node.update(ArgumentBundle.named(Map.of("callable", "one")));
        assertEquals(1, node.evaluate(Instructions.none()));

        node.update(ArgumentBundle.named(Map.of("callable", "two")));
        assertEquals("two", node.callable().name());
        assertEquals(2, node.evaluate(Instructions.none()));
    }

    @Test
    public void testUnresolvedCallable() {
        CallableResolver resolver = new CallableResolver(List.of(new NativeCallableProvider(new FunctionRegistry())));
        FunctionNode node = new FunctionNode("F").bind(resolver, Duration.ofSeconds(1));
        try {
            node.evaluate(Instructions.none());
            fail("Expected SemanticException");
        } catch (SemanticException e) {
            assertTrue(e.getMessage().contains("Unresolved callable"));
        }

        node.putMetadata("callable", "missing");
        try {
            node.evaluate(Instructions.none());
            fail("Expected SemanticException");
        } catch (SemanticException e) {
            assertTrue(e.getMessage().contains("missing"));
        }
    }
}
