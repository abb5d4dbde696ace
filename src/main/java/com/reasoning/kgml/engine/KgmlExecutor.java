package com.reasoning.kgml.engine;

import com.reasoning.kgml.api.ArgumentBundle;
import com.reasoning.kgml.api.ExecutionListener;
import com.reasoning.kgml.api.Instructions;
import com.reasoning.kgml.dsl.Command;
import com.reasoning.kgml.dsl.Conditional;
import com.reasoning.kgml.dsl.Loop;
import com.reasoning.kgml.dsl.Program;
import com.reasoning.kgml.dsl.Statement;
import com.reasoning.kgml.dsl.Verb;
import com.reasoning.kgml.error.CommandFailedException;
import com.reasoning.kgml.error.KgmlException;
import com.reasoning.kgml.error.KgmlExecutionException;
import com.reasoning.kgml.error.NotFoundException;
import com.reasoning.kgml.error.SemanticException;
import com.reasoning.kgml.graph.KnowledgeGraph;
import com.reasoning.kgml.graph.Link;
import com.reasoning.kgml.graph.LinkRelation;
import com.reasoning.kgml.node.ActionMetaNode;
import com.reasoning.kgml.node.DataNode;
import com.reasoning.kgml.node.EventMetaNode;
import com.reasoning.kgml.node.FunctionNode;
import com.reasoning.kgml.node.GraphNode;
import com.reasoning.kgml.util.ErrorRateLimiter;
import com.reasoning.kgml.util.Values;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

import lombok.extern.log4j.Log4j2;

/**
 * Applies parsed KGML programs to a {@link KnowledgeGraph}.
 *
 * <p>
 * Statements run in program order. {@code E►} evaluates its node and then walks
 * the node's outgoing {@code eval_sequence} and {@code parameter} edges
 * depth-first in declaration order. A {@code parameter} edge hands the
 * source's result to the target as its only positional argument; an
 * {@code eval_sequence} edge passes nothing. Reaching a node that is still
 * being evaluated higher up the same chain is a cycle and fails the command.
 * Each uid is evaluated at most once per {@code E►} command: a node reached
 * again along a second path (a diamond) fails the command as well.
 *
 * <p>
 * {@code IF►} runs the body of the first branch whose condition evaluates
 * truthy (see {@link Values#isTruthy(Object)}), else the {@code ELSE►} body.
 * {@code LOOP►} runs its body while its condition evaluates truthy, at most
 * {@code maxLoopIterations} times; a condition still truthy after that fails
 * the loop. Commands inside a block report the index of their enclosing
 * top-level statement.
 *
 * <p>
 * Fail fast: the first failing command stops the program with a
 * {@link CommandFailedException}. Commands before it stay applied; take a
 * {@link KnowledgeGraph#snapshot(String) snapshot} first to be able to undo
 * them.
 *
 * <p>
 * Programs against the same executor never overlap. {@link #execute(Program)}
 * runs on the calling thread and blocks on asynchronous callables;
 * {@link #executeAsync(Program)} returns at once and runs synchronous
 * callables on the worker pool. Cancelling the future of an asynchronous
 * program stops it before its next command or cascade step, and an in-flight
 * call whose program was cancelled does not write its result.
 * A blocking program submitted from inside a callable of the same executor
 * waits for itself and never completes.
 */
@Log4j2
public final class KgmlExecutor {
    public static final int DEFAULT_MAX_LOOP_ITERATIONS = 100;

    private final KnowledgeGraph graph;
    private final NodeRegistry registry;
    private final Executor workers;
    private final ExecutionListener listener;
    private final int maxLoopIterations;
    private final ProgramSequencer sequencer = new ProgramSequencer();
    private final AtomicLong programIds = new AtomicLong();
    private final ErrorRateLimiter listenerErrors = new ErrorRateLimiter(log, 1000);

    public KgmlExecutor(KnowledgeGraph graph, NodeRegistry registry, Executor workers, ExecutionListener listener) {
        this(graph, registry, workers, listener, DEFAULT_MAX_LOOP_ITERATIONS);
    }

    public KgmlExecutor(KnowledgeGraph graph, NodeRegistry registry, Executor workers, ExecutionListener listener,
            int maxLoopIterations) {
        if (maxLoopIterations <= 0)
            throw new IllegalArgumentException("maxLoopIterations must be positive: " + maxLoopIterations);
        this.graph = graph;
        this.registry = registry;
        this.workers = workers;
        this.listener = listener;
        this.maxLoopIterations = maxLoopIterations;
    }

    public KnowledgeGraph graph() {
        return graph;
    }

    // ---------------------------------------------------------------------
    // Blocking mode
    // ---------------------------------------------------------------------

    /**
     * Runs a program on the calling thread.
     *
     * @throws CommandFailedException for the first failing command
     */
    public ExecutionResult execute(Program program) {
        ProgramSequencer.Ticket ticket = sequencer.enter();
        try {
            ticket.awaitTurn();
            return run(program);
        } finally {
            ticket.release();
        }
    }

    private ExecutionResult run(Program program) {
        Run run = new Run(programIds.incrementAndGet(), program);
        log.debug("Program {} started: {} commands", run.id, program.size());
        notifyListener(l -> l.onProgramStart(run.id, program.size()));
        try {
            for (int i = 0; i < program.size(); i++)
                runStatement(run, i, program.get(i));
        } finally {
            notifyListener(l -> l.onProgramEnd(run.id, run.results.size()));
        }
        log.debug("Program {} finished: {} commands applied", run.id, run.results.size());
        return run.result();
    }

    // index is the position of the enclosing top-level statement
    private void runStatement(Run run, int index, Statement statement) {
        if (statement instanceof Conditional conditional) {
            for (Conditional.Branch branch : conditional.branches()) {
                if (Values.isTruthy(runCommand(run, index, branch.condition()).value())) {
                    runBlock(run, index, branch.body());
                    return;
                }
            }
            runBlock(run, index, conditional.otherwise());
        } else if (statement instanceof Loop loop) {
            int iterations = 0;
            while (Values.isTruthy(runCommand(run, index, loop.condition()).value())) {
                if (iterations == maxLoopIterations)
                    throw fail(run, index, loop.condition(), loopLimit(loop));
                runBlock(run, index, loop.body());
                iterations++;
            }
            log.debug("Loop on {} ended after {} iterations", loop.condition().target(), iterations);
        } else {
            runCommand(run, index, (Command) statement);
        }
    }

    private void runBlock(Run run, int index, List<Statement> block) {
        for (Statement statement : block)
            runStatement(run, index, statement);
    }

    private CommandResult runCommand(Run run, int index, Command command) {
        long start = System.nanoTime();
        CommandResult result;
        try {
            result = command.verb() == Verb.EVALUATE
                    ? evaluateCommand(run, index, command)
                    : apply(index, command);
        } catch (KgmlException e) {
            throw fail(run, index, command, e);
        }
        run.applied(result, System.nanoTime() - start);
        return result;
    }

    private CommandResult evaluateCommand(Run run, int index, Command command) {
        GraphNode node = graph.getNode(command.target());
        Object value = evaluate(run, node, command.instructions(), new Visits());
        return new CommandResult(index, command.verb(), command.target(), CommandStatus.EVALUATED, value);
    }

    private Object evaluate(Run run, GraphNode node, Instructions instructions, Visits visits) {
        visits.enter(node);
        try {
            Object result = node.evaluate(instructions);
            evaluated(run, node, result);
            for (Link link : graph.outgoing(node.uid(), LinkRelation.EVAL_SEQUENCE, LinkRelation.PARAMETER)) {
                GraphNode target = graph.getNode(link.target());
                evaluate(run, target, argumentsFor(link, result), visits);
            }
            return result;
        } finally {
            visits.leave(node);
        }
    }

    // ---------------------------------------------------------------------
    // Cooperative mode
    // ---------------------------------------------------------------------

    /**
     * Queues a program and returns at once.
     *
     * @return a future completing with the result, or exceptionally with a
     *         {@link CommandFailedException}; cancel it to stop the program
     */
    public CompletableFuture<ExecutionResult> executeAsync(Program program) {
        ProgramSequencer.Ticket ticket = sequencer.enter();
        AsyncRun run = new AsyncRun(programIds.incrementAndGet(), program);
        run.handle.whenComplete((r, e) -> {
            if (run.handle.isCancelled())
                run.cancel();
        });
        ticket.ready().whenComplete((ignored, error) -> {
            if (run.handle.isDone()) {
                ticket.release();
                return;
            }
            CompletableFuture<ExecutionResult> started;
            try {
                started = start(run);
            } catch (RuntimeException e) {
                started = CompletableFuture.failedFuture(e);
            }
            started.whenComplete((result, failure) -> {
                ticket.release();
                if (failure != null)
                    run.handle.completeExceptionally(unwrap(failure));
                else
                    run.handle.complete(result);
            });
        });
        return run.handle;
    }

    private CompletableFuture<ExecutionResult> start(AsyncRun run) {
        Program program = run.program;
        log.debug("Program {} started asynchronously: {} commands", run.id, program.size());
        notifyListener(l -> l.onProgramStart(run.id, program.size()));
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (int i = 0; i < program.size(); i++) {
            final int index = i;
            final Statement statement = program.get(i);
            chain = chain.thenCompose(v -> runStatementAsync(run, index, statement));
        }
        return chain.handle((v, error) -> {
            notifyListener(l -> l.onProgramEnd(run.id, run.results.size()));
            if (error != null)
                throw error instanceof CompletionException ce ? ce : new CompletionException(error);
            log.debug("Program {} finished: {} commands applied", run.id, run.results.size());
            return run.result();
        });
    }

    private CompletableFuture<Void> runStatementAsync(AsyncRun run, int index, Statement statement) {
        if (statement instanceof Conditional conditional)
            return branchAsync(run, index, conditional, 0);
        if (statement instanceof Loop loop)
            return loopAsync(run, index, loop, 0);
        return runCommandAsync(run, index, (Command) statement).thenApply(r -> null);
    }

    private CompletableFuture<Void> runBlockAsync(AsyncRun run, int index, List<Statement> block) {
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (Statement statement : block)
            chain = chain.thenCompose(v -> runStatementAsync(run, index, statement));
        return chain;
    }

    private CompletableFuture<Void> branchAsync(AsyncRun run, int index, Conditional conditional, int branch) {
        if (branch == conditional.branches().size())
            return runBlockAsync(run, index, conditional.otherwise());
        Conditional.Branch current = conditional.branches().get(branch);
        return runCommandAsync(run, index, current.condition()).thenCompose(r -> Values.isTruthy(r.value())
                ? runBlockAsync(run, index, current.body())
                : branchAsync(run, index, conditional, branch + 1));
    }

    private CompletableFuture<Void> loopAsync(AsyncRun run, int index, Loop loop, int done) {
        return runCommandAsync(run, index, loop.condition()).thenCompose(r -> {
            if (!Values.isTruthy(r.value())) {
                log.debug("Loop on {} ended after {} iterations", loop.condition().target(), done);
                return CompletableFuture.<Void>completedFuture(null);
            }
            if (done == maxLoopIterations)
                return CompletableFuture.<Void>failedFuture(fail(run, index, loop.condition(), loopLimit(loop)));
            return runBlockAsync(run, index, loop.body()).thenCompose(v -> loopAsync(run, index, loop, done + 1));
        });
    }

    private CompletableFuture<CommandResult> runCommandAsync(AsyncRun run, int index, Command command) {
        try {
            run.checkCancelled();
        } catch (CancellationException e) {
            return CompletableFuture.failedFuture(e);
        }
        long start = System.nanoTime();
        CompletableFuture<CommandResult> step;
        try {
            step = command.verb() == Verb.EVALUATE
                    ? evaluateCommandAsync(run, index, command)
                    : CompletableFuture.completedFuture(apply(index, command));
        } catch (KgmlException e) {
            step = CompletableFuture.failedFuture(e);
        }
        return step.handle((result, error) -> {
            if (error != null) {
                Throwable cause = unwrap(error);
                if (cause instanceof CancellationException ce)
                    throw ce;
                throw new CompletionException(fail(run, index, command, asKgml(cause)));
            }
            run.applied(result, System.nanoTime() - start);
            return result;
        });
    }

    private CompletableFuture<CommandResult> evaluateCommandAsync(AsyncRun run, int index, Command command) {
        GraphNode node = graph.getNode(command.target());
        return evaluateAsync(run, node, command.instructions(), new Visits())
                .thenApply(value -> new CommandResult(index, command.verb(), command.target(),
                        CommandStatus.EVALUATED, value));
    }

    private CompletableFuture<Object> evaluateAsync(AsyncRun run, GraphNode node, Instructions instructions,
            Visits visits) {
        try {
            run.checkCancelled();
            visits.enter(node);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        CompletableFuture<Object> own;
        if (node instanceof FunctionNode fn) {
            own = fn.evaluateAsync(instructions, workers);
            run.track(own);
        } else {
            try {
                own = CompletableFuture.completedFuture(node.evaluate(instructions));
            } catch (RuntimeException e) {
                own = CompletableFuture.failedFuture(e);
            }
        }
        return own.thenCompose(result -> {
            evaluated(run, node, result);
            CompletableFuture<Void> cascade = CompletableFuture.completedFuture(null);
            for (Link link : graph.outgoing(node.uid(), LinkRelation.EVAL_SEQUENCE, LinkRelation.PARAMETER)) {
                cascade = cascade.thenCompose(v -> evaluateAsync(run, graph.getNode(link.target()),
                        argumentsFor(link, result), visits).thenApply(r -> null));
            }
            return cascade.thenApply(v -> result);
        }).whenComplete((r, e) -> visits.leave(node));
    }

    // ---------------------------------------------------------------------
    // Commands other than evaluate
    // ---------------------------------------------------------------------

    private CommandResult apply(int index, Command c) {
        log.debug("#{} {}", index, c);
        return switch (c.verb()) {
            case NODE_DECL -> declareNode(index, c);
            case CREATE -> {
                if (c.tag() == null)
                    throw new SemanticException("C► " + c.target() + " requires a 'type' property");
                yield createNode(index, c, c.tag());
            }
            case NODE -> {
                String type = c.tag();
                if (!ActionMetaNode.TYPE.equals(type) && !EventMetaNode.TYPE.equals(type))
                    throw new SemanticException("N► " + c.target() + " must declare type ActionMetaNode or "
                            + "EventMetaNode, got " + type);
                yield createNode(index, c, type);
            }
            case LINK_DECL -> declareLink(index, c);
            case UPDATE -> {
                if (!graph.containsNode(c.target()) && graph.findEdge(c.target()).isPresent()) {
                    graph.updateEdge(c.target(), c.properties());
                } else {
                    ArgumentBundle props = ArgumentBundle.named(c.properties());
                    graph.updateNode(c.target(), node -> node.update(props));
                }
                yield new CommandResult(index, c.verb(), c.target(), CommandStatus.UPDATED, null);
            }
            case DELETE -> {
                if (graph.containsNode(c.target()))
                    graph.deleteNode(c.target());
                else if (graph.findEdge(c.target()).isPresent())
                    graph.deleteEdge(c.target());
                else
                    throw new NotFoundException("Node or edge", c.target());
                yield new CommandResult(index, c.verb(), c.target(), CommandStatus.DELETED, null);
            }
            case EVALUATE -> throw new IllegalStateException("Evaluate is not a plain command");
        };
    }

    // KGNODE► upserts: an existing mutable node of the same type gets its properties updated.
    private CommandResult declareNode(int index, Command c) {
        String type = c.tag() == null ? DataNode.TYPE : c.tag();
        GraphNode existing = graph.findNode(c.target()).orElse(null);
        if (existing == null)
            return createNode(index, c, type);
        if (existing.isFrozen())
            throw new SemanticException("Node " + c.target() + " is frozen and cannot be redeclared");
        if (!existing.type().equals(type))
            throw new SemanticException("Node " + c.target() + " is already declared with type " + existing.type());
        ArgumentBundle props = ArgumentBundle.named(c.properties());
        graph.updateNode(c.target(), node -> node.update(props));
        return new CommandResult(index, c.verb(), c.target(), CommandStatus.UPDATED, null);
    }

    private CommandResult createNode(int index, Command c, String type) {
        if (graph.containsNode(c.target()))
            throw new SemanticException("Duplicate node uid: " + c.target());
        GraphNode node = registry.create(c.target(), type, c.properties());
        if (!node.isFrozen() && !c.properties().isEmpty())
            node.update(ArgumentBundle.named(c.properties()));
        graph.insertNode(node);
        return new CommandResult(index, c.verb(), c.target(), CommandStatus.CREATED, null);
    }

    private CommandResult declareLink(int index, Command c) {
        Object relation = c.property(Command.RELATION_KEY);
        if (relation == null)
            throw new SemanticException("KGLINK► " + c.target() + " requires a 'relation' property");
        LinkRelation rel = LinkRelation.fromString(relation.toString());
        Object source = c.property(Link.SOURCE_KEY);
        Object target = c.property(Link.TARGET_KEY);
        if (!(source instanceof String) || !(target instanceof String))
            throw new SemanticException("KGLINK► " + c.target() + " requires string 'source' and 'target' properties");
        Map<String, Object> metadata = new LinkedHashMap<>(c.properties());
        metadata.remove(Command.RELATION_KEY);
        metadata.remove(Link.SOURCE_KEY);
        metadata.remove(Link.TARGET_KEY);
        graph.insertEdge(new Link(c.target(), (String) source, (String) target, rel, metadata));
        return new CommandResult(index, c.verb(), c.target(), CommandStatus.DECLARED, null);
    }

    // ---------------------------------------------------------------------
    // Shared helpers
    // ---------------------------------------------------------------------

    // A throwing listener is logged; the command it reports on stays applied.
    private void notifyListener(Consumer<ExecutionListener> event) {
        try {
            event.accept(listener);
        } catch (RuntimeException e) {
            listenerErrors.log("Execution listener " + listener.getClass().getName() + " failed", e);
        }
    }

    private KgmlExecutionException loopLimit(Loop loop) {
        return new KgmlExecutionException("Loop on " + loop.condition().target() + " still true after "
                + maxLoopIterations + " iterations");
    }

    private static Instructions argumentsFor(Link link, Object result) {
        return link.relation() == LinkRelation.PARAMETER ? ArgumentBundle.of(result) : Instructions.none();
    }

    private void evaluated(Run run, GraphNode node, Object result) {
        run.evaluated(node.uid(), result);
        if (!node.kind().isMeta())
            graph.markUpdated(node);
    }

    private CommandFailedException fail(Run run, int index, Command command, KgmlException cause) {
        log.error("Program {} failed at command #{} ({} {}): {}", run.id, index, command.verb().marker(),
                command.target(), cause.getMessage());
        notifyListener(l -> l.onCommandError(run.id, index, command, cause));
        return new CommandFailedException(index, command.verb().marker(), command.target(), cause);
    }

    private static KgmlException asKgml(Throwable t) {
        if (t instanceof KgmlException ke)
            return ke;
        return new KgmlExecutionException("Unexpected failure: " + t, t);
    }

    private static Throwable unwrap(Throwable t) {
        Throwable cause = t;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null)
            cause = cause.getCause();
        return cause;
    }

    /**
     * Nodes seen by one {@code E►} command. {@code path} holds the chain being
     * evaluated, {@code seen} every uid evaluated so far and is never cleared.
     */
    private static final class Visits {
        private final Set<String> path = new LinkedHashSet<>();
        private final Set<String> seen = new HashSet<>();

        synchronized void enter(GraphNode node) {
            String uid = node.uid();
            if (path.contains(uid)) {
                List<String> chain = new ArrayList<>(path);
                chain.add(uid);
                throw new KgmlExecutionException("Evaluation cycle detected: " + String.join(" -> ", chain));
            }
            if (!seen.add(uid)) {
                List<String> chain = new ArrayList<>(path);
                chain.add(uid);
                throw new KgmlExecutionException("Node " + uid + " reached twice in one evaluation: "
                        + String.join(" -> ", chain));
            }
            path.add(uid);
        }

        synchronized void leave(GraphNode node) {
            path.remove(node.uid());
        }
    }

    /** Bookkeeping of one program. */
    private class Run {
        final long id;
        final Program program;
        final List<CommandResult> results = Collections.synchronizedList(new ArrayList<>());
        final Map<String, Object> evaluations = Collections.synchronizedMap(new LinkedHashMap<>());

        Run(long id, Program program) {
            this.id = id;
            this.program = program;
        }

        void applied(CommandResult result, long durationNanos) {
            results.add(result);
            notifyListener(l -> l.onCommandExecuted(id, result, durationNanos));
        }

        void evaluated(String uid, Object value) {
            evaluations.put(uid, value);
        }

        ExecutionResult result() {
            synchronized (evaluations) {
                return new ExecutionResult(id, results, evaluations);
            }
        }
    }

    private final class AsyncRun extends Run {
        final CompletableFuture<ExecutionResult> handle = new CompletableFuture<>();
        private volatile boolean cancelled;
        private volatile CompletableFuture<?> inFlight;

        AsyncRun(long id, Program program) {
            super(id, program);
        }

        void track(CompletableFuture<?> call) {
            inFlight = call;
            if (cancelled)
                call.cancel(false);
        }

        void cancel() {
            cancelled = true;
            CompletableFuture<?> call = inFlight;
            if (call != null)
                call.cancel(false);
            log.info("Program {} cancelled", id);
        }

        void checkCancelled() {
            if (cancelled)
                throw new CancellationException("Program " + id + " was cancelled");
        }
    }
}
