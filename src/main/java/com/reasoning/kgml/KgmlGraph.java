package com.reasoning.kgml;

import com.lmax.disruptor.util.DaemonThreadFactory;
import com.reasoning.kgml.api.ExecutionListener;
import com.reasoning.kgml.api.GraphListener;
import com.reasoning.kgml.dispatch.KgmlDispatcher;
import com.reasoning.kgml.dsl.Kgml;
import com.reasoning.kgml.dsl.KgmlWriter;
import com.reasoning.kgml.dsl.Program;
import com.reasoning.kgml.dsl.ValidationResult;
import com.reasoning.kgml.engine.ExecutionResult;
import com.reasoning.kgml.engine.KgmlConfig;
import com.reasoning.kgml.engine.KgmlExecutor;
import com.reasoning.kgml.engine.NodeRegistry;
import com.reasoning.kgml.error.KgmlException;
import com.reasoning.kgml.fn.CallableProvider;
import com.reasoning.kgml.fn.CallableResolver;
import com.reasoning.kgml.fn.FunctionRegistry;
import com.reasoning.kgml.fn.NativeCallableProvider;
import com.reasoning.kgml.fn.ScriptCallableProvider;
import com.reasoning.kgml.graph.GraphVersion;
import com.reasoning.kgml.graph.KnowledgeGraph;
import com.reasoning.kgml.graph.Link;
import com.reasoning.kgml.graph.Revision;
import com.reasoning.kgml.io.GraphJson;
import com.reasoning.kgml.node.GraphNode;
import com.reasoning.kgml.util.CompositeExecutionListener;
import com.reasoning.kgml.util.GraphExplain;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A knowledge graph together with everything needed to drive it with KGML.
 * <p>
 * This class wires:
 * <ul>
 * <li>the {@link KnowledgeGraph} store</li>
 * <li>a {@link FunctionRegistry} of native callables, plus optional
 * JavaScript compilation of {@code code} properties</li>
 * <li>the {@link KgmlExecutor} with its worker pool and listeners</li>
 * <li>on demand, a {@link KgmlDispatcher} for multi-threaded submission</li>
 * </ul>
 *
 * <pre>
 * try (KgmlGraph kg = new KgmlGraph()) {
 *     kg.functions().register("answer", args -&gt; 42);
 *     kg.execute("KG► C► Q : type=\"OutcomeNode\", callable=\"answer\", target_eval_state=42 E► Q ◄");
 * }
 * </pre>
 */
public class KgmlGraph implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(KgmlGraph.class);

    private final KgmlConfig config;
    private final KnowledgeGraph graph;
    private final FunctionRegistry functions;
    private final NodeRegistry nodes;
    private final ExecutorService workers;
    private final CompositeExecutionListener listeners = new CompositeExecutionListener();
    private final KgmlExecutor executor;
    private final ScriptCallableProvider scripts;
    private KgmlDispatcher dispatcher;

    public KgmlGraph() {
        this(KgmlConfig.defaults());
    }

    public KgmlGraph(KgmlConfig config) {
        this(config, new FunctionRegistry());
    }

    public KgmlGraph(KgmlConfig config, FunctionRegistry functions) {
        this.config = config.validate();
        this.functions = functions;
        this.graph = new KnowledgeGraph(config.getHistoryDepth());

        List<CallableProvider> providers = new ArrayList<>();
        providers.add(new NativeCallableProvider(functions));
        if (config.isSourceCompilation()) {
            this.scripts = new ScriptCallableProvider();
            providers.add(scripts);
            graph.addListener(scripts);
        } else {
            this.scripts = null;
        }
        this.nodes = new NodeRegistry(new CallableResolver(providers), config.getCallTimeout());
        this.workers = Executors.newFixedThreadPool(config.getWorkerThreads(), DaemonThreadFactory.INSTANCE);
        this.executor = new KgmlExecutor(graph, nodes, workers, listeners, config.getMaxLoopIterations());
        log.info("KGML graph created: {}", config);
    }

    // ── Execution ──────────────────────────────────────────

    /**
     * Parses and runs a document on the calling thread.
     *
     * @throws KgmlException a lexical or syntax error before anything ran, or
     *                       a {@link com.reasoning.kgml.error.CommandFailedException}
     */
    public ExecutionResult execute(String kgml) {
        return executor.execute(Kgml.parse(kgml));
    }

    public ExecutionResult execute(Program program) {
        return executor.execute(program);
    }

    /**
     * Parses on the calling thread, then runs cooperatively. Parse errors
     * complete the returned future exceptionally.
     */
    public CompletableFuture<ExecutionResult> executeAsync(String kgml) {
        Program program;
        try {
            program = Kgml.parse(kgml);
        } catch (KgmlException e) {
            return CompletableFuture.failedFuture(e);
        }
        return executor.executeAsync(program);
    }

    public CompletableFuture<ExecutionResult> executeAsync(Program program) {
        return executor.executeAsync(program);
    }

    public ValidationResult validate(String kgml) {
        return Kgml.validate(kgml);
    }

    /** Dispatcher sharing this graph's executor, started on first use. */
    public synchronized KgmlDispatcher dispatcher() {
        if (dispatcher == null)
            dispatcher = new KgmlDispatcher(executor, config.getRingBufferSize());
        return dispatcher;
    }

    // ── Graph access ──────────────────────────────────────────

    public KnowledgeGraph graph() {
        return graph;
    }

    public FunctionRegistry functions() {
        return functions;
    }

    public NodeRegistry nodeTypes() {
        return nodes;
    }

    public KgmlConfig config() {
        return config;
    }

    /** Inserts a node built in code, binding function nodes to this graph's callables. */
    public <N extends GraphNode> N addNode(N node) {
        graph.insertNode(nodes.bind(node));
        return node;
    }

    public void addListener(ExecutionListener listener) {
        listeners.add(listener);
    }

    public void addGraphListener(GraphListener listener) {
        graph.addListener(listener);
    }

    public int snapshot(String message) {
        return graph.snapshot(message);
    }

    public void rollback(int version) {
        graph.rollback(version);
    }

    public List<GraphVersion> versions() {
        return graph.listSnapshots();
    }

    public List<Revision> nodeHistory(String uid) {
        return graph.nodeHistory(uid);
    }

    public GraphNode rollbackNode(String uid, int revision) {
        return graph.rollbackNode(uid, revision);
    }

    public List<Revision> edgeHistory(String uid) {
        return graph.edgeHistory(uid);
    }

    public Link rollbackEdge(String uid, int revision) {
        return graph.rollbackEdge(uid, revision);
    }

    // ── Output ──────────────────────────────────────────

    /** The graph as a KGML document that rebuilds it. */
    public String serialize() {
        return KgmlWriter.write(graph);
    }

    public String toJson() {
        return GraphJson.toJson(graph);
    }

    public GraphExplain explain() {
        return new GraphExplain(graph);
    }

    @Override
    public synchronized void close() {
        if (dispatcher != null)
            dispatcher.close();
        workers.shutdown();
        if (scripts != null)
            scripts.close();
        log.info("KGML graph closed ({} nodes, {} edges)", graph.nodeCount(), graph.edgeCount());
    }
}
