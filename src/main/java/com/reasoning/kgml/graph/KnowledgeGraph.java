package com.reasoning.kgml.graph;

import com.reasoning.kgml.api.GraphListener;
import com.reasoning.kgml.error.NotFoundException;
import com.reasoning.kgml.error.SemanticException;
import com.reasoning.kgml.node.GraphNode;
import com.reasoning.kgml.node.NodeKind;
import com.reasoning.kgml.util.ErrorRateLimiter;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.function.Supplier;

import lombok.extern.log4j.Log4j2;

/**
 * In-memory store of nodes and typed edges.
 *
 * <p>
 * Nodes and edges are kept in insertion order, which is also the order in
 * which queries and {@link #outgoing(String, LinkRelation...)} return them.
 * Every mutation runs under the write lock and is atomic: either it is fully
 * applied and listeners are told, or it throws and nothing changed.
 *
 * <p>
 * Queries are lazy. Each call to {@code iterator()} copies the current
 * contents under the read lock and filters that copy, so iteration never sees
 * a half-applied mutation and can be restarted.
 *
 * <p>
 * Snapshots copy every node, including content and outcome state, and can be
 * restored with {@link #rollback(int)}. The executor never rolls back on its
 * own; callers take a snapshot before running a program they may want to undo.
 *
 * <p>
 * Independently of snapshots, every node and edge keeps a short history of
 * its own states: one revision per create, update, evaluation and rollback,
 * up to {@code historyDepth} per uid. {@link #rollbackNode(String, int)} and
 * {@link #rollbackEdge(String, int)} restore a single element. Deleting an
 * element drops its history.
 */
@Log4j2
public final class KnowledgeGraph {
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, GraphNode> nodes = new LinkedHashMap<>();
    private final Map<String, Link> edges = new LinkedHashMap<>();
    private final List<Snapshot> snapshots = new ArrayList<>();
    private final Map<String, History<GraphNode>> nodeHistory = new HashMap<>();
    private final Map<String, History<Link>> edgeHistory = new HashMap<>();
    private final int historyDepth;
    private final ErrorRateLimiter listenerErrors = new ErrorRateLimiter(log, 1000);
    private GraphListener[] listeners = new GraphListener[0];
    private int nextVersion = 1;

    private record Snapshot(GraphVersion info, List<GraphNode> nodes, List<Link> edges) {
    }

    public static final int DEFAULT_HISTORY_DEPTH = 16;

    public KnowledgeGraph() {
        this(DEFAULT_HISTORY_DEPTH);
    }

    /**
     * @param historyDepth revisions kept per node and per edge
     */
    public KnowledgeGraph(int historyDepth) {
        if (historyDepth <= 0)
            throw new IllegalArgumentException("historyDepth must be positive: " + historyDepth);
        this.historyDepth = historyDepth;
    }

    public void addListener(GraphListener listener) {
        lock.writeLock().lock();
        try {
            GraphListener[] next = Arrays.copyOf(listeners, listeners.length + 1);
            next[listeners.length] = listener;
            listeners = next;
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ---------------------------------------------------------------------
    // Nodes
    // ---------------------------------------------------------------------

    /**
     * @throws SemanticException if a node with the same uid exists
     */
    public void insertNode(GraphNode node) {
        mutate(() -> {
            if (nodes.containsKey(node.uid()))
                throw new SemanticException("Duplicate node uid: " + node.uid());
            nodes.put(node.uid(), node);
            recordNode(node, "Created");
            log.debug("Node added: {}", node);
            fire(l -> l.nodeAdded(node));
        });
    }

    /**
     * @throws NotFoundException if no node has this uid
     */
    public GraphNode getNode(String uid) {
        return findNode(uid).orElseThrow(() -> new NotFoundException("Node", uid));
    }

    public Optional<GraphNode> findNode(String uid) {
        return read(() -> Optional.ofNullable(nodes.get(uid)));
    }

    public boolean containsNode(String uid) {
        return read(() -> nodes.containsKey(uid));
    }

    /**
     * Mutates a node under the write lock and reports it as updated.
     *
     * @throws NotFoundException if no node has this uid
     */
    public GraphNode updateNode(String uid, Consumer<GraphNode> mutation) {
        return write(() -> {
            GraphNode node = nodes.get(uid);
            if (node == null)
                throw new NotFoundException("Node", uid);
            mutation.accept(node);
            recordNode(node, "Updated");
            fire(l -> l.nodeUpdated(node));
            return node;
        });
    }

    /** Reports a node whose state changed outside {@link #updateNode}, e.g. by evaluation. */
    public void markUpdated(GraphNode node) {
        mutate(() -> {
            if (nodes.get(node.uid()) == node)
                recordNode(node, "Evaluated");
            fire(l -> l.nodeUpdated(node));
        });
    }

    /**
     * Removes a node together with every edge that starts or ends at it.
     *
     * @return the removed node
     * @throws NotFoundException if no node has this uid
     */
    public GraphNode deleteNode(String uid) {
        return write(() -> {
            GraphNode node = nodes.get(uid);
            if (node == null)
                throw new NotFoundException("Node", uid);
            Iterator<Link> it = edges.values().iterator();
            List<Link> removed = new ArrayList<>();
            while (it.hasNext()) {
                Link link = it.next();
                if (link.source().equals(uid) || link.target().equals(uid)) {
                    it.remove();
                    removed.add(link);
                }
            }
            nodes.remove(uid);
            nodeHistory.remove(uid);
            for (Link link : removed)
                edgeHistory.remove(link.uid());
            log.debug("Node removed: {} ({} incident edges)", node, removed.size());
            for (Link link : removed)
                fire(l -> l.edgeRemoved(link));
            fire(l -> l.nodeRemoved(node));
            return node;
        });
    }

    public Iterable<GraphNode> queryNodes(Predicate<? super GraphNode> predicate) {
        return () -> new FilteringIterator<>(read(() -> new ArrayList<>(nodes.values())), predicate);
    }

    public int nodeCount() {
        return read(nodes::size);
    }

    // ---------------------------------------------------------------------
    // Edges
    // ---------------------------------------------------------------------

    /**
     * @throws SemanticException if the uid is taken by another edge
     * @throws NotFoundException if either endpoint is missing
     */
    public void insertEdge(Link link) {
        mutate(() -> {
            if (edges.containsKey(link.uid()))
                throw new SemanticException("Duplicate edge uid: " + link.uid());
            if (!nodes.containsKey(link.source()))
                throw new NotFoundException("Source node", link.source());
            if (!nodes.containsKey(link.target()))
                throw new NotFoundException("Target node", link.target());
            edges.put(link.uid(), link);
            recordEdge(link, "Created");
            log.debug("Edge added: {} {} -{}-> {}", link.uid(), link.source(), link.relation().label(),
                    link.target());
            fire(l -> l.edgeAdded(link));
        });
    }

    /**
     * @throws NotFoundException if no edge has this uid
     */
    public Link getEdge(String uid) {
        return findEdge(uid).orElseThrow(() -> new NotFoundException("Edge", uid));
    }

    public Optional<Link> findEdge(String uid) {
        return read(() -> Optional.ofNullable(edges.get(uid)));
    }

    /**
     * @throws NotFoundException if no edge has this uid
     */
    public Link deleteEdge(String uid) {
        return write(() -> {
            Link link = edges.remove(uid);
            if (link == null)
                throw new NotFoundException("Edge", uid);
            edgeHistory.remove(uid);
            fire(l -> l.edgeRemoved(link));
            return link;
        });
    }

    /**
     * Merges properties into an edge; see {@link Link#withProperties(Map)}.
     *
     * @return the edge as stored after the update
     * @throws NotFoundException if no edge has this uid
     * @throws SemanticException for an invalid relation or a changed endpoint
     */
    public Link updateEdge(String uid, Map<String, Object> properties) {
        return write(() -> {
            Link link = edges.get(uid);
            if (link == null)
                throw new NotFoundException("Edge", uid);
            Link updated = link.withProperties(properties);
            edges.put(uid, updated);
            recordEdge(updated, "Updated");
            log.debug("Edge updated: {} {}", uid, updated.metadata());
            fire(l -> l.edgeUpdated(updated));
            return updated;
        });
    }

    public Iterable<Link> queryEdges(Predicate<? super Link> predicate) {
        return () -> new FilteringIterator<>(read(() -> new ArrayList<>(edges.values())), predicate);
    }

    /**
     * Edges leaving {@code uid} in declaration order, restricted to the given
     * relations, or all relations when none are given.
     */
    public List<Link> outgoing(String uid, LinkRelation... relations) {
        Set<LinkRelation> wanted = relations.length == 0
                ? EnumSet.allOf(LinkRelation.class)
                : EnumSet.copyOf(Arrays.asList(relations));
        return read(() -> {
            List<Link> out = new ArrayList<>();
            for (Link link : edges.values()) {
                if (link.source().equals(uid) && wanted.contains(link.relation()))
                    out.add(link);
            }
            return out;
        });
    }

    public int edgeCount() {
        return read(edges::size);
    }

    public GraphStats stats() {
        return read(() -> {
            Map<NodeKind, Integer> byKind = new EnumMap<>(NodeKind.class);
            for (GraphNode n : nodes.values())
                byKind.merge(n.kind(), 1, Integer::sum);
            Map<LinkRelation, Integer> byRelation = new EnumMap<>(LinkRelation.class);
            for (Link e : edges.values())
                byRelation.merge(e.relation(), 1, Integer::sum);
            return new GraphStats(nodes.size(), edges.size(), byKind, byRelation);
        });
    }

    // ---------------------------------------------------------------------
    // Versions
    // ---------------------------------------------------------------------

    /**
     * Copies the current state.
     *
     * @return the version number to pass to {@link #rollback(int)}
     */
    public int snapshot(String message) {
        return write(() -> {
            List<GraphNode> nodeCopies = new ArrayList<>(nodes.size());
            for (GraphNode n : nodes.values())
                nodeCopies.add(n.copy());
            GraphVersion info = new GraphVersion(nextVersion++, message, Instant.now(), nodes.size(), edges.size());
            snapshots.add(new Snapshot(info, nodeCopies, new ArrayList<>(edges.values())));
            log.info("Snapshot v{} taken: {} ({} nodes, {} edges)", info.version(), message, info.nodeCount(),
                    info.edgeCount());
            return info.version();
        });
    }

    /**
     * Replaces the graph contents with those of a snapshot. The snapshot stays
     * available for further rollbacks. Listeners are not told about the
     * individual changes.
     *
     * @throws NotFoundException if the version does not exist
     */
    public void rollback(int version) {
        mutate(() -> {
            Snapshot snap = null;
            for (Snapshot s : snapshots) {
                if (s.info().version() == version)
                    snap = s;
            }
            if (snap == null)
                throw new NotFoundException("Snapshot", String.valueOf(version));
            nodes.clear();
            for (GraphNode n : snap.nodes())
                nodes.put(n.uid(), n.copy());
            edges.clear();
            for (Link e : snap.edges())
                edges.put(e.uid(), e);
            nodeHistory.keySet().retainAll(nodes.keySet());
            edgeHistory.keySet().retainAll(edges.keySet());
            log.info("Rolled back to snapshot v{} ({})", version, snap.info().message());
        });
    }

    /** Recorded revisions of a node, oldest first; empty for an unknown uid. */
    public List<Revision> nodeHistory(String uid) {
        return read(() -> {
            History<GraphNode> h = nodeHistory.get(uid);
            return h == null ? List.of() : h.list();
        });
    }

    /** Recorded revisions of an edge, oldest first; empty for an unknown uid. */
    public List<Revision> edgeHistory(String uid) {
        return read(() -> {
            History<Link> h = edgeHistory.get(uid);
            return h == null ? List.of() : h.list();
        });
    }

    /**
     * Restores one node to a recorded revision. The restore is recorded as a
     * new revision.
     *
     * @return the node now stored under {@code uid}
     * @throws NotFoundException if the node or the revision does not exist
     */
    public GraphNode rollbackNode(String uid, int revision) {
        return write(() -> {
            if (!nodes.containsKey(uid))
                throw new NotFoundException("Node", uid);
            GraphNode restored = revisionOf(nodeHistory.get(uid), uid, revision).copy();
            nodes.put(uid, restored);
            recordNode(restored, "Rolled back to revision " + revision);
            log.info("Node {} rolled back to revision {}", uid, revision);
            fire(l -> l.nodeUpdated(restored));
            return restored;
        });
    }

    /**
     * Restores one edge to a recorded revision. The restore is recorded as a
     * new revision.
     *
     * @return the edge now stored under {@code uid}
     * @throws NotFoundException if the edge or the revision does not exist
     */
    public Link rollbackEdge(String uid, int revision) {
        return write(() -> {
            if (!edges.containsKey(uid))
                throw new NotFoundException("Edge", uid);
            Link restored = revisionOf(edgeHistory.get(uid), uid, revision);
            edges.put(uid, restored);
            recordEdge(restored, "Rolled back to revision " + revision);
            log.info("Edge {} rolled back to revision {}", uid, revision);
            fire(l -> l.edgeUpdated(restored));
            return restored;
        });
    }

    public List<GraphVersion> listSnapshots() {
        return read(() -> {
            List<GraphVersion> out = new ArrayList<>(snapshots.size());
            for (Snapshot s : snapshots)
                out.add(s.info());
            return Collections.unmodifiableList(out);
        });
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private void recordNode(GraphNode node, String message) {
        nodeHistory.computeIfAbsent(node.uid(), k -> new History<>())
                .record(node.uid(), message, node.copy(), historyDepth);
    }

    private void recordEdge(Link link, String message) {
        edgeHistory.computeIfAbsent(link.uid(), k -> new History<>())
                .record(link.uid(), message, link, historyDepth);
    }

    private static <T> T revisionOf(History<T> history, String uid, int revision) {
        T state = history == null ? null : history.find(revision);
        if (state == null)
            throw new NotFoundException("Revision", uid + "@" + revision);
        return state;
    }

    private void fire(Consumer<GraphListener> event) {
        for (GraphListener l : listeners) {
            try {
                event.accept(l);
            } catch (RuntimeException e) {
                listenerErrors.log("Graph listener " + l.getClass().getName() + " failed", e);
            }
        }
    }

    private <T> T read(Supplier<T> action) {
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private <T> T write(Supplier<T> action) {
        lock.writeLock().lock();
        try {
            return action.get();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void mutate(Runnable action) {
        lock.writeLock().lock();
        try {
            action.run();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Bounded revision list of one uid. Guarded by the graph lock. */
    private static final class History<T> {
        private final Deque<Stored<T>> revisions = new ArrayDeque<>();
        private int next = 1;

        void record(String uid, String message, T state, int depth) {
            revisions.addLast(new Stored<>(new Revision(uid, next++, message, Instant.now()), state));
            while (revisions.size() > depth)
                revisions.pollFirst();
        }

        T find(int revision) {
            for (Stored<T> s : revisions) {
                if (s.info().revision() == revision)
                    return s.state();
            }
            return null;
        }

        List<Revision> list() {
            List<Revision> out = new ArrayList<>(revisions.size());
            for (Stored<T> s : revisions)
                out.add(s.info());
            return Collections.unmodifiableList(out);
        }
    }

    private record Stored<T>(Revision info, T state) {
    }

    private static final class FilteringIterator<T> implements Iterator<T> {
        private final Iterator<T> source;
        private final Predicate<? super T> predicate;
        private T next;
        private boolean ready;

        FilteringIterator(List<T> snapshot, Predicate<? super T> predicate) {
            this.source = snapshot.iterator();
            this.predicate = predicate;
        }

        @Override
        public boolean hasNext() {
            while (!ready && source.hasNext()) {
                T candidate = source.next();
                if (predicate.test(candidate)) {
                    next = candidate;
                    ready = true;
                }
            }
            return ready;
        }

        @Override
        public T next() {
            if (!hasNext())
                throw new NoSuchElementException();
            ready = false;
            return next;
        }
    }
}
