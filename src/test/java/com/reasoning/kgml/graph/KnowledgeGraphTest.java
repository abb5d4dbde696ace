package com.reasoning.kgml.graph;

import com.reasoning.kgml.api.GraphListener;
import com.reasoning.kgml.error.NotFoundException;
import com.reasoning.kgml.error.SemanticException;
import com.reasoning.kgml.node.DataNode;
import com.reasoning.kgml.node.EventMetaNode;
import com.reasoning.kgml.node.GraphNode;
import com.reasoning.kgml.node.NodeKind;
import com.reasoning.kgml.node.OutcomeNode;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class KnowledgeGraphTest {

    private static KnowledgeGraph abc() {
        KnowledgeGraph g = new KnowledgeGraph();
        g.insertNode(new DataNode("A"));
        g.insertNode(new DataNode("B"));
        g.insertNode(new DataNode("C"));
        return g;
    }

    private static List<String> uids(Iterable<GraphNode> nodes) {
        List<String> out = new ArrayList<>();
        for (GraphNode n : nodes)
            out.add(n.uid());
        return out;
    }

    @Test
    public void testDuplicateNodeRejected() {
        KnowledgeGraph g = abc();
        try {
            g.insertNode(new DataNode("A"));
            fail("Expected SemanticException");
        } catch (SemanticException e) {
            assertTrue(e.getMessage().contains("Duplicate node uid: A"));
        }
        assertEquals(3, g.nodeCount());
    }

    @Test
    public void testMissingNode() {
        KnowledgeGraph g = abc();
        assertFalse(g.findNode("Z").isPresent());
        try {
            g.getNode("Z");
            fail("Expected NotFoundException");
        } catch (NotFoundException e) {
            assertEquals("Node not found: Z", e.getMessage());
        }
    }

    @Test
    public void testEdgeEndpointsMustExist() {
        KnowledgeGraph g = abc();
        try {
            g.insertEdge(Link.of("A", LinkRelation.HIERARCHY, "Z"));
            fail("Expected NotFoundException");
        } catch (NotFoundException e) {
            assertTrue(e.getMessage().startsWith("Target node"));
        }
        try {
            g.insertEdge(Link.of("Z", LinkRelation.HIERARCHY, "A"));
            fail("Expected NotFoundException");
        } catch (NotFoundException e) {
            assertTrue(e.getMessage().startsWith("Source node"));
        }
        assertEquals(0, g.edgeCount());
    }

    @Test
    public void testDuplicateEdgeRejected() {
        KnowledgeGraph g = abc();
        g.insertEdge(new Link("L1", "A", "B", LinkRelation.CASUAL, Map.of()));
        try {
            g.insertEdge(new Link("L1", "B", "C", LinkRelation.CASUAL, Map.of()));
            fail("Expected SemanticException");
        } catch (SemanticException e) {
            assertTrue(e.getMessage().contains("L1"));
        }
        assertEquals("B", g.getEdge("L1").target());
    }

    @Test
    public void testDeleteNodeCascadesToEdges() {
        KnowledgeGraph g = abc();
        g.insertEdge(Link.of("A", LinkRelation.EVAL_SEQUENCE, "B"));
        g.insertEdge(Link.of("B", LinkRelation.PARAMETER, "C"));
        g.insertEdge(Link.of("A", LinkRelation.CASUAL, "C"));

        g.deleteNode("B");

        assertEquals(2, g.nodeCount());
        assertEquals(1, g.edgeCount());
        assertTrue(g.findEdge("A_casual_C").isPresent());
        for (Link link : g.queryEdges(e -> true)) {
            assertNotEquals("B", link.source());
            assertNotEquals("B", link.target());
        }
    }

    @Test
    public void testOutgoingInDeclarationOrder() {
        KnowledgeGraph g = abc();
        g.insertNode(new DataNode("D"));
        g.insertEdge(Link.of("A", LinkRelation.PARAMETER, "C"));
        g.insertEdge(Link.of("A", LinkRelation.HIERARCHY, "D"));
        g.insertEdge(Link.of("A", LinkRelation.EVAL_SEQUENCE, "B"));

        List<Link> all = g.outgoing("A");
        assertEquals(Arrays.asList("C", "D", "B"), Arrays.asList(all.get(0).target(), all.get(1).target(),
                all.get(2).target()));

        List<Link> cascading = g.outgoing("A", LinkRelation.EVAL_SEQUENCE, LinkRelation.PARAMETER);
        assertEquals(2, cascading.size());
        assertEquals("C", cascading.get(0).target());
        assertEquals("B", cascading.get(1).target());
    }

    @Test
    public void testQueryIsLazyAndRestartable() {
        KnowledgeGraph g = abc();
        Iterable<GraphNode> query = g.queryNodes(n -> !n.uid().equals("B"));
        assertEquals(Arrays.asList("A", "C"), uids(query));

        // A new iteration sees the current contents
        g.insertNode(new DataNode("D"));
        assertEquals(Arrays.asList("A", "C", "D"), uids(query));

        // An iteration in progress is unaffected by later mutations
        Iterator<GraphNode> it = query.iterator();
        assertEquals("A", it.next().uid());
        g.deleteNode("C");
        assertEquals("C", it.next().uid());
        assertEquals("D", it.next().uid());
        assertFalse(it.hasNext());
    }

    @Test
    public void testUpdateNodeNotifiesListeners() {
        KnowledgeGraph g = abc();
        List<String> events = new ArrayList<>();
        g.addListener(new GraphListener() {
            @Override
            public void nodeUpdated(GraphNode node) {
                events.add("updated " + node.uid());
            }

            @Override
            public void nodeRemoved(GraphNode node) {
                events.add("removed " + node.uid());
            }

            @Override
            public void edgeRemoved(Link link) {
                events.add("unlinked " + link.uid());
            }
        });
        g.insertEdge(new Link("L", "A", "B", LinkRelation.CASUAL, Map.of()));
        g.updateNode("A", n -> n.putMetadata("k", "v"));
        g.deleteNode("A");

        assertEquals(Arrays.asList("updated A", "unlinked L", "removed A"), events);
    }

    @Test
    public void testFailingListenerDoesNotAbortMutation() {
        KnowledgeGraph g = new KnowledgeGraph();
        List<String> seen = new ArrayList<>();
        g.addListener(new GraphListener() {
            @Override
            public void nodeAdded(GraphNode node) {
                throw new IllegalStateException("listener bug");
            }
        });
        g.addListener(new GraphListener() {
            @Override
            public void nodeAdded(GraphNode node) {
                seen.add(node.uid());
            }
        });

        g.insertNode(new DataNode("A"));

        assertTrue(g.containsNode("A"));
        assertEquals(List.of("A"), seen);
    }

    @Test
    public void testFailedUpdateLeavesNodeUnchanged() {
        KnowledgeGraph g = abc();
        try {
            g.updateNode("Z", n -> n.putMetadata("k", 1));
            fail("Expected NotFoundException");
        } catch (NotFoundException e) {
            // expected
        }
        g.insertNode(new EventMetaNode("E", Map.of("message", "boot")));
        try {
            g.updateNode("E", n -> n.putMetadata("message", "changed"));
            fail("Expected SemanticException");
        } catch (SemanticException e) {
            assertEquals("boot", g.getNode("E").metadata("message"));
        }
    }

    @Test
    public void testStats() {
        KnowledgeGraph g = abc();
        g.insertNode(new OutcomeNode("Q"));
        g.insertEdge(Link.of("A", LinkRelation.EVAL_SEQUENCE, "B"));
        g.insertEdge(Link.of("B", LinkRelation.EVAL_SEQUENCE, "C"));

        GraphStats stats = g.stats();
        assertEquals(4, stats.nodeCount());
        assertEquals(2, stats.edgeCount());
        assertEquals(Integer.valueOf(3), stats.nodesByKind().get(NodeKind.DATA));
        assertEquals(Integer.valueOf(1), stats.nodesByKind().get(NodeKind.OUTCOME));
        assertEquals(Integer.valueOf(2), stats.edgesByRelation().get(LinkRelation.EVAL_SEQUENCE));
    }

    @Test
    public void testSnapshotAndRollback() {
        KnowledgeGraph g = abc();
        ((DataNode) g.getNode("A")).setContent("original");
        g.insertEdge(Link.of("A", LinkRelation.CASUAL, "B"));

        int v1 = g.snapshot("before changes");
        assertEquals(1, v1);

        ((DataNode) g.getNode("A")).setContent("changed");
        g.deleteNode("B");
        g.insertNode(new DataNode("X"));
        int v2 = g.snapshot("after changes");
        assertEquals(2, v2);

        g.rollback(v1);
        assertEquals(3, g.nodeCount());
        assertFalse(g.containsNode("X"));
        assertEquals(1, g.edgeCount());
        assertEquals("original", ((DataNode) g.getNode("A")).content());

        // The snapshot is not consumed, and mutations after rollback do not leak into it
        ((DataNode) g.getNode("A")).setContent("again");
        g.rollback(v1);
        assertEquals("original", ((DataNode) g.getNode("A")).content());

        g.rollback(v2);
        assertTrue(g.containsNode("X"));
        assertEquals("changed", ((DataNode) g.getNode("A")).content());

        List<GraphVersion> versions = g.listSnapshots();
        assertEquals(2, versions.size());
        assertEquals("before changes", versions.get(0).message());
        assertEquals(3, versions.get(0).nodeCount());
    }

    @Test
    public void testRollbackToUnknownVersion() {
        try {
            new KnowledgeGraph().rollback(9);
            fail("Expected NotFoundException");
        } catch (NotFoundException e) {
            assertTrue(e.getMessage().contains("Snapshot"));
        }
    }

    @Test
    public void testNodeHistoryAndRollback() {
        KnowledgeGraph g = abc();
        g.updateNode("A", n -> ((DataNode) n).setContent("first"));
        g.updateNode("A", n -> ((DataNode) n).setContent("second"));

        List<Revision> history = g.nodeHistory("A");
        assertEquals(3, history.size());
        assertEquals("Created", history.get(0).message());
        assertEquals(2, history.get(1).revision());

        GraphNode restored = g.rollbackNode("A", 2);
        assertEquals("first", ((DataNode) restored).content());
        assertSame(restored, g.getNode("A"));
        assertEquals(4, g.nodeHistory("A").size());
        assertEquals("Rolled back to revision 2", g.nodeHistory("A").get(3).message());

        try {
            g.rollbackNode("A", 9);
            fail("Expected NotFoundException");
        } catch (NotFoundException e) {
            assertTrue(e.getMessage().contains("A@9"));
        }
        assertEquals("first", ((DataNode) g.getNode("A")).content());
    }

    @Test
    public void testHistoryDepthAndDeletion() {
        KnowledgeGraph g = new KnowledgeGraph(2);
        g.insertNode(new DataNode("A"));
        g.insertNode(new DataNode("B"));
        for (int i = 0; i < 5; i++) {
            final int value = i;
            g.updateNode("A", n -> ((DataNode) n).setContent(value));
        }
        List<Revision> history = g.nodeHistory("A");
        assertEquals(2, history.size());
        assertEquals(5, history.get(0).revision());
        assertEquals(6, history.get(1).revision());
        try {
            g.rollbackNode("A", 1);
            fail("Expected NotFoundException");
        } catch (NotFoundException e) {
            // dropped
        }

        g.insertEdge(Link.of("A", LinkRelation.HIERARCHY, "B"));
        g.deleteNode("A");
        assertTrue(g.nodeHistory("A").isEmpty());
        assertTrue(g.edgeHistory("A_hierarchy_B").isEmpty());
    }

    @Test
    public void testEdgeUpdateAndRollback() {
        KnowledgeGraph g = abc();
        List<String> events = new ArrayList<>();
        g.addListener(new GraphListener() {
            @Override
            public void edgeUpdated(Link link) {
                events.add(link.relation().label());
            }
        });
        g.insertEdge(new Link("AB", "A", "B", LinkRelation.NON_FUNCTIONAL, Map.of("w", 1L)));

        Link updated = g.updateEdge("AB", Map.of("relation", "parameter", "w", 2L, "source", "A"));
        assertEquals(LinkRelation.PARAMETER, updated.relation());
        assertEquals(2L, g.getEdge("AB").metadata().get("w"));

        Link restored = g.rollbackEdge("AB", 1);
        assertEquals(LinkRelation.NON_FUNCTIONAL, restored.relation());
        assertEquals(1L, g.getEdge("AB").metadata().get("w"));
        assertEquals(Arrays.asList("parameter", "non_functional"), events);

        try {
            g.updateEdge("AB", Map.of("target", "C"));
            fail("Expected SemanticException");
        } catch (SemanticException e) {
            assertTrue(e.getMessage().contains("target"));
        }
        try {
            g.updateEdge("AB", Map.of("relation", "friend"));
            fail("Expected SemanticException");
        } catch (SemanticException e) {
            assertTrue(e.getMessage().contains("friend"));
        }
        try {
            g.updateEdge("Nope", Map.of("w", 3L));
            fail("Expected NotFoundException");
        } catch (NotFoundException e) {
            assertEquals("Edge not found: Nope", e.getMessage());
        }
        assertEquals(3, g.edgeHistory("AB").size());
    }

    @Test
    public void testSnapshotRollbackPrunesHistory() {
        KnowledgeGraph g = abc();
        int v = g.snapshot("three nodes");
        g.insertNode(new DataNode("D"));
        assertEquals(1, g.nodeHistory("D").size());
        g.rollback(v);
        assertTrue(g.nodeHistory("D").isEmpty());
        assertEquals(1, g.nodeHistory("A").size());
    }
}
