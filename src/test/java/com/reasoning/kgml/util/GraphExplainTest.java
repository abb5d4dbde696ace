package com.reasoning.kgml.util;

import com.reasoning.kgml.error.NotFoundException;
import com.reasoning.kgml.graph.KnowledgeGraph;
import com.reasoning.kgml.graph.Link;
import com.reasoning.kgml.graph.LinkRelation;
import com.reasoning.kgml.node.ActionMetaNode;
import com.reasoning.kgml.node.DataNode;
import com.reasoning.kgml.node.OutcomeNode;
import org.junit.Test;

import java.util.Map;

import static org.junit.Assert.*;

public class GraphExplainTest {

    private static KnowledgeGraph sample() {
        KnowledgeGraph g = new KnowledgeGraph();
        DataNode sensor = new DataNode("Sensor-01", "SensorNode");
        sensor.setContent("reading \"high\"");
        g.insertNode(sensor);
        g.insertNode(new OutcomeNode("Check"));
        g.insertNode(new ActionMetaNode("Why", Map.of("reason", "test")));
        g.insertEdge(Link.of("Sensor-01", LinkRelation.EVAL_SEQUENCE, "Check"));
        g.insertEdge(Link.of("Check", LinkRelation.HIERARCHY, "Why"));
        return g;
    }

    @Test
    public void testExplainNode() {
        String text = new GraphExplain(sample()).explainNode("Sensor-01");
        assertTrue(text.startsWith("Node: Sensor-01"));
        assertTrue(text.contains("Type: SensorNode (DATA)"));
        assertTrue(text.contains("Outgoing (1): Check [eval_sequence]"));
    }

    @Test
    public void testExplainMissingNode() {
        try {
            new GraphExplain(sample()).explainNode("Nope");
            fail("Expected NotFoundException");
        } catch (NotFoundException e) {
            assertTrue(e.getMessage().contains("Nope"));
        }
    }

    @Test
    public void testDump() {
        String dump = new GraphExplain(sample()).dump();
        assertTrue(dump.startsWith("Graph (3 nodes, 2 edges):"));
        assertTrue(dump.contains("[2] Why : ActionMetaNode (FROZEN)"));
        assertTrue(dump.contains("Sensor-01 : SensorNode → Check/eval_sequence"));
    }

    @Test
    public void testMermaid() {
        String mermaid = new GraphExplain(sample()).toMermaid();
        assertTrue(mermaid.startsWith("graph TD;"));
        // Ids are sanitized, labels keep the uid with quotes escaped
        assertTrue(mermaid.contains("Sensor_01[\"Sensor-01<br/><i>SensorNode</i><br/>reading #quot;high#quot;\"];"));
        assertTrue(mermaid.contains("Why[\"Why<br/><i>ActionMetaNode</i>\"]:::meta;"));
        // Cascading edges solid, descriptive ones dotted
        assertTrue(mermaid.contains("Sensor_01 -- \"eval_sequence\" --> Check;"));
        assertTrue(mermaid.contains("Check -. \"hierarchy\" .-> Why;"));
    }
}
