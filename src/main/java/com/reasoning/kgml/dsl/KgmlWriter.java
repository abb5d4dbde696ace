package com.reasoning.kgml.dsl;

import com.reasoning.kgml.api.ArgumentBundle;
import com.reasoning.kgml.api.Instructions;
import com.reasoning.kgml.api.RawText;
import com.reasoning.kgml.error.SemanticException;
import com.reasoning.kgml.graph.KnowledgeGraph;
import com.reasoning.kgml.graph.Link;
import com.reasoning.kgml.node.DataNode;
import com.reasoning.kgml.node.GraphNode;
import com.reasoning.kgml.node.OutcomeNode;
import com.reasoning.kgml.util.Values;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Serializes programs and graphs back to KGML.
 *
 * <p>
 * Writing a parsed program and parsing the text again gives an equal
 * program. Writing a graph gives a program that, executed against an empty
 * graph, rebuilds its nodes, types, metadata, scalar content, outcome state and
 * edges. Non-scalar content and attached callables cannot be expressed in KGML
 * and are left out.
 */
public final class KgmlWriter {
    private static final Pattern IDENT = Pattern.compile("[\\p{L}_][\\p{L}\\p{Nd}_-]*");

    private KgmlWriter() {
        // Utility class
    }

    public static String write(Program program) {
        StringBuilder sb = new StringBuilder(64 + program.size() * 48);
        sb.append("KG►\n");
        writeBlock(sb, program.statements());
        return sb.append("◄\n").toString();
    }

    private static void writeBlock(StringBuilder sb, List<Statement> statements) {
        for (Statement s : statements) {
            if (s instanceof Command c) {
                writeCommand(sb, c);
            } else if (s instanceof Conditional cond) {
                String marker = "IF► ";
                for (Conditional.Branch branch : cond.branches()) {
                    sb.append(marker);
                    writeCommand(sb, branch.condition());
                    writeBlock(sb, branch.body());
                    marker = "ELIF► ";
                }
                if (!cond.otherwise().isEmpty()) {
                    sb.append("ELSE►\n");
                    writeBlock(sb, cond.otherwise());
                }
                sb.append("◄\n");
            } else if (s instanceof Loop loop) {
                sb.append("LOOP► ");
                writeCommand(sb, loop.condition());
                writeBlock(sb, loop.body());
                sb.append("◄\n");
            }
        }
    }

    /** One KGML document recreating the graph: nodes first, then edges. */
    public static String write(KnowledgeGraph graph) {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("KG►\n");
        for (GraphNode node : graph.queryNodes(n -> true))
            writeCommand(sb, nodeCommand(node));
        for (Link link : graph.queryEdges(e -> true))
            writeCommand(sb, linkCommand(link));
        return sb.append("◄\n").toString();
    }

    static Command nodeCommand(GraphNode node) {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put(Command.TYPE_KEY, node.type());
        props.putAll(node.metadata());
        if (node.kind().isMeta())
            return new Command(Verb.NODE, node.uid(), props);
        if (node instanceof OutcomeNode outcome) {
            props.put(OutcomeNode.TARGET_KEY, outcome.targetEvalState());
            props.put(OutcomeNode.LAST_STATE_KEY, outcome.lastEvalState());
            props.put(OutcomeNode.WEIGHT_KEY, outcome.weight());
        }
        if (node instanceof DataNode data && data.content() != null && Values.isScalar(data.content()))
            props.put(DataNode.CONTENT_KEY, data.content());
        return new Command(Verb.CREATE, node.uid(), props);
    }

    static Command linkCommand(Link link) {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put(Command.RELATION_KEY, link.relation().label());
        props.put("source", link.source());
        props.put("target", link.target());
        props.putAll(link.metadata());
        return new Command(Verb.LINK_DECL, link.uid(), props);
    }

    private static void writeCommand(StringBuilder sb, Command c) {
        sb.append(c.verb().marker()).append(' ').append(ident(c.target()));
        if (c.verb() == Verb.EVALUATE) {
            writeInstructions(sb, c.instructions());
        } else if (!c.properties().isEmpty() || c.verb() != Verb.DELETE) {
            sb.append(" :");
            Map<String, Object> props = c.properties();
            if (c.verb() == Verb.LINK_DECL && props.containsKey(Command.RELATION_KEY)) {
                props = new LinkedHashMap<>();
                props.put(Command.RELATION_KEY, c.properties().get(Command.RELATION_KEY));
                props.putAll(c.properties());
            }
            String sep = " ";
            for (Map.Entry<String, Object> e : props.entrySet()) {
                sb.append(sep).append(ident(e.getKey())).append('=');
                writeValue(sb, e.getValue());
                sep = ", ";
            }
        }
        sb.append('\n');
    }

    private static void writeInstructions(StringBuilder sb, Instructions instructions) {
        if (instructions.isEmpty() && instructions instanceof ArgumentBundle)
            return;
        instructions.fold(bundle -> {
            sb.append(" : {");
            String sep = "";
            for (Object v : bundle.positional()) {
                sb.append(sep);
                writeValue(sb, v);
                sep = ", ";
            }
            for (Map.Entry<String, Object> e : bundle.named().entrySet()) {
                sb.append(sep).append(ident(e.getKey())).append('=');
                writeValue(sb, e.getValue());
                sep = ", ";
            }
            return sb.append('}');
        }, (RawText text) -> {
            sb.append(" : ");
            quote(sb, text.text());
            return sb;
        });
    }

    static void writeValue(StringBuilder sb, Object value) {
        if (value == null) {
            sb.append("null");
        } else if (value instanceof Boolean b) {
            sb.append(b);
        } else if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isFinite(d))
                sb.append(d);
            else
                quote(sb, Double.toString(d));
        } else if (value instanceof Number n) {
            sb.append(n);
        } else {
            quote(sb, value.toString());
        }
    }

    private static void quote(StringBuilder sb, String s) {
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                default -> {
                    if (c < 0x20)
                        sb.append(String.format("\\u%04x", (int) c));
                    else
                        sb.append(c);
                }
            }
        }
        sb.append('"');
    }

    private static String ident(String s) {
        if (!IDENT.matcher(s).matches())
            throw new SemanticException("'" + s + "' cannot be written as a KGML identifier");
        return s;
    }
}
