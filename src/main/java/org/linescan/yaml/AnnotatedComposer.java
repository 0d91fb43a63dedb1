package org.linescan.yaml;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.composer.Composer;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.NodeTuple;
import org.yaml.snakeyaml.nodes.ScalarNode;
import org.yaml.snakeyaml.nodes.Tag;
import org.yaml.snakeyaml.parser.Parser;
import org.yaml.snakeyaml.resolver.Resolver;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Composer that records, for every mapping value, the source line it starts on and rewrites
 * string and binary values into {@link ProvenanceNode}s once their mapping is complete.
 * <p>
 * The tree is otherwise identical to the one the stock {@link Composer} builds. Sequences are
 * not annotated: a scalar only gains provenance when it is the value of a mapping entry.
 */
public class AnnotatedComposer extends Composer {

    private final ParserContext context;
    private final FlowMappingLineCorrector corrector;
    // value lines per open mapping, in child order
    private final Map<MappingNode, List<Integer>> valueLines = new IdentityHashMap<>();

    public AnnotatedComposer(Parser parser,
                             Resolver resolver,
                             LoaderOptions options,
                             ParserContext context,
                             FlowMappingLineCorrector corrector) {
        super(parser, resolver, options);
        this.context = context;
        this.corrector = corrector;
    }

    @Override
    protected Node composeKeyNode(MappingNode node) {
        // the key event is already queued by the mapping loop
        corrector.beforeKey(node, parser.peekEvent().getStartMark(), context);
        return super.composeKeyNode(node);
    }

    @Override
    protected Node composeValueNode(MappingNode node) {
        // the value event, not the composed node: an alias starts where it is written
        int line = context.valueLine(node.getStartMark(), parser.peekEvent().getStartMark());
        Node value = super.composeValueNode(node);
        valueLines.computeIfAbsent(node, k -> new ArrayList<>()).add(line);
        return value;
    }

    @Override
    protected Node composeMappingNode(String anchor) {
        MappingNode node = (MappingNode) super.composeMappingNode(anchor);
        context.clearInlineMappingKey();
        List<Integer> lines = valueLines.remove(node);
        if (lines != null) {
            annotate(node, lines);
        }
        return node;
    }

    /**
     * Replaces every string or binary scalar value of a finished mapping with a
     * {@link ProvenanceNode}. The node is updated in place so aliases of an anchored mapping
     * resolve to the annotated children.
     */
    private static void annotate(MappingNode node, List<Integer> lines) {
        List<NodeTuple> children = node.getValue();
        List<NodeTuple> annotated = new ArrayList<>(children.size());
        for (int i = 0; i < children.size(); i++) {
            NodeTuple tuple = children.get(i);
            Node key = tuple.getKeyNode();
            Node value = tuple.getValueNode();
            if (i < lines.size() && key instanceof ScalarNode && isAnnotatable(value)) {
                ProvenanceNode provenance = new ProvenanceNode(
                        (ScalarNode) value, lines.get(i), ((ScalarNode) key).getValue());
                annotated.add(new NodeTuple(key, provenance));
            } else {
                annotated.add(tuple);
            }
        }
        node.setValue(annotated);
    }

    private static boolean isAnnotatable(Node value) {
        if (!(value instanceof ScalarNode)) {
            return false;
        }
        Tag tag = value.getTag();
        return Tag.STR.equals(tag) || Tag.BINARY.equals(tag);
    }
}
