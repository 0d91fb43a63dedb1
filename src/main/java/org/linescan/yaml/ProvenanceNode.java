package org.linescan.yaml;

import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.NodeId;
import org.yaml.snakeyaml.nodes.ScalarNode;

import java.util.Objects;

/**
 * Mapping value carrying its source provenance: the original string or binary scalar, the
 * 1-based line it was stamped with and the text of the key it was found under.
 * <p>
 * It is a leaf, constructed by {@link AnnotatedConstructor} into an {@link AnnotatedScalar}.
 */
public final class ProvenanceNode extends Node {

    private final ScalarNode valueNode;
    private final int line;
    private final String originalKey;

    public ProvenanceNode(ScalarNode valueNode, int line, String originalKey) {
        super(valueNode.getTag(), valueNode.getStartMark(), valueNode.getEndMark());
        this.valueNode = valueNode;
        this.line = line;
        this.originalKey = Objects.requireNonNull(originalKey, "originalKey must not be null");
    }

    @Override
    public NodeId getNodeId() {
        return NodeId.scalar;
    }

    public ScalarNode getValueNode() {
        return valueNode;
    }

    public int getLine() {
        return line;
    }

    public String getOriginalKey() {
        return originalKey;
    }

    @Override
    public String toString() {
        return "<" + getClass().getName() + " (key=" + originalKey + ", line=" + line + ")>";
    }
}
