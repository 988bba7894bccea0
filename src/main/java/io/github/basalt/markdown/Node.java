package io.github.basalt.markdown;

import java.util.List;
import java.util.Objects;

/**
 * A {@link MarkdownNode} paired with the range of source text it was parsed from.
 */
public record Node(MarkdownNode markdownNode, SourceRange sourceRange) {
    public Node {
        Objects.requireNonNull(markdownNode, "markdownNode");
        Objects.requireNonNull(sourceRange, "sourceRange");
    }

    /**
     * Child nodes of a container, or an empty list for leaves.
     */
    public List<Node> children() {
        if (markdownNode instanceof MarkdownNode.Container container) {
            return container.nodes();
        }
        return List.of();
    }

    /**
     * Appends a run to the innermost open leaf: this node's own text for leaves, the last
     * child (recursively) for containers. Runs reaching an empty container are dropped.
     */
    void pushText(TextNode run) {
        if (markdownNode instanceof MarkdownNode.Leaf leaf) {
            leaf.text().push(run);
        } else if (markdownNode instanceof MarkdownNode.Container container) {
            var nodes = container.nodes();
            if (!nodes.isEmpty()) {
                nodes.get(nodes.size() - 1).pushText(run);
            }
        }
    }
}
