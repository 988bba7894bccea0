package io.github.basalt.markdown;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only queries over parsed node trees.
 */
public final class MarkdownNodes {
    private MarkdownNodes() {
    }

    /**
     * Lists every node depth-first, parents before their children.
     */
    public static List<Node> flatten(List<Node> nodes) {
        Objects.requireNonNull(nodes, "nodes");
        var result = new ArrayList<Node>();
        collect(nodes, result);
        return result;
    }

    private static void collect(List<Node> nodes, List<Node> into) {
        for (var node : nodes) {
            into.add(node);
            collect(node.children(), into);
        }
    }

    /**
     * Finds the top-level node whose source range contains the byte offset.
     */
    public static Optional<Node> nodeAt(List<Node> nodes, int byteOffset) {
        Objects.requireNonNull(nodes, "nodes");
        return nodes.stream()
                .filter(node -> node.sourceRange().contains(byteOffset))
                .findFirst();
    }

    /**
     * Returns the chain of nodes containing the byte offset, from the top-level node down to the
     * innermost one. Empty when no top-level node contains the offset.
     */
    public static List<Node> pathAt(List<Node> nodes, int byteOffset) {
        Objects.requireNonNull(nodes, "nodes");
        var path = new ArrayList<Node>();
        var level = nodes;
        while (true) {
            var hit = nodeAt(level, byteOffset);
            if (hit.isEmpty()) {
                return path;
            }
            path.add(hit.get());
            level = hit.get().children();
        }
    }

    /**
     * The top-level headings, in document order.
     */
    public static List<Node> headings(List<Node> nodes) {
        Objects.requireNonNull(nodes, "nodes");
        return nodes.stream()
                .filter(node -> node.markdownNode() instanceof MarkdownNode.Heading)
                .toList();
    }
}
