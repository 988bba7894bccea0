package io.github.basalt.outline;

import io.github.basalt.markdown.HeadingLevel;
import io.github.basalt.markdown.MarkdownNode;
import io.github.basalt.markdown.Node;
import io.github.basalt.markdown.SourceRange;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.stream.IntStream;

/**
 * Table of contents built from the top-level headings of a parsed note.
 * <p>
 * Headings nest by level: a heading becomes a child of the closest preceding heading with a
 * smaller level. Only top-level nodes are considered, so headings inside block quotes or lists
 * are not part of the outline.
 */
public final class Outline {
    private static final Logger logger = LogManager.getLogger(Outline.class);

    private final List<OutlineEntry> entries;
    private final List<OutlineEntry> flattened;

    private Outline(List<OutlineEntry> entries) {
        this.entries = List.copyOf(entries);
        this.flattened = flatten(entries);
    }

    public static Outline of(List<Node> nodes) {
        Objects.requireNonNull(nodes, "nodes");
        var headings = new ArrayList<HeadingRef>();
        for (int i = 0; i < nodes.size(); i++) {
            var node = nodes.get(i);
            if (node.markdownNode() instanceof MarkdownNode.Heading heading) {
                headings.add(new HeadingRef(i, heading.level(), heading.text().plain(), node.sourceRange()));
            }
        }

        var cursor = new Cursor(headings);
        var entries = build(cursor, null, nodes.size());
        logger.debug("Built outline of {} headings from {} nodes", headings.size(), nodes.size());
        return new Outline(entries);
    }

    private record HeadingRef(int index, HeadingLevel level, String title, SourceRange range) {}

    private static final class Cursor {
        private final List<HeadingRef> headings;
        private int position;

        Cursor(List<HeadingRef> headings) {
            this.headings = headings;
        }

        Optional<HeadingRef> peek() {
            return position < headings.size() ? Optional.of(headings.get(position)) : Optional.empty();
        }

        HeadingRef next() {
            return headings.get(position++);
        }
    }

    /**
     * Builds the entries of one nesting level. Returns once the next heading is at or above
     * {@code parentLevel}.
     */
    private static List<OutlineEntry> build(Cursor cursor, HeadingLevel parentLevel, int nodeCount) {
        var result = new ArrayList<OutlineEntry>();
        while (cursor.peek().isPresent()) {
            if (parentLevel != null && cursor.peek().get().level().compareTo(parentLevel) <= 0) {
                break;
            }
            var heading = cursor.next();
            var following = cursor.peek();
            int end = following.map(HeadingRef::index).orElse(nodeCount);
            List<OutlineEntry> children = following.isPresent() && following.get().level().compareTo(heading.level()) > 0
                    ? build(cursor, heading.level(), nodeCount)
                    : List.of();
            result.add(new OutlineEntry(heading.title(), heading.level(), heading.index(), end, heading.range(), children));
        }
        return result;
    }

    private static List<OutlineEntry> flatten(List<OutlineEntry> entries) {
        var result = new ArrayList<OutlineEntry>();
        for (var entry : entries) {
            result.add(entry);
            result.addAll(flatten(entry.children()));
        }
        return result;
    }

    public List<OutlineEntry> entries() {
        return entries;
    }

    /**
     * All entries depth-first, parents before children.
     */
    public List<OutlineEntry> flatten() {
        return List.copyOf(flattened);
    }

    public int headingCount() {
        return flattened.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Finds the entry whose section contains the top-level node index.
     */
    public Optional<OutlineEntry> find(int nodeIndex) {
        var index = indexOf(nodeIndex);
        return index.isPresent() ? Optional.of(flattened.get(index.getAsInt())) : Optional.empty();
    }

    /**
     * Position in {@link #flatten()} of the entry whose section contains the node index.
     */
    public OptionalInt indexOf(int nodeIndex) {
        return IntStream.range(0, flattened.size())
                .filter(i -> flattened.get(i).containsIndex(nodeIndex))
                .findFirst();
    }
}
