package io.github.basalt.outline;

import io.github.basalt.markdown.HeadingLevel;
import io.github.basalt.markdown.SourceRange;

import java.util.List;
import java.util.Objects;

/**
 * A heading in the outline tree.
 *
 * @param title the heading's plain text
 * @param level the heading level
 * @param startIndex index of the heading among the top-level nodes
 * @param endIndex index of the next heading of any level, or the node count for the last one
 * @param sourceRange source range of the heading node itself
 * @param children deeper headings that follow before the next heading at this level or above
 */
public record OutlineEntry(String title,
                           HeadingLevel level,
                           int startIndex,
                           int endIndex,
                           SourceRange sourceRange,
                           List<OutlineEntry> children) {
    public OutlineEntry {
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(level, "level");
        Objects.requireNonNull(sourceRange, "sourceRange");
        children = List.copyOf(children);
    }

    /**
     * Returns true if the top-level node index falls into this heading's section, before the
     * next heading.
     */
    public boolean containsIndex(int nodeIndex) {
        return nodeIndex >= startIndex && nodeIndex < endIndex;
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }
}
