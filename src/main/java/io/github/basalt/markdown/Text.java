package io.github.basalt.markdown;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An ordered sequence of {@link TextNode} runs owned by a leaf node.
 * <p>
 * Runs are appended only by {@link TreeBuilder} while the owning node is still open.
 * Callers see an unmodifiable view.
 */
public final class Text implements Iterable<TextNode> {
    private final List<TextNode> runs;

    public Text() {
        this.runs = new ArrayList<>();
    }

    private Text(List<TextNode> runs) {
        this.runs = new ArrayList<>(runs);
    }

    /**
     * Creates a text holding a single plain run.
     */
    public static Text of(String plain) {
        return new Text(List.of(TextNode.plain(plain)));
    }

    public static Text of(TextNode... runs) {
        return new Text(List.of(runs));
    }

    public static Text of(List<TextNode> runs) {
        return new Text(runs);
    }

    void push(TextNode run) {
        runs.add(run);
    }

    public List<TextNode> runs() {
        return Collections.unmodifiableList(runs);
    }

    public boolean isEmpty() {
        return runs.isEmpty();
    }

    /**
     * Concatenates all run contents, dropping style information.
     */
    public String plain() {
        return runs.stream().map(TextNode::content).collect(Collectors.joining());
    }

    @Override
    public Iterator<TextNode> iterator() {
        return runs().iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Text other && runs.equals(other.runs);
    }

    @Override
    public int hashCode() {
        return runs.hashCode();
    }

    @Override
    public String toString() {
        return "Text" + runs;
    }
}
