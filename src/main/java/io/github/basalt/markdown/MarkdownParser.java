package io.github.basalt.markdown;

import io.github.basalt.markdown.event.EventSource;
import io.github.basalt.markdown.flex.FlexmarkEventSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;

/**
 * Parses Markdown text into a list of source-ranged {@link Node}s.
 * <p>
 * The text is lexed by an {@link EventSource} (flexmark-backed by default) and the resulting
 * event stream is folded into a tree by {@link TreeBuilder}. Parsing never fails: unsupported
 * constructs such as HTML blocks or tables simply produce no node.
 *
 * <pre>{@code
 * var nodes = MarkdownParser.fromString("# My Heading\n\nSome text.");
 * // [Node[Heading[H1, "My Heading"], 0..13], Node[Paragraph["Some text."], 14..24]]
 * }</pre>
 */
public final class MarkdownParser {
    private static final Logger logger = LogManager.getLogger(MarkdownParser.class);
    private static final MarkdownParser DEFAULT = new MarkdownParser();

    private final EventSource eventSource;
    private final TreeBuilder treeBuilder = new TreeBuilder();

    public MarkdownParser() {
        this(new FlexmarkEventSource());
    }

    public MarkdownParser(EventSource eventSource) {
        this.eventSource = Objects.requireNonNull(eventSource, "eventSource");
    }

    /**
     * Parses the text with the default flexmark event source.
     */
    public static List<Node> fromString(String text) {
        return DEFAULT.parse(text);
    }

    /**
     * Parses the given Markdown text.
     *
     * @param text the Markdown source
     * @return the top-level nodes in document order, never null
     */
    public List<Node> parse(String text) {
        Objects.requireNonNull(text, "text");
        var events = eventSource.events(text);
        var nodes = treeBuilder.build(events);
        logger.debug("Parsed {} events into {} top-level nodes ({} chars)", events.size(), nodes.size(), text.length());
        return nodes;
    }
}
