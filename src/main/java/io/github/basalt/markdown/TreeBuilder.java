package io.github.basalt.markdown;

import io.github.basalt.markdown.event.MarkdownEvent;
import io.github.basalt.markdown.event.Tag;
import io.github.basalt.markdown.event.TagKind;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Rebuilds the nested AST from a flat {@link MarkdownEvent} stream.
 * <p>
 * The builder is a recursive descent over the stream. Block quotes and lists recurse until their
 * matching close event; headings, paragraphs, code blocks and items are leaves that collect the
 * text of the events following them. Nothing here throws on odd input: close events without a
 * matching open container and events the AST has no place for are dropped.
 * <p>
 * The builder keeps no state between calls and may be shared between threads.
 */
public class TreeBuilder {
    private static final Logger logger = LogManager.getLogger(TreeBuilder.class);

    /**
     * Consumes the whole event stream and returns the top-level nodes in document order.
     *
     * @param events the lexical events, in source order
     * @return the top-level nodes
     */
    public List<Node> build(Iterator<MarkdownEvent> events) {
        return List.copyOf(buildLevel(events, null));
    }

    public List<Node> build(Iterable<MarkdownEvent> events) {
        return build(events.iterator());
    }

    /**
     * Builds the nodes of one nesting level.
     *
     * @param events shared iterator, advanced past the close event of {@code enclosing}
     * @param enclosing the container being filled, or null at the top level
     * @return the nodes of this level, still mutable for task-marker replacement
     */
    private List<Node> buildLevel(Iterator<MarkdownEvent> events, TagKind enclosing) {
        var nodes = new ArrayList<Node>();

        while (events.hasNext()) {
            var event = events.next();

            if (event instanceof MarkdownEvent.Start start) {
                open(start.tag(), start.range(), events).ifPresent(nodes::add);
            } else if (event instanceof MarkdownEvent.End end) {
                if (enclosing != null && enclosing == end.kind()) {
                    return nodes;
                }
                logger.trace("Ignoring {} close at {}", end.kind(), end.range());
            } else if (event instanceof MarkdownEvent.Text text) {
                pushText(nodes, TextNode.plain(text.text()));
            } else if (event instanceof MarkdownEvent.Code code) {
                pushText(nodes, TextNode.code(code.code()));
            } else if (event instanceof MarkdownEvent.TaskListMarker marker) {
                markTask(nodes, marker);
            } else {
                logger.trace("Skipping unsupported event {}", event);
            }
        }

        if (enclosing != null) {
            logger.debug("Event stream ended inside an open {}", enclosing);
        }
        return nodes;
    }

    /**
     * Creates the node for an opening tag. Containers consume their children from the stream
     * before returning.
     */
    private Optional<Node> open(Tag tag, SourceRange range, Iterator<MarkdownEvent> events) {
        if (tag instanceof Tag.BlockQuote quote) {
            var children = buildLevel(events, TagKind.BLOCK_QUOTE);
            return Optional.of(new Node(new MarkdownNode.BlockQuote(quote.callout(), children), range));
        }
        if (tag instanceof Tag.ListBlock list) {
            var kind = list.start().isPresent() ? ListKind.ordered(list.start().getAsLong()) : ListKind.unordered();
            var children = buildLevel(events, TagKind.LIST);
            return Optional.of(new Node(new MarkdownNode.ListBlock(kind, children), range));
        }
        if (tag instanceof Tag.Heading heading) {
            return Optional.of(new Node(new MarkdownNode.Heading(heading.level(), new Text()), range));
        }
        if (tag instanceof Tag.Paragraph) {
            return Optional.of(new Node(new MarkdownNode.Paragraph(new Text()), range));
        }
        if (tag instanceof Tag.CodeBlock codeBlock) {
            return Optional.of(new Node(new MarkdownNode.CodeBlock(language(codeBlock), new Text()), range));
        }
        if (tag instanceof Tag.Item) {
            return Optional.of(new Node(new MarkdownNode.Item(new Text()), range));
        }
        logger.trace("No node for {} at {}", tag.kind(), range);
        return Optional.empty();
    }

    private static Optional<String> language(Tag.CodeBlock codeBlock) {
        return codeBlock.info()
                .map(String::strip)
                .filter(info -> !info.isEmpty())
                .map(info -> info.split("\\s+", 2)[0]);
    }

    private static void pushText(List<Node> nodes, TextNode run) {
        if (nodes.isEmpty()) {
            logger.trace("Dropping text without an owning node: {}", run);
            return;
        }
        nodes.get(nodes.size() - 1).pushText(run);
    }

    /**
     * Turns the item opened just before the marker into a task item, keeping its range and text.
     */
    private static void markTask(List<Node> nodes, MarkdownEvent.TaskListMarker marker) {
        if (nodes.isEmpty()) {
            return;
        }
        int last = nodes.size() - 1;
        var node = nodes.get(last);
        if (node.markdownNode() instanceof MarkdownNode.Item item) {
            var kind = marker.checked() ? TaskListItemKind.CHECKED : TaskListItemKind.UNCHECKED;
            nodes.set(last, new Node(new MarkdownNode.TaskListItem(kind, item.text()), node.sourceRange()));
        } else {
            logger.trace("Task marker at {} does not follow an item", marker.range());
        }
    }
}
