package io.github.basalt.markdown;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The Markdown AST node variants.
 * <p>
 * {@link Leaf} variants own a {@link Text} buffer and never hold child nodes; {@link Container}
 * variants hold fully built child {@link Node}s and no text of their own.
 */
public sealed interface MarkdownNode {

    sealed interface Leaf extends MarkdownNode {
        Text text();
    }

    sealed interface Container extends MarkdownNode {
        List<Node> nodes();
    }

    record Heading(HeadingLevel level, Text text) implements Leaf {
        public Heading {
            Objects.requireNonNull(level, "level");
            Objects.requireNonNull(text, "text");
        }
    }

    record Paragraph(Text text) implements Leaf {
        public Paragraph {
            Objects.requireNonNull(text, "text");
        }
    }

    /**
     * A block quote. When {@code kind} is empty it is a regular {@code > quote}, otherwise a callout.
     */
    record BlockQuote(Optional<BlockQuoteKind> kind, List<Node> nodes) implements Container {
        public BlockQuote {
            Objects.requireNonNull(kind, "kind");
            nodes = List.copyOf(nodes);
        }
    }

    /**
     * A fenced or indented code block. {@code lang} is the first word of a fence's info string.
     */
    record CodeBlock(Optional<String> lang, Text text) implements Leaf {
        public CodeBlock {
            Objects.requireNonNull(lang, "lang");
            Objects.requireNonNull(text, "text");
        }
    }

    record ListBlock(ListKind kind, List<Node> nodes) implements Container {
        public ListBlock {
            Objects.requireNonNull(kind, "kind");
            nodes = List.copyOf(nodes);
        }
    }

    record Item(Text text) implements Leaf {
        public Item {
            Objects.requireNonNull(text, "text");
        }
    }

    record TaskListItem(TaskListItemKind kind, Text text) implements Leaf {
        public TaskListItem {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(text, "text");
        }
    }
}
