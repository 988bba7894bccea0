package io.github.basalt.markdown.event;

import io.github.basalt.markdown.BlockQuoteKind;
import io.github.basalt.markdown.HeadingLevel;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * The payload of a {@link MarkdownEvent.Start} event.
 */
public sealed interface Tag {

    TagKind kind();

    record Heading(HeadingLevel level) implements Tag {
        public Heading {
            Objects.requireNonNull(level, "level");
        }

        @Override
        public TagKind kind() {
            return TagKind.HEADING;
        }
    }

    record Paragraph() implements Tag {
        @Override
        public TagKind kind() {
            return TagKind.PARAGRAPH;
        }
    }

    /**
     * @param callout the callout kind recognized by the lexer, empty for plain quotes
     */
    record BlockQuote(Optional<BlockQuoteKind> callout) implements Tag {
        public BlockQuote {
            Objects.requireNonNull(callout, "callout");
        }

        @Override
        public TagKind kind() {
            return TagKind.BLOCK_QUOTE;
        }
    }

    /**
     * @param info the info string of a fenced block, empty for indented blocks
     */
    record CodeBlock(Optional<String> info) implements Tag {
        public CodeBlock {
            Objects.requireNonNull(info, "info");
        }

        @Override
        public TagKind kind() {
            return TagKind.CODE_BLOCK;
        }
    }

    /**
     * @param start the first number of an ordered list, empty for bullet lists
     */
    record ListBlock(OptionalLong start) implements Tag {
        public ListBlock {
            Objects.requireNonNull(start, "start");
        }

        @Override
        public TagKind kind() {
            return TagKind.LIST;
        }
    }

    record Item() implements Tag {
        @Override
        public TagKind kind() {
            return TagKind.ITEM;
        }
    }

    /**
     * Inline formatting and block kinds that produce no AST node of their own.
     */
    record Other(TagKind kind) implements Tag {
        public Other {
            Objects.requireNonNull(kind, "kind");
        }
    }
}
