package io.github.basalt.markdown;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Golden tests comparing whole parsed trees, ranges included.
 */
public class MarkdownParserTest {

    private static Node node(MarkdownNode markdownNode, int start, int end) {
        return new Node(markdownNode, SourceRange.of(start, end));
    }

    private static Node p(String text, int start, int end) {
        return node(new MarkdownNode.Paragraph(Text.of(text)), start, end);
    }

    private static Node heading(HeadingLevel level, String text, int start, int end) {
        return node(new MarkdownNode.Heading(level, Text.of(text)), start, end);
    }

    private static Node blockquote(List<Node> nodes, int start, int end) {
        return node(new MarkdownNode.BlockQuote(Optional.empty(), nodes), start, end);
    }

    private static Node list(ListKind kind, List<Node> nodes, int start, int end) {
        return node(new MarkdownNode.ListBlock(kind, nodes), start, end);
    }

    private static Node item(String text, int start, int end) {
        return node(new MarkdownNode.Item(Text.of(text)), start, end);
    }

    private static Node task(TaskListItemKind kind, String text, int start, int end) {
        return node(new MarkdownNode.TaskListItem(kind, Text.of(text)), start, end);
    }

    @Test
    void testHeadingAndParagraph() {
        var nodes = MarkdownParser.fromString("# My Heading\n\nSome text.");

        assertEquals(List.of(
                heading(HeadingLevel.H1, "My Heading", 0, 13),
                p("Some text.", 14, 24)
        ), nodes);
    }

    @Test
    void testAllHeadingLevels() {
        var markdown = """
                # Heading 1

                ## Heading 2

                ### Heading 3

                #### Heading 4

                ##### Heading 5

                ###### Heading 6
                """;

        assertEquals(List.of(
                heading(HeadingLevel.H1, "Heading 1", 0, 12),
                heading(HeadingLevel.H2, "Heading 2", 13, 26),
                heading(HeadingLevel.H3, "Heading 3", 27, 41),
                heading(HeadingLevel.H4, "Heading 4", 42, 57),
                heading(HeadingLevel.H5, "Heading 5", 58, 74),
                heading(HeadingLevel.H6, "Heading 6", 75, 92)
        ), MarkdownParser.fromString(markdown));
    }

    @Test
    void testTaskList() {
        var markdown = """
                - [ ] Task
                - [x] Completed task
                - [?] Completed task
                """;

        // "[?]" is not a recognized checkbox and stays a regular item
        assertEquals(List.of(list(ListKind.unordered(), List.of(
                task(TaskListItemKind.UNCHECKED, "Task", 0, 11),
                task(TaskListItemKind.CHECKED, "Completed task", 11, 32),
                item("[?] Completed task", 32, 53)
        ), 0, 53)), MarkdownParser.fromString(markdown));
    }

    @Test
    void testQuotesWithInlineCode() {
        var markdown = """
                You _can_ quote text by adding a `>` symbols before the text.
                > Human beings face ever more complex and urgent problems, and their effectiveness in dealing with these problems is a matter that is critical to the stability and continued progress of society.
                > > > Deep Quote
                >
                > - Doug Engelbart, 1961
                """;

        var intro = node(new MarkdownNode.Paragraph(Text.of(
                TextNode.plain("You "),
                TextNode.plain("can"),
                TextNode.plain(" quote text by adding a "),
                TextNode.code(">"),
                TextNode.plain(" symbols before the text.")
        )), 0, 62);
        var quote = blockquote(List.of(
                p("Human beings face ever more complex and urgent problems, and their effectiveness in dealing with these problems is a matter that is critical to the stability and continued progress of society.", 64, 257),
                blockquote(List.of(blockquote(List.of(p("Deep Quote", 263, 274)), 261, 274)), 259, 274),
                list(ListKind.unordered(), List.of(item("Doug Engelbart, 1961", 278, 301)), 278, 301)
        ), 62, 301);

        assertEquals(List.of(intro, quote), MarkdownParser.fromString(markdown));
    }

    @Test
    void testNestedQuotesWithoutTrailingNewline() {
        var nodes = MarkdownParser.fromString("> > > Deep Quote");

        assertEquals(1, nodes.size());
        var outer = (MarkdownNode.BlockQuote) nodes.get(0).markdownNode();
        var middle = (MarkdownNode.BlockQuote) outer.nodes().get(0).markdownNode();
        var inner = (MarkdownNode.BlockQuote) middle.nodes().get(0).markdownNode();
        assertEquals(List.of(p("Deep Quote", 6, 16)), inner.nodes());
        assertEquals(SourceRange.of(0, 16), nodes.get(0).sourceRange());
    }

    @Test
    void testOrderedList() {
        var nodes = MarkdownParser.fromString("1. First\n2. Second\n");

        assertEquals(List.of(list(ListKind.ordered(1), List.of(
                item("First", 0, 9),
                item("Second", 9, 19)
        ), 0, 19)), nodes);

        var kind = (ListKind.Ordered) ((MarkdownNode.ListBlock) nodes.get(0).markdownNode()).kind();
        assertEquals(1, kind.numberAt(0));
        assertEquals(2, kind.numberAt(1));
    }

    @Test
    void testOrderedListKeepsStartNumber() {
        var nodes = MarkdownParser.fromString("3. Third\n4. Fourth\n");

        var listBlock = (MarkdownNode.ListBlock) nodes.get(0).markdownNode();
        assertEquals(ListKind.ordered(3), listBlock.kind());
        assertEquals(2, listBlock.nodes().size());
    }

    @Test
    void testHtmlBlockProducesNothing() {
        assertEquals(List.of(), MarkdownParser.fromString("<div>raw</div>"));
    }

    @Test
    void testEmptyInput() {
        assertTrue(MarkdownParser.fromString("").isEmpty());
    }

    @Test
    void testFencedCodeBlock() {
        var nodes = MarkdownParser.fromString("```java\nint x = 1;\n```\n");

        assertEquals(List.of(node(
                new MarkdownNode.CodeBlock(Optional.of("java"), Text.of("int x = 1;\n")), 0, 23)
        ), nodes);
    }

    @Test
    void testFencedCodeBlockWithoutLanguage() {
        var nodes = MarkdownParser.fromString("```\na\nb\n```\n");

        var codeBlock = (MarkdownNode.CodeBlock) nodes.get(0).markdownNode();
        assertEquals(Optional.empty(), codeBlock.lang());
        assertEquals("a\nb\n", codeBlock.text().plain());
    }

    @Test
    void testRangesAreUtf8Bytes() {
        var nodes = MarkdownParser.fromString("# Café\n\nÜber");

        assertEquals(List.of(
                heading(HeadingLevel.H1, "Café", 0, 8),
                p("Über", 9, 14)
        ), nodes);
    }

    @Test
    void testCallout() {
        var nodes = MarkdownParser.fromString("> [!NOTE]\n> Useful information.\n");

        assertEquals(List.of(node(
                new MarkdownNode.BlockQuote(Optional.of(BlockQuoteKind.NOTE), List.of(p("Useful information.", 12, 32))),
                0, 32)
        ), nodes);
    }

    @Test
    void testCalloutKindIsCaseInsensitive() {
        var nodes = MarkdownParser.fromString("> [!warning]\n> Careful.\n");

        var quote = (MarkdownNode.BlockQuote) nodes.get(0).markdownNode();
        assertEquals(Optional.of(BlockQuoteKind.WARNING), quote.kind());
        assertEquals("Careful.", ((MarkdownNode.Paragraph) quote.nodes().get(0).markdownNode()).text().plain());
    }

    @Test
    void testUnknownCalloutStaysPlainQuote() {
        var nodes = MarkdownParser.fromString("> [!FOO]\n> Text\n");

        var quote = (MarkdownNode.BlockQuote) nodes.get(0).markdownNode();
        assertEquals(Optional.empty(), quote.kind());
    }

    @Test
    void testInlineFormattingIsFlattened() {
        var nodes = MarkdownParser.fromString("Some **bold** and ~~gone~~ [link](https://example.com).");

        var paragraph = (MarkdownNode.Paragraph) nodes.get(0).markdownNode();
        assertEquals("Some bold and gone link.", paragraph.text().plain());
    }

    @Test
    void testUndefinedReferenceContentKeepsStyle() {
        assertEquals(List.of(node(new MarkdownNode.Paragraph(Text.of(
                TextNode.plain("See ["),
                TextNode.code("x"),
                TextNode.plain("] here")
        )), 0, 14)), MarkdownParser.fromString("See [`x`] here"));

        assertEquals(List.of(node(new MarkdownNode.Paragraph(Text.of(
                TextNode.plain("See ["),
                TextNode.plain("a"),
                TextNode.plain("] here")
        )), 0, 14)), MarkdownParser.fromString("See [*a*] here"));
    }

    @Test
    void testUncheckableMarkerStaysLiteral() {
        var nodes = MarkdownParser.fromString("- [?] maybe\n");

        assertEquals(List.of(list(ListKind.unordered(), List.of(item("[?] maybe", 0, 12)), 0, 12)), nodes);
    }

    @Test
    void testConcurrentParsesShareTheDefaultParser() throws Exception {
        var markdown = """
                # Title

                > [!TIP]
                > Quoted `code`

                - [x] done
                - [ ] open
                """;
        var expected = MarkdownParser.fromString(markdown);

        var pool = Executors.newFixedThreadPool(8);
        try {
            var tasks = new ArrayList<Callable<List<Node>>>();
            for (int i = 0; i < 64; i++) {
                tasks.add(() -> MarkdownParser.fromString(markdown));
            }
            for (var future : pool.invokeAll(tasks)) {
                assertEquals(expected, future.get());
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void testThematicBreakAndTableAreDropped() {
        var nodes = MarkdownParser.fromString("Before\n\n---\n\n| a | b |\n|---|---|\n| 1 | 2 |\n\nAfter\n");

        assertEquals(2, nodes.size());
        assertEquals("Before", ((MarkdownNode.Paragraph) nodes.get(0).markdownNode()).text().plain());
        assertEquals("After", ((MarkdownNode.Paragraph) nodes.get(1).markdownNode()).text().plain());
    }

    @Test
    void testParsingIsDeterministic() {
        var markdown = "# Title\n\n- [x] done\n- todo\n\n> quote\n";

        assertEquals(MarkdownParser.fromString(markdown), MarkdownParser.fromString(markdown));
    }
}
