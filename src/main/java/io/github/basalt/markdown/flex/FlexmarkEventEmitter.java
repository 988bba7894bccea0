package io.github.basalt.markdown.flex;

import com.vladsch.flexmark.ast.AutoLink;
import com.vladsch.flexmark.ast.BlockQuote;
import com.vladsch.flexmark.ast.BulletList;
import com.vladsch.flexmark.ast.Code;
import com.vladsch.flexmark.ast.Emphasis;
import com.vladsch.flexmark.ast.FencedCodeBlock;
import com.vladsch.flexmark.ast.HardLineBreak;
import com.vladsch.flexmark.ast.Heading;
import com.vladsch.flexmark.ast.HtmlBlock;
import com.vladsch.flexmark.ast.HtmlCommentBlock;
import com.vladsch.flexmark.ast.HtmlEntity;
import com.vladsch.flexmark.ast.HtmlInline;
import com.vladsch.flexmark.ast.HtmlInlineComment;
import com.vladsch.flexmark.ast.Image;
import com.vladsch.flexmark.ast.IndentedCodeBlock;
import com.vladsch.flexmark.ast.Link;
import com.vladsch.flexmark.ast.ListBlock;
import com.vladsch.flexmark.ast.ListItem;
import com.vladsch.flexmark.ast.MailLink;
import com.vladsch.flexmark.ast.OrderedList;
import com.vladsch.flexmark.ast.Paragraph;
import com.vladsch.flexmark.ast.RefNode;
import com.vladsch.flexmark.ast.Reference;
import com.vladsch.flexmark.ast.SoftLineBreak;
import com.vladsch.flexmark.ast.StrongEmphasis;
import com.vladsch.flexmark.ast.ThematicBreak;
import com.vladsch.flexmark.ext.gfm.strikethrough.Strikethrough;
import com.vladsch.flexmark.ext.gfm.tasklist.TaskListItem;
import com.vladsch.flexmark.ext.tables.TableBlock;
import com.vladsch.flexmark.util.ast.Block;
import com.vladsch.flexmark.util.ast.ContentNode;
import com.vladsch.flexmark.util.ast.Document;
import com.vladsch.flexmark.util.ast.Node;
import io.github.basalt.markdown.HeadingLevel;
import io.github.basalt.markdown.SourceOffsets;
import io.github.basalt.markdown.SourceRange;
import io.github.basalt.markdown.event.MarkdownEvent;
import io.github.basalt.markdown.event.Tag;
import io.github.basalt.markdown.event.TagKind;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Walks a flexmark {@link Document} depth-first and records the equivalent event stream.
 * <p>
 * One emitter serves a single document; {@link FlexmarkEventSource} creates a fresh one per call.
 */
class FlexmarkEventEmitter {
    private static final Logger logger = LogManager.getLogger(FlexmarkEventEmitter.class);

    private final SourceOffsets offsets;
    private final String source;
    private final boolean detectCallouts;
    private final List<MarkdownEvent> events = new ArrayList<>();

    FlexmarkEventEmitter(SourceOffsets offsets, boolean detectCallouts) {
        this.offsets = offsets;
        this.source = offsets.text();
        this.detectCallouts = detectCallouts;
    }

    List<MarkdownEvent> emit(Document document) {
        visitChildren(document);
        return events;
    }

    private void visitChildren(Node parent) {
        for (var child = parent.getFirstChild(); child != null; child = child.getNext()) {
            visit(child);
        }
    }

    private void visit(Node node) {
        // block structure
        if (node instanceof Heading heading) {
            block(new Tag.Heading(HeadingLevel.of(heading.getLevel())), heading);
        } else if (node instanceof Paragraph paragraph) {
            paragraph(paragraph);
        } else if (node instanceof BlockQuote quote) {
            blockQuote(quote);
        } else if (node instanceof FencedCodeBlock fenced) {
            codeBlock(fenced, Optional.of(fenced.getInfo().toString()));
        } else if (node instanceof IndentedCodeBlock indented) {
            codeBlock(indented, Optional.empty());
        } else if (node instanceof OrderedList ordered) {
            block(new Tag.ListBlock(OptionalLong.of(ordered.getStartNumber())), ordered);
        } else if (node instanceof BulletList bullets) {
            block(new Tag.ListBlock(OptionalLong.empty()), bullets);
        } else if (node instanceof ListItem item) {
            listItem(item);
        } else if (node instanceof HtmlBlock || node instanceof HtmlCommentBlock) {
            var range = blockRange(node);
            events.add(new MarkdownEvent.Start(new Tag.Other(TagKind.HTML_BLOCK), range));
            events.add(new MarkdownEvent.Html(node.getChars().toString(), range));
            events.add(new MarkdownEvent.End(TagKind.HTML_BLOCK, range));
        } else if (node instanceof TableBlock) {
            var range = blockRange(node);
            events.add(new MarkdownEvent.Start(new Tag.Other(TagKind.TABLE), range));
            events.add(new MarkdownEvent.End(TagKind.TABLE, range));
        } else if (node instanceof ThematicBreak) {
            events.add(new MarkdownEvent.Rule(blockRange(node)));
        } else if (node instanceof Reference) {
            logger.trace("Skipping link reference definition at {}", node.getStartOffset());
        }
        // inline content
        else if (node instanceof com.vladsch.flexmark.ast.Text || node instanceof HtmlEntity) {
            text(node.getChars().unescape(), node);
        } else if (node instanceof Code code) {
            events.add(new MarkdownEvent.Code(codeSpanContent(code.getText().toString()), inlineRange(code)));
        } else if (node instanceof SoftLineBreak) {
            events.add(new MarkdownEvent.SoftBreak(inlineRange(node)));
        } else if (node instanceof HardLineBreak) {
            events.add(new MarkdownEvent.HardBreak(inlineRange(node)));
        } else if (node instanceof HtmlInline || node instanceof HtmlInlineComment) {
            events.add(new MarkdownEvent.InlineHtml(node.getChars().toString(), inlineRange(node)));
        } else if (node instanceof Emphasis) {
            inline(TagKind.EMPHASIS, node);
        } else if (node instanceof StrongEmphasis) {
            inline(TagKind.STRONG, node);
        } else if (node instanceof Strikethrough) {
            inline(TagKind.STRIKETHROUGH, node);
        } else if (node instanceof Link) {
            inline(TagKind.LINK, node);
        } else if (node instanceof Image) {
            inline(TagKind.IMAGE, node);
        } else if (node instanceof AutoLink autoLink) {
            autoLink(autoLink.getText().toString(), autoLink);
        } else if (node instanceof MailLink mailLink) {
            autoLink(mailLink.getText().toString(), mailLink);
        } else if (node instanceof RefNode ref) {
            reference(ref);
        } else if (node instanceof Block) {
            logger.debug("Skipping unsupported block {} at {}", node.getNodeName(), node.getStartOffset());
        } else {
            visitChildren(node);
        }
    }

    private void block(Tag tag, Node node) {
        var range = blockRange(node);
        events.add(new MarkdownEvent.Start(tag, range));
        visitChildren(node);
        events.add(new MarkdownEvent.End(tag.kind(), range));
    }

    private void inline(TagKind kind, Node node) {
        var range = inlineRange(node);
        events.add(new MarkdownEvent.Start(new Tag.Other(kind), range));
        visitChildren(node);
        events.add(new MarkdownEvent.End(kind, range));
    }

    private void autoLink(String text, Node node) {
        var range = inlineRange(node);
        events.add(new MarkdownEvent.Start(new Tag.Other(TagKind.LINK), range));
        text(text, node);
        events.add(new MarkdownEvent.End(TagKind.LINK, range));
    }

    /**
     * Reference links with a matching definition behave like links. Undefined ones, such as a
     * {@code [?]} checkbox lookalike, keep their brackets as literal text while the content
     * between them is emitted like any other inline content.
     */
    private void reference(RefNode ref) {
        if (ref.isDefined()) {
            inline(ref instanceof com.vladsch.flexmark.ast.ImageRef ? TagKind.IMAGE : TagKind.LINK, ref);
            return;
        }

        var opening = ref.getTextOpeningMarker();
        var closing = ref.getTextClosingMarker();
        if (opening.isNull() || closing.isNull()) {
            text(ref.getChars().unescape(), inlineRange(ref));
            return;
        }

        text(opening.toString(), offsets.range(opening.getStartOffset(), opening.getEndOffset()));
        if (ref.hasChildren()) {
            visitChildren(ref);
        } else {
            var content = ref.getText();
            if (!content.isNull()) {
                text(content.unescape(), offsets.range(content.getStartOffset(), content.getEndOffset()));
            }
        }
        // "]" for [text], "][label]" for a full reference
        var tail = source.substring(closing.getStartOffset(), ref.getEndOffset());
        text(tail, offsets.range(closing.getStartOffset(), ref.getEndOffset()));
    }

    private void paragraph(Paragraph paragraph) {
        // tight list items carry their inline content directly
        if (paragraph.getParent() instanceof ListItem item
                && item.getParent() instanceof ListBlock list
                && list.isTight()) {
            visitChildren(paragraph);
            return;
        }
        block(new Tag.Paragraph(), paragraph);
    }

    private void listItem(ListItem item) {
        var range = blockRange(item);
        events.add(new MarkdownEvent.Start(new Tag.Item(), range));
        if (item instanceof TaskListItem task) {
            int markerEnd = task.getFirstChild() != null ? task.getFirstChild().getStartOffset() : task.getEndOffset();
            var markerRange = offsets.range(task.getStartOffset(), Math.max(task.getStartOffset(), markerEnd));
            events.add(new MarkdownEvent.TaskListMarker(task.isItemDoneMarker(), markerRange));
        }
        visitChildren(item);
        events.add(new MarkdownEvent.End(TagKind.ITEM, range));
    }

    private void blockQuote(BlockQuote quote) {
        var callout = detectCallouts ? CalloutMarker.find(quote, source) : Optional.<CalloutMarker>empty();
        var range = blockRange(quote);
        var tag = new Tag.BlockQuote(callout.map(CalloutMarker::kind));
        events.add(new MarkdownEvent.Start(tag, range));

        if (callout.isPresent()) {
            var marker = callout.get();
            for (var child = quote.getFirstChild(); child != null; child = child.getNext()) {
                if (child == marker.paragraph()) {
                    calloutParagraph(marker);
                } else {
                    visit(child);
                }
            }
        } else {
            visitChildren(quote);
        }

        events.add(new MarkdownEvent.End(TagKind.BLOCK_QUOTE, range));
    }

    /**
     * Emits the first paragraph of a callout without its {@code [!KIND]} line. The paragraph
     * starts at its first remaining inline and vanishes if nothing remains.
     */
    private void calloutParagraph(CalloutMarker marker) {
        var paragraph = marker.paragraph();
        var first = paragraph.getFirstChild();
        while (first != null && first.getStartOffset() < marker.lineEnd()) {
            first = first.getNext();
        }
        if (first == null) {
            logger.debug("Callout {} has no body text", marker.kind());
            return;
        }

        var range = blockRange(first.getStartOffset(), paragraph.getEndOffset());
        events.add(new MarkdownEvent.Start(new Tag.Paragraph(), range));
        for (var child = first; child != null; child = child.getNext()) {
            visit(child);
        }
        events.add(new MarkdownEvent.End(TagKind.PARAGRAPH, range));
    }

    private void codeBlock(Block block, Optional<String> info) {
        var range = blockRange(block);
        events.add(new MarkdownEvent.Start(new Tag.CodeBlock(info), range));
        var content = codeContent(block);
        if (!content.isEmpty()) {
            var lines = block.getContentLines();
            var contentRange = offsets.range(lines.get(0).getStartOffset(), lines.get(lines.size() - 1).getEndOffset());
            events.add(new MarkdownEvent.Text(content, contentRange));
        }
        events.add(new MarkdownEvent.End(TagKind.CODE_BLOCK, range));
    }

    /**
     * Joins the content lines of a code block, each terminated by a single {@code \n}.
     */
    private static String codeContent(ContentNode block) {
        var content = new StringBuilder();
        for (var line : block.getContentLines()) {
            content.append(stripLineBreak(line.toString())).append('\n');
        }
        return content.toString();
    }

    private static String stripLineBreak(String line) {
        int end = line.length();
        while (end > 0 && isLineBreak(line.charAt(end - 1))) {
            end--;
        }
        return line.substring(0, end);
    }

    /**
     * Code span content as CommonMark defines it: line endings become spaces and a single
     * space is stripped from both ends when both are present and the span is not all spaces.
     */
    static String codeSpanContent(String raw) {
        var content = raw.replace("\r\n", " ").replace('\n', ' ');
        if (content.length() >= 2 && content.startsWith(" ") && content.endsWith(" ") && !content.isBlank()) {
            return content.substring(1, content.length() - 1);
        }
        return content;
    }

    /**
     * Appends a text event, merging it into the previous one when the two are adjacent in the
     * stream.
     */
    private void text(String content, Node node) {
        text(content, inlineRange(node));
    }

    private void text(String content, SourceRange range) {
        if (content.isEmpty()) {
            return;
        }
        if (!events.isEmpty() && events.get(events.size() - 1) instanceof MarkdownEvent.Text previous) {
            var merged = new SourceRange(previous.range().start(), Math.max(previous.range().end(), range.end()));
            events.set(events.size() - 1, new MarkdownEvent.Text(previous.text() + content, merged));
        } else {
            events.add(new MarkdownEvent.Text(content, range));
        }
    }

    private SourceRange inlineRange(Node node) {
        return offsets.range(node.getStartOffset(), node.getEndOffset());
    }

    private SourceRange blockRange(Node node) {
        return blockRange(node.getStartOffset(), node.getEndOffset());
    }

    /**
     * Block ranges run up to the last content character plus exactly one line terminator, no
     * matter how many trailing line breaks flexmark attributes to the block.
     */
    private SourceRange blockRange(int start, int end) {
        int contentEnd = end;
        while (contentEnd > start && isLineBreak(source.charAt(contentEnd - 1))) {
            contentEnd--;
        }
        if (contentEnd < source.length() && source.charAt(contentEnd) == '\r') {
            contentEnd++;
        }
        if (contentEnd < source.length() && source.charAt(contentEnd) == '\n') {
            contentEnd++;
        }
        return offsets.range(start, contentEnd);
    }

    private static boolean isLineBreak(char c) {
        return c == '\n' || c == '\r';
    }
}
