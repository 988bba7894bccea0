package io.github.basalt.markdown.flex;

import com.vladsch.flexmark.ast.BlockQuote;
import com.vladsch.flexmark.ast.Paragraph;
import io.github.basalt.markdown.BlockQuoteKind;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * The {@code [!KIND]} line opening a callout block quote.
 *
 * @param kind the callout kind named by the marker
 * @param paragraph the quote's first paragraph, whose first line is the marker
 * @param lineEnd char index just past the marker line and its line terminator
 */
record CalloutMarker(BlockQuoteKind kind, Paragraph paragraph, int lineEnd) {
    private static final Pattern MARKER =
            Pattern.compile("^\\[!(NOTE|TIP|IMPORTANT|WARNING|CAUTION)\\]\\s*$", Pattern.CASE_INSENSITIVE);

    static Optional<CalloutMarker> find(BlockQuote quote, String source) {
        if (!(quote.getFirstChild() instanceof Paragraph paragraph)) {
            return Optional.empty();
        }

        int start = paragraph.getStartOffset();
        int newline = source.indexOf('\n', start);
        int lineEnd = newline < 0 ? source.length() : newline + 1;
        int contentEnd = Math.min(lineEnd, paragraph.getEndOffset());
        var firstLine = source.substring(start, Math.max(start, contentEnd));

        var matcher = MARKER.matcher(firstLine.strip());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        var kind = BlockQuoteKind.valueOf(matcher.group(1).toUpperCase(Locale.ROOT));
        return Optional.of(new CalloutMarker(kind, paragraph, lineEnd));
    }
}
