package io.github.basalt.markdown.flex;

import com.vladsch.flexmark.ext.gfm.strikethrough.StrikethroughExtension;
import com.vladsch.flexmark.ext.gfm.tasklist.TaskListExtension;
import com.vladsch.flexmark.ext.tables.TablesExtension;
import com.vladsch.flexmark.parser.Parser;
import com.vladsch.flexmark.util.data.DataHolder;
import com.vladsch.flexmark.util.data.DataKey;
import com.vladsch.flexmark.util.data.MutableDataSet;
import io.github.basalt.markdown.SourceOffsets;
import io.github.basalt.markdown.event.EventSource;
import io.github.basalt.markdown.event.MarkdownEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;

/**
 * {@link EventSource} backed by the flexmark parser.
 * <p>
 * Flexmark builds its own AST, which {@link FlexmarkEventEmitter} walks depth-first to produce
 * the open/close/text event stream. The flexmark {@link Parser} is immutable once built, so one
 * instance serves concurrent callers.
 */
public class FlexmarkEventSource implements EventSource {
    private static final Logger logger = LogManager.getLogger(FlexmarkEventSource.class);

    /**
     * Whether {@code > [!NOTE]} style first lines turn a block quote into a callout.
     */
    public static final DataKey<Boolean> DETECT_CALLOUTS = new DataKey<>("DETECT_CALLOUTS", true);

    private final Parser parser;
    private final boolean detectCallouts;

    public FlexmarkEventSource() {
        this(defaultOptions());
    }

    /**
     * Creates an event source with caller supplied flexmark options. The options should enable
     * the task list extension, otherwise no task markers are ever reported.
     */
    public FlexmarkEventSource(DataHolder options) {
        Objects.requireNonNull(options, "options");
        this.parser = Parser.builder(options).build();
        this.detectCallouts = DETECT_CALLOUTS.get(options);
        logger.debug("Initialized flexmark event source (callouts {})", detectCallouts ? "on" : "off");
    }

    /**
     * The options used by the no-arg constructor: GFM task lists, strikethrough and tables.
     */
    public static MutableDataSet defaultOptions() {
        return new MutableDataSet()
                .set(Parser.EXTENSIONS, List.of(
                        TaskListExtension.create(),
                        StrikethroughExtension.create(),
                        TablesExtension.create()
                ))
                .set(DETECT_CALLOUTS, true);
    }

    @Override
    public List<MarkdownEvent> events(String text) {
        Objects.requireNonNull(text, "text");
        var document = parser.parse(text);
        var emitter = new FlexmarkEventEmitter(SourceOffsets.of(text), detectCallouts);
        var events = emitter.emit(document);
        logger.trace("Emitted {} events for {} chars", events.size(), text.length());
        return events;
    }
}
