package io.github.basalt.markdown;

public enum TaskListItemKind {
    /** Marked as done with {@code - [x]}. */
    CHECKED,
    /** Open task written as {@code - [ ]}. */
    UNCHECKED
}
