package io.github.basalt.markdown;

/**
 * Whether a list is ordered (with its declared start number) or unordered.
 */
public sealed interface ListKind {

    static ListKind ordered(long start) {
        return new Ordered(start);
    }

    static ListKind unordered() {
        return new Unordered();
    }

    /**
     * An ordered list such as {@code 1. item}. Only the first number in the source matters;
     * following items are numbered by position.
     */
    record Ordered(long start) implements ListKind {
        /**
         * The number displayed for the item at the given zero-based position among its siblings.
         */
        public long numberAt(int position) {
            if (position < 0) {
                throw new IllegalArgumentException("Position must not be negative: " + position);
            }
            return start + position;
        }
    }

    /** A bullet list such as {@code - item}. */
    record Unordered() implements ListKind {}
}
