package io.github.basalt.markdown;

/**
 * A half-open interval {@code [start, end)} of UTF-8 byte offsets into the source text.
 */
public record SourceRange(int start, int end) {
    public SourceRange {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid source range " + start + ".." + end);
        }
    }

    public static SourceRange of(int start, int end) {
        return new SourceRange(start, end);
    }

    public int length() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    /**
     * Returns true if the byte offset lies inside this range. The end offset is exclusive.
     */
    public boolean contains(int offset) {
        return offset >= start && offset < end;
    }

    /**
     * Returns true if the other range lies fully inside this one.
     */
    public boolean encloses(SourceRange other) {
        return other.start >= start && other.end <= end;
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
