package io.github.basalt.markdown;

import java.util.Objects;

/**
 * Translates between char indices of a Java string and UTF-8 byte offsets of the same text.
 * <p>
 * {@link SourceRange}s are expressed in bytes; editors working on the {@code String} use this to
 * slice the text a node was parsed from.
 */
public final class SourceOffsets {
    private final String text;
    // byteOffsets[i] is the UTF-8 offset of char index i; the last slot holds the total length
    private final int[] byteOffsets;

    private SourceOffsets(String text) {
        this.text = text;
        this.byteOffsets = new int[text.length() + 1];
        int bytes = 0;
        for (int i = 0; i < text.length(); i++) {
            byteOffsets[i] = bytes;
            bytes += utf8Length(text.charAt(i));
        }
        byteOffsets[text.length()] = bytes;
    }

    public static SourceOffsets of(String text) {
        return new SourceOffsets(Objects.requireNonNull(text, "text"));
    }

    private static int utf8Length(char c) {
        if (c < 0x80) {
            return 1;
        }
        if (c < 0x800) {
            return 2;
        }
        // each half of a surrogate pair accounts for half of the 4-byte encoding
        if (Character.isSurrogate(c)) {
            return 2;
        }
        return 3;
    }

    public String text() {
        return text;
    }

    /**
     * Total UTF-8 length of the text.
     */
    public int byteLength() {
        return byteOffsets[text.length()];
    }

    public int byteOffset(int charIndex) {
        Objects.checkIndex(charIndex, byteOffsets.length);
        return byteOffsets[charIndex];
    }

    /**
     * Returns the char index of the character containing the given byte offset. Offsets pointing
     * into the middle of a multi-byte character resolve to that character's start.
     */
    public int charIndex(int byteOffset) {
        if (byteOffset < 0 || byteOffset > byteLength()) {
            throw new IndexOutOfBoundsException("Byte offset " + byteOffset + " outside 0.." + byteLength());
        }
        int low = 0;
        int high = text.length();
        while (low < high) {
            int mid = (low + high + 1) >>> 1;
            if (byteOffsets[mid] <= byteOffset) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }
        if (low > 0 && low < text.length()
                && Character.isLowSurrogate(text.charAt(low)) && Character.isHighSurrogate(text.charAt(low - 1))) {
            return low - 1;
        }
        return low;
    }

    /**
     * Builds a byte range from a half-open char index range.
     */
    public SourceRange range(int startChar, int endChar) {
        return new SourceRange(byteOffset(startChar), byteOffset(endChar));
    }

    /**
     * Returns the part of the text covered by the given byte range.
     */
    public String slice(SourceRange range) {
        return text.substring(charIndex(range.start()), charIndex(range.end()));
    }
}
