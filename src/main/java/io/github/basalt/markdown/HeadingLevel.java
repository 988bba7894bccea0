package io.github.basalt.markdown;

public enum HeadingLevel {
    H1, H2, H3, H4, H5, H6;

    /**
     * The numeric level, 1 for {@link #H1} through 6 for {@link #H6}.
     */
    public int level() {
        return ordinal() + 1;
    }

    public static HeadingLevel of(int level) {
        if (level < 1 || level > 6) {
            throw new IllegalArgumentException("Heading level must be between 1 and 6, got " + level);
        }
        return values()[level - 1];
    }
}
