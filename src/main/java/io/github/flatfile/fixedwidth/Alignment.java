package io.github.flatfile.fixedwidth;

import java.util.Locale;

/**
 * Which side of a fixed-width field its value is aligned to.
 *
 * <p>The opposite side absorbs the padding: a LEFT-aligned value is followed by
 * padding characters, a RIGHT-aligned value is preceded by them.
 */
public enum Alignment
{
    /** Value starts at the first position of the field; padding fills the end. */
    LEFT,
    /** Value ends at the last position of the field; padding fills the beginning. */
    RIGHT;

    /**
     * Parses an alignment from free text.
     *
     * <p>Matching is case-insensitive and ignores surrounding whitespace, so
     * {@code " Right "} and {@code "RIGHT"} both produce {@link #RIGHT}.
     *
     * @param alignmentText The text to parse ("left" or "right").
     * @return The matching alignment.
     * @throws IllegalArgumentException If the text names no alignment.
     */
    public static Alignment parse(String alignmentText)
    {
        // ENSURE THERE IS TEXT TO PARSE.
        if (alignmentText == null)
        {
            throw new IllegalArgumentException("Unknown alignment: null");
        }

        // MATCH THE NORMALIZED TEXT AGAINST THE KNOWN ALIGNMENTS.
        String normalizedAlignmentText = alignmentText.trim().toLowerCase(Locale.ROOT);
        switch (normalizedAlignmentText)
        {
            case "left":
                return LEFT;
            case "right":
                return RIGHT;
            default:
                throw new IllegalArgumentException("Unknown alignment: '" + alignmentText + "'");
        }
    }
}
