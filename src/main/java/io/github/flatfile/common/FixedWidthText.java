package io.github.flatfile.common;

import io.github.flatfile.fixedwidth.Alignment;

/**
 * String primitives for placing a value into, and recovering a value from, a
 * fixed-width slot of a flat-file record.
 *
 * <p>All lengths and widths are counted in Unicode code points, not in Java
 * {@code char}s. A field declared as 10 characters wide holds 10 code points
 * regardless of whether any of them lies outside the Basic Multilingual Plane,
 * and no operation here ever splits a surrogate pair.
 *
 * <p>Padding is a single code point, passed as an {@code int}, so it may also
 * lie outside the Basic Multilingual Plane. A {@code char} argument widens to
 * its code point.
 *
 * <p>When an operation does not need to change its input, the input instance
 * itself is returned without copying.
 */
public final class FixedWidthText
{
    /**
     * Counts the code points in a string.
     *
     * @param text The text to measure.
     * @return The number of Unicode code points in {@code text}.
     */
    public static int codePointLength(String text)
    {
        // COUNT THE CODE POINTS ACROSS THE ENTIRE STRING.
        final int BEGINNING_OF_TEXT_INDEX = 0;
        int codePointCount = text.codePointCount(BEGINNING_OF_TEXT_INDEX, text.length());
        return codePointCount;
    }

    /**
     * Truncates text to at most the given number of code points.
     *
     * @param text  The text to truncate.
     * @param width The maximum width in code points.
     * @return The first {@code width} code points of {@code text}, or {@code text}
     *         itself if it is not longer than {@code width}.
     */
    public static String truncate(String text, int width)
    {
        int textLengthInCodePoints = codePointLength(text);
        String truncatedText = truncate(text, width, textLengthInCodePoints);
        return truncatedText;
    }

    /**
     * Pads text to the given number of code points.
     *
     * <p>LEFT-aligned text has padding appended after it; RIGHT-aligned text has
     * padding prepended before it. Text that is already at least {@code width}
     * code points long is returned unchanged.
     *
     * @param text      The text to pad.
     * @param width     The target width in code points.
     * @param alignment Which side of the slot the text is aligned to.
     * @param padding   The code point used to fill the unused part of the slot.
     * @return {@code text} padded to {@code width} code points, or {@code text} itself.
     */
    public static String pad(String text, int width, Alignment alignment, int padding)
    {
        int textLengthInCodePoints = codePointLength(text);
        String paddedText = pad(text, width, alignment, padding, textLengthInCodePoints);
        return paddedText;
    }

    /**
     * Pads or truncates text to exactly the given number of code points.
     * This is the single entry point used when rendering a field into a record.
     *
     * @param text      The text to fit into the slot.
     * @param width     The slot width in code points.
     * @param alignment Which side of the slot the text is aligned to.
     * @param padding   The code point used to fill the unused part of the slot.
     * @return A string of exactly {@code width} code points.
     */
    public static String fixedWidth(String text, int width, Alignment alignment, int padding)
    {
        // CHECK IF THE TEXT IS ALREADY OF THE APPROPRIATE LENGTH.
        int textLengthInCodePoints = codePointLength(text);
        boolean textIsExactSize = (textLengthInCodePoints == width);
        if (textIsExactSize)
        {
            // RETURN THE TEXT AS-IS.
            return text;
        }

        // CHECK IF THE TEXT IS TOO LONG.
        boolean textIsTooLong = (textLengthInCodePoints > width);
        if (textIsTooLong)
        {
            // RETURN THE TEXT TRUNCATED TO THE SLOT WIDTH.
            String truncatedText = truncate(text, width, textLengthInCodePoints);
            return truncatedText;
        }

        // PAD THE TEXT UNTIL IT FILLS THE SLOT.
        String paddedText = pad(text, width, alignment, padding, textLengthInCodePoints);
        return paddedText;
    }

    /**
     * Removes the padding that {@link #pad} would have added.
     *
     * <p>For LEFT alignment the maximal trailing run of {@code padding} is removed;
     * for RIGHT alignment the maximal leading run is removed. A value that
     * genuinely ends (or begins) with the padding character cannot be told apart
     * from padding, so that part of the value is lost as well.
     *
     * @param text      The content of a fixed-width slot.
     * @param alignment The alignment the slot was written with.
     * @param padding   The padding code point the slot was written with.
     * @return The slot content without its padding.
     */
    public static String stripPadding(String text, Alignment alignment, int padding)
    {
        boolean isLeftAligned = (alignment == Alignment.LEFT);
        if (isLeftAligned)
        {
            // SCAN BACKWARDS OVER THE TRAILING PADDING.
            // Whole code points are compared, so half of a surrogate pair is never
            // mistaken for padding.
            int paddingLengthInCharacters = Character.charCount(padding);
            int valueEndIndex = text.length();
            while (valueEndIndex > 0 && text.codePointBefore(valueEndIndex) == padding)
            {
                valueEndIndex -= paddingLengthInCharacters;
            }

            // RETURN THE VALUE WITHOUT THE TRAILING PADDING.
            boolean hasTrailingPadding = (valueEndIndex < text.length());
            if (!hasTrailingPadding)
            {
                return text;
            }
            final int BEGINNING_OF_TEXT_INDEX = 0;
            String strippedText = text.substring(BEGINNING_OF_TEXT_INDEX, valueEndIndex);
            return strippedText;
        }
        else
        {
            // SCAN FORWARDS OVER THE LEADING PADDING.
            int paddingLengthInCharacters = Character.charCount(padding);
            int valueStartIndex = 0;
            while (valueStartIndex < text.length() && text.codePointAt(valueStartIndex) == padding)
            {
                valueStartIndex += paddingLengthInCharacters;
            }

            // RETURN THE VALUE WITHOUT THE LEADING PADDING.
            boolean hasLeadingPadding = (valueStartIndex > 0);
            if (!hasLeadingPadding)
            {
                return text;
            }
            String strippedText = text.substring(valueStartIndex);
            return strippedText;
        }
    }

    /**
     * Truncates text whose code point length has already been measured.
     *
     * @param text                   The text to truncate.
     * @param width                  The maximum width in code points.
     * @param textLengthInCodePoints The code point length of {@code text}.
     * @return The truncated text, or {@code text} itself.
     */
    private static String truncate(String text, int width, int textLengthInCodePoints)
    {
        boolean textIsTooLong = (textLengthInCodePoints > width);
        if (!textIsTooLong)
        {
            return text;
        }

        // CUT THE TEXT AT THE CHAR INDEX OF THE WIDTH-TH CODE POINT.
        final int BEGINNING_OF_TEXT_INDEX = 0;
        int truncationCharIndex = text.offsetByCodePoints(BEGINNING_OF_TEXT_INDEX, width);
        String truncatedText = text.substring(BEGINNING_OF_TEXT_INDEX, truncationCharIndex);
        return truncatedText;
    }

    /**
     * Pads text whose code point length has already been measured.
     *
     * @param text                   The text to pad.
     * @param width                  The target width in code points.
     * @param alignment              Which side of the slot the text is aligned to.
     * @param padding                The padding code point.
     * @param textLengthInCodePoints The code point length of {@code text}.
     * @return The padded text, or {@code text} itself.
     */
    private static String pad(String text, int width, Alignment alignment, int padding, int textLengthInCodePoints)
    {
        boolean textIsTooShort = (textLengthInCodePoints < width);
        if (!textIsTooShort)
        {
            return text;
        }

        // BUILD THE PADDING FOR THE UNUSED PART OF THE SLOT.
        int paddingLengthInCodePoints = width - textLengthInCodePoints;
        String paddingText = Character.toString(padding).repeat(paddingLengthInCodePoints);

        // PLACE THE PADDING ON THE SIDE AWAY FROM THE ALIGNMENT.
        // LEFT-aligned values are followed by padding, RIGHT-aligned values preceded by it.
        StringBuilder paddedText = new StringBuilder(text.length() + paddingText.length());
        boolean isLeftAligned = (alignment == Alignment.LEFT);
        if (isLeftAligned)
        {
            paddedText.append(text).append(paddingText);
        }
        else
        {
            paddedText.append(paddingText).append(text);
        }
        return paddedText.toString();
    }

    private FixedWidthText()
    {
    }
}
