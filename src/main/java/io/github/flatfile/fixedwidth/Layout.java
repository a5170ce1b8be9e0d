package io.github.flatfile.fixedwidth;

import io.github.flatfile.common.FixedWidthText;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Spliterator;

/**
 * A resolved, immutable fixed-width record layout.
 *
 * <p>A layout converts between one line of fixed-width text and a record, a map
 * from field name to the field's text value:
 * <ul>
 *   <li>{@link #parse(String)} extracts every named field from a line, removing
 *       each field's padding.</li>
 *   <li>{@link #format(Map)} renders a record back into a line of exactly
 *       {@link #getTotalWidth()} code points, padding or truncating each value.</li>
 * </ul>
 *
 * <p>Layouts are built with {@link LayoutBuilder}. Since a layout never changes
 * after it is built and every call works only on call-local state, one layout
 * may be shared freely, including across threads.
 */
public final class Layout
{
    /** Fields in index order, which is also left-to-right position order. */
    private final List<Field> fields;
    /** Number of code points a line must hold: the end of the last field. */
    private final int totalWidth;
    /** Code point written at positions no field covers (gaps between explicit starts). */
    private final int gapFill;

    /**
     * Creates a layout from already resolved fields.
     * Only {@link LayoutBuilder} resolves fields, so this is package-private.
     *
     * @param fields     See {@link #fields}.
     * @param totalWidth See {@link #totalWidth}.
     * @param gapFill    See {@link #gapFill}.
     */
    Layout(List<Field> fields, int totalWidth, int gapFill)
    {
        this.fields = Collections.unmodifiableList(fields);
        this.totalWidth = totalWidth;
        this.gapFill = gapFill;
    }

    /**
     * @return The resolved fields in position order, as an unmodifiable list.
     */
    public List<Field> getFields()
    {
        return fields;
    }

    /**
     * @return The number of code points in a formatted record.
     */
    public int getTotalWidth()
    {
        return totalWidth;
    }

    /**
     * @return The code point filling positions that no field covers.
     */
    public int getGapFill()
    {
        return gapFill;
    }

    /**
     * Parses one line into a record.
     *
     * <p>Each named field's code points are extracted and stripped of padding
     * according to the field's alignment. Spacers are skipped. If two fields
     * share a name, the first one's value is kept. Anything after
     * {@link #getTotalWidth()} code points is ignored.
     *
     * @param line The line to parse, without its line terminator.
     * @return A new record holding the value of every named field, in field order.
     * @throws InsufficientBufferException If the line holds fewer code points than the layout's total width.
     */
    public Map<String, String> parse(String line) throws InsufficientBufferException
    {
        // ENSURE THE LINE IS LONG ENOUGH TO HOLD EVERY FIELD.
        int lineLengthInCodePoints = FixedWidthText.codePointLength(line);
        boolean lineIsTooShort = (lineLengthInCodePoints < totalWidth);
        if (lineIsTooShort)
        {
            throw new InsufficientBufferException(totalWidth, lineLengthInCodePoints);
        }

        // EXTRACT EACH FIELD FROM ITS CODE POINT RANGE.
        // Field offsets are code point offsets, so they are translated into char
        // indexes while walking the line from left to right.
        Map<String, String> record = new LinkedHashMap<>();
        int codePointPosition = 0;
        int charIndex = 0;
        for (Field field : fields)
        {
            // ADVANCE TO THE START OF THE FIELD.
            int codePointsToFieldStart = field.start - codePointPosition;
            int fieldStartCharIndex = line.offsetByCodePoints(charIndex, codePointsToFieldStart);
            int fieldEndCharIndex = line.offsetByCodePoints(fieldStartCharIndex, field.width);
            codePointPosition = field.end();
            charIndex = fieldEndCharIndex;

            // SKIP SPACERS, WHICH NEVER PRODUCE A RECORD ENTRY.
            if (field.isSpacer())
            {
                continue;
            }

            // STORE THE VALUE UNLESS AN EARLIER FIELD ALREADY USED THE NAME.
            String fieldSlot = line.substring(fieldStartCharIndex, fieldEndCharIndex);
            String fieldValue = FixedWidthText.stripPadding(fieldSlot, field.alignment, field.padding);
            record.putIfAbsent(field.name, fieldValue);
        }
        return record;
    }

    /**
     * Parses a record from a source of code points.
     *
     * <p>The source's exact size must be known before anything is read from it;
     * a source of unknown size is rejected rather than read speculatively.
     * Only the first {@link #getTotalWidth()} code points are consumed.
     *
     * @param codePoints The code points of one line.
     * @return A new record holding the value of every named field, in field order.
     * @throws InsufficientBufferException If the source's size is unknown or smaller than the layout's total width.
     */
    public Map<String, String> parse(Spliterator.OfInt codePoints) throws InsufficientBufferException
    {
        // ENSURE THE SOURCE IS KNOWN TO BE LONG ENOUGH BEFORE READING IT.
        final long UNKNOWN_SIZE = -1;
        long availableCodePointCount = codePoints.getExactSizeIfKnown();
        boolean sizeIsUnknown = (availableCodePointCount == UNKNOWN_SIZE);
        if (sizeIsUnknown)
        {
            final Integer UNKNOWN_AVAILABLE_LENGTH = null;
            throw new InsufficientBufferException(totalWidth, UNKNOWN_AVAILABLE_LENGTH);
        }
        boolean sourceIsTooShort = (availableCodePointCount < totalWidth);
        if (sourceIsTooShort)
        {
            throw new InsufficientBufferException(totalWidth, (int) availableCodePointCount);
        }

        // COLLECT EXACTLY THE CODE POINTS THE LAYOUT COVERS.
        StringBuilder line = new StringBuilder();
        for (int codePointIndex = 0; codePointIndex < totalWidth; ++codePointIndex)
        {
            codePoints.tryAdvance((int codePoint) -> line.appendCodePoint(codePoint));
        }

        // PARSE THE COLLECTED LINE.
        Map<String, String> record = parse(line.toString());
        return record;
    }

    /**
     * Formats a record into one line.
     *
     * <p>Each field's value is padded or truncated to the field's width. Fields
     * whose name is missing from the record, and spacers, are written as
     * padding only. Positions between fields are written with the gap fill
     * character.
     *
     * @param record The record to format; it is only read.
     * @return A line of exactly {@link #getTotalWidth()} code points, without a line terminator.
     */
    public String format(Map<String, String> record)
    {
        StringBuilder line = new StringBuilder(totalWidth);
        int codePointPosition = 0;
        for (Field field : fields)
        {
            // FILL ANY GAP LEFT BEFORE THE FIELD BY AN EXPLICIT START POSITION.
            int gapWidth = field.start - codePointPosition;
            for (int gapIndex = 0; gapIndex < gapWidth; ++gapIndex)
            {
                line.appendCodePoint(gapFill);
            }

            // LOOK UP THE VALUE TO RENDER.
            // Missing values render as an empty value, which pads to the full width.
            final String EMPTY_VALUE = "";
            String fieldValue = EMPTY_VALUE;
            if (!field.isSpacer())
            {
                String recordValue = record.get(field.name);
                boolean recordHasValue = (recordValue != null);
                if (recordHasValue)
                {
                    fieldValue = recordValue;
                }
            }

            // RENDER THE VALUE INTO ITS FIXED-WIDTH SLOT.
            String fieldSlot = FixedWidthText.fixedWidth(fieldValue, field.width, field.alignment, field.padding);
            line.append(fieldSlot);
            codePointPosition = field.end();
        }
        return line.toString();
    }

    @Override
    public String toString()
    {
        return "Layout" + fields + " width " + totalWidth;
    }
}
