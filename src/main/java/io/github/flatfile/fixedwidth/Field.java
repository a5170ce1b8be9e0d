package io.github.flatfile.fixedwidth;

import java.util.Objects;

/**
 * One fully resolved, fixed-width slot in a record layout.
 *
 * <p>A field occupies the code point positions {@code [start, start + width)}
 * of every record. A field without a name is a spacer: its positions are
 * skipped when parsing and filled with padding when formatting.
 *
 * <p>Fields are immutable and are only produced by {@link LayoutBuilder#build()}.
 */
public final class Field
{
    /** Ordinal position of the field within its layout (0-based). */
    public final int index;
    /**
     * Record key of the field.
     * Null for spacers, which never appear in parsed records.
     */
    public final String name;
    /** Offset of the first code point of the field within a record. */
    public final int start;
    /** Number of code points the field occupies. Always positive. */
    public final int width;
    /** Side of the field the value is aligned to. */
    public final Alignment alignment;
    /** Code point filling the part of the field the value does not use. */
    public final int padding;

    /**
     * Creates a resolved field.
     *
     * @param index     See {@link #index}.
     * @param name      See {@link #name}.
     * @param start     See {@link #start}.
     * @param width     See {@link #width}.
     * @param alignment See {@link #alignment}.
     * @param padding   See {@link #padding}.
     */
    public Field(int index, String name, int start, int width, Alignment alignment, int padding)
    {
        this.index = index;
        this.name = name;
        this.start = start;
        this.width = width;
        this.alignment = alignment;
        this.padding = padding;
    }

    /**
     * Returns the offset just past the last code point of the field.
     *
     * @return {@code start + width}.
     */
    public int end()
    {
        int end = start + width;
        return end;
    }

    /**
     * Tests if this field is an anonymous spacer.
     *
     * @return True if the field has no name.
     */
    public boolean isSpacer()
    {
        boolean isSpacer = (name == null);
        return isSpacer;
    }

    @Override
    public boolean equals(Object other)
    {
        if (this == other)
        {
            return true;
        }
        if (!(other instanceof Field))
        {
            return false;
        }
        Field otherField = (Field) other;
        boolean fieldsAreEqual =
            (index == otherField.index) &&
            Objects.equals(name, otherField.name) &&
            (start == otherField.start) &&
            (width == otherField.width) &&
            (alignment == otherField.alignment) &&
            (padding == otherField.padding);
        return fieldsAreEqual;
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(index, name, start, width, alignment, padding);
    }

    @Override
    public String toString()
    {
        String displayName = isSpacer() ? "<spacer>" : name;
        return "Field#" + index + " " + displayName + " [" + start + ".." + end() + ") " + alignment + " '" + Character.toString(padding) + "'";
    }
}
