package io.github.flatfile.fixedwidth;

/**
 * A field declaration under construction, possibly only partly specified.
 *
 * <p>Obtained from {@link LayoutBuilder#field(String)} or
 * {@link LayoutBuilder#spacer(int, int)} and handed back to the layout with
 * {@link #append()} or {@link #insert(int)}. Its start and width are resolved
 * against neighboring declarations when the layout is built.
 */
public class FieldBuilder
{
    /** The layout this declaration will join. */
    private final LayoutBuilder layoutBuilder;
    /** Record key of the field; null for a spacer. */
    final String name;
    /** Explicit start position, or null to start where the previous field ends. */
    Integer start;
    /** Explicit width, or null to infer it from the next declaration's start. */
    Integer width;
    /** Side of the field the value is aligned to. */
    Alignment alignment;
    /** Code point filling the unused part of the field. */
    int padding;
    /** Whether the declaration was already handed to the layout. */
    private boolean isAdded = false;

    /**
     * Creates a declaration with no position or width yet.
     *
     * @param layoutBuilder See {@link #layoutBuilder}.
     * @param name          See {@link #name}.
     * @param alignment     See {@link #alignment}.
     * @param padding       See {@link #padding}.
     */
    FieldBuilder(LayoutBuilder layoutBuilder, String name, Alignment alignment, int padding)
    {
        this.layoutBuilder = layoutBuilder;
        this.name = name;
        this.alignment = alignment;
        this.padding = padding;
    }

    /**
     * Sets the number of code points the field occupies.
     *
     * @param width The field width; must be positive.
     * @return This declaration.
     */
    public FieldBuilder width(int width)
    {
        final int MINIMUM_FIELD_WIDTH = 1;
        boolean widthIsTooSmall = (width < MINIMUM_FIELD_WIDTH);
        if (widthIsTooSmall)
        {
            throw new IllegalArgumentException("Field width must be at least " + MINIMUM_FIELD_WIDTH + ", got " + width);
        }
        this.width = width;
        return this;
    }

    /**
     * Sets the code point offset the field starts at.
     *
     * @param start The start position; must not be negative.
     * @return This declaration.
     */
    public FieldBuilder position(int start)
    {
        boolean startIsNegative = (start < 0);
        if (startIsNegative)
        {
            throw new IllegalArgumentException("Field position must not be negative, got " + start);
        }
        this.start = start;
        return this;
    }

    /**
     * Sets both the start and the width from the code point range {@code [start, end)}.
     *
     * @param start The start position.
     * @param end   The position just past the field; must be greater than {@code start}.
     * @return This declaration.
     */
    public FieldBuilder range(int start, int end)
    {
        boolean rangeIsEmpty = (end <= start);
        if (rangeIsEmpty)
        {
            throw new IllegalArgumentException("Field range " + start + ".." + end + " is empty");
        }
        position(start);
        width(end - start);
        return this;
    }

    /**
     * Sets the alignment of the field.
     *
     * @param alignment The alignment.
     * @return This declaration.
     */
    public FieldBuilder alignment(Alignment alignment)
    {
        if (alignment == null)
        {
            throw new IllegalArgumentException("Field alignment must not be null");
        }
        this.alignment = alignment;
        return this;
    }

    /**
     * Sets the alignment of the field from free text.
     *
     * <p>An unrecognized value does not fail the declaration: a warning is
     * written to standard error and the alignment the field already had is kept.
     *
     * @param alignmentText "left" or "right", in any case.
     * @return This declaration.
     */
    public FieldBuilder alignment(String alignmentText)
    {
        try
        {
            this.alignment = Alignment.parse(alignmentText);
        }
        catch (IllegalArgumentException exception)
        {
            // PROVIDE VISIBILITY INTO THE IGNORED OVERRIDE.
            System.err.println(
                "Unable to parse argument as alignment for " + describe() + ": " +
                exception.getMessage() + "; keeping " + alignment);
        }
        return this;
    }

    /**
     * Sets the padding of the field.
     *
     * <p>The padding is one Unicode scalar value. A {@code char} such as
     * {@code '0'} widens to its code point; characters outside the Basic
     * Multilingual Plane are passed as code points, for example
     * {@code "\u2605".codePointAt(0)}.
     *
     * @param padding The padding code point; must not be a surrogate.
     * @return This declaration.
     * @throws IllegalArgumentException If {@code padding} is not a Unicode scalar value.
     */
    public FieldBuilder padding(int padding)
    {
        this.padding = LayoutBuilder.requireScalarValue(padding);
        return this;
    }

    /**
     * Adds this declaration after all declarations already in the layout.
     *
     * @return The layout builder, to continue declaring fields.
     */
    public LayoutBuilder append()
    {
        markAdded();
        layoutBuilder.append(this);
        return layoutBuilder;
    }

    /**
     * Adds this declaration at the given index of the layout, ahead of the
     * declaration currently there.
     *
     * @param index The index the declaration will have.
     * @return The layout builder, to continue declaring fields.
     * @throws IndexOutOfBoundsException If the index is negative or past the end.
     */
    public LayoutBuilder insert(int index)
    {
        // CHECK THE INDEX BEFORE MARKING THE DECLARATION AS ADDED.
        int declaredFieldCount = layoutBuilder.getDeclaredFieldCount();
        boolean indexIsOutOfRange = (index < 0 || index > declaredFieldCount);
        if (indexIsOutOfRange)
        {
            throw new IndexOutOfBoundsException("Cannot insert at " + index + " into " + declaredFieldCount + " declarations");
        }
        markAdded();
        layoutBuilder.insert(index, this);
        return layoutBuilder;
    }

    /**
     * Records that the declaration joined the layout, so it cannot join twice.
     */
    private void markAdded()
    {
        if (isAdded)
        {
            throw new IllegalStateException(describe() + " was already added to the layout");
        }
        isAdded = true;
    }

    /**
     * @return A short description of the declaration for messages.
     */
    private String describe()
    {
        boolean isSpacer = (name == null);
        String description = isSpacer ? "spacer" : "field '" + name + "'";
        return description;
    }
}
