package io.github.flatfile.fixedwidth;

/**
 * Thrown when a field would end past the largest position a record can have.
 *
 * <p>Positions are {@code int} code point offsets, so no field may end after
 * {@link Integer#MAX_VALUE}.
 */
public class LayoutWidthOverflowException extends LayoutResolutionException
{
    /** Position the field starts at. */
    private final int fieldStart;
    /** Declared width of the field. */
    private final int fieldWidth;

    /**
     * Creates the exception.
     *
     * @param fieldIndex Index of the offending declaration.
     * @param fieldName  Name of the offending declaration, or null for a spacer.
     * @param fieldStart See {@link #fieldStart}.
     * @param fieldWidth See {@link #fieldWidth}.
     */
    public LayoutWidthOverflowException(int fieldIndex, String fieldName, int fieldStart, int fieldWidth)
    {
        super(
            "Field extends past the maximum record width: " + describeField(fieldIndex, fieldName) +
                " starts at " + fieldStart + " and is " + fieldWidth + " wide",
            fieldIndex,
            fieldName);
        this.fieldStart = fieldStart;
        this.fieldWidth = fieldWidth;
    }

    /**
     * @return The position the field starts at.
     */
    public int getFieldStart()
    {
        return fieldStart;
    }

    /**
     * @return The declared width of the field.
     */
    public int getFieldWidth()
    {
        return fieldWidth;
    }
}
