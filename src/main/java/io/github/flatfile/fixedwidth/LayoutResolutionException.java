package io.github.flatfile.fixedwidth;

/**
 * Thrown when a sequence of field declarations cannot be resolved into a layout.
 *
 * <p>Resolution stops at the first offending declaration and no layout is
 * produced, since a malformed layout cannot safely parse or format any record.
 *
 * @see LayoutOrderingException
 * @see MissingFieldSpecificationException
 */
public abstract class LayoutResolutionException extends RuntimeException
{
    /** Index of the declaration that failed to resolve. */
    private final int fieldIndex;
    /** Name of the declaration that failed to resolve; null for a spacer. */
    private final String fieldName;

    /**
     * Creates a resolution failure for one declaration.
     *
     * @param message    Description of the failure.
     * @param fieldIndex See {@link #fieldIndex}.
     * @param fieldName  See {@link #fieldName}.
     */
    protected LayoutResolutionException(String message, int fieldIndex, String fieldName)
    {
        super(message);
        this.fieldIndex = fieldIndex;
        this.fieldName = fieldName;
    }

    /**
     * @return The index of the declaration that failed to resolve.
     */
    public int getFieldIndex()
    {
        return fieldIndex;
    }

    /**
     * @return The name of the declaration that failed to resolve, or null for a spacer.
     */
    public String getFieldName()
    {
        return fieldName;
    }

    /**
     * Describes a declaration for use in failure messages.
     *
     * @param fieldIndex The declaration index.
     * @param fieldName  The declaration name, or null for a spacer.
     * @return A short description such as {@code field 2 ('amount')}.
     */
    static String describeField(int fieldIndex, String fieldName)
    {
        boolean isSpacer = (fieldName == null);
        String fieldDescription = isSpacer ?
            "spacer " + fieldIndex :
            "field " + fieldIndex + " ('" + fieldName + "')";
        return fieldDescription;
    }
}
