package io.github.flatfile.fixedwidth;

/**
 * Thrown when a field's width can neither be read from its declaration nor
 * inferred from the explicit start of the declaration that follows it.
 */
public class MissingFieldSpecificationException extends LayoutResolutionException
{
    /**
     * Creates a missing-specification failure.
     *
     * @param fieldIndex Index of the declaration left without a width.
     * @param fieldName  Name of the declaration, or null for a spacer.
     * @param reason     Why the width could not be determined.
     */
    public MissingFieldSpecificationException(int fieldIndex, String fieldName, String reason)
    {
        super(
            "Either position or width must be specified: " + describeField(fieldIndex, fieldName) + " " + reason,
            fieldIndex,
            fieldName);
    }
}
