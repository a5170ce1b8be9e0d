package io.github.flatfile.fixedwidth;

/**
 * Thrown when a field declaration's explicit start position lies before the
 * end of the fields already resolved, which would make fields overlap or run
 * backwards.
 */
public class LayoutOrderingException extends LayoutResolutionException
{
    /** The explicit start position that was declared. */
    private final int declaredStart;
    /** The earliest position the declaration could have started at. */
    private final int earliestAllowedStart;

    /**
     * Creates an ordering failure.
     *
     * @param fieldIndex           Index of the offending declaration.
     * @param fieldName            Name of the offending declaration, or null for a spacer.
     * @param declaredStart        See {@link #declaredStart}.
     * @param earliestAllowedStart See {@link #earliestAllowedStart}.
     */
    public LayoutOrderingException(int fieldIndex, String fieldName, int declaredStart, int earliestAllowedStart)
    {
        super(
            "Position before current marker: " + describeField(fieldIndex, fieldName) +
                " starts at " + declaredStart + " but the previous field ends at " + earliestAllowedStart,
            fieldIndex,
            fieldName);
        this.declaredStart = declaredStart;
        this.earliestAllowedStart = earliestAllowedStart;
    }

    /**
     * @return The explicit start position that was declared.
     */
    public int getDeclaredStart()
    {
        return declaredStart;
    }

    /**
     * @return The earliest position the declaration could have started at.
     */
    public int getEarliestAllowedStart()
    {
        return earliestAllowedStart;
    }
}
