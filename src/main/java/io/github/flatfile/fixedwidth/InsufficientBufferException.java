package io.github.flatfile.fixedwidth;

/**
 * Thrown when a line is too short to hold every field of a layout, or when its
 * length cannot be determined before reading it.
 *
 * <p>This is a per-record failure: the caller can skip the record, report it,
 * or abandon the input, and the layout remains usable for later records.
 */
public class InsufficientBufferException extends Exception
{
    /** The number of code points the layout needs (its total width). */
    private final int requiredLength;
    /**
     * The number of code points the input offered.
     * Null when the input's length was not known in advance.
     */
    private final Integer availableLength;

    /**
     * Creates an insufficient-buffer failure.
     *
     * @param requiredLength  See {@link #requiredLength}.
     * @param availableLength See {@link #availableLength}.
     */
    public InsufficientBufferException(int requiredLength, Integer availableLength)
    {
        super(describe(requiredLength, availableLength));
        this.requiredLength = requiredLength;
        this.availableLength = availableLength;
    }

    /**
     * @return The number of code points the layout needs.
     */
    public int getRequiredLength()
    {
        return requiredLength;
    }

    /**
     * @return The number of code points the input offered, or null if unknown.
     */
    public Integer getAvailableLength()
    {
        return availableLength;
    }

    /**
     * Tests if the input's length was known when the failure was detected.
     *
     * @return True if {@link #getAvailableLength()} is non-null.
     */
    public boolean hasKnownAvailableLength()
    {
        boolean hasKnownAvailableLength = (availableLength != null);
        return hasKnownAvailableLength;
    }

    /**
     * Builds the failure message.
     *
     * @param requiredLength  The required length.
     * @param availableLength The available length, or null if unknown.
     * @return The message text.
     */
    private static String describe(int requiredLength, Integer availableLength)
    {
        boolean availableLengthIsUnknown = (availableLength == null);
        if (availableLengthIsUnknown)
        {
            return "Undefined buffer size, required " + requiredLength;
        }
        return "Insufficient buffer size, required " + requiredLength + " only " + availableLength + " available";
    }
}
