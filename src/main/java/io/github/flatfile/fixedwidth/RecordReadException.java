package io.github.flatfile.fixedwidth;

import java.io.IOException;

/**
 * A failure to obtain a record from a fixed-width source, either because the
 * source could not be read or because a line could not be parsed.
 *
 * <p>The underlying {@link IOException} or {@link InsufficientBufferException}
 * is always available as the cause.
 */
public class RecordReadException extends Exception
{
    /**
     * Wraps an I/O failure of the underlying source.
     *
     * @param cause The I/O failure.
     */
    public RecordReadException(IOException cause)
    {
        super(cause.getMessage(), cause);
    }

    /**
     * Wraps a parse failure of one line.
     *
     * @param lineNumber The 1-based number of the rejected line.
     * @param cause      The parse failure.
     */
    public RecordReadException(long lineNumber, InsufficientBufferException cause)
    {
        super("Line " + lineNumber + ": " + cause.getMessage(), cause);
    }

    /**
     * Tests if this failure came from the underlying source rather than from parsing.
     *
     * @return True if the cause is an {@link IOException}.
     */
    public boolean isInputOutputFailure()
    {
        boolean isInputOutputFailure = (getCause() instanceof IOException);
        return isInputOutputFailure;
    }
}
