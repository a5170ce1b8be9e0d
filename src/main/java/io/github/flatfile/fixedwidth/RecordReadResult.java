package io.github.flatfile.fixedwidth;

import java.util.Map;

/**
 * Result of reading one line from a fixed-width source.
 *
 * <p>Exactly one of three outcomes applies:
 * <ul>
 *   <li>End of input: {@link #isEndOfFile} is true and nothing else is set.</li>
 *   <li>Accepted line: {@link #record} holds the parsed fields.</li>
 *   <li>Rejected line: {@link #parseFailure} explains why the line could not be
 *       parsed. Reading may continue with the next line.</li>
 * </ul>
 *
 * @see FixedWidthRecordReader
 */
public class RecordReadResult
{
    /**
     * True when the source has been exhausted.
     * When true, {@link #line}, {@link #record} and {@link #parseFailure} are null.
     */
    public final boolean isEndOfFile;
    /** The 1-based number of the line that was read; 0 at end of input. */
    public final long lineNumber;
    /** The line as read, without its terminator. Null at end of input. */
    public final String line;
    /** The parsed record. Null at end of input or when the line was rejected. */
    public final Map<String, String> record;
    /** Why the line was rejected. Null unless the line was rejected. */
    public final InsufficientBufferException parseFailure;

    /**
     * Creates the result for the end of the input.
     *
     * @return A result with {@link #isEndOfFile} set.
     */
    public static RecordReadResult endOfFile()
    {
        final long NO_LINE_NUMBER = 0;
        RecordReadResult endOfFileResult = new RecordReadResult(true, NO_LINE_NUMBER, null, null, null);
        return endOfFileResult;
    }

    /**
     * Creates the result for a line that was parsed.
     *
     * @param lineNumber See {@link #lineNumber}.
     * @param line       See {@link #line}.
     * @param record     See {@link #record}.
     * @return A result holding the record.
     */
    public static RecordReadResult accepted(long lineNumber, String line, Map<String, String> record)
    {
        final InsufficientBufferException NO_PARSE_FAILURE = null;
        RecordReadResult acceptedResult = new RecordReadResult(false, lineNumber, line, record, NO_PARSE_FAILURE);
        return acceptedResult;
    }

    /**
     * Creates the result for a line that could not be parsed.
     *
     * @param lineNumber   See {@link #lineNumber}.
     * @param line         See {@link #line}.
     * @param parseFailure See {@link #parseFailure}.
     * @return A result holding the failure.
     */
    public static RecordReadResult rejected(long lineNumber, String line, InsufficientBufferException parseFailure)
    {
        final Map<String, String> NO_RECORD = null;
        RecordReadResult rejectedResult = new RecordReadResult(false, lineNumber, line, NO_RECORD, parseFailure);
        return rejectedResult;
    }

    /**
     * Tests if a line was read but could not be parsed.
     *
     * @return True if {@link #parseFailure} is set.
     */
    public boolean isRejected()
    {
        boolean isRejected = (parseFailure != null);
        return isRejected;
    }

    /**
     * Returns the parsed record, turning a rejected line into an exception.
     *
     * @return The parsed record, or null at end of input.
     * @throws RecordReadException If the line was rejected.
     */
    public Map<String, String> getRecordOrThrow() throws RecordReadException
    {
        if (isRejected())
        {
            throw new RecordReadException(lineNumber, parseFailure);
        }
        return record;
    }

    /**
     * Creates a result. Use the static creation methods instead.
     *
     * @param isEndOfFile  See {@link #isEndOfFile}.
     * @param lineNumber   See {@link #lineNumber}.
     * @param line         See {@link #line}.
     * @param record       See {@link #record}.
     * @param parseFailure See {@link #parseFailure}.
     */
    private RecordReadResult(
        boolean isEndOfFile,
        long lineNumber,
        String line,
        Map<String, String> record,
        InsufficientBufferException parseFailure)
    {
        this.isEndOfFile = isEndOfFile;
        this.lineNumber = lineNumber;
        this.line = line;
        this.record = record;
        this.parseFailure = parseFailure;
    }
}
