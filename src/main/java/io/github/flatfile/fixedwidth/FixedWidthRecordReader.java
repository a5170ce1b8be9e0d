package io.github.flatfile.fixedwidth;

import io.github.flatfile.common.LineSequentialFile;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Reads fixed-width records one line at a time, parsing each with a layout.
 *
 * <p>A line too short for the layout does not stop reading: it is returned as
 * a rejected {@link RecordReadResult} and the next call moves on to the next
 * line. The records form a finite sequence that ends with an end-of-file
 * result and cannot be restarted.
 */
public class FixedWidthRecordReader implements Closeable
{
    /** Source of the lines. */
    private final LineSequentialFile inputFile;
    /** Layout every line is parsed with. */
    private final Layout layout;

    /**
     * Opens a UTF-8 fixed-width file for reading.
     *
     * @param filePath Path to the input file.
     * @param layout   Layout of every record in the file.
     * @return A reader positioned before the first record.
     * @throws IOException If the file cannot be opened.
     */
    public static FixedWidthRecordReader open(Path filePath, Layout layout) throws IOException
    {
        LineSequentialFile inputFile = LineSequentialFile.openForInput(filePath);
        FixedWidthRecordReader reader = new FixedWidthRecordReader(inputFile, layout);
        return reader;
    }

    /**
     * Reads fixed-width records held in a string, one per line.
     *
     * @param text   The records.
     * @param layout Layout of every record.
     * @return A reader positioned before the first record.
     */
    public static FixedWidthRecordReader fromString(String text, Layout layout)
    {
        LineSequentialFile inputFile = LineSequentialFile.fromString(text);
        FixedWidthRecordReader reader = new FixedWidthRecordReader(inputFile, layout);
        return reader;
    }

    /**
     * Creates a reader over an input line source.
     *
     * @param inputFile See {@link #inputFile}. Must be open for INPUT.
     * @param layout    See {@link #layout}.
     */
    public FixedWidthRecordReader(LineSequentialFile inputFile, Layout layout)
    {
        boolean isOpenForReading = (inputFile.getOpenMode() == LineSequentialFile.OpenMode.INPUT);
        if (!isOpenForReading)
        {
            throw new IllegalArgumentException("Records can only be read from a file opened for INPUT");
        }
        this.inputFile = inputFile;
        this.layout = layout;
    }

    /**
     * @return The layout every line is parsed with.
     */
    public Layout getLayout()
    {
        return layout;
    }

    /**
     * Reads and parses the next line.
     *
     * @return The outcome for the next line, or an end-of-file result.
     * @throws IOException If the source cannot be read.
     */
    public RecordReadResult readRecord() throws IOException
    {
        // READ THE NEXT LINE FROM THE SOURCE.
        String line = inputFile.readLine();
        boolean isEndOfFile = (line == null);
        if (isEndOfFile)
        {
            RecordReadResult endOfFileResult = RecordReadResult.endOfFile();
            return endOfFileResult;
        }

        // PARSE THE LINE INTO A RECORD.
        // A short line only rejects this record; the caller decides whether to continue.
        long lineNumber = inputFile.getLineCount();
        try
        {
            Map<String, String> record = layout.parse(line);
            RecordReadResult acceptedResult = RecordReadResult.accepted(lineNumber, line, record);
            return acceptedResult;
        }
        catch (InsufficientBufferException exception)
        {
            RecordReadResult rejectedResult = RecordReadResult.rejected(lineNumber, line, exception);
            return rejectedResult;
        }
    }

    /**
     * Reads and parses the next line, reporting any failure as a single exception type.
     *
     * <p>Unlike {@link #readRecord()}, a short line fails the call. The failing
     * line is still consumed, so a caller that catches the exception can keep
     * reading from the next line.
     *
     * @return The next record, or {@code null} at the end of the input.
     * @throws RecordReadException If the source cannot be read or the line is too short for the layout.
     */
    public Map<String, String> nextRecord() throws RecordReadException
    {
        // READ THE NEXT LINE, WRAPPING ANY I/O FAILURE.
        RecordReadResult readResult;
        try
        {
            readResult = readRecord();
        }
        catch (IOException exception)
        {
            throw new RecordReadException(exception);
        }

        // INDICATE THAT NO MORE RECORDS ARE AVAILABLE.
        if (readResult.isEndOfFile)
        {
            return null;
        }

        // RETURN THE RECORD OR ITS PARSE FAILURE.
        Map<String, String> record = readResult.getRecordOrThrow();
        return record;
    }

    /**
     * Closes the underlying line source.
     *
     * @throws IOException If an I/O error occurs while closing.
     */
    @Override
    public void close() throws IOException
    {
        inputFile.close();
    }
}
