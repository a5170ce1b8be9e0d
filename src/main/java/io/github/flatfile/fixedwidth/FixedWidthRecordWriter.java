package io.github.flatfile.fixedwidth;

import io.github.flatfile.common.LineSequentialFile;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Writes records as fixed-width lines, formatting each with a layout.
 */
public class FixedWidthRecordWriter implements Closeable
{
    /** Destination of the lines. */
    private final LineSequentialFile outputFile;
    /** Layout every record is formatted with. */
    private final Layout layout;

    /**
     * Opens a UTF-8 fixed-width file for writing.
     *
     * @param filePath Path to the output file.
     * @param layout   Layout of every record written to the file.
     * @return A writer for the file.
     * @throws IOException If the file cannot be created.
     */
    public static FixedWidthRecordWriter open(Path filePath, Layout layout) throws IOException
    {
        LineSequentialFile outputFile = LineSequentialFile.openForOutput(filePath);
        FixedWidthRecordWriter writer = new FixedWidthRecordWriter(outputFile, layout);
        return writer;
    }

    /**
     * Creates a writer over an output line sink.
     *
     * @param outputFile See {@link #outputFile}. Must be open for OUTPUT.
     * @param layout     See {@link #layout}.
     */
    public FixedWidthRecordWriter(LineSequentialFile outputFile, Layout layout)
    {
        boolean isOpenForWriting = (outputFile.getOpenMode() == LineSequentialFile.OpenMode.OUTPUT);
        if (!isOpenForWriting)
        {
            throw new IllegalArgumentException("Records can only be written to a file opened for OUTPUT");
        }
        this.outputFile = outputFile;
        this.layout = layout;
    }

    /**
     * Formats a record and writes it as one line.
     *
     * @param record The record to write; missing fields are written as padding.
     * @throws IOException If a write error occurs.
     */
    public void writeRecord(Map<String, String> record) throws IOException
    {
        String line = layout.format(record);
        outputFile.writeLine(line);
    }

    /**
     * Closes the underlying line sink.
     *
     * @throws IOException If an I/O error occurs while closing.
     */
    @Override
    public void close() throws IOException
    {
        outputFile.close();
    }
}
