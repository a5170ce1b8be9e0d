package io.github.flatfile.common;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.ByteArrayInputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.StringReader;
import java.io.Writer;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * A text file of newline-delimited records, opened either for reading or for writing.
 *
 * <p>Fixed-width flat files carry one record per line. This class only moves
 * lines in and out; splitting a line into fields is the job of a record layout.
 *
 * <h3>Input mode</h3>
 * <p>{@link #readLine()} returns each line without its terminator. Lines may be
 * terminated by LF or CR+LF; a CR that is not followed by LF is ordinary
 * content. The last line does not need a terminator. Input can come from a
 * file, any {@link Reader}, a string, or raw bytes.
 *
 * <h3>Output mode</h3>
 * <p>{@link #writeLine(String)} writes the line followed by a single LF,
 * regardless of the platform line separator.
 *
 * <p>Character positions in fixed-width records are counted in characters, not
 * bytes, so files are decoded with a real text encoding (UTF-8 unless told
 * otherwise) rather than byte-for-byte.
 */
public class LineSequentialFile implements Closeable
{
    /** The access mode this file was opened with. */
    public enum OpenMode
    {
        /** The file is open for reading lines. */
        INPUT,
        /** The file is open for writing lines. */
        OUTPUT
    }

    /** The access mode this file was opened with (INPUT or OUTPUT). */
    private final OpenMode openMode;
    /**
     * The underlying reader for INPUT mode; {@code null} in OUTPUT mode.
     * Buffered because lines are read one character at a time.
     */
    private final BufferedReader inputFile;
    /** The underlying writer for OUTPUT mode; {@code null} in INPUT mode. */
    private final Writer outputFile;
    /** Number of lines read or written so far. */
    private long lineCount = 0;

    /**
     * Opens a UTF-8 text file for reading.
     *
     * @param filePath Path to the input file.
     * @return A file opened for reading.
     * @throws IOException If the file cannot be opened.
     */
    public static LineSequentialFile openForInput(Path filePath) throws IOException
    {
        LineSequentialFile inputFile = openForInput(filePath, StandardCharsets.UTF_8);
        return inputFile;
    }

    /**
     * Opens a text file in the given encoding for reading.
     *
     * @param filePath Path to the input file.
     * @param charset  Encoding of the file.
     * @return A file opened for reading.
     * @throws IOException If the file cannot be opened.
     */
    public static LineSequentialFile openForInput(Path filePath, Charset charset) throws IOException
    {
        // OPEN THE FILE IN INPUT MODE.
        BufferedReader inputFile = Files.newBufferedReader(filePath, charset);
        LineSequentialFile lineSequentialFile = fromReader(inputFile);
        return lineSequentialFile;
    }

    /**
     * Reads lines from an already open character source.
     * Closing the returned file closes the source.
     *
     * @param reader The character source.
     * @return A file opened for reading.
     */
    public static LineSequentialFile fromReader(Reader reader)
    {
        // WRAP THE SOURCE FOR CHARACTER-AT-A-TIME READING.
        BufferedReader inputFile = (reader instanceof BufferedReader) ?
            (BufferedReader) reader :
            new BufferedReader(reader);
        final Writer NO_OUTPUT_FILE = null;
        LineSequentialFile lineSequentialFile = new LineSequentialFile(OpenMode.INPUT, inputFile, NO_OUTPUT_FILE);
        return lineSequentialFile;
    }

    /**
     * Reads lines from a string.
     *
     * @param text The text holding the lines.
     * @return A file opened for reading.
     */
    public static LineSequentialFile fromString(String text)
    {
        LineSequentialFile lineSequentialFile = fromReader(new StringReader(text));
        return lineSequentialFile;
    }

    /**
     * Reads lines from UTF-8 encoded bytes.
     *
     * @param bytes The encoded text holding the lines.
     * @return A file opened for reading.
     */
    public static LineSequentialFile fromBytes(byte[] bytes)
    {
        InputStreamReader reader = new InputStreamReader(new ByteArrayInputStream(bytes), StandardCharsets.UTF_8);
        LineSequentialFile lineSequentialFile = fromReader(reader);
        return lineSequentialFile;
    }

    /**
     * Opens a UTF-8 text file for writing, replacing any existing content.
     *
     * @param filePath Path to the output file.
     * @return A file opened for writing.
     * @throws IOException If the file cannot be created.
     */
    public static LineSequentialFile openForOutput(Path filePath) throws IOException
    {
        LineSequentialFile outputFile = openForOutput(filePath, StandardCharsets.UTF_8);
        return outputFile;
    }

    /**
     * Opens a text file in the given encoding for writing, replacing any existing content.
     *
     * @param filePath Path to the output file.
     * @param charset  Encoding of the file.
     * @return A file opened for writing.
     * @throws IOException If the file cannot be created.
     */
    public static LineSequentialFile openForOutput(Path filePath, Charset charset) throws IOException
    {
        // OPEN THE FILE IN OUTPUT MODE.
        Writer outputFile = new BufferedWriter(new OutputStreamWriter(Files.newOutputStream(filePath), charset));
        LineSequentialFile lineSequentialFile = toWriter(outputFile);
        return lineSequentialFile;
    }

    /**
     * Writes lines to an already open character sink.
     * Closing the returned file closes the sink.
     *
     * @param writer The character sink.
     * @return A file opened for writing.
     */
    public static LineSequentialFile toWriter(Writer writer)
    {
        final BufferedReader NO_INPUT_FILE = null;
        LineSequentialFile lineSequentialFile = new LineSequentialFile(OpenMode.OUTPUT, NO_INPUT_FILE, writer);
        return lineSequentialFile;
    }

    /**
     * @return The access mode this file was opened with.
     */
    public OpenMode getOpenMode()
    {
        return openMode;
    }

    /**
     * @return The number of lines read or written so far.
     */
    public long getLineCount()
    {
        return lineCount;
    }

    /**
     * Reads the next line.
     *
     * @return The line without its LF or CR+LF terminator, or {@code null} if
     *         the end of the input has been reached.
     * @throws IOException           If a read error occurs.
     * @throws IllegalStateException If the file was opened for OUTPUT.
     */
    public String readLine() throws IOException
    {
        // ENSURE THE FILE IS OPENED FOR READING.
        boolean isOpenForReading = (openMode == OpenMode.INPUT);
        if (!isOpenForReading)
        {
            throw new IllegalStateException("Cannot read a line from a file opened for " + openMode);
        }

        // READ CHARACTERS UNTIL THE END OF THE LINE OR OF THE INPUT.
        final int END_OF_FILE = -1;
        StringBuilder line = new StringBuilder();
        int nextCharacter = inputFile.read();
        boolean isEndOfFile = (nextCharacter == END_OF_FILE);
        if (isEndOfFile)
        {
            // INDICATE THAT NO MORE LINES ARE AVAILABLE.
            return null;
        }
        while (nextCharacter != END_OF_FILE && nextCharacter != '\n')
        {
            line.append((char) nextCharacter);
            nextCharacter = inputFile.read();
        }

        // DROP THE CARRIAGE RETURN OF A CR+LF TERMINATOR.
        // A CR only counts as part of the terminator when a LF follows it.
        boolean isLineFeedTerminated = (nextCharacter == '\n');
        int lineLengthInCharacters = line.length();
        boolean endsWithCarriageReturn = (lineLengthInCharacters > 0 && line.charAt(lineLengthInCharacters - 1) == '\r');
        if (isLineFeedTerminated && endsWithCarriageReturn)
        {
            line.setLength(lineLengthInCharacters - 1);
        }

        // RETURN THE LINE.
        ++lineCount;
        return line.toString();
    }

    /**
     * Writes a line followed by a LF terminator.
     *
     * @param line The line content, which must not itself contain a line terminator.
     * @throws IOException           If a write error occurs.
     * @throws IllegalStateException If the file was opened for INPUT.
     */
    public void writeLine(String line) throws IOException
    {
        // ENSURE THE FILE IS OPENED FOR WRITING.
        boolean isOpenForWriting = (openMode == OpenMode.OUTPUT);
        if (!isOpenForWriting)
        {
            throw new IllegalStateException("Cannot write a line to a file opened for " + openMode);
        }

        // WRITE THE LINE WITH AN EXPLICIT LF.
        // The platform line separator is not used so output is identical on all platforms.
        outputFile.write(line);
        outputFile.write('\n');
        ++lineCount;
    }

    /**
     * Closes the underlying reader or writer, releasing system resources.
     * Safe to call regardless of the open mode.
     *
     * @throws IOException If an I/O error occurs while closing the file.
     */
    @Override
    public void close() throws IOException
    {
        // CLOSE THE INPUT HANDLE IF ONE WAS OPENED.
        boolean inputFileExists = (inputFile != null);
        if (inputFileExists)
        {
            inputFile.close();
        }

        // CLOSE THE OUTPUT HANDLE IF ONE WAS OPENED.
        boolean outputFileExists = (outputFile != null);
        if (outputFileExists)
        {
            outputFile.close();
        }
    }

    /**
     * Internal constructor used by the static creation methods.
     *
     * @param openMode   See {@link #openMode}.
     * @param inputFile  See {@link #inputFile}.
     * @param outputFile See {@link #outputFile}.
     */
    private LineSequentialFile(OpenMode openMode, BufferedReader inputFile, Writer outputFile)
    {
        this.openMode = openMode;
        this.inputFile = inputFile;
        this.outputFile = outputFile;
    }
}
