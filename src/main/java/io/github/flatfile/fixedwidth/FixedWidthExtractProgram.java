package io.github.flatfile.fixedwidth;

import io.github.flatfile.common.LineSequentialFile;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Extracts the fields of a fixed-width file into tab-delimited text.
 *
 * <p>The program:
 * <ol>
 *   <li>Builds a layout from field declarations (see {@link FieldDeclarationArgument})</li>
 *   <li>Writes a header line holding the field names</li>
 *   <li>Parses each input line and writes its field values, tab separated</li>
 *   <li>Reports lines too short for the layout to standard error and keeps going</li>
 *   <li>Rejects lines with a field value containing a tab, since the value would
 *       shift every later column, and keeps going</li>
 *   <li>Prints input, output and error counts</li>
 * </ol>
 */
public class FixedWidthExtractProgram
{
    /** Return code when every line was extracted. */
    public static final int SUCCESS_RETURN_CODE = 0;
    /** Return code when at least one line was rejected. */
    public static final int REJECTED_RECORDS_RETURN_CODE = 4;
    /** Return code when the field declarations do not form a valid layout. */
    public static final int INVALID_LAYOUT_RETURN_CODE = 8;
    /** Separator between values in the output. */
    private static final String OUTPUT_FIELD_SEPARATOR = "\t";

    /** Path to the fixed-width input file. */
    private final Path inputFilePath;
    /** Path to the tab-delimited output file. */
    private final Path outputFilePath;
    /** Field declaration tokens, in layout order. */
    private final List<String> fieldDeclarations;

    /**
     * CLI entry point.  @see FixedWidthExtractProgram
     *
     * <p>Usage: {@code java -jar flatfile.jar <input_file> <output_file> <field>...}
     *
     * <p>The arguments can also be provided via environment variables:
     * {@code FIXED_WIDTH_INPUT}, {@code FIXED_WIDTH_OUTPUT}, and
     * {@code FIXED_WIDTH_FIELDS} (space-separated field declarations).
     *
     * @param commandLineArguments Command-line arguments: input_file, output_file, field declarations.
     */
    public static void main(String[] commandLineArguments)
    {
        // RESOLVE THE ARGUMENTS FROM THE COMMAND LINE OR ENVIRONMENT VARIABLES.
        Path inputFilePath;
        Path outputFilePath;
        List<String> fieldDeclarations;

        // Command line arguments are prioritized over environment variables since
        // they tend to be more explicitly specified.
        final int MINIMUM_COMMAND_LINE_ARGUMENT_COUNT = 3;
        boolean hasCommandLineArguments = (commandLineArguments.length >= MINIMUM_COMMAND_LINE_ARGUMENT_COUNT);
        if (hasCommandLineArguments)
        {
            // READ IN THE ARGUMENTS FROM THE COMMAND LINE.
            final int INPUT_FILE_PATH_ARGUMENT_INDEX = 0;
            final int OUTPUT_FILE_PATH_ARGUMENT_INDEX = 1;
            final int FIRST_FIELD_DECLARATION_ARGUMENT_INDEX = 2;
            inputFilePath = Path.of(commandLineArguments[INPUT_FILE_PATH_ARGUMENT_INDEX]);
            outputFilePath = Path.of(commandLineArguments[OUTPUT_FILE_PATH_ARGUMENT_INDEX]);
            fieldDeclarations = Arrays.asList(commandLineArguments)
                .subList(FIRST_FIELD_DECLARATION_ARGUMENT_INDEX, commandLineArguments.length);
        }
        else
        {
            // FALL BACK TO ENVIRONMENT VARIABLES.
            String inputFilePathString = System.getenv("FIXED_WIDTH_INPUT");
            String outputFilePathString = System.getenv("FIXED_WIDTH_OUTPUT");
            String fieldDeclarationsString = System.getenv("FIXED_WIDTH_FIELDS");
            // Everything needs to be specified for the program to run.
            boolean hasAllEnvironmentVariables =
                (inputFilePathString != null) &&
                (outputFilePathString != null) &&
                (fieldDeclarationsString != null) &&
                !fieldDeclarationsString.isBlank();
            if (!hasAllEnvironmentVariables)
            {
                // PROVIDE VISIBILITY INTO THE ERROR.
                System.err.println("Usage: java -jar flatfile.jar <input_file> <output_file> <field>...");
                System.err.println("  <field> is name=WIDTH, name=START-END or name=START-, optionally followed by :left|right and :<padding>");
                System.err.println("  Or set environment variables: FIXED_WIDTH_INPUT, FIXED_WIDTH_OUTPUT, FIXED_WIDTH_FIELDS");
                final int MISSING_ARGUMENTS_EXIT_CODE = 1;
                System.exit(MISSING_ARGUMENTS_EXIT_CODE);
                return;
            }

            // CONVERT THE STRINGS TO PATHS AND DECLARATIONS.
            inputFilePath = Path.of(inputFilePathString);
            outputFilePath = Path.of(outputFilePathString);
            final String WHITESPACE_PATTERN = "\\s+";
            fieldDeclarations = Arrays.asList(fieldDeclarationsString.trim().split(WHITESPACE_PATTERN));
        }

        // RUN THE PROGRAM AND EXIT WITH ITS RETURN CODE.
        try
        {
            FixedWidthExtractProgram program = new FixedWidthExtractProgram(inputFilePath, outputFilePath, fieldDeclarations);
            int returnCode = program.run();
            System.exit(returnCode);
        }
        catch (IOException exception)
        {
            // PROVIDE VISIBILITY INTO THE ERROR.
            System.err.println("Fixed-width extract I/O error: " + exception.getMessage());
            final int IO_ERROR_EXIT_CODE = 12;
            System.exit(IO_ERROR_EXIT_CODE);
        }
    }

    /**
     * Creates an extract program.
     *
     * @param inputFilePath     See {@link #inputFilePath}.
     * @param outputFilePath    See {@link #outputFilePath}.
     * @param fieldDeclarations See {@link #fieldDeclarations}.
     */
    public FixedWidthExtractProgram(Path inputFilePath, Path outputFilePath, List<String> fieldDeclarations)
    {
        this.inputFilePath = inputFilePath;
        this.outputFilePath = outputFilePath;
        this.fieldDeclarations = List.copyOf(fieldDeclarations);
    }

    /**
     * Executes the extraction.
     *
     * @return {@link #SUCCESS_RETURN_CODE}, {@link #REJECTED_RECORDS_RETURN_CODE}
     *         or {@link #INVALID_LAYOUT_RETURN_CODE}.
     * @throws IOException If a file I/O error occurs.
     */
    public int run() throws IOException
    {
        // BUILD THE LAYOUT BEFORE TOUCHING ANY FILE.
        // A layout that cannot be resolved cannot parse any record.
        Layout layout;
        try
        {
            layout = buildLayout(fieldDeclarations);
        }
        catch (IllegalArgumentException | LayoutResolutionException exception)
        {
            // PROVIDE VISIBILITY INTO THE ERROR.
            System.err.println("INVALID LAYOUT: " + exception.getMessage());
            return INVALID_LAYOUT_RETURN_CODE;
        }

        // PROCESS ALL LINES UNTIL END-OF-FILE.
        final int NO_INITIAL_RECORD_COUNT = 0;
        RecordProcessingStatistics entireProgramRunRecordStatistics = new RecordProcessingStatistics(
            NO_INITIAL_RECORD_COUNT,
            NO_INITIAL_RECORD_COUNT,
            NO_INITIAL_RECORD_COUNT);
        try (FixedWidthRecordReader inputFile = FixedWidthRecordReader.open(inputFilePath, layout);
             LineSequentialFile outputFile = LineSequentialFile.openForOutput(outputFilePath))
        {
            // WRITE THE HEADER LINE.
            List<String> fieldNames = getFieldNames(layout);
            outputFile.writeLine(String.join(OUTPUT_FIELD_SEPARATOR, fieldNames));

            // EXTRACT EACH LINE.
            RecordReadResult readResult = inputFile.readRecord();
            while (!readResult.isEndOfFile)
            {
                RecordProcessingStatistics lineStatistics = writeExtractedRecord(readResult, fieldNames, outputFile);
                entireProgramRunRecordStatistics.add(lineStatistics);
                readResult = inputFile.readRecord();
            }
        }

        // DISPLAY PROCESSING SUMMARY COUNTS.
        System.out.println("NO. OF INPUT RECORDS  = " + entireProgramRunRecordStatistics.inputCount);
        System.out.println("NO. OF OUTPUT RECORDS = " + entireProgramRunRecordStatistics.outputCount);
        System.out.println("NO. OF ERROR RECORDS  = " + entireProgramRunRecordStatistics.errorCount);

        // DETERMINE THE RETURN CODE BASED ON PROCESSING OUTCOME.
        boolean hadRejectedRecords = (entireProgramRunRecordStatistics.errorCount > 0);
        int returnCode = hadRejectedRecords ? REJECTED_RECORDS_RETURN_CODE : SUCCESS_RETURN_CODE;
        return returnCode;
    }

    /**
     * Builds the layout described by field declaration tokens.
     *
     * @param fieldDeclarations The declaration tokens, in layout order.
     * @return The resolved layout.
     * @throws IllegalArgumentException If a token is malformed.
     * @throws LayoutResolutionException If the declarations do not resolve.
     */
    static Layout buildLayout(List<String> fieldDeclarations)
    {
        LayoutBuilder layoutBuilder = LayoutBuilder.create();
        for (String fieldDeclarationToken : fieldDeclarations)
        {
            FieldDeclarationArgument fieldDeclaration = FieldDeclarationArgument.parse(fieldDeclarationToken);
            fieldDeclaration.appendTo(layoutBuilder);
        }
        Layout layout = layoutBuilder.build();
        return layout;
    }

    /**
     * Lists the distinct names of a layout's named fields, in layout order.
     * A repeated name keeps only its first field, as parsing does.
     *
     * @param layout The layout.
     * @return The output column names.
     */
    private static List<String> getFieldNames(Layout layout)
    {
        List<String> fieldNames = new ArrayList<>();
        for (Field field : layout.getFields())
        {
            boolean isNewName = !field.isSpacer() && !fieldNames.contains(field.name);
            if (isNewName)
            {
                fieldNames.add(field.name);
            }
        }
        return fieldNames;
    }

    /**
     * Writes one accepted record as a tab-delimited line, or reports a rejected one.
     *
     * @param readResult The outcome of reading one line.
     * @param fieldNames The output column names.
     * @param outputFile The output file.
     * @return The counts for this line.
     * @throws IOException If a write error occurs.
     */
    private RecordProcessingStatistics writeExtractedRecord(
        RecordReadResult readResult,
        List<String> fieldNames,
        LineSequentialFile outputFile) throws IOException
    {
        // COUNT THE INPUT LINE.
        final int ONE_INPUT_RECORD = 1;
        final int NO_INITIAL_RECORD_COUNT = 0;
        RecordProcessingStatistics statistics = new RecordProcessingStatistics(ONE_INPUT_RECORD, NO_INITIAL_RECORD_COUNT, NO_INITIAL_RECORD_COUNT);

        // REPORT A REJECTED LINE WITHOUT STOPPING.
        if (readResult.isRejected())
        {
            System.err.println("RECORD REJECTED AT LINE " + readResult.lineNumber + ": " + readResult.parseFailure.getMessage());
            statistics.errorCount = 1;
            return statistics;
        }

        // COLLECT THE VALUES IN COLUMN ORDER.
        Map<String, String> record = readResult.record;
        List<String> values = new ArrayList<>(fieldNames.size());
        for (String fieldName : fieldNames)
        {
            // REJECT A VALUE THAT WOULD BE READ AS TWO COLUMNS.
            String fieldValue = record.get(fieldName);
            boolean containsFieldSeparator = fieldValue.contains(OUTPUT_FIELD_SEPARATOR);
            if (containsFieldSeparator)
            {
                System.err.println("RECORD REJECTED AT LINE " + readResult.lineNumber + ": field '" + fieldName + "' contains a tab");
                statistics.errorCount = 1;
                return statistics;
            }
            values.add(fieldValue);
        }

        // WRITE THE VALUES AS ONE LINE.
        outputFile.writeLine(String.join(OUTPUT_FIELD_SEPARATOR, values));
        statistics.outputCount = 1;
        return statistics;
    }
}
