package io.github.flatfile.fixedwidth;

/**
 * Counts of records processed.
 * Can be for a single line or aggregated across an entire program run.
 */
public class RecordProcessingStatistics
{
    /**
     * Number of input records.
     * 1 for each line read from the input (accepted or rejected).
     */
    public int inputCount;
    /**
     * Number of output records written.
     * 1 for each accepted line written to the output.
     */
    public int outputCount;
    /**
     * Number of error records.
     * 1 for each line rejected as too short for the layout.
     */
    public int errorCount;

    /**
     * Creates a statistics snapshot.
     *
     * @param inputCount  See {@link #inputCount}.
     * @param outputCount See {@link #outputCount}.
     * @param errorCount  See {@link #errorCount}.
     */
    public RecordProcessingStatistics(int inputCount, int outputCount, int errorCount)
    {
        this.inputCount = inputCount;
        this.outputCount = outputCount;
        this.errorCount = errorCount;
    }

    /**
     * Adds another set of counts into this one.
     *
     * @param other The counts to add.
     */
    public void add(RecordProcessingStatistics other)
    {
        inputCount += other.inputCount;
        outputCount += other.outputCount;
        errorCount += other.errorCount;
    }
}
