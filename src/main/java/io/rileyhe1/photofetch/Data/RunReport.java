package io.rileyhe1.photofetch.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Data Transfer Object for the JSON report written at the end of a run.
 * Holds plain fields only so Gson can write and read it.
 */
public class RunReport
{
    private String outputDirectory;
    private String startedAt;
    private String finishedAt;
    private List<BatchCounts> batches;
    private BatchCounts total;

    // No arg constructor for gson deserialization
    public RunReport()
    {
        this.batches = new ArrayList<>();
    }

    public RunReport(String outputDirectory, String startedAt, String finishedAt,
                     List<BatchSummary> batchSummaries, BatchSummary total)
    {
        this.outputDirectory = outputDirectory;
        this.startedAt = startedAt;
        this.finishedAt = finishedAt;
        this.batches = new ArrayList<>();
        for(BatchSummary summary : batchSummaries)
        {
            this.batches.add(BatchCounts.from(summary));
        }
        this.total = BatchCounts.from(total);
    }

    public String getOutputDirectory()
    {
        return outputDirectory;
    }

    public String getStartedAt()
    {
        return startedAt;
    }

    public String getFinishedAt()
    {
        return finishedAt;
    }

    public List<BatchCounts> getBatches()
    {
        return batches;
    }

    public BatchCounts getTotal()
    {
        return total;
    }

    public List<BatchSummary> getBatchSummaries()
    {
        List<BatchSummary> summaries = new ArrayList<>();
        if(batches != null)
        {
            for(BatchCounts counts : batches)
            {
                summaries.add(counts.toSummary());
            }
        }
        return summaries;
    }

    public BatchSummary getTotalSummary()
    {
        return total != null ? total.toSummary() : BatchSummary.empty("TOTAL");
    }

    public static class BatchCounts
    {
        private String label;
        private int downloaded;
        private int skipped;
        private int errors;

        public BatchCounts()
        {
        }

        static BatchCounts from(BatchSummary summary)
        {
            BatchCounts counts = new BatchCounts();
            counts.label = summary.getLabel();
            counts.downloaded = summary.getDownloaded();
            counts.skipped = summary.getSkipped();
            counts.errors = summary.getErrors();
            return counts;
        }

        public BatchSummary toSummary()
        {
            return new BatchSummary(label, downloaded, skipped, errors);
        }

        public String getLabel()
        {
            return label;
        }

        public int getDownloaded()
        {
            return downloaded;
        }

        public int getSkipped()
        {
            return skipped;
        }

        public int getErrors()
        {
            return errors;
        }
    }
}
