package io.rileyhe1.photofetch.Data;

import java.util.Objects;

/**
 * Download counts for one batch, or for a whole run.
 * downloaded + skipped + errors always equals the number of outcomes folded in.
 */
public final class BatchSummary
{
    private final String label;
    private final int downloaded;
    private final int skipped;
    private final int errors;

    public BatchSummary(String label, int downloaded, int skipped, int errors)
    {
        if(downloaded < 0 || skipped < 0 || errors < 0)
        {
            throw new IllegalArgumentException("Counts cannot be negative");
        }
        this.label = label != null ? label : "";
        this.downloaded = downloaded;
        this.skipped = skipped;
        this.errors = errors;
    }

    public static BatchSummary empty(String label)
    {
        return new BatchSummary(label, 0, 0, 0);
    }

    public BatchSummary with(Outcome outcome)
    {
        if(outcome == null) throw new IllegalArgumentException("Outcome cannot be null");
        switch(outcome)
        {
            case SUCCESS:
                return new BatchSummary(label, downloaded + 1, skipped, errors);
            case SKIPPED:
                return new BatchSummary(label, downloaded, skipped + 1, errors);
            default:
                return new BatchSummary(label, downloaded, skipped, errors + 1);
        }
    }

    // keeps this summary's label
    public BatchSummary plus(BatchSummary other)
    {
        if(other == null) throw new IllegalArgumentException("Summary cannot be null");
        return new BatchSummary(label, downloaded + other.downloaded, skipped + other.skipped, errors + other.errors);
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

    public int getTotal()
    {
        return downloaded + skipped + errors;
    }

    // counts only, labels are ignored
    public boolean sameCounts(BatchSummary other)
    {
        return other != null && downloaded == other.downloaded && skipped == other.skipped && errors == other.errors;
    }

    @Override
    public boolean equals(Object o)
    {
        if(this == o) return true;
        if(!(o instanceof BatchSummary)) return false;
        BatchSummary other = (BatchSummary) o;
        return label.equals(other.label) && sameCounts(other);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(label, downloaded, skipped, errors);
    }

    @Override
    public String toString()
    {
        return "BatchSummary[" + label + ": downloaded=" + downloaded + ", skipped=" + skipped + ", errors=" + errors + "]";
    }
}
