package io.rileyhe1.photofetch.Util;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import io.rileyhe1.photofetch.Data.BatchSummary;
import io.rileyhe1.photofetch.Data.Outcome;

/**
 * Counts outcomes. The static folds are pure; an instance is a running tally that
 * workers and the run loop may update concurrently.
 */
public class BatchAggregator
{
    private final Map<Outcome, AtomicInteger> counts;

    public BatchAggregator()
    {
        this.counts = new EnumMap<>(Outcome.class);
        for(Outcome outcome : Outcome.values())
        {
            counts.put(outcome, new AtomicInteger());
        }
    }

    public void record(Outcome outcome)
    {
        if(outcome == null) throw new IllegalArgumentException("Outcome cannot be null");
        counts.get(outcome).incrementAndGet();
    }

    public void record(BatchSummary summary)
    {
        if(summary == null) throw new IllegalArgumentException("Summary cannot be null");
        counts.get(Outcome.SUCCESS).addAndGet(summary.getDownloaded());
        counts.get(Outcome.SKIPPED).addAndGet(summary.getSkipped());
        counts.get(Outcome.ERROR).addAndGet(summary.getErrors());
    }

    public BatchSummary snapshot(String label)
    {
        return new BatchSummary(label,
            counts.get(Outcome.SUCCESS).get(),
            counts.get(Outcome.SKIPPED).get(),
            counts.get(Outcome.ERROR).get());
    }

    public static BatchSummary fold(String label, Iterable<Outcome> outcomes)
    {
        if(outcomes == null) throw new IllegalArgumentException("Outcomes cannot be null");
        BatchSummary summary = BatchSummary.empty(label);
        for(Outcome outcome : outcomes)
        {
            summary = summary.with(outcome);
        }
        return summary;
    }

    public static BatchSummary total(String label, Iterable<BatchSummary> summaries)
    {
        if(summaries == null) throw new IllegalArgumentException("Summaries cannot be null");
        BatchSummary total = BatchSummary.empty(label);
        for(BatchSummary summary : summaries)
        {
            total = total.plus(summary);
        }
        return total;
    }
}
