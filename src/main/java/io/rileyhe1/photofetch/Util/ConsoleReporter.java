package io.rileyhe1.photofetch.Util;

import java.util.Locale;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.rileyhe1.photofetch.Data.DownloadTask;

/**
 * Serialized output channel shared by all download workers.
 * <p>
 * Workers only enqueue messages; one writer thread hands them to the sink in
 * the order they arrived, so lines from concurrent downloads never interleave.
 * {@link #close()} blocks until every queued message has been written.
 */
public class ConsoleReporter implements AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(ConsoleReporter.class);
    private static final Logger CONSOLE = LoggerFactory.getLogger("io.rileyhe1.photofetch.console");

    // end-of-output marker, compared by identity
    private static final Line SHUTDOWN = new Line("");

    private static int reporterNr = 0;

    private final BlockingQueue<Line> messages;
    private final Consumer<String> sink;
    private final Thread writer;
    private boolean closed = false;

    public ConsoleReporter()
    {
        this(CONSOLE::info);
    }

    public ConsoleReporter(Consumer<String> sink)
    {
        if(sink == null) throw new IllegalArgumentException("Sink cannot be null");
        this.sink = sink;
        this.messages = new LinkedBlockingQueue<>();
        this.writer = new Thread(this::drain, nextThreadName());
        this.writer.setDaemon(true);
        this.writer.start();
    }

    private static synchronized String nextThreadName()
    {
        return String.format("console-reporter-%1$d", reporterNr++);
    }

    public synchronized void report(String message)
    {
        if(closed) throw new IllegalStateException("Reporter is closed");
        messages.add(new Line(message != null ? message : "null"));
    }

    public void success(DownloadTask task)
    {
        report("  ✓ " + task.getFileName());
    }

    public void rateLimited(double waitSeconds)
    {
        report(String.format(Locale.ROOT, "  ⏸ Rate limit hit, waiting %.1fs...", waitSeconds));
    }

    public void timeoutRetrying(DownloadTask task)
    {
        report("  ⏱ Timeout, retrying... " + task.getFileName());
    }

    public void failedAfterRetries(DownloadTask task, int attempts)
    {
        report("  ✗ Failed after " + attempts + " attempts: " + task.getFileName());
    }

    public void timedOut(DownloadTask task)
    {
        report("  ✗ Timeout: " + task.getFileName());
    }

    public void error(DownloadTask task, String reason)
    {
        report("  ✗ Error: " + task.getFileName() + " - " + reason);
    }

    private void drain()
    {
        while(true)
        {
            Line message;
            try
            {
                message = messages.take();
            }
            catch(InterruptedException e)
            {
                Thread.currentThread().interrupt();
                return;
            }
            if(message == SHUTDOWN)
            {
                return;
            }
            try
            {
                sink.accept(message.text);
            }
            catch(RuntimeException e)
            {
                log.warn("Console sink rejected message '{}'", message.text, e);
            }
        }
    }

    @Override
    public void close()
    {
        synchronized(this)
        {
            if(closed) return;
            closed = true;
            messages.add(SHUTDOWN);
        }
        try
        {
            writer.join();
        }
        catch(InterruptedException e)
        {
            Thread.currentThread().interrupt();
        }
    }

    public synchronized boolean isClosed()
    {
        return closed;
    }

    private static final class Line
    {
        private final String text;

        private Line(String text)
        {
            this.text = text;
        }
    }
}
