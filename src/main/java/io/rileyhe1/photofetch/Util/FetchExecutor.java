package io.rileyhe1.photofetch.Util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.rileyhe1.photofetch.Data.DownloadTask;
import io.rileyhe1.photofetch.Data.FetchConfig;
import io.rileyhe1.photofetch.Data.FetchException;
import io.rileyhe1.photofetch.Data.FetchResult;
import io.rileyhe1.photofetch.Data.FetchTimeoutException;
import io.rileyhe1.photofetch.Data.Outcome;
import io.rileyhe1.photofetch.Transport.FetchTransport;

/**
 * Downloads one task with retries.
 * <p>
 * An existing destination file is never fetched again, which makes whole runs safe to repeat.
 * Rate limited attempts back off exponentially, other failed attempts wait a short randomized
 * delay, and timeouts wait a fixed delay. All of them use up the same attempt budget.
 * Transport faults other than timeouts end the task at once.
 * <p>
 * {@link #execute(DownloadTask)} never throws for a failed download; it reports and returns {@link Outcome#ERROR}.
 */
public class FetchExecutor
{
    private static final Logger log = LoggerFactory.getLogger(FetchExecutor.class);

    private static final List<String> RATE_LIMIT_MARKERS = List.of("quota", "limit", "too many");

    private final FetchTransport transport;
    private final FetchConfig config;
    private final ConsoleReporter reporter;
    private final Sleeper sleeper;
    private final DoubleSupplier random;

    public FetchExecutor(FetchTransport transport, FetchConfig config, ConsoleReporter reporter)
    {
        this(transport, config, reporter, Sleeper.SYSTEM, () -> ThreadLocalRandom.current().nextDouble());
    }

    public FetchExecutor(FetchTransport transport, FetchConfig config, ConsoleReporter reporter,
                         Sleeper sleeper, DoubleSupplier random)
    {
        if(transport == null) throw new IllegalArgumentException("Transport cannot be null");
        if(config == null) throw new IllegalArgumentException("Config cannot be null");
        if(reporter == null) throw new IllegalArgumentException("Reporter cannot be null");
        if(sleeper == null) throw new IllegalArgumentException("Sleeper cannot be null");
        if(random == null) throw new IllegalArgumentException("Random source cannot be null");
        this.transport = transport;
        this.config = config;
        this.reporter = reporter;
        this.sleeper = sleeper;
        this.random = random;
    }

    public Outcome execute(DownloadTask task)
    {
        if(task == null) throw new IllegalArgumentException("Task cannot be null");

        Path destination = task.getDestinationPath();
        if(Files.exists(destination))
        {
            return Outcome.SKIPPED;
        }

        int maxRetries = config.getMaxRetries();
        Duration timeout = Duration.ofMillis(config.getFetchTimeoutMS());
        try
        {
            // spread the first requests of concurrent workers
            sleeper.sleep(jitterMillis());

            for(int attempt = 0; attempt < maxRetries; attempt++)
            {
                boolean lastAttempt = attempt == maxRetries - 1;
                FetchResult result;
                try
                {
                    result = transport.fetch(task.getResourceId(), destination, timeout);
                }
                catch(FetchTimeoutException e)
                {
                    if(!lastAttempt)
                    {
                        log.debug("Attempt {} for {} timed out", attempt + 1, task.getResourceId());
                        reporter.timeoutRetrying(task);
                        sleeper.sleep(config.getTimeoutRetryDelayMS());
                        continue;
                    }
                    reporter.timedOut(task);
                    return Outcome.ERROR;
                }
                catch(FetchException | RuntimeException e)
                {
                    log.debug("Transport failed for {}", task.getResourceId(), e);
                    reporter.error(task, e.getMessage());
                    return Outcome.ERROR;
                }

                if(result.isSuccessful() && Files.exists(destination))
                {
                    if(Files.size(destination) > 0)
                    {
                        reporter.success(task);
                        return Outcome.SUCCESS;
                    }
                    // an empty file would be skipped forever on the next run
                    Files.delete(destination);
                }

                if(isRateLimited(result.getDiagnostic()))
                {
                    if(lastAttempt)
                    {
                        break;
                    }
                    long waitMillis = rateLimitBackoffMillis(attempt);
                    reporter.rateLimited(waitMillis / 1000.0);
                    sleeper.sleep(waitMillis);
                }
                else if(!lastAttempt)
                {
                    log.debug("Attempt {} for {} failed: {}", attempt + 1, task.getResourceId(), result.getDiagnostic());
                    sleeper.sleep(Math.round(config.getRetryDelayMS() * (1 + random.getAsDouble())));
                }
            }
            reporter.failedAfterRetries(task, maxRetries);
            return Outcome.ERROR;
        }
        catch(InterruptedException e)
        {
            Thread.currentThread().interrupt();
            reporter.error(task, "interrupted");
            return Outcome.ERROR;
        }
        catch(IOException e)
        {
            reporter.error(task, e.getMessage());
            return Outcome.ERROR;
        }
    }

    static boolean isRateLimited(String diagnostic)
    {
        if(diagnostic == null) return false;
        String lower = diagnostic.toLowerCase(Locale.ROOT);
        for(String marker : RATE_LIMIT_MARKERS)
        {
            if(lower.contains(marker)) return true;
        }
        return false;
    }

    // 2^attempt * (1 + r) base units, r uniform in [0, 1)
    long rateLimitBackoffMillis(int attempt)
    {
        double factor = Math.pow(2, attempt) * (1 + random.getAsDouble());
        return Math.round(factor * config.getRateLimitDelayMS());
    }

    private long jitterMillis()
    {
        int min = config.getJitterMinMS();
        int max = config.getJitterMaxMS();
        return min + Math.round((max - min) * random.getAsDouble());
    }
}
