import io.rileyhe1.photofetch.Data.DownloadTask;
import io.rileyhe1.photofetch.Util.ConsoleReporter;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ConsoleReporterTest
{
    private static final DownloadTask TASK = new DownloadTask("ABC", Paths.get("photos", "d-c-PS001-Main-PSB-ABC.jpg"));

    @Test
    @Timeout(10)
    void testMessagesArriveInOrder()
    {
        List<String> sink = Collections.synchronizedList(new ArrayList<>());
        try(ConsoleReporter reporter = new ConsoleReporter(sink::add))
        {
            for(int i = 0; i < 100; i++)
            {
                reporter.report("line " + i);
            }
        }
        assertEquals(100, sink.size());
        for(int i = 0; i < 100; i++)
        {
            assertEquals("line " + i, sink.get(i));
        }
    }

    @Test
    @Timeout(10)
    void testAnyTextIsWrittenUntilClose()
    {
        List<String> sink = Collections.synchronizedList(new ArrayList<>());
        try(ConsoleReporter reporter = new ConsoleReporter(sink::add))
        {
            reporter.report("");
            reporter.report("<shutdown>");
            reporter.report(null);
            reporter.report("after");
        }
        assertEquals(List.of("", "<shutdown>", "null", "after"), sink);
    }

    @Test
    @Timeout(30)
    void testConcurrentProducersLoseNothing() throws InterruptedException
    {
        List<String> sink = new ArrayList<>();
        // the writer thread is the only one touching the sink, so a plain list is enough
        ConsoleReporter reporter = new ConsoleReporter(sink::add);
        ExecutorService executor = Executors.newFixedThreadPool(6);
        CountDownLatch done = new CountDownLatch(6);
        for(int t = 0; t < 6; t++)
        {
            int producer = t;
            executor.submit(() -> {
                for(int i = 0; i < 500; i++)
                {
                    reporter.report(producer + ":" + i);
                }
                done.countDown();
            });
        }
        done.await();
        executor.shutdown();
        assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
        reporter.close();

        assertEquals(3000, sink.size());
        Set<String> unique = new HashSet<>(sink);
        assertEquals(3000, unique.size());
    }

    @Test
    @Timeout(10)
    void testFormattedMessages()
    {
        List<String> sink = new ArrayList<>();
        try(ConsoleReporter reporter = new ConsoleReporter(sink::add))
        {
            reporter.success(TASK);
            reporter.rateLimited(2.345);
            reporter.timeoutRetrying(TASK);
            reporter.failedAfterRetries(TASK, 3);
            reporter.timedOut(TASK);
            reporter.error(TASK, "disk full");
        }
        assertEquals(List.of(
            "  ✓ d-c-PS001-Main-PSB-ABC.jpg",
            "  ⏸ Rate limit hit, waiting 2.3s...",
            "  ⏱ Timeout, retrying... d-c-PS001-Main-PSB-ABC.jpg",
            "  ✗ Failed after 3 attempts: d-c-PS001-Main-PSB-ABC.jpg",
            "  ✗ Timeout: d-c-PS001-Main-PSB-ABC.jpg",
            "  ✗ Error: d-c-PS001-Main-PSB-ABC.jpg - disk full"), sink);
    }

    @Test
    @Timeout(10)
    void testFailingSinkDoesNotStopReporter()
    {
        List<String> sink = new ArrayList<>();
        try(ConsoleReporter reporter = new ConsoleReporter(message -> {
            if(message.equals("bad")) throw new IllegalStateException("sink broke");
            sink.add(message);
        }))
        {
            reporter.report("first");
            reporter.report("bad");
            reporter.report("last");
        }
        assertEquals(List.of("first", "last"), sink);
    }

    @Test
    @Timeout(10)
    void testClosedReporterRejectsMessages()
    {
        ConsoleReporter reporter = new ConsoleReporter(message -> { });
        reporter.close();
        reporter.close();

        assertTrue(reporter.isClosed());
        assertThrows(IllegalStateException.class, () -> reporter.report("late"));
    }

    @Test
    void testNullSinkRejected()
    {
        assertThrows(IllegalArgumentException.class, () -> new ConsoleReporter(null));
    }
}
