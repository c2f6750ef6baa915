package io.rileyhe1.photofetch.Util;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.rileyhe1.photofetch.Data.DownloadTask;
import io.rileyhe1.photofetch.Data.Outcome;

/**
 * Runs a batch of tasks on a fixed number of workers.
 * <p>
 * Tasks go through a bounded channel that exactly {@code workerCount} worker threads take from,
 * so no more than that many tasks are ever in flight and the producer blocks while the channel is full.
 * {@link #runAll} returns once every task has an outcome; nothing is cancelled or abandoned.
 */
public class WorkerPool
{
    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    // end-of-batch marker, compared by identity
    private static final DownloadTask END_OF_BATCH = new DownloadTask("end-of-batch", Paths.get(""));

    private static final AtomicInteger poolNr = new AtomicInteger();

    private final int workerCount;
    private final int queueCapacity;

    public WorkerPool(int workerCount, int queueCapacity)
    {
        if(workerCount < 1) throw new IllegalArgumentException("Worker count must be at least 1");
        if(queueCapacity < 1) throw new IllegalArgumentException("Queue capacity must be at least 1");
        this.workerCount = workerCount;
        this.queueCapacity = queueCapacity;
    }

    /**
     * Executes {@code work} for every task and returns the outcomes in completion order.
     * Anything thrown by {@code work}, errors included, counts as {@link Outcome#ERROR} for that task.
     */
    public List<Outcome> runAll(List<DownloadTask> tasks, Function<DownloadTask, Outcome> work) throws InterruptedException
    {
        if(tasks == null) throw new IllegalArgumentException("Tasks cannot be null");
        if(work == null) throw new IllegalArgumentException("Work cannot be null");
        if(tasks.isEmpty()) return new ArrayList<>();

        BlockingQueue<DownloadTask> channel = new ArrayBlockingQueue<>(queueCapacity);
        BlockingQueue<Outcome> outcomes = new LinkedBlockingQueue<>();
        int threads = Math.min(workerCount, tasks.size());
        CountDownLatch workersDone = new CountDownLatch(threads);

        ExecutorService executorService = Executors.newFixedThreadPool(threads, workerThreadFactory());
        try
        {
            for(int i = 0; i < threads; i++)
            {
                executorService.submit(() -> consume(channel, outcomes, work, workersDone));
            }
            for(DownloadTask task : tasks)
            {
                channel.put(task);
            }
            for(int i = 0; i < threads; i++)
            {
                channel.put(END_OF_BATCH);
            }
            workersDone.await();
        }
        finally
        {
            executorService.shutdownNow();
            if(!executorService.awaitTermination(30, TimeUnit.SECONDS))
            {
                log.warn("Worker threads did not terminate within 30 seconds");
            }
        }

        List<Outcome> results = new ArrayList<>(tasks.size());
        outcomes.drainTo(results);
        return results;
    }

    private void consume(BlockingQueue<DownloadTask> channel, BlockingQueue<Outcome> outcomes,
                         Function<DownloadTask, Outcome> work, CountDownLatch workersDone)
    {
        try
        {
            while(true)
            {
                DownloadTask task = channel.take();
                if(task == END_OF_BATCH)
                {
                    return;
                }
                runOne(task, work, outcomes);
            }
        }
        catch(InterruptedException e)
        {
            Thread.currentThread().interrupt();
        }
        finally
        {
            workersDone.countDown();
        }
    }

    private static void runOne(DownloadTask task, Function<DownloadTask, Outcome> work, BlockingQueue<Outcome> outcomes)
    {
        Outcome outcome = Outcome.ERROR;
        try
        {
            Outcome result = work.apply(task);
            if(result != null)
            {
                outcome = result;
            }
        }
        catch(VirtualMachineError e)
        {
            log.error("Task {} aborted by a fatal error", task.getResourceId(), e);
            throw e;
        }
        catch(Throwable e)
        {
            // an Error must not kill the worker, otherwise the producer blocks on a full channel
            log.warn("Task {} failed unexpectedly", task.getResourceId(), e);
        }
        finally
        {
            outcomes.add(outcome);
        }
    }

    private static ThreadFactory workerThreadFactory()
    {
        int pool = poolNr.getAndIncrement();
        AtomicInteger workerNr = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, String.format("download-worker-%1$d-%2$d", pool, workerNr.getAndIncrement()));
            thread.setDaemon(true);
            return thread;
        };
    }

    public int getWorkerCount()
    {
        return workerCount;
    }

    public int getQueueCapacity()
    {
        return queueCapacity;
    }
}
