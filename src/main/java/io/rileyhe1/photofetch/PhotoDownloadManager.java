package io.rileyhe1.photofetch;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.rileyhe1.photofetch.Data.BatchSummary;
import io.rileyhe1.photofetch.Data.DownloadTask;
import io.rileyhe1.photofetch.Data.FetchConfig;
import io.rileyhe1.photofetch.Data.FetchException;
import io.rileyhe1.photofetch.Data.Outcome;
import io.rileyhe1.photofetch.Data.RunReport;
import io.rileyhe1.photofetch.Records.BatchDiscovery;
import io.rileyhe1.photofetch.Records.RecordBatch;
import io.rileyhe1.photofetch.Records.RecordSource;
import io.rileyhe1.photofetch.Transport.FetchTransport;
import io.rileyhe1.photofetch.Util.BatchAggregator;
import io.rileyhe1.photofetch.Util.ConsoleReporter;
import io.rileyhe1.photofetch.Util.FetchExecutor;
import io.rileyhe1.photofetch.Util.TaskBuilder;
import io.rileyhe1.photofetch.Util.WorkerPool;

/**
 * Drives a whole run: batches are processed one after another in file name order,
 * the downloads inside a batch run on the worker pool.
 */
public class PhotoDownloadManager
{
    private static final Logger log = LoggerFactory.getLogger(PhotoDownloadManager.class);

    static final String TOTAL_LABEL = "TOTAL";
    private static final String RULE = "=".repeat(60);

    private final FetchConfig config;
    private final FetchTransport transport;
    private final RecordSource recordSource;
    private final ConsoleReporter reporter;
    private final Path outputDirectory;
    private final TaskBuilder taskBuilder;
    private final FetchExecutor fetchExecutor;
    private final WorkerPool workerPool;
    private final BatchDiscovery batchDiscovery;

    public PhotoDownloadManager(FetchConfig config, FetchTransport transport, RecordSource recordSource, ConsoleReporter reporter)
    {
        this(config, transport, recordSource, reporter, new FetchExecutor(transport, config, reporter));
    }

    public PhotoDownloadManager(FetchConfig config, FetchTransport transport, RecordSource recordSource,
                                ConsoleReporter reporter, FetchExecutor fetchExecutor)
    {
        if(config == null) throw new IllegalArgumentException("Config cannot be null");
        if(transport == null) throw new IllegalArgumentException("Transport cannot be null");
        if(recordSource == null) throw new IllegalArgumentException("Record source cannot be null");
        if(reporter == null) throw new IllegalArgumentException("Reporter cannot be null");
        if(fetchExecutor == null) throw new IllegalArgumentException("Fetch executor cannot be null");
        this.config = config;
        this.transport = transport;
        this.recordSource = recordSource;
        this.reporter = reporter;
        this.outputDirectory = Paths.get(config.getOutputDirectory());
        this.taskBuilder = new TaskBuilder(outputDirectory, config.getImageExtension());
        this.fetchExecutor = fetchExecutor;
        this.workerPool = new WorkerPool(config.getWorkerCount(), config.getQueueCapacity());
        this.batchDiscovery = new BatchDiscovery(config.getBatchSuffix());
    }

    /**
     * Creates the output directory and makes sure the transport can be used.
     */
    public void prepare() throws IOException, FetchException, InterruptedException
    {
        Files.createDirectories(outputDirectory);
        transport.verifyAvailable();
    }

    public RunReport run(Path inputDirectory) throws IOException, InterruptedException
    {
        String startedAt = Instant.now().toString();
        List<BatchDiscovery.BatchFile> batchFiles = batchDiscovery.discover(inputDirectory);
        reporter.report("Found " + batchFiles.size() + " photo-links CSV files");

        List<BatchSummary> summaries = new ArrayList<>();
        BatchAggregator total = new BatchAggregator();
        for(BatchDiscovery.BatchFile batchFile : batchFiles)
        {
            reporter.report("");
            reporter.report("Processing: " + batchFile.getPath().getFileName());
            RecordBatch batch = recordSource.read(batchFile.getPath(), batchFile.getLabel());
            BatchSummary summary = processBatch(batch);
            summaries.add(summary);
            total.record(summary);
        }

        BatchSummary grandTotal = total.snapshot(TOTAL_LABEL);
        reportTotal(grandTotal);
        return new RunReport(outputDirectory.toString(), startedAt, Instant.now().toString(), summaries, grandTotal);
    }

    public BatchSummary processBatch(RecordBatch batch) throws InterruptedException
    {
        if(batch == null) throw new IllegalArgumentException("Batch cannot be null");
        reporter.report("District: " + batch.getLabel());

        List<DownloadTask> tasks = taskBuilder.build(batch);
        reporter.report("  Downloading " + tasks.size() + " photos with " + config.getWorkerCount() + " parallel workers...");
        log.debug("Batch {}: {} rows, {} tasks", batch.getLabel(), batch.size(), tasks.size());

        List<Outcome> outcomes = workerPool.runAll(tasks, fetchExecutor::execute);
        BatchSummary summary = BatchAggregator.fold(batch.getLabel(), outcomes);

        reporter.report("");
        reporter.report("Summary for " + batch.getLabel() + ":");
        reporter.report("  Downloaded: " + summary.getDownloaded());
        reporter.report("  Skipped (existing): " + summary.getSkipped());
        reporter.report("  Errors: " + summary.getErrors());
        return summary;
    }

    private void reportTotal(BatchSummary total)
    {
        reporter.report("");
        reporter.report(RULE);
        reporter.report("TOTAL SUMMARY:");
        reporter.report("  Total Downloaded: " + total.getDownloaded());
        reporter.report("  Total Skipped (existing): " + total.getSkipped());
        reporter.report("  Total Errors: " + total.getErrors());
        reporter.report(RULE);
    }

    public void saveReport(RunReport report, Path file) throws IOException
    {
        if(report == null) throw new IllegalArgumentException("Report cannot be null");
        if(file == null) throw new IllegalArgumentException("File cannot be null");

        Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
        Path parent = file.toAbsolutePath().getParent();
        if(parent != null)
        {
            Files.createDirectories(parent);
        }
        try(Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8))
        {
            gson.toJson(report, writer);
        }
        log.debug("Wrote run report to {}", file);
    }

    public static RunReport loadReport(Path file) throws IOException
    {
        if(file == null) throw new IllegalArgumentException("File cannot be null");
        try(Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8))
        {
            RunReport report = new Gson().fromJson(reader, RunReport.class);
            if(report == null)
            {
                throw new IOException("Report file is empty: " + file);
            }
            return report;
        }
        catch(JsonParseException e)
        {
            throw new IOException("Malformed report file: " + file, e);
        }
    }

    public FetchConfig getConfig()
    {
        return config;
    }

    public Path getOutputDirectory()
    {
        return outputDirectory;
    }
}
