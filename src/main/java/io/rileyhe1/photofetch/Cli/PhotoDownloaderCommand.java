package io.rileyhe1.photofetch.Cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.rileyhe1.photofetch.PhotoDownloadManager;
import io.rileyhe1.photofetch.Data.FetchConfig;
import io.rileyhe1.photofetch.Data.FetchException;
import io.rileyhe1.photofetch.Data.RunReport;
import io.rileyhe1.photofetch.Records.CsvRecordSource;
import io.rileyhe1.photofetch.Transport.FetchTransport;
import io.rileyhe1.photofetch.Transport.GdownTransport;
import io.rileyhe1.photofetch.Transport.HttpDriveTransport;
import io.rileyhe1.photofetch.Util.ConsoleReporter;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "photo-downloader",
    mixinStandardHelpOptions = true,
    description = "Downloads the polling station photos linked from every *-photo-links.csv file "
        + "in the input directory. Photos already present in the output directory are skipped.",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {
        "0: run completed (failed photos are counted in the summary)",
        "1: setup failed (transport unavailable, unreadable input, report not written)",
        "2: invalid command line"
    })
public class PhotoDownloaderCommand implements Callable<Integer>
{
    private static final Logger log = LoggerFactory.getLogger(PhotoDownloaderCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_SETUP_FAILED = 1;

    public enum TransportKind
    {
        gdown,
        http
    }

    @Option(names = {"-i", "--input-dir"}, defaultValue = ".",
        description = "Directory holding the photo-links CSV files (default: ${DEFAULT-VALUE})")
    private Path inputDirectory;

    @Option(names = {"-o", "--output-dir"}, defaultValue = "photos",
        description = "Directory the photos are written to (default: ${DEFAULT-VALUE})")
    private String outputDirectory;

    @Option(names = {"-w", "--workers"}, defaultValue = "3",
        description = "Parallel downloads per batch (default: ${DEFAULT-VALUE})")
    private int workers;

    @Option(names = {"-r", "--max-retries"}, defaultValue = "3",
        description = "Attempts per photo (default: ${DEFAULT-VALUE})")
    private int maxRetries;

    @Option(names = {"-t", "--timeout"}, defaultValue = "90",
        description = "Seconds one download attempt may take (default: ${DEFAULT-VALUE})")
    private int timeoutSeconds;

    @Option(names = {"--transport"}, defaultValue = "gdown",
        description = "How files are fetched, one of ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private TransportKind transportKind;

    @Option(names = {"--gdown-command"}, defaultValue = "gdown",
        description = "gdown executable (default: ${DEFAULT-VALUE})")
    private String gdownCommand;

    @Option(names = {"--python-command"}, defaultValue = "python3",
        description = "Python used to install gdown when it is missing (default: ${DEFAULT-VALUE})")
    private String pythonCommand;

    @Option(names = {"--report"},
        description = "Also write the run summary as JSON to this file")
    private Path reportFile;

    public static void main(String[] args)
    {
        int exitCode = new CommandLine(new PhotoDownloaderCommand())
            .setCaseInsensitiveEnumValuesAllowed(true)
            .execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call()
    {
        FetchConfig config;
        try
        {
            config = FetchConfig.builder()
                .workerCount(workers)
                .maxRetries(maxRetries)
                .fetchTimeoutSeconds(timeoutSeconds)
                .outputDirectory(outputDirectory)
                .build();
        }
        catch(IllegalArgumentException e)
        {
            log.error("Invalid option: {}", e.getMessage());
            return CommandLine.ExitCode.USAGE;
        }

        try(ConsoleReporter reporter = new ConsoleReporter())
        {
            PhotoDownloadManager manager = new PhotoDownloadManager(config, createTransport(), new CsvRecordSource(), reporter);
            manager.prepare();
            RunReport report = manager.run(inputDirectory);
            if(reportFile != null)
            {
                manager.saveReport(report, reportFile);
            }
            return EXIT_OK;
        }
        catch(FetchException e)
        {
            log.error("Transport unavailable: {}", e.getMessage(), e);
            return EXIT_SETUP_FAILED;
        }
        catch(IOException e)
        {
            log.error("Run failed: {}", e.getMessage(), e);
            return EXIT_SETUP_FAILED;
        }
        catch(InterruptedException e)
        {
            Thread.currentThread().interrupt();
            log.error("Run interrupted");
            return EXIT_SETUP_FAILED;
        }
    }

    FetchTransport createTransport()
    {
        if(transportKind == TransportKind.http)
        {
            return new HttpDriveTransport();
        }
        return new GdownTransport(gdownCommand, pythonCommand);
    }
}
