package io.rileyhe1.photofetch.Transport;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.rileyhe1.photofetch.Data.FetchException;
import io.rileyhe1.photofetch.Data.FetchResult;
import io.rileyhe1.photofetch.Data.FetchTimeoutException;

/**
 * Fetches files by running the {@code gdown} command line tool, one process per attempt:
 * <pre>
 * gdown https://drive.google.com/uc?id=FILE_ID -O DESTINATION --quiet
 * </pre>
 * Exit code 0 means success; whatever the tool wrote to stderr is the diagnostic.
 */
public class GdownTransport implements FetchTransport
{
    private static final Logger log = LoggerFactory.getLogger(GdownTransport.class);

    static final String DOWNLOAD_URL = "https://drive.google.com/uc?id=";
    private static final long CHECK_TIMEOUT_SECONDS = 30;
    private static final long INSTALL_TIMEOUT_SECONDS = 300;

    private final String command;
    private final String pythonCommand;

    public GdownTransport()
    {
        this("gdown", "python3");
    }

    public GdownTransport(String command, String pythonCommand)
    {
        if(command == null || command.trim().isEmpty()) throw new IllegalArgumentException("Command cannot be null or empty");
        if(pythonCommand == null || pythonCommand.trim().isEmpty()) throw new IllegalArgumentException("Python command cannot be null or empty");
        this.command = command;
        this.pythonCommand = pythonCommand;
    }

    @Override
    public FetchResult fetch(String resourceId, Path destination, Duration timeout)
        throws FetchException, InterruptedException
    {
        List<String> cmd = List.of(command, DOWNLOAD_URL + resourceId, "-O", destination.toString(), "--quiet");

        Path errorLog;
        try
        {
            errorLog = Files.createTempFile("gdown-", ".err");
        }
        catch(IOException e)
        {
            throw new FetchException("Could not create diagnostic file", e, resourceId, destination.toString());
        }

        try
        {
            Process process;
            try
            {
                process = new ProcessBuilder(cmd)
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .redirectError(errorLog.toFile())
                    .start();
            }
            catch(IOException e)
            {
                throw new FetchException("Could not start " + command, e, resourceId, destination.toString());
            }

            boolean finished;
            try
            {
                finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            }
            catch(InterruptedException e)
            {
                process.destroyForcibly();
                throw e;
            }
            if(!finished)
            {
                process.destroyForcibly();
                throw new FetchTimeoutException("gdown did not finish within " + timeout.toSeconds() + "s",
                    resourceId, destination.toString());
            }

            String diagnostic = readDiagnostic(errorLog, resourceId, destination);
            return process.exitValue() == 0 ? FetchResult.success(diagnostic) : FetchResult.failure(diagnostic);
        }
        finally
        {
            deleteQuietly(errorLog);
        }
    }

    /**
     * Runs {@code gdown --version}; if that fails, tries {@code python3 -m pip install gdown} once and checks again.
     */
    @Override
    public void verifyAvailable() throws FetchException, InterruptedException
    {
        if(runsSuccessfully(List.of(command, "--version"), CHECK_TIMEOUT_SECONDS))
        {
            return;
        }
        log.warn("{} is not installed. Installing...", command);
        if(!runsSuccessfully(List.of(pythonCommand, "-m", "pip", "install", "gdown"), INSTALL_TIMEOUT_SECONDS))
        {
            throw new FetchException("Could not install gdown with " + pythonCommand + " -m pip");
        }
        if(!runsSuccessfully(List.of(command, "--version"), CHECK_TIMEOUT_SECONDS))
        {
            throw new FetchException(command + " is still not runnable after installing gdown");
        }
    }

    private static boolean runsSuccessfully(List<String> cmd, long timeoutSeconds) throws InterruptedException
    {
        Process process;
        try
        {
            process = new ProcessBuilder(new ArrayList<>(cmd))
                .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                .redirectError(ProcessBuilder.Redirect.DISCARD)
                .start();
        }
        catch(IOException e)
        {
            log.debug("Could not run {}", cmd, e);
            return false;
        }
        if(!process.waitFor(timeoutSeconds, TimeUnit.SECONDS))
        {
            process.destroyForcibly();
            log.debug("{} did not finish within {}s", cmd, timeoutSeconds);
            return false;
        }
        return process.exitValue() == 0;
    }

    private static String readDiagnostic(Path errorLog, String resourceId, Path destination) throws FetchException
    {
        try
        {
            return new String(Files.readAllBytes(errorLog), StandardCharsets.UTF_8);
        }
        catch(IOException e)
        {
            throw new FetchException("Could not read gdown output", e, resourceId, destination.toString());
        }
    }

    private static void deleteQuietly(Path file)
    {
        try
        {
            Files.deleteIfExists(file);
        }
        catch(IOException e)
        {
            log.debug("Could not delete {}", file, e);
        }
    }

    @Override
    public String getName()
    {
        return "gdown";
    }

    public String getCommand()
    {
        return command;
    }
}
