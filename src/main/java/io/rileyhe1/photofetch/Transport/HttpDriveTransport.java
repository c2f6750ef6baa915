package io.rileyhe1.photofetch.Transport;

import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.rileyhe1.photofetch.Data.FetchException;
import io.rileyhe1.photofetch.Data.FetchResult;
import io.rileyhe1.photofetch.Data.FetchTimeoutException;

/**
 * Fetches files in-process over HTTP from the Google Drive download endpoint.
 * <p>
 * The body is written to {@code DESTINATION.part} and moved into place when complete,
 * so a failed attempt never leaves a file that a later run would skip.
 */
public class HttpDriveTransport implements FetchTransport
{
    private static final Logger log = LoggerFactory.getLogger(HttpDriveTransport.class);

    public static final String DEFAULT_BASE_URL = "https://drive.google.com/uc?export=download&id=";
    private static final int HTTP_TOO_MANY_REQUESTS = 429;

    private final String baseUrl;

    public HttpDriveTransport()
    {
        this(DEFAULT_BASE_URL);
    }

    // the resource id is appended to baseUrl as is
    public HttpDriveTransport(String baseUrl)
    {
        if(baseUrl == null || baseUrl.trim().isEmpty()) throw new IllegalArgumentException("Base URL cannot be null or empty");
        this.baseUrl = baseUrl;
    }

    @Override
    public FetchResult fetch(String resourceId, Path destination, Duration timeout) throws FetchException
    {
        int timeoutMS = (int) Math.min(timeout.toMillis(), Integer.MAX_VALUE);
        Path partFile = destination.resolveSibling(destination.getFileName() + ".part");
        HttpURLConnection connection = null;
        try
        {
            connection = (HttpURLConnection) URI.create(baseUrl + resourceId).toURL().openConnection();
            connection.setRequestProperty("User-Agent", "Mozilla/5.0");
            connection.setConnectTimeout(timeoutMS);
            connection.setReadTimeout(timeoutMS);
            connection.setInstanceFollowRedirects(true);

            int responseCode = connection.getResponseCode();
            if(responseCode == HTTP_TOO_MANY_REQUESTS)
            {
                return FetchResult.failure("HTTP 429: too many requests");
            }
            if(responseCode == HttpURLConnection.HTTP_FORBIDDEN)
            {
                // Drive answers 403 when the daily download quota of a file is exceeded
                return FetchResult.failure("HTTP 403: access denied or download quota exceeded");
            }
            if(responseCode < 200 || responseCode >= 300)
            {
                return FetchResult.failure("HTTP " + responseCode + " " + connection.getResponseMessage());
            }
            String contentType = connection.getContentType();
            if(contentType != null && contentType.startsWith("text/html"))
            {
                // confirmation or sign-in page instead of the file itself
                return FetchResult.failure("Received an HTML page instead of file content");
            }

            try(InputStream in = connection.getInputStream())
            {
                Files.copy(in, partFile, StandardCopyOption.REPLACE_EXISTING);
            }
            Files.move(partFile, destination, StandardCopyOption.REPLACE_EXISTING);
            return FetchResult.success();
        }
        catch(SocketTimeoutException e)
        {
            deletePartFile(partFile);
            throw new FetchTimeoutException("No response within " + timeoutMS + "ms", e, resourceId, destination.toString());
        }
        catch(IOException | IllegalArgumentException e)
        {
            deletePartFile(partFile);
            throw new FetchException("HTTP fetch failed: " + e.getMessage(), e, resourceId, destination.toString());
        }
        finally
        {
            if(connection != null) connection.disconnect();
        }
    }

    private static void deletePartFile(Path partFile)
    {
        try
        {
            Files.deleteIfExists(partFile);
        }
        catch(IOException e)
        {
            log.debug("Could not delete partial file {}", partFile, e);
        }
    }

    @Override
    public String getName()
    {
        return "http";
    }

    public String getBaseUrl()
    {
        return baseUrl;
    }
}
