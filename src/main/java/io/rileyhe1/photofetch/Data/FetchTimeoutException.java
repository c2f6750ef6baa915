package io.rileyhe1.photofetch.Data;

/**
 * Thrown by a transport when a fetch does not finish within its timeout.
 * Unlike other {@link FetchException}s this one is retried.
 */
public class FetchTimeoutException extends FetchException
{
    public FetchTimeoutException(String message, String resourceId, String destination)
    {
        super(message, resourceId, destination);
    }

    public FetchTimeoutException(String message, Throwable cause, String resourceId, String destination)
    {
        super(message, cause, resourceId, destination);
    }
}
