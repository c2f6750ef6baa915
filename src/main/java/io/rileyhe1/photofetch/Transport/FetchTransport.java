package io.rileyhe1.photofetch.Transport;

import java.nio.file.Path;
import java.time.Duration;

import io.rileyhe1.photofetch.Data.FetchException;
import io.rileyhe1.photofetch.Data.FetchResult;
import io.rileyhe1.photofetch.Data.FetchTimeoutException;

/**
 * Retrieves one remote file into a local path.
 * <p>
 * Implementations must be safe to call from several workers at once for distinct destinations,
 * and must not prompt for input.
 */
public interface FetchTransport
{
    /**
     * Fetches {@code resourceId} into {@code destination}.
     *
     * @return whether the transport considers the fetch successful, with its diagnostic output
     * @throws FetchTimeoutException if the fetch did not finish within {@code timeout}
     * @throws FetchException if the transport itself failed (process could not start, I/O fault, ...)
     */
    FetchResult fetch(String resourceId, Path destination, Duration timeout)
        throws FetchException, InterruptedException;

    /**
     * Checks that the transport can be used, repairing it where possible.
     *
     * @throws FetchException if it is not usable
     */
    default void verifyAvailable() throws FetchException, InterruptedException
    {
    }

    String getName();
}
