package io.rileyhe1.photofetch.Data;

/**
 * Result of executing one {@link DownloadTask}.
 */
public enum Outcome
{
    SUCCESS,
    SKIPPED,
    ERROR
}
