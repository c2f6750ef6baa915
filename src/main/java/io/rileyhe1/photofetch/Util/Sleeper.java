package io.rileyhe1.photofetch.Util;

/**
 * Waits between fetch attempts. Swapped out in tests so retry timing can be checked without waiting.
 */
@FunctionalInterface
public interface Sleeper
{
    Sleeper SYSTEM = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
