package io.rileyhe1.photofetch.Records;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads one batch file into rows.
 */
public interface RecordSource
{
    RecordBatch read(Path file, String label) throws IOException;
}
