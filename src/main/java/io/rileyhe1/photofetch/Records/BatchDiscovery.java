package io.rileyhe1.photofetch.Records;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds the batch files of a run: every regular file in one directory whose
 * name ends with the batch suffix, in file name order.
 */
public class BatchDiscovery
{
    private final String suffix;

    public BatchDiscovery(String suffix)
    {
        if(suffix == null || suffix.isEmpty()) throw new IllegalArgumentException("Suffix cannot be null or empty");
        this.suffix = suffix;
    }

    public List<BatchFile> discover(Path directory) throws IOException
    {
        if(directory == null) throw new IllegalArgumentException("Directory cannot be null");
        if(!Files.isDirectory(directory))
        {
            throw new IOException("Input directory does not exist: " + directory);
        }
        List<Path> files;
        try(Stream<Path> listing = Files.list(directory))
        {
            files = listing
                .filter(Files::isRegularFile)
                .filter(path -> path.getFileName().toString().endsWith(suffix))
                .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                .collect(Collectors.toList());
        }
        List<BatchFile> batches = new ArrayList<>(files.size());
        for(Path file : files)
        {
            batches.add(new BatchFile(file, labelOf(file)));
        }
        return batches;
    }

    // "1-Paschim Champaran-photo-links.csv" -> "1-Paschim Champaran"
    public String labelOf(Path file)
    {
        String name = file.getFileName().toString();
        return name.endsWith(suffix) ? name.substring(0, name.length() - suffix.length()) : name;
    }

    public static final class BatchFile
    {
        private final Path path;
        private final String label;

        public BatchFile(Path path, String label)
        {
            this.path = path;
            this.label = label;
        }

        public Path getPath()
        {
            return path;
        }

        public String getLabel()
        {
            return label;
        }

        @Override
        public String toString()
        {
            return label + " (" + path + ")";
        }
    }
}
