import io.rileyhe1.photofetch.Records.BatchDiscovery;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BatchDiscoveryTest
{
    private final BatchDiscovery discovery = new BatchDiscovery("-photo-links.csv");

    @Test
    void testFindsMatchingFilesInNameOrder(@TempDir Path dir) throws IOException
    {
        Files.writeString(dir.resolve("2-Purvi Champaran-photo-links.csv"), "");
        Files.writeString(dir.resolve("1-Paschim Champaran-photo-links.csv"), "");
        Files.writeString(dir.resolve("10-Sitamarhi-photo-links.csv"), "");
        Files.writeString(dir.resolve("summary.csv"), "");
        Files.writeString(dir.resolve("notes.txt"), "");
        Files.createDirectory(dir.resolve("3-Sheohar-photo-links.csv"));

        List<BatchDiscovery.BatchFile> batches = discovery.discover(dir);

        List<String> labels = new ArrayList<>();
        for(BatchDiscovery.BatchFile batch : batches) labels.add(batch.getLabel());
        // plain string order, as the files are listed
        assertEquals(List.of("1-Paschim Champaran", "10-Sitamarhi", "2-Purvi Champaran"), labels);
        assertEquals(dir.resolve("1-Paschim Champaran-photo-links.csv"), batches.get(0).getPath());
    }

    @Test
    void testEmptyDirectory(@TempDir Path dir) throws IOException
    {
        assertTrue(discovery.discover(dir).isEmpty());
    }

    @Test
    void testMissingDirectoryThrows(@TempDir Path dir)
    {
        assertThrows(IOException.class, () -> discovery.discover(dir.resolve("missing")));
    }

    @Test
    void testLabelOf()
    {
        assertEquals("1-Paschim Champaran", discovery.labelOf(Paths.get("in", "1-Paschim Champaran-photo-links.csv")));
        assertEquals("other.csv", discovery.labelOf(Paths.get("other.csv")));
    }

    @Test
    void testInvalidSuffix()
    {
        assertThrows(IllegalArgumentException.class, () -> new BatchDiscovery(""));
        assertThrows(IllegalArgumentException.class, () -> new BatchDiscovery(null));
    }
}
