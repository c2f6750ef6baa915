package io.rileyhe1.photofetch.Util;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.rileyhe1.photofetch.Data.DownloadTask;
import io.rileyhe1.photofetch.Data.PhotoRole;
import io.rileyhe1.photofetch.Records.RecordBatch;
import io.rileyhe1.photofetch.Records.RecordRow;

/**
 * Turns the rows of one batch into download tasks.
 * <p>
 * File names follow
 * {@code {district}-{constituency}-PS{station:000}-{stationType}-{role}-{fileId}{ext}},
 * e.g. {@code 1-Paschim_Champaran-4-Bagaha-PS007-Auxiliary-PSB-ABC123.jpg}.
 * Tasks come out in row order, and within a row in {@link PhotoRole} order.
 */
public class TaskBuilder
{
    private static final Logger log = LoggerFactory.getLogger(TaskBuilder.class);

    public static final String CONSTITUENCY_COLUMN = "AC No. & AC Name";
    public static final String STATION_NUMBER_COLUMN = "Polling Station No.";
    public static final String STATION_TYPE_COLUMN = "Polling Station Type";

    static final String UNKNOWN_CONSTITUENCY = "Unknown";
    private static final int STATION_NUMBER_WIDTH = 3;

    private final Path outputDirectory;
    private final String imageExtension;

    public TaskBuilder(Path outputDirectory, String imageExtension)
    {
        if(outputDirectory == null) throw new IllegalArgumentException("Output directory cannot be null");
        if(imageExtension == null || imageExtension.isEmpty()) throw new IllegalArgumentException("Image extension cannot be null or empty");
        this.outputDirectory = outputDirectory;
        this.imageExtension = imageExtension;
    }

    public List<DownloadTask> build(RecordBatch batch)
    {
        if(batch == null) throw new IllegalArgumentException("Batch cannot be null");

        String district = NameSanitizer.sanitize(batch.getLabel());
        List<DownloadTask> tasks = new ArrayList<>();
        Set<Path> seen = new HashSet<>();

        int rowNumber = 0;
        for(RecordRow row : batch.getRows())
        {
            rowNumber++;
            String constituency = constituencyOf(row.get(CONSTITUENCY_COLUMN));
            String station = zeroPad(strip(row.get(STATION_NUMBER_COLUMN)), STATION_NUMBER_WIDTH);
            String stationType = NameSanitizer.sanitize(strip(row.get(STATION_TYPE_COLUMN)));

            for(PhotoRole role : PhotoRole.values())
            {
                String link = row.get(role.getColumnName());
                if(strip(link).isEmpty())
                {
                    continue;
                }
                Optional<String> fileId = IdentifierExtractor.extract(link);
                if(fileId.isEmpty())
                {
                    log.debug("{} row {}: no file id in {} link '{}'", batch.getSourceName(), rowNumber, role.getCode(), link);
                    continue;
                }

                String fileName = district + "-" + constituency + "-PS" + station + "-" + stationType
                    + "-" + role.getCode() + "-" + fileId.get() + imageExtension;
                Path destination = outputDirectory.resolve(fileName);
                // a repeated row would point two workers at the same file
                if(!seen.add(destination))
                {
                    log.debug("{} row {}: duplicate destination {}", batch.getSourceName(), rowNumber, fileName);
                    continue;
                }
                tasks.add(new DownloadTask(fileId.get(), destination));
            }
        }
        return tasks;
    }

    // "4-Bagaha [1-Paschim Champaran]" -> "4-Bagaha"
    static String constituencyOf(String composite)
    {
        int bracket = composite.indexOf('[');
        String head = bracket >= 0 ? composite.substring(0, bracket) : composite;
        if(head.isEmpty())
        {
            return UNKNOWN_CONSTITUENCY;
        }
        return NameSanitizer.sanitize(strip(head));
    }

    // removes leading and trailing Unicode spaces, including no-break spaces that String.trim() keeps
    static String strip(String text)
    {
        int start = 0;
        int end = text.length();
        while(start < end && isSpace(text.charAt(start)))
        {
            start++;
        }
        while(end > start && isSpace(text.charAt(end - 1)))
        {
            end--;
        }
        return text.substring(start, end);
    }

    private static boolean isSpace(char c)
    {
        return Character.isWhitespace(c) || Character.isSpaceChar(c) || c == '\u0085';
    }

    // pads with zeros after any leading sign, so "7" -> "007" and "-7" -> "-07"
    static String zeroPad(String number, int width)
    {
        if(number.length() >= width)
        {
            return number;
        }
        StringBuilder padded = new StringBuilder(width);
        int digitsStart = 0;
        if(number.startsWith("+") || number.startsWith("-"))
        {
            padded.append(number.charAt(0));
            digitsStart = 1;
        }
        for(int i = number.length(); i < width; i++)
        {
            padded.append('0');
        }
        padded.append(number, digitsStart, number.length());
        return padded.toString();
    }
}
