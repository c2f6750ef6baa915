package io.rileyhe1.photofetch.Records;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a UTF-8 CSV file whose first line is the header.
 */
public class CsvRecordSource implements RecordSource
{
    private static final Logger log = LoggerFactory.getLogger(CsvRecordSource.class);
    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final CSVFormat format;

    public CsvRecordSource()
    {
        this.format = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setAllowMissingColumnNames(true)
            .setIgnoreEmptyLines(true)
            .build();
    }

    @Override
    public RecordBatch read(Path file, String label) throws IOException
    {
        if(file == null) throw new IllegalArgumentException("File cannot be null");
        if(label == null) throw new IllegalArgumentException("Label cannot be null");

        List<RecordRow> rows = new ArrayList<>();
        try(Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8))
        {
            skipByteOrderMark(reader);
            try(CSVParser parser = format.parse(reader))
            {
                for(CSVRecord record : parser)
                {
                    // short records simply lack the trailing columns
                    rows.add(new RecordRow(record.toMap()));
                }
            }
        }
        log.debug("Read {} rows from {}", rows.size(), file);
        return new RecordBatch(label, file.getFileName().toString(), rows);
    }

    private static void skipByteOrderMark(Reader reader) throws IOException
    {
        reader.mark(1);
        int first = reader.read();
        if(first != BYTE_ORDER_MARK)
        {
            reader.reset();
        }
    }
}
