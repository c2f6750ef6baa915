package io.rileyhe1.photofetch.Records;

import java.util.Collections;
import java.util.List;

/**
 * All rows of one record file, labelled by the district the file belongs to.
 */
public final class RecordBatch
{
    private final String label;
    private final String sourceName;
    private final List<RecordRow> rows;

    public RecordBatch(String label, String sourceName, List<RecordRow> rows)
    {
        if(label == null) throw new IllegalArgumentException("Label cannot be null");
        if(rows == null) throw new IllegalArgumentException("Rows cannot be null");
        this.label = label;
        this.sourceName = sourceName != null ? sourceName : label;
        this.rows = List.copyOf(rows);
    }

    public String getLabel()
    {
        return label;
    }

    public String getSourceName()
    {
        return sourceName;
    }

    public List<RecordRow> getRows()
    {
        return Collections.unmodifiableList(rows);
    }

    public int size()
    {
        return rows.size();
    }
}
