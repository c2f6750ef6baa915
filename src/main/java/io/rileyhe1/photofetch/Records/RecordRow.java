package io.rileyhe1.photofetch.Records;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One tabular record with fields addressed by column name.
 * A column the record does not have reads as an empty string.
 */
public final class RecordRow
{
    private final Map<String, String> fields;

    public RecordRow(Map<String, String> fields)
    {
        if(fields == null) throw new IllegalArgumentException("Fields cannot be null");
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public String get(String name)
    {
        String value = fields.get(name);
        return value != null ? value : "";
    }

    @Override
    public String toString()
    {
        return fields.toString();
    }
}
