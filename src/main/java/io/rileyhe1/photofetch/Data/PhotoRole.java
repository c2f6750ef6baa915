package io.rileyhe1.photofetch.Data;

/**
 * The photo columns of a polling station record, in the order they are processed.
 */
public enum PhotoRole
{
    PSB("Photo of Polling Station Building (PSB)"),
    PSP("Photo of Polling Station Premises with PS Building (PSP)");

    private final String columnName;

    PhotoRole(String columnName)
    {
        this.columnName = columnName;
    }

    public String getColumnName()
    {
        return columnName;
    }

    // short code used in file names
    public String getCode()
    {
        return name();
    }
}
