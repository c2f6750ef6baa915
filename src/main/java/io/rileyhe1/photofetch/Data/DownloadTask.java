package io.rileyhe1.photofetch.Data;

import java.nio.file.Path;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A single photo to fetch: the remote resource id and the file it is written to.
 * Immutable once built.
 */
public final class DownloadTask
{
    private static final Pattern RESOURCE_ID = Pattern.compile("[A-Za-z0-9_-]+");

    private final String resourceId;
    private final Path destinationPath;

    public DownloadTask(String resourceId, Path destinationPath)
    {
        if(resourceId == null || resourceId.isEmpty())
        {
            throw new IllegalArgumentException("Resource id cannot be null or empty");
        }
        if(!RESOURCE_ID.matcher(resourceId).matches())
        {
            throw new IllegalArgumentException("Resource id contains invalid characters: " + resourceId);
        }
        if(destinationPath == null)
        {
            throw new IllegalArgumentException("Destination path cannot be null");
        }
        this.resourceId = resourceId;
        this.destinationPath = destinationPath;
    }

    public String getResourceId()
    {
        return resourceId;
    }

    public Path getDestinationPath()
    {
        return destinationPath;
    }

    public String getFileName()
    {
        Path fileName = destinationPath.getFileName();
        return fileName != null ? fileName.toString() : destinationPath.toString();
    }

    @Override
    public boolean equals(Object o)
    {
        if(this == o) return true;
        if(!(o instanceof DownloadTask)) return false;
        DownloadTask other = (DownloadTask) o;
        return resourceId.equals(other.resourceId) && destinationPath.equals(other.destinationPath);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(resourceId, destinationPath);
    }

    @Override
    public String toString()
    {
        return "DownloadTask[resourceId=" + resourceId + ", destination=" + destinationPath + "]";
    }
}
