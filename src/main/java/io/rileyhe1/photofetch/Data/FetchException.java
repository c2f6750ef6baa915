package io.rileyhe1.photofetch.Data;

public class FetchException extends Exception
{
    private final String resourceId;
    private final String destination;

    // used when we don't have task context, e.g. while verifying a transport
    public FetchException(String message)
    {
        super(message);
        this.resourceId = null;
        this.destination = null;
    }

    public FetchException(String message, Throwable cause)
    {
        super(message, cause);
        this.resourceId = null;
        this.destination = null;
    }

    // used when the failing task is known
    public FetchException(String message, String resourceId, String destination)
    {
        super(message);
        this.resourceId = resourceId;
        this.destination = destination;
    }

    public FetchException(String message, Throwable cause, String resourceId, String destination)
    {
        super(message, cause);
        this.resourceId = resourceId;
        this.destination = destination;
    }

    public String getResourceId()
    {
        return resourceId;
    }

    public String getDestination()
    {
        return destination;
    }

    @Override
    public String toString()
    {
        StringBuilder sb = new StringBuilder(getClass().getSimpleName()).append(": ");
        sb.append(getMessage());

        if(resourceId != null)
        {
            sb.append(" [resourceId=").append(resourceId).append("]");
        }

        if(destination != null)
        {
            sb.append(" [destination=").append(destination).append("]");
        }

        if(getCause() != null)
        {
            sb.append(" caused by ").append(getCause().getClass().getSimpleName());
            sb.append(": ").append(getCause().getMessage());
        }

        return sb.toString();
    }
}
