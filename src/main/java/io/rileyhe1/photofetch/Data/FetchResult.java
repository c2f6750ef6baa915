package io.rileyhe1.photofetch.Data;

/**
 * What a transport reports back for one completed fetch invocation.
 */
public class FetchResult
{
    private final boolean successful;
    private final String diagnostic;

    private FetchResult(boolean successful, String diagnostic)
    {
        this.successful = successful;
        this.diagnostic = diagnostic != null ? diagnostic : "";
    }

    public static FetchResult success()
    {
        return new FetchResult(true, "");
    }

    public static FetchResult success(String diagnostic)
    {
        return new FetchResult(true, diagnostic);
    }

    public static FetchResult failure(String diagnostic)
    {
        return new FetchResult(false, diagnostic);
    }

    public boolean isSuccessful()
    {
        return successful;
    }

    public String getDiagnostic()
    {
        return diagnostic;
    }

    @Override
    public String toString()
    {
        return "FetchResult[successful=" + successful + ", diagnostic=" + diagnostic + "]";
    }
}
