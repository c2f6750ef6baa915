package io.rileyhe1.photofetch.Util;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the Google Drive file id out of a sharing link.
 * Handles {@code https://drive.google.com/open?id=FILE_ID} and
 * {@code https://drive.google.com/file/d/FILE_ID/view}; the query form wins when both are present.
 */
public final class IdentifierExtractor
{
    private static final List<Pattern> PATTERNS = List.of(
        Pattern.compile("id=([a-zA-Z0-9_-]+)"),
        Pattern.compile("/d/([a-zA-Z0-9_-]+)"));

    private IdentifierExtractor()
    {
    }

    public static Optional<String> extract(String reference)
    {
        if(reference == null || reference.trim().isEmpty())
        {
            return Optional.empty();
        }
        for(Pattern pattern : PATTERNS)
        {
            Matcher matcher = pattern.matcher(reference);
            if(matcher.find())
            {
                return Optional.of(matcher.group(1));
            }
        }
        return Optional.empty();
    }
}
