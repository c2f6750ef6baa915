package io.rileyhe1.photofetch.Util;

import java.util.regex.Pattern;

public final class NameSanitizer
{
    // letters and numbers of any script, underscore, hyphen and dot are kept; combining marks are not
    private static final Pattern UNSAFE = Pattern.compile("[^\\p{L}\\p{N}_\\-.]");
    private static final Pattern UNDERSCORES = Pattern.compile("_+");

    private NameSanitizer()
    {
    }

    public static String sanitize(String text)
    {
        if(text == null) return "";
        String replaced = UNSAFE.matcher(text).replaceAll("_");
        return UNDERSCORES.matcher(replaced).replaceAll("_");
    }
}
