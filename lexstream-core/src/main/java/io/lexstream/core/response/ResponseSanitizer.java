package io.lexstream.core.response;

import java.util.regex.Pattern;

public final class ResponseSanitizer {
    private static final Pattern SOURCES_SECTION = Pattern.compile("(?im)^[ \\t]*Sources?:?[ \\t]*$[\\s\\S]*\\z");
    private static final Pattern SOURCES_INLINE = Pattern.compile("(?im)^[ \\t]*Sources?:[\\s\\S]*\\z");
    private static final Pattern URL_UNAVAILABLE = Pattern.compile("(?i)\\(?URL unavailable\\)?");
    private static final Pattern URL_LABEL = Pattern.compile("(?i)\\bURL:\\s*");
    private static final Pattern SPACES = Pattern.compile(" {2,}");
    private static final Pattern BLANK_LINES = Pattern.compile("\\n{3,}");

    public String sanitize(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        String result = SOURCES_SECTION.matcher(text).replaceFirst("");
        result = SOURCES_INLINE.matcher(result).replaceFirst("");
        result = URL_UNAVAILABLE.matcher(result).replaceAll("");
        result = URL_LABEL.matcher(result).replaceAll("");
        result = SPACES.matcher(result).replaceAll(" ");
        result = BLANK_LINES.matcher(result).replaceAll("\n\n");
        result = result.strip();
        return result.isEmpty() ? text.strip() : result;
    }
}
