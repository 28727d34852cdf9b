package io.lexstream.core.citation;

import io.lexstream.core.model.Source;
import java.util.List;
import java.util.Locale;

public final class SourceFilter {
    public static final List<String> DEFAULT_DENYLIST = List.of(
        "dr.oracle",
        "oracle.ai",
        "oracle.com",
        "google.com/search",
        "google.com/url",
        "internal",
        "tool",
        "generated"
    );

    private final List<String> denylist;

    public SourceFilter(List<String> denylist) {
        this.denylist = (denylist == null ? DEFAULT_DENYLIST : denylist).stream()
            .filter(pattern -> pattern != null && !pattern.isBlank())
            .map(pattern -> pattern.toLowerCase(Locale.ROOT))
            .toList();
    }

    public static SourceFilter defaults() {
        return new SourceFilter(DEFAULT_DENYLIST);
    }

    public boolean keep(Source source) {
        String url = source.url().toLowerCase(Locale.ROOT);
        String title = source.title().toLowerCase(Locale.ROOT);
        for (String pattern : denylist) {
            if (url.contains(pattern) || title.contains(pattern)) {
                return false;
            }
        }
        return true;
    }

    public List<Source> filter(List<Source> sources) {
        return sources.stream().filter(this::keep).toList();
    }
}
