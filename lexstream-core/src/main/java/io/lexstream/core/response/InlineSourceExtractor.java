package io.lexstream.core.response;

import io.lexstream.core.model.Source;
import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class InlineSourceExtractor {
    private static final Pattern ABSOLUTE_URL = Pattern.compile("https?://[A-Za-z0-9.\\-/_?=#%&+:;,]+[A-Za-z0-9/#]");
    private static final Pattern BARE_DOMAIN = Pattern.compile("(?<![/@\\w.-])([A-Za-z0-9-]+\\.(?:[A-Za-z0-9-]+\\.)*[A-Za-z]{2,})\\b(?![/\\w-])");
    private static final String TRAILING_PUNCTUATION = ".,);]";

    public List<Source> extract(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        Set<String> seen = new LinkedHashSet<>();
        List<Source> sources = new ArrayList<>();

        Matcher urls = ABSOLUTE_URL.matcher(text);
        while (urls.find()) {
            String url = trimTrailing(urls.group());
            if (url.isEmpty() || !seen.add(url)) {
                continue;
            }
            sources.add(Source.of(hostOf(url), url, null));
        }

        String withoutUrls = ABSOLUTE_URL.matcher(text).replaceAll(" ");
        Matcher domains = BARE_DOMAIN.matcher(withoutUrls);
        while (domains.find()) {
            String domain = trimTrailing(domains.group(1)).toLowerCase(Locale.ROOT);
            String url = "https://" + domain;
            if (domain.isEmpty() || !seen.add(url)) {
                continue;
            }
            sources.add(Source.of(domain, url, null));
        }
        return sources;
    }

    private static String trimTrailing(String value) {
        int end = value.length();
        while (end > 0 && TRAILING_PUNCTUATION.indexOf(value.charAt(end - 1)) >= 0) {
            end--;
        }
        return value.substring(0, end);
    }

    private static String hostOf(String url) {
        try {
            String host = URI.create(url).getHost();
            return host == null ? url : host;
        } catch (IllegalArgumentException e) {
            return url;
        }
    }
}
