package io.lexstream.core.citation;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import okhttp3.HttpUrl;

public final class RedirectHeuristics {
    public static final List<String> QUERY_KEYS = List.of(
        "originalUrl",
        "url",
        "link",
        "source",
        "target",
        "redirect",
        "destination",
        "href",
        "source_url",
        "original_url"
    );
    public static final String DEFAULT_SCHEME = "https://";

    private static final Pattern EMBEDDED_URL = Pattern.compile("https?://[^\\s)?&]+");

    private final RedirectMarkers markers;

    public RedirectHeuristics(RedirectMarkers markers) {
        this.markers = markers;
    }

    public List<UrlHeuristic> chain() {
        return List.of(
            this::alreadyDestination,
            this::bareDomain,
            this::fromQueryParameters,
            this::fromFragment,
            this::fromEmbeddedUrl
        );
    }

    public Optional<String> alreadyDestination(String uri) {
        return markers.isDestination(uri) ? Optional.of(uri) : Optional.empty();
    }

    public Optional<String> bareDomain(String uri) {
        if (RedirectMarkers.isAbsolute(uri) || uri.contains("://")) {
            return Optional.empty();
        }
        if (!uri.contains(".") || uri.chars().anyMatch(Character::isWhitespace) || markers.isRedirect(uri)) {
            return Optional.empty();
        }
        return Optional.of(DEFAULT_SCHEME + uri);
    }

    public Optional<String> fromQueryParameters(String uri) {
        if (!markers.isRedirect(uri)) {
            return Optional.empty();
        }
        HttpUrl url = HttpUrl.parse(uri);
        if (url == null || url.querySize() == 0) {
            return Optional.empty();
        }
        for (String key : QUERY_KEYS) {
            for (int i = 0; i < url.querySize(); i++) {
                if (!url.queryParameterName(i).toLowerCase(Locale.ROOT).equals(key.toLowerCase(Locale.ROOT))) {
                    continue;
                }
                Optional<String> value = destination(url.queryParameterValue(i));
                if (value.isPresent()) {
                    return value;
                }
            }
        }
        for (int i = 0; i < url.querySize(); i++) {
            Optional<String> value = destination(url.queryParameterValue(i));
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    public Optional<String> fromFragment(String uri) {
        if (!markers.isRedirect(uri)) {
            return Optional.empty();
        }
        HttpUrl url = HttpUrl.parse(uri);
        if (url == null) {
            return Optional.empty();
        }
        return destination(url.fragment());
    }

    public Optional<String> fromEmbeddedUrl(String uri) {
        if (!markers.isRedirect(uri)) {
            return Optional.empty();
        }
        HttpUrl url = HttpUrl.parse(uri);
        if (url != null) {
            String path = "/" + String.join("/", url.pathSegments());
            if (path.contains("http")) {
                Optional<String> fromPath = firstEmbedded(path);
                if (fromPath.isPresent()) {
                    return fromPath;
                }
            }
        }
        return firstEmbedded(uri);
    }

    private Optional<String> firstEmbedded(String value) {
        Matcher matcher = EMBEDDED_URL.matcher(value);
        while (matcher.find()) {
            String candidate = matcher.group();
            if (!markers.isRedirect(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private Optional<String> destination(String rawValue) {
        if (rawValue == null || rawValue.isBlank()) {
            return Optional.empty();
        }
        String value = rawValue.trim();
        if (!RedirectMarkers.isAbsolute(value)) {
            value = percentDecode(value);
        }
        return markers.isDestination(value) ? Optional.of(value) : Optional.empty();
    }

    private static String percentDecode(String value) {
        try {
            return URLDecoder.decode(value.replace("+", "%2B"), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return value;
        }
    }
}
