package io.lexstream.core.citation;

import java.util.List;
import java.util.Locale;

public final class RedirectMarkers {
    public static final List<String> DEFAULT_MARKERS = List.of("vertexaisearch", "grounding-api-redirect");

    private final List<String> markers;

    public RedirectMarkers(List<String> markers) {
        List<String> configured = markers == null || markers.isEmpty() ? DEFAULT_MARKERS : markers;
        this.markers = configured.stream()
            .filter(marker -> marker != null && !marker.isBlank())
            .map(marker -> marker.toLowerCase(Locale.ROOT))
            .toList();
    }

    public static RedirectMarkers defaults() {
        return new RedirectMarkers(DEFAULT_MARKERS);
    }

    public boolean isRedirect(String uri) {
        if (uri == null) {
            return false;
        }
        String lower = uri.toLowerCase(Locale.ROOT);
        return markers.stream().anyMatch(lower::contains);
    }

    public boolean isDestination(String uri) {
        return isAbsolute(uri) && !isRedirect(uri);
    }

    public static boolean isAbsolute(String uri) {
        if (uri == null) {
            return false;
        }
        String lower = uri.toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://");
    }

    public List<String> markers() {
        return markers;
    }
}
