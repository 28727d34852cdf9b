package io.lexstream.core.citation;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class HttpRedirectProbe implements RedirectProbe {
    private static final Logger LOG = LoggerFactory.getLogger(HttpRedirectProbe.class);
    public static final String DEFAULT_USER_AGENT = "Mozilla/5.0 (iPhone; CPU iPhone OS 16_6 like Mac OS X) "
        + "AppleWebKit/605.1.15 (KHTML, like Gecko) Version/16.6 Mobile/15E148 Safari/604.1";
    private static final String ACCEPT = "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";

    private final OkHttpClient client;
    private final RedirectMarkers markers;
    private final String userAgent;

    public HttpRedirectProbe(RedirectMarkers markers, Duration timeout, String userAgent) {
        this(
            new OkHttpClient.Builder()
                .followRedirects(true)
                .followSslRedirects(true)
                .callTimeout(timeout)
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .build(),
            markers,
            userAgent
        );
    }

    public HttpRedirectProbe(OkHttpClient client, RedirectMarkers markers, String userAgent) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.markers = Objects.requireNonNull(markers, "markers must not be null");
        this.userAgent = userAgent == null || userAgent.isBlank() ? DEFAULT_USER_AGENT : userAgent;
    }

    @Override
    public Optional<String> follow(String redirectUri) {
        HttpUrl url = HttpUrl.parse(redirectUri);
        if (url == null) {
            LOG.warn("Cannot probe malformed citation link: {}", redirectUri);
            return Optional.empty();
        }

        try {
            Optional<String> viaHead = probe(url, "HEAD");
            if (viaHead.isPresent()) {
                return viaHead;
            }
        } catch (IOException e) {
            LOG.debug("HEAD probe failed for {}: {}", redirectUri, e.getMessage());
        }

        try {
            Optional<String> viaGet = probe(url, "GET");
            if (viaGet.isEmpty()) {
                LOG.warn("Citation link still unresolved after probing: {}", redirectUri);
            }
            return viaGet;
        } catch (IOException e) {
            LOG.warn("Could not follow citation link {}: {}", redirectUri, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<String> probe(HttpUrl url, String method) throws IOException {
        Request request = new Request.Builder()
            .url(url)
            .method(method, null)
            .header("User-Agent", userAgent)
            .header("Accept", ACCEPT)
            .build();

        try (Response response = client.newCall(request).execute()) {
            String finalUrl = response.request().url().toString();
            if (markers.isDestination(finalUrl)) {
                LOG.debug("Resolved {} via {} to {}", url, method, finalUrl);
                return Optional.of(finalUrl);
            }
            String location = response.header("Location");
            if (location != null && markers.isDestination(location.trim())) {
                return Optional.of(location.trim());
            }
            return Optional.empty();
        }
    }
}
