package io.lexstream.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.net.URI;
import java.util.Objects;
import java.util.UUID;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Source(String id, String title, String url, String snippet, String favicon) {

    public Source {
        id = id == null || id.isBlank() ? UUID.randomUUID().toString() : id;
        title = title == null ? "" : title;
        url = url == null ? "" : url;
    }

    public static Source of(String title, String url, String snippet) {
        return new Source(null, title, url, snippet, null);
    }

    public Source withUrl(String newUrl) {
        return new Source(id, title, newUrl, snippet, favicon);
    }

    public boolean sameCitation(Source other) {
        return other != null && url.equals(other.url) && title.equals(other.title);
    }

    @JsonIgnore
    public String domain() {
        try {
            String host = URI.create(url).getHost();
            if (host == null) {
                return url;
            }
            return host.startsWith("www.") ? host.substring(4) : host;
        } catch (IllegalArgumentException e) {
            return url;
        }
    }

    @JsonIgnore
    public String faviconUrl() {
        if (favicon != null && !favicon.isBlank()) {
            return favicon;
        }
        return "https://www.google.com/s2/favicons?domain=" + domain() + "&sz=64";
    }

    CitationKey key() {
        return new CitationKey(url, title);
    }

    record CitationKey(String url, String title) {
        CitationKey {
            Objects.requireNonNull(url, "url must not be null");
            Objects.requireNonNull(title, "title must not be null");
        }
    }
}
