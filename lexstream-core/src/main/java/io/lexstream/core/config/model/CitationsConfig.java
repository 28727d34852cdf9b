package io.lexstream.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.lexstream.core.citation.HttpRedirectProbe;
import io.lexstream.core.citation.RedirectMarkers;
import io.lexstream.core.citation.SourceFilter;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CitationsConfig(
    @JsonAlias({"probe_enabled"}) boolean probeEnabled,
    @JsonAlias({"probe_timeout_seconds"}) int probeTimeoutSeconds,
    @JsonAlias({"resolve_timeout_seconds"}) int resolveTimeoutSeconds,
    @JsonAlias({"max_concurrent_probes"}) int maxConcurrentProbes,
    @JsonAlias({"redirect_markers"}) List<String> redirectMarkers,
    List<String> denylist,
    @JsonAlias({"user_agent"}) String userAgent
) {

    public CitationsConfig {
        redirectMarkers = redirectMarkers == null ? RedirectMarkers.DEFAULT_MARKERS : List.copyOf(redirectMarkers);
        denylist = denylist == null ? SourceFilter.DEFAULT_DENYLIST : List.copyOf(denylist);
        userAgent = userAgent == null || userAgent.isBlank() ? HttpRedirectProbe.DEFAULT_USER_AGENT : userAgent;
    }

    public static CitationsConfig defaults() {
        return new CitationsConfig(
            true,
            10,
            12,
            4,
            RedirectMarkers.DEFAULT_MARKERS,
            SourceFilter.DEFAULT_DENYLIST,
            HttpRedirectProbe.DEFAULT_USER_AGENT
        );
    }
}
