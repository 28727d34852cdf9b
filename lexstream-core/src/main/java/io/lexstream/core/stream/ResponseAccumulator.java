package io.lexstream.core.stream;

import io.lexstream.core.model.AssembledResponse;
import io.lexstream.core.model.CitationFragment;
import io.lexstream.core.model.Source;
import io.lexstream.core.model.SourceList;
import io.lexstream.core.wire.GenerateContentChunk;
import io.lexstream.core.wire.GenerateContentChunk.Candidate;
import java.net.URI;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ResponseAccumulator {
    private static final Logger LOG = LoggerFactory.getLogger(ResponseAccumulator.class);
    private static final Pattern HTTP_URL = Pattern.compile("https?://[^\\s)]+");
    private static final Pattern HTTP_HOST = Pattern.compile("https?://([^\\s/]+)");
    private static final List<String> TITLE_PREFIXES = List.of("Source: ", "From: ", "Cited from: ");

    private final StringBuilder text = new StringBuilder();
    private final SourceList sources = new SourceList();
    private GenerateContentChunk lastPayload;
    private int appliedDeltas;

    public void apply(ResponseDelta delta) {
        text.append(delta.text());
        delta.citations().forEach(this::addFragment);
        appliedDeltas++;
    }

    public void apply(GenerateContentChunk chunk) {
        lastPayload = chunk;
        apply(ChunkDecoder.toDelta(chunk));
    }

    public String text() {
        return text.toString();
    }

    public List<Source> sources() {
        return sources.toList();
    }

    public int appliedDeltas() {
        return appliedDeltas;
    }

    /**
     * Ends accumulation. Citations are sometimes only attached to the terminal event, so the
     * last parsed payload is scanned again across all of its candidates before returning.
     */
    public AssembledResponse finish() {
        if (lastPayload != null) {
            int before = sources.size();
            for (Candidate candidate : lastPayload.candidates()) {
                ChunkDecoder.fragments(candidate).forEach(this::addFragment);
            }
            if (sources.size() > before) {
                LOG.debug("Final extraction pass recovered {} source(s)", sources.size() - before);
            }
        }
        return new AssembledResponse(text.toString(), sources.toList(), List.of());
    }

    private void addFragment(CitationFragment fragment) {
        toSource(fragment).ifPresent(sources::add);
    }

    static Optional<Source> toSource(CitationFragment fragment) {
        String title = fragment.title();
        if (title.isEmpty()) {
            LOG.debug("Skipping citation without title (uri: {})", fragment.uri().isEmpty() ? "empty" : "present");
            return Optional.empty();
        }

        String url = fragment.uri();
        if (url.isEmpty() || isBareDomain(url)) {
            Matcher inTitle = HTTP_URL.matcher(title);
            if (inTitle.find()) {
                url = inTitle.group();
            }
        }
        if (url.isEmpty()) {
            String domain = domainFromTitle(title);
            if (domain.isEmpty()) {
                LOG.debug("Skipping citation '{}' without a usable link", title);
                return Optional.empty();
            }
            url = "https://" + domain;
        }
        return Optional.of(Source.of(title, url, fragment.snippet()));
    }

    static boolean isBareDomain(String value) {
        return !value.startsWith("http://")
            && !value.startsWith("https://")
            && value.contains(".")
            && !value.contains("/")
            && value.chars().noneMatch(Character::isWhitespace);
    }

    static String domainFromTitle(String rawTitle) {
        String candidate = rawTitle.trim();
        for (String prefix : TITLE_PREFIXES) {
            if (candidate.startsWith(prefix)) {
                candidate = candidate.substring(prefix.length());
            }
        }
        if (candidate.contains(".") && candidate.chars().noneMatch(Character::isWhitespace)) {
            return candidate;
        }
        Matcher matcher = HTTP_HOST.matcher(candidate);
        if (matcher.find()) {
            try {
                String host = URI.create(matcher.group()).getHost();
                return host == null ? "" : host;
            } catch (IllegalArgumentException e) {
                return "";
            }
        }
        return "";
    }
}
