package io.lexstream.core.wire;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GenerateContentChunk(List<Candidate> candidates) {

    public GenerateContentChunk {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    public Candidate firstCandidate() {
        return candidates.isEmpty() ? Candidate.EMPTY : candidates.get(0);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Candidate(Content content, GroundingMetadata groundingMetadata, String finishReason) {
        static final Candidate EMPTY = new Candidate(null, null, null);

        public Candidate {
            content = content == null ? Content.EMPTY : content;
            groundingMetadata = groundingMetadata == null ? GroundingMetadata.EMPTY : groundingMetadata;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Content(String role, List<Part> parts) {
        static final Content EMPTY = new Content(null, null);

        public Content {
            parts = parts == null ? List.of() : List.copyOf(parts);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Part(String text, Boolean thought) {

        public boolean isAnswerText() {
            return text != null && !Boolean.TRUE.equals(thought);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GroundingMetadata(List<GroundingChunk> groundingChunks, List<String> webSearchQueries) {
        static final GroundingMetadata EMPTY = new GroundingMetadata(null, null);

        public GroundingMetadata {
            groundingChunks = groundingChunks == null ? List.of() : List.copyOf(groundingChunks);
            webSearchQueries = webSearchQueries == null ? List.of() : List.copyOf(webSearchQueries);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GroundingChunk(WebReference web) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record WebReference(
        String uri,
        String title,
        String snippet,
        String originalUrl,
        String sourceUrl,
        String link,
        String url
    ) {

        // Some responses carry the destination beside the redirect uri.
        public String preferredUri() {
            for (String candidate : new String[] {originalUrl, sourceUrl, link, url, uri}) {
                if (candidate != null && !candidate.isBlank()) {
                    return candidate;
                }
            }
            return "";
        }
    }
}
