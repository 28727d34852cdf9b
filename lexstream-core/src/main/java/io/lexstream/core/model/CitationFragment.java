package io.lexstream.core.model;

public record CitationFragment(String title, String uri, String snippet) {

    public CitationFragment {
        title = title == null ? "" : title.trim();
        uri = uri == null ? "" : uri.trim();
        snippet = snippet == null || snippet.isBlank() ? null : snippet.trim();
    }
}
