package io.lexstream.core.playback;

import java.util.Objects;

public record PlaybackToken(Kind kind, String text) {

    public enum Kind {
        WORD,
        WHITESPACE,
        CITATION_MARKER
    }

    public PlaybackToken {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(text, "text must not be null");
    }

    public static PlaybackToken word(String text) {
        return new PlaybackToken(Kind.WORD, text);
    }

    public static PlaybackToken whitespace(String text) {
        return new PlaybackToken(Kind.WHITESPACE, text);
    }

    public static PlaybackToken citation(String text) {
        return new PlaybackToken(Kind.CITATION_MARKER, text);
    }
}
