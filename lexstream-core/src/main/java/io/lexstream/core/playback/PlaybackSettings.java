package io.lexstream.core.playback;

import java.time.Duration;
import java.util.Objects;

public record PlaybackSettings(Duration wordDelay, Duration whitespaceDelay) {

    public PlaybackSettings {
        Objects.requireNonNull(wordDelay, "wordDelay must not be null");
        Objects.requireNonNull(whitespaceDelay, "whitespaceDelay must not be null");
    }

    public static PlaybackSettings defaults() {
        return new PlaybackSettings(Duration.ofMillis(40), Duration.ofMillis(10));
    }

    public static PlaybackSettings immediate() {
        return new PlaybackSettings(Duration.ZERO, Duration.ZERO);
    }

    public Duration delayAfter(PlaybackToken token) {
        return token.kind() == PlaybackToken.Kind.WHITESPACE ? whitespaceDelay : wordDelay;
    }
}
