package io.lexstream.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.lexstream.core.playback.PlaybackSettings;
import java.time.Duration;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PlaybackConfig(
    @JsonAlias({"word_delay_millis"}) long wordDelayMillis,
    @JsonAlias({"whitespace_delay_millis"}) long whitespaceDelayMillis
) {

    public static PlaybackConfig defaults() {
        return new PlaybackConfig(40, 10);
    }

    public PlaybackSettings toSettings() {
        return new PlaybackSettings(Duration.ofMillis(wordDelayMillis), Duration.ofMillis(whitespaceDelayMillis));
    }
}
