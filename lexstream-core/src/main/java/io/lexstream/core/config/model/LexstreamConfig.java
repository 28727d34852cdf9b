package io.lexstream.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record LexstreamConfig(
    GeminiConfig gemini,
    CitationsConfig citations,
    PlaybackConfig playback,
    StorageConfig storage
) {

    public LexstreamConfig {
        gemini = gemini == null ? GeminiConfig.defaults() : gemini;
        citations = citations == null ? CitationsConfig.defaults() : citations;
        playback = playback == null ? PlaybackConfig.defaults() : playback;
        storage = storage == null ? StorageConfig.defaults() : storage;
    }

    public static LexstreamConfig defaults() {
        return new LexstreamConfig(
            GeminiConfig.defaults(),
            CitationsConfig.defaults(),
            PlaybackConfig.defaults(),
            StorageConfig.defaults()
        );
    }

    public LexstreamConfig withGemini(GeminiConfig newGemini) {
        return new LexstreamConfig(newGemini, citations, playback, storage);
    }
}
