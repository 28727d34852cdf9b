package io.lexstream.core.playback;

@FunctionalInterface
public interface PlaybackListener {
    void revealed(String textSoFar);
}
