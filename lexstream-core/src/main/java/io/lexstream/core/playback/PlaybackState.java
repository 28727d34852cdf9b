package io.lexstream.core.playback;

public enum PlaybackState {
    IDLE,
    PLAYING,
    CANCELLED,
    COMPLETED;

    public boolean isTerminal() {
        return this == CANCELLED || this == COMPLETED;
    }
}
