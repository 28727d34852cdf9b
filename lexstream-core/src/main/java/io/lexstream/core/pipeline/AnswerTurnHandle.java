package io.lexstream.core.pipeline;

import io.lexstream.core.model.AssembledResponse;
import io.lexstream.core.playback.PlaybackSession;
import java.time.Duration;

public record AnswerTurnHandle(AssembledResponse response, PlaybackSession playback, String model) {

    public void cancel() {
        playback.cancel();
    }

    public boolean awaitPlayback(Duration timeout) throws InterruptedException {
        return playback.awaitTermination(timeout);
    }
}
