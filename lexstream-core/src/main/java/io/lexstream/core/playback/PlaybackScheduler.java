package io.lexstream.core.playback;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class PlaybackScheduler implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(PlaybackScheduler.class);

    private final PlaybackSettings settings;
    private final TextSegmenter segmenter;
    private final ExecutorService worker;
    private PlaybackSession current;

    public PlaybackScheduler(PlaybackSettings settings) {
        this(settings, new TextSegmenter());
    }

    public PlaybackScheduler(PlaybackSettings settings, TextSegmenter segmenter) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.segmenter = Objects.requireNonNull(segmenter, "segmenter must not be null");
        this.worker = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "playback");
            thread.setDaemon(true);
            return thread;
        });
    }

    public synchronized PlaybackSession start(
        String fullText,
        PlaybackListener listener,
        Consumer<PlaybackSession> onFinished
    ) {
        if (current != null && current.isActive()) {
            LOG.debug("Finishing running playback at token {} of {}", current.cursor(), current.tokens().size());
            current.cancel();
        }
        String text = fullText == null ? "" : fullText;
        PlaybackSession session = new PlaybackSession(text, segmenter.segment(text), listener, onFinished);
        worker.execute(() -> session.play(settings));
        current = session;
        return session;
    }

    public synchronized Optional<PlaybackSession> current() {
        return Optional.ofNullable(current);
    }

    public void cancelCurrent() {
        PlaybackSession session;
        synchronized (this) {
            session = current;
        }
        if (session != null) {
            session.cancel();
        }
    }

    @Override
    public void close() {
        cancelCurrent();
        worker.shutdownNow();
    }
}
