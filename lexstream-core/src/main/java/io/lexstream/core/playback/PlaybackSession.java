package io.lexstream.core.playback;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Paced reveal of one finished answer.
 *
 * <p>The session moves from {@link PlaybackState#IDLE} to {@link PlaybackState#PLAYING} once
 * its worker starts, and ends either {@link PlaybackState#COMPLETED} after the last token or
 * {@link PlaybackState#CANCELLED}, in which case the whole text is revealed at once. Either
 * way the finish callback runs exactly once.
 */
public final class PlaybackSession {
    private static final Logger LOG = LoggerFactory.getLogger(PlaybackSession.class);

    private final String fullText;
    private final List<PlaybackToken> tokens;
    private final PlaybackListener listener;
    private final Consumer<PlaybackSession> onFinished;
    private final CancellationToken cancellation = new CancellationToken();
    private final AtomicBoolean finished = new AtomicBoolean();
    private final CountDownLatch terminated = new CountDownLatch(1);
    private final StringBuilder revealed = new StringBuilder();

    private PlaybackState state = PlaybackState.IDLE;
    private int cursor;

    PlaybackSession(
        String fullText,
        List<PlaybackToken> tokens,
        PlaybackListener listener,
        Consumer<PlaybackSession> onFinished
    ) {
        this.fullText = Objects.requireNonNull(fullText, "fullText must not be null");
        this.tokens = List.copyOf(tokens);
        this.listener = listener == null ? text -> { } : listener;
        this.onFinished = onFinished == null ? session -> { } : onFinished;
    }

    void play(PlaybackSettings settings) {
        if (!begin()) {
            return;
        }
        try {
            while (true) {
                Emission emission = emitNext();
                if (emission == null) {
                    break;
                }
                notifyListener(emission.revealed());
                PlaybackToken emitted = emission.token();
                if (hasMore() && cancellation.await(settings.delayAfter(emitted))) {
                    return;
                }
            }
            end(PlaybackState.COMPLETED);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
        }
    }

    // No effect once the session has ended.
    public void cancel() {
        String flushed;
        synchronized (this) {
            if (state.isTerminal()) {
                return;
            }
            state = PlaybackState.CANCELLED;
            cancellation.cancel();
            boolean changed = revealed.length() != fullText.length();
            revealed.setLength(0);
            revealed.append(fullText);
            cursor = tokens.size();
            flushed = changed ? fullText : null;
        }
        if (flushed != null) {
            notifyListener(flushed);
        }
        fireFinished();
    }

    public synchronized PlaybackState state() {
        return state;
    }

    public synchronized String revealed() {
        return revealed.toString();
    }

    public synchronized int cursor() {
        return cursor;
    }

    public String fullText() {
        return fullText;
    }

    public List<PlaybackToken> tokens() {
        return tokens;
    }

    public boolean isActive() {
        return !state().isTerminal();
    }

    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminated.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    private synchronized boolean begin() {
        if (state != PlaybackState.IDLE) {
            return false;
        }
        state = PlaybackState.PLAYING;
        return true;
    }

    private synchronized boolean hasMore() {
        return state == PlaybackState.PLAYING && cursor < tokens.size();
    }

    // The listener runs outside the monitor; it may call back into the scheduler.
    private synchronized Emission emitNext() {
        if (!hasMore()) {
            return null;
        }
        PlaybackToken next = tokens.get(cursor++);
        revealed.append(next.text());
        return new Emission(next, revealed.toString());
    }

    private void end(PlaybackState terminal) {
        synchronized (this) {
            if (state.isTerminal()) {
                return;
            }
            state = terminal;
        }
        fireFinished();
    }

    private void notifyListener(String text) {
        try {
            listener.revealed(text);
        } catch (RuntimeException e) {
            LOG.warn("Playback listener failed: {}", e.getMessage(), e);
        }
    }

    private void fireFinished() {
        if (!finished.compareAndSet(false, true)) {
            return;
        }
        try {
            onFinished.accept(this);
        } catch (RuntimeException e) {
            LOG.warn("Playback finish callback failed: {}", e.getMessage(), e);
        } finally {
            terminated.countDown();
        }
    }

    private record Emission(PlaybackToken token, String revealed) {
    }
}
