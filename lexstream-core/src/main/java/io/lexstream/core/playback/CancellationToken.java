package io.lexstream.core.playback;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

public final class CancellationToken {
    private final CountDownLatch cancelled = new CountDownLatch(1);

    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    public boolean await(Duration delay) throws InterruptedException {
        if (delay.isZero() || delay.isNegative()) {
            return isCancelled();
        }
        return cancelled.await(delay.toNanos(), TimeUnit.NANOSECONDS);
    }
}
