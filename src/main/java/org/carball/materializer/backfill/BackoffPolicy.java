package org.carball.materializer.backfill;

import java.time.Duration;

/**
 * Exponential backoff between attempts at a failed chunk.
 */
public class BackoffPolicy {

    private final long initialMs;
    private final long maxMs;

    public BackoffPolicy(long initialMs, long maxMs) {
        this.initialMs = Math.max(0, initialMs);
        this.maxMs = Math.max(this.initialMs, maxMs);
    }

    /**
     * Delay before retry number {@code attempt} (1-based).
     */
    public Duration delay(int attempt) {
        if (attempt <= 1) {
            return Duration.ofMillis(initialMs);
        }
        int shift = Math.min(attempt - 1, 62);
        // saturate before shifting so large initial delays never wrap
        if (initialMs > (maxMs >> shift)) {
            return Duration.ofMillis(maxMs);
        }
        return Duration.ofMillis(initialMs << shift);
    }

    public void sleep(int attempt) throws InterruptedException {
        Thread.sleep(delay(attempt).toMillis());
    }
}
