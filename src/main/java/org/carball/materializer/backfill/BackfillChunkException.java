package org.carball.materializer.backfill;

/**
 * A transient failure rewriting one chunk: timeout, resource exhaustion or I/O.
 * The chunk can be retried because applying it is idempotent.
 */
public class BackfillChunkException extends Exception {

    public BackfillChunkException(String message) {
        super(message);
    }

    public BackfillChunkException(String message, Throwable cause) {
        super(message, cause);
    }
}
