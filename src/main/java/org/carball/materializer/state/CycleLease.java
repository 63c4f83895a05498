package org.carball.materializer.state;

import java.io.IOException;

/**
 * Single-flight guard for materialization cycles. A lease expires after its TTL so a crashed
 * holder cannot block later cycles forever.
 */
public interface CycleLease {

    void acquire() throws LockContentionException, IOException;

    /**
     * Extends the expiry of a held lease.
     */
    void renew() throws IOException;

    void release();

    String getOwner();
}
