package org.carball.materializer.state;

/**
 * Another cycle holds the lease. The current invocation should exit without doing anything.
 */
public class LockContentionException extends Exception {

    public LockContentionException(String message) {
        super(message);
    }
}
