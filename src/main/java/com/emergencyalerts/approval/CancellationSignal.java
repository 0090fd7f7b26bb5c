package com.emergencyalerts.approval;

/**
 * Lets a caller abandon an operation. Checked immediately before the single write an operation
 * performs: a cancellation seen there aborts with nothing committed, one arriving after the
 * write has no effect.
 */
@FunctionalInterface
public interface CancellationSignal {

    boolean isCancelled();

    /** Cancelled when the calling thread has been interrupted, e.g. by a timed-out request. */
    static CancellationSignal currentThread() {
        return () -> Thread.currentThread().isInterrupted();
    }

    static CancellationSignal none() {
        return () -> false;
    }
}
