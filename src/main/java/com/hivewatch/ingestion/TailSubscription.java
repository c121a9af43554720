package com.hivewatch.ingestion;

/**
 * Handle on a running tail. Cancelling stops every adapter worker and releases
 * their file handles; already-dispatched records are unaffected.
 */
public interface TailSubscription extends AutoCloseable {

    void cancel();

    boolean isCancelled();

    @Override
    default void close() {
        cancel();
    }
}
