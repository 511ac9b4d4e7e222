package org.saiql.engine;

/**
 * Lets a caller stop a long optimization from another thread. The optimizer
 * polls it between rule applications.
 */
public final class CancellationToken {

    private volatile boolean cancelled;

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }
}
