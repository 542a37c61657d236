package com.kvmcloud.common.time;

/**
 * Cancellation handle for a scheduled task.
 */
@FunctionalInterface
public interface Cancellable {

    /** A handle that has nothing to cancel. */
    Cancellable NOOP = () -> false;

    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if this call cancelled it; {@code false} if the task
     *         already ran, is running a final time, or was cancelled before
     */
    boolean cancel();
}
