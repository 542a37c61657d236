package com.kvmcloud.common.time;

/**
 * Monotonic time source used for timeouts and cadence.
 * Values are only meaningful for elapsed-time computations.
 */
@FunctionalInterface
public interface MonotonicClock {

    MonotonicClock SYSTEM = System::nanoTime;

    long nowNanos();
}
