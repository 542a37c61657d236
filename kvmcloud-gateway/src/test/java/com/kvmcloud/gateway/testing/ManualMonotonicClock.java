package com.kvmcloud.gateway.testing;

import com.kvmcloud.common.time.MonotonicClock;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Monotonic clock for tests. Starts at 0 and moves only when told to.
 */
public final class ManualMonotonicClock implements MonotonicClock {

    private final AtomicLong nowNanos = new AtomicLong(0);

    @Override
    public long nowNanos() {
        return nowNanos.get();
    }

    void advanceTo(long targetNanos) {
        nowNanos.accumulateAndGet(targetNanos, Math::max);
    }
}
