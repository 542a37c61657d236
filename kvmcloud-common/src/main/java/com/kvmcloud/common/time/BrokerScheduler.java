package com.kvmcloud.common.time;

import java.time.Duration;

/**
 * Timer surface used by the broker for exchange timeouts and liveness checks.
 *
 * <p>
 * Kept as an interface so tests can drive time by hand instead of sleeping.
 * Tasks must be short and must not block: they run on the scheduler's own
 * thread in production.
 * </p>
 */
public interface BrokerScheduler {

    /**
     * Run {@code task} once, no earlier than {@code delay} from now.
     */
    Cancellable schedule(Duration delay, Runnable task);

    /**
     * Run {@code task} every {@code period}, first run one period from now.
     * Cancelling the handle stops further runs.
     */
    Cancellable scheduleAtFixedRate(Duration period, Runnable task);

    /**
     * The clock this scheduler measures delays against.
     */
    MonotonicClock clock();
}
