package com.kvmcloud.gateway.exchange;

import com.kvmcloud.common.time.BrokerScheduler;
import com.kvmcloud.common.time.Cancellable;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Single-resolution fan-in over several event sources (reply, timeout,
 * transport failure, external abort).
 *
 * <p>
 * Whichever source calls {@link #complete} or {@link #fail} first wins; every
 * later call is a no-op. Before the winning result becomes visible on
 * {@link #future()}, all cleanups registered through {@link #onSettled} run
 * exactly once, newest first, so a caller that observes the result also
 * observes released locks, cancelled timers and detached listeners.
 * </p>
 */
@Slf4j
public final class FirstOutcome<T> {

    private final CompletableFuture<T> future = new CompletableFuture<>();
    private final Object lock = new Object();
    private final List<Runnable> cleanups = new ArrayList<>();
    private boolean settled;

    public CompletableFuture<T> future() {
        return future;
    }

    public boolean isSettled() {
        synchronized (lock) {
            return settled;
        }
    }

    /**
     * Resolve successfully.
     *
     * @return true if this call settled the outcome
     */
    public boolean complete(T value) {
        return settle(() -> future.complete(value));
    }

    /**
     * Resolve with a failure.
     *
     * @return true if this call settled the outcome
     */
    public boolean fail(Throwable error) {
        return settle(() -> future.completeExceptionally(error));
    }

    /**
     * Register a cleanup that runs once when the outcome settles. Runs
     * immediately if it already has.
     */
    public void onSettled(Runnable cleanup) {
        synchronized (lock) {
            if (!settled) {
                cleanups.add(cleanup);
                return;
            }
        }
        runQuietly(cleanup);
    }

    /**
     * Race a timer: fail with {@code error} once {@code delay} elapses. The
     * timer is cancelled if anything else settles first.
     */
    public Cancellable failAfter(BrokerScheduler scheduler, Duration delay,
            Supplier<? extends Throwable> error) {
        Cancellable timer = scheduler.schedule(delay, () -> fail(error.get()));
        onSettled(timer::cancel);
        return timer;
    }

    /**
     * Race an abort signal: fail with {@code error} when it is raised. The
     * registration is withdrawn if anything else settles first.
     */
    public void failOnAbort(AbortSignal signal, Supplier<? extends Throwable> error) {
        Cancellable registration = signal.onAbort(() -> fail(error.get()));
        onSettled(registration::cancel);
    }

    private boolean settle(Runnable resolution) {
        List<Runnable> toRun;
        synchronized (lock) {
            if (settled) {
                return false;
            }
            settled = true;
            toRun = new ArrayList<>(cleanups);
            cleanups.clear();
        }
        for (int i = toRun.size() - 1; i >= 0; i--) {
            runQuietly(toRun.get(i));
        }
        resolution.run();
        return true;
    }

    private static void runQuietly(Runnable cleanup) {
        try {
            cleanup.run();
        } catch (RuntimeException e) {
            log.error("outcome cleanup failed: {}", e.getMessage(), e);
        }
    }
}
