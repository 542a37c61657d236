package com.kvmcloud.gateway.testing;

import com.kvmcloud.common.time.BrokerScheduler;
import com.kvmcloud.common.time.Cancellable;
import com.kvmcloud.common.time.MonotonicClock;

import java.time.Duration;
import java.util.PriorityQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Scheduler driven by hand. Tasks run only inside {@link #advance}, on the
 * calling thread, in deadline order.
 */
public final class DeterministicScheduler implements BrokerScheduler {

    private final ManualMonotonicClock clock = new ManualMonotonicClock();
    private final PriorityQueue<Scheduled> queue = new PriorityQueue<>();
    private long sequence;

    @Override
    public synchronized Cancellable schedule(Duration delay, Runnable task) {
        Scheduled scheduled = new Scheduled(clock.nowNanos() + delay.toNanos(), 0, task, sequence++);
        queue.add(scheduled);
        return scheduled;
    }

    @Override
    public synchronized Cancellable scheduleAtFixedRate(Duration period, Runnable task) {
        if (period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("period must be > 0");
        }
        long nanos = period.toNanos();
        Scheduled scheduled = new Scheduled(clock.nowNanos() + nanos, nanos, task, sequence++);
        queue.add(scheduled);
        return scheduled;
    }

    @Override
    public MonotonicClock clock() {
        return clock;
    }

    /**
     * Move time forward by {@code amount}, running every task that falls due
     * on the way at its own deadline.
     */
    public void advance(Duration amount) {
        long target = clock.nowNanos() + amount.toNanos();
        while (true) {
            Scheduled next;
            synchronized (this) {
                next = queue.peek();
                if (next == null || next.deadlineNanos > target) {
                    break;
                }
                queue.poll();
            }
            if (next.cancelled.get()) {
                continue;
            }
            clock.advanceTo(next.deadlineNanos);
            next.task.run();
            if (next.periodNanos > 0 && !next.cancelled.get()) {
                synchronized (this) {
                    next.deadlineNanos += next.periodNanos;
                    queue.add(next);
                }
            }
        }
        clock.advanceTo(target);
    }

    /** Tasks scheduled and not cancelled. */
    public synchronized int pendingCount() {
        return (int) queue.stream().filter(s -> !s.cancelled.get()).count();
    }

    private static final class Scheduled implements Comparable<Scheduled>, Cancellable {
        private long deadlineNanos;
        private final long periodNanos;
        private final Runnable task;
        private final long order;
        private final AtomicBoolean cancelled = new AtomicBoolean(false);

        private Scheduled(long deadlineNanos, long periodNanos, Runnable task, long order) {
            this.deadlineNanos = deadlineNanos;
            this.periodNanos = periodNanos;
            this.task = task;
            this.order = order;
        }

        @Override
        public boolean cancel() {
            return cancelled.compareAndSet(false, true);
        }

        @Override
        public int compareTo(Scheduled o) {
            int byDeadline = Long.compare(deadlineNanos, o.deadlineNanos);
            return byDeadline != 0 ? byDeadline : Long.compare(order, o.order);
        }
    }
}
