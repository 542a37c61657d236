package com.kvmcloud.common.time;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ExecutorBrokerSchedulerTest {

    private final ExecutorBrokerScheduler scheduler = new ExecutorBrokerScheduler("test-scheduler", 1);

    @AfterEach
    void tearDown() {
        scheduler.close();
    }

    @Test
    void schedule_runsOnce() throws Exception {
        var latch = new CountDownLatch(1);
        scheduler.schedule(Duration.ofMillis(10), latch::countDown);
        assertTrue(latch.await(2, TimeUnit.SECONDS));
    }

    @Test
    void schedule_cancelledBeforeDeadline_neverRuns() throws Exception {
        var counter = new AtomicInteger();
        Cancellable handle = scheduler.schedule(Duration.ofMillis(200), counter::incrementAndGet);
        assertTrue(handle.cancel());
        assertFalse(handle.cancel());

        Thread.sleep(300);
        assertEquals(0, counter.get());
    }

    @Test
    void scheduleAtFixedRate_repeatsUntilCancelled() throws Exception {
        var latch = new CountDownLatch(3);
        Cancellable handle = scheduler.scheduleAtFixedRate(Duration.ofMillis(10), latch::countDown);
        assertTrue(latch.await(2, TimeUnit.SECONDS));
        assertTrue(handle.cancel());
    }

    @Test
    void scheduleAtFixedRate_survivesThrowingTask() throws Exception {
        var latch = new CountDownLatch(2);
        Cancellable handle = scheduler.scheduleAtFixedRate(Duration.ofMillis(10), () -> {
            latch.countDown();
            throw new IllegalStateException("boom");
        });
        assertTrue(latch.await(2, TimeUnit.SECONDS));
        handle.cancel();
    }

    @Test
    void scheduleAtFixedRate_rejectsZeroPeriod() {
        assertThrows(IllegalArgumentException.class,
                () -> scheduler.scheduleAtFixedRate(Duration.ZERO, () -> {
                }));
    }
}
