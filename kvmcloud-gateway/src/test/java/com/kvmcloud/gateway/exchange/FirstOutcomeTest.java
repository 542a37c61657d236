package com.kvmcloud.gateway.exchange;

import com.kvmcloud.gateway.testing.DeterministicScheduler;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class FirstOutcomeTest {

    @Test
    void firstCompletionWins_laterCallsAreNoOps() throws Exception {
        FirstOutcome<String> outcome = new FirstOutcome<>();

        assertTrue(outcome.complete("answer"));
        assertFalse(outcome.fail(new IllegalStateException("late")));
        assertFalse(outcome.complete("other"));

        assertEquals("answer", outcome.future().get());
    }

    @Test
    void cleanupsRunOnceNewestFirst_beforeResultIsVisible() {
        FirstOutcome<String> outcome = new FirstOutcome<>();
        List<String> order = new ArrayList<>();
        outcome.onSettled(() -> order.add("first"));
        outcome.onSettled(() -> order.add("second"));
        outcome.future().whenComplete((v, e) -> order.add("result"));

        outcome.fail(new IllegalStateException("boom"));
        outcome.complete("late");

        assertEquals(List.of("second", "first", "result"), order);
    }

    @Test
    void onSettled_afterSettlement_runsImmediately() {
        FirstOutcome<String> outcome = new FirstOutcome<>();
        outcome.complete("x");
        AtomicInteger ran = new AtomicInteger();

        outcome.onSettled(ran::incrementAndGet);

        assertEquals(1, ran.get());
    }

    @Test
    void throwingCleanup_doesNotPreventSettlement() throws Exception {
        FirstOutcome<String> outcome = new FirstOutcome<>();
        AtomicInteger ran = new AtomicInteger();
        outcome.onSettled(ran::incrementAndGet);
        outcome.onSettled(() -> {
            throw new IllegalStateException("cleanup failed");
        });

        outcome.complete("ok");

        assertEquals(1, ran.get());
        assertEquals("ok", outcome.future().get());
    }

    @Test
    void failAfter_firesAtDeadlineAndNotBefore() {
        DeterministicScheduler scheduler = new DeterministicScheduler();
        FirstOutcome<String> outcome = new FirstOutcome<>();
        outcome.failAfter(scheduler, Duration.ofSeconds(15), () -> new TimeoutException("late"));

        scheduler.advance(Duration.ofMillis(14_999));
        assertFalse(outcome.isSettled());

        scheduler.advance(Duration.ofMillis(1));
        ExecutionException e = assertThrows(ExecutionException.class, () -> outcome.future().get());
        assertInstanceOf(TimeoutException.class, e.getCause());
    }

    @Test
    void completionBeforeDeadline_cancelsTimer() {
        DeterministicScheduler scheduler = new DeterministicScheduler();
        FirstOutcome<String> outcome = new FirstOutcome<>();
        outcome.failAfter(scheduler, Duration.ofSeconds(15), () -> new TimeoutException("late"));

        outcome.complete("answer");

        assertEquals(0, scheduler.pendingCount());
    }

    @Test
    void failOnAbort_registrationWithdrawnWhenSomethingElseWins() {
        AbortSignal signal = new AbortSignal();
        FirstOutcome<String> outcome = new FirstOutcome<>();
        outcome.failOnAbort(signal, () -> new IllegalStateException("aborted"));
        assertEquals(1, signal.listenerCount());

        outcome.complete("answer");

        assertEquals(0, signal.listenerCount());
        assertEquals("answer", outcome.future().join());
    }

    @Test
    void failOnAbort_alreadyAborted_failsImmediately() {
        AbortSignal signal = new AbortSignal();
        signal.abort("gone");
        FirstOutcome<String> outcome = new FirstOutcome<>();

        outcome.failOnAbort(signal, () -> new IllegalStateException("aborted"));

        assertTrue(outcome.future().isCompletedExceptionally());
    }

    @Test
    void racingSources_settleExactlyOnce() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            for (int round = 0; round < 500; round++) {
                FirstOutcome<Integer> outcome = new FirstOutcome<>();
                AtomicInteger cleanups = new AtomicInteger();
                AtomicInteger winners = new AtomicInteger();
                outcome.onSettled(cleanups::incrementAndGet);
                CountDownLatch start = new CountDownLatch(1);
                List<CompletableFuture<Void>> racers = new ArrayList<>();
                for (int i = 0; i < 4; i++) {
                    int value = i;
                    racers.add(CompletableFuture.runAsync(() -> {
                        try {
                            start.await();
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                        boolean won = value % 2 == 0
                                ? outcome.complete(value)
                                : outcome.fail(new IllegalStateException("racer " + value));
                        if (won) {
                            winners.incrementAndGet();
                        }
                    }, pool));
                }
                start.countDown();
                CompletableFuture.allOf(racers.toArray(new CompletableFuture[0])).get(5, TimeUnit.SECONDS);
                assertEquals(1, winners.get());
                assertEquals(1, cleanups.get());
                assertTrue(outcome.future().isDone());
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
