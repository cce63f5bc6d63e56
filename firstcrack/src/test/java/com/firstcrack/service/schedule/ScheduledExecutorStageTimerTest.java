package com.firstcrack.service.schedule;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class ScheduledExecutorStageTimerTest {

    private ScheduledExecutorService executor;
    private ScheduledExecutorStageTimer timer;

    @BeforeEach
    void setUp() {
        executor = ScheduledExecutorStageTimer.daemonPool(2);
        timer = new ScheduledExecutorStageTimer(executor, Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void testPastFireTimeRunsImmediately() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);
        timer.scheduleAt(Instant.now().minusSeconds(5), latch::countDown);

        assertTrue(latch.await(2, TimeUnit.SECONDS), "Past fire time should run right away");
    }

    @Test
    void testNeverRunsBeforeFireTime() throws InterruptedException {
        Instant fireTime = Instant.now().plusMillis(200);
        AtomicReference<Instant> ranAt = new AtomicReference<>();
        CountDownLatch latch = new CountDownLatch(1);

        timer.scheduleAt(fireTime, () -> {
            ranAt.set(Instant.now());
            latch.countDown();
        });

        assertTrue(latch.await(2, TimeUnit.SECONDS));
        assertFalse(ranAt.get().isBefore(fireTime.minusMillis(5)), "Ran early: " + ranAt.get());
    }

    @Test
    void testCancelPreventsRun() throws InterruptedException {
        AtomicBoolean ran = new AtomicBoolean(false);
        Cancellable handle = timer.scheduleAt(Instant.now().plusMillis(300), () -> ran.set(true));

        assertTrue(handle.cancel());
        assertFalse(handle.cancel(), "Second cancel reports nothing cancelled");

        Thread.sleep(500);
        assertFalse(ran.get());
    }

    @Test
    void testThreadsAreDaemons() throws InterruptedException {
        AtomicReference<Thread> thread = new AtomicReference<>();
        CountDownLatch latch = new CountDownLatch(1);
        timer.scheduleAt(Instant.now(), () -> {
            thread.set(Thread.currentThread());
            latch.countDown();
        });

        assertTrue(latch.await(2, TimeUnit.SECONDS));
        assertTrue(thread.get().isDaemon());
        assertTrue(thread.get().getName().startsWith("stage-timer-"));
    }
}
