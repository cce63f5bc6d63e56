package com.firstcrack.service.schedule;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link StageTimer} backed by a {@link ScheduledExecutorService}.
 *
 * Fire times are converted to delays against {@code clock} when scheduled.
 * The executor is owned by the caller and must be shut down by it.
 */
public final class ScheduledExecutorStageTimer implements StageTimer {

    private final ScheduledExecutorService executor;
    private final Clock clock;

    public ScheduledExecutorStageTimer(ScheduledExecutorService executor, Clock clock) {
        if (executor == null || clock == null) {
            throw new IllegalArgumentException("executor and clock are required");
        }
        this.executor = executor;
        this.clock = clock;
    }

    /**
     * Pool of daemon threads named {@code stage-timer-N}.
     */
    public static ScheduledExecutorService daemonPool(int threads) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newScheduledThreadPool(threads, r -> {
            Thread t = new Thread(r, "stage-timer-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public Cancellable scheduleAt(Instant fireTime, Runnable task) {
        if (fireTime == null || task == null) {
            throw new IllegalArgumentException("fireTime and task are required");
        }
        long delayMillis = Math.max(0, Duration.between(clock.instant(), fireTime).toMillis());
        ScheduledFuture<?> future = executor.schedule(task, delayMillis, TimeUnit.MILLISECONDS);
        // false: a send already in progress is left to finish
        return () -> future.cancel(false);
    }
}
