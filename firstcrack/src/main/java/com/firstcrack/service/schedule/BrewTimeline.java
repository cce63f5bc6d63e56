package com.firstcrack.service.schedule;

import com.firstcrack.domain.brew.BrewContext;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Handle for one scheduled brew timeline.
 *
 * Two timelines for the same brew id are independent handles.
 */
public final class BrewTimeline {

    private final BrewContext context;
    private final List<Instant> fireTimes;
    private final List<Cancellable> pending = new CopyOnWriteArrayList<>();
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicInteger remaining;

    BrewTimeline(BrewContext context, List<Instant> fireTimes) {
        this.context = context;
        this.fireTimes = List.copyOf(fireTimes);
        this.remaining = new AtomicInteger(fireTimes.size());
    }

    public String brewId() {
        return context.brewId();
    }

    public BrewContext context() {
        return context;
    }

    /**
     * Absolute fire time of each stage, in timeline order.
     */
    public List<Instant> fireTimes() {
        return fireTimes;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Stages that have not fired, failed or been skipped yet.
     */
    public int remainingStages() {
        return remaining.get();
    }

    public boolean isFinished() {
        return remaining.get() == 0;
    }

    void track(Cancellable handle) {
        pending.add(handle);
        // registered after cancel() already walked the list
        if (cancelled.get()) {
            handle.cancel();
        }
    }

    /**
     * @return remaining stage count after this one settled
     */
    int settle() {
        return remaining.updateAndGet(n -> Math.max(0, n - 1));
    }

    /**
     * Stops every stage that has not started. A send already in flight is
     * suppressed if it has not reached the transport yet.
     *
     * @return {@code true} if this call cancelled the timeline
     */
    boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        for (Cancellable handle : new ArrayList<>(pending)) {
            handle.cancel();
        }
        return true;
    }
}
