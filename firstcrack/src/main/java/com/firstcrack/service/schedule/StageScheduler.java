package com.firstcrack.service.schedule;

import com.firstcrack.domain.brew.BrewContext;
import com.firstcrack.domain.notification.StagePayloadSet;
import com.firstcrack.domain.stage.StageEntry;
import com.firstcrack.domain.stage.StageTimeline;
import com.firstcrack.infrastructure.metrics.NotificationMetrics;
import com.firstcrack.infrastructure.push.PushTransport;
import com.firstcrack.infrastructure.push.TransportSendException;
import com.firstcrack.service.notification.InvalidStageDataException;
import com.firstcrack.service.notification.PayloadBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Fires one notification per timeline stage at {@code startTime + offset}.
 *
 * Every stage is scheduled up front against the brew's fixed start time, so
 * a slow or failed send never shifts the stages after it. Stage failures
 * (payload or transport) are logged and counted; the remaining stages still
 * fire. Nothing is retried.
 *
 * Cancellation is keyed by brew id and covers every timeline scheduled for
 * that id.
 */
public class StageScheduler {
    private static final Logger log = LoggerFactory.getLogger(StageScheduler.class);

    private final StageTimeline timeline;
    private final PayloadBuilder payloadBuilder;
    private final PushTransport transport;
    private final StageTimer timer;
    private final NotificationMetrics metrics;

    private final ConcurrentMap<String, Set<BrewTimeline>> active = new ConcurrentHashMap<>();

    public StageScheduler(StageTimeline timeline, PayloadBuilder payloadBuilder, PushTransport transport,
                          StageTimer timer, NotificationMetrics metrics) {
        this.timeline = timeline;
        this.payloadBuilder = payloadBuilder;
        this.transport = transport;
        this.timer = timer;
        this.metrics = metrics;
    }

    public BrewTimeline schedule(BrewContext context) {
        List<Instant> fireTimes = new ArrayList<>();
        for (StageEntry entry : timeline.entries()) {
            fireTimes.add(context.fireTimeFor(entry.offsetSeconds()));
        }
        BrewTimeline handle = new BrewTimeline(context, fireTimes);
        // atomic with cancel() and settle()
        active.compute(context.brewId(), (id, set) -> {
            Set<BrewTimeline> timelines = set != null ? set : ConcurrentHashMap.newKeySet();
            timelines.add(handle);
            return timelines;
        });
        metrics.setActiveTimelines(activeCount());

        List<StageEntry> entries = timeline.entries();
        for (int i = 0; i < entries.size(); i++) {
            StageEntry entry = entries.get(i);
            handle.track(timer.scheduleAt(fireTimes.get(i), () -> fire(handle, entry)));
        }

        log.info("[SCHEDULER] Scheduled {} stages for {} (start={}, last={})",
            entries.size(), context.brewId(), context.startTime(), fireTimes.get(fireTimes.size() - 1));
        return handle;
    }

    /**
     * Cancel every pending timeline for a brew.
     *
     * @return {@code true} if at least one timeline was still pending
     */
    public boolean cancel(String brewId) {
        if (brewId == null) {
            return false;
        }
        Set<BrewTimeline> timelines = active.remove(brewId);
        if (timelines == null) {
            return false;
        }
        boolean any = false;
        for (BrewTimeline handle : timelines) {
            any |= handle.cancel();
        }
        metrics.setActiveTimelines(activeCount());
        if (any) {
            log.info("[SCHEDULER] Cancelled {} timeline(s) for {}", timelines.size(), brewId);
        }
        return any;
    }

    public boolean isActive(String brewId) {
        return brewId != null && active.containsKey(brewId);
    }

    /**
     * Timelines with at least one stage still to fire.
     */
    public int activeCount() {
        return active.values().stream().mapToInt(Set::size).sum();
    }

    private void fire(BrewTimeline handle, StageEntry entry) {
        String brewId = handle.brewId();
        try {
            if (handle.isCancelled()) {
                skip(handle, entry);
                return;
            }

            StagePayloadSet payload;
            try {
                payload = payloadBuilder.build(handle.context(), entry);
            } catch (InvalidStageDataException e) {
                log.warn("[SCHEDULER] {}", e.getMessage());
                metrics.recordPayloadBuildFailure(entry.stageId());
                return;
            }

            // cancelled while the payload was being built
            if (handle.isCancelled()) {
                skip(handle, entry);
                return;
            }

            long started = System.nanoTime();
            try {
                String messageId = transport.send(payload);
                metrics.recordStageSent(entry.stageId(), Duration.ofNanos(System.nanoTime() - started));
                log.info("[SCHEDULER] {} {} sent ({})", brewId, entry.stageId().wireValue(), messageId);
            } catch (TransportSendException e) {
                metrics.recordStageFailed(entry.stageId(), "TRANSPORT", Duration.ofNanos(System.nanoTime() - started));
                log.warn("[SCHEDULER] {} (status {})", e.getMessage(), e.getStatusCode());
            } catch (RuntimeException e) {
                metrics.recordStageFailed(entry.stageId(), "UNEXPECTED", Duration.ofNanos(System.nanoTime() - started));
                log.error("[SCHEDULER] {} {} unexpected send failure", brewId, entry.stageId().wireValue(), e);
            }
        } finally {
            settle(handle);
        }
    }

    private void skip(BrewTimeline handle, StageEntry entry) {
        metrics.recordStageSkipped(entry.stageId());
        log.debug("[SCHEDULER] {} {} skipped, brew cancelled", handle.brewId(), entry.stageId().wireValue());
    }

    private void settle(BrewTimeline handle) {
        if (handle.settle() > 0) {
            return;
        }
        active.computeIfPresent(handle.brewId(), (id, set) -> {
            set.remove(handle);
            return set.isEmpty() ? null : set;
        });
        metrics.setActiveTimelines(activeCount());
        if (!handle.isCancelled()) {
            log.info("[SCHEDULER] Timeline for {} complete", handle.brewId());
        }
    }
}
