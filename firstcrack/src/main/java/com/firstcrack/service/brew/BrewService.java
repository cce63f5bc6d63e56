package com.firstcrack.service.brew;

import com.firstcrack.domain.brew.BrewContext;
import com.firstcrack.domain.brew.BrewRequest;
import com.firstcrack.domain.brew.BrewStartResult;
import com.firstcrack.domain.brew.BrewType;
import com.firstcrack.domain.common.ValidationResult;
import com.firstcrack.domain.stage.StageTimeline;
import com.firstcrack.infrastructure.metrics.NotificationMetrics;
import com.firstcrack.service.schedule.StageScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Entry point for starting and stopping brews.
 *
 * A brew id has the form {@code brew_<epochMillis>_<0-9999>}.
 */
public class BrewService {
    private static final Logger log = LoggerFactory.getLogger(BrewService.class);

    private final StageTimeline timeline;
    private final StageScheduler scheduler;
    private final BrewRequestValidator validator;
    private final Clock clock;
    private final NotificationMetrics metrics;

    public BrewService(StageTimeline timeline, StageScheduler scheduler, BrewRequestValidator validator,
                       Clock clock, NotificationMetrics metrics) {
        this.timeline = timeline;
        this.scheduler = scheduler;
        this.validator = validator;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Validate the request and schedule its stage timeline.
     *
     * @throws BrewValidationException with every failing field; nothing is scheduled
     */
    public BrewStartResult startBrew(BrewRequest request) {
        ValidationResult validation = validator.validate(request);
        if (!validation.passed()) {
            log.warn("[BREW] Rejected brew request: {} error(s)", validation.errors().size());
            throw new BrewValidationException(validation.errors());
        }

        BrewType brewType = BrewType.fromWire(request.brewType()).orElseThrow();
        String brewId = newBrewId();
        BrewContext context = new BrewContext(
            brewId,
            request.deviceAddress(),
            brewType,
            request.doseGrams(),
            request.targetTempC(),
            request.targetPressureBar(),
            request.effectivePreinfusionSeconds(),
            request.effectiveExtractionSeconds(),
            clock.instant());

        scheduler.schedule(context);
        metrics.recordBrewStarted(brewType);

        log.info("[BREW] Started {} {} ({}g, {}°C, {} bar)", brewType.wireValue(), brewId,
            context.doseGrams().toPlainString(), context.targetTempC().toPlainString(),
            context.targetPressureBar().toPlainString());
        return new BrewStartResult(brewId, timeline.stageCount(), timeline.totalDurationSeconds());
    }

    public BrewStartResult startBrew(String brewType, int doseGrams, int targetTempC,
                                     int targetPressureBar, String deviceAddress) {
        return startBrew(BrewRequest.of(brewType, doseGrams, targetTempC, targetPressureBar, deviceAddress));
    }

    /**
     * Cancel the remaining stages of a brew.
     *
     * @return {@code true} if the brew still had stages pending
     */
    public boolean stopBrew(String brewId) {
        boolean cancelled = scheduler.cancel(brewId);
        if (cancelled) {
            metrics.recordBrewCancelled();
            log.info("[BREW] Stopped {}", brewId);
        } else {
            log.info("[BREW] Stop requested for {} but nothing was pending", brewId);
        }
        return cancelled;
    }

    public int activeBrewCount() {
        return scheduler.activeCount();
    }

    private String newBrewId() {
        return "brew_" + clock.millis() + "_" + ThreadLocalRandom.current().nextInt(10000);
    }
}
