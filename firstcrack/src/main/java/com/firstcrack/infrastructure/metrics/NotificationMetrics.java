package com.firstcrack.infrastructure.metrics;

import com.firstcrack.domain.brew.BrewType;
import com.firstcrack.domain.stage.StageId;

import java.time.Duration;

/**
 * Metrics for the brew notification pipeline.
 *
 * Key metrics:
 * - Brews started / cancelled
 * - Stage send success/failure rates and latency
 * - Payload build failures
 * - Timelines currently scheduled
 */
public interface NotificationMetrics {

    void recordBrewStarted(BrewType brewType);

    void recordBrewCancelled();

    /**
     * Record a stage notification accepted by the push transport.
     *
     * @param stage Stage that fired
     * @param latency Time spent in the transport call
     */
    void recordStageSent(StageId stage, Duration latency);

    /**
     * Record a stage notification the push transport rejected.
     *
     * @param stage Stage that fired
     * @param reason Short failure class (TRANSPORT, UNEXPECTED)
     * @param latency Time to failure
     */
    void recordStageFailed(StageId stage, String reason, Duration latency);

    /**
     * Record a stage skipped because its brew was cancelled before it fired.
     */
    void recordStageSkipped(StageId stage);

    void recordPayloadBuildFailure(StageId stage);

    void setActiveTimelines(int count);
}
