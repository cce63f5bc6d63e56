package com.firstcrack.domain.brew;

/**
 * Returned to the caller of startBrew once the timeline is scheduled.
 */
public record BrewStartResult(
    String brewId,
    int stageCount,
    int estimatedDurationSeconds
) {}
