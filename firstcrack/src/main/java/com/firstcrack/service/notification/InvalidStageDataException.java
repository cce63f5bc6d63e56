package com.firstcrack.service.notification;

import com.firstcrack.domain.stage.StageId;

/**
 * Exception thrown when a stage notification cannot be built. No surface gets
 * a payload for that stage.
 */
public class InvalidStageDataException extends RuntimeException {

    private final String brewId;
    private final StageId stage;

    public InvalidStageDataException(String brewId, StageId stage, String message) {
        super(String.format("[%s:%s] Invalid stage data: %s", brewId, stage, message));
        this.brewId = brewId;
        this.stage = stage;
    }

    public InvalidStageDataException(String brewId, StageId stage, String message, Throwable cause) {
        super(String.format("[%s:%s] Invalid stage data: %s", brewId, stage, message), cause);
        this.brewId = brewId;
        this.stage = stage;
    }

    public String getBrewId() {
        return brewId;
    }

    public StageId getStage() {
        return stage;
    }
}
