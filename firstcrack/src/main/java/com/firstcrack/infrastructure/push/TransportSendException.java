package com.firstcrack.infrastructure.push;

import com.firstcrack.domain.stage.StageId;

/**
 * Exception thrown when the push transport fails to accept a stage notification.
 */
public class TransportSendException extends RuntimeException {

    /** Status code when no HTTP response was received. */
    public static final int NO_STATUS = -1;

    private final String brewId;
    private final StageId stage;
    private final int statusCode;

    public TransportSendException(String brewId, StageId stage, int statusCode, String message) {
        super(String.format("[%s:%s] Push send failed: %s", brewId, stage, message));
        this.brewId = brewId;
        this.stage = stage;
        this.statusCode = statusCode;
    }

    public TransportSendException(String brewId, StageId stage, String message, Throwable cause) {
        super(String.format("[%s:%s] Push send failed: %s", brewId, stage, message), cause);
        this.brewId = brewId;
        this.stage = stage;
        this.statusCode = NO_STATUS;
    }

    public String getBrewId() {
        return brewId;
    }

    public StageId getStage() {
        return stage;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
