package com.firstcrack.domain.action;

/**
 * Thrown when a wire action identifier is neither a known action nor a
 * platform default-tap sentinel.
 */
public class UnknownActionException extends RuntimeException {

    private final String wireId;

    public UnknownActionException(String wireId) {
        super("Unknown action identifier: " + wireId);
        this.wireId = wireId;
    }

    public String getWireId() {
        return wireId;
    }
}
