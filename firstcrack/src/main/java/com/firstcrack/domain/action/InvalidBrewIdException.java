package com.firstcrack.domain.action;

/**
 * Thrown when a brew id contains characters outside {@code [A-Za-z0-9_-]} and
 * therefore cannot be placed into a deep link.
 */
public class InvalidBrewIdException extends RuntimeException {

    private final String brewId;

    public InvalidBrewIdException(String brewId) {
        super("Invalid brew ID format: " + brewId);
        this.brewId = brewId;
    }

    public String getBrewId() {
        return brewId;
    }
}
