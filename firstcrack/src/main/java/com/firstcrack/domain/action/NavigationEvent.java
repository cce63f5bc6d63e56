package com.firstcrack.domain.action;

/**
 * Canonical navigation request handed to the UI layer after a notification
 * interaction has been resolved.
 *
 * {@code brewId} is either an id that passed the deep-link allow-list or
 * {@link #UNKNOWN_BREW_ID}; the raw value from a rejected id is not carried.
 */
public record NavigationEvent(
    ActionId action,
    String brewId,
    String deepLink
) {
    public static final String UNKNOWN_BREW_ID = "unknown";

    public NavigationEvent {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        if (brewId == null || brewId.isBlank()) {
            throw new IllegalArgumentException("brewId cannot be null or empty");
        }
        if (deepLink == null || deepLink.isBlank()) {
            throw new IllegalArgumentException("deepLink cannot be null or empty");
        }
    }
}
