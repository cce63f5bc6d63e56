package com.firstcrack.domain.notification;

import java.util.Optional;

/**
 * Notification delivery surfaces a stage payload is rendered for.
 */
public enum PlatformSurface {
    ANDROID("android", 3),
    APNS("apns", 3),
    WEB_PUSH("webpush", 4);

    private final String key;
    private final int maxActions;

    PlatformSurface(String key, int maxActions) {
        this.key = key;
        this.maxActions = maxActions;
    }

    /**
     * Section name inside an FCM v1 message.
     */
    public String key() {
        return key;
    }

    /**
     * Most action buttons the surface will render.
     */
    public int maxActions() {
        return maxActions;
    }

    public static Optional<PlatformSurface> fromKey(String key) {
        for (PlatformSurface surface : values()) {
            if (surface.key.equalsIgnoreCase(key)) {
                return Optional.of(surface);
            }
        }
        return Optional.empty();
    }
}
