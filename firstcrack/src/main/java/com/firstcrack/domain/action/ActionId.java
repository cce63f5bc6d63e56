package com.firstcrack.domain.action;

/**
 * Closed set of notification actions.
 *
 * Each constant carries its wire identifier (what the notification surfaces
 * report back when a button is tapped), the deep-link path segment it routes
 * to, and the button presentation sent along with the payload.
 * {@link #DEFAULT} stands for a tap on the notification body.
 */
public enum ActionId {
    DEFAULT("default", "details", "Open", "info", true, false),

    // Grinding
    PAUSE_GRINDING("pause_grinding", "pause", "Pause Grinding", "pause", true, false),
    ADJUST_GRIND("adjust_grind", "settings", "Adjust Settings", "tune", true, false),

    // Pre-infusion
    SKIP_PREINFUSION("skip_preinfusion", "skip-preinfusion", "Skip to Extraction", "skip_next", true, false),
    EXTEND_PREINFUSION("extend_preinfusion", "extend-preinfusion", "Extend Pre-Infusion", "more_time", true, false),

    // Extraction
    STOP_SHOT("stop_shot", "stop", "Stop Shot Now", "stop", true, true),
    VIEW_LIVE("view_live", "live", "View Live", "videocam", true, false),

    // Post-brew
    BREW_AGAIN("brew_again", "repeat", "Brew Again", "refresh", true, false),
    ADJUST_PROFILE("adjust_profile", "profile", "Adjust Profile", "tune", true, false),
    SHARE("share", "share", "Share", "share", true, false);

    private final String wireId;
    private final String pathSegment;
    private final String title;
    private final String icon;
    private final boolean requiresForeground;
    private final boolean destructive;

    ActionId(String wireId, String pathSegment, String title, String icon,
             boolean requiresForeground, boolean destructive) {
        this.wireId = wireId;
        this.pathSegment = pathSegment;
        this.title = title;
        this.icon = icon;
        this.requiresForeground = requiresForeground;
        this.destructive = destructive;
    }

    public String wireId() {
        return wireId;
    }

    public String pathSegment() {
        return pathSegment;
    }

    public String title() {
        return title;
    }

    public String icon() {
        return icon;
    }

    public boolean requiresForeground() {
        return requiresForeground;
    }

    /**
     * Rendered in red on surfaces that support it.
     */
    public boolean destructive() {
        return destructive;
    }
}
