package com.firstcrack.domain.stage;

/**
 * Category / action-set tag attached to a stage notification.
 *
 * The Apple surfaces register one notification category per tag; Android and
 * web clients use the tag to pick their button layout.
 */
public enum NotificationCategory {
    BREW_HEATING,
    BREW_GRINDING,
    BREW_PREINFUSION,
    BREW_EXTRACTION,
    BREW_COMPLETE;

    /**
     * Tag whose registered action set is empty.
     */
    public static final NotificationCategory NO_ACTIONS = BREW_HEATING;

    public static NotificationCategory forStage(StageId stage) {
        if (stage == null) {
            return NO_ACTIONS;
        }
        switch (stage) {
            case HEATING:
                return BREW_HEATING;
            case GRINDING:
                return BREW_GRINDING;
            case PRE_INFUSION:
                return BREW_PREINFUSION;
            case BREWING:
                return BREW_EXTRACTION;
            case COMPLETE:
                return BREW_COMPLETE;
            default:
                return NO_ACTIONS;
        }
    }

    /**
     * Maps a stage wire value; stage ids this build does not know degrade to
     * {@link #NO_ACTIONS} instead of failing.
     */
    public static NotificationCategory forStage(String stageWireValue) {
        return StageId.fromWire(stageWireValue)
            .map(NotificationCategory::forStage)
            .orElse(NO_ACTIONS);
    }
}
