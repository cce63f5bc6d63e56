package com.firstcrack.domain.stage;

import com.firstcrack.domain.action.ActionId;

import java.util.HashSet;
import java.util.List;

/**
 * One point in the brew lifecycle: when it fires, what it shows and which
 * actions the notification offers (in display order).
 */
public record StageEntry(
    StageId stageId,
    int offsetSeconds,
    String title,
    String body,
    MediaRef media,
    List<ActionId> actions,
    int progress,
    boolean highPriority,
    boolean requireInteraction
) {
    public StageEntry {
        if (stageId == null) {
            throw new IllegalArgumentException("stageId cannot be null");
        }
        if (offsetSeconds < 0) {
            throw new IllegalArgumentException("offsetSeconds must be non-negative: " + offsetSeconds);
        }
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("title cannot be null or empty");
        }
        if (body == null || body.isBlank()) {
            throw new IllegalArgumentException("body cannot be null or empty");
        }
        if (progress < 0 || progress > 100) {
            throw new IllegalArgumentException("progress must be between 0 and 100: " + progress);
        }
        media = media != null ? media : MediaRef.NONE;
        actions = actions != null ? List.copyOf(actions) : List.of();
        if (actions.contains(ActionId.DEFAULT)) {
            throw new IllegalArgumentException("The default tap action cannot be offered as a button");
        }
        if (new HashSet<>(actions).size() != actions.size()) {
            throw new IllegalArgumentException("Duplicate actions on stage " + stageId + ": " + actions);
        }
    }

    public boolean hasActions() {
        return !actions.isEmpty();
    }
}
