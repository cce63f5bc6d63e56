package com.firstcrack.client.router;

import com.firstcrack.domain.notification.PlatformSurface;
import com.firstcrack.domain.stage.StageId;

import java.util.HashMap;
import java.util.Map;

/**
 * A user interaction with a stage notification, normalised from whichever
 * surface delivered it.
 *
 * Blank optional fields are stored as null. {@code wireActionId} is never
 * null: a body tap carries the surface's default-tap identifier.
 *
 * @param wireActionId action id exactly as the surface reported it
 * @param brewId       brew correlation id, null when the notification carried none
 * @param deepLink     link precomputed by the sender, null when absent
 * @param stage        stage the notification was for, null when absent or unknown
 * @param source       surface the interaction came from
 * @param data         typed notification data; built from the other fields when
 *                     the surface delivered nothing more
 */
public record InteractionEvent(
    String wireActionId,
    String brewId,
    String deepLink,
    StageId stage,
    PlatformSurface source,
    NotificationData data
) {
    public InteractionEvent {
        wireActionId = wireActionId != null ? wireActionId : "";
        brewId = blankToNull(brewId);
        deepLink = blankToNull(deepLink);
        if (data == null) {
            Map<String, String> fields = new HashMap<>();
            fields.put("brewId", brewId);
            fields.put("deepLink", deepLink);
            fields.put("stage", stage != null ? stage.wireValue() : null);
            data = NotificationData.fromDataMap(fields);
        }
    }

    /**
     * @param stage stage wire value; unknown values are dropped
     */
    public InteractionEvent(String wireActionId, String brewId, String deepLink, String stage,
                            PlatformSurface source) {
        this(wireActionId, brewId, deepLink, StageId.fromWire(blankToNull(stage)).orElse(null), source, null);
    }

    public boolean hasBrewId() {
        return brewId != null;
    }

    public boolean hasDeepLink() {
        return deepLink != null;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
