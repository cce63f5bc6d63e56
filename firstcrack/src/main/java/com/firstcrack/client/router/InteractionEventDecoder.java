package com.firstcrack.client.router;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.firstcrack.domain.action.ActionRegistry;
import com.firstcrack.domain.notification.PlatformSurface;
import com.firstcrack.domain.stage.StageId;

import java.util.HashMap;
import java.util.Map;

/**
 * Turns the surface-specific shape of a notification interaction into an
 * {@link InteractionEvent}.
 *
 * <ul>
 *   <li>Android: broadcast intent extras; {@code actionId}, then {@code action},
 *       then the launcher default</li>
 *   <li>APNs: response action identifier plus {@code userInfo}</li>
 *   <li>Web Push: {@code notificationclick} action plus {@code notification.data}</li>
 * </ul>
 * The rest of the delivered data map is parsed into {@link NotificationData}.
 */
public final class InteractionEventDecoder {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String KEY_ACTION_ID = "actionId";
    static final String KEY_ACTION = "action";
    static final String KEY_WIRE_ACTION_ID = "wireActionId";
    static final String KEY_BREW_ID = "brewId";
    static final String KEY_DEEP_LINK = "deepLink";
    static final String KEY_STAGE = "stage";
    static final String KEY_SOURCE = "source";

    public static InteractionEvent fromAndroidExtras(Map<String, String> extras) {
        Map<String, String> data = extras != null ? extras : Map.of();
        String actionId = firstNonBlank(data.get(KEY_ACTION_ID), data.get(KEY_ACTION),
            ActionRegistry.ANDROID_DEFAULT_TAP);
        return event(actionId, data, PlatformSurface.ANDROID);
    }

    public static InteractionEvent fromApnsResponse(String actionIdentifier, Map<String, ?> userInfo) {
        String actionId = actionIdentifier != null ? actionIdentifier : ActionRegistry.APNS_DEFAULT_TAP;
        Map<String, String> data = new HashMap<>();
        if (userInfo != null) {
            userInfo.forEach((key, value) -> {
                if (value != null) {
                    data.put(key, value.toString());
                }
            });
        }
        return event(actionId, data, PlatformSurface.APNS);
    }

    /**
     * @param action           {@code event.action}; empty or null for a body click
     * @param notificationData {@code event.notification.data}
     */
    public static InteractionEvent fromWebNotificationClick(String action, JsonNode notificationData) {
        String actionId = action != null ? action : ActionRegistry.WEB_DEFAULT_TAP;
        return event(actionId, stringFields(notificationData), PlatformSurface.WEB_PUSH);
    }

    /**
     * Generic form: {@code {wireActionId, brewId?, deepLink?, stage?, source?}}.
     * Any other string fields are read as notification data.
     *
     * @throws IllegalArgumentException if the text is not a JSON object or the
     *         action id is missing
     */
    public static InteractionEvent fromJson(String json) {
        JsonNode node;
        try {
            node = MAPPER.readTree(json == null ? "" : json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Interaction event is not valid JSON", e);
        }
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Interaction event must be a JSON object");
        }
        JsonNode action = node.get(KEY_WIRE_ACTION_ID);
        if (action == null || !action.isTextual()) {
            throw new IllegalArgumentException("Interaction event has no wireActionId");
        }
        PlatformSurface source = PlatformSurface.fromKey(text(node, KEY_SOURCE)).orElse(null);
        return event(action.asText(), stringFields(node), source);
    }

    private static InteractionEvent event(String actionId, Map<String, String> data, PlatformSurface source) {
        NotificationData typed = NotificationData.fromDataMap(data);
        StageId stage = StageId.fromWire(data.get(KEY_STAGE)).orElse(null);
        return new InteractionEvent(actionId, data.get(KEY_BREW_ID), data.get(KEY_DEEP_LINK), stage, source, typed);
    }

    private static Map<String, String> stringFields(JsonNode node) {
        Map<String, String> fields = new HashMap<>();
        if (node != null && node.isObject()) {
            node.fields().forEachRemaining(field -> {
                String value = text(node, field.getKey());
                if (value != null) {
                    fields.put(field.getKey(), value);
                }
            });
        }
        return fields;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isValueNode() && !value.isNull() ? value.asText() : null;
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }

    private InteractionEventDecoder() {}
}
