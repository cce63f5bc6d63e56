package com.firstcrack.service.notification;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.firstcrack.domain.action.ActionId;
import com.firstcrack.domain.action.ActionRegistry;
import com.firstcrack.domain.action.InvalidBrewIdException;
import com.firstcrack.domain.brew.BrewContext;
import com.firstcrack.domain.notification.PlatformSurface;
import com.firstcrack.domain.notification.StagePayloadSet;
import com.firstcrack.domain.stage.MediaRef;
import com.firstcrack.domain.stage.NotificationCategory;
import com.firstcrack.domain.stage.StageEntry;
import com.firstcrack.domain.stage.StageId;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the per-surface notification payloads for one stage of one brew.
 *
 * Pure: no clock, no I/O. The same (context, stage) pair always yields an
 * equal {@link StagePayloadSet}. Either every surface gets a payload or
 * {@link InvalidStageDataException} is thrown.
 *
 * Core data record (string values, in this order):
 * <pre>
 *  type, stage, brewId, title, body, brewType, dose, temperature, pressure,
 *  elapsedTime, [remainingTime], [imageUrl], [videoUrl], [actions],
 *  deepLink, progress, category
 * </pre>
 */
public final class PayloadBuilder {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String TYPE_STAGE = "brew_stage";
    public static final String TYPE_COMPLETE = "brew_complete";
    public static final String ANDROID_CHANNEL_ID = "brew_notifications";
    public static final String WEB_ICON = "/icons/icon-192.png";
    public static final String WEB_BADGE = "/icons/badge-72.png";

    private final ActionRegistry registry;
    private final String mediaBaseUrl;
    private final int totalDurationSeconds;
    private final int maxActions;

    public PayloadBuilder(ActionRegistry registry, String mediaBaseUrl, int totalDurationSeconds) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (mediaBaseUrl == null || mediaBaseUrl.isBlank()) {
            throw new IllegalArgumentException("mediaBaseUrl cannot be null or empty");
        }
        if (totalDurationSeconds < 0) {
            throw new IllegalArgumentException("totalDurationSeconds must be non-negative");
        }
        this.registry = registry;
        this.mediaBaseUrl = mediaBaseUrl.endsWith("/")
            ? mediaBaseUrl.substring(0, mediaBaseUrl.length() - 1)
            : mediaBaseUrl;
        this.totalDurationSeconds = totalDurationSeconds;

        int min = Integer.MAX_VALUE;
        for (PlatformSurface surface : PlatformSurface.values()) {
            min = Math.min(min, surface.maxActions());
        }
        this.maxActions = min;
    }

    public StagePayloadSet build(BrewContext context, StageEntry entry) {
        if (entry == null) {
            throw new InvalidStageDataException(context != null ? context.brewId() : null, null,
                "stage entry is missing");
        }
        if (context == null) {
            throw new InvalidStageDataException(null, entry.stageId(), "brew context is missing");
        }
        String brewId = context.brewId();
        StageId stage = entry.stageId();

        if (entry.actions().size() > maxActions) {
            throw new InvalidStageDataException(brewId, stage, String.format(
                "%d actions exceed the per-surface limit of %d", entry.actions().size(), maxActions));
        }

        String defaultLink;
        Map<ActionId, String> actionLinks = new LinkedHashMap<>();
        try {
            defaultLink = registry.deepLinkFor(ActionId.DEFAULT, brewId);
            for (ActionId action : entry.actions()) {
                actionLinks.put(action, registry.deepLinkFor(action, brewId));
            }
        } catch (InvalidBrewIdException e) {
            throw new InvalidStageDataException(brewId, stage, "brew id cannot be used in a deep link", e);
        }

        NotificationCategory category = NotificationCategory.forStage(stage);
        Map<String, String> data = coreData(context, entry, category, defaultLink, actionLinks);

        ObjectNode android = androidSection(context, entry, data);
        ObjectNode apns = apnsSection(context, entry, category, data);
        ObjectNode webpush = webPushSection(context, entry, data, defaultLink);

        return new StagePayloadSet(brewId, stage, context.deviceAddress(), category, data,
            android, apns, webpush);
    }

    private Map<String, String> coreData(BrewContext context, StageEntry entry,
                                         NotificationCategory category, String defaultLink,
                                         Map<ActionId, String> actionLinks) {
        Map<String, String> data = new LinkedHashMap<>();
        data.put("type", entry.stageId() == StageId.COMPLETE ? TYPE_COMPLETE : TYPE_STAGE);
        data.put("stage", entry.stageId().wireValue());
        data.put("brewId", context.brewId());
        data.put("title", entry.title());
        data.put("body", entry.body());
        data.put("brewType", context.brewType().wireValue());
        data.put("dose", plain(context.doseGrams()));
        data.put("temperature", plain(context.targetTempC()));
        data.put("pressure", plain(context.targetPressureBar()));
        data.put("elapsedTime", Integer.toString(entry.offsetSeconds()));

        int remaining = totalDurationSeconds - entry.offsetSeconds();
        if (remaining > 0) {
            data.put("remainingTime", Integer.toString(remaining));
        }

        MediaRef media = entry.media();
        if (media.hasImage()) {
            data.put("imageUrl", resolveMedia(media.imagePath()));
        }
        if (media.hasVideo()) {
            data.put("videoUrl", resolveMedia(media.videoPath()));
        }

        if (!actionLinks.isEmpty()) {
            ArrayNode actions = MAPPER.createArrayNode();
            actionLinks.forEach((action, link) -> {
                ObjectNode node = actions.addObject();
                node.put("id", action.wireId());
                node.put("title", action.title());
                node.put("icon", action.icon());
                node.put("requiresForeground", action.requiresForeground());
                node.put("deepLink", link);
            });
            data.put("actions", actions.toString());
        }

        data.put("deepLink", defaultLink);
        data.put("progress", Integer.toString(entry.progress()));
        data.put("category", category.name());
        return data;
    }

    private ObjectNode androidSection(BrewContext context, StageEntry entry, Map<String, String> data) {
        ObjectNode android = MAPPER.createObjectNode();
        android.put("priority", entry.highPriority() ? "HIGH" : "NORMAL");
        putData(android.putObject("data"), data);

        ObjectNode notification = android.putObject("notification");
        notification.put("title", entry.title());
        notification.put("body", entry.body());
        if (data.containsKey("imageUrl")) {
            notification.put("image", data.get("imageUrl"));
        }
        notification.put("channel_id", ANDROID_CHANNEL_ID);
        notification.put("notification_priority", entry.highPriority() ? "PRIORITY_HIGH" : "PRIORITY_DEFAULT");
        notification.put("sound", "default");
        notification.put("tag", "brew_" + context.brewId());
        return android;
    }

    private ObjectNode apnsSection(BrewContext context, StageEntry entry,
                                   NotificationCategory category, Map<String, String> data) {
        ObjectNode apns = MAPPER.createObjectNode();
        ObjectNode headers = apns.putObject("headers");
        headers.put("apns-priority", entry.highPriority() ? "10" : "5");
        headers.put("apns-push-type", "alert");
        headers.put("apns-collapse-id", context.brewId());

        ObjectNode payload = apns.putObject("payload");
        ObjectNode aps = payload.putObject("aps");
        ObjectNode alert = aps.putObject("alert");
        alert.put("title", entry.title());
        alert.put("body", entry.body());
        aps.put("sound", "default");
        aps.put("badge", 1);
        aps.put("mutable-content", 1);
        aps.put("thread-id", context.brewId());
        if (entry.hasActions()) {
            aps.put("category", category.name());
        }
        putData(payload, data);

        if (data.containsKey("imageUrl")) {
            apns.putObject("fcm_options").put("image", data.get("imageUrl"));
        }
        return apns;
    }

    private ObjectNode webPushSection(BrewContext context, StageEntry entry,
                                      Map<String, String> data, String defaultLink) {
        ObjectNode webpush = MAPPER.createObjectNode();
        webpush.putObject("headers").put("Urgency", entry.highPriority() ? "high" : "normal");
        putData(webpush.putObject("data"), data);

        ObjectNode notification = webpush.putObject("notification");
        notification.put("title", entry.title());
        notification.put("body", entry.body());
        notification.put("icon", WEB_ICON);
        notification.put("badge", WEB_BADGE);
        if (data.containsKey("imageUrl")) {
            notification.put("image", data.get("imageUrl"));
        }
        notification.put("tag", context.brewId());
        notification.put("renotify", true);
        notification.put("requireInteraction", entry.requireInteraction());
        if (entry.hasActions()) {
            ArrayNode actions = notification.putArray("actions");
            for (ActionId action : entry.actions()) {
                ObjectNode node = actions.addObject();
                node.put("action", action.wireId());
                node.put("title", action.title());
            }
        }

        // FCM only accepts an https click-through link; app-scheme links travel in data.deepLink
        if (defaultLink.startsWith("https://")) {
            webpush.putObject("fcm_options").put("link", defaultLink);
        }
        return webpush;
    }

    private String resolveMedia(String path) {
        if (path.startsWith("https://") || path.startsWith("http://")) {
            return path;
        }
        return mediaBaseUrl + (path.startsWith("/") ? path : "/" + path);
    }

    private static void putData(ObjectNode target, Map<String, String> data) {
        data.forEach(target::put);
    }

    private static String plain(BigDecimal value) {
        return value.stripTrailingZeros().toPlainString();
    }
}
