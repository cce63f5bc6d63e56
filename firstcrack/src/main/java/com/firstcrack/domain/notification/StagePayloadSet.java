package com.firstcrack.domain.notification;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.firstcrack.domain.stage.NotificationCategory;
import com.firstcrack.domain.stage.StageId;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Every platform rendering of one stage notification for one brew.
 *
 * {@code data} is the string-only core record shared by all surfaces; each
 * platform section embeds it again in the place that surface reads custom
 * data from. Field order is fixed, so {@link #toJson()} is stable for equal
 * inputs.
 */
public final class StagePayloadSet {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String brewId;
    private final StageId stage;
    private final String deviceAddress;
    private final NotificationCategory category;
    private final Map<String, String> data;
    private final ObjectNode android;
    private final ObjectNode apns;
    private final ObjectNode webpush;

    public StagePayloadSet(String brewId, StageId stage, String deviceAddress,
                           NotificationCategory category, Map<String, String> data,
                           ObjectNode android, ObjectNode apns, ObjectNode webpush) {
        this.brewId = brewId;
        this.stage = stage;
        this.deviceAddress = deviceAddress;
        this.category = category;
        this.data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
        this.android = android.deepCopy();
        this.apns = apns.deepCopy();
        this.webpush = webpush.deepCopy();
    }

    public String brewId() {
        return brewId;
    }

    public StageId stage() {
        return stage;
    }

    public String deviceAddress() {
        return deviceAddress;
    }

    public NotificationCategory category() {
        return category;
    }

    public Map<String, String> data() {
        return data;
    }

    public ObjectNode forSurface(PlatformSurface surface) {
        switch (surface) {
            case ANDROID:
                return android.deepCopy();
            case APNS:
                return apns.deepCopy();
            case WEB_PUSH:
                return webpush.deepCopy();
            default:
                throw new IllegalArgumentException("Unsupported surface: " + surface);
        }
    }

    /**
     * FCM HTTP v1 request body: {@code {"message": {...}}}.
     */
    public ObjectNode toFcmMessage() {
        ObjectNode root = MAPPER.createObjectNode();
        ObjectNode message = root.putObject("message");
        message.put("token", deviceAddress);
        ObjectNode dataNode = message.putObject("data");
        data.forEach(dataNode::put);
        message.set(PlatformSurface.ANDROID.key(), android.deepCopy());
        message.set(PlatformSurface.APNS.key(), apns.deepCopy());
        message.set(PlatformSurface.WEB_PUSH.key(), webpush.deepCopy());
        return root;
    }

    public String toJson() {
        return toFcmMessage().toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StagePayloadSet)) return false;
        return toJson().equals(((StagePayloadSet) o).toJson());
    }

    @Override
    public int hashCode() {
        return toJson().hashCode();
    }

    @Override
    public String toString() {
        return String.format("StagePayloadSet[brewId=%s, stage=%s, category=%s]", brewId, stage, category);
    }
}
