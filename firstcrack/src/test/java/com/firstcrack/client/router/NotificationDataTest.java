package com.firstcrack.client.router;

import com.firstcrack.domain.action.ActionId;
import com.firstcrack.domain.action.ActionRegistry;
import com.firstcrack.domain.brew.BrewContext;
import com.firstcrack.domain.brew.BrewType;
import com.firstcrack.domain.notification.PlatformSurface;
import com.firstcrack.domain.notification.StagePayloadSet;
import com.firstcrack.domain.stage.NotificationCategory;
import com.firstcrack.domain.stage.StageEntry;
import com.firstcrack.domain.stage.StageId;
import com.firstcrack.domain.stage.StageTimeline;
import com.firstcrack.service.notification.PayloadBuilder;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Notification data decoding")
class NotificationDataTest {

    @Test
    @DisplayName("Every stage's sent data decodes back to the same typed values")
    void testDecodesWhatThePayloadBuilderSends() {
        StageTimeline timeline = StageTimeline.standard();
        PayloadBuilder builder = new PayloadBuilder(new ActionRegistry(), "https://media.example.com",
            timeline.totalDurationSeconds());
        BrewContext context = new BrewContext("brew_1700000000000_42", "dev-123", BrewType.LUNGO,
            new BigDecimal("19.5"), new BigDecimal("92.5"), BigDecimal.valueOf(9), 8, 28,
            Instant.parse("2026-01-01T08:00:00Z"));

        for (StageEntry entry : timeline.entries()) {
            StagePayloadSet payload = builder.build(context, entry);
            NotificationData data = NotificationData.fromDataMap(payload.data());
            String stage = entry.stageId().name();

            assertEquals(entry.stageId(), data.stage(), stage);
            assertEquals("brew_1700000000000_42", data.brewId(), stage);
            assertEquals(entry.title(), data.title(), stage);
            assertEquals(entry.body(), data.body(), stage);
            assertEquals(BrewType.LUNGO, data.brewType(), stage);
            assertEquals(0, new BigDecimal("19.5").compareTo(data.dose()), stage);
            assertEquals(0, new BigDecimal("92.5").compareTo(data.temperature()), stage);
            assertEquals(0, BigDecimal.valueOf(9).compareTo(data.pressure()), stage);
            assertEquals(entry.offsetSeconds(), data.elapsedTime(), stage);
            assertEquals(entry.progress(), data.progress(), stage);
            assertEquals(entry.actions(), data.actions(), stage);
            assertEquals(NotificationCategory.forStage(entry.stageId()), data.category(), stage);
            assertEquals(entry.stageId() == StageId.COMPLETE, data.isComplete(), stage);
            assertEquals(payload.data().get("deepLink"), data.deepLink(), stage);
            assertEquals(payload.data().get("imageUrl"), data.imageUrl(), stage);
            if (entry.offsetSeconds() < timeline.totalDurationSeconds()) {
                assertEquals(timeline.totalDurationSeconds() - entry.offsetSeconds(), data.remainingTime(), stage);
            } else {
                assertNull(data.remainingTime(), stage);
            }
        }
    }

    @Test
    void testBrewingStageDecodedFromWebClick() {
        PayloadBuilder builder = new PayloadBuilder(new ActionRegistry(), "https://media.example.com", 75);
        BrewContext context = new BrewContext("brew_5_5", "dev-1", BrewType.ESPRESSO, BigDecimal.valueOf(18),
            BigDecimal.valueOf(93), BigDecimal.valueOf(9), 8, 28, Instant.parse("2026-01-01T08:00:00Z"));
        StageEntry brewing = StageTimeline.standard().find(StageId.BREWING).orElseThrow();
        ObjectNode web = builder.build(context, brewing).forSurface(PlatformSurface.WEB_PUSH);

        InteractionEvent event = InteractionEventDecoder.fromWebNotificationClick("view_live", web.get("data"));

        assertEquals(StageId.BREWING, event.stage());
        assertEquals(List.of(ActionId.STOP_SHOT, ActionId.VIEW_LIVE), event.data().actions());
        assertEquals("https://media.example.com/videos/extraction-live.mp4", event.data().videoUrl());
        assertEquals(NotificationCategory.BREW_EXTRACTION, event.data().category());
    }

    @Test
    @DisplayName("Absent or unparseable fields take their defaults")
    void testDefaults() {
        NotificationData empty = NotificationData.fromDataMap(Map.of());

        assertEquals(NotificationData.DEFAULT_TYPE, empty.type());
        assertEquals(StageId.HEATING, empty.stage());
        assertNull(empty.brewId());
        assertEquals("", empty.title());
        assertEquals(BrewType.ESPRESSO, empty.brewType());
        assertEquals(new BigDecimal("18.0"), empty.dose());
        assertEquals(new BigDecimal("93.0"), empty.temperature());
        assertEquals(new BigDecimal("9.0"), empty.pressure());
        assertEquals(0, empty.elapsedTime());
        assertNull(empty.remainingTime());
        assertNull(empty.progress());
        assertTrue(empty.actions().isEmpty());
        assertEquals(NotificationCategory.BREW_HEATING, empty.category());
        assertEquals(empty, NotificationData.fromDataMap(null));

        Map<String, String> garbled = new HashMap<>();
        garbled.put("stage", "roasting");
        garbled.put("dose", "lots");
        garbled.put("elapsedTime", "4.5");
        garbled.put("progress", "");
        garbled.put("brewType", "frappe");
        garbled.put("actions", "{not an array");
        NotificationData parsed = NotificationData.fromDataMap(garbled);

        assertEquals(StageId.HEATING, parsed.stage());
        assertEquals(new BigDecimal("18.0"), parsed.dose());
        assertEquals(0, parsed.elapsedTime());
        assertNull(parsed.progress());
        assertEquals(BrewType.ESPRESSO, parsed.brewType());
        assertTrue(parsed.actions().isEmpty());
    }

    @Test
    void testActionsDecoding() {
        assertEquals(List.of(ActionId.BREW_AGAIN, ActionId.SHARE),
            NotificationData.actions("[{\"id\":\"brew_again\"},{\"id\":\"make_tea\"},\"share\",{\"id\":\"default\"}]"));
        assertEquals(List.of(), NotificationData.actions("\"stop_shot\""));
        assertEquals(List.of(), NotificationData.actions(null));
    }
}
