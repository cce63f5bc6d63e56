package com.firstcrack.domain.stage;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NotificationCategoryTest {

    @Test
    void testEveryStageHasExplicitCategory() {
        assertEquals(NotificationCategory.BREW_HEATING, NotificationCategory.forStage(StageId.HEATING));
        assertEquals(NotificationCategory.BREW_GRINDING, NotificationCategory.forStage(StageId.GRINDING));
        assertEquals(NotificationCategory.BREW_PREINFUSION, NotificationCategory.forStage(StageId.PRE_INFUSION));
        assertEquals(NotificationCategory.BREW_EXTRACTION, NotificationCategory.forStage(StageId.BREWING));
        assertEquals(NotificationCategory.BREW_COMPLETE, NotificationCategory.forStage(StageId.COMPLETE));
    }

    @Test
    void testWireValues() {
        assertEquals(NotificationCategory.BREW_PREINFUSION, NotificationCategory.forStage("pre_infusion"));
        assertEquals(NotificationCategory.BREW_EXTRACTION, NotificationCategory.forStage("brewing"));
    }

    @Test
    void testUnknownStageFallsBackToNoActions() {
        assertEquals(NotificationCategory.NO_ACTIONS, NotificationCategory.forStage("tamping"));
        assertEquals(NotificationCategory.NO_ACTIONS, NotificationCategory.forStage((String) null));
        assertEquals(NotificationCategory.NO_ACTIONS, NotificationCategory.forStage((StageId) null));
        assertEquals(NotificationCategory.BREW_HEATING, NotificationCategory.NO_ACTIONS);
    }
}
