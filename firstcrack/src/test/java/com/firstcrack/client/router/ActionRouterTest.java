package com.firstcrack.client.router;

import com.firstcrack.domain.action.ActionId;
import com.firstcrack.domain.action.ActionRegistry;
import com.firstcrack.domain.action.NavigationEvent;
import com.firstcrack.domain.notification.PlatformSurface;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Action Router")
class ActionRouterTest {

    private NavigationChannel channel;
    private List<NavigationEvent> received;
    private ActionRouter router;

    @BeforeEach
    void setUp() {
        channel = new NavigationChannel();
        received = new ArrayList<>();
        channel.attach(received::add);
        router = new ActionRouter(new ActionRegistry(), channel);
    }

    @Test
    @DisplayName("stop_shot on brew_1_2 navigates to the stop screen")
    void testStopShot() {
        RoutingOutcome outcome = router.route(
            new InteractionEvent("stop_shot", "brew_1_2", null, null, PlatformSurface.ANDROID));

        assertTrue(outcome.isDispatched());
        NavigationEvent expected = new NavigationEvent(ActionId.STOP_SHOT, "brew_1_2", "firstcrack://brew/brew_1_2/stop");
        assertEquals(expected, outcome.event());
        assertEquals(List.of(expected), received);
        assertEquals(List.of(RouterState.IDLE, RouterState.RECEIVED, RouterState.RESOLVED, RouterState.DISPATCHED),
            outcome.path());
    }

    @Test
    @DisplayName("Missing brewId is always rejected")
    void testMissingBrewIdRejected() {
        for (String action : List.of("stop_shot", "default", "", "com.apple.UNNotificationDefaultActionIdentifier")) {
            RoutingOutcome outcome = router.route(new InteractionEvent(action, null, "firstcrack://brew/x/stop",
                null, PlatformSurface.APNS));

            assertEquals(RouterState.REJECTED, outcome.state(), action);
            assertEquals(RejectReason.MISSING_BREW_ID, outcome.reason());
            assertNull(outcome.event());
        }
        assertEquals(RejectReason.MISSING_BREW_ID,
            router.route(new InteractionEvent("share", "  ", null, null, null)).reason());
        assertTrue(received.isEmpty());
    }

    @Test
    void testUnknownActionRejected() {
        RoutingOutcome outcome = router.route(new InteractionEvent("make_tea", "brew_1_2", null, null, null));

        assertEquals(RejectReason.UNKNOWN_ACTION, outcome.reason());
        assertEquals(List.of(RouterState.IDLE, RouterState.RECEIVED, RouterState.REJECTED), outcome.path());
        assertTrue(received.isEmpty());
    }

    @Test
    void testBodyTapOnEverySurfaceOpensDetails() {
        router.route(InteractionEventDecoder.fromAndroidExtras(Map.of("brewId", "brew_9_9")));
        router.route(InteractionEventDecoder.fromApnsResponse(ActionRegistry.APNS_DEFAULT_TAP,
            Map.of("brewId", "brew_9_9")));
        router.route(new InteractionEvent("", "brew_9_9", null, null, PlatformSurface.WEB_PUSH));

        assertEquals(3, received.size());
        for (NavigationEvent event : received) {
            assertEquals(ActionId.DEFAULT, event.action());
            assertEquals("firstcrack://brew/brew_9_9/details", event.deepLink());
        }
    }

    @Test
    @DisplayName("A deep link supplied by the surface wins")
    void testSuppliedDeepLinkWins() {
        RoutingOutcome outcome = router.route(new InteractionEvent("view_live", "brew_1_2",
            "firstcrack://brew/brew_1_2/live?t=45", null, PlatformSurface.WEB_PUSH));

        assertEquals("firstcrack://brew/brew_1_2/live?t=45", outcome.event().deepLink());
        assertEquals(ActionId.VIEW_LIVE, outcome.event().action());
    }

    @Test
    @DisplayName("Malformed brewId falls back to the generic details link")
    void testInvalidBrewIdFallsBack() {
        RoutingOutcome outcome = router.route(new InteractionEvent("stop_shot", "abc;rm -rf", null, null, null));

        assertTrue(outcome.isDispatched());
        assertEquals("firstcrack://brew/details", outcome.event().deepLink());
        assertEquals(NavigationEvent.UNKNOWN_BREW_ID, outcome.event().brewId());
        assertEquals(List.of(outcome.event()), received);
        assertFalse(received.get(0).brewId().contains(";"));
    }

    @Test
    @DisplayName("A failing navigation listener is reported, not thrown")
    void testListenerFailureRejected() {
        NavigationChannel failing = new NavigationChannel();
        failing.attach(event -> {
            throw new IllegalStateException("ui listener failed");
        });
        ActionRouter failingRouter = new ActionRouter(new ActionRegistry(), failing);

        RoutingOutcome outcome = assertDoesNotThrow(() -> failingRouter.route(
            new InteractionEvent("stop_shot", "brew_1_2", null, null, PlatformSurface.ANDROID)));

        assertEquals(RouterState.REJECTED, outcome.state());
        assertEquals(RejectReason.LISTENER_FAILED, outcome.reason());
        assertEquals("firstcrack://brew/brew_1_2/stop", outcome.event().deepLink());
        assertTrue(outcome.state().isTerminal());
    }

    @Test
    void testDetachedChannel() {
        NavigationChannel detached = new NavigationChannel();
        ActionRouter detachedRouter = new ActionRouter(new ActionRegistry(), detached);

        RoutingOutcome outcome = detachedRouter.route(new InteractionEvent("share", "brew_1_2", null, null, null));

        assertEquals(RouterState.REJECTED, outcome.state());
        assertEquals(RejectReason.CHANNEL_DETACHED, outcome.reason());
        assertNotNull(outcome.event());
        assertEquals(List.of(RouterState.IDLE, RouterState.RECEIVED, RouterState.RESOLVED, RouterState.REJECTED),
            outcome.path());
    }

    @Test
    void testRouteJson() {
        RoutingOutcome outcome = router.route("{\"wireActionId\":\"brew_again\",\"brewId\":\"brew_5_1\"}");
        assertEquals("firstcrack://brew/brew_5_1/repeat", outcome.event().deepLink());

        assertEquals(RejectReason.MALFORMED_EVENT, router.route("not json").reason());
        assertEquals(RejectReason.MALFORMED_EVENT, router.route("{\"brewId\":\"brew_5_1\"}").reason());
        assertEquals(RejectReason.MALFORMED_EVENT, router.route((InteractionEvent) null).reason());
        assertEquals(1, received.size());
    }

    @Test
    void testOneEventPerInteraction() {
        router.route(new InteractionEvent("pause_grinding", "brew_3_3", null, "grinding", PlatformSurface.ANDROID));
        router.route(new InteractionEvent("adjust_grind", "brew_3_3", null, "grinding", PlatformSurface.ANDROID));

        assertEquals(2, received.size());
        assertEquals("firstcrack://brew/brew_3_3/pause", received.get(0).deepLink());
        assertEquals("firstcrack://brew/brew_3_3/settings", received.get(1).deepLink());
    }
}
