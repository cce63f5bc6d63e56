package com.firstcrack.client.router;

import com.firstcrack.domain.action.ActionId;
import com.firstcrack.domain.action.ActionRegistry;
import com.firstcrack.domain.action.NavigationEvent;
import com.firstcrack.domain.action.UnknownActionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves notification interactions into navigation events.
 *
 * Stateless per event; safe to call from any thread. A deep link supplied by
 * the delivering surface is used as-is; otherwise the link is computed from
 * the action and brew id, falling back to the generic details link when the
 * brew id cannot be interpolated. Such a brew id is also replaced by
 * {@link NavigationEvent#UNKNOWN_BREW_ID} in the published event.
 *
 * Rejections are logged and never thrown.
 */
public final class ActionRouter {
    private static final Logger log = LoggerFactory.getLogger(ActionRouter.class);

    private final ActionRegistry registry;
    private final NavigationChannel channel;

    public ActionRouter(ActionRegistry registry, NavigationChannel channel) {
        this.registry = registry;
        this.channel = channel;
    }

    public RoutingOutcome route(InteractionEvent event) {
        if (event == null) {
            log.warn("[ROUTER] Rejected: no event");
            return RoutingOutcome.rejected(RejectReason.MALFORMED_EVENT);
        }
        if (!event.hasBrewId()) {
            log.warn("[ROUTER] Rejected {} from {}: missing brewId", event.wireActionId(), event.source());
            return RoutingOutcome.rejected(RejectReason.MISSING_BREW_ID);
        }

        ActionId action;
        try {
            action = registry.resolve(event.wireActionId());
        } catch (UnknownActionException e) {
            log.warn("[ROUTER] Rejected {} for {}: {}", event.wireActionId(), event.brewId(), e.getMessage());
            return RoutingOutcome.rejected(RejectReason.UNKNOWN_ACTION);
        }

        // a brew id that fails the allow-list never reaches the UI
        boolean trusted = registry.isValidBrewId(event.brewId());
        String brewId = trusted ? event.brewId() : NavigationEvent.UNKNOWN_BREW_ID;
        String deepLink = event.hasDeepLink()
            ? event.deepLink()
            : registry.deepLinkOrFallback(action, event.brewId());
        NavigationEvent navigation = new NavigationEvent(action, brewId, deepLink);

        boolean delivered;
        try {
            delivered = channel.publish(navigation);
        } catch (RuntimeException e) {
            log.warn("[ROUTER] Dropped {} for {}: navigation listener failed", action, brewId, e);
            return RoutingOutcome.rejectedAfterResolution(navigation, RejectReason.LISTENER_FAILED);
        }
        if (!delivered) {
            log.warn("[ROUTER] Dropped {} for {}: navigation channel not attached", action, brewId);
            return RoutingOutcome.rejectedAfterResolution(navigation, RejectReason.CHANNEL_DETACHED);
        }
        log.info("[ROUTER] {} -> {}", action.wireId(), deepLink);
        return RoutingOutcome.dispatched(navigation);
    }

    /**
     * Decode and route a generic JSON interaction event.
     */
    public RoutingOutcome route(String json) {
        InteractionEvent event;
        try {
            event = InteractionEventDecoder.fromJson(json);
        } catch (IllegalArgumentException e) {
            log.warn("[ROUTER] Rejected malformed event: {}", e.getMessage());
            return RoutingOutcome.rejected(RejectReason.MALFORMED_EVENT);
        }
        return route(event);
    }
}
