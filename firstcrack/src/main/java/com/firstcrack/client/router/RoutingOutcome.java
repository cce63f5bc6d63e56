package com.firstcrack.client.router;

import com.firstcrack.domain.action.NavigationEvent;

import java.util.List;

/**
 * Terminal result of routing one interaction.
 *
 * @param state  DISPATCHED or REJECTED
 * @param event  published event, null when rejected before resolution
 * @param reason null when dispatched
 * @param path   states visited, starting at IDLE
 */
public record RoutingOutcome(
    RouterState state,
    NavigationEvent event,
    RejectReason reason,
    List<RouterState> path
) {
    public RoutingOutcome {
        path = List.copyOf(path);
    }

    static RoutingOutcome dispatched(NavigationEvent event) {
        return new RoutingOutcome(RouterState.DISPATCHED, event, null,
            List.of(RouterState.IDLE, RouterState.RECEIVED, RouterState.RESOLVED, RouterState.DISPATCHED));
    }

    static RoutingOutcome rejected(RejectReason reason) {
        return new RoutingOutcome(RouterState.REJECTED, null, reason,
            List.of(RouterState.IDLE, RouterState.RECEIVED, RouterState.REJECTED));
    }

    static RoutingOutcome rejectedAfterResolution(NavigationEvent event, RejectReason reason) {
        return new RoutingOutcome(RouterState.REJECTED, event, reason,
            List.of(RouterState.IDLE, RouterState.RECEIVED, RouterState.RESOLVED, RouterState.REJECTED));
    }

    public boolean isDispatched() {
        return state == RouterState.DISPATCHED;
    }
}
