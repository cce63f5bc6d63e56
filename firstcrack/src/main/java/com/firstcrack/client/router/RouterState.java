package com.firstcrack.client.router;

/**
 * Lifecycle of one interaction through the router.
 *
 * IDLE → RECEIVED → RESOLVED → DISPATCHED, or RECEIVED → REJECTED.
 * DISPATCHED and REJECTED are terminal.
 */
public enum RouterState {
    IDLE,
    RECEIVED,
    RESOLVED,
    DISPATCHED,
    REJECTED;

    public boolean isTerminal() {
        return this == DISPATCHED || this == REJECTED;
    }
}
