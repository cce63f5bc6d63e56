package com.firstcrack.client.router;

public enum RejectReason {
    MISSING_BREW_ID,
    UNKNOWN_ACTION,
    CHANNEL_DETACHED,
    LISTENER_FAILED,
    MALFORMED_EVENT
}
