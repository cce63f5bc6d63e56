package com.firstcrack.client.router;

import com.firstcrack.domain.action.NavigationEvent;

import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Single-owner outlet for navigation events.
 *
 * At most one listener is attached at a time. Publishing while nothing is
 * attached is not an error; {@link #publish} reports it and the caller
 * decides what to do.
 */
public final class NavigationChannel {

    private final AtomicReference<Consumer<NavigationEvent>> owner = new AtomicReference<>();

    private static final class Holder {
        static final NavigationChannel SHARED = new NavigationChannel();
    }

    /**
     * Process-wide channel, created on first use.
     */
    public static NavigationChannel shared() {
        return Holder.SHARED;
    }

    /**
     * @throws IllegalStateException if another listener already owns the channel
     */
    public void attach(Consumer<NavigationEvent> listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        if (!owner.compareAndSet(null, listener) && owner.get() != listener) {
            throw new IllegalStateException("Navigation channel already has an owner");
        }
    }

    /**
     * @return {@code true} if {@code listener} was the owner
     */
    public boolean detach(Consumer<NavigationEvent> listener) {
        return owner.compareAndSet(listener, null);
    }

    public boolean isAttached() {
        return owner.get() != null;
    }

    /**
     * @return {@code false} if no listener is attached; the event is dropped
     */
    public boolean publish(NavigationEvent event) {
        Consumer<NavigationEvent> listener = owner.get();
        if (listener == null) {
            return false;
        }
        listener.accept(event);
        return true;
    }
}
