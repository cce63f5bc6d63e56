package com.firstcrack.domain.action;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Bidirectional mapping between wire action identifiers and {@link ActionId},
 * and from {@link ActionId} to deep links.
 *
 * Deep link format: {@code <scheme>://brew/<brewId>/<path-segment>}
 *
 * Default-tap sentinels (all resolve to {@link ActionId#DEFAULT}):
 * <ul>
 *   <li>{@code com.apple.UNNotificationDefaultActionIdentifier} - APNs body tap</li>
 *   <li>{@code default} - Android launcher intent</li>
 *   <li>empty string - Web Push {@code notificationclick} without an action</li>
 * </ul>
 *
 * Read-only after construction; safe to share between threads.
 */
public final class ActionRegistry {
    private static final Logger log = LoggerFactory.getLogger(ActionRegistry.class);

    public static final String DEFAULT_SCHEME = "firstcrack";

    public static final String APNS_DEFAULT_TAP = "com.apple.UNNotificationDefaultActionIdentifier";
    public static final String ANDROID_DEFAULT_TAP = "default";
    public static final String WEB_DEFAULT_TAP = "";

    private static final Set<String> DEFAULT_TAP_SENTINELS =
        Set.of(APNS_DEFAULT_TAP, ANDROID_DEFAULT_TAP, WEB_DEFAULT_TAP);

    private static final Pattern BREW_ID_PATTERN = Pattern.compile("^[a-zA-Z0-9_-]+$");
    private static final Pattern SCHEME_PATTERN = Pattern.compile("^[a-z][a-z0-9+.-]*$");
    private static final int MAX_BREW_ID_LENGTH = 128;

    private final String scheme;
    private final Map<String, ActionId> byWireId;

    public ActionRegistry() {
        this(DEFAULT_SCHEME);
    }

    public ActionRegistry(String scheme) {
        if (scheme == null || !SCHEME_PATTERN.matcher(scheme).matches()) {
            throw new IllegalArgumentException("Invalid deep link scheme: " + scheme);
        }
        this.scheme = scheme;

        Map<String, ActionId> map = new LinkedHashMap<>();
        for (ActionId action : ActionId.values()) {
            if (action == ActionId.DEFAULT) {
                continue;
            }
            if (DEFAULT_TAP_SENTINELS.contains(action.wireId())) {
                throw new IllegalStateException("Wire id collides with a default-tap sentinel: " + action.wireId());
            }
            if (map.put(action.wireId(), action) != null) {
                throw new IllegalStateException("Duplicate wire id: " + action.wireId());
            }
        }
        this.byWireId = Collections.unmodifiableMap(map);
    }

    public String scheme() {
        return scheme;
    }

    /**
     * Resolve a wire identifier reported by a notification surface.
     *
     * @throws UnknownActionException if the id is not part of the closed set
     */
    public ActionId resolve(String wireId) {
        if (wireId == null) {
            throw new UnknownActionException(null);
        }
        if (DEFAULT_TAP_SENTINELS.contains(wireId)) {
            return ActionId.DEFAULT;
        }
        ActionId action = byWireId.get(wireId);
        if (action == null) {
            throw new UnknownActionException(wireId);
        }
        return action;
    }

    public Optional<ActionId> tryResolve(String wireId) {
        try {
            return Optional.of(resolve(wireId));
        } catch (UnknownActionException e) {
            return Optional.empty();
        }
    }

    public String wireIdOf(ActionId action) {
        return action.wireId();
    }

    /**
     * Non-default actions, in declaration order.
     */
    public Set<ActionId> buttonActions() {
        return Collections.unmodifiableSet(EnumSet.copyOf(byWireId.values()));
    }

    public boolean isDefaultTap(String wireId) {
        return wireId != null && DEFAULT_TAP_SENTINELS.contains(wireId);
    }

    public boolean isValidBrewId(String brewId) {
        return brewId != null
            && brewId.length() <= MAX_BREW_ID_LENGTH
            && BREW_ID_PATTERN.matcher(brewId).matches();
    }

    /**
     * Build the deep link for an action on a brew.
     *
     * @throws InvalidBrewIdException if the brew id fails the allow-list check;
     *         nothing is interpolated in that case
     */
    public String deepLinkFor(ActionId action, String brewId) {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        if (!isValidBrewId(brewId)) {
            throw new InvalidBrewIdException(brewId);
        }
        return scheme + "://brew/" + brewId + "/" + action.pathSegment();
    }

    /**
     * Details link not scoped to any brew.
     */
    public String genericDetailsLink() {
        return scheme + "://brew/" + ActionId.DEFAULT.pathSegment();
    }

    /**
     * {@link #deepLinkFor} falling back to {@link #genericDetailsLink()} for a
     * malformed brew id, so the interaction still leads somewhere.
     */
    public String deepLinkOrFallback(ActionId action, String brewId) {
        try {
            return deepLinkFor(action, brewId);
        } catch (InvalidBrewIdException e) {
            log.warn("[ACTIONS] {} - using generic details link", e.getMessage());
            return genericDetailsLink();
        }
    }
}
