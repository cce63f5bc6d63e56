package com.firstcrack.bootstrap;

import com.firstcrack.util.Env;

/**
 * Process configuration, read once at startup.
 *
 * @param pushTransport {@code log} (dry run) or {@code fcm}
 */
public record FirstCrackConfig(
    int port,
    String bindHost,
    String mediaBaseUrl,
    String deepLinkScheme,
    String pushTransport,
    String fcmProjectId,
    String fcmAccessToken,
    String fcmEndpoint,
    int fcmTimeoutSeconds,
    int schedulerThreads
) {
    public static final String TRANSPORT_LOG = "log";
    public static final String TRANSPORT_FCM = "fcm";

    public static FirstCrackConfig fromEnv() {
        return new FirstCrackConfig(
            Env.getInt("PORT", 8080),
            Env.get("BIND_HOST", "0.0.0.0"),
            Env.get("MEDIA_BASE_URL", "https://storage.googleapis.com/first-crack-demo"),
            Env.get("DEEP_LINK_SCHEME", "firstcrack"),
            Env.get("PUSH_TRANSPORT", TRANSPORT_LOG).toLowerCase(),
            Env.get("FCM_PROJECT_ID", null),
            Env.get("FCM_ACCESS_TOKEN", null),
            Env.get("FCM_ENDPOINT", "https://fcm.googleapis.com"),
            Env.getInt("FCM_TIMEOUT_SECONDS", 10),
            Env.getInt("SCHEDULER_THREADS", 2));
    }

    public boolean usesFcm() {
        return TRANSPORT_FCM.equals(pushTransport);
    }

    @Override
    public String toString() {
        // access token left out
        return String.format(
            "FirstCrackConfig[port=%d, bindHost=%s, mediaBaseUrl=%s, deepLinkScheme=%s, pushTransport=%s, "
                + "fcmProjectId=%s, fcmEndpoint=%s, fcmTimeoutSeconds=%d, schedulerThreads=%d]",
            port, bindHost, mediaBaseUrl, deepLinkScheme, pushTransport,
            fcmProjectId, fcmEndpoint, fcmTimeoutSeconds, schedulerThreads);
    }
}
