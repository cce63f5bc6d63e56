package com.firstcrack.bootstrap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Startup configuration validator.
 *
 * Throws IllegalStateException if configuration is invalid; the process
 * refuses to start.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    public static void validate(FirstCrackConfig config) {
        log.info("Running startup config validation...");

        if (config.port() < 1 || config.port() > 65535) {
            throw new IllegalStateException("INVALID CONFIG: PORT must be between 1 and 65535, got " + config.port());
        }

        if (config.schedulerThreads() < 1) {
            throw new IllegalStateException(
                "INVALID CONFIG: SCHEDULER_THREADS must be at least 1, got " + config.schedulerThreads());
        }

        requireHttpUrl("MEDIA_BASE_URL", config.mediaBaseUrl());

        switch (config.pushTransport()) {
            case FirstCrackConfig.TRANSPORT_LOG:
                log.warn("PUSH_TRANSPORT=log: notifications are logged, not delivered");
                break;
            case FirstCrackConfig.TRANSPORT_FCM:
                validateFcm(config);
                break;
            default:
                throw new IllegalStateException(
                    "INVALID CONFIG: PUSH_TRANSPORT must be 'log' or 'fcm', got '" + config.pushTransport() + "'");
        }

        log.info("Startup config validation passed");
    }

    private static void validateFcm(FirstCrackConfig config) {
        if (config.fcmProjectId() == null) {
            throw new IllegalStateException(
                "INVALID CONFIG: PUSH_TRANSPORT=fcm requires FCM_PROJECT_ID\n" +
                "Either set FCM_PROJECT_ID or use PUSH_TRANSPORT=log for local runs");
        }
        if (config.fcmAccessToken() == null) {
            throw new IllegalStateException(
                "INVALID CONFIG: PUSH_TRANSPORT=fcm requires FCM_ACCESS_TOKEN\n" +
                "Either set FCM_ACCESS_TOKEN or use PUSH_TRANSPORT=log for local runs");
        }
        if (config.fcmTimeoutSeconds() < 1) {
            throw new IllegalStateException(
                "INVALID CONFIG: FCM_TIMEOUT_SECONDS must be at least 1, got " + config.fcmTimeoutSeconds());
        }
        requireHttpUrl("FCM_ENDPOINT", config.fcmEndpoint());
        log.info("FCM transport configured for project {}", config.fcmProjectId());
    }

    private static void requireHttpUrl(String key, String value) {
        try {
            URI uri = new URI(value);
            String scheme = uri.getScheme();
            if (uri.getHost() == null || !("https".equals(scheme) || "http".equals(scheme))) {
                throw new IllegalStateException("INVALID CONFIG: " + key + " must be an http(s) URL, got " + value);
            }
        } catch (URISyntaxException e) {
            throw new IllegalStateException("INVALID CONFIG: " + key + " is not a valid URL: " + value, e);
        }
    }

    private StartupConfigValidator() {}
}
