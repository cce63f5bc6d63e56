package com.firstcrack.infrastructure.push;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.firstcrack.domain.notification.StagePayloadSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;

/**
 * Sends stage notifications through the FCM HTTP v1 API.
 *
 * POST {endpoint}/v1/projects/{projectId}/messages:send
 * Authorization: Bearer {accessToken}
 *
 * The access token is supplied by configuration; minting it from a service
 * account is left to the deployment.
 */
public class FcmHttpPushTransport implements PushTransport {
    private static final Logger log = LoggerFactory.getLogger(FcmHttpPushTransport.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final HttpClient httpClient;
    private final URI sendUri;
    private final String accessToken;
    private final Duration requestTimeout;

    public FcmHttpPushTransport(String endpoint, String projectId, String accessToken, Duration timeout) {
        this(HttpClient.newBuilder().connectTimeout(timeout).build(), endpoint, projectId, accessToken, timeout);
    }

    public FcmHttpPushTransport(HttpClient httpClient, String endpoint, String projectId,
                                String accessToken, Duration timeout) {
        if (projectId == null || projectId.isBlank()) {
            throw new IllegalArgumentException("projectId cannot be null or empty");
        }
        if (accessToken == null || accessToken.isBlank()) {
            throw new IllegalArgumentException("accessToken cannot be null or empty");
        }
        String base = endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
        this.httpClient = httpClient;
        this.sendUri = URI.create(base + "/v1/projects/" + projectId + "/messages:send");
        this.accessToken = accessToken;
        this.requestTimeout = timeout;
    }

    @Override
    public String send(StagePayloadSet payload) {
        Instant start = Instant.now();
        HttpRequest request = HttpRequest.newBuilder()
            .uri(sendUri)
            .timeout(requestTimeout)
            .header("Authorization", "Bearer " + accessToken)
            .header("Content-Type", "application/json; charset=UTF-8")
            .header("Accept", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(payload.toJson()))
            .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new TransportSendException(payload.brewId(), payload.stage(), "connection error", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportSendException(payload.brewId(), payload.stage(), "interrupted", e);
        }

        if (response.statusCode() / 100 != 2) {
            log.warn("[FCM] {} {} rejected: HTTP {} {}", payload.brewId(), payload.stage().wireValue(),
                response.statusCode(), response.body());
            throw new TransportSendException(payload.brewId(), payload.stage(), response.statusCode(),
                "HTTP error " + response.statusCode());
        }

        String messageId = messageIdFrom(response.body());
        log.debug("[FCM] {} {} accepted as {} in {}ms", payload.brewId(), payload.stage().wireValue(),
            messageId, Duration.between(start, Instant.now()).toMillis());
        return messageId;
    }

    @Override
    public String name() {
        return "fcm";
    }

    private static String messageIdFrom(String body) {
        try {
            JsonNode json = MAPPER.readTree(body);
            if (json != null && json.hasNonNull("name")) {
                return json.get("name").asText();
            }
        } catch (IOException e) {
            log.warn("[FCM] Unparseable send response: {}", e.getMessage());
        }
        return "unknown";
    }
}
