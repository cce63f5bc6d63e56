package com.firstcrack.transport.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.firstcrack.domain.brew.BrewRequest;
import com.firstcrack.domain.brew.BrewStartResult;
import com.firstcrack.domain.common.ValidationError;
import com.firstcrack.domain.common.ValidationErrorCode;
import com.firstcrack.service.brew.BrewRequestValidator;
import com.firstcrack.service.brew.BrewService;
import com.firstcrack.service.brew.BrewValidationException;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Deque;
import java.util.List;

/**
 * HTTP handlers for the brew API.
 *
 * - POST /api/brews (alias POST /startBrew) - start a brew
 * - POST /api/brews/{brewId}/stop (alias POST /stopBrew) - cancel remaining stages
 * - GET /api/health - service status
 */
public final class BrewHandlers {
    private static final Logger log = LoggerFactory.getLogger(BrewHandlers.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String SERVICE_NAME = "first-crack";

    // JSON Response Keys
    private static final String JSON_SUCCESS = "success";
    private static final String JSON_MESSAGE = "message";
    private static final String JSON_ERROR = "error";
    private static final String JSON_BREW_ID = "brewId";

    private final BrewService brewService;
    private final Clock clock;
    private final String version;

    public BrewHandlers(BrewService brewService, Clock clock, String version) {
        this.brewService = brewService;
        this.clock = clock;
        this.version = version;
    }

    /**
     * POST /api/brews
     *
     * Body: {deviceToken, brewType, dose, targetTemp, targetPressure,
     * preinfusionDuration?, extractionTime?}
     */
    public void startBrew(HttpServerExchange exchange) {
        exchange.getRequestReceiver().receiveFullString((ex, body) -> {
            try {
                BrewRequest request = parseBrewRequest(MAPPER.readTree(body));
                BrewStartResult result = brewService.startBrew(request);

                ObjectNode response = MAPPER.createObjectNode();
                response.put(JSON_SUCCESS, true);
                response.put(JSON_BREW_ID, result.brewId());
                response.put(JSON_MESSAGE, "Brew started");
                response.put("stages", result.stageCount());
                response.put("estimatedDuration", result.estimatedDurationSeconds());
                sendJson(ex, StatusCodes.OK, response);

            } catch (BrewValidationException e) {
                validationFailed(ex, e.getErrors());
            } catch (JsonProcessingException | IllegalArgumentException e) {
                log.warn("[HTTP] Malformed brew request: {}", e.getMessage());
                sendError(ex, StatusCodes.BAD_REQUEST, "Request body must be a JSON object");
            } catch (Exception e) {
                log.error("[HTTP] Failed to start brew", e);
                sendError(ex, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to start brew");
            }
        }, StandardCharsets.UTF_8);
    }

    /**
     * POST /api/brews/{brewId}/stop
     */
    public void stopBrew(HttpServerExchange exchange) {
        Deque<String> brewIdParam = exchange.getQueryParameters().get(JSON_BREW_ID);
        String brewId = brewIdParam != null ? brewIdParam.peekFirst() : null;
        stop(exchange, brewId);
    }

    /**
     * POST /stopBrew with body {brewId}
     */
    public void stopBrewByBody(HttpServerExchange exchange) {
        exchange.getRequestReceiver().receiveFullString((ex, body) -> {
            try {
                JsonNode json = MAPPER.readTree(body);
                String brewId = json != null && json.hasNonNull(JSON_BREW_ID) ? json.get(JSON_BREW_ID).asText() : null;
                stop(ex, brewId);
            } catch (JsonProcessingException e) {
                sendError(ex, StatusCodes.BAD_REQUEST, "Request body must be a JSON object");
            }
        }, StandardCharsets.UTF_8);
    }

    /**
     * GET /api/health
     */
    public void health(HttpServerExchange exchange) {
        ObjectNode health = MAPPER.createObjectNode();
        health.put("status", "ok");
        health.put("service", SERVICE_NAME);
        health.put("version", version);
        health.put("timestamp", clock.instant().toString());
        health.put("activeBrews", brewService.activeBrewCount());
        sendJson(exchange, StatusCodes.OK, health);
    }

    private void stop(HttpServerExchange exchange, String brewId) {
        if (brewId == null || brewId.isBlank()) {
            sendError(exchange, StatusCodes.BAD_REQUEST, "brewId is required");
            return;
        }
        try {
            boolean cancelled = brewService.stopBrew(brewId);
            ObjectNode response = MAPPER.createObjectNode();
            response.put(JSON_SUCCESS, true);
            response.put(JSON_BREW_ID, brewId);
            response.put("cancelled", cancelled);
            sendJson(exchange, StatusCodes.OK, response);
        } catch (Exception e) {
            log.error("[HTTP] Failed to stop brew {}", brewId, e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to stop brew");
        }
    }

    /**
     * Map the JSON body onto a request. Absent or non-numeric parameters
     * become null and are reported by the validator.
     */
    static BrewRequest parseBrewRequest(JsonNode json) {
        if (json == null || !json.isObject()) {
            throw new IllegalArgumentException("body is not a JSON object");
        }
        return new BrewRequest(
            text(json, BrewRequestValidator.FIELD_BREW_TYPE),
            decimal(json, BrewRequestValidator.FIELD_DOSE),
            decimal(json, BrewRequestValidator.FIELD_TEMPERATURE),
            decimal(json, BrewRequestValidator.FIELD_PRESSURE),
            text(json, BrewRequestValidator.FIELD_DEVICE),
            seconds(json, BrewRequestValidator.FIELD_PREINFUSION),
            seconds(json, BrewRequestValidator.FIELD_EXTRACTION));
    }

    private static String text(JsonNode json, String field) {
        JsonNode node = json.get(field);
        return node != null && node.isTextual() ? node.asText() : null;
    }

    private static BigDecimal decimal(JsonNode json, String field) {
        JsonNode node = json.get(field);
        return node != null && node.isNumber() ? node.decimalValue() : null;
    }

    private static Integer seconds(JsonNode json, String field) {
        JsonNode node = json.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isIntegralNumber() || !node.canConvertToInt()) {
            throw new BrewValidationException(List.of(ValidationError.of(
                ValidationErrorCode.MISSING_FIELD, field, "Must be a whole number of seconds", node.toString())));
        }
        return node.intValue();
    }

    private void validationFailed(HttpServerExchange exchange, List<ValidationError> errors) {
        ObjectNode response = MAPPER.createObjectNode();
        response.put(JSON_SUCCESS, false);
        response.put(JSON_ERROR, "Invalid brew parameters");
        ArrayNode details = response.putArray("details");
        for (ValidationError error : errors) {
            ObjectNode node = details.addObject();
            node.put("field", error.field());
            node.put("code", error.code().name());
            node.put(JSON_MESSAGE, error.message());
            if (error.rejected() != null) {
                node.set("rejected", MAPPER.valueToTree(error.rejected()));
            }
        }
        sendJson(exchange, StatusCodes.BAD_REQUEST, response);
    }

    private void sendError(HttpServerExchange exchange, int statusCode, String message) {
        ObjectNode response = MAPPER.createObjectNode();
        response.put(JSON_SUCCESS, false);
        response.put(JSON_ERROR, message);
        sendJson(exchange, statusCode, response);
    }

    private void sendJson(HttpServerExchange exchange, int statusCode, ObjectNode body) {
        exchange.setStatusCode(statusCode);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseSender().send(body.toString(), StandardCharsets.UTF_8);
    }
}
