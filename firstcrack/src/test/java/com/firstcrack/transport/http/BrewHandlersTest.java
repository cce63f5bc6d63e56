package com.firstcrack.transport.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.firstcrack.bootstrap.App;
import com.firstcrack.domain.action.ActionRegistry;
import com.firstcrack.domain.stage.StageTimeline;
import com.firstcrack.infrastructure.metrics.PrometheusMetricsHandler;
import com.firstcrack.infrastructure.metrics.PrometheusNotificationMetrics;
import com.firstcrack.infrastructure.push.LoggingPushTransport;
import com.firstcrack.service.brew.BrewRequestValidator;
import com.firstcrack.service.brew.BrewService;
import com.firstcrack.service.notification.PayloadBuilder;
import com.firstcrack.service.schedule.ManualStageTimer;
import com.firstcrack.service.schedule.MutableClock;
import com.firstcrack.service.schedule.StageScheduler;
import io.prometheus.client.CollectorRegistry;
import io.undertow.Undertow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Brew API over a real Undertow listener.
 */
@DisplayName("Brew HTTP API")
class BrewHandlersTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int TEST_PORT = 19183;
    private static final String BASE = "http://localhost:" + TEST_PORT;

    private Undertow server;
    private HttpClient httpClient;
    private ManualStageTimer timer;
    private CollectorRegistry registry;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(Instant.parse("2026-02-02T09:00:00Z"));
        timer = new ManualStageTimer(clock);
        registry = new CollectorRegistry();
        PrometheusNotificationMetrics metrics = new PrometheusNotificationMetrics(registry);

        StageTimeline timeline = StageTimeline.standard();
        PayloadBuilder builder = new PayloadBuilder(new ActionRegistry(), "https://media.example.com",
            timeline.totalDurationSeconds());
        StageScheduler scheduler = new StageScheduler(timeline, builder, new LoggingPushTransport(), timer, metrics);
        BrewService service = new BrewService(timeline, scheduler, new BrewRequestValidator(), clock, metrics);

        server = Undertow.builder()
            .addHttpListener(TEST_PORT, "localhost")
            .setHandler(App.buildHandler(new BrewHandlers(service, clock, "test"),
                new PrometheusMetricsHandler(registry)))
            .build();
        server.start();

        httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    @Test
    void testStartBrew() throws Exception {
        HttpResponse<String> response = post("/api/brews",
            "{\"deviceToken\":\"dev-123\",\"brewType\":\"espresso\",\"dose\":18,\"targetTemp\":93,\"targetPressure\":9}");

        assertEquals(200, response.statusCode());
        JsonNode json = MAPPER.readTree(response.body());
        assertTrue(json.get("success").asBoolean());
        assertTrue(json.get("brewId").asText().matches("brew_\\d+_\\d+"));
        assertEquals(5, json.get("stages").asInt());
        assertEquals(75, json.get("estimatedDuration").asInt());
        assertEquals("*", response.headers().firstValue("Access-Control-Allow-Origin").orElse(null));
    }

    @Test
    @DisplayName("Legacy /startBrew alias accepts decimals and optional timings")
    void testStartBrewAlias() throws Exception {
        HttpResponse<String> response = post("/startBrew",
            "{\"deviceToken\":\"dev-1\",\"brewType\":\"ristretto\",\"dose\":17.5,\"targetTemp\":92.5,"
                + "\"targetPressure\":9,\"preinfusionDuration\":5,\"extractionTime\":20}");

        assertEquals(200, response.statusCode(), response.body());
    }

    @Test
    void testValidationErrorsReturn400WithDetails() throws Exception {
        HttpResponse<String> response = post("/api/brews",
            "{\"deviceToken\":\"\",\"brewType\":\"frappe\",\"dose\":50,\"targetTemp\":93,\"targetPressure\":\"high\"}");

        assertEquals(400, response.statusCode());
        JsonNode json = MAPPER.readTree(response.body());
        assertFalse(json.get("success").asBoolean());
        JsonNode details = json.get("details");
        assertEquals(4, details.size());
        assertEquals("brewType", details.get(0).get("field").asText());
        assertEquals("INVALID_BREW_TYPE", details.get(0).get("code").asText());
        assertEquals("dose", details.get(1).get("field").asText());
        assertEquals(50, details.get(1).get("rejected").asInt());
        assertEquals("targetPressure", details.get(2).get("field").asText());
        assertEquals("MISSING_FIELD", details.get(2).get("code").asText());
        assertEquals("deviceToken", details.get(3).get("field").asText());
        assertEquals(0, timer.pendingCount(), "nothing scheduled for a rejected request");
    }

    @Test
    void testNonIntegralTimingRejected() throws Exception {
        HttpResponse<String> response = post("/api/brews",
            "{\"deviceToken\":\"d\",\"brewType\":\"espresso\",\"dose\":18,\"targetTemp\":93,\"targetPressure\":9,"
                + "\"preinfusionDuration\":2.5}");

        assertEquals(400, response.statusCode());
        assertEquals("preinfusionDuration", MAPPER.readTree(response.body()).at("/details/0/field").asText());
    }

    @Test
    void testMalformedJson() throws Exception {
        assertEquals(400, post("/api/brews", "{not json").statusCode());
        assertEquals(400, post("/api/brews", "[]").statusCode());
    }

    @Test
    void testStopBrew() throws Exception {
        String brewId = MAPPER.readTree(post("/api/brews",
            "{\"deviceToken\":\"dev-123\",\"brewType\":\"lungo\",\"dose\":18,\"targetTemp\":93,\"targetPressure\":9}")
            .body()).get("brewId").asText();
        assertEquals(5, timer.pendingCount());

        HttpResponse<String> response = post("/api/brews/" + brewId + "/stop", "");
        assertEquals(200, response.statusCode());
        JsonNode json = MAPPER.readTree(response.body());
        assertTrue(json.get("cancelled").asBoolean());
        assertEquals(brewId, json.get("brewId").asText());
        assertEquals(0, timer.pendingCount());

        HttpResponse<String> again = post("/stopBrew", "{\"brewId\":\"" + brewId + "\"}");
        assertEquals(200, again.statusCode());
        assertFalse(MAPPER.readTree(again.body()).get("cancelled").asBoolean());

        assertEquals(400, post("/stopBrew", "{}").statusCode());
    }

    @Test
    void testHealth() throws Exception {
        post("/api/brews",
            "{\"deviceToken\":\"dev-123\",\"brewType\":\"espresso\",\"dose\":18,\"targetTemp\":93,\"targetPressure\":9}");

        HttpResponse<String> response = get("/api/health");
        assertEquals(200, response.statusCode());
        JsonNode json = MAPPER.readTree(response.body());
        assertEquals("ok", json.get("status").asText());
        assertEquals(BrewHandlers.SERVICE_NAME, json.get("service").asText());
        assertEquals("test", json.get("version").asText());
        assertEquals("2026-02-02T09:00:00Z", json.get("timestamp").asText());
        assertEquals(1, json.get("activeBrews").asInt());
    }

    @Test
    void testMethodNotAllowed() throws Exception {
        assertEquals(405, get("/api/brews").statusCode());
        assertEquals(405, get("/startBrew").statusCode());
    }

    @Test
    void testCorsPreflight() throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(BASE + "/api/brews"))
            .method("OPTIONS", HttpRequest.BodyPublishers.noBody())
            .build();
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

        assertEquals(200, response.statusCode());
        assertTrue(response.headers().firstValue("Access-Control-Allow-Methods").orElse("").contains("POST"));
    }

    @Test
    void testMetricsRoute() throws Exception {
        post("/api/brews",
            "{\"deviceToken\":\"dev-123\",\"brewType\":\"americano\",\"dose\":18,\"targetTemp\":93,\"targetPressure\":9}");

        HttpResponse<String> response = get("/metrics");
        assertEquals(200, response.statusCode());
        assertTrue(response.body().contains("firstcrack_brews_started_total"));
        assertTrue(response.body().contains("brew_type=\"americano\""));
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(BASE + path))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(BASE + path))
            .GET()
            .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }
}
