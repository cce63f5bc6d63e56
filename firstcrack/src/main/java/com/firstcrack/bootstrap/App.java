package com.firstcrack.bootstrap;

import com.firstcrack.domain.action.ActionRegistry;
import com.firstcrack.domain.stage.StageTimeline;
import com.firstcrack.infrastructure.metrics.PrometheusMetricsHandler;
import com.firstcrack.infrastructure.metrics.PrometheusNotificationMetrics;
import com.firstcrack.infrastructure.push.FcmHttpPushTransport;
import com.firstcrack.infrastructure.push.LoggingPushTransport;
import com.firstcrack.infrastructure.push.PushTransport;
import com.firstcrack.service.brew.BrewRequestValidator;
import com.firstcrack.service.brew.BrewService;
import com.firstcrack.service.notification.PayloadBuilder;
import com.firstcrack.service.schedule.ScheduledExecutorStageTimer;
import com.firstcrack.service.schedule.StageScheduler;
import com.firstcrack.transport.http.BrewHandlers;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.RoutingHandler;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * First Crack notification service.
 *
 * Wires the stage timeline, payload builder, scheduler and push transport,
 * then serves the brew API on Undertow.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static final String VERSION = "1.0.0";

    public static void main(String[] args) {
        log.info("=== First Crack {} starting ===", VERSION);

        FirstCrackConfig config = FirstCrackConfig.fromEnv();
        StartupConfigValidator.validate(config);
        log.info("Config: {}", config);

        Clock clock = Clock.systemUTC();

        // ═══════════════════════════════════════════════════════════════
        // Metrics
        // ═══════════════════════════════════════════════════════════════
        PrometheusNotificationMetrics metrics = new PrometheusNotificationMetrics();

        // ═══════════════════════════════════════════════════════════════
        // Timeline, payloads, transport
        // ═══════════════════════════════════════════════════════════════
        StageTimeline timeline = StageTimeline.standard();
        ActionRegistry registry = new ActionRegistry(config.deepLinkScheme());
        PayloadBuilder payloadBuilder = new PayloadBuilder(registry, config.mediaBaseUrl(),
            timeline.totalDurationSeconds());
        PushTransport transport = createTransport(config);
        log.info("Push transport: {}", transport.name());

        // ═══════════════════════════════════════════════════════════════
        // Scheduler
        // ═══════════════════════════════════════════════════════════════
        ScheduledExecutorService executor = ScheduledExecutorStageTimer.daemonPool(config.schedulerThreads());
        StageScheduler scheduler = new StageScheduler(timeline, payloadBuilder, transport,
            new ScheduledExecutorStageTimer(executor, clock), metrics);
        BrewService brewService = new BrewService(timeline, scheduler, new BrewRequestValidator(), clock, metrics);

        // ═══════════════════════════════════════════════════════════════
        // HTTP
        // ═══════════════════════════════════════════════════════════════
        BrewHandlers handlers = new BrewHandlers(brewService, clock, VERSION);
        HttpHandler root = buildHandler(handlers, new PrometheusMetricsHandler(metrics.getRegistry()));

        Undertow server = Undertow.builder()
            .addHttpListener(config.port(), config.bindHost())
            .setHandler(root)
            .build();
        server.start();
        log.info("First Crack started on http://{}:{}/", config.bindHost(), config.port());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            server.stop();
            executor.shutdown();
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
            log.info("Stopped with {} brew timeline(s) still pending", scheduler.activeCount());
        }, "shutdown"));
    }

    static PushTransport createTransport(FirstCrackConfig config) {
        if (config.usesFcm()) {
            return new FcmHttpPushTransport(config.fcmEndpoint(), config.fcmProjectId(),
                config.fcmAccessToken(), Duration.ofSeconds(config.fcmTimeoutSeconds()));
        }
        return new LoggingPushTransport();
    }

    /**
     * Routes plus CORS handling.
     */
    public static HttpHandler buildHandler(BrewHandlers handlers, HttpHandler metricsHandler) {
        RoutingHandler routes = Handlers.routing()
            .get("/metrics", metricsHandler)
            .get("/api/health", handlers::health)
            .post("/api/brews", handlers::startBrew)
            .post("/startBrew", handlers::startBrew)
            .post("/api/brews/{brewId}/stop", handlers::stopBrew)
            .post("/stopBrew", handlers::stopBrewByBody)
            .setInvalidMethodHandler(exchange -> {
                exchange.setStatusCode(StatusCodes.METHOD_NOT_ALLOWED);
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
                exchange.getResponseSender().send("{\"success\":false,\"error\":\"Method not allowed\"}");
            })
            .setFallbackHandler(exchange -> {
                exchange.setStatusCode(StatusCodes.NOT_FOUND);
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
                exchange.getResponseSender().send(
                    "First Crack " + VERSION + "\n\n" +
                    "API: POST /api/brews, POST /api/brews/{brewId}/stop, GET /api/health\n" +
                    "Metrics: GET /metrics\n");
            });

        return exchange -> {
            exchange.getResponseHeaders()
                .put(HttpString.tryFromString("Access-Control-Allow-Origin"), "*")
                .put(HttpString.tryFromString("Access-Control-Allow-Methods"), "GET, POST, OPTIONS")
                .put(HttpString.tryFromString("Access-Control-Allow-Headers"), "Content-Type, Authorization")
                .put(HttpString.tryFromString("Access-Control-Max-Age"), "3600");

            if (exchange.getRequestMethod().toString().equals("OPTIONS")) {
                exchange.setStatusCode(StatusCodes.OK);
                exchange.endExchange();
            } else {
                routes.handleRequest(exchange);
            }
        };
    }

    private App() {}
}
