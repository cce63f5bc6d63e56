package com.firstcrack.infrastructure.metrics;

import com.firstcrack.domain.brew.BrewType;
import com.firstcrack.domain.stage.StageId;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Prometheus implementation of NotificationMetrics.
 *
 * Key Metrics:
 * - firstcrack_brews_started_total{brew_type}
 * - firstcrack_brews_cancelled_total
 * - firstcrack_stage_sends_total{stage, status} - status is success, failure or skipped
 * - firstcrack_stage_send_latency_seconds{stage}
 * - firstcrack_payload_build_failures_total{stage}
 * - firstcrack_active_timelines
 */
public class PrometheusNotificationMetrics implements NotificationMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusNotificationMetrics.class);

    private final CollectorRegistry registry;

    private final Counter brewsStarted;
    private final Counter brewsCancelled;
    private final Counter stageSends;
    private final Counter stageFailureReasons;
    private final Histogram sendLatency;
    private final Counter payloadFailures;
    private final Gauge activeTimelines;

    public PrometheusNotificationMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusNotificationMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.brewsStarted = Counter.build()
            .name("firstcrack_brews_started_total")
            .help("Total number of brews started")
            .labelNames("brew_type")
            .register(registry);

        this.brewsCancelled = Counter.build()
            .name("firstcrack_brews_cancelled_total")
            .help("Total number of brews cancelled before their last stage")
            .register(registry);

        this.stageSends = Counter.build()
            .name("firstcrack_stage_sends_total")
            .help("Stage notifications by outcome")
            .labelNames("stage", "status")
            .register(registry);

        this.stageFailureReasons = Counter.build()
            .name("firstcrack_stage_send_failures_total")
            .help("Failed stage sends by reason")
            .labelNames("stage", "reason")
            .register(registry);

        this.sendLatency = Histogram.build()
            .name("firstcrack_stage_send_latency_seconds")
            .help("Push transport latency per stage send in seconds")
            .labelNames("stage")
            .buckets(0.01, 0.05, 0.1, 0.25, 0.5, 1.0, 2.5, 5.0, 10.0)
            .register(registry);

        this.payloadFailures = Counter.build()
            .name("firstcrack_payload_build_failures_total")
            .help("Stage payloads that could not be built")
            .labelNames("stage")
            .register(registry);

        this.activeTimelines = Gauge.build()
            .name("firstcrack_active_timelines")
            .help("Brew timelines with stages still pending")
            .register(registry);

        log.info("[PrometheusNotificationMetrics] Initialized");
    }

    @Override
    public void recordBrewStarted(BrewType brewType) {
        brewsStarted.labels(brewType.wireValue()).inc();
    }

    @Override
    public void recordBrewCancelled() {
        brewsCancelled.inc();
    }

    @Override
    public void recordStageSent(StageId stage, Duration latency) {
        stageSends.labels(stage.wireValue(), "success").inc();
        sendLatency.labels(stage.wireValue()).observe(latency.toNanos() / 1e9);
    }

    @Override
    public void recordStageFailed(StageId stage, String reason, Duration latency) {
        stageSends.labels(stage.wireValue(), "failure").inc();
        stageFailureReasons.labels(stage.wireValue(), reason).inc();
        sendLatency.labels(stage.wireValue()).observe(latency.toNanos() / 1e9);
    }

    @Override
    public void recordStageSkipped(StageId stage) {
        stageSends.labels(stage.wireValue(), "skipped").inc();
    }

    @Override
    public void recordPayloadBuildFailure(StageId stage) {
        payloadFailures.labels(stage.wireValue()).inc();
    }

    @Override
    public void setActiveTimelines(int count) {
        activeTimelines.set(count);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
