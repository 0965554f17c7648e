package com.guildhub.gateway.metrics;

import com.guildhub.core.metrics.MetricsNames;
import com.guildhub.core.metrics.MetricsTags;
import com.guildhub.core.msg.PublishScope;
import com.guildhub.gateway.config.GatewayConfig;
import com.guildhub.gateway.registry.ConnectionRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.netty.Metrics;

import java.util.EnumMap;
import java.util.Map;

/**
 * Centralized metrics for a gateway node.
 * <p>
 * In production the meters are registered in Reactor Netty's global registry with a Prometheus
 * registry attached (see {@link #withPrometheus(GatewayConfig)}), so Netty server meters and hub
 * meters come out of one {@link #scrape()}. Tests pass any registry and get an empty scrape.
 * </p>
 */
public class MetricsService {
    private static final Logger log = LoggerFactory.getLogger(MetricsService.class);

    private final MeterRegistry registry;
    private final PrometheusMeterRegistry prometheus;
    private final String nodeId;

    private final Map<PublishScope, Counter> eventsPublished = new EnumMap<>(PublishScope.class);
    private final Counter framesDelivered;
    private final Counter inboundDropped;
    private final Counter presenceCallbackFailures;

    // Network traffic counters (bytes)
    private final Counter networkInboundWs;
    private final Counter networkOutboundWs;

    // Fan-out width per published event
    private final DistributionSummary fanOut;

    public MetricsService(MeterRegistry registry, GatewayConfig config) {
        this(registry, null, config);
    }

    private MetricsService(MeterRegistry registry, PrometheusMeterRegistry prometheus, GatewayConfig config) {
        this.registry = registry;
        this.prometheus = prometheus;
        this.nodeId = config.getNodeId();

        new ProcessorMetrics().bindTo(registry);
        new JvmMemoryMetrics().bindTo(registry);

        for (PublishScope scope : PublishScope.values()) {
            eventsPublished.put(scope, Counter.builder(MetricsNames.EVENTS_PUBLISHED_TOTAL)
                .tag(MetricsTags.NODE_ID, nodeId)
                .tag(MetricsTags.SCOPE, scope.wireName())
                .description("Events published, per audience scope")
                .register(registry));
        }

        framesDelivered = Counter.builder(MetricsNames.FRAMES_DELIVERED_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Frames enqueued to connections")
            .register(registry);

        inboundDropped = Counter.builder(MetricsNames.INBOUND_DROPPED_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Inbound frames dropped as malformed or unknown")
            .register(registry);

        presenceCallbackFailures = Counter.builder(MetricsNames.PRESENCE_CALLBACK_FAILURES_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Presence callbacks that failed")
            .register(registry);

        networkInboundWs = Counter.builder(MetricsNames.NETWORK_INBOUND_WS_BYTES)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Total bytes received from WebSocket clients")
            .baseUnit("bytes")
            .register(registry);

        networkOutboundWs = Counter.builder(MetricsNames.NETWORK_OUTBOUND_WS_BYTES)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Total bytes sent to WebSocket clients")
            .baseUnit("bytes")
            .register(registry);

        fanOut = DistributionSummary.builder(MetricsNames.FANOUT_RECIPIENTS)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Recipients per published event")
            .register(registry);
    }

    /**
     * Metrics for a running node, scraped from {@code /metrics}.
     *
     * @param config gateway configuration
     * @return metrics backed by the global registry with Prometheus attached
     */
    public static MetricsService withPrometheus(GatewayConfig config) {
        PrometheusMeterRegistry prometheus = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        MeterRegistry global = Metrics.REGISTRY;
        if (global instanceof CompositeMeterRegistry composite) {
            composite.add(prometheus);
        } else {
            log.warn("Reactor Netty registry is not composite, Netty meters will not be scraped");
            global = prometheus;
        }
        log.info("Prometheus scraping enabled for node {}", config.getNodeId());
        return new MetricsService(global, prometheus, config);
    }

    /**
     * Prometheus text exposition, or an empty string when no Prometheus registry is attached.
     */
    public String scrape() {
        return prometheus == null ? "" : prometheus.scrape();
    }

    /**
     * Detaches the Prometheus registry from the global one.
     */
    public void close() {
        if (prometheus == null) {
            return;
        }
        if (registry instanceof CompositeMeterRegistry composite) {
            composite.remove(prometheus);
        }
        prometheus.close();
    }

    /**
     * Registers gauges that read live occupancy from the registry.
     *
     * @param connections connection registry of this node
     */
    public void bindRegistryGauges(ConnectionRegistry connections) {
        Gauge.builder(MetricsNames.CONNECTIONS, connections, ConnectionRegistry::size)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Live connections")
            .register(registry);

        Gauge.builder(MetricsNames.ONLINE_USERS, connections, ConnectionRegistry::onlineUserCount)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Users with at least one live connection")
            .register(registry);
    }

    public void recordPublished(PublishScope scope, int delivered) {
        eventsPublished.get(scope).increment();
        framesDelivered.increment(delivered);
        fanOut.record(delivered);
    }

    /**
     * Records a connection closed by the hub.
     *
     * @param reason queue_overflow, liveness_timeout, drain or disconnect
     */
    public void recordForcedClose(String reason) {
        Counter.builder(MetricsNames.FORCED_CLOSES_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.REASON, reason)
            .register(registry)
            .increment();
    }

    /**
     * Records an upgrade request refused before admission.
     *
     * @param reason unauthorized, banned, draining or error
     */
    public void recordRejectedUpgrade(String reason) {
        Counter.builder(MetricsNames.REJECTED_UPGRADES_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.REASON, reason)
            .register(registry)
            .increment();
    }

    public void recordInboundDropped() {
        inboundDropped.increment();
    }

    public void recordPresenceCallbackFailure() {
        presenceCallbackFailures.increment();
    }

    public void recordNetworkInboundWs(long bytes) {
        networkInboundWs.increment(bytes);
    }

    public void recordNetworkOutboundWs(long bytes) {
        networkOutboundWs.increment(bytes);
    }
}
