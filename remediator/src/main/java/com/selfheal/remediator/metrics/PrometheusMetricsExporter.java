package com.selfheal.remediator.metrics;

import com.selfheal.core.metrics.MetricsNames;
import com.selfheal.core.metrics.MetricsTags;
import com.selfheal.core.model.RemediationAction;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.netty.Metrics;

import java.util.List;

/**
 * Exposes the remediator's meters in Prometheus text format.
 * <p>
 * A Prometheus registry is attached to a composite registry, by default reactor-netty's
 * global one, so HTTP server meters and remediation meters come out of the same scrape.
 * Every meter carries the {@code node_id} common tag. Request counters are registered at
 * zero for each action, so a scrape shows the series before the first request arrives.
 * </p>
 */
public class PrometheusMetricsExporter {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsExporter.class);

    public static final String CONTENT_TYPE = "text/plain; version=0.0.4; charset=utf-8";

    static final List<String> REQUEST_STATUSES = List.of("success", "failure");

    @Getter
    private final MeterRegistry registry;
    private final PrometheusMeterRegistry prometheusRegistry;

    public PrometheusMetricsExporter(String nodeId) {
        this(nodeId, Metrics.REGISTRY);
    }

    PrometheusMetricsExporter(String nodeId, MeterRegistry registry) {
        this.registry = registry;

        this.prometheusRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        if (registry instanceof CompositeMeterRegistry composite) {
            composite.add(prometheusRegistry);
        } else {
            log.warn("Registry {} is not a composite, scrape will only see meters registered on it directly",
                registry.getClass().getSimpleName());
        }

        registry.config().commonTags(MetricsTags.NODE_ID, nodeId);

        for (RemediationAction action : RemediationAction.values()) {
            for (String status : REQUEST_STATUSES) {
                registry.counter(MetricsNames.REMEDIATION_REQUESTS_TOTAL,
                    MetricsTags.ACTION, action.wireName(), MetricsTags.STATUS, status);
            }
        }
        log.info("Metrics exporter initialized for node {}", nodeId);
    }

    public String scrape() {
        return prometheusRegistry.scrape();
    }
}
