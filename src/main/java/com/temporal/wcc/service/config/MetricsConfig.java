package com.temporal.wcc.service.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.context.annotation.Configuration;

import java.util.function.Supplier;

/**
 * Metrics configuration for the Temporal WCC Service.
 *
 * Provides custom meters for ingestion, merges, component metrics and feature extraction.
 */
@Configuration
@Getter
public class MetricsConfig {

    private final MeterRegistry registry;

    // Counters
    private final Counter eventsIngested;
    private final Counter eventsMerged;
    private final Counter groupRetries;
    private final Counter groupFailures;
    private final Counter precedenceEdgesCreated;
    private final Counter componentMetricsComputed;
    private final Counter trainingFeaturesServed;
    private final Counter realtimeFeaturesServed;

    // Timers
    private final Timer batchTimer;
    private final Timer groupMergeTimer;
    private final Timer metricsTimer;
    private final Timer realtimeFeatureTimer;
    private final Timer ingestionTimer;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;

        this.eventsIngested = Counter.builder("wcc.ingest.events.count")
                .description("Number of events ingested")
                .register(registry);

        this.eventsMerged = Counter.builder("wcc.merge.events.count")
                .description("Number of events merged into the forest")
                .register(registry);

        this.groupRetries = Counter.builder("wcc.merge.group.retries")
                .description("Number of component group retries")
                .register(registry);

        this.groupFailures = Counter.builder("wcc.merge.group.failures")
                .description("Number of component groups that failed after all attempts")
                .register(registry);

        this.precedenceEdgesCreated = Counter.builder("wcc.chain.edges.count")
                .description("Number of precedence edges created")
                .register(registry);

        this.componentMetricsComputed = Counter.builder("wcc.metrics.computed.count")
                .description("Number of forest nodes with computed component metrics")
                .register(registry);

        this.trainingFeaturesServed = Counter.builder("wcc.features.training.count")
                .description("Number of training feature records extracted")
                .register(registry);

        this.realtimeFeaturesServed = Counter.builder("wcc.features.realtime.count")
                .description("Number of real-time feature records extracted")
                .register(registry);

        this.batchTimer = Timer.builder("wcc.merge.batch.duration")
                .description("Time taken for a full batch merge run")
                .register(registry);

        this.groupMergeTimer = Timer.builder("wcc.merge.group.duration")
                .description("Time taken to merge one component group")
                .register(registry);

        this.metricsTimer = Timer.builder("wcc.metrics.duration")
                .description("Time taken for a component metrics pass")
                .register(registry);

        this.realtimeFeatureTimer = Timer.builder("wcc.features.realtime.duration")
                .description("Latency of real-time feature extraction")
                .register(registry);

        this.ingestionTimer = Timer.builder("wcc.ingest.duration")
                .description("Time taken for ingestion processing")
                .register(registry);
    }

    /**
     * Registers a gauge for queue depth monitoring.
     */
    public void registerQueueGauge(String name, String description, Supplier<Number> sizeSupplier) {
        Gauge.builder(name, sizeSupplier)
                .description(description)
                .register(registry);
    }

    /**
     * Registers a gauge for store size monitoring.
     */
    public void registerStoreGauge(String name, String description, Supplier<Number> sizeSupplier) {
        Gauge.builder(name, sizeSupplier)
                .description(description)
                .register(registry);
    }
}
