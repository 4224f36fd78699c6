package com.temporal.wcc.service.api.health;

import com.temporal.wcc.service.config.IngestionConfig;
import com.temporal.wcc.service.ingest.IngestionQueue;
import com.temporal.wcc.service.ingest.IngestionWorker;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports ingestion queue depth; down once utilization crosses the backpressure threshold.
 */
@Component
@RequiredArgsConstructor
public class IngestionQueueHealthIndicator implements HealthIndicator {

    private final IngestionQueue queue;
    private final IngestionWorker worker;
    private final IngestionConfig config;

    @Override
    public Health health() {
        int utilization = queue.getUtilizationPercent();
        int threshold = config.getQueue().getBackpressureThreshold();

        Health.Builder builder = utilization >= threshold
                ? Health.down()
                : Health.up();

        return builder
                .withDetail("queueSize", queue.size())
                .withDetail("queueCapacity", queue.getCapacity())
                .withDetail("queuedEvents", queue.getQueuedEventCount())
                .withDetail("utilizationPercent", utilization)
                .withDetail("backpressureThreshold", threshold)
                .withDetail("activeWorkers", worker.getActiveWorkerCount())
                .build();
    }
}
