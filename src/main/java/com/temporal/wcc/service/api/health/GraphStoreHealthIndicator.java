package com.temporal.wcc.service.api.health;

import com.temporal.wcc.service.config.WccConfig;
import com.temporal.wcc.service.engine.ForestException;
import com.temporal.wcc.service.store.GraphStore;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports whether the graph store answers, with its element counts.
 */
@Component
@RequiredArgsConstructor
public class GraphStoreHealthIndicator implements HealthIndicator {

    private final GraphStore graphStore;
    private final WccConfig wccConfig;

    @Override
    public Health health() {
        try {
            graphStore.ping();
            var stats = graphStore.stats();
            return Health.up()
                    .withDetail("storeType", wccConfig.getStore().getType())
                    .withDetail("events", stats.eventCount())
                    .withDetail("processed", stats.processedCount())
                    .withDetail("forestEdges", stats.forestEdgeCount())
                    .build();
        } catch (ForestException e) {
            return Health.down()
                    .withDetail("storeType", wccConfig.getStore().getType())
                    .withDetail("errorCode", e.getErrorCode())
                    .withException(e)
                    .build();
        }
    }
}
