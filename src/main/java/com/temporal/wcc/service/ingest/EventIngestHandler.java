package com.temporal.wcc.service.ingest;

import com.temporal.wcc.service.config.MetricsConfig;
import com.temporal.wcc.service.config.WccConfig;
import com.temporal.wcc.service.engine.ForestMaintenanceService;
import com.temporal.wcc.service.engine.SequentialChainBuilder;
import com.temporal.wcc.service.ingest.IngestionWorkItem.EventBatchWorkItem;
import com.temporal.wcc.service.model.Entity;
import com.temporal.wcc.service.store.GraphStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;

/**
 * Stores incoming events and their touch edges, then relinks the chains of every
 * entity the batch touched.
 *
 * Duplicate events are accepted and ignored. When auto-merge is on, a merge pass is
 * requested on the merge executor so ingestion is never blocked by merging.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EventIngestHandler implements IngestionHandler<EventBatchWorkItem> {

    private final GraphStore graphStore;
    private final SequentialChainBuilder chainBuilder;
    private final ForestMaintenanceService maintenanceService;
    private final WccConfig wccConfig;
    private final MetricsConfig metricsConfig;

    @Override
    public void handle(EventBatchWorkItem workItem) {
        String batchId = workItem.batchId();
        try {
            log.debug("Processing event batch: batchId={}, events={}", batchId, workItem.events().size());

            metricsConfig.getIngestionTimer().record(() -> store(workItem));

            if (wccConfig.getFeatures().isAutoMergeEnabled()) {
                maintenanceService.triggerMerge();
            }
        } catch (IngestionException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to process event batch: batchId={}", batchId, e);
            throw new IngestionException(
                    "Failed to process event batch: " + e.getMessage(),
                    batchId,
                    "EVENT_BATCH_PROCESSING_FAILED",
                    e
            );
        }
    }

    @Override
    public Class<EventBatchWorkItem> getSupportedType() {
        return EventBatchWorkItem.class;
    }

    private void store(EventBatchWorkItem workItem) {
        var touched = new LinkedHashSet<Entity>();
        int created = 0;
        for (var incoming : workItem.events()) {
            var event = incoming.event();
            if (graphStore.saveEvent(event)) {
                created++;
            } else {
                log.debug("Event {} already stored", event.id());
            }
            for (var entity : incoming.entities()) {
                graphStore.addTouch(event.id(), entity);
                touched.add(entity);
            }
        }
        metricsConfig.getEventsIngested().increment(created);

        var linked = chainBuilder.link(touched);
        log.debug("Event batch stored: batchId={}, created={}, entities={}, lateArrivals={}",
                workItem.batchId(), created, touched.size(), linked.lateArrivals());
    }
}
