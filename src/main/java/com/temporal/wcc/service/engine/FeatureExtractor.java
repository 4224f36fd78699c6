package com.temporal.wcc.service.engine;

import com.temporal.wcc.service.config.MetricsConfig;
import com.temporal.wcc.service.model.ComponentMetrics;
import com.temporal.wcc.service.model.Entity;
import com.temporal.wcc.service.model.Event;
import com.temporal.wcc.service.model.FeatureRecord;
import com.temporal.wcc.service.store.GraphStore;
import com.temporal.wcc.service.store.StoreUnavailableException;
import com.temporal.wcc.service.store.TransientStoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Aggregates the metrics of the components an event bridges.
 *
 * Training extraction reads the forest edges persisted by the merge. Real-time
 * extraction answers the same question for an event that is not merged yet, by
 * walking the forest as it stood before that event. Both produce the same record
 * for the same state.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FeatureExtractor {

    private final GraphStore graphStore;
    private final TemporalUnionFindForest forest;
    private final MetricsConfig metricsConfig;

    // ==================== Training ====================

    /**
     * Features of a merged event from the heads it absorbed, restricted to heads at
     * or before the cutoff.
     *
     * @param cutoff as-of time; the event's own timestamp when null
     */
    public FeatureRecord extractTraining(String eventId, Instant cutoff) {
        return guarded(eventId, () -> {
            var source = graphStore.findEvent(eventId).orElseThrow(() -> new EventNotFoundException(eventId));
            var asOf = cutoff != null ? cutoff : source.timestamp();
            if (source.timestamp().isAfter(asOf)) {
                throw new IllegalArgumentException(
                        "Event " + eventId + " occurs after the cutoff " + asOf);
            }
            var heads = graphStore.findForestPredecessors(eventId).stream()
                    .map(id -> graphStore.findEvent(id).orElseThrow(() -> new EventNotFoundException(id)))
                    .filter(head -> !head.timestamp().isAfter(asOf))
                    .map(Event::id)
                    .toList();
            var features = aggregate(eventId, heads);
            metricsConfig.getTrainingFeaturesServed().increment();
            return features;
        });
    }

    // ==================== Real-time ====================

    /**
     * Features of an incoming event that has not been merged. Reads only; nothing is
     * written to the store.
     *
     * @param entities entities the event touches
     * @throws FeaturesUnavailableException if the store cannot be read
     */
    public FeatureRecord extractRealtime(Event event, Collection<Entity> entities) {
        return metricsConfig.getRealtimeFeatureTimer().record(() -> guarded(event.id(), () -> {
            var heads = new LinkedHashSet<String>();
            for (var entity : new LinkedHashSet<>(entities)) {
                // the entity chain already joins every earlier event to the latest one
                graphStore.findEventsTouching(entity).stream()
                        .filter(candidate -> isEarlierProcessed(candidate, event))
                        .max(Event.CHRONOLOGICAL)
                        .ifPresent(latest -> heads.add(forest.findHeadBefore(graphStore, latest.id(), event)));
            }
            var features = aggregate(event.id(), heads);
            metricsConfig.getRealtimeFeaturesServed().increment();
            return features;
        }));
    }

    private boolean isEarlierProcessed(Event candidate, Event event) {
        return !candidate.id().equals(event.id())
                && candidate.isBefore(event)
                && graphStore.isProcessed(candidate.id());
    }

    // ==================== Aggregation ====================

    private FeatureRecord aggregate(String eventId, Collection<String> headIds) {
        if (headIds.isEmpty()) {
            return FeatureRecord.empty(eventId);
        }
        var metrics = new ArrayList<ComponentMetrics>();
        for (var headId : headIds) {
            metrics.add(graphStore.findMetrics(headId).orElseThrow(() ->
                    new FeaturesUnavailableException(eventId, "component metrics missing for " + headId)));
        }
        long maxSize = metrics.stream().mapToLong(ComponentMetrics::componentSize).max().orElseThrow();
        Integer maxDiameter = metrics.stream()
                .map(ComponentMetrics::componentDiameter)
                .filter(Objects::nonNull)
                .max(Integer::compare)
                .orElse(null);
        double maxVelocity = metrics.stream().mapToDouble(ComponentMetrics::componentVelocity).max().orElseThrow();
        return new FeatureRecord(eventId, maxSize, maxDiameter, maxVelocity, headIds.size());
    }

    private FeatureRecord guarded(String eventId, Supplier<FeatureRecord> extraction) {
        try {
            return extraction.get();
        } catch (StoreUnavailableException | TransientStoreException e) {
            log.error("Store unreachable while extracting features for {}", eventId, e);
            throw new FeaturesUnavailableException(eventId, e);
        }
    }
}
