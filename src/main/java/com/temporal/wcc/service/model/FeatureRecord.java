package com.temporal.wcc.service.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * Flat feature row consumed downstream. Training and real-time extraction emit the same shape.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record FeatureRecord(
        String eventId,
        Long maxComponentSize,
        Integer maxComponentDiameter,
        Double maxComponentVelocity,
        int distinctComponentCount
) {

    public static FeatureRecord empty(String eventId) {
        return new FeatureRecord(eventId, null, null, null, 0);
    }

    /**
     * Compares the aggregates only, ignoring the event id.
     */
    public boolean sameAggregates(FeatureRecord other) {
        return Objects.equals(maxComponentSize, other.maxComponentSize)
                && Objects.equals(maxComponentDiameter, other.maxComponentDiameter)
                && Objects.equals(maxComponentVelocity, other.maxComponentVelocity)
                && distinctComponentCount == other.distinctComponentCount;
    }
}
