package com.temporal.wcc.service.model;

/**
 * Snapshot metrics of a component as it existed at one forest node's timestamp.
 *
 * @param componentSize     number of events in the snapshot, the node itself included
 * @param componentDiameter longest event-to-event distance, null when undefined
 * @param componentVelocity absorbed events per second of component lifetime
 */
public record ComponentMetrics(
        long componentSize,
        Integer componentDiameter,
        double componentVelocity
) {

    public static ComponentMetrics singleton() {
        return new ComponentMetrics(1, null, 0.0);
    }
}
