package com.temporal.wcc.service.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.temporal.wcc.service.model.ComponentMetrics;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Forest view of one event.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ForestNodeResponse {

    private String eventId;

    private Instant timestamp;

    private boolean processed;

    /**
     * Current head of the event's component; the event itself when nothing absorbed it yet.
     */
    private String head;

    /**
     * Heads this event absorbed when it was merged.
     */
    private List<String> absorbedHeads;

    /**
     * Event that absorbed this one's component, if any.
     */
    private String absorbedBy;

    private List<String> entities;

    private ComponentMetrics metrics;
}
