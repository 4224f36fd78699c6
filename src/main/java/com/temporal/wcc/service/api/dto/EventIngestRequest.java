package com.temporal.wcc.service.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Batch of events submitted for ingestion.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventIngestRequest {

    /**
     * Producer-side batch id, used in logs. Generated when absent.
     */
    private String batchId;

    @Valid
    @NotEmpty(message = "events cannot be empty")
    private List<EventDto> events;
}
