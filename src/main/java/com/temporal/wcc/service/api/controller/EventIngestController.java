package com.temporal.wcc.service.api.controller;

import com.temporal.wcc.service.api.dto.ApiResponse;
import com.temporal.wcc.service.api.dto.EventDto;
import com.temporal.wcc.service.api.dto.EventIngestRequest;
import com.temporal.wcc.service.config.IngestionConfig;
import com.temporal.wcc.service.ingest.IngestionQueue;
import com.temporal.wcc.service.ingest.IngestionWorkItem;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Controller for event ingestion.
 *
 * Handles POST /ingest/events; events are stored and linked asynchronously.
 */
@Slf4j
@RestController
@RequestMapping("/ingest/events")
@Tag(name = "Event Ingestion", description = "Endpoints for ingesting events and their entities")
@RequiredArgsConstructor
public class EventIngestController {

    private final IngestionQueue ingestionQueue;
    private final IngestionConfig config;

    /**
     * Queues a batch of events.
     *
     * @return 202 Accepted with the batch id, 429 if the queue is full
     */
    @PostMapping
    @Operation(
            summary = "Ingest events",
            description = "Submits events with the entities they touch. Events are stored, chained per entity and merged into the forest asynchronously."
    )
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "202", description = "Events accepted for processing"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Invalid request"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "429", description = "Ingestion queue full")
    })
    public ResponseEntity<ApiResponse<String>> ingestEvents(@Valid @RequestBody EventIngestRequest request) {
        String batchId = request.getBatchId() != null ? request.getBatchId() : UUID.randomUUID().toString();
        var events = request.getEvents().stream()
                .map(EventDto::toIncomingEvent)
                .toList();

        log.debug("Received event batch: batchId={}, eventCount={}", batchId, events.size());

        var workItem = new IngestionWorkItem.EventBatchWorkItem(batchId, events);
        boolean enqueued = ingestionQueue.enqueue(workItem, config.getTimeout().getEnqueueMs());

        if (!enqueued) {
            log.warn("Ingestion queue full, rejecting event batch: batchId={}", batchId);
            return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                    .body(ApiResponse.error(
                            "Ingestion queue is full, please retry later",
                            "QUEUE_FULL",
                            "Queue utilization: " + ingestionQueue.getUtilizationPercent() + "%"
                    ));
        }

        log.info("Event batch accepted: batchId={}, eventCount={}", batchId, events.size());
        return ResponseEntity.accepted()
                .body(ApiResponse.success(batchId));
    }
}
