package com.temporal.wcc.service.api.controller;

import com.temporal.wcc.service.api.dto.ApiResponse;
import com.temporal.wcc.service.api.dto.ForestNodeResponse;
import com.temporal.wcc.service.api.dto.GroupRetryRequest;
import com.temporal.wcc.service.engine.BatchCoordinator;
import com.temporal.wcc.service.engine.BatchReport;
import com.temporal.wcc.service.engine.ChainLinkResult;
import com.temporal.wcc.service.engine.ComponentMetricsEngine;
import com.temporal.wcc.service.engine.EventNotFoundException;
import com.temporal.wcc.service.engine.ForestRebuildService;
import com.temporal.wcc.service.engine.ForestValidator;
import com.temporal.wcc.service.engine.MetricsReport;
import com.temporal.wcc.service.engine.RebuildReport;
import com.temporal.wcc.service.engine.SequentialChainBuilder;
import com.temporal.wcc.service.engine.TemporalUnionFindForest;
import com.temporal.wcc.service.engine.ValidationReport;
import com.temporal.wcc.service.model.Entity;
import com.temporal.wcc.service.store.GraphStore;
import com.temporal.wcc.service.store.GraphStore.StoreStats;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Controller for forest maintenance and inspection.
 *
 * Merge, metrics and rebuild run synchronously and return their reports. Every
 * mutating call holds the maintenance lock, so none of them overlaps a reset.
 */
@Slf4j
@RestController
@RequestMapping("/forest")
@Tag(name = "Forest", description = "Chain linking, merging, metrics, validation and rebuild")
@RequiredArgsConstructor
public class ForestController {

    private final GraphStore graphStore;
    private final SequentialChainBuilder chainBuilder;
    private final TemporalUnionFindForest forest;
    private final BatchCoordinator batchCoordinator;
    private final ComponentMetricsEngine metricsEngine;
    private final ForestValidator validator;
    private final ForestRebuildService rebuildService;

    // ==================== Maintenance ====================

    @PostMapping("/link")
    @Operation(summary = "Link chains", description = "Builds the precedence chain of every entity")
    public ResponseEntity<ApiResponse<ChainLinkResult>> link() {
        return ResponseEntity.ok(ApiResponse.success(rebuildService.exclusively(chainBuilder::linkAll)));
    }

    @PostMapping("/merge")
    @Operation(summary = "Merge pending events", description = "Merges every unprocessed event, one transaction per component group")
    public ResponseEntity<ApiResponse<BatchReport>> merge() {
        return ResponseEntity.ok(ApiResponse.success(rebuildService.exclusively(batchCoordinator::runBatch)));
    }

    @PostMapping("/merge/retry")
    @Operation(summary = "Retry a failed group", description = "Merges the events of a group reported as failed")
    public ResponseEntity<ApiResponse<BatchReport>> retryGroup(@Valid @RequestBody GroupRetryRequest request) {
        String label = request.getLabel() != null ? request.getLabel() : "retry";
        log.info("Retrying merge group {} with {} events", label, request.getEventIds().size());
        var report = rebuildService.exclusively(() -> batchCoordinator.retry(label, request.getEventIds()));
        return ResponseEntity.ok(ApiResponse.success(report));
    }

    @PostMapping("/metrics")
    @Operation(summary = "Compute metrics", description = "Computes missing component metrics, or all of them with recompute=true")
    public ResponseEntity<ApiResponse<MetricsReport>> computeMetrics(
            @Parameter(description = "Recompute metrics that already exist")
            @RequestParam(defaultValue = "false") boolean recompute) {
        var report = rebuildService.exclusively(() ->
                recompute ? metricsEngine.recomputeAll() : metricsEngine.computeMissing());
        return ResponseEntity.ok(ApiResponse.success(report));
    }

    @PostMapping("/rebuild")
    @Operation(summary = "Rebuild forest", description = "Resets derived state, then relinks, remerges and recomputes everything")
    public ResponseEntity<ApiResponse<RebuildReport>> rebuild() {
        return ResponseEntity.ok(ApiResponse.success(rebuildService.rebuild()));
    }

    @DeleteMapping
    @Operation(summary = "Reset forest", description = "Deletes chains, forest edges, processed flags and metrics")
    public ResponseEntity<Void> reset() {
        rebuildService.reset();
        return ResponseEntity.noContent().build();
    }

    // ==================== Inspection ====================

    @GetMapping("/validate")
    @Operation(summary = "Validate forest", description = "Checks chain linearity and forest structure")
    public ResponseEntity<ApiResponse<ValidationReport>> validate() {
        return ResponseEntity.ok(ApiResponse.success(validator.validate()));
    }

    @GetMapping("/stats")
    @Operation(summary = "Store statistics")
    public ResponseEntity<ApiResponse<StoreStats>> stats() {
        return ResponseEntity.ok(ApiResponse.success(graphStore.stats()));
    }

    @GetMapping("/events/{eventId}")
    @Operation(summary = "Forest node", description = "Processed flag, head, absorbed heads and metrics of one event")
    public ResponseEntity<ApiResponse<ForestNodeResponse>> node(
            @Parameter(description = "Event ID") @PathVariable String eventId) {
        var event = graphStore.findEvent(eventId).orElseThrow(() -> new EventNotFoundException(eventId));
        var response = ForestNodeResponse.builder()
                .eventId(event.id())
                .timestamp(event.timestamp())
                .processed(graphStore.isProcessed(eventId))
                .head(forest.findHead(graphStore, eventId))
                .absorbedHeads(graphStore.findForestPredecessors(eventId))
                .absorbedBy(graphStore.findForestSuccessor(eventId).orElse(null))
                .entities(graphStore.findEntities(eventId).stream()
                        .sorted(Entity.NATURAL_ORDER)
                        .map(Entity::toString)
                        .toList())
                .metrics(graphStore.findMetrics(eventId).orElse(null))
                .build();
        return ResponseEntity.ok(ApiResponse.success(response));
    }
}
