package com.temporal.wcc.service.api.controller;

import com.temporal.wcc.service.api.dto.ApiResponse;
import com.temporal.wcc.service.api.dto.EventDto;
import com.temporal.wcc.service.engine.FeatureExtractor;
import com.temporal.wcc.service.model.FeatureRecord;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

/**
 * Controller for component features.
 */
@Slf4j
@RestController
@RequestMapping("/features")
@Tag(name = "Features", description = "Component features for training and real-time scoring")
@RequiredArgsConstructor
public class FeatureController {

    private final FeatureExtractor featureExtractor;

    @GetMapping("/training/{eventId}")
    @Operation(summary = "Training features", description = "Features of a merged event as of the cutoff")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Features extracted"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Event not found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "503", description = "Store or metrics unavailable")
    })
    public ResponseEntity<ApiResponse<FeatureRecord>> training(
            @Parameter(description = "Event ID") @PathVariable String eventId,
            @Parameter(description = "As-of time, defaults to the event timestamp")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant cutoff) {
        log.debug("Training features for {} as of {}", eventId, cutoff);
        return ResponseEntity.ok(ApiResponse.success(featureExtractor.extractTraining(eventId, cutoff)));
    }

    @PostMapping("/realtime")
    @Operation(summary = "Real-time features", description = "Features of an event that has not been merged; read-only")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Features extracted"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Invalid event"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "503", description = "Store or metrics unavailable")
    })
    public ResponseEntity<ApiResponse<FeatureRecord>> realtime(@Valid @RequestBody EventDto request) {
        var incoming = request.toIncomingEvent();
        return ResponseEntity.ok(ApiResponse.success(
                featureExtractor.extractRealtime(incoming.event(), incoming.entities())));
    }
}
