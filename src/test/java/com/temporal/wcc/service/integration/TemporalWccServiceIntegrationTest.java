package com.temporal.wcc.service.integration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.temporal.wcc.service.api.dto.EventDto;
import com.temporal.wcc.service.api.dto.EventIngestRequest;
import com.temporal.wcc.service.engine.ForestRebuildService;
import com.temporal.wcc.service.engine.ForestValidator;
import com.temporal.wcc.service.model.ComponentMetrics;
import com.temporal.wcc.service.model.EntityType;
import com.temporal.wcc.service.store.GraphStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * End-to-end flow against the in-memory store: ingest, automatic chain linking and
 * merging, metrics, feature extraction, validation and rebuild.
 *
 * Every test ingests its own events under a fresh prefix so tests can share the store.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class TemporalWccServiceIntegrationTest {

    private static final Instant T0 = Instant.parse("2024-03-01T12:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private GraphStore graphStore;

    @Autowired
    private ForestValidator validator;

    @Autowired
    private ForestRebuildService rebuildService;

    private String prefix;

    @BeforeEach
    void newPrefix() {
        prefix = "it-" + UUID.randomUUID().toString().substring(0, 8) + "-";
    }

    @Test
    @DisplayName("Ingested events are chained, merged and measured asynchronously")
    void ingestMergesAndMeasures() throws Exception {
        ingestBridgeScenario();

        mockMvc.perform(get("/forest/events/" + id("a1")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.processed").value(true))
                .andExpect(jsonPath("$.data.head").value(id("x")))
                .andExpect(jsonPath("$.data.absorbedBy").value(id("a2")));

        mockMvc.perform(get("/forest/events/" + id("x")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.absorbedHeads.length()").value(2))
                .andExpect(jsonPath("$.data.metrics.componentSize").value(8))
                .andExpect(jsonPath("$.data.metrics.componentDiameter").value(3));

        assertThat(graphStore.findMetrics(id("a4"))).contains(new ComponentMetrics(4, 2, 0.1));
    }

    @Test
    @DisplayName("Training features of the bridge event aggregate both absorbed components")
    void trainingFeatures() throws Exception {
        ingestBridgeScenario();

        mockMvc.perform(get("/features/training/" + id("x")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.eventId").value(id("x")))
                .andExpect(jsonPath("$.data.distinctComponentCount").value(2))
                .andExpect(jsonPath("$.data.maxComponentSize").value(4))
                .andExpect(jsonPath("$.data.maxComponentDiameter").value(2))
                .andExpect(jsonPath("$.data.maxComponentVelocity").value(0.1));

        mockMvc.perform(get("/features/training/" + id("x"))
                        .param("cutoff", T0.plusSeconds(39).toString()))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Real-time features of an unseen event read the forest without writing")
    void realtimeFeatures() throws Exception {
        ingestBridgeScenario();
        long eventsBefore = graphStore.stats().eventCount();

        var incoming = event("y", 50, EntityType.CREDIT_CARD, key("card"));
        mockMvc.perform(post("/features/realtime")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(incoming)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.eventId").value(id("y")))
                .andExpect(jsonPath("$.data.distinctComponentCount").value(1))
                .andExpect(jsonPath("$.data.maxComponentSize").value(8));

        assertThat(graphStore.findEvent(id("y"))).isEmpty();
        assertThat(graphStore.stats().eventCount()).isEqualTo(eventsBefore);
    }

    @Test
    @DisplayName("Real-time features of an isolated event are empty")
    void realtimeFeaturesIsolated() throws Exception {
        var incoming = event("lonely", 0, EntityType.PHONE, key("phone"));

        mockMvc.perform(post("/features/realtime")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(incoming)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.distinctComponentCount").value(0))
                .andExpect(jsonPath("$.data.maxComponentSize").doesNotExist());
    }

    @Test
    @DisplayName("The merged forest passes validation")
    void validatesForest() throws Exception {
        ingestBridgeScenario();

        mockMvc.perform(get("/forest/validate"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.violations").isEmpty());
        assertThat(validator.validate().isValid()).isTrue();
    }

    @Test
    @DisplayName("Reset clears derived state and rebuild restores it")
    void resetAndRebuild() throws Exception {
        ingestBridgeScenario();

        mockMvc.perform(delete("/forest"))
                .andExpect(status().isNoContent());

        assertThat(graphStore.isProcessed(id("x"))).isFalse();
        assertThat(graphStore.findMetrics(id("x"))).isEmpty();
        assertThat(graphStore.findEvent(id("x"))).isPresent();

        mockMvc.perform(post("/forest/rebuild"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.batch.failures").isEmpty());

        assertThat(graphStore.findMetrics(id("x")))
                .get()
                .extracting(ComponentMetrics::componentSize)
                .isEqualTo(8L);
        assertThat(validator.validate().isValid()).isTrue();
    }

    @Test
    @DisplayName("Retrying an already merged group merges nothing")
    void retryMergedGroup() throws Exception {
        ingestBridgeScenario();

        mockMvc.perform(post("/forest/merge/retry")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                Map.of("label", "manual", "eventIds", List.of(id("a1"), id("a2"))))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.groupsSucceeded").value(1))
                .andExpect(jsonPath("$.data.eventsMerged").value(0));
    }

    @Test
    @DisplayName("Manual merge and metrics calls wait for a running reset")
    void manualMaintenanceWaitsForReset() throws Exception {
        var pool = Executors.newFixedThreadPool(4);
        var holding = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        var reset = CompletableFuture.runAsync(() -> rebuildService.exclusively(() -> {
            holding.countDown();
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return null;
        }), pool);
        assertThat(holding.await(5, TimeUnit.SECONDS)).isTrue();

        var merge = CompletableFuture.supplyAsync(() -> perform("/forest/merge"), pool);
        var metrics = CompletableFuture.supplyAsync(() -> perform("/forest/metrics"), pool);
        var link = CompletableFuture.supplyAsync(() -> perform("/forest/link"), pool);

        await().during(300, TimeUnit.MILLISECONDS)
                .atMost(2, TimeUnit.SECONDS)
                .until(() -> !merge.isDone() && !metrics.isDone() && !link.isDone());

        release.countDown();
        reset.get(5, TimeUnit.SECONDS);

        assertThat(merge.get(5, TimeUnit.SECONDS)).isEqualTo(200);
        assertThat(metrics.get(5, TimeUnit.SECONDS)).isEqualTo(200);
        assertThat(link.get(5, TimeUnit.SECONDS)).isEqualTo(200);
        pool.shutdown();
    }

    // ==================== Helpers ====================

    private int perform(String path) {
        try {
            return mockMvc.perform(post(path)).andReturn().getResponse().getStatus();
        } catch (Exception e) {
            throw new IllegalStateException("Request to " + path + " failed", e);
        }
    }

    /**
     * a1..a4 chained by ip, email and device; b1..b3 by card; x bridges both at T0 + 40s.
     */
    private void ingestBridgeScenario() throws Exception {
        var ip = key("ip");
        var email = key("shared") + "@example.com";
        var device = key("dev");
        var card = key("card");
        var events = List.of(
                event("a1", 0, EntityType.IP_ADDRESS, ip),
                event("a2", 10, EntityType.IP_ADDRESS, ip, EntityType.EMAIL, email),
                event("a3", 20, EntityType.EMAIL, email, EntityType.DEVICE, device),
                event("a4", 30, EntityType.DEVICE, device),
                event("b1", 5, EntityType.CREDIT_CARD, card),
                event("b2", 15, EntityType.CREDIT_CARD, card),
                event("b3", 25, EntityType.CREDIT_CARD, card),
                event("x", 40, EntityType.DEVICE, device, EntityType.CREDIT_CARD, card)
        );
        var request = EventIngestRequest.builder()
                .batchId(prefix + "batch")
                .events(events)
                .build();

        mockMvc.perform(post("/ingest/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.data").value(prefix + "batch"));

        await().atMost(10, TimeUnit.SECONDS)
                .until(() -> events.stream().allMatch(e -> graphStore.findMetrics(e.getId()).isPresent()));
    }

    /**
     * Builds an event at {@code T0 + seconds}; the varargs alternate entity type and key.
     */
    private EventDto event(String name, long seconds, Object... typeAndKey) {
        var entities = new ArrayList<EventDto.EntityDto>();
        for (int i = 0; i < typeAndKey.length; i += 2) {
            entities.add(EventDto.EntityDto.builder()
                    .type((EntityType) typeAndKey[i])
                    .key((String) typeAndKey[i + 1])
                    .build());
        }
        return EventDto.builder()
                .id(id(name))
                .timestamp(T0.plusSeconds(seconds))
                .interactionType("CHECKOUT")
                .entities(entities)
                .build();
    }

    private String id(String name) {
        return prefix + name;
    }

    private String key(String name) {
        return prefix + name;
    }
}
