package com.temporal.wcc.service.api.dto;

import com.temporal.wcc.service.ingest.IncomingEvent;
import com.temporal.wcc.service.model.Entity;
import com.temporal.wcc.service.model.EntityType;
import com.temporal.wcc.service.model.Event;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * An event and the entities it touches, as sent by producers.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventDto {

    @NotBlank(message = "event id is required")
    private String id;

    @NotNull(message = "timestamp is required")
    private Instant timestamp;

    /**
     * Kind of interaction, e.g. CHECKOUT or LOGIN.
     */
    private String interactionType;

    /**
     * Optional monetary amount.
     */
    private BigDecimal amount;

    /**
     * Identifying entities; an event without any starts its own component.
     */
    @Valid
    @Builder.Default
    private List<EntityDto> entities = new ArrayList<>();

    public IncomingEvent toIncomingEvent() {
        var touched = new LinkedHashSet<Entity>();
        if (entities != null) {
            entities.forEach(entity -> touched.add(Entity.of(entity.getType(), entity.getKey())));
        }
        return new IncomingEvent(new Event(id, timestamp, interactionType, amount), touched);
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class EntityDto {

        @NotNull(message = "entity type is required")
        private EntityType type;

        @NotBlank(message = "entity key is required")
        private String key;
    }
}
