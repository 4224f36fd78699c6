package com.temporal.wcc.service.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * An identifying entity keyed by its type and natural value.
 */
public record Entity(EntityType type, String key) {

    public static final Comparator<Entity> NATURAL_ORDER =
            Comparator.comparing(Entity::type).thenComparing(Entity::key);

    public Entity {
        Objects.requireNonNull(type, "type");
        key = type.normalize(key);
    }

    public static Entity of(EntityType type, String key) {
        return new Entity(type, key);
    }

    @Override
    public String toString() {
        return type + ":" + key;
    }
}
