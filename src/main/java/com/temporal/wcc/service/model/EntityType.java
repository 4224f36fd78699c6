package com.temporal.wcc.service.model;

/**
 * Kinds of identifying entities an event can touch.
 */
public enum EntityType {
    CREDIT_CARD,
    IP_ADDRESS,
    EMAIL,
    PHONE,
    DEVICE,
    SESSION,
    BANK_ACCOUNT,
    USER_AGENT,
    SHIPPING_ADDRESS;

    /**
     * Normalizes a raw natural key for this type.
     */
    public String normalize(String rawKey) {
        if (rawKey == null) {
            throw new IllegalArgumentException("Entity key must not be null for type " + name());
        }
        String trimmed = rawKey.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Entity key must not be blank for type " + name());
        }
        return this == EMAIL ? trimmed.toLowerCase() : trimmed;
    }

    public static EntityType parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Entity type must not be null");
        }
        try {
            return EntityType.valueOf(value.trim().toUpperCase().replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown entity type: " + value, e);
        }
    }
}
