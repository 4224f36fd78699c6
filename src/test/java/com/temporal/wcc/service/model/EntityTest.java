package com.temporal.wcc.service.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EntityTest {

    @Test
    @DisplayName("Email keys are trimmed and lower-cased, other keys only trimmed")
    void normalizesKeys() {
        assertThat(Entity.of(EntityType.EMAIL, "  Alice@Example.COM "))
                .isEqualTo(Entity.of(EntityType.EMAIL, "alice@example.com"));
        assertThat(Entity.of(EntityType.DEVICE, " Dev-A ").key()).isEqualTo("Dev-A");
    }

    @Test
    @DisplayName("Blank keys are rejected")
    void rejectsBlankKey() {
        assertThatThrownBy(() -> Entity.of(EntityType.PHONE, "   "))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("PHONE");
    }

    @Test
    @DisplayName("Entity types parse case-insensitively with dashes")
    void parsesType() {
        assertThat(EntityType.parse("credit-card")).isEqualTo(EntityType.CREDIT_CARD);
        assertThat(EntityType.parse(" ip_address ")).isEqualTo(EntityType.IP_ADDRESS);
        assertThatThrownBy(() -> EntityType.parse("fax"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown entity type");
    }
}
