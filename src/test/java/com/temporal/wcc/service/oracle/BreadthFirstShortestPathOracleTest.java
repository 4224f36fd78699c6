package com.temporal.wcc.service.oracle;

import com.temporal.wcc.service.engine.MicroProjection;
import com.temporal.wcc.service.model.Entity;
import com.temporal.wcc.service.model.EntityType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BreadthFirstShortestPathOracleTest {

    private static final Entity IP = Entity.of(EntityType.IP_ADDRESS, "10.1.1.1");
    private static final Entity CARD = Entity.of(EntityType.CREDIT_CARD, "4000");
    private static final Entity PHONE = Entity.of(EntityType.PHONE, "+15550100");

    private final BreadthFirstShortestPathOracle oracle = new BreadthFirstShortestPathOracle();

    @Test
    @DisplayName("Distances alternate between event and entity hops")
    void bipartiteDistances() {
        var touches = Map.of(
                "e1", Set.of(IP),
                "e2", Set.of(IP, CARD),
                "e3", Set.of(CARD),
                "e4", Set.of(PHONE));
        var projection = MicroProjection.of(List.of("e1", "e2", "e3", "e4"), touches::get);

        var distances = oracle.shortestPathLengths(projection, MicroProjection.eventNode("e1"));

        assertThat(distances)
                .containsEntry(MicroProjection.eventNode("e1"), 0)
                .containsEntry(MicroProjection.entityNode(IP), 1)
                .containsEntry(MicroProjection.eventNode("e2"), 2)
                .containsEntry(MicroProjection.eventNode("e3"), 4)
                .doesNotContainKey(MicroProjection.eventNode("e4"));
    }

    @Test
    @DisplayName("A source outside the projection is rejected")
    void unknownSource() {
        var projection = MicroProjection.of(List.of("e1"), id -> Set.of(IP));

        assertThatThrownBy(() -> oracle.shortestPathLengths(projection, MicroProjection.eventNode("nope")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
