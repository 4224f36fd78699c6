package com.temporal.wcc.service.oracle;

import com.temporal.wcc.service.oracle.ComponentLabelOracle.Link;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class BreadthFirstComponentLabelOracleTest {

    private final BreadthFirstComponentLabelOracle oracle = new BreadthFirstComponentLabelOracle();

    @Test
    @DisplayName("Links are treated as undirected")
    void labelsWeakComponents() {
        var labels = oracle.label(
                List.of("a", "b", "c", "d", "e"),
                List.of(new Link("b", "a"), new Link("c", "b"), new Link("e", "d")));

        assertThat(labels).containsEntry("a", "a")
                .containsEntry("b", "a")
                .containsEntry("c", "a")
                .containsEntry("d", "d")
                .containsEntry("e", "d");
    }

    @Test
    @DisplayName("Isolated nodes label themselves")
    void isolatedNodes() {
        var labels = oracle.label(List.of("x", "y"), List.of());

        assertThat(labels).containsExactlyInAnyOrderEntriesOf(Map.of("x", "x", "y", "y"));
    }

    @Test
    @DisplayName("Links to unknown nodes are ignored")
    void ignoresForeignEndpoints() {
        var labels = oracle.label(List.of("a", "b"), List.of(new Link("a", "zz"), new Link("zz", "b")));

        assertThat(labels).hasSize(2).containsEntry("a", "a").containsEntry("b", "b");
    }
}
