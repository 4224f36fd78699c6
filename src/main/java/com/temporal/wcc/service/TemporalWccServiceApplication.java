package com.temporal.wcc.service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.neo4j.Neo4jAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Temporal WCC Service - Entry point for the Spring Boot application.
 *
 * Maintains a time-ordered connected-component forest over events and the entities
 * they touch, and serves component features for training and real-time scoring:
 * - Ingests events with their entities and links per-entity chains
 * - Merges new events into the forest in component-partitioned batches
 * - Computes as-of-time component metrics per forest node
 * - Extracts identical features for merged and not-yet-merged events
 */
@SpringBootApplication(exclude = Neo4jAutoConfiguration.class)
@EnableScheduling
@EnableAsync
@ConfigurationPropertiesScan("com.temporal.wcc.service.config")
public class TemporalWccServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(TemporalWccServiceApplication.class, args);
    }
}
