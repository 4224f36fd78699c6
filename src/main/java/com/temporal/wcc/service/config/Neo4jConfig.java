package com.temporal.wcc.service.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Creates the Neo4j driver when the Neo4j store is selected.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "wcc.store", name = "type", havingValue = "neo4j")
@RequiredArgsConstructor
public class Neo4jConfig {

    private final WccConfig wccConfig;

    @Bean(destroyMethod = "close")
    public Driver neo4jDriver() {
        var neo4j = wccConfig.getNeo4j();
        log.info("Initializing Neo4j driver for {}", neo4j.getUri());
        return GraphDatabase.driver(neo4j.getUri(), AuthTokens.basic(neo4j.getUsername(), neo4j.getPassword()));
    }
}
