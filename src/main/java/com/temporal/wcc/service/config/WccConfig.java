package com.temporal.wcc.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Overall application configuration for the Temporal WCC Service.
 *
 * Contains feature toggles, store selection, and tuning for batch merges,
 * metrics computation and forest traversal.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "wcc")
public class WccConfig {

    /**
     * Feature flags for optional capabilities.
     */
    private Features features = new Features();

    /**
     * Backing store selection.
     */
    private StoreConfig store = new StoreConfig();

    /**
     * Neo4j connection settings, used when the store type is neo4j.
     */
    private Neo4jConfig neo4j = new Neo4jConfig();

    /**
     * Batch merge settings.
     */
    private BatchConfig batch = new BatchConfig();

    /**
     * Metrics engine settings.
     */
    private MetricsEngineConfig metrics = new MetricsEngineConfig();

    /**
     * Forest traversal settings.
     */
    private ForestConfig forest = new ForestConfig();

    @Getter
    @Setter
    public static class Features {

        /**
         * Trigger a batch merge after each ingested event batch.
         */
        private boolean autoMergeEnabled = true;

        /**
         * Compute missing component metrics right after an automatic merge.
         */
        private boolean metricsAfterMergeEnabled = true;

        /**
         * Interval of the background sweep that merges events left unprocessed, in milliseconds.
         */
        private long mergeSweepMs = 60000;
    }

    @Getter
    @Setter
    public static class StoreConfig {

        /**
         * Store implementation: memory or neo4j.
         */
        private String type = "memory";
    }

    @Getter
    @Setter
    public static class Neo4jConfig {

        private String uri = "bolt://localhost:7687";

        private String username = "neo4j";

        private String password = "password";

        /**
         * Target database; the server default when blank.
         */
        private String database;
    }

    @Getter
    @Setter
    public static class BatchConfig {

        /**
         * Number of component groups merged concurrently (0 = available processors).
         */
        private int parallelism = 0;

        /**
         * Attempts per group before it is reported as failed.
         */
        private int maxAttempts = 3;

        /**
         * Initial retry backoff in milliseconds, doubled on every retry.
         */
        private long backoffMs = 50;

        /**
         * Upper bound for the retry backoff in milliseconds.
         */
        private long maxBackoffMs = 2000;

        /**
         * Seed for the group shuffle; random when null.
         */
        private Long shuffleSeed;

        public int resolveParallelism() {
            return parallelism > 0 ? parallelism : Runtime.getRuntime().availableProcessors();
        }
    }

    @Getter
    @Setter
    public static class MetricsEngineConfig {

        /**
         * Number of forest nodes handed to one worker at a time.
         */
        private int batchSize = 256;

        /**
         * Number of metric batches computed concurrently (0 = available processors).
         */
        private int parallelism = 0;

        public int resolveParallelism() {
            return parallelism > 0 ? parallelism : Runtime.getRuntime().availableProcessors();
        }
    }

    @Getter
    @Setter
    public static class ForestConfig {

        /**
         * Longest forest walk accepted before the walk is treated as a cycle.
         */
        private int maxWalkLength = 1_000_000;
    }
}
