package com.temporal.wcc.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the ingestion pipeline.
 *
 * Controls queue sizes, worker pools, backpressure thresholds, and timeouts.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "wcc.ingest")
public class IngestionConfig {

    private QueueConfig queue = new QueueConfig();

    private WorkerConfig worker = new WorkerConfig();

    private TimeoutConfig timeout = new TimeoutConfig();

    @Getter
    @Setter
    public static class QueueConfig {

        /**
         * Maximum queue capacity.
         */
        private int capacity = 10000;

        /**
         * Queue utilization threshold for backpressure alerts (percentage).
         */
        private int backpressureThreshold = 80;
    }

    @Getter
    @Setter
    public static class WorkerConfig {

        /**
         * Number of worker threads.
         */
        private int threadCount = 2;
    }

    @Getter
    @Setter
    public static class TimeoutConfig {

        /**
         * Enqueue timeout in milliseconds.
         */
        private long enqueueMs = 5000;

        /**
         * Poll timeout in milliseconds.
         */
        private long pollMs = 100;
    }
}
