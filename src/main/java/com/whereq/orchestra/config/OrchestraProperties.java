package com.whereq.orchestra.config;

import com.whereq.orchestra.model.JobType;
import com.whereq.orchestra.model.RetryPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Configuration properties for WhereQ Orchestra.
 *
 * @author WhereQ Inc.
 */
@Configuration
@ConfigurationProperties(prefix = "orchestra")
@Data
public class OrchestraProperties {

    /**
     * Where records and task queues live.
     * REDIS: shared Redis instance (default)
     * MEMORY: in-process maps, for local runs and tests
     */
    private Backend backend = Backend.REDIS;

    private AutomationServiceConfig automationService = new AutomationServiceConfig();

    private QueueConfig queue = new QueueConfig();

    private WorkerConfig workers = new WorkerConfig();

    private ShutdownConfig shutdown = new ShutdownConfig();

    private PlaybookConfig playbooks = new PlaybookConfig();

    @Data
    public static class AutomationServiceConfig {
        /**
         * Base URL of the generation / validation / execution service.
         */
        private String baseUrl = "http://ai-generator:8000";

        /**
         * Per-request timeout. Execution runs can be long.
         */
        private Duration timeout = Duration.ofMinutes(30);
    }

    @Data
    public static class QueueConfig {
        /**
         * Prefix for Redis keys holding queues and records.
         */
        private String keyPrefix = "orchestra";

        /**
         * How long an idle worker slot waits before polling again.
         */
        private Duration pollInterval = Duration.ofMillis(500);

        /**
         * Redelivery of nacked tasks.
         */
        private RetryPolicy retry = RetryPolicy.defaultPolicy();

        /**
         * How long a consumer's claim on its in-flight deliveries survives without a heartbeat.
         * Deliveries of a consumer whose lease ran out are recovered by the next instance to start.
         */
        private Duration leaseTtl = Duration.ofSeconds(30);

        /**
         * How often a running instance renews its lease. Must be well below the lease TTL.
         */
        private Duration heartbeatInterval = Duration.ofSeconds(10);
    }

    @Data
    public static class WorkerConfig {
        /**
         * Worker slots per job type. EXECUTE is kept lowest because each slot drives an external run.
         */
        private Map<JobType, Integer> concurrency = defaultConcurrency();

        public int concurrencyFor(JobType type) {
            Integer configured = concurrency.get(type);
            return configured != null && configured > 0 ? configured : 1;
        }

        private static Map<JobType, Integer> defaultConcurrency() {
            Map<JobType, Integer> defaults = new EnumMap<>(JobType.class);
            defaults.put(JobType.GENERATE, 2);
            defaults.put(JobType.VALIDATE, 5);
            defaults.put(JobType.LINT, 5);
            defaults.put(JobType.EXECUTE, 3);
            defaults.put(JobType.REFINE, 2);
            return defaults;
        }
    }

    @Data
    public static class ShutdownConfig {
        /**
         * Upper bound on waiting for in-flight tasks at shutdown.
         */
        private Duration drainTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class PlaybookConfig {
        /**
         * Directory generated playbooks are written to.
         */
        private String directory = "/tmp/orchestra/playbooks";
    }

    public enum Backend {
        REDIS,
        MEMORY
    }
}
