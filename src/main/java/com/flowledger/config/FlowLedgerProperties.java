package com.flowledger.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralizes topic, execution, retry, ledger and downstream configuration.
 *
 * Bound from application.yml under "flowledger" prefix:
 *   flowledger:
 *     topics:
 *       record-created: flowledger.record-created
 *       dead-letter: flowledger.dead-letter
 *     execution:
 *       mode: async
 *       worker-threads: 8
 *     retry:
 *       base-delay-ms: 0
 *     record-api:
 *       base-url: http://localhost:8081
 *     ledger:
 *       stale-threshold: PT15M
 *     queue:
 *       lease: PT5M
 */
@Component
@ConfigurationProperties(prefix = "flowledger")
@Getter
@Setter
public class FlowLedgerProperties {

    private Topics topics = new Topics();
    private Execution execution = new Execution();
    private Retry retry = new Retry();
    private RecordApi recordApi = new RecordApi();
    private Ledger ledger = new Ledger();
    private Schedule schedule = new Schedule();
    private Dedup dedup = new Dedup();
    private DeadLetter deadLetter = new DeadLetter();
    private Queue queue = new Queue();

    public enum ExecutionMode {
        /** Runs are handed to the worker pool; the caller only sees "accepted". */
        ASYNC,
        /** Runs execute on the caller's thread. Used by tests and single-node tools. */
        INLINE,
        /** Runs become persisted jobs that workers claim under a lease; survives restarts. */
        QUEUED
    }

    @Getter
    @Setter
    public static class Topics {
        private String recordCreated = "flowledger.record-created";
        private String deadLetter = "flowledger.dead-letter";
    }

    @Getter
    @Setter
    public static class Execution {
        private ExecutionMode mode = ExecutionMode.ASYNC;
        private int workerThreads = 8;
        private int queueCapacity = 500;
    }

    @Getter
    @Setter
    public static class Retry {
        /** 0 keeps retries immediate. */
        private long baseDelayMs = 0;
        private double multiplier = 2.0;
        private long maxDelayMs = 30_000;
    }

    @Getter
    @Setter
    public static class RecordApi {
        private String baseUrl = "http://localhost:8081";
        private long connectTimeoutMs = 2_000;
        private long readTimeoutMs = 10_000;
    }

    @Getter
    @Setter
    public static class Ledger {
        private int transactionTimeoutSeconds = 10;
        private Duration staleThreshold = Duration.ofMinutes(15);
    }

    @Getter
    @Setter
    public static class Schedule {
        private boolean enabled = false;
        private long tickIntervalMs = 60_000;
    }

    @Getter
    @Setter
    public static class Dedup {
        private Duration ttl = Duration.ofHours(24);
    }

    @Getter
    @Setter
    public static class DeadLetter {
        private boolean publishEnabled = false;
    }

    @Getter
    @Setter
    public static class Queue {
        private long pollIntervalMs = 1_000;
        private int batchSize = 10;
        /** Should outlast a full drive of a run, retries and backoff included. */
        private Duration lease = Duration.ofMinutes(5);
        /** Blank means a random id per process. */
        private String workerId = "";
    }
}
