package com.flowledger.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Infrastructure beans the engine takes by injection instead of reading
 * global state: the clock, the run worker pool, and the record API client.
 */
@Configuration
@Slf4j
public class EngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * One task per run. Within a run steps are strictly sequential, so the
     * pool size bounds how many runs execute at the same time.
     * When the queue is full the submitting thread executes the run itself.
     */
    @Bean(name = "workflowRunExecutor")
    public ThreadPoolTaskExecutor workflowRunExecutor(FlowLedgerProperties properties) {
        FlowLedgerProperties.Execution execution = properties.getExecution();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(execution.getWorkerThreads());
        executor.setMaxPoolSize(execution.getWorkerThreads());
        executor.setQueueCapacity(execution.getQueueCapacity());
        executor.setThreadNamePrefix("workflow-run-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        log.info("Workflow run executor started: threads={}, queueCapacity={}, mode={}",
                execution.getWorkerThreads(), execution.getQueueCapacity(), execution.getMode());
        return executor;
    }

    @Bean
    public RestTemplate recordApiRestTemplate(RestTemplateBuilder builder, FlowLedgerProperties properties) {
        FlowLedgerProperties.RecordApi recordApi = properties.getRecordApi();
        return builder
                .rootUri(recordApi.getBaseUrl())
                .setConnectTimeout(Duration.ofMillis(recordApi.getConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(recordApi.getReadTimeoutMs()))
                .build();
    }
}
