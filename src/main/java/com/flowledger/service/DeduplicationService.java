package com.flowledger.service;

import com.flowledger.config.FlowLedgerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Prevents a redelivered trigger event from starting the same workflow twice.
 *
 * HOW IT WORKS:
 *   1. Before creating a run, call firstDelivery(tenant, triggerType, eventId, workflow)
 *   2. This SETs "flowledger:dedup:{tenant}:{triggerType}:{eventId}:{workflow}" with NX
 *      (NX = only set if the key does NOT exist)
 *   3. SET succeeded → first delivery, create the run
 *   4. SET failed    → key exists, skip
 *
 * The key is per workflow, so one event that matches several workflows
 * starts each of them once. Keys expire after flowledger.dedup.ttl.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DeduplicationService {

    private static final String DEDUP_PREFIX = "flowledger:dedup:";

    private final StringRedisTemplate redisTemplate;
    private final FlowLedgerProperties properties;

    /**
     * Returns true if this (event, workflow) pair has not been seen before.
     * Events without an id cannot be deduplicated and always pass.
     */
    public boolean firstDelivery(String tenantId, String triggerType, String eventId, String workflowLogicalName) {
        if (eventId == null || eventId.isBlank()) {
            return true;
        }

        String key = key(tenantId, triggerType, eventId, workflowLogicalName);
        Boolean wasSet = redisTemplate.opsForValue()
                .setIfAbsent(key, "1", properties.getDedup().getTtl());

        if (Boolean.TRUE.equals(wasSet)) {
            return true;
        }
        log.warn("Duplicate trigger event skipped: tenant={}, type={}, eventId={}, workflow={}",
                tenantId, triggerType, eventId, workflowLogicalName);
        return false;
    }

    /**
     * Forgets a pair so the event can start the workflow again. Used when
     * run creation fails after the key was taken.
     */
    public void release(String tenantId, String triggerType, String eventId, String workflowLogicalName) {
        if (eventId == null || eventId.isBlank()) {
            return;
        }
        redisTemplate.delete(key(tenantId, triggerType, eventId, workflowLogicalName));
        log.info("Released dedup key: tenant={}, eventId={}, workflow={}", tenantId, eventId, workflowLogicalName);
    }

    static String key(String tenantId, String triggerType, String eventId, String workflowLogicalName) {
        return DEDUP_PREFIX + tenantId + ":" + triggerType + ":" + eventId + ":" + workflowLogicalName;
    }
}
