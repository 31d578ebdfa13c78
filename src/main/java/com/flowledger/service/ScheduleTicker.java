package com.flowledger.service;

import com.flowledger.config.FlowLedgerProperties;
import com.flowledger.model.TriggerType;
import com.flowledger.repository.WorkflowDefinitionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Emits schedule_tick triggers every flowledger.schedule.tick-interval-ms,
 * for each tenant that has an enabled schedule_tick workflow.
 * Off unless flowledger.schedule.enabled is true.
 *
 * The tick id is the tick's slot number (epoch millis / interval), so
 * several instances ticking the same slot start each workflow once.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ScheduleTicker {

    private final WorkflowDefinitionRepository definitionRepository;
    private final WorkflowDispatcher dispatcher;
    private final FlowLedgerProperties properties;
    private final Clock clock;

    @Scheduled(fixedRateString = "${flowledger.schedule.tick-interval-ms:60000}")
    public void tick() {
        if (!properties.getSchedule().isEnabled()) {
            return;
        }
        Instant now = clock.instant();
        String tickId = tickId(now);
        List<String> tenants = definitionRepository.findTenantsWithEnabledTrigger(TriggerType.SCHEDULE_TICK);
        for (String tenantId : tenants) {
            try {
                dispatcher.dispatchScheduleTick(tenantId, now, tickId);
            } catch (RuntimeException e) {
                // One tenant's failure must not starve the others of this tick
                log.error("Schedule tick failed: tenant={}, tick={}, error={}", tenantId, tickId, e.getMessage(), e);
            }
        }
        log.debug("Schedule tick {} sent to {} tenant(s)", tickId, tenants.size());
    }

    String tickId(Instant now) {
        long interval = Math.max(1, properties.getSchedule().getTickIntervalMs());
        return "tick-" + (now.toEpochMilli() / interval);
    }
}
