package com.flowledger.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowledger.config.FlowLedgerProperties;
import com.flowledger.model.WorkflowExecutionRun;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Publishes a notice for every dead-lettered run when
 * flowledger.dead-letter.publish-enabled is true (off by default).
 *
 * Message on flowledger.dead-letter, keyed by run id:
 *   {"run_id": "...", "tenant_id": "acme", "workflow_logical_name": "invoice_follow_up",
 *    "attempts": 3, "reason": "step 1 (create_runtime_record) failed: ...",
 *    "timestamp": "2026-01-01T00:00:00Z"}
 *
 * The run is already dead-lettered in the ledger when this is called, so a
 * publish failure is logged and otherwise ignored.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DeadLetterPublisher {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final FlowLedgerProperties properties;
    private final Clock clock;

    public void publish(WorkflowExecutionRun run) {
        if (!properties.getDeadLetter().isPublishEnabled()) {
            return;
        }
        String topic = properties.getTopics().getDeadLetter();
        try {
            ObjectNode notice = objectMapper.createObjectNode();
            notice.put("run_id", run.getId().toString());
            notice.put("tenant_id", run.getTenantId());
            notice.put("workflow_logical_name", run.getWorkflowLogicalName());
            notice.put("attempts", run.getAttempts());
            notice.put("reason", run.getDeadLetterReason());
            notice.put("timestamp", clock.instant().toString());

            kafkaTemplate.send(topic, run.getId().toString(), objectMapper.writeValueAsString(notice))
                    .whenComplete((result, error) -> {
                        if (error != null) {
                            log.error("CRITICAL: Failed to publish dead-letter notice: run={}, error={}",
                                    run.getId(), error.getMessage());
                        }
                    });
            log.info("Dead-letter notice sent to {}: run={}", topic, run.getId());
        } catch (Exception e) {
            log.error("CRITICAL: Failed to publish dead-letter notice: run={}, error={}",
                    run.getId(), e.getMessage(), e);
        }
    }
}
