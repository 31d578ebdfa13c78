package com.flowledger.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.flowledger.model.TriggerType;
import lombok.*;

/**
 * A trigger as seen by the matcher, whatever its source
 * (execute endpoint, schedule ticker, record-created topic).
 *
 * - triggerType:       selects candidate definitions
 * - entityLogicalName: only for runtime_record_created
 * - eventId:           dedup id of the originating event; null = no dedup
 * - payload:           becomes the run's trigger payload
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class TriggerEvent {

    private String tenantId;
    private TriggerType triggerType;
    private String entityLogicalName;
    private String eventId;
    private JsonNode payload;
}
