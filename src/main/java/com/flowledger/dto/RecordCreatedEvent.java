package com.flowledger.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;
import lombok.*;

/**
 * Notification from the record store after a record commit.
 * Delivered at least once, so record_id doubles as the dedup id.
 *
 * Example JSON:
 * {
 *   "tenant_id": "acme",
 *   "entity_logical_name": "invoice",
 *   "record_id": "c0a8-...",
 *   "data": {"status": "open", "total": 1200}
 * }
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class RecordCreatedEvent {

    @NotBlank(message = "tenant_id is required")
    @JsonProperty("tenant_id")
    private String tenantId;

    @NotBlank(message = "entity_logical_name is required")
    @JsonProperty("entity_logical_name")
    private String entityLogicalName;

    @NotBlank(message = "record_id is required")
    @JsonProperty("record_id")
    private String recordId;

    @JsonProperty("data")
    private JsonNode data;
}
