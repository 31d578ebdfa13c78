package com.flowledger.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.flowledger.exception.RecordCreationException;

/**
 * Downstream record store: create(tenant, entity, data) → record id.
 */
public interface RecordCreationClient {

    /**
     * @param idempotencyKey stable per run and step path, so a retried attempt
     *                       can be recognized downstream
     * @return id of the created record, never blank
     * @throws RecordCreationException on any rejection or I/O failure
     */
    String create(String tenantId, String entityLogicalName, JsonNode data, String idempotencyKey);
}
