package com.flowledger.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowledger.exception.RecordCreationException;
import com.flowledger.exception.RecordCreationException.Kind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.List;

/**
 * Creates runtime records through the record store's HTTP API.
 *
 *   POST {record-api.base-url}/api/runtime/{entity}/records
 *   X-Tenant-Id:     acme
 *   Idempotency-Key: 5f0c...:0.then.1
 *   {"title": "x"}
 *
 *   → 201 {"record_id": "..."}   (an "id" field is accepted too)
 *
 * Failure mapping:
 *   404                      → ENTITY_NOT_FOUND
 *   408, 429, 5xx, I/O error → TRANSIENT
 *   any other 4xx            → VALIDATION_REJECTED
 *
 * Connect and read timeouts come from the injected RestTemplate, so a stuck
 * record store fails the step instead of holding the worker.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HttpRecordCreationClient implements RecordCreationClient {

    static final String RECORDS_PATH = "/api/runtime/{entity}/records";
    static final String TENANT_HEADER = "X-Tenant-Id";
    static final String IDEMPOTENCY_HEADER = "Idempotency-Key";

    private final RestTemplate recordApiRestTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public String create(String tenantId, String entityLogicalName, JsonNode data, String idempotencyKey) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.set(TENANT_HEADER, tenantId);
        if (idempotencyKey != null) {
            headers.set(IDEMPOTENCY_HEADER, idempotencyKey);
        }

        ResponseEntity<String> response;
        try {
            String body = objectMapper.writeValueAsString(data);
            response = recordApiRestTemplate.postForEntity(
                    RECORDS_PATH, new HttpEntity<>(body, headers), String.class, entityLogicalName);
        } catch (JsonProcessingException e) {
            throw new RecordCreationException(Kind.VALIDATION_REJECTED, entityLogicalName,
                    "record data is not serializable: " + e.getOriginalMessage(), e);
        } catch (HttpClientErrorException e) {
            throw mapClientError(entityLogicalName, e);
        } catch (HttpServerErrorException e) {
            throw new RecordCreationException(Kind.TRANSIENT, entityLogicalName,
                    "record store unavailable (" + e.getStatusCode().value() + ")", e);
        } catch (ResourceAccessException e) {
            throw new RecordCreationException(Kind.TRANSIENT, entityLogicalName,
                    "record store I/O failure: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new RecordCreationException(Kind.TRANSIENT, entityLogicalName,
                    "record store call failed: " + e.getMessage(), e);
        }

        String recordId = extractRecordId(response.getBody());
        if (recordId == null) {
            throw new RecordCreationException(Kind.TRANSIENT, entityLogicalName,
                    "record store returned no record id for entity '" + entityLogicalName + "'");
        }
        log.debug("Created runtime record: tenant={}, entity={}, recordId={}, key={}",
                tenantId, entityLogicalName, recordId, idempotencyKey);
        return recordId;
    }

    private RecordCreationException mapClientError(String entityLogicalName, HttpClientErrorException e) {
        HttpStatus status = HttpStatus.resolve(e.getStatusCode().value());
        if (status == HttpStatus.NOT_FOUND) {
            return new RecordCreationException(Kind.ENTITY_NOT_FOUND, entityLogicalName,
                    "entity '" + entityLogicalName + "' not found", e);
        }
        if (status == HttpStatus.REQUEST_TIMEOUT || status == HttpStatus.TOO_MANY_REQUESTS) {
            return new RecordCreationException(Kind.TRANSIENT, entityLogicalName,
                    "record store busy (" + e.getStatusCode().value() + ")", e);
        }
        String detail = e.getResponseBodyAsString();
        return new RecordCreationException(Kind.VALIDATION_REJECTED, entityLogicalName,
                "record rejected for entity '" + entityLogicalName + "' (" + e.getStatusCode().value() + ")"
                        + (detail.isBlank() ? "" : ": " + detail), e);
    }

    private String extractRecordId(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode json = objectMapper.readTree(body);
            JsonNode id = json.hasNonNull("record_id") ? json.get("record_id") : json.get("id");
            if (id == null || id.isNull() || !id.isValueNode() || id.asText().isBlank()) {
                return null;
            }
            return id.asText();
        } catch (JsonProcessingException e) {
            log.warn("Unparseable record store response: {}", e.getOriginalMessage());
            return null;
        }
    }
}
