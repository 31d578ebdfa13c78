package com.flowledger.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowledger.exception.RecordCreationException;
import com.flowledger.exception.RecordCreationException.Kind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

/**
 * Tests for the record store HTTP client against a mocked server.
 */
class HttpRecordCreationClientTest {

    private static final String URL = "http://records.test/api/runtime/task/records";

    private final ObjectMapper mapper = new ObjectMapper();
    private MockRestServiceServer server;
    private HttpRecordCreationClient client;
    private JsonNode data;

    @BeforeEach
    void setUp() throws Exception {
        RestTemplate restTemplate = new RestTemplateBuilder().rootUri("http://records.test").build();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new HttpRecordCreationClient(restTemplate, mapper);
        data = mapper.readTree("{\"title\": \"Follow up\"}");
    }

    private Kind failureKind() {
        return assertThrows(RecordCreationException.class,
                () -> client.create("acme", "task", data, "run-1:0")).getKind();
    }

    @Nested
    @DisplayName("Successful creation")
    class SuccessTests {

        @Test
        @DisplayName("posts the data with tenant and idempotency headers and returns the record id")
        void createsRecord() {
            server.expect(requestTo(URL))
                    .andExpect(method(HttpMethod.POST))
                    .andExpect(header("X-Tenant-Id", "acme"))
                    .andExpect(header("Idempotency-Key", "run-1:0"))
                    .andExpect(content().json("{\"title\": \"Follow up\"}"))
                    .andRespond(withStatus(HttpStatus.CREATED)
                            .contentType(MediaType.APPLICATION_JSON)
                            .body("{\"record_id\": \"rec-77\"}"));

            assertEquals("rec-77", client.create("acme", "task", data, "run-1:0"));
            server.verify();
        }

        @Test
        @DisplayName("accepts an id field as the record id")
        void acceptsIdField() {
            server.expect(requestTo(URL))
                    .andRespond(withSuccess("{\"id\": 12}", MediaType.APPLICATION_JSON));

            assertEquals("12", client.create("acme", "task", data, "run-1:0"));
        }
    }

    @Nested
    @DisplayName("Failure mapping")
    class FailureTests {

        @Test
        @DisplayName("404 means the entity does not exist")
        void notFound() {
            server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.NOT_FOUND));

            RecordCreationException e = assertThrows(RecordCreationException.class,
                    () -> client.create("acme", "task", data, "run-1:0"));
            assertEquals(Kind.ENTITY_NOT_FOUND, e.getKind());
            assertEquals("entity 'task' not found", e.getMessage());
            assertEquals("task", e.getEntityLogicalName());
        }

        @Test
        @DisplayName("other 4xx responses are rejections and keep the response detail")
        void rejected() {
            server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.UNPROCESSABLE_ENTITY)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body("{\"error\": \"title too long\"}"));

            RecordCreationException e = assertThrows(RecordCreationException.class,
                    () -> client.create("acme", "task", data, "run-1:0"));
            assertEquals(Kind.VALIDATION_REJECTED, e.getKind());
            assertTrue(e.getMessage().contains("(422)"));
            assertTrue(e.getMessage().contains("title too long"));
        }

        @Test
        @DisplayName("5xx is transient")
        void serverError() {
            server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

            assertEquals(Kind.TRANSIENT, failureKind());
        }

        @Test
        @DisplayName("429 is transient")
        void tooManyRequests() {
            server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

            assertEquals(Kind.TRANSIENT, failureKind());
        }

        @Test
        @DisplayName("I/O errors are transient")
        void ioError() {
            server.expect(requestTo(URL)).andRespond(withException(new IOException("connection reset")));

            assertEquals(Kind.TRANSIENT, failureKind());
        }

        @Test
        @DisplayName("a response without a record id is transient")
        void missingId() {
            server.expect(requestTo(URL)).andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

            RecordCreationException e = assertThrows(RecordCreationException.class,
                    () -> client.create("acme", "task", data, "run-1:0"));
            assertEquals(Kind.TRANSIENT, e.getKind());
            assertEquals("record store returned no record id for entity 'task'", e.getMessage());
        }
    }
}
