package com.accesslist.api.rest;

import com.accesslist.core.model.ConflictRetryPolicy;
import com.accesslist.engine.coordinator.AccessListCoordinator;
import com.accesslist.engine.metrics.AccessListMetrics;
import com.accesslist.engine.persistence.InMemoryAccessListRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.util.UUID;

import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Drives the REST API over the real service and an in-memory repository.
 */
@DisplayName("Access list REST API")
class AccessListControllerTest {

    private static final String BANKS = "/api/v1/access-lists/skd/banks";

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        AccessListMetrics metrics = new AccessListMetrics();
        metrics.bindTo(new SimpleMeterRegistry());
        AccessListCoordinator service = new AccessListCoordinator(
            new InMemoryAccessListRepository(Clock.systemUTC()),
            TransactionOperations.withoutTransaction(),
            ConflictRetryPolicy.defaultPolicy(),
            metrics,
            20);

        mockMvc = MockMvcBuilders.standaloneSetup(new AccessListController(service))
            .setControllerAdvice(new ApiExceptionHandler())
            .build();
    }

    private void createBanks() throws Exception {
        mockMvc.perform(put(BANKS)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"Approved banks\",\"description\":\"desc\"}"))
            .andExpect(status().isOk());
    }

    @Test
    @DisplayName("PUT creates the list and answers with its version as ETag")
    void create() throws Exception {
        mockMvc.perform(put(BANKS)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"Approved banks\",\"description\":\"desc\"}"))
            .andExpect(status().isOk())
            .andExpect(header().string(HttpHeaders.ETAG, "\"1\""))
            .andExpect(header().exists(HttpHeaders.LAST_MODIFIED))
            .andExpect(jsonPath("$.identifier").value("banks"))
            .andExpect(jsonPath("$.name").value("Approved banks"))
            .andExpect(jsonPath("$.version").value(1));
    }

    @Test
    @DisplayName("GET with the current ETag is 304")
    void notModified() throws Exception {
        createBanks();

        mockMvc.perform(get(BANKS).header(HttpHeaders.IF_NONE_MATCH, "\"1\""))
            .andExpect(status().isNotModified())
            .andExpect(header().string(HttpHeaders.ETAG, "\"1\""));

        mockMvc.perform(get(BANKS).header(HttpHeaders.IF_NONE_MATCH, "\"0\""))
            .andExpect(status().isOk());
    }

    @Test
    @DisplayName("Create-only PUT on an existing list is 412")
    void createOnlyConflict() throws Exception {
        createBanks();

        mockMvc.perform(put(BANKS)
                .header(HttpHeaders.IF_NONE_MATCH, "*")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"Other\"}"))
            .andExpect(status().isPreconditionFailed());
    }

    @Test
    @DisplayName("Missing lists are 404")
    void notFound() throws Exception {
        mockMvc.perform(get("/api/v1/access-lists/skd/missing"))
            .andExpect(status().isNotFound());
        mockMvc.perform(delete("/api/v1/access-lists/skd/missing"))
            .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("DELETE with a stale If-Match is 412")
    void staleDelete() throws Exception {
        createBanks();

        mockMvc.perform(delete(BANKS).header(HttpHeaders.IF_MATCH, "\"7\""))
            .andExpect(status().isPreconditionFailed());
        mockMvc.perform(delete(BANKS).header(HttpHeaders.IF_MATCH, "\"1\""))
            .andExpect(status().isOk());
    }

    @Test
    @DisplayName("Resource connections are upserted and included on request")
    void resourceConnections() throws Exception {
        createBanks();

        mockMvc.perform(put(BANKS + "/resource-connections/tax-api")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"actions\":[\"read\"]}"))
            .andExpect(status().isOk())
            .andExpect(header().string(HttpHeaders.ETAG, "\"2\""))
            .andExpect(jsonPath("$.actions", contains("read")));

        mockMvc.perform(get(BANKS).param("include", "RESOURCE_CONNECTIONS_ACTIONS"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.resourceConnections[0].resourceIdentifier").value("tax-api"))
            .andExpect(jsonPath("$.resourceConnections[0].actions", contains("read")));

        mockMvc.perform(get(BANKS + "/resource-connections"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.items", hasSize(1)))
            .andExpect(jsonPath("$.continuationToken").doesNotExist());
    }

    @Test
    @DisplayName("Members are added, listed and replaced")
    void members() throws Exception {
        createBanks();
        UUID p1 = UUID.randomUUID();
        UUID p2 = UUID.randomUUID();

        mockMvc.perform(post(BANKS + "/members")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"partyIds\":[\"" + p1 + "\",\"" + p2 + "\"]}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(2)));

        mockMvc.perform(put(BANKS + "/members")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"partyIds\":[\"" + p2 + "\"]}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[*].partyId", contains(p2.toString())));

        mockMvc.perform(get("/api/v1/memberships/" + p2 + "/access-lists"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].identifier").value("banks"));
    }

    @Test
    @DisplayName("Invalid member page token is a 400 naming the parameter")
    void invalidToken() throws Exception {
        createBanks();

        mockMvc.perform(get(BANKS + "/members").param("token", "nope"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.parameter").value("continuationToken"));
    }

    @Test
    @DisplayName("Unreadable body is a 400")
    void unreadableBody() throws Exception {
        mockMvc.perform(put(BANKS)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{not json"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value(ApiExceptionHandler.BAD_REQUEST_CODE));
    }
}
