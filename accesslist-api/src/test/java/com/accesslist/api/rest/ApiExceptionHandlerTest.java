package com.accesslist.api.rest;

import com.accesslist.core.exception.AccessListValidationException;
import com.accesslist.core.exception.AggregateStateException;
import com.accesslist.core.exception.DuplicateAccessListException;
import com.accesslist.core.exception.OptimisticConcurrencyException;
import com.accesslist.core.exception.RetriesExhaustedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class ApiExceptionHandlerTest {

    private MockMvc mockMvc;

    @BeforeEach
    public void setUp() {
        this.mockMvc = MockMvcBuilders.standaloneSetup(new ErrorController())
            .setControllerAdvice(new ApiExceptionHandler())
            .build();
    }

    @Test
    public void shouldMapValidationToBadRequest() throws Exception {
        mockMvc.perform(get("/test/validation"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value(AccessListValidationException.ERROR_CODE))
            .andExpect(jsonPath("$.parameter").value("partyIds"))
            .andExpect(jsonPath("$.message").value("Party IDs must be specified"));
    }

    @Test
    public void shouldMapDeletedAggregateToConflict() throws Exception {
        mockMvc.perform(get("/test/deleted"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.code").value(AggregateStateException.ERROR_CODE));
    }

    @Test
    public void shouldMapDuplicateToConflict() throws Exception {
        mockMvc.perform(get("/test/duplicate"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.code").value(DuplicateAccessListException.ERROR_CODE));
    }

    @Test
    public void shouldMapExhaustedRetriesToServiceUnavailable() throws Exception {
        mockMvc.perform(get("/test/exhausted"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.code").value(RetriesExhaustedException.ERROR_CODE));
    }

    @Test
    public void shouldMapTypeMismatchToBadRequest() throws Exception {
        mockMvc.perform(get("/test/party/not-a-uuid"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value(ApiExceptionHandler.BAD_REQUEST_CODE));
    }

    @Test
    public void shouldHideUnknownErrors() throws Exception {
        mockMvc.perform(get("/test/boom"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.code").value(ApiExceptionHandler.INTERNAL_ERROR_CODE))
            .andExpect(jsonPath("$.message").value("Internal server error"));
    }

    @RestController
    static class ErrorController {

        @GetMapping("/test/validation")
        public String validation() {
            throw new AccessListValidationException("partyIds", "Party IDs must be specified");
        }

        @GetMapping("/test/deleted")
        public String deleted() {
            throw AggregateStateException.deleted(UUID.randomUUID());
        }

        @GetMapping("/test/duplicate")
        public String duplicate() {
            throw new DuplicateAccessListException("skd", "banks");
        }

        @GetMapping("/test/exhausted")
        public String exhausted() {
            throw new RetriesExhaustedException("addMembers", 3, new OptimisticConcurrencyException(UUID.randomUUID(), 4));
        }

        @GetMapping("/test/party/{partyId}")
        public String party(@PathVariable UUID partyId) {
            return partyId.toString();
        }

        @GetMapping("/test/boom")
        public String boom() {
            throw new IllegalStateException("boom");
        }
    }
}
