package com.trustledger.ledger.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.trustledger.common.exception.ErrorCode;
import com.trustledger.common.exception.ResourceNotFoundException;
import com.trustledger.common.exception.UnauthorizedException;
import com.trustledger.common.exception.ValidationException;
import com.trustledger.ledger.dto.ModerateItemRequest;
import com.trustledger.ledger.dto.RegisterItemRequest;
import com.trustledger.ledger.dto.RegistryItemResponse;
import com.trustledger.ledger.service.RegistryService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(RegistryController.class)
@DisplayName("RegistryController Tests")
class RegistryControllerTest {

    private static final String CALLER = "0x00000000000000000000000000000000000000c1";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private RegistryService registryService;

    private RegistryItemResponse item(boolean verified, boolean active) {
        return RegistryItemResponse.builder()
                .id(0L)
                .submitter(CALLER)
                .uri("ipfs://item")
                .category("dataset")
                .createdAt(Instant.parse("2024-05-01T10:00:00Z"))
                .verified(verified)
                .active(active)
                .build();
    }

    @Test
    @DisplayName("Should register an item for the caller header")
    void shouldRegisterItem() throws Exception {
        // Arrange
        when(registryService.registerItem(CALLER, "ipfs://item", "dataset")).thenReturn(0L);
        when(registryService.getItem(0L)).thenReturn(item(false, true));

        // Act & Assert
        mockMvc.perform(post("/api/v1/ledger/items")
                        .header(LedgerHeaders.CALLER, CALLER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new RegisterItemRequest("ipfs://item", "dataset"))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.id").value(0))
                .andExpect(jsonPath("$.data.submitter").value(CALLER))
                .andExpect(jsonPath("$.data.verified").value(false));
    }

    @Test
    @DisplayName("Should map an empty URI to 400 with its error code")
    void shouldMapValidationFailure() throws Exception {
        when(registryService.registerItem(eq(CALLER), eq(""), any()))
                .thenThrow(new ValidationException(ErrorCode.ITEM_EMPTY_URI));

        mockMvc.perform(post("/api/v1/ledger/items")
                        .header(LedgerHeaders.CALLER, CALLER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new RegisterItemRequest("", null))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("ITEM_002"))
                .andExpect(jsonPath("$.category").value("INVALID_INPUT"))
                .andExpect(jsonPath("$.correctable").value(true));
    }

    @Test
    @DisplayName("Should map a missing curator role to 403")
    void shouldMapUnauthorized() throws Exception {
        doThrow(new UnauthorizedException(ErrorCode.ACCESS_NOT_CURATOR))
                .when(registryService).moderateItem(CALLER, 0L, true, true);

        mockMvc.perform(put("/api/v1/ledger/items/0/moderation")
                        .header(LedgerHeaders.CALLER, CALLER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new ModerateItemRequest(true, true))))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.errorCode").value("ACCESS_003"));
    }

    @Test
    @DisplayName("Should reject moderation without both flags")
    void shouldRejectIncompleteModeration() throws Exception {
        mockMvc.perform(put("/api/v1/ledger/items/0/moderation")
                        .header(LedgerHeaders.CALLER, CALLER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"verified\":true}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.active").exists());

        verifyNoInteractions(registryService);
    }

    @Test
    @DisplayName("Should map an unknown item to 404")
    void shouldMapNotFound() throws Exception {
        when(registryService.getItem(9L))
                .thenThrow(new ResourceNotFoundException(ErrorCode.ITEM_NOT_FOUND, "RegistryItem", 9L));

        mockMvc.perform(get("/api/v1/ledger/items/9"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.category").value("NOT_FOUND"));
    }

    @Test
    @DisplayName("Should list the submitter's item ids")
    void shouldListItemsOf() throws Exception {
        when(registryService.getItemsOf(CALLER)).thenReturn(List.of(0L, 3L));

        mockMvc.perform(get("/api/v1/ledger/items/submitters/{account}", CALLER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0]").value(0))
                .andExpect(jsonPath("$.data[1]").value(3));
    }
}
