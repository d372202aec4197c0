package com.trustledger.ledger.controller;

import com.trustledger.common.api.ApiResponse;
import com.trustledger.ledger.dto.ModerateItemRequest;
import com.trustledger.ledger.dto.RegisterItemRequest;
import com.trustledger.ledger.dto.RegistryItemResponse;
import com.trustledger.ledger.service.RegistryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/ledger/items")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Registry", description = "Item submission and curation")
public class RegistryController {

    private final RegistryService registryService;

    @PostMapping
    @Operation(summary = "Register an item")
    public ResponseEntity<ApiResponse<RegistryItemResponse>> registerItem(
            @RequestHeader(value = LedgerHeaders.CALLER, required = false) String caller,
            @Valid @RequestBody RegisterItemRequest request) {
        log.info("Registering item for {}", caller);

        long id = registryService.registerItem(caller, request.getUri(), request.getCategory());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(registryService.getItem(id)));
    }

    @PutMapping("/{itemId}/moderation")
    @Operation(summary = "Set the verified and active flags of an item (CURATOR only)")
    public ResponseEntity<ApiResponse<RegistryItemResponse>> moderateItem(
            @RequestHeader(value = LedgerHeaders.CALLER, required = false) String caller,
            @PathVariable long itemId,
            @Valid @RequestBody ModerateItemRequest request) {
        log.info("Moderating item {}: verified={} active={}", itemId, request.getVerified(), request.getActive());

        registryService.moderateItem(caller, itemId, request.getVerified(), request.getActive());
        return ResponseEntity.ok(ApiResponse.success(registryService.getItem(itemId)));
    }

    @PostMapping("/{itemId}/deactivation")
    @Operation(summary = "Deactivate an item the caller submitted")
    public ResponseEntity<ApiResponse<RegistryItemResponse>> deactivateOwnItem(
            @RequestHeader(value = LedgerHeaders.CALLER, required = false) String caller,
            @PathVariable long itemId) {
        log.info("Deactivating item {} for {}", itemId, caller);

        registryService.deactivateOwnItem(caller, itemId);
        return ResponseEntity.ok(ApiResponse.success(registryService.getItem(itemId)));
    }

    @GetMapping("/{itemId}")
    @Operation(summary = "Get an item")
    public ResponseEntity<ApiResponse<RegistryItemResponse>> getItem(@PathVariable long itemId) {
        return ResponseEntity.ok(ApiResponse.success(registryService.getItem(itemId)));
    }

    @GetMapping("/submitters/{account}")
    @Operation(summary = "List ids of items an account submitted")
    public ResponseEntity<ApiResponse<List<Long>>> getItemsOf(@PathVariable String account) {
        return ResponseEntity.ok(ApiResponse.success(registryService.getItemsOf(account)));
    }
}
