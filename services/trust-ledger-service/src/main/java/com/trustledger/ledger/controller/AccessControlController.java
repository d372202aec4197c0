package com.trustledger.ledger.controller;

import com.trustledger.common.api.ApiResponse;
import com.trustledger.ledger.domain.LedgerRole;
import com.trustledger.ledger.dto.AccountRequest;
import com.trustledger.ledger.dto.OwnershipResponse;
import com.trustledger.ledger.dto.RoleStatusResponse;
import com.trustledger.ledger.service.AccessControlService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/ledger/access")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Access Control", description = "Role grants and ledger ownership")
public class AccessControlController {

    private final AccessControlService accessControlService;

    @PostMapping("/roles/{role}/grants")
    @Operation(summary = "Grant a role to an account (ADMIN only)")
    public ResponseEntity<ApiResponse<RoleStatusResponse>> grantRole(
            @RequestHeader(value = LedgerHeaders.CALLER, required = false) String caller,
            @PathVariable LedgerRole role,
            @Valid @RequestBody AccountRequest request) {
        log.info("Granting role {} to {}", role, request.getAccount());

        accessControlService.grantRole(caller, request.getAccount(), role);
        return ResponseEntity.ok(ApiResponse.success(new RoleStatusResponse(request.getAccount(), role, true)));
    }

    @DeleteMapping("/roles/{role}/grants/{account}")
    @Operation(summary = "Revoke a role from an account (ADMIN only)")
    public ResponseEntity<ApiResponse<RoleStatusResponse>> revokeRole(
            @RequestHeader(value = LedgerHeaders.CALLER, required = false) String caller,
            @PathVariable LedgerRole role,
            @PathVariable String account) {
        log.info("Revoking role {} from {}", role, account);

        accessControlService.revokeRole(caller, account, role);
        return ResponseEntity.ok(ApiResponse.success(new RoleStatusResponse(account, role, false)));
    }

    @GetMapping("/roles/{role}/grants/{account}")
    @Operation(summary = "Check whether an account holds a role")
    public ResponseEntity<ApiResponse<RoleStatusResponse>> hasRole(
            @PathVariable LedgerRole role,
            @PathVariable String account) {
        boolean granted = accessControlService.hasRole(account, role);
        return ResponseEntity.ok(ApiResponse.success(new RoleStatusResponse(account, role, granted)));
    }

    @GetMapping("/accounts/{account}/roles")
    @Operation(summary = "List the roles an account holds")
    public ResponseEntity<ApiResponse<List<LedgerRole>>> rolesOf(@PathVariable String account) {
        return ResponseEntity.ok(ApiResponse.success(accessControlService.rolesOf(account)));
    }

    @GetMapping("/owner")
    @Operation(summary = "Get the ledger owner")
    public ResponseEntity<ApiResponse<OwnershipResponse>> owner() {
        return ResponseEntity.ok(ApiResponse.success(new OwnershipResponse(accessControlService.owner())));
    }

    @PutMapping("/owner")
    @Operation(summary = "Transfer ownership (owner only)")
    public ResponseEntity<ApiResponse<OwnershipResponse>> transferOwnership(
            @RequestHeader(value = LedgerHeaders.CALLER, required = false) String caller,
            @Valid @RequestBody AccountRequest request) {
        log.info("Transferring ownership to {}", request.getAccount());

        accessControlService.transferOwnership(caller, request.getAccount());
        return ResponseEntity.ok(ApiResponse.success(new OwnershipResponse(request.getAccount())));
    }
}
