package com.trustledger.ledger.controller;

import com.trustledger.common.api.ApiResponse;
import com.trustledger.ledger.dto.StorageFeeRequest;
import com.trustledger.ledger.dto.TreasuryResponse;
import com.trustledger.ledger.dto.WithdrawalResponse;
import com.trustledger.ledger.service.FeeTreasuryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/ledger/treasury")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Fee Treasury", description = "Storage fee and collected fees")
public class TreasuryController {

    private final FeeTreasuryService feeTreasuryService;

    @GetMapping
    @Operation(summary = "Get the storage fee and treasury balance")
    public ResponseEntity<ApiResponse<TreasuryResponse>> treasury() {
        return ResponseEntity.ok(ApiResponse.success(feeTreasuryService.treasury()));
    }

    @PutMapping("/storage-fee")
    @Operation(summary = "Set the storage fee (owner only)")
    public ResponseEntity<ApiResponse<TreasuryResponse>> setStorageFee(
            @RequestHeader(value = LedgerHeaders.CALLER, required = false) String caller,
            @Valid @RequestBody StorageFeeRequest request) {
        log.info("Setting storage fee to {}", request.getStorageFee());

        feeTreasuryService.setStorageFee(caller, request.getStorageFee());
        return ResponseEntity.ok(ApiResponse.success(feeTreasuryService.treasury()));
    }

    @PostMapping("/withdrawals")
    @Operation(summary = "Withdraw the whole treasury balance to the owner (owner only)")
    public ResponseEntity<ApiResponse<WithdrawalResponse>> withdrawFees(
            @RequestHeader(value = LedgerHeaders.CALLER, required = false) String caller) {
        log.info("Withdrawing fees for {}", caller);

        return ResponseEntity.ok(ApiResponse.success(feeTreasuryService.withdrawFees(caller)));
    }
}
