package com.trustledger.ledger.controller;

import com.trustledger.common.api.ApiResponse;
import com.trustledger.ledger.dto.CreateDocumentRequest;
import com.trustledger.ledger.dto.DocumentDetailsResponse;
import com.trustledger.ledger.dto.SignerStatusResponse;
import com.trustledger.ledger.service.AttestationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;
import java.util.List;

@RestController
@RequestMapping("/api/v1/ledger/documents")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Attestation", description = "Multi-party document attestation")
public class AttestationController {

    private final AttestationService attestationService;

    @PostMapping
    @Operation(summary = "Create a document; the attached value must cover the storage fee")
    public ResponseEntity<ApiResponse<DocumentDetailsResponse>> createDocument(
            @RequestHeader(value = LedgerHeaders.CALLER, required = false) String caller,
            @RequestHeader(value = LedgerHeaders.VALUE, required = false) BigInteger value,
            @Valid @RequestBody CreateDocumentRequest request) {
        log.info("Creating document for {} with value {}", caller, value);

        long id = attestationService.createDocument(caller, value, request.getDocumentHash(), request.getRequiredSigners());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(attestationService.getDocumentDetails(id)));
    }

    @PostMapping("/{documentId}/signatures")
    @Operation(summary = "Sign a document as one of its required signers")
    public ResponseEntity<ApiResponse<DocumentDetailsResponse>> signDocument(
            @RequestHeader(value = LedgerHeaders.CALLER, required = false) String caller,
            @PathVariable long documentId) {
        log.info("Signing document {} by {}", documentId, caller);

        attestationService.signDocument(caller, documentId);
        return ResponseEntity.ok(ApiResponse.success(attestationService.getDocumentDetails(documentId)));
    }

    @PostMapping("/{documentId}/revocation")
    @Operation(summary = "Revoke a document before completion (creator only)")
    public ResponseEntity<ApiResponse<DocumentDetailsResponse>> revokeDocument(
            @RequestHeader(value = LedgerHeaders.CALLER, required = false) String caller,
            @PathVariable long documentId) {
        log.info("Revoking document {} by {}", documentId, caller);

        attestationService.revokeDocument(caller, documentId);
        return ResponseEntity.ok(ApiResponse.success(attestationService.getDocumentDetails(documentId)));
    }

    @GetMapping("/{documentId}")
    @Operation(summary = "Get document details")
    public ResponseEntity<ApiResponse<DocumentDetailsResponse>> getDocumentDetails(@PathVariable long documentId) {
        return ResponseEntity.ok(ApiResponse.success(attestationService.getDocumentDetails(documentId)));
    }

    @GetMapping("/{documentId}/signers/{account}")
    @Operation(summary = "Whether an account is a required signer and has signed")
    public ResponseEntity<ApiResponse<SignerStatusResponse>> signerStatus(
            @PathVariable long documentId,
            @PathVariable String account) {
        return ResponseEntity.ok(ApiResponse.success(attestationService.signerStatus(documentId, account)));
    }

    @GetMapping("/creators/{account}")
    @Operation(summary = "List ids of documents an account created")
    public ResponseEntity<ApiResponse<List<Long>>> getUserDocuments(@PathVariable String account) {
        return ResponseEntity.ok(ApiResponse.success(attestationService.getUserDocuments(account)));
    }

    @GetMapping("/signers/{account}")
    @Operation(summary = "List ids of documents naming an account as required signer")
    public ResponseEntity<ApiResponse<List<Long>>> getSignerDocuments(@PathVariable String account) {
        return ResponseEntity.ok(ApiResponse.success(attestationService.getSignerDocuments(account)));
    }
}
