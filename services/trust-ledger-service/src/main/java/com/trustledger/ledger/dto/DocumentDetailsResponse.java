package com.trustledger.ledger.dto;

import com.trustledger.ledger.domain.AttestationDocument;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Attestation document state")
public class DocumentDetailsResponse {

    private long id;
    private String documentHash;
    private String creator;
    private Instant createdAt;
    private BigInteger feePaid;
    private List<String> requiredSigners;

    @Schema(description = "Signatures in the order they were recorded")
    private List<SignatureEntry> signatures;

    private int signatureCount;
    private boolean active;
    private boolean completed;
    private Instant completedAt;
    private Instant revokedAt;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SignatureEntry {
        private String signer;
        private Instant signedAt;
    }

    public static DocumentDetailsResponse from(AttestationDocument document) {
        return DocumentDetailsResponse.builder()
                .id(document.getId())
                .documentHash(document.getDocumentHash())
                .creator(document.getCreator())
                .createdAt(document.getCreatedAt())
                .feePaid(document.getFeePaid())
                .requiredSigners(List.copyOf(document.getRequiredSigners()))
                .signatures(document.getSignatures().stream()
                        .map(signature -> new SignatureEntry(signature.getSigner(), signature.getSignedAt()))
                        .toList())
                .signatureCount(document.getSignatureCount())
                .active(document.isActive())
                .completed(document.isCompleted())
                .completedAt(document.getCompletedAt())
                .revokedAt(document.getRevokedAt())
                .build();
    }
}
