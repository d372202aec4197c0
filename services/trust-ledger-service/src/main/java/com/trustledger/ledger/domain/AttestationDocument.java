package com.trustledger.ledger.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A document awaiting attestation by a fixed set of required signers.
 *
 * <p>Lifecycle: created active; each required signer may sign once; the signature that brings
 * {@link #signatureCount} up to the number of required signers marks the document completed.
 * The creator may revoke it while it is not completed. Completion and revocation are both
 * one-way, and a completed document stays active.
 */
@Entity
@Table(name = "attestation_documents", indexes = {
        @Index(name = "idx_attestation_documents_creator", columnList = "creator")
})
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AttestationDocument {

    public static final int MAX_HASH_LENGTH = 512;

    @Id
    private Long id;

    @Column(name = "document_hash", nullable = false, updatable = false, length = MAX_HASH_LENGTH)
    private String documentHash;

    @Column(name = "creator", nullable = false, updatable = false, length = 128)
    private String creator;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "fee_paid", nullable = false, updatable = false, precision = 38, scale = 0)
    private BigInteger feePaid;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "document_required_signers", joinColumns = @JoinColumn(name = "document_id"))
    @OrderColumn(name = "signer_position")
    @Column(name = "signer", nullable = false, length = 128)
    @Builder.Default
    private List<String> requiredSigners = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "document_signatures",
            joinColumns = @JoinColumn(name = "document_id"),
            uniqueConstraints = @UniqueConstraint(name = "uk_document_signatures_signer",
                    columnNames = {"document_id", "signer"}))
    @OrderColumn(name = "signature_position")
    @Builder.Default
    private List<DocumentSignature> signatures = new ArrayList<>();

    @Column(name = "signature_count", nullable = false)
    @Builder.Default
    private int signatureCount = 0;

    @Column(name = "active", nullable = false)
    @Builder.Default
    private boolean active = true;

    @Column(name = "completed", nullable = false)
    @Builder.Default
    private boolean completed = false;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "revoked_at")
    private Instant revokedAt;

    @Version
    private Long version;

    public List<String> getRequiredSigners() {
        return Collections.unmodifiableList(requiredSigners);
    }

    public List<DocumentSignature> getSignatures() {
        return Collections.unmodifiableList(signatures);
    }

    public boolean isRequiredSigner(String account) {
        return requiredSigners.contains(account);
    }

    public boolean hasSigned(String account) {
        return signatures.stream().anyMatch(signature -> signature.getSigner().equals(account));
    }

    public boolean isCreatedBy(String account) {
        return creator.equals(account);
    }

    /**
     * Records an attestation. Callers check eligibility first.
     *
     * @return true if this signature completed the document
     */
    public boolean recordSignature(String signer, Instant at) {
        signatures.add(new DocumentSignature(signer, at));
        signatureCount++;
        if (signatureCount == requiredSigners.size()) {
            completed = true;
            completedAt = at;
            return true;
        }
        return false;
    }

    public void revoke(Instant at) {
        active = false;
        revokedAt = at;
    }
}
